package lineage.tree;

import gnu.trove.map.hash.TObjectDoubleHashMap;

import java.util.HashMap;
import java.util.List;

import org.apache.log4j.Logger;

/**
 * Memoized structural facts of a LineageTree. Each field is null (or empty) until the first
 * query that needs it. Fields hold the tree's own lists: LineageTree copies them before
 * handing them to callers.
 *
 * Topology changes and relabeling must call clear(). Changes of time or branch length only
 * change distances and must call clearDistances().
 */
class TreeCache {

	static Logger _LOG = Logger.getLogger(TreeCache.class);

	String root;
	List<String> leaves;
	List<String> internalNodes;
	List<String> nodes;
	List<Edge> edges;
	final HashMap<String, List<String>> ancestors = new HashMap<String, List<String>>();
	HashMap<String, List<String>> subtreeLeaves;
	final HashMap<String, TObjectDoubleHashMap<String>> distances = new HashMap<String, TObjectDoubleHashMap<String>>();

	void clear() {
		if (_LOG.isTraceEnabled()) {
			_LOG.trace("clearing structural cache");
		}
		this.root = null;
		this.leaves = null;
		this.internalNodes = null;
		this.nodes = null;
		this.edges = null;
		this.ancestors.clear();
		this.subtreeLeaves = null;
		this.distances.clear();
	}

	void clearDistances() {
		this.distances.clear();
	}

	/**
	 * @return the (mutable, cached) distance row of `node`, created on first use
	 */
	TObjectDoubleHashMap<String> distancesFrom(String node) {
		TObjectDoubleHashMap<String> d = this.distances.get(node);
		if (d == null) {
			d = new TObjectDoubleHashMap<String>();
			this.distances.put(node, d);
		}
		return d;
	}
}
