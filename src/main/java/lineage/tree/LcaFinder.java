package lineage.tree;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TObjectIntHashMap;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lineage.exceptions.TreeValidationException;

/**
 * Tarjan's offline lowest common ancestor algorithm. All requested pairs are answered by a
 * single depth-first walk of the tree, merging finished subtrees into their parent with a
 * union-find, so the cost is close to linear in the number of nodes plus pairs.
 *
 * The walk uses an explicit stack so deep (caterpillar) lineages do not overflow.
 */
public class LcaFinder {

	private final String[] names;
	private final int[][] children;
	private final TObjectIntHashMap<String> index;
	private final int root;

	/**
	 * @param rootName the root of the tree
	 * @param preorder every node of the tree, root first
	 * @param childMap node -> children
	 */
	public LcaFinder(String rootName, List<String> preorder, Map<String, ? extends List<String>> childMap) {
		this.names = preorder.toArray(new String[preorder.size()]);
		this.index = new TObjectIntHashMap<String>(this.names.length, 0.5f, -1);
		for (int i = 0; i < this.names.length; i++) {
			this.index.put(this.names[i], i);
		}
		this.children = new int[this.names.length][];
		for (int i = 0; i < this.names.length; i++) {
			List<String> ch = childMap.get(this.names[i]);
			this.children[i] = new int[ch == null ? 0 : ch.size()];
			for (int j = 0; j < this.children[i].length; j++) {
				this.children[i][j] = this.index.get(ch.get(j));
			}
		}
		this.root = this.index.get(rootName);
	}

	/**
	 * @return pair -> lowest common ancestor, in the order the pairs were given
	 * @throws TreeValidationException if a pair names a node that is not in the tree
	 */
	public Map<NodePair, String> findLcas(List<NodePair> pairs) {
		int n = this.names.length;
		int[] first = new int[pairs.size()];
		int[] second = new int[pairs.size()];
		TIntArrayList[] queries = new TIntArrayList[n];
		for (int q = 0; q < pairs.size(); q++) {
			first[q] = nodeIndex(pairs.get(q).getFirst());
			second[q] = nodeIndex(pairs.get(q).getSecond());
			addQuery(queries, first[q], q);
			if (second[q] != first[q]) {
				addQuery(queries, second[q], q);
			}
		}

		String[] answers = new String[pairs.size()];
		DisjointSet ds = new DisjointSet(n);
		int[] ancestor = new int[n];
		boolean[] finished = new boolean[n];

		int[] stack = new int[n];
		int[] nextChild = new int[n];
		int top = 0;
		stack[0] = this.root;
		ancestor[this.root] = this.root;
		while (top >= 0) {
			int u = stack[top];
			if (nextChild[u] < this.children[u].length) {
				int c = this.children[u][nextChild[u]++];
				ancestor[c] = c;
				stack[++top] = c;
				continue;
			}
			top--;
			finished[u] = true;
			if (queries[u] != null) {
				for (int k = 0; k < queries[u].size(); k++) {
					int q = queries[u].get(k);
					int other = first[q] == u ? second[q] : first[q];
					if (finished[other]) {
						answers[q] = this.names[ancestor[ds.find(other)]];
					}
				}
			}
			if (top >= 0) {
				int parent = stack[top];
				ds.union(parent, u);
				ancestor[ds.find(parent)] = parent;
			}
		}

		Map<NodePair, String> ret = new LinkedHashMap<NodePair, String>();
		for (int q = 0; q < pairs.size(); q++) {
			ret.put(pairs.get(q), answers[q]);
		}
		return ret;
	}

	/**
	 * @return every unordered pair of distinct nodes, in preorder
	 */
	public List<NodePair> allPairs() {
		List<NodePair> pairs = new ArrayList<NodePair>();
		for (int i = 0; i < this.names.length; i++) {
			for (int j = i + 1; j < this.names.length; j++) {
				pairs.add(new NodePair(this.names[i], this.names[j]));
			}
		}
		return pairs;
	}

	private int nodeIndex(String node) {
		int i = this.index.get(node);
		if (i < 0) {
			throw new TreeValidationException("Node " + node + " does not exist.");
		}
		return i;
	}

	private static void addQuery(TIntArrayList[] queries, int node, int q) {
		if (queries[node] == null) {
			queries[node] = new TIntArrayList();
		}
		queries[node].add(q);
	}
}
