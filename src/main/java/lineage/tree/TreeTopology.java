package lineage.tree;

import gnu.trove.map.hash.TObjectDoubleHashMap;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

import lineage.exceptions.TreeParseException;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

/**
 * A raw node/edge description of a tree, as produced by a parser or a converter from another
 * tree library, and as exported by LineageTree.getTreeTopology. Identifiers of any type are
 * stored in their String form. Edges may record a branch length.
 *
 * No tree invariants are checked here; LineageTree checks them on ingestion.
 */
public class TreeTopology {

	private final LinkedHashSet<String> nodes;
	private final List<Edge> edges;
	private final TObjectDoubleHashMap<Edge> lengths;

	public TreeTopology() {
		this.nodes = new LinkedHashSet<String>();
		this.edges = new ArrayList<Edge>();
		this.lengths = new TObjectDoubleHashMap<Edge>();
	}

	public void addNode(Object node) {
		this.nodes.add(String.valueOf(node));
	}

	/**
	 * Adds an edge without a branch length. Both endpoints are added as nodes.
	 */
	public Edge addEdge(Object parent, Object child) {
		String p = String.valueOf(parent);
		String c = String.valueOf(child);
		this.nodes.add(p);
		this.nodes.add(c);
		Edge e = new Edge(p, c);
		this.edges.add(e);
		return e;
	}

	public Edge addEdge(Object parent, Object child, double length) {
		Edge e = addEdge(parent, child);
		this.lengths.put(e, length);
		return e;
	}

	public List<String> getNodes() {
		return new ArrayList<String>(this.nodes);
	}

	public List<Edge> getEdges() {
		return new ArrayList<Edge>(this.edges);
	}

	public boolean hasBranchLength(Edge e) {
		return this.lengths.containsKey(e);
	}

	/**
	 * @return the recorded length of `e`, or NaN if none was recorded
	 */
	public double getBranchLength(Edge e) {
		if (!this.lengths.containsKey(e)) {
			return Double.NaN;
		}
		return this.lengths.get(e);
	}

	public int getNodeCount() {
		return this.nodes.size();
	}

	/**
	 * @return {"nodes": [...], "edges": [{"parent": .., "child": .., "length": ..}, ...]}
	 *		where "length" is present only for edges that record one
	 */
	@SuppressWarnings("unchecked")
	public String toJSONString() {
		JSONObject root = new JSONObject();
		JSONArray jnodes = new JSONArray();
		jnodes.addAll(this.nodes);
		JSONArray jedges = new JSONArray();
		for (Edge e : this.edges) {
			JSONObject je = new JSONObject();
			je.put("parent", e.getParent());
			je.put("child", e.getChild());
			if (this.lengths.containsKey(e)) {
				je.put("length", this.lengths.get(e));
			}
			jedges.add(je);
		}
		root.put("nodes", jnodes);
		root.put("edges", jedges);
		return root.toJSONString();
	}

	/**
	 * Reads the format written by toJSONString.
	 *
	 * @throws TreeParseException if `json` is not valid JSON or lacks the expected fields
	 */
	public static TreeTopology fromJSON(String json) throws TreeParseException {
		Object parsed;
		try {
			parsed = new JSONParser().parse(json);
		} catch (ParseException e) {
			throw new TreeParseException("invalid JSON: " + e.toString(), e.getPosition());
		}
		if (!(parsed instanceof JSONObject)) {
			throw new TreeParseException("expected a JSON object at the top level");
		}
		JSONObject root = (JSONObject) parsed;
		TreeTopology topology = new TreeTopology();
		Object jnodes = root.get("nodes");
		if (jnodes instanceof JSONArray) {
			for (Object n : (JSONArray) jnodes) {
				topology.addNode(n);
			}
		}
		Object jedges = root.get("edges");
		if (!(jedges instanceof JSONArray)) {
			throw new TreeParseException("missing \"edges\" array");
		}
		for (Object o : (JSONArray) jedges) {
			if (!(o instanceof JSONObject)) {
				throw new TreeParseException("edge entries must be objects");
			}
			JSONObject je = (JSONObject) o;
			Object parent = je.get("parent");
			Object child = je.get("child");
			if (parent == null || child == null) {
				throw new TreeParseException("edge entries need a \"parent\" and a \"child\"");
			}
			Object length = je.get("length");
			if (length == null) {
				topology.addEdge(parent, child);
			} else if (length instanceof Number) {
				topology.addEdge(parent, child, ((Number) length).doubleValue());
			} else {
				throw new TreeParseException("edge length must be a number: " + length);
			}
		}
		return topology;
	}
}
