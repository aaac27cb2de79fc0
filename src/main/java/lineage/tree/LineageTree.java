package lineage.tree;

import gnu.trove.map.hash.TObjectDoubleHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.Stack;
import java.util.function.Predicate;

import lineage.constants.GeneralConstants;
import lineage.constants.NodeProperty;
import lineage.data.CharacterMatrix;
import lineage.data.DissimilarityMap;
import lineage.data.MetadataTable;
import lineage.exceptions.AttributeNotFoundException;
import lineage.exceptions.TimeConsistencyException;
import lineage.exceptions.TreeNotInitializedException;
import lineage.exceptions.TreeValidationException;
import lineage.solver.ClusterDissimilarity;
import lineage.solver.DissimilarityFunction;
import lineage.solver.PriorTransformation;
import lineage.solver.WeightedHammingDistance;

import org.apache.log4j.Logger;

/**
 * A rooted cell-lineage tree together with the character states observed at its leaves.
 *
 * The topology is stored as a node arena (a parent map and an ordered children map). Every node
 * carries a time and a character state vector, every edge a branch length, and
 * time(child) = time(parent) + length(parent, child) holds after every public call returns.
 *
 * Leaf-indexed data (the current character matrix, the cell metadata and the dissimilarity
 * map) always has one row per leaf: add/remove operations resynchronize it.
 *
 * Structural queries are memoized in a TreeCache that every topology change clears; time and
 * branch length changes only clear the cached distances. Returned collections are copies.
 *
 * Instances are not thread safe.
 */
public class LineageTree {

	static Logger _LOG = Logger.getLogger(LineageTree.class);

	private final int missingStateIndicator;
	private MetadataTable cellMeta;
	private MetadataTable characterMeta;
	private Map<Integer, Map<Integer, Double>> priors;
	private String rootSampleName;
	private Random random;

	// node arena, null until populateTree
	private LinkedHashMap<String, ArrayList<String>> children;
	private HashMap<String, String> parents;
	private TObjectDoubleHashMap<String> times;
	private TObjectDoubleHashMap<String> branchLengths; // keyed by the child of the edge
	private HashMap<String, List<CharacterState>> characterStates;
	private HashMap<String, HashMap<String, Object>> attributes;

	private CharacterMatrix originalCharacterMatrix;
	private CharacterMatrix currentCharacterMatrix;
	private DissimilarityMap dissimilarityMap;

	private final TreeCache cache = new TreeCache();

	/*
	 * constructors
	 */
	public LineageTree() {
		this(null, GeneralConstants.DEFAULT_MISSING_STATE_INDICATOR.intValue(), null, null, null, null, null, null);
	}

	public LineageTree(TreeTopology tree) {
		this(null, GeneralConstants.DEFAULT_MISSING_STATE_INDICATOR.intValue(), null, null, null, tree, null, null);
	}

	public LineageTree(CharacterMatrix characterMatrix, TreeTopology tree) {
		this(characterMatrix, GeneralConstants.DEFAULT_MISSING_STATE_INDICATOR.intValue(), null, null, null, tree, null, null);
	}

	/**
	 * Every argument except `missingStateIndicator` may be null.
	 *
	 * @param characterMatrix states observed at the samples
	 * @param missingStateIndicator the integer code of an unobserved character
	 * @param cellMeta per-cell metadata, kept in sync with the leaves
	 * @param characterMeta per-character metadata
	 * @param priors character -> state -> probability of mutating to that state
	 * @param tree the topology; if null the tree stays uninitialized until populateTree
	 * @param dissimilarityMap pairwise dissimilarities between samples
	 * @param rootSampleName the sample to treat as the root, when a solver needs one
	 */
	public LineageTree(CharacterMatrix characterMatrix, int missingStateIndicator, MetadataTable cellMeta,
			MetadataTable characterMeta, Map<Integer, Map<Integer, Double>> priors, TreeTopology tree,
			DissimilarityMap dissimilarityMap, String rootSampleName) {
		this.missingStateIndicator = missingStateIndicator;
		this.cellMeta = cellMeta == null ? null : cellMeta.copy();
		this.characterMeta = characterMeta == null ? null : characterMeta.copy();
		this.priors = copyPriors(priors);
		this.random = new Random();
		if (characterMatrix != null) {
			setCharacterMatrix(characterMatrix);
		}
		if (tree != null) {
			populateTree(tree);
		}
		if (dissimilarityMap != null) {
			setDissimilarityMap(dissimilarityMap);
		}
		this.rootSampleName = rootSampleName;
	}

	/*
	 * ingestion
	 */

	/**
	 * Replaces the topology of this tree. Node states are taken from the original character
	 * matrix where it has a row for the node, and are empty otherwise. Edges without a recorded
	 * length get length 1. The root is at time 0.
	 *
	 * @throws TreeValidationException if `tree` is not a single rooted tree
	 */
	public void populateTree(TreeTopology tree) {
		List<String> nodeList = tree.getNodes();
		if (nodeList.isEmpty()) {
			throw new TreeValidationException("The topology has no nodes.");
		}
		LinkedHashMap<String, ArrayList<String>> newChildren = new LinkedHashMap<String, ArrayList<String>>();
		HashMap<String, String> newParents = new HashMap<String, String>();
		TObjectDoubleHashMap<String> newLengths = new TObjectDoubleHashMap<String>();
		for (String n : nodeList) {
			newChildren.put(n, new ArrayList<String>());
		}
		for (Edge e : tree.getEdges()) {
			if (newParents.containsKey(e.getChild())) {
				throw new TreeValidationException("Node " + e.getChild() + " has more than one parent.");
			}
			newParents.put(e.getChild(), e.getParent());
			newChildren.get(e.getParent()).add(e.getChild());
			newLengths.put(e.getChild(), tree.hasBranchLength(e) ? tree.getBranchLength(e)
					: GeneralConstants.DEFAULT_BRANCH_LENGTH.doubleValue());
		}
		String root = null;
		for (String n : nodeList) {
			if (!newParents.containsKey(n)) {
				if (root != null) {
					throw new TreeValidationException("The topology has more than one root: " + root + ", " + n + ".");
				}
				root = n;
			}
		}
		if (root == null) {
			throw new TreeValidationException("The topology has no root.");
		}

		// times, top down. Also detects nodes that are not reachable from the root (cycles).
		TObjectDoubleHashMap<String> newTimes = new TObjectDoubleHashMap<String>();
		newTimes.put(root, 0.0);
		Stack<String> stack = new Stack<String>();
		stack.push(root);
		int reached = 0;
		while (!stack.isEmpty()) {
			String u = stack.pop();
			reached++;
			for (String v : newChildren.get(u)) {
				if (newLengths.get(v) < 0) {
					throw new TreeValidationException("Edge (" + u + ", " + v + ") has a negative length.");
				}
				newTimes.put(v, newTimes.get(u) + newLengths.get(v));
				stack.push(v);
			}
		}
		if (reached != nodeList.size()) {
			throw new TreeValidationException("The topology is not connected or contains a cycle.");
		}

		HashMap<String, List<CharacterState>> newStates = new HashMap<String, List<CharacterState>>();
		for (String n : nodeList) {
			if (this.originalCharacterMatrix != null && this.originalCharacterMatrix.hasRow(n)) {
				newStates.put(n, this.originalCharacterMatrix.getRow(n));
			} else {
				newStates.put(n, new ArrayList<CharacterState>());
			}
		}

		this.children = newChildren;
		this.parents = newParents;
		this.branchLengths = newLengths;
		this.times = newTimes;
		this.characterStates = newStates;
		this.attributes = new HashMap<String, HashMap<String, Object>>();
		this.cache.clear();
		if (_LOG.isDebugEnabled()) {
			_LOG.debug("populated tree with " + nodeList.size() + " nodes rooted at " + root);
		}
	}

	/**
	 * Stores a character matrix. If a topology exists, its leaves receive the rows.
	 *
	 * @throws TreeValidationException if a topology exists and its leaves are not exactly the
	 *		rows of the matrix
	 */
	public void setCharacterMatrix(CharacterMatrix characterMatrix) {
		if (this.children != null) {
			initializeCharacterStatesAtLeaves(characterMatrix);
			return;
		}
		this.originalCharacterMatrix = characterMatrix.copy();
		this.currentCharacterMatrix = characterMatrix.copy();
	}

	/**
	 * Assigns character states to the leaves. The matrix must have a row for every leaf and
	 * no other rows. Becomes both the original and the current character matrix.
	 */
	public void initializeCharacterStatesAtLeaves(CharacterMatrix characterMatrix) {
		checkInitialized();
		if (!new HashSet<String>(getLeaves()).equals(characterMatrix.sampleSet())) {
			throw new TreeValidationException("Character matrix index does not match set of leaves.");
		}
		for (String leaf : getLeaves()) {
			this.characterStates.put(leaf, characterMatrix.getRow(leaf));
		}
		this.originalCharacterMatrix = characterMatrix.copy();
		this.currentCharacterMatrix = characterMatrix.copy();
	}

	public void initializeCharacterStatesAtLeaves(Map<?, int[]> characterMatrix) {
		initializeCharacterStatesAtLeaves(CharacterMatrix.fromInts(characterMatrix, this.missingStateIndicator));
	}

	/**
	 * Assigns character states to every node. The mapping must have an entry for every node
	 * and no other entries. The leaf rows become the original and current character matrix.
	 */
	public void initializeAllCharacterStates(Map<String, List<CharacterState>> characterStateMapping) {
		checkInitialized();
		if (!characterStateMapping.keySet().equals(this.children.keySet())) {
			throw new TreeValidationException("Mapping does not account for all the nodes.");
		}
		LinkedHashMap<String, List<CharacterState>> leafRows = new LinkedHashMap<String, List<CharacterState>>();
		for (String leaf : getLeaves()) {
			leafRows.put(leaf, characterStateMapping.get(leaf));
		}
		CharacterMatrix cm = CharacterMatrix.fromStates(leafRows);
		for (String n : getNodes()) {
			this.characterStates.put(n, new ArrayList<CharacterState>(characterStateMapping.get(n)));
		}
		this.originalCharacterMatrix = cm;
		this.currentCharacterMatrix = cm.copy();
	}

	/**
	 * @return a copy of the character matrix as it was ingested
	 */
	public CharacterMatrix getOriginalCharacterMatrix() {
		if (this.originalCharacterMatrix == null) {
			throw new TreeNotInitializedException("Character matrix does not exist.");
		}
		return this.originalCharacterMatrix.copy();
	}

	/**
	 * @return a copy of the character matrix reflecting later edits of leaf states and the
	 *		current leaf set
	 */
	public CharacterMatrix getCurrentCharacterMatrix() {
		if (this.currentCharacterMatrix == null) {
			throw new TreeNotInitializedException("Character matrix does not exist.");
		}
		return this.currentCharacterMatrix.copy();
	}

	/**
	 * @return the number of cells: rows of the current character matrix, or leaves
	 */
	public int getCellCount() {
		if (this.currentCharacterMatrix == null) {
			if (this.children == null) {
				throw new TreeNotInitializedException("This is an empty object with no tree or character matrix.");
			}
			return getLeaves().size();
		}
		return this.currentCharacterMatrix.getCellCount();
	}

	/**
	 * @return the number of characters per state vector
	 */
	public int getCharacterCount() {
		if (this.currentCharacterMatrix == null) {
			if (this.children == null) {
				throw new TreeNotInitializedException("This is an empty object with no tree or character matrix.");
			}
			List<CharacterState> states = this.characterStates.get(getLeaves().get(0));
			if (states.isEmpty()) {
				throw new TreeNotInitializedException("Character states have not been initialized.");
			}
			return states.size();
		}
		return this.currentCharacterMatrix.getCharacterCount();
	}

	/*
	 * topology store
	 */

	private void checkInitialized() {
		if (this.children == null) {
			throw new TreeNotInitializedException();
		}
	}

	private void checkNode(String node) {
		checkInitialized();
		if (!this.children.containsKey(node)) {
			throw new TreeValidationException("Node " + node + " does not exist.");
		}
	}

	private void checkEdge(String parent, String child) {
		checkInitialized();
		if (!this.children.containsKey(child) || !parent.equals(this.parents.get(child))) {
			throw new TreeValidationException("Edge (" + parent + ", " + child + ") does not exist.");
		}
	}

	public String getRoot() {
		checkInitialized();
		if (this.cache.root == null) {
			for (String n : this.children.keySet()) {
				if (!this.parents.containsKey(n)) {
					this.cache.root = n;
					break;
				}
			}
		}
		return this.cache.root;
	}

	public List<String> getLeaves() {
		checkInitialized();
		if (this.cache.leaves == null) {
			List<String> leaves = new ArrayList<String>();
			for (Map.Entry<String, ArrayList<String>> e : this.children.entrySet()) {
				if (e.getValue().isEmpty()) {
					leaves.add(e.getKey());
				}
			}
			this.cache.leaves = leaves;
		}
		return new ArrayList<String>(this.cache.leaves);
	}

	/**
	 * @return every node with at least one child, the root included
	 */
	public List<String> getInternalNodes() {
		checkInitialized();
		if (this.cache.internalNodes == null) {
			List<String> internal = new ArrayList<String>();
			for (Map.Entry<String, ArrayList<String>> e : this.children.entrySet()) {
				if (!e.getValue().isEmpty()) {
					internal.add(e.getKey());
				}
			}
			this.cache.internalNodes = internal;
		}
		return new ArrayList<String>(this.cache.internalNodes);
	}

	public List<String> getNodes() {
		checkInitialized();
		if (this.cache.nodes == null) {
			this.cache.nodes = new ArrayList<String>(this.children.keySet());
		}
		return new ArrayList<String>(this.cache.nodes);
	}

	public List<Edge> getEdges() {
		checkInitialized();
		if (this.cache.edges == null) {
			List<Edge> edges = new ArrayList<Edge>();
			for (Map.Entry<String, ArrayList<String>> e : this.children.entrySet()) {
				for (String c : e.getValue()) {
					edges.add(new Edge(e.getKey(), c));
				}
			}
			this.cache.edges = edges;
		}
		return new ArrayList<Edge>(this.cache.edges);
	}

	public boolean isLeaf(String node) {
		checkNode(node);
		return this.children.get(node).isEmpty();
	}

	public boolean isRoot(String node) {
		checkNode(node);
		return !this.parents.containsKey(node);
	}

	/**
	 * @return true if the node has children. The root counts as internal when it has children.
	 */
	public boolean isInternalNode(String node) {
		checkNode(node);
		return !this.children.get(node).isEmpty();
	}

	public boolean hasNode(String node) {
		checkInitialized();
		return this.children.containsKey(node);
	}

	/**
	 * @throws TreeValidationException if `node` is the root
	 */
	public String getParent(String node) {
		checkNode(node);
		String p = this.parents.get(node);
		if (p == null) {
			throw new TreeValidationException("The root has no parent.");
		}
		return p;
	}

	public List<String> getChildren(String node) {
		checkNode(node);
		return new ArrayList<String>(this.children.get(node));
	}

	/**
	 * @return the nodes of the subtree rooted at `source`, in postorder or preorder
	 */
	public List<String> depthFirstTraverseNodes(String source, boolean postorder) {
		checkNode(source);
		LinkedList<String> ret = new LinkedList<String>();
		Stack<String> stack = new Stack<String>();
		stack.push(source);
		if (postorder) {
			// reversed (node, right-to-left children) preorder is a left-to-right postorder
			while (!stack.isEmpty()) {
				String u = stack.pop();
				ret.addFirst(u);
				for (String c : this.children.get(u)) {
					stack.push(c);
				}
			}
		} else {
			while (!stack.isEmpty()) {
				String u = stack.pop();
				ret.add(u);
				List<String> ch = this.children.get(u);
				for (int i = ch.size() - 1; i >= 0; i--) {
					stack.push(ch.get(i));
				}
			}
		}
		return new ArrayList<String>(ret);
	}

	/**
	 * @return every node in postorder, starting from the root
	 */
	public List<String> depthFirstTraverseNodes() {
		return depthFirstTraverseNodes(getRoot(), true);
	}

	/**
	 * @return the edges below `source` in the order a preorder walk discovers them
	 */
	public List<Edge> depthFirstTraverseEdges(String source) {
		List<Edge> edges = new ArrayList<Edge>();
		for (String n : depthFirstTraverseNodes(source, false)) {
			if (!n.equals(source)) {
				edges.add(new Edge(this.parents.get(n), n));
			}
		}
		return edges;
	}

	public List<Edge> depthFirstTraverseEdges() {
		return depthFirstTraverseEdges(getRoot());
	}

	/**
	 * @return the leaves of the subtree rooted at `node`
	 */
	public List<String> getLeavesInSubtree(String node) {
		checkNode(node);
		if (this.cache.subtreeLeaves == null) {
			HashMap<String, List<String>> subtree = new HashMap<String, List<String>>();
			for (String n : depthFirstTraverseNodes()) {
				List<String> leaves = new ArrayList<String>();
				if (this.children.get(n).isEmpty()) {
					leaves.add(n);
				} else {
					for (String c : this.children.get(n)) {
						leaves.addAll(subtree.get(c));
					}
				}
				subtree.put(n, leaves);
			}
			this.cache.subtreeLeaves = subtree;
		}
		return new ArrayList<String>(this.cache.subtreeLeaves.get(node));
	}

	/**
	 * @return the ancestors of `node`, closest first, ending with the root
	 */
	public List<String> getAllAncestors(String node) {
		checkNode(node);
		List<String> ancestors = this.cache.ancestors.get(node);
		if (ancestors == null) {
			ancestors = new ArrayList<String>();
			String curr = this.parents.get(node);
			while (curr != null) {
				ancestors.add(curr);
				curr = this.parents.get(curr);
			}
			this.cache.ancestors.put(node, ancestors);
		}
		return new ArrayList<String>(ancestors);
	}

	/**
	 * @return the nodes, in postorder, for which `condition` holds
	 */
	public List<String> filterNodes(Predicate<String> condition) {
		List<String> ret = new ArrayList<String>();
		for (String n : depthFirstTraverseNodes()) {
			if (condition.test(n)) {
				ret.add(n);
			}
		}
		return ret;
	}

	/*
	 * primitive mutations. Unchecked: callers validate and clear the cache.
	 */

	private void addNode(String node) {
		this.children.put(node, new ArrayList<String>());
		this.characterStates.put(node, new ArrayList<CharacterState>());
	}

	/**
	 * Removes `node` and its incident edges. Its children are left without a parent.
	 */
	private void removeNode(String node) {
		String p = this.parents.remove(node);
		if (p != null) {
			this.children.get(p).remove(node);
		}
		for (String c : this.children.remove(node)) {
			this.parents.remove(c);
			this.branchLengths.remove(c);
		}
		this.times.remove(node);
		this.branchLengths.remove(node);
		this.characterStates.remove(node);
		this.attributes.remove(node);
	}

	private void addEdge(String u, String v) {
		this.children.get(u).add(v);
		this.parents.put(v, u);
	}

	private void removeEdge(String u, String v) {
		this.children.get(u).remove(v);
		this.parents.remove(v);
		this.branchLengths.remove(v);
	}

	/*
	 * time and branch length consistency
	 */

	public double getTime(String node) {
		checkNode(node);
		return this.times.get(node);
	}

	public Map<String, Double> getTimes() {
		checkInitialized();
		Map<String, Double> ret = new LinkedHashMap<String, Double>();
		for (String n : this.children.keySet()) {
			ret.put(n, this.times.get(n));
		}
		return ret;
	}

	/**
	 * Sets the time of a node and adjusts the lengths of the edge into it and the edges out of
	 * it, so no other node moves.
	 *
	 * @throws TimeConsistencyException if `time` is before the parent's time or after a child's
	 */
	public void setTime(String node, double time) {
		checkNode(node);
		String parent = this.parents.get(node);
		if (parent != null && time < this.times.get(parent)) {
			throw new TimeConsistencyException("New time " + time + " of " + node + " is less than the time of the parent.");
		}
		for (String child : this.children.get(node)) {
			if (time > this.times.get(child)) {
				throw new TimeConsistencyException("New time " + time + " of " + node + " is greater than the time of child " + child + ".");
			}
		}
		this.times.put(node, time);
		if (parent != null) {
			this.branchLengths.put(node, time - this.times.get(parent));
		}
		for (String child : this.children.get(node)) {
			this.branchLengths.put(child, this.times.get(child) - time);
		}
		this.cache.clearDistances();
	}

	/**
	 * Sets the time of many nodes at once and recomputes every branch length. Nodes that are
	 * not in `timeMap` keep their current time; entries for nodes that are not in the tree are
	 * ignored. Nothing changes if the check fails.
	 *
	 * @throws TimeConsistencyException if any parent would be later than its child
	 */
	public void setTimes(Map<String, Double> timeMap) {
		checkInitialized();
		TObjectDoubleHashMap<String> newTimes = new TObjectDoubleHashMap<String>(this.times);
		for (Map.Entry<String, Double> e : timeMap.entrySet()) {
			if (this.children.containsKey(e.getKey())) {
				newTimes.put(e.getKey(), e.getValue());
			} else if (_LOG.isDebugEnabled()) {
				_LOG.debug("ignoring time for unknown node " + e.getKey());
			}
		}
		for (Map.Entry<String, String> e : this.parents.entrySet()) {
			double tParent = newTimes.get(e.getValue());
			double tChild = newTimes.get(e.getKey());
			if (tParent > tChild) {
				throw new TimeConsistencyException("Time of parent greater than that of child: " + tParent + " > " + tChild);
			}
		}
		for (Map.Entry<String, String> e : this.parents.entrySet()) {
			this.branchLengths.put(e.getKey(), newTimes.get(e.getKey()) - newTimes.get(e.getValue()));
		}
		this.times = newTimes;
		this.cache.clearDistances();
	}

	public double getBranchLength(String parent, String child) {
		checkEdge(parent, child);
		return this.branchLengths.get(child);
	}

	/**
	 * Sets the length of an edge and moves every node below it by the change in length.
	 *
	 * @throws TreeValidationException if the edge does not exist or `length` is negative
	 */
	public void setBranchLength(String parent, String child, double length) {
		checkEdge(parent, child);
		if (length < 0) {
			throw new TreeValidationException("Edge length must be non-negative.");
		}
		this.branchLengths.put(child, length);
		updateTimes(child);
		this.cache.clearDistances();
	}

	/**
	 * Sets the length of many edges and recomputes every time. Nothing changes if any edge is
	 * missing or any length is negative.
	 */
	public void setBranchLengths(Map<Edge, Double> lengths) {
		checkInitialized();
		for (Map.Entry<Edge, Double> e : lengths.entrySet()) {
			checkEdge(e.getKey().getParent(), e.getKey().getChild());
			if (e.getValue() < 0) {
				throw new TreeValidationException("Edge length must be non-negative.");
			}
		}
		for (Map.Entry<Edge, Double> e : lengths.entrySet()) {
			this.branchLengths.put(e.getKey().getChild(), e.getValue());
		}
		updateTimes(getRoot());
		this.cache.clearDistances();
	}

	/**
	 * Recomputes the time of every node in the subtree rooted at `source` from its parent's
	 * time and its branch length. The root keeps its time.
	 */
	private void updateTimes(String source) {
		for (String n : depthFirstTraverseNodes(source, false)) {
			String p = this.parents.get(n);
			if (p != null) {
				this.times.put(n, this.times.get(p) + this.branchLengths.get(n));
			}
		}
	}

	/*
	 * character states
	 */

	public int getMissingStateIndicator() {
		return this.missingStateIndicator;
	}

	/**
	 * @return a copy of the state vector of `node`
	 */
	public List<CharacterState> getCharacterStates(String node) {
		checkNode(node);
		return new ArrayList<CharacterState>(this.characterStates.get(node));
	}

	/**
	 * Sets the state vector of a node. For a leaf, the current character matrix is updated.
	 *
	 * @throws TreeValidationException if the vector does not have one entry per character, or
	 *		if `node` is a leaf whose states were never initialized
	 */
	public void setCharacterStates(String node, List<CharacterState> states) {
		checkNode(node);
		if (states.size() != getCharacterCount()) {
			throw new TreeValidationException("Input character vector is not the right length.");
		}
		boolean leaf = this.children.get(node).isEmpty();
		if (leaf && this.characterStates.get(node).isEmpty()) {
			throw new TreeValidationException("Leaf node character states have not been instantiated.");
		}
		this.characterStates.put(node, new ArrayList<CharacterState>(states));
		if (leaf && this.currentCharacterMatrix != null) {
			this.currentCharacterMatrix.putRow(node, states);
		}
	}

	/**
	 * Sets integer-coded states; the missing-state indicator becomes a missing state.
	 */
	public void setCharacterStates(String node, int... states) {
		setCharacterStates(node, CharacterState.fromInts(states, this.missingStateIndicator));
	}

	/**
	 * @return true if any character of `node` is ambiguous
	 */
	public boolean isAmbiguous(String node) {
		checkNode(node);
		return CharacterState.anyAmbiguous(this.characterStates.get(node));
	}

	/**
	 * Drops repeated candidates from every ambiguous state. Idempotent.
	 */
	public void collapseAmbiguousCharacters() {
		checkInitialized();
		for (String node : getNodes()) {
			List<CharacterState> states = getCharacterStates(node);
			boolean modified = false;
			for (int i = 0; i < states.size(); i++) {
				CharacterState collapsed = states.get(i).collapse();
				if (collapsed != states.get(i)) {
					states.set(i, collapsed);
					modified = true;
				}
			}
			if (modified) {
				setCharacterStates(node, states);
			}
		}
	}

	/**
	 * Resolves every ambiguous state to its most frequent candidate. Ties are broken uniformly
	 * at random with the source set by setRandom.
	 */
	public void resolveAmbiguousCharacters() {
		resolveAmbiguousCharacters(null);
	}

	/**
	 * Resolves every ambiguous state with `resolver`, or by the default rule if it is null.
	 */
	public void resolveAmbiguousCharacters(StateResolver resolver) {
		checkInitialized();
		for (String node : getNodes()) {
			List<CharacterState> states = getCharacterStates(node);
			boolean modified = false;
			for (int i = 0; i < states.size(); i++) {
				CharacterState s = states.get(i);
				if (!s.isAmbiguous()) {
					continue;
				}
				int resolved;
				if (resolver != null) {
					resolved = resolver.resolve(s.getCandidates());
				} else {
					int[] winners = s.mostFrequentCandidates();
					resolved = winners[this.random.nextInt(winners.length)];
				}
				states.set(i, CharacterState.fromInt(resolved, this.missingStateIndicator));
				modified = true;
			}
			if (modified) {
				setCharacterStates(node, states);
			}
		}
	}

	/**
	 * Sets the randomness used to break ties when resolving ambiguous states.
	 */
	public void setRandom(Random random) {
		this.random = random;
	}

	/**
	 * @return the (character, new state) pairs that differ between `parent` and `child`
	 */
	public List<Mutation> getMutationsAlongEdge(String parent, String child) {
		checkEdge(parent, child);
		List<CharacterState> ps = this.characterStates.get(parent);
		List<CharacterState> cs = this.characterStates.get(child);
		List<Mutation> mutations = new ArrayList<Mutation>();
		for (int i = 0; i < getCharacterCount(); i++) {
			if (!ps.get(i).equals(cs.get(i))) {
				mutations.add(new Mutation(i, cs.get(i)));
			}
		}
		return mutations;
	}

	/*
	 * ancestral reconstruction
	 */

	/**
	 * Fills in the states of every internal node, bottom up, under Camin-Sokal parsimony. Leaf
	 * states are not changed.
	 *
	 * @throws TreeNotInitializedException if a leaf has no states
	 */
	public void reconstructAncestralCharacters() {
		checkInitialized();
		List<String> postorder = depthFirstTraverseNodes();
		for (String n : postorder) {
			if (this.children.get(n).isEmpty() && this.characterStates.get(n).isEmpty()) {
				throw new TreeNotInitializedException("Character states not annotated at leaf " + n
						+ ", initialize character states at leaves before reconstructing ancestral characters.");
			}
		}
		for (String n : postorder) {
			List<String> ch = this.children.get(n);
			if (ch.isEmpty()) {
				continue;
			}
			List<List<CharacterState>> childStates = new ArrayList<List<CharacterState>>(ch.size());
			for (String c : ch) {
				childStates.add(this.characterStates.get(c));
			}
			this.characterStates.put(n, CaminSokalParsimony.lcaCharacters(childStates));
		}
	}

	/*
	 * topology surgery
	 */

	/**
	 * Adds a leaf under `parent` with branch length 0. The leaf gets missing states (if there is
	 * a character matrix), an empty metadata row and infinite dissimilarity to every sample.
	 * Callers adjust its time and states afterwards.
	 *
	 * @throws TreeValidationException if `node` exists, `parent` does not, or `parent` is a leaf
	 */
	public void addLeaf(String parent, String node) {
		checkInitialized();
		if (this.children.containsKey(node)) {
			throw new TreeValidationException("Node " + node + " already exists.");
		}
		if (!this.children.containsKey(parent)) {
			throw new TreeValidationException("Node " + parent + " does not exist.");
		}
		if (this.children.get(parent).isEmpty()) {
			throw new TreeValidationException("Can not add a leaf to a leaf.");
		}
		addNode(node);
		addEdge(parent, node);
		this.branchLengths.put(node, 0.0);
		this.times.put(node, this.times.get(parent));
		this.cache.clear();
		registerDataWithTree();
		_LOG.debug("added leaf " + node + " under " + parent);
	}

	/**
	 * Removes a leaf, then every ancestor left without children, stopping at the first ancestor
	 * that still has a child or at the root. The leaf's rows are dropped from leaf data.
	 *
	 * The root is never removed, even when it is the only node left: a tree always keeps its
	 * root.
	 *
	 * @throws TreeValidationException if `node` is not a leaf, or if `node` is the root (a
	 *		single-node tree can not be emptied)
	 */
	public void removeLeafAndPruneLineage(String node) {
		checkNode(node);
		if (!this.children.get(node).isEmpty()) {
			throw new TreeValidationException("Node " + node + " is not a leaf.");
		}
		if (!this.parents.containsKey(node)) {
			throw new TreeValidationException("Can not remove the root of the tree.");
		}
		String curr = this.parents.get(node);
		removeNode(node);
		while (this.children.get(curr).isEmpty() && this.parents.containsKey(curr)) {
			String next = this.parents.get(curr);
			removeNode(curr);
			_LOG.trace("pruned " + curr);
			curr = next;
		}
		this.cache.clear();
		registerDataWithTree();
		_LOG.debug("removed leaf " + node);
	}

	public void collapseUnifurcations() {
		collapseUnifurcations(getRoot());
	}

	/**
	 * Removes the internal nodes below `source` that have exactly one child, joining their
	 * parent to that child with the summed length. If `source` itself has a single internal
	 * child, that child is removed instead and its children are joined to `source`. Times of
	 * the remaining nodes do not change.
	 */
	public void collapseUnifurcations(String source) {
		checkNode(source);
		for (String node : depthFirstTraverseNodes(source, true)) {
			List<String> ch = this.children.get(node);
			if (ch.size() != 1) {
				continue;
			}
			String child = ch.get(0);
			if (node.equals(source)) {
				if (!this.children.get(child).isEmpty()) {
					mergeIntoParent(node, child);
				}
			} else {
				String parent = this.parents.get(node);
				double t = this.branchLengths.get(node) + this.branchLengths.get(child);
				removeEdge(node, child);
				addEdge(parent, child);
				this.branchLengths.put(child, t);
				removeNode(node);
			}
		}
		this.cache.clear();
	}

	/**
	 * Removes internal edges along which no character changes. Leaves are never removed. The
	 * introduction of a missing state counts as a change.
	 *
	 * @param inferAncestralCharacters if true, reconstructAncestralCharacters runs first
	 */
	public void collapseMutationlessEdges(boolean inferAncestralCharacters) {
		checkInitialized();
		if (inferAncestralCharacters) {
			reconstructAncestralCharacters();
		}
		for (String n : depthFirstTraverseNodes()) {
			if (this.children.get(n).isEmpty()) {
				continue;
			}
			for (String child : new ArrayList<String>(this.children.get(n))) {
				if (!this.children.get(child).isEmpty()
						&& this.characterStates.get(n).equals(this.characterStates.get(child))) {
					mergeIntoParent(n, child);
				}
			}
		}
		this.cache.clear();
	}

	/**
	 * Removes `child` and joins its children to `parent`, keeping their times.
	 */
	private void mergeIntoParent(String parent, String child) {
		double t = this.branchLengths.get(child);
		for (String grandchild : new ArrayList<String>(this.children.get(child))) {
			double t_ = this.branchLengths.get(grandchild);
			removeEdge(child, grandchild);
			addEdge(parent, grandchild);
			this.branchLengths.put(grandchild, t + t_);
		}
		removeNode(child);
		_LOG.trace("collapsed " + child + " into " + parent);
	}

	/**
	 * Renames nodes. Names missing from `relabelMap` are kept. Leaf data follows the rename.
	 *
	 * @throws TreeValidationException if two nodes would end up with the same name
	 */
	public void relabelNodes(Map<String, String> relabelMap) {
		checkInitialized();
		Set<String> renamed = new HashSet<String>();
		for (String n : this.children.keySet()) {
			if (!renamed.add(relabel(relabelMap, n))) {
				throw new TreeValidationException("Relabeling would give two nodes the name " + relabel(relabelMap, n) + ".");
			}
		}
		LinkedHashMap<String, ArrayList<String>> newChildren = new LinkedHashMap<String, ArrayList<String>>();
		HashMap<String, String> newParents = new HashMap<String, String>();
		TObjectDoubleHashMap<String> newTimes = new TObjectDoubleHashMap<String>();
		TObjectDoubleHashMap<String> newLengths = new TObjectDoubleHashMap<String>();
		HashMap<String, List<CharacterState>> newStates = new HashMap<String, List<CharacterState>>();
		HashMap<String, HashMap<String, Object>> newAttributes = new HashMap<String, HashMap<String, Object>>();
		for (Map.Entry<String, ArrayList<String>> e : this.children.entrySet()) {
			String n = e.getKey();
			String r = relabel(relabelMap, n);
			ArrayList<String> ch = new ArrayList<String>();
			for (String c : e.getValue()) {
				ch.add(relabel(relabelMap, c));
				newParents.put(relabel(relabelMap, c), r);
				newLengths.put(relabel(relabelMap, c), this.branchLengths.get(c));
			}
			newChildren.put(r, ch);
			newTimes.put(r, this.times.get(n));
			newStates.put(r, this.characterStates.get(n));
			if (this.attributes.containsKey(n)) {
				newAttributes.put(r, this.attributes.get(n));
			}
		}
		this.children = newChildren;
		this.parents = newParents;
		this.times = newTimes;
		this.branchLengths = newLengths;
		this.characterStates = newStates;
		this.attributes = newAttributes;
		if (this.currentCharacterMatrix != null) {
			this.currentCharacterMatrix = this.currentCharacterMatrix.relabel(relabelMap);
		}
		if (this.cellMeta != null) {
			this.cellMeta = this.cellMeta.relabel(relabelMap);
		}
		if (this.dissimilarityMap != null) {
			this.dissimilarityMap = this.dissimilarityMap.relabel(relabelMap);
		}
		this.cache.clear();
	}

	private static String relabel(Map<String, String> relabelMap, String n) {
		return relabelMap.containsKey(n) ? relabelMap.get(n) : n;
	}

	/**
	 * Makes the leaf data match the leaves. Rows of removed leaves are dropped; new leaves get
	 * all-missing states, null metadata and infinite dissimilarity to every other sample.
	 */
	private void registerDataWithTree() {
		List<String> leaves = getLeaves();
		Set<String> leafSet = new HashSet<String>(leaves);
		if (this.currentCharacterMatrix != null) {
			for (String s : this.currentCharacterMatrix.getSamples()) {
				if (!leafSet.contains(s)) {
					this.currentCharacterMatrix.removeRow(s);
				}
			}
			for (String leaf : leaves) {
				if (!this.currentCharacterMatrix.hasRow(leaf)) {
					List<CharacterState> missing = new ArrayList<CharacterState>(
							Collections.nCopies(this.currentCharacterMatrix.getCharacterCount(), CharacterState.missing()));
					this.characterStates.put(leaf, missing);
					this.currentCharacterMatrix.putRow(leaf, missing);
				}
			}
		}
		if (this.cellMeta != null) {
			for (String s : this.cellMeta.getRowNames()) {
				if (!leafSet.contains(s)) {
					this.cellMeta.removeRow(s);
				}
			}
			for (String leaf : leaves) {
				this.cellMeta.addEmptyRow(leaf);
			}
		}
		if (this.dissimilarityMap != null) {
			for (String s : this.dissimilarityMap.getSamples()) {
				if (!leafSet.contains(s)) {
					this.dissimilarityMap.removeSample(s);
				}
			}
			for (String leaf : leaves) {
				this.dissimilarityMap.addSample(leaf);
			}
		}
	}

	/*
	 * lowest common ancestors and distances
	 */

	/**
	 * Finds the LCA of each pair with one offline walk of the tree.
	 *
	 * @param pairs the pairs to answer, or null for every unordered pair of distinct nodes
	 * @return pair -> LCA, in the order of `pairs`
	 */
	public Map<NodePair, String> findLcasOfPairs(List<NodePair> pairs) {
		checkInitialized();
		String root = getRoot();
		LcaFinder finder = new LcaFinder(root, depthFirstTraverseNodes(root, false), this.children);
		return finder.findLcas(pairs == null ? finder.allPairs() : pairs);
	}

	/**
	 * @return the deepest node that is an ancestor of (or equal to) every node given
	 * @throws TreeValidationException if fewer than two distinct nodes are given
	 */
	public String findLca(String... nodes) {
		checkInitialized();
		Set<String> current = new LinkedHashSet<String>();
		Collections.addAll(current, nodes);
		if (current.size() < 2) {
			throw new TreeValidationException("At least two distinct nodes must be provided.");
		}
		while (current.size() > 1) {
			List<String> members = new ArrayList<String>(current);
			List<NodePair> pairs = new ArrayList<NodePair>();
			for (int i = 0; i < members.size(); i++) {
				for (int j = i + 1; j < members.size(); j++) {
					pairs.add(new NodePair(members.get(i), members.get(j)));
				}
			}
			current = new LinkedHashSet<String>(findLcasOfPairs(pairs).values());
		}
		return current.iterator().next();
	}

	/**
	 * @return the summed branch length on the path between two nodes
	 */
	public double getDistance(String node1, String node2) {
		checkNode(node1);
		checkNode(node2);
		TObjectDoubleHashMap<String> row = this.cache.distancesFrom(node1);
		if (!row.containsKey(node2)) {
			double d = 0.0;
			if (!node1.equals(node2)) {
				double lcaTime = this.times.get(findLca(node1, node2));
				d = (this.times.get(node1) - lcaTime) + (this.times.get(node2) - lcaTime);
			}
			row.put(node2, d);
			this.cache.distancesFrom(node2).put(node1, d);
		}
		return row.get(node2);
	}

	/**
	 * Computes the distance from `node` to every node in one pass: descendants by time
	 * difference, then every other subtree of each ancestor in turn.
	 *
	 * @param leavesOnly only report distances to leaves
	 */
	public Map<String, Double> getDistances(String node, boolean leavesOnly) {
		checkNode(node);
		TObjectDoubleHashMap<String> row = this.cache.distancesFrom(node);
		if (row.size() < this.children.size()) {
			double nodeTime = this.times.get(node);
			for (String d : depthFirstTraverseNodes(node, false)) {
				row.put(d, this.times.get(d) - nodeTime);
			}
			String prev = node;
			for (String ancestor : getAllAncestors(node)) {
				double ancestorTime = this.times.get(ancestor);
				double ancestorDistance = nodeTime - ancestorTime;
				row.put(ancestor, ancestorDistance);
				for (String c : this.children.get(ancestor)) {
					if (c.equals(prev)) {
						continue;
					}
					for (String d : depthFirstTraverseNodes(c, false)) {
						row.put(d, ancestorDistance + (this.times.get(d) - ancestorTime));
					}
				}
				prev = ancestor;
			}
		}
		Map<String, Double> ret = new LinkedHashMap<String, Double>();
		for (String n : this.children.keySet()) {
			if (!leavesOnly || this.children.get(n).isEmpty()) {
				ret.put(n, row.get(n));
			}
		}
		return ret;
	}

	public Map<String, Double> getDistances(String node) {
		return getDistances(node, false);
	}

	public double getMeanDepthOfTree() {
		checkInitialized();
		return TreeUtils.getMeanDepth(this);
	}

	public double getMaxDepthOfTree() {
		checkInitialized();
		return TreeUtils.getMaxDepth(this);
	}

	/*
	 * dissimilarity map
	 */

	/**
	 * @return a copy of the dissimilarity map, or null if there is none
	 */
	public DissimilarityMap getDissimilarityMap() {
		return this.dissimilarityMap == null ? null : this.dissimilarityMap.copy();
	}

	/**
	 * Stores a copy of `dissimilarityMap`. Logs a warning if its samples are not the rows of
	 * the current character matrix.
	 */
	public void setDissimilarityMap(DissimilarityMap dissimilarityMap) {
		if (this.currentCharacterMatrix != null
				&& !this.currentCharacterMatrix.sampleSet().equals(dissimilarityMap.sampleSet())) {
			_LOG.warn("The samples in the existing character matrix and specified dissimilarity map do not agree.");
		}
		this.dissimilarityMap = dissimilarityMap.copy();
	}

	public void computeDissimilarityMap(DissimilarityFunction dissimilarityFunction) {
		computeDissimilarityMap(dissimilarityFunction, PriorTransformation.NEGATIVE_LOG.transformationName);
	}

	/**
	 * Computes the dissimilarity of every pair of rows of the current character matrix and
	 * stores the result as the dissimilarity map. If any row is ambiguous the function is
	 * applied through ClusterDissimilarity.
	 *
	 * @param dissimilarityFunction the scoring function, or null for WeightedHammingDistance
	 * @param priorTransformation one of "negative_log", "inverse", "square_root_inverse"; used
	 *		only when priors are set
	 */
	public void computeDissimilarityMap(DissimilarityFunction dissimilarityFunction, String priorTransformation) {
		if (this.currentCharacterMatrix == null) {
			throw new TreeNotInitializedException("No character matrix is detected in this tree.");
		}
		PriorTransformation transformation = PriorTransformation.forName(priorTransformation);
		DissimilarityFunction function = dissimilarityFunction == null ? new WeightedHammingDistance() : dissimilarityFunction;
		CharacterMatrix cm = this.currentCharacterMatrix;
		boolean ambiguous = cm.isAmbiguous();
		if (ambiguous) {
			_LOG.warn("Character matrix contains ambiguous characters.");
		}
		Map<Integer, Map<Integer, Double>> weights = null;
		if (this.priors != null && !this.priors.isEmpty()) {
			weights = transformation.transformPriors(this.priors);
		}

		List<String> samples = cm.getSamples();
		DissimilarityMap dm = new DissimilarityMap(samples);
		ClusterDissimilarity cluster = new ClusterDissimilarity(function);
		for (int i = 0; i < samples.size(); i++) {
			for (int j = i + 1; j < samples.size(); j++) {
				String a = samples.get(i);
				String b = samples.get(j);
				double d;
				if (ambiguous) {
					d = cluster.dissimilarity(cm.getRow(a), cm.getRow(b), this.missingStateIndicator, weights);
				} else {
					d = function.dissimilarity(cm.getIntRow(a, this.missingStateIndicator),
							cm.getIntRow(b, this.missingStateIndicator), this.missingStateIndicator, weights);
				}
				dm.set(a, b, d);
			}
		}
		setDissimilarityMap(dm);
	}

	/*
	 * node attributes
	 */

	/**
	 * @throws TreeValidationException if `attributeName` is a property maintained by the tree
	 */
	public void setAttribute(String node, String attributeName, Object value) {
		checkNode(node);
		if (NodeProperty.forName(attributeName) != null) {
			throw new TreeValidationException("Attribute " + attributeName + " is maintained by the tree and can not be set directly.");
		}
		HashMap<String, Object> a = this.attributes.get(node);
		if (a == null) {
			a = new HashMap<String, Object>();
			this.attributes.put(node, a);
		}
		a.put(attributeName, value);
	}

	/**
	 * @throws AttributeNotFoundException if the attribute was never set on `node`
	 */
	public Object getAttribute(String node, String attributeName) {
		checkNode(node);
		NodeProperty p = NodeProperty.forName(attributeName);
		if (p == NodeProperty.TIME) {
			return getTime(node);
		} else if (p == NodeProperty.CHARACTER_STATES) {
			return getCharacterStates(node);
		}
		HashMap<String, Object> a = this.attributes.get(node);
		if (a == null || !a.containsKey(attributeName)) {
			throw new AttributeNotFoundException(node, attributeName);
		}
		return a.get(attributeName);
	}

	/*
	 * serialization
	 */

	/**
	 * @param recordBranchLengths should be true to include branch lengths
	 * @throws TreeValidationException if a node name contains the list separator
	 */
	public String getNewick(boolean recordBranchLengths) {
		checkInitialized();
		return NewickWriter.write(this, recordBranchLengths);
	}

	/**
	 * @return a node/edge snapshot of the tree, with branch lengths, in preorder
	 */
	public TreeTopology getTreeTopology() {
		checkInitialized();
		TreeTopology topology = new TreeTopology();
		topology.addNode(getRoot());
		for (Edge e : depthFirstTraverseEdges()) {
			topology.addEdge(e.getParent(), e.getChild(), this.branchLengths.get(e.getChild()));
		}
		return topology;
	}

	/*
	 * metadata
	 */

	public MetadataTable getCellMeta() {
		return this.cellMeta == null ? null : this.cellMeta.copy();
	}

	public void setCellMeta(MetadataTable cellMeta) {
		this.cellMeta = cellMeta == null ? null : cellMeta.copy();
	}

	public MetadataTable getCharacterMeta() {
		return this.characterMeta == null ? null : this.characterMeta.copy();
	}

	public void setCharacterMeta(MetadataTable characterMeta) {
		this.characterMeta = characterMeta == null ? null : characterMeta.copy();
	}

	/**
	 * @return a copy of the priors, or null if none are set
	 */
	public Map<Integer, Map<Integer, Double>> getPriors() {return copyPriors(this.priors);}

	public void setPriors(Map<Integer, Map<Integer, Double>> priors) {this.priors = copyPriors(priors);}

	private static Map<Integer, Map<Integer, Double>> copyPriors(Map<Integer, Map<Integer, Double>> priors) {
		if (priors == null) {
			return null;
		}
		Map<Integer, Map<Integer, Double>> copy = new HashMap<Integer, Map<Integer, Double>>();
		for (Map.Entry<Integer, Map<Integer, Double>> e : priors.entrySet()) {
			copy.put(e.getKey(), new HashMap<Integer, Double>(e.getValue()));
		}
		return copy;
	}

	public String getRootSampleName() {return this.rootSampleName;}

	public void setRootSampleName(String rootSampleName) {this.rootSampleName = rootSampleName;}
}
