package lineage.tree;

import gnu.trove.list.array.TDoubleArrayList;
import gnu.trove.list.array.TIntArrayList;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import lineage.exceptions.TreeParseException;

/**
 * Reads a tree in bracket (newick) notation into a TreeTopology. Unnamed nodes are given
 * generated names ("node0", "node1", ...) that do not clash with the names in the string.
 * Bracketed comments are skipped. Edges record a branch length only when the string has one.
 */
public class NewickReader {

	private static final String UNNAMED_PREFIX = "node";

	public NewickReader() {
	}

	public TreeTopology readTree(String treeString) throws TreeParseException {
		String pb = treeString.trim();
		if (pb.isEmpty() || pb.charAt(pb.length() - 1) != ';') {
			throw new TreeParseException("missing concluding semicolon", pb.length());
		}

		// nodes in creation order, which is a preorder
		List<String> names = new ArrayList<String>();
		TIntArrayList parents = new TIntArrayList();
		TDoubleArrayList lengths = new TDoubleArrayList();

		int curr = -1;
		int x = 0;
		while (x < pb.length()) {
			char nextChar = pb.charAt(x);
			if (nextChar == '(') {
				curr = newNode(names, parents, lengths, curr);
				x++;
			} else if (nextChar == ',') {
				if (curr < 0 || parents.get(curr) < 0) {
					throw new TreeParseException("unexpected separator", x);
				}
				curr = parents.get(curr);
				x++;
			} else if (nextChar == ')') {
				if (curr < 0 || parents.get(curr) < 0) {
					throw new TreeParseException("unbalanced parenthesis", x);
				}
				curr = parents.get(curr);
				x++;
				int end = scanLabel(pb, x);
				String label = pb.substring(x, end).trim();
				if (!label.isEmpty()) {
					names.set(curr, label);
				}
				x = end;
			} else if (nextChar == ':') {
				if (curr < 0) {
					throw new TreeParseException("branch length without a node", x);
				}
				x++;
				int end = scanLabel(pb, x);
				try {
					lengths.set(curr, Double.parseDouble(pb.substring(x, end)));
				} catch (NumberFormatException e) {
					throw new TreeParseException("bad branch length " + pb.substring(x, end), x);
				}
				x = end;
			} else if (nextChar == '[') { // note
				int close = pb.indexOf(']', x);
				if (close < 0) {
					throw new TreeParseException("unterminated comment", x);
				}
				x = close + 1;
			} else if (nextChar == ';') {
				if (curr != 0) {
					throw new TreeParseException("unbalanced parenthesis", x);
				}
				break;
			} else if (Character.isWhitespace(nextChar)) {
				x++;
			} else { // external named node
				curr = newNode(names, parents, lengths, curr);
				int end = scanLabel(pb, x);
				names.set(curr, pb.substring(x, end).trim());
				x = end;
			}
		}
		if (names.isEmpty()) {
			throw new TreeParseException("empty tree");
		}

		nameUnnamed(names);
		TreeTopology topology = new TreeTopology();
		topology.addNode(names.get(0));
		for (int i = 1; i < names.size(); i++) {
			String parent = names.get(parents.get(i));
			if (Double.isNaN(lengths.get(i))) {
				topology.addEdge(parent, names.get(i));
			} else {
				topology.addEdge(parent, names.get(i), lengths.get(i));
			}
		}
		return topology;
	}

	private static int newNode(List<String> names, TIntArrayList parents, TDoubleArrayList lengths, int parent) {
		names.add(null);
		parents.add(parent);
		lengths.add(Double.NaN);
		return names.size() - 1;
	}

	private static int scanLabel(String pb, int x) {
		while (x < pb.length()) {
			char c = pb.charAt(x);
			if (c == ',' || c == ')' || c == '(' || c == ':' || c == ';' || c == '[') {
				break;
			}
			x++;
		}
		return x;
	}

	private static void nameUnnamed(List<String> names) {
		HashSet<String> used = new HashSet<String>();
		for (String n : names) {
			if (n != null) {
				used.add(n);
			}
		}
		int counter = 0;
		for (int i = 0; i < names.size(); i++) {
			if (names.get(i) == null) {
				String candidate = UNNAMED_PREFIX + counter++;
				while (used.contains(candidate)) {
					candidate = UNNAMED_PREFIX + counter++;
				}
				used.add(candidate);
				names.set(i, candidate);
			}
		}
	}
}
