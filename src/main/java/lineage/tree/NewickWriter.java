package lineage.tree;

import java.util.ArrayList;
import java.util.List;

import lineage.constants.GeneralConstants;
import lineage.exceptions.TreeValidationException;

import org.apache.commons.lang3.StringUtils;

/**
 * Writes a LineageTree in bracket (newick) notation. Every node, internal nodes included, is
 * written with its name so that NewickReader reproduces the same node set.
 *
 * The walk keeps its own stack, so deep (caterpillar) lineages do not overflow.
 */
public class NewickWriter {

	private static final String SEPARATOR = GeneralConstants.LIST_SEPARATOR.stringValue();

	// characters with a meaning in bracket notation
	private static final String RESERVED = SEPARATOR + "():;[]";

	/**
	 * @param recordBranchLengths should be true to include branch lengths
	 * @throws TreeValidationException if a node name contains the list separator or another
	 *		character reserved by the notation
	 */
	public static String write(LineageTree tree, boolean recordBranchLengths) {
		for (String n : tree.getNodes()) {
			if (n.contains(SEPARATOR)) {
				throw new TreeValidationException("No nodes may have the comma (" + SEPARATOR + ") character in its name.");
			}
			if (StringUtils.containsAny(n, RESERVED)) {
				throw new TreeValidationException("Node name " + n + " contains one of the reserved characters " + RESERVED + ".");
			}
		}
		StringBuffer buffer = new StringBuffer();

		// one frame per open node: its name, its children and the next child to write
		List<String> nodeStack = new ArrayList<String>();
		List<List<String>> childStack = new ArrayList<List<String>>();
		List<Integer> nextStack = new ArrayList<Integer>();
		nodeStack.add(tree.getRoot());
		childStack.add(tree.getChildren(tree.getRoot()));
		nextStack.add(0);
		while (!nodeStack.isEmpty()) {
			int top = nodeStack.size() - 1;
			String node = nodeStack.get(top);
			List<String> children = childStack.get(top);
			int next = nextStack.get(top);
			if (next < children.size()) {
				buffer.append(next == 0 ? "(" : SEPARATOR);
				nextStack.set(top, next + 1);
				String child = children.get(next);
				nodeStack.add(child);
				childStack.add(tree.getChildren(child));
				nextStack.add(0);
				continue;
			}
			if (!children.isEmpty()) {
				buffer.append(")");
			}
			buffer.append(node);
			nodeStack.remove(top);
			childStack.remove(top);
			nextStack.remove(top);
			if (recordBranchLengths && top > 0) {
				buffer.append(":").append(tree.getBranchLength(nodeStack.get(top - 1), node));
			}
		}
		buffer.append(";");
		return buffer.toString();
	}
}
