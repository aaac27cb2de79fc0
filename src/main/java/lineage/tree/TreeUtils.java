package lineage.tree;

import java.util.List;

/**
 * Summary statistics over the node times of a tree. If branch lengths have not been set,
 * times count the edges from the root.
 */
public class TreeUtils {

	/**
	 * @return the mean time of the leaves
	 */
	public static double getMeanDepth(LineageTree tree) {
		List<String> leaves = tree.getLeaves();
		double sum = 0.0;
		for (String l : leaves) {
			sum += tree.getTime(l);
		}
		return sum / leaves.size();
	}

	/**
	 * @return the greatest time of any leaf
	 */
	public static double getMaxDepth(LineageTree tree) {
		double max = Double.NEGATIVE_INFINITY;
		for (String l : tree.getLeaves()) {
			double t = tree.getTime(l);
			if (t > max) {
				max = t;
			}
		}
		return max;
	}
}
