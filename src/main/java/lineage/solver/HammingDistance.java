package lineage.solver;

import java.util.Map;

/**
 * The number of positions at which two samples disagree. Missing states and weights are not
 * treated specially.
 */
public class HammingDistance implements DissimilarityFunction {

	public double dissimilarity(int[] s1, int[] s2, int missingStateIndicator, Map<Integer, Map<Integer, Double>> weights) {
		int dist = 0;
		for (int i = 0; i < s1.length; i++) {
			if (s1[i] != s2[i]) {
				dist++;
			}
		}
		return dist;
	}
}
