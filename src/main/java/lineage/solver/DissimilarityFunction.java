package lineage.solver;

import java.util.Map;

/**
 * Scores how different two samples are from their integer-coded character vectors.
 * Implementations must be symmetric in their two vector arguments.
 */
public interface DissimilarityFunction {

	/**
	 * @param s1 character states of the first sample
	 * @param s2 character states of the second sample
	 * @param missingStateIndicator the value marking an unobserved character
	 * @param weights character -> state -> weight, or null when no priors are available
	 */
	public double dissimilarity(int[] s1, int[] s2, int missingStateIndicator, Map<Integer, Map<Integer, Double>> weights);
}
