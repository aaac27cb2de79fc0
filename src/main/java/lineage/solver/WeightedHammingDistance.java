package lineage.solver;

import java.util.Map;

import lineage.constants.GeneralConstants;

/**
 * Hamming distance that knows about the uncut state and about state priors.
 *
 * Characters missing in either sample are skipped. For each remaining character, two
 * identical states cost nothing; an uncut state against an indel costs 1 (or the weight of
 * the indel); two different indels cost 2 (or the sum of their weights). The total is
 * normalised by the number of characters present in both samples.
 *
 * Weights are already transformed priors (see PriorTransformation), so any transformation can be
 * plugged in. A shared indel gets no bonus: identical states cost 0 with or without weights,
 * which keeps every score non-negative.
 */
public class WeightedHammingDistance implements DissimilarityFunction {

	private static final int UNCUT = GeneralConstants.UNMUTATED_STATE.intValue();

	public double dissimilarity(int[] s1, int[] s2, int missingStateIndicator, Map<Integer, Map<Integer, Double>> weights) {
		double d = 0;
		int numPresent = 0;
		for (int i = 0; i < s1.length; i++) {
			if (s1[i] == missingStateIndicator || s2[i] == missingStateIndicator) {
				continue;
			}
			numPresent++;
			if (s1[i] == s2[i]) {
				continue;
			}
			if (s1[i] == UNCUT || s2[i] == UNCUT) {
				if (weights != null) {
					d += weight(weights, i, s1[i] != UNCUT ? s1[i] : s2[i]);
				} else {
					d += 1;
				}
			} else {
				if (weights != null) {
					d += weight(weights, i, s1[i]) + weight(weights, i, s2[i]);
				} else {
					d += 2;
				}
			}
		}
		if (numPresent == 0) {
			return 0;
		}
		return d / numPresent;
	}

	private static double weight(Map<Integer, Map<Integer, Double>> weights, int character, int state) {
		Map<Integer, Double> w = weights.get(character);
		if (w == null || !w.containsKey(state)) {
			throw new IllegalArgumentException("No weight for state " + state + " of character " + character);
		}
		return w.get(state);
	}
}
