package lineage.solver;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lineage.tree.CharacterState;

/**
 * Extends a DissimilarityFunction to samples carrying ambiguous states. Every character is
 * scored on its own: the wrapped function is applied to each pair of candidates drawn from the
 * two states and the scores are averaged. Per-character scores are summed and normalised by
 * the number of characters observed in both samples.
 */
public class ClusterDissimilarity {

	private final DissimilarityFunction function;

	public ClusterDissimilarity(DissimilarityFunction function) {
		this.function = function;
	}

	public double dissimilarity(List<CharacterState> s1, List<CharacterState> s2, int missingStateIndicator,
			Map<Integer, Map<Integer, Double>> weights) {
		double result = 0;
		int numPresent = 0;
		for (int i = 0; i < s1.size(); i++) {
			CharacterState c1 = s1.get(i);
			CharacterState c2 = s2.get(i);
			if (c1.isMissing() || c2.isMissing()) {
				continue;
			}
			numPresent++;
			Map<Integer, Map<Integer, Double>> characterWeights = null;
			if (weights != null && weights.containsKey(i)) {
				characterWeights = new HashMap<Integer, Map<Integer, Double>>();
				characterWeights.put(0, weights.get(i));
			}
			double sum = 0;
			int pairs = 0;
			for (int a : c1.getCandidates()) {
				for (int b : c2.getCandidates()) {
					sum += this.function.dissimilarity(new int[] {a}, new int[] {b}, missingStateIndicator, characterWeights);
					pairs++;
				}
			}
			result += sum / pairs;
		}
		if (numPresent == 0) {
			return 0;
		}
		return result / numPresent;
	}
}
