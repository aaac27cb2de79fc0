package lineage.solver;

import java.util.HashMap;
import java.util.Map;

import lineage.exceptions.TreeValidationException;

/**
 * Turns state prior probabilities into dissimilarity weights.
 */
public enum PriorTransformation {

	/** w = -log(p) */
	NEGATIVE_LOG ("negative_log"),
	/** w = 1 / p */
	INVERSE ("inverse"),
	/** w = sqrt(1 / p) */
	SQUARE_ROOT_INVERSE ("square_root_inverse");

	public final String transformationName;

	PriorTransformation(String transformationName) {
		this.transformationName = transformationName;
	}

	/**
	 * @throws TreeValidationException if `name` is not one of the supported transformations
	 */
	public static PriorTransformation forName(String name) {
		for (PriorTransformation t : values()) {
			if (t.transformationName.equals(name)) {
				return t;
			}
		}
		throw new TreeValidationException("Please select one of the supported prior transformations: "
				+ "negative_log, inverse, square_root_inverse. Got " + name + ".");
	}

	public double transform(double p) {
		switch (this) {
		case INVERSE:
			return 1.0 / p;
		case SQUARE_ROOT_INVERSE:
			return Math.sqrt(1.0 / p);
		default:
			return -Math.log(p);
		}
	}

	/**
	 * @param priors character -> state -> probability
	 * @return character -> state -> weight
	 */
	public Map<Integer, Map<Integer, Double>> transformPriors(Map<Integer, Map<Integer, Double>> priors) {
		Map<Integer, Map<Integer, Double>> weights = new HashMap<Integer, Map<Integer, Double>>();
		for (Map.Entry<Integer, Map<Integer, Double>> character : priors.entrySet()) {
			Map<Integer, Double> w = new HashMap<Integer, Double>();
			for (Map.Entry<Integer, Double> state : character.getValue().entrySet()) {
				w.put(state.getKey(), transform(state.getValue()));
			}
			weights.put(character.getKey(), w);
		}
		return weights;
	}
}
