package lineage.constants;

/**
 * A general-purpose container for values that do not change but do not fit into the other
 * enums. The data objects themselves are stored in the `value` parameter, and the type is
 * indicated by the type stored in `type`.
 */
public enum GeneralConstants {

	/** The character state used to mark an unobserved character when none is supplied. */
	DEFAULT_MISSING_STATE_INDICATOR (Integer.class, -1),

	/** Separates the members of a bracket-notation list. Node names may not contain it. */
	LIST_SEPARATOR (String.class, ","),

	/** Branch length given to ingested edges that do not record one. */
	DEFAULT_BRANCH_LENGTH (Double.class, 1.0),

	/** The unmutated ("uncut") character state. */
	UNMUTATED_STATE (Integer.class, 0);

	public final Class<?> type;
	public final Object value;

	GeneralConstants(Class<?> type, Object value) {
		this.type = type;
		this.value = value;
	}

	public int intValue() {
		return ((Integer) this.value).intValue();
	}

	public double doubleValue() {
		return ((Double) this.value).doubleValue();
	}

	public String stringValue() {
		return (String) this.value;
	}
}
