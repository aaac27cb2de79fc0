package lineage.constants;

/**
 * Node properties maintained by the tree itself. Callers may read these through
 * LineageTree.getAttribute, but they may only be changed through the dedicated setters so
 * that the time and state invariants hold.
 */
public enum NodeProperty {

	TIME ("time", Double.class, "Time of the node: the summed branch length from the root."),
	CHARACTER_STATES ("character_states", java.util.List.class, "The character state vector of the node.");

	public final String propertyName;
	public final Class<?> type;
	public final String description;

	NodeProperty(String propertyName, Class<?> T, String description) {
		this.propertyName = propertyName;
		this.type = T;
		this.description = description;
	}

	/**
	 * @return the property with the given name, or null if the name is not reserved
	 */
	public static NodeProperty forName(String propertyName) {
		for (NodeProperty p : values()) {
			if (p.propertyName.equals(propertyName)) {
				return p;
			}
		}
		return null;
	}
}
