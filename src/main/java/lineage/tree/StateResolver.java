package lineage.tree;

/**
 * Picks a single state for an ambiguous character.
 */
public interface StateResolver {

	/**
	 * @param candidates the candidate states, duplicates included
	 * @return the resolved state
	 */
	public int resolve(int[] candidates);
}
