package lineage.tree;

import java.util.ArrayList;
import java.util.List;

import lineage.exceptions.TreeValidationException;

/**
 * Ancestral states under irreversible (Camin-Sokal) parsimony. A mutated state can not revert
 * to its ancestor, so a parent only carries a state that all of its children carry; any
 * disagreement, or a child that was not observed, leaves the parent's character unresolved.
 */
public class CaminSokalParsimony {

	/**
	 * @param childStates the state vectors of the children of one node
	 * @return the per-character state shared by every child, or missing where they differ
	 * @throws TreeValidationException if the vectors differ in length
	 */
	public static List<CharacterState> lcaCharacters(List<List<CharacterState>> childStates) {
		int k = childStates.get(0).size();
		for (List<CharacterState> v : childStates) {
			if (v.size() != k) {
				throw new TreeValidationException("Character vectors of sibling nodes differ in length.");
			}
		}
		List<CharacterState> lca = new ArrayList<CharacterState>(k);
		for (int i = 0; i < k; i++) {
			CharacterState shared = childStates.get(0).get(i);
			for (int j = 1; j < childStates.size() && !shared.isMissing(); j++) {
				if (!shared.equals(childStates.get(j).get(i))) {
					shared = CharacterState.missing();
				}
			}
			lca.add(shared);
		}
		return lca;
	}
}
