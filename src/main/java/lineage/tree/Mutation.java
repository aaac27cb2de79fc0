package lineage.tree;

/**
 * A change of state along an edge: the 0-based character that changed and the state it
 * changed to.
 */
public final class Mutation {

	private final int character;
	private final CharacterState state;

	public Mutation(int character, CharacterState state) {
		this.character = character;
		this.state = state;
	}

	public int getCharacter() {return this.character;}

	public CharacterState getState() {return this.state;}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Mutation)) {
			return false;
		}
		Mutation m = (Mutation) o;
		return this.character == m.character && this.state.equals(m.state);
	}

	@Override
	public int hashCode() {
		return this.character * 31 + this.state.hashCode();
	}

	@Override
	public String toString() {
		return "(" + this.character + ", " + this.state + ")";
	}
}
