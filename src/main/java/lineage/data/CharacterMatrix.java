package lineage.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lineage.exceptions.TreeValidationException;
import lineage.tree.CharacterState;

/**
 * A table of character states indexed by sample (leaf) name. Every row has the same number of
 * characters. Row order is the order in which rows were added.
 */
public class CharacterMatrix {

	private final LinkedHashMap<String, List<CharacterState>> rows;
	private int nCharacter;

	public CharacterMatrix(int nCharacter) {
		this.rows = new LinkedHashMap<String, List<CharacterState>>();
		this.nCharacter = nCharacter;
	}

	/**
	 * Builds a matrix from integer-coded rows. Values equal to `missingStateIndicator` become
	 * missing states.
	 *
	 * @throws TreeValidationException if a row key is not a String or the rows differ in length
	 */
	public static CharacterMatrix fromInts(Map<?, int[]> table, int missingStateIndicator) {
		CharacterMatrix cm = null;
		for (Map.Entry<?, int[]> e : table.entrySet()) {
			if (!(e.getKey() instanceof String)) {
				throw new TreeValidationException("Index of character matrix must consist of strings.");
			}
			if (cm == null) {
				cm = new CharacterMatrix(e.getValue().length);
			}
			cm.putRow((String) e.getKey(), CharacterState.fromInts(e.getValue(), missingStateIndicator));
		}
		return cm == null ? new CharacterMatrix(0) : cm;
	}

	/**
	 * Builds a matrix from rows of states.
	 *
	 * @throws TreeValidationException if a row key is not a String or the rows differ in length
	 */
	public static CharacterMatrix fromStates(Map<?, ? extends List<CharacterState>> table) {
		CharacterMatrix cm = null;
		for (Map.Entry<?, ? extends List<CharacterState>> e : table.entrySet()) {
			if (!(e.getKey() instanceof String)) {
				throw new TreeValidationException("Index of character matrix must consist of strings.");
			}
			if (cm == null) {
				cm = new CharacterMatrix(e.getValue().size());
			}
			cm.putRow((String) e.getKey(), e.getValue());
		}
		return cm == null ? new CharacterMatrix(0) : cm;
	}

	public CharacterMatrix copy() {
		CharacterMatrix cm = new CharacterMatrix(this.nCharacter);
		for (Map.Entry<String, List<CharacterState>> e : this.rows.entrySet()) {
			cm.rows.put(e.getKey(), new ArrayList<CharacterState>(e.getValue()));
		}
		return cm;
	}

	/**
	 * Adds or replaces a row.
	 *
	 * @throws TreeValidationException if the row does not have nCharacter entries
	 */
	public void putRow(String sample, List<CharacterState> states) {
		if (states.size() != this.nCharacter) {
			throw new TreeValidationException("Row " + sample + " has " + states.size()
					+ " characters, expected " + this.nCharacter + ".");
		}
		this.rows.put(sample, new ArrayList<CharacterState>(states));
	}

	public void removeRow(String sample) {
		this.rows.remove(sample);
	}

	/**
	 * @return a copy of this matrix whose rows are renamed through `relabelMap`. Rows not in
	 *		the map keep their name.
	 */
	public CharacterMatrix relabel(Map<String, String> relabelMap) {
		CharacterMatrix cm = new CharacterMatrix(this.nCharacter);
		for (Map.Entry<String, List<CharacterState>> e : this.rows.entrySet()) {
			String name = relabelMap.containsKey(e.getKey()) ? relabelMap.get(e.getKey()) : e.getKey();
			cm.rows.put(name, new ArrayList<CharacterState>(e.getValue()));
		}
		return cm;
	}

	public boolean hasRow(String sample) {
		return this.rows.containsKey(sample);
	}

	/**
	 * @return a copy of the row, or null if the sample is not in the matrix
	 */
	public List<CharacterState> getRow(String sample) {
		List<CharacterState> r = this.rows.get(sample);
		return r == null ? null : new ArrayList<CharacterState>(r);
	}

	/**
	 * @return the row encoded as integers (missing as `missingStateIndicator`)
	 * @throws IllegalStateException if the row holds ambiguous states
	 */
	public int[] getIntRow(String sample, int missingStateIndicator) {
		return CharacterState.toInts(this.rows.get(sample), missingStateIndicator);
	}

	public CharacterState get(String sample, int character) {
		return this.rows.get(sample).get(character);
	}

	public List<String> getSamples() {
		return new ArrayList<String>(this.rows.keySet());
	}

	public Set<String> sampleSet() {
		return Collections.unmodifiableSet(this.rows.keySet());
	}

	public int getCellCount() {
		return this.rows.size();
	}

	public int getCharacterCount() {
		return this.nCharacter;
	}

	/**
	 * @return true if any entry is an ambiguous state
	 */
	public boolean isAmbiguous() {
		for (List<CharacterState> r : this.rows.values()) {
			if (CharacterState.anyAmbiguous(r)) {
				return true;
			}
		}
		return false;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof CharacterMatrix)) {
			return false;
		}
		CharacterMatrix other = (CharacterMatrix) o;
		return this.nCharacter == other.nCharacter && this.rows.equals(other.rows);
	}

	@Override
	public int hashCode() {
		return this.rows.hashCode() * 31 + this.nCharacter;
	}

	@Override
	public String toString() {
		StringBuffer sb = new StringBuffer();
		for (Map.Entry<String, List<CharacterState>> e : this.rows.entrySet()) {
			sb.append(e.getKey()).append('\t').append(e.getValue()).append('\n');
		}
		return sb.toString();
	}
}
