package lineage.tree;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TIntIntHashMap;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * The state of one character (target site) in one node. A state is either missing, a single
 * observed integer state, or an ambiguous bag of candidate integer states. Instances are
 * immutable.
 *
 * Ambiguous states compare as multisets: (1,2,2) equals (2,1,2) but not (1,2).
 */
public final class CharacterState {

	public enum Kind { MISSING, SCALAR, AMBIGUOUS }

	private static final CharacterState MISSING = new CharacterState(Kind.MISSING, 0, null);

	private final Kind kind;
	private final int value;
	private final int[] candidates; // sorted copy, only for AMBIGUOUS

	private CharacterState(Kind kind, int value, int[] candidates) {
		this.kind = kind;
		this.value = value;
		this.candidates = candidates;
	}

	public static CharacterState missing() {
		return MISSING;
	}

	public static CharacterState of(int value) {
		return new CharacterState(Kind.SCALAR, value, null);
	}

	/**
	 * @return a SCALAR state, or MISSING when `value` equals the missing-state indicator
	 */
	public static CharacterState fromInt(int value, int missingStateIndicator) {
		if (value == missingStateIndicator) {
			return MISSING;
		}
		return of(value);
	}

	/**
	 * Builds an ambiguous state from its candidate values. Repeated candidates are kept, they
	 * encode the relative abundance of each candidate.
	 */
	public static CharacterState ambiguous(int... candidates) {
		if (candidates == null || candidates.length == 0) {
			throw new IllegalArgumentException("An ambiguous state needs at least one candidate.");
		}
		TIntArrayList sorted = new TIntArrayList(candidates);
		sorted.sort();
		return new CharacterState(Kind.AMBIGUOUS, 0, sorted.toArray());
	}

	public Kind getKind() {
		return this.kind;
	}

	public boolean isMissing() {
		return this.kind == Kind.MISSING;
	}

	public boolean isAmbiguous() {
		return this.kind == Kind.AMBIGUOUS;
	}

	public boolean isScalar() {
		return this.kind == Kind.SCALAR;
	}

	/**
	 * @return the observed state of a SCALAR
	 * @throws IllegalStateException for MISSING and AMBIGUOUS states
	 */
	public int getValue() {
		if (this.kind != Kind.SCALAR) {
			throw new IllegalStateException(this.kind + " state has no single value");
		}
		return this.value;
	}

	/**
	 * @return the candidate values of an AMBIGUOUS state (duplicates included, ascending), or
	 *		the single value of a SCALAR
	 */
	public int[] getCandidates() {
		if (this.kind == Kind.AMBIGUOUS) {
			return this.candidates.clone();
		}
		if (this.kind == Kind.SCALAR) {
			return new int[] {this.value};
		}
		throw new IllegalStateException("MISSING state has no candidates");
	}

	/**
	 * @return the integer encoding of this state, with MISSING encoded as `missingStateIndicator`
	 */
	public int toInt(int missingStateIndicator) {
		if (this.kind == Kind.MISSING) {
			return missingStateIndicator;
		}
		return getValue();
	}

	/**
	 * @return this state with repeated candidates removed. MISSING and SCALAR states are
	 *		returned unchanged.
	 */
	public CharacterState collapse() {
		if (this.kind != Kind.AMBIGUOUS) {
			return this;
		}
		TIntArrayList distinct = new TIntArrayList();
		for (int c : this.candidates) {
			if (distinct.isEmpty() || distinct.get(distinct.size() - 1) != c) {
				distinct.add(c);
			}
		}
		if (distinct.size() == this.candidates.length) {
			return this;
		}
		return new CharacterState(Kind.AMBIGUOUS, 0, distinct.toArray());
	}

	/**
	 * @return the candidates that occur most often in an AMBIGUOUS state, ascending
	 */
	public int[] mostFrequentCandidates() {
		int[] cands = getCandidates();
		TIntIntHashMap counts = new TIntIntHashMap();
		int best = 0;
		for (int c : cands) {
			int n = counts.adjustOrPutValue(c, 1, 1);
			if (n > best) {
				best = n;
			}
		}
		TIntArrayList winners = new TIntArrayList();
		for (int c : counts.keys()) {
			if (counts.get(c) == best) {
				winners.add(c);
			}
		}
		winners.sort();
		return winners.toArray();
	}

	public static List<CharacterState> fromInts(int[] states, int missingStateIndicator) {
		List<CharacterState> ret = new ArrayList<CharacterState>(states.length);
		for (int s : states) {
			ret.add(fromInt(s, missingStateIndicator));
		}
		return ret;
	}

	/**
	 * @throws IllegalStateException if any state is ambiguous
	 */
	public static int[] toInts(List<CharacterState> states, int missingStateIndicator) {
		int[] ret = new int[states.size()];
		for (int i = 0; i < ret.length; i++) {
			ret[i] = states.get(i).toInt(missingStateIndicator);
		}
		return ret;
	}

	public static boolean anyAmbiguous(List<CharacterState> states) {
		for (CharacterState s : states) {
			if (s.isAmbiguous()) {
				return true;
			}
		}
		return false;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof CharacterState)) {
			return false;
		}
		CharacterState other = (CharacterState) o;
		if (this.kind != other.kind) {
			return false;
		}
		switch (this.kind) {
		case SCALAR:
			return this.value == other.value;
		case AMBIGUOUS:
			return java.util.Arrays.equals(this.candidates, other.candidates);
		default:
			return true;
		}
	}

	@Override
	public int hashCode() {
		switch (this.kind) {
		case SCALAR:
			return 31 + this.value;
		case AMBIGUOUS:
			return 17 * java.util.Arrays.hashCode(this.candidates);
		default:
			return 0;
		}
	}

	@Override
	public String toString() {
		switch (this.kind) {
		case SCALAR:
			return Integer.toString(this.value);
		case AMBIGUOUS:
			return "(" + StringUtils.join(this.candidates, ',') + ")";
		default:
			return "missing";
		}
	}
}
