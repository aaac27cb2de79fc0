package lineage.tree;

/**
 * An ordered pair of node names, used to request and report lowest common ancestors.
 */
public final class NodePair {

	private final String first;
	private final String second;

	public NodePair(String first, String second) {
		this.first = first;
		this.second = second;
	}

	public String getFirst() {return this.first;}

	public String getSecond() {return this.second;}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof NodePair)) {
			return false;
		}
		NodePair p = (NodePair) o;
		return this.first.equals(p.first) && this.second.equals(p.second);
	}

	@Override
	public int hashCode() {
		return this.first.hashCode() * 31 + this.second.hashCode();
	}

	@Override
	public String toString() {
		return "(" + this.first + ", " + this.second + ")";
	}
}
