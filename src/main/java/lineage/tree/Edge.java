package lineage.tree;

/**
 * A directed (parent, child) edge of a tree.
 */
public final class Edge {

	private final String parent;
	private final String child;

	public Edge(String parent, String child) {
		this.parent = parent;
		this.child = child;
	}

	public String getParent() {return this.parent;}

	public String getChild() {return this.child;}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Edge)) {
			return false;
		}
		Edge e = (Edge) o;
		return this.parent.equals(e.parent) && this.child.equals(e.child);
	}

	@Override
	public int hashCode() {
		return this.parent.hashCode() * 31 + this.child.hashCode();
	}

	@Override
	public String toString() {
		return "(" + this.parent + ", " + this.child + ")";
	}
}
