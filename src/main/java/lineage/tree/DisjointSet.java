package lineage.tree;

/**
 * Weighted quick-union over the integers 0..N-1, with path halving.
 */
public class DisjointSet {

	private int[] id; // id[i] = parent of i
	private int[] sz; // sz[i] = number of objects in subtree rooted at i
	private int count;

	public DisjointSet(int N) {
		this.count = N;
		this.id = new int[N];
		this.sz = new int[N];
		for (int i = 0; i < N; i++) {
			this.id[i] = i;
			this.sz[i] = 1;
		}
	}

	// number of disjoint sets
	public int count() {
		return this.count;
	}

	public int find(int p) {
		while (p != this.id[p]) {
			this.id[p] = this.id[this.id[p]];
			p = this.id[p];
		}
		return p;
	}

	public boolean connected(int p, int q) {
		return find(p) == find(q);
	}

	/**
	 * Replaces the sets containing p and q with their union.
	 * @return the representative of the merged set
	 */
	public int union(int p, int q) {
		int i = find(p);
		int j = find(q);
		if (i == j) {
			return i;
		}
		this.count--;
		// make smaller root point to larger one
		if (this.sz[i] < this.sz[j]) {
			this.id[i] = j;
			this.sz[j] += this.sz[i];
			return j;
		}
		this.id[j] = i;
		this.sz[i] += this.sz[j];
		return i;
	}
}
