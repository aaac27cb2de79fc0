package lineage.tree;

import static org.junit.Assert.*;

import org.junit.Test;

public class DisjointSetTest {

	@Test
	public void testUnion() {
		DisjointSet ds = new DisjointSet(6);
		assertEquals(6, ds.count());
		ds.union(0, 1);
		ds.union(2, 3);
		ds.union(1, 3);
		assertTrue(ds.connected(0, 2));
		assertFalse(ds.connected(0, 4));
		assertEquals(3, ds.count());
		int rep = ds.union(0, 3);
		assertEquals(rep, ds.find(2));
		assertEquals(3, ds.count());
	}
}
