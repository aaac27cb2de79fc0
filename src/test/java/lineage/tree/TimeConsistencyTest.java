package lineage.tree;

import static org.junit.Assert.*;

import java.util.HashMap;
import java.util.Map;

import lineage.exceptions.TimeConsistencyException;
import lineage.exceptions.TreeValidationException;

import org.junit.Before;
import org.junit.Test;

public class TimeConsistencyTest {

	private static final double EPS = 1e-9;

	protected LineageTree tree;

	@Before
	public void buildTree() {
		tree = new LineageTree(LineageTreeTopologyTest.exampleTopology());
	}

	/**
	 * time(child) = time(parent) + length(parent, child) on every edge
	 */
	static void assertConsistent(LineageTree tree) {
		for (Edge e : tree.getEdges()) {
			assertEquals(e.toString(), tree.getTime(e.getParent()) + tree.getBranchLength(e.getParent(), e.getChild()),
					tree.getTime(e.getChild()), EPS);
		}
	}

	private void assertConsistent() {
		assertConsistent(tree);
	}

	@Test
	public void testSetBranchLengthShiftsSubtree() {
		tree.setBranchLength("root", "B", 2.5);
		assertEquals(2.5, tree.getTime("B"), EPS);
		assertEquals(3.5, tree.getTime("c3"), EPS);
		assertEquals(3.5, tree.getTime("C"), EPS);
		assertEquals(4.5, tree.getTime("c5"), EPS);
		assertEquals(2.0, tree.getTime("c1"), EPS);
		assertConsistent();
	}

	@Test(expected = TreeValidationException.class)
	public void testNegativeBranchLength() {
		tree.setBranchLength("root", "A", -0.1);
	}

	@Test(expected = TreeValidationException.class)
	public void testBranchLengthOfMissingEdge() {
		tree.setBranchLength("A", "c3", 1.0);
	}

	@Test
	public void testSetBranchLengths() {
		Map<Edge, Double> lengths = new HashMap<Edge, Double>();
		lengths.put(new Edge("root", "A"), 0.5);
		lengths.put(new Edge("C", "c4"), 4.0);
		tree.setBranchLengths(lengths);
		assertEquals(0.5, tree.getTime("A"), EPS);
		assertEquals(1.5, tree.getTime("c2"), EPS);
		assertEquals(6.0, tree.getTime("c4"), EPS);
		assertEquals(3.0, tree.getTime("c5"), EPS);
		assertConsistent();
	}

	@Test
	public void testSetBranchLengthsIsAtomic() {
		Map<Edge, Double> lengths = new HashMap<Edge, Double>();
		lengths.put(new Edge("root", "A"), 0.5);
		lengths.put(new Edge("A", "c4"), 1.0);
		try {
			tree.setBranchLengths(lengths);
			fail("expected a TreeValidationException");
		} catch (TreeValidationException e) {
			// expected
		}
		assertEquals(1.0, tree.getBranchLength("root", "A"), 0.0);
		assertConsistent();
	}

	@Test
	public void testSetTimeAdjustsAdjacentEdges() {
		tree.setTime("C", 2.5);
		assertEquals(2.5, tree.getTime("C"), EPS);
		assertEquals(1.5, tree.getBranchLength("B", "C"), EPS);
		assertEquals(0.5, tree.getBranchLength("C", "c4"), EPS);
		assertEquals(3.0, tree.getTime("c4"), EPS);
		assertEquals(1.0, tree.getTime("B"), EPS);
		assertConsistent();
	}

	@Test
	public void testSetTimeOfRoot() {
		tree.setTime("root", 0.5);
		assertEquals(0.5, tree.getBranchLength("root", "A"), EPS);
		assertConsistent();
	}

	@Test
	public void testSetTimeBeforeParent() {
		try {
			tree.setTime("C", 0.5);
			fail("expected a TimeConsistencyException");
		} catch (TimeConsistencyException e) {
			// expected
		}
		assertEquals(2.0, tree.getTime("C"), 0.0);
		assertConsistent();
	}

	@Test(expected = TimeConsistencyException.class)
	public void testSetTimeAfterChild() {
		tree.setTime("C", 3.5);
	}

	@Test
	public void testSetTimes() {
		Map<String, Double> times = new HashMap<String, Double>();
		times.put("A", 0.5);
		times.put("c1", 4.0);
		times.put("not_a_node", 10.0);
		tree.setTimes(times);
		assertEquals(0.5, tree.getBranchLength("root", "A"), EPS);
		assertEquals(3.5, tree.getBranchLength("A", "c1"), EPS);
		assertEquals(1.5, tree.getBranchLength("A", "c2"), EPS);
		assertEquals(3.0, tree.getTime("c5"), EPS);
		assertFalse(tree.getTimes().containsKey("not_a_node"));
		assertConsistent();
	}

	@Test
	public void testSetTimesIsAtomic() {
		Map<String, Double> times = new HashMap<String, Double>();
		times.put("B", 0.5);
		times.put("A", 5.0);
		try {
			tree.setTimes(times);
			fail("expected a TimeConsistencyException");
		} catch (TimeConsistencyException e) {
			// expected
		}
		assertEquals(1.0, tree.getTime("A"), 0.0);
		assertEquals(1.0, tree.getTime("B"), 0.0);
		assertConsistent();
	}

	@Test
	public void testZeroLengthEdgesAllowed() {
		tree.setBranchLength("B", "C", 0.0);
		assertEquals(tree.getTime("B"), tree.getTime("C"), 0.0);
		tree.setTime("c4", 1.0);
		assertEquals(0.0, tree.getBranchLength("C", "c4"), 0.0);
		assertConsistent();
	}

	@Test
	public void testDistancesFollowTimeChanges() {
		assertEquals(5.0, tree.getDistance("c1", "c4"), EPS);
		tree.setBranchLength("root", "A", 3.0);
		assertEquals(7.0, tree.getDistance("c1", "c4"), EPS);
		tree.setTime("c4", 2.0);
		assertEquals(6.0, tree.getDistance("c4", "c1"), EPS);
	}
}
