package lineage.tree;

import static org.junit.Assert.*;

import java.util.Arrays;

import lineage.exceptions.TreeParseException;

import org.junit.Test;

public class TreeTopologyTest {

	@Test
	public void testJsonRoundTrip() throws Exception {
		TreeTopology t = new TreeTopology();
		t.addEdge("r", "a", 0.5);
		t.addEdge("r", "b");
		TreeTopology back = TreeTopology.fromJSON(t.toJSONString());
		assertEquals(Arrays.asList("r", "a", "b"), back.getNodes());
		assertEquals(t.getEdges(), back.getEdges());
		assertEquals(0.5, back.getBranchLength(new Edge("r", "a")), 0.0);
		assertFalse(back.hasBranchLength(new Edge("r", "b")));
	}

	@Test
	public void testIntegerLengthsAndIds() throws Exception {
		TreeTopology t = TreeTopology.fromJSON("{\"edges\":[{\"parent\":0,\"child\":1,\"length\":2}]}");
		assertEquals(Arrays.asList("0", "1"), t.getNodes());
		assertEquals(2.0, t.getBranchLength(new Edge("0", "1")), 0.0);
	}

	@Test
	public void testExportFromTree() throws Exception {
		LineageTree tree = new LineageTree(LineageTreeTopologyTest.exampleTopology());
		tree.setBranchLength("B", "C", 0.5);
		TreeTopology t = TreeTopology.fromJSON(tree.getTreeTopology().toJSONString());
		LineageTree copy = new LineageTree(t);
		assertEquals(tree.getTimes(), copy.getTimes());
		assertEquals(tree.getNewick(true), copy.getNewick(true));
	}

	@Test(expected = TreeParseException.class)
	public void testInvalidJson() throws Exception {
		TreeTopology.fromJSON("{not json");
	}

	@Test(expected = TreeParseException.class)
	public void testMissingEdges() throws Exception {
		TreeTopology.fromJSON("{\"nodes\":[\"a\"]}");
	}
}
