package lineage.tree;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import lineage.data.CharacterMatrix;
import lineage.exceptions.TreeNotInitializedException;
import lineage.exceptions.TreeValidationException;

import org.junit.Before;
import org.junit.Test;

public class AncestralReconstructionTest {

	private static final CharacterState M = CharacterState.missing();

	protected LineageTree tree;

	@Before
	public void buildTree() {
		tree = new LineageTree(CharacterMatrix.fromInts(CharacterStateTest.exampleMatrix(), -1),
				LineageTreeTopologyTest.exampleTopology());
	}

	private static CharacterState s(int v) {
		return CharacterState.of(v);
	}

	@Test
	public void testLcaCharacters() {
		List<CharacterState> a = Arrays.asList(s(1), s(0), s(2), M);
		List<CharacterState> b = Arrays.asList(s(1), s(3), M, M);
		assertEquals(Arrays.asList(s(1), M, M, M), CaminSokalParsimony.lcaCharacters(Arrays.asList(a, b)));
		assertEquals(a, CaminSokalParsimony.lcaCharacters(Arrays.asList(a)));
	}

	@Test
	public void testAmbiguousChildrenMustMatchAsMultisets() {
		List<CharacterState> a = Arrays.asList(CharacterState.ambiguous(1, 2));
		List<CharacterState> b = Arrays.asList(CharacterState.ambiguous(2, 1));
		assertEquals(a, CaminSokalParsimony.lcaCharacters(Arrays.asList(a, b)));
	}

	@Test(expected = TreeValidationException.class)
	public void testLcaCharactersLengthMismatch() {
		CaminSokalParsimony.lcaCharacters(Arrays.asList(Arrays.asList(s(1)), Arrays.asList(s(1), s(2))));
	}

	@Test
	public void testReconstruct() {
		tree.reconstructAncestralCharacters();
		assertEquals(Arrays.asList(s(2), s(0), s(3)), tree.getCharacterStates("C"));
		assertEquals(Arrays.asList(M, s(0), s(3)), tree.getCharacterStates("B"));
		assertEquals(Arrays.asList(s(1), M, M), tree.getCharacterStates("A"));
		assertEquals(Arrays.asList(M, M, M), tree.getCharacterStates("root"));
		// leaves untouched
		assertEquals(CharacterState.fromInts(new int[] {1, 0, -1}, -1), tree.getCharacterStates("c1"));
	}

	@Test
	public void testParentAgreesWithEveryChild() {
		tree.reconstructAncestralCharacters();
		for (String n : tree.getInternalNodes()) {
			List<CharacterState> parent = tree.getCharacterStates(n);
			for (int i = 0; i < parent.size(); i++) {
				if (parent.get(i).isMissing()) {
					continue;
				}
				for (String c : tree.getChildren(n)) {
					assertEquals(parent.get(i), tree.getCharacterStates(c).get(i));
				}
			}
		}
	}

	@Test
	public void testMutationsAlongEdge() {
		tree.reconstructAncestralCharacters();
		List<Mutation> mutations = tree.getMutationsAlongEdge("A", "c2");
		assertEquals(Arrays.asList(new Mutation(1, s(2)), new Mutation(2, s(3))), mutations);
		assertTrue(tree.getMutationsAlongEdge("C", "c5").isEmpty());
	}

	@Test(expected = TreeNotInitializedException.class)
	public void testReconstructNeedsLeafStates() {
		new LineageTree(LineageTreeTopologyTest.exampleTopology()).reconstructAncestralCharacters();
	}

	@Test
	public void testCollapseMutationlessEdges() {
		Map<String, int[]> m = CharacterStateTest.exampleMatrix();
		m.put("c3", new int[] {2, 0, 3});
		tree.initializeCharacterStatesAtLeaves(m);
		tree.collapseMutationlessEdges(true);

		assertFalse(tree.hasNode("C"));
		assertEquals(Arrays.asList("c3", "c4", "c5"), tree.getChildren("B"));
		assertEquals(2.0, tree.getBranchLength("B", "c4"), 0.0);
		assertEquals(3.0, tree.getTime("c4"), 0.0);
		assertEquals(5, tree.getLeaves().size());
		assertEquals(5, tree.getCurrentCharacterMatrix().getCellCount());
		TimeConsistencyTest.assertConsistent(tree);
	}

	@Test
	public void testCollapseMutationlessEdgesKeepsLeaves() {
		Map<String, int[]> m = CharacterStateTest.exampleMatrix();
		m.put("c1", new int[] {1, 2, 3});
		tree.initializeCharacterStatesAtLeaves(m);
		tree.collapseMutationlessEdges(true);
		// A equals both of its children but they are leaves
		assertTrue(tree.hasNode("A"));
		assertEquals(Arrays.asList("c1", "c2"), tree.getChildren("A"));
	}

	@Test
	public void testCollapseMutationlessEdgesWithGivenStates() {
		tree.setCharacterStates("root", 0, 0, 0);
		tree.setCharacterStates("B", 0, 0, 0);
		tree.setCharacterStates("A", 1, 0, 0);
		tree.setCharacterStates("C", 2, 0, 3);
		tree.collapseMutationlessEdges(false);
		assertFalse(tree.hasNode("B"));
		assertEquals(Arrays.asList("A", "c3", "C"), tree.getChildren("root"));
		assertEquals(2.0, tree.getTime("C"), 0.0);
		assertEquals("root", tree.getParent("C"));
		TimeConsistencyTest.assertConsistent(tree);
	}
}
