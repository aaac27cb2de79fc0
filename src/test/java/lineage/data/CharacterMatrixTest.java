package lineage.data;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lineage.exceptions.TreeValidationException;
import lineage.tree.CharacterState;

import org.junit.Before;
import org.junit.Test;

public class CharacterMatrixTest {

	protected CharacterMatrix cm;

	@Before
	public void buildMatrix() {
		Map<String, int[]> m = new LinkedHashMap<String, int[]>();
		m.put("s1", new int[] {0, 1, -1});
		m.put("s2", new int[] {2, 1, 0});
		cm = CharacterMatrix.fromInts(m, -1);
	}

	@Test
	public void testShape() {
		assertEquals(2, cm.getCellCount());
		assertEquals(3, cm.getCharacterCount());
		assertEquals(Arrays.asList("s1", "s2"), cm.getSamples());
		assertTrue(cm.get("s1", 2).isMissing());
		assertTrue(Arrays.equals(new int[] {0, 1, -1}, cm.getIntRow("s1", -1)));
		assertTrue(Arrays.equals(new int[] {0, 1, 9}, cm.getIntRow("s1", 9)));
		assertNull(cm.getRow("s3"));
	}

	@Test
	public void testRowsAreCopies() {
		List<CharacterState> row = cm.getRow("s1");
		row.set(0, CharacterState.of(7));
		assertEquals(CharacterState.of(0), cm.get("s1", 0));
		assertEquals(cm, cm.copy());
	}

	@Test(expected = TreeValidationException.class)
	public void testRowLengthChecked() {
		cm.putRow("s3", CharacterState.fromInts(new int[] {1, 2}, -1));
	}

	@Test
	public void testRelabelAndRemove() {
		Map<String, String> relabel = new HashMap<String, String>();
		relabel.put("s1", "x");
		CharacterMatrix r = cm.relabel(relabel);
		assertEquals(Arrays.asList("x", "s2"), r.getSamples());
		assertEquals(cm.getRow("s1"), r.getRow("x"));
		r.removeRow("x");
		assertEquals(1, r.getCellCount());
		assertEquals(2, cm.getCellCount());
	}

	@Test
	public void testAmbiguity() {
		assertFalse(cm.isAmbiguous());
		cm.putRow("s3", Arrays.asList(CharacterState.ambiguous(1, 2), CharacterState.of(1), CharacterState.missing()));
		assertTrue(cm.isAmbiguous());
	}

	@Test(expected = IllegalStateException.class)
	public void testAmbiguousRowHasNoIntEncoding() {
		cm.putRow("s3", Arrays.asList(CharacterState.ambiguous(1, 2), CharacterState.of(1), CharacterState.missing()));
		cm.getIntRow("s3", -1);
	}

	@Test
	public void testMetadataTable() {
		MetadataTable mt = new MetadataTable(Arrays.asList("cluster", "tissue"));
		mt.put("s1", "cluster", 3);
		mt.addEmptyRow("s2");
		assertEquals(3, mt.get("s1", "cluster"));
		assertNull(mt.get("s1", "tissue"));
		assertNull(mt.get("s2", "cluster"));
		assertEquals(2, mt.size());
		mt.removeRow("s1");
		assertFalse(mt.hasRow("s1"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMetadataUnknownColumn() {
		new MetadataTable(Arrays.asList("cluster")).put("s1", "bogus", 1);
	}
}
