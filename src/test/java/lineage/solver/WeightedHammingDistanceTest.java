package lineage.solver;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lineage.exceptions.TreeValidationException;
import lineage.tree.CharacterState;

import org.junit.Before;
import org.junit.Test;

public class WeightedHammingDistanceTest {

	private static final double EPS = 1e-9;

	protected WeightedHammingDistance whd;
	protected Map<Integer, Map<Integer, Double>> priors;

	@Before
	public void setUp() {
		whd = new WeightedHammingDistance();
		priors = new HashMap<Integer, Map<Integer, Double>>();
		for (int c = 0; c < 3; c++) {
			Map<Integer, Double> p = new HashMap<Integer, Double>();
			p.put(1, 0.5);
			p.put(2, 0.25);
			p.put(3, 0.1);
			priors.put(c, p);
		}
	}

	@Test
	public void testUnweighted() {
		assertEquals(0.0, whd.dissimilarity(new int[] {1, 0, 3}, new int[] {1, 0, 3}, -1, null), 0.0);
		// 0 vs 2 costs 1, missing skipped
		assertEquals(0.5, whd.dissimilarity(new int[] {1, 0, -1}, new int[] {1, 2, 3}, -1, null), EPS);
		// 1 vs 2 costs 2, 2 vs 0 costs 1
		assertEquals(1.0, whd.dissimilarity(new int[] {1, 2, 3}, new int[] {2, 0, 3}, -1, null), EPS);
	}

	@Test
	public void testNothingPresent() {
		assertEquals(0.0, whd.dissimilarity(new int[] {-1, 1}, new int[] {2, -1}, -1, null), 0.0);
	}

	@Test
	public void testWeighted() {
		Map<Integer, Map<Integer, Double>> weights = PriorTransformation.INVERSE.transformPriors(priors);
		// 0 vs 2 costs 1/0.25
		assertEquals(2.0, whd.dissimilarity(new int[] {1, 0, -1}, new int[] {1, 2, 3}, -1, weights), EPS);
		// (2 + 4) + 4
		assertEquals(10.0 / 3, whd.dissimilarity(new int[] {1, 2, 3}, new int[] {2, 0, 3}, -1, weights), EPS);
	}

	@Test
	public void testSharedIndelsCostNothingWhenWeighted() {
		Map<Integer, Map<Integer, Double>> weights = PriorTransformation.NEGATIVE_LOG.transformPriors(priors);
		assertEquals(0.0, whd.dissimilarity(new int[] {1, 3, 0}, new int[] {1, 3, 0}, -1, weights), 0.0);
		// only character 2 differs: uncut against state 2
		assertEquals(-Math.log(0.25) / 3, whd.dissimilarity(new int[] {1, 3, 0}, new int[] {1, 3, 2}, -1, weights), EPS);
	}

	@Test
	public void testHamming() {
		assertEquals(2.0, new HammingDistance().dissimilarity(new int[] {1, 0, -1}, new int[] {1, 2, 3}, -1, null), 0.0);
	}

	@Test
	public void testPriorTransformations() {
		assertEquals(Math.log(2), PriorTransformation.NEGATIVE_LOG.transform(0.5), EPS);
		assertEquals(4.0, PriorTransformation.INVERSE.transform(0.25), EPS);
		assertEquals(2.0, PriorTransformation.SQUARE_ROOT_INVERSE.transform(0.25), EPS);
		assertSame(PriorTransformation.SQUARE_ROOT_INVERSE, PriorTransformation.forName("square_root_inverse"));
		assertEquals(10.0, PriorTransformation.INVERSE.transformPriors(priors).get(2).get(3), EPS);
	}

	@Test(expected = TreeValidationException.class)
	public void testUnknownTransformation() {
		PriorTransformation.forName("log");
	}

	@Test
	public void testClusterDissimilarity() {
		ClusterDissimilarity cd = new ClusterDissimilarity(whd);
		List<CharacterState> a = Arrays.asList(CharacterState.ambiguous(1, 2), CharacterState.of(0), CharacterState.missing());
		List<CharacterState> b = Arrays.asList(CharacterState.of(1), CharacterState.of(0), CharacterState.of(3));
		// character 0 averages 0 and 2
		assertEquals(0.5, cd.dissimilarity(a, b, -1, null), EPS);
		assertEquals(cd.dissimilarity(a, b, -1, null), cd.dissimilarity(b, a, -1, null), EPS);
	}

	@Test
	public void testClusterDissimilarityMatchesScalarCase() {
		ClusterDissimilarity cd = new ClusterDissimilarity(whd);
		Map<Integer, Map<Integer, Double>> weights = PriorTransformation.INVERSE.transformPriors(priors);
		int[] s1 = new int[] {1, 2, 3};
		int[] s2 = new int[] {2, 0, 3};
		assertEquals(whd.dissimilarity(s1, s2, -1, weights),
				cd.dissimilarity(CharacterState.fromInts(s1, -1), CharacterState.fromInts(s2, -1), -1, weights), EPS);
	}
}
