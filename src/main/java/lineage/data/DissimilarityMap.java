package lineage.data;

import gnu.trove.map.hash.TObjectDoubleHashMap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lineage.exceptions.TreeValidationException;

/**
 * A symmetric table of pairwise dissimilarities between samples. Setting (a, b) also sets
 * (b, a). Samples keep the order in which they were added.
 */
public class DissimilarityMap {

	private final LinkedHashMap<String, TObjectDoubleHashMap<String>> rows;

	public DissimilarityMap() {
		this.rows = new LinkedHashMap<String, TObjectDoubleHashMap<String>>();
	}

	/**
	 * Creates a map over `samples` with 0 on the diagonal and +Infinity elsewhere.
	 */
	public DissimilarityMap(Collection<String> samples) {
		this();
		for (String s : samples) {
			addSample(s);
		}
	}

	public DissimilarityMap copy() {
		DissimilarityMap dm = new DissimilarityMap();
		for (Map.Entry<String, TObjectDoubleHashMap<String>> e : this.rows.entrySet()) {
			dm.rows.put(e.getKey(), new TObjectDoubleHashMap<String>(e.getValue()));
		}
		return dm;
	}

	/**
	 * Adds a sample at +Infinity from every other sample. Does nothing if it is present.
	 */
	public void addSample(String sample) {
		if (this.rows.containsKey(sample)) {
			return;
		}
		TObjectDoubleHashMap<String> row = new TObjectDoubleHashMap<String>();
		for (Map.Entry<String, TObjectDoubleHashMap<String>> e : this.rows.entrySet()) {
			e.getValue().put(sample, Double.POSITIVE_INFINITY);
			row.put(e.getKey(), Double.POSITIVE_INFINITY);
		}
		row.put(sample, 0.0);
		this.rows.put(sample, row);
	}

	public void removeSample(String sample) {
		if (this.rows.remove(sample) == null) {
			return;
		}
		for (TObjectDoubleHashMap<String> row : this.rows.values()) {
			row.remove(sample);
		}
	}

	/**
	 * @return a copy of this map whose samples are renamed through `relabelMap`
	 */
	public DissimilarityMap relabel(Map<String, String> relabelMap) {
		DissimilarityMap dm = new DissimilarityMap();
		for (Map.Entry<String, TObjectDoubleHashMap<String>> e : this.rows.entrySet()) {
			TObjectDoubleHashMap<String> row = new TObjectDoubleHashMap<String>();
			for (String other : e.getValue().keySet()) {
				row.put(relabelMap.containsKey(other) ? relabelMap.get(other) : other, e.getValue().get(other));
			}
			dm.rows.put(relabelMap.containsKey(e.getKey()) ? relabelMap.get(e.getKey()) : e.getKey(), row);
		}
		return dm;
	}

	/**
	 * Sets the dissimilarity of the unordered pair (a, b).
	 *
	 * @throws TreeValidationException if either sample is not in the map
	 */
	public void set(String a, String b, double d) {
		checkSample(a);
		checkSample(b);
		this.rows.get(a).put(b, d);
		this.rows.get(b).put(a, d);
	}

	/**
	 * @throws TreeValidationException if either sample is not in the map
	 */
	public double get(String a, String b) {
		checkSample(a);
		checkSample(b);
		return this.rows.get(a).get(b);
	}

	private void checkSample(String s) {
		if (!this.rows.containsKey(s)) {
			throw new TreeValidationException("Sample " + s + " is not in the dissimilarity map.");
		}
	}

	public boolean hasSample(String sample) {
		return this.rows.containsKey(sample);
	}

	public List<String> getSamples() {
		return new ArrayList<String>(this.rows.keySet());
	}

	public Set<String> sampleSet() {
		return Collections.unmodifiableSet(this.rows.keySet());
	}

	public int size() {
		return this.rows.size();
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof DissimilarityMap)) {
			return false;
		}
		return this.rows.equals(((DissimilarityMap) o).rows);
	}

	@Override
	public int hashCode() {
		return this.rows.hashCode();
	}
}
