package lineage.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Auxiliary per-row data (e.g. per-cell cluster or tissue labels, per-character missing
 * proportions) stored as named columns. Cells may be null.
 */
public class MetadataTable {

	private final List<String> columns;
	private final LinkedHashMap<String, HashMap<String, Object>> rows;

	public MetadataTable(List<String> columns) {
		this.columns = new ArrayList<String>(columns);
		this.rows = new LinkedHashMap<String, HashMap<String, Object>>();
	}

	public MetadataTable copy() {
		MetadataTable mt = new MetadataTable(this.columns);
		for (Map.Entry<String, HashMap<String, Object>> e : this.rows.entrySet()) {
			mt.rows.put(e.getKey(), new HashMap<String, Object>(e.getValue()));
		}
		return mt;
	}

	/**
	 * Adds a row whose cells are all null. Does nothing if the row exists.
	 */
	public void addEmptyRow(String row) {
		if (!this.rows.containsKey(row)) {
			this.rows.put(row, new HashMap<String, Object>());
		}
	}

	public void removeRow(String row) {
		this.rows.remove(row);
	}

	/**
	 * @return a copy of this table whose rows are renamed through `relabelMap`
	 */
	public MetadataTable relabel(Map<String, String> relabelMap) {
		MetadataTable mt = new MetadataTable(this.columns);
		for (Map.Entry<String, HashMap<String, Object>> e : this.rows.entrySet()) {
			String name = relabelMap.containsKey(e.getKey()) ? relabelMap.get(e.getKey()) : e.getKey();
			mt.rows.put(name, new HashMap<String, Object>(e.getValue()));
		}
		return mt;
	}

	/**
	 * Sets a cell, adding the row if needed.
	 *
	 * @throws IllegalArgumentException if the column is unknown
	 */
	public void put(String row, String column, Object value) {
		if (!this.columns.contains(column)) {
			throw new IllegalArgumentException("Unknown column " + column);
		}
		addEmptyRow(row);
		this.rows.get(row).put(column, value);
	}

	/**
	 * @return the value of the cell, or null if the row or the cell is empty
	 */
	public Object get(String row, String column) {
		HashMap<String, Object> r = this.rows.get(row);
		return r == null ? null : r.get(column);
	}

	public boolean hasRow(String row) {
		return this.rows.containsKey(row);
	}

	public List<String> getRowNames() {
		return new ArrayList<String>(this.rows.keySet());
	}

	public Set<String> rowSet() {
		return Collections.unmodifiableSet(this.rows.keySet());
	}

	public List<String> getColumns() {
		return new ArrayList<String>(this.columns);
	}

	public int size() {
		return this.rows.size();
	}
}
