package autostack.data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Immutable table of named columns. Nominal columns store the index of a value in the list declared for that column; missing values are NaN.
 */
public class Dataset {

	private final ImmutableList<String> columnNames;
	private final ImmutableMap<String, ImmutableList<String>> nominalValues;
	private final Map<String, Integer> columnIndexes = new HashMap<>();
	private final double[][] values;
	private final double[] sampleWeights;

	public Dataset(final List<String> columnNames, final double[][] values) {
		this(columnNames, values, ImmutableMap.of(), null);
	}

	public Dataset(final List<String> columnNames, final double[][] values, final Map<String, List<String>> nominalValues, final double[] sampleWeights) {
		this(columnNames, deepCopy(values), copyNominalValues(nominalValues), sampleWeights != null ? Arrays.copyOf(sampleWeights, sampleWeights.length) : null, true);
	}

	/* internal constructor that takes ownership of the arrays */
	private Dataset(final List<String> columnNames, final double[][] values, final ImmutableMap<String, ImmutableList<String>> nominalValues, final double[] sampleWeights, final boolean validate) {
		super();
		Objects.requireNonNull(columnNames, "Column names must not be null.");
		Objects.requireNonNull(values, "Values must not be null.");
		this.columnNames = ImmutableList.copyOf(columnNames);
		this.nominalValues = nominalValues;
		this.values = values;
		this.sampleWeights = sampleWeights;
		for (int i = 0; i < this.columnNames.size(); i++) {
			if (this.columnIndexes.put(this.columnNames.get(i), i) != null) {
				throw new IllegalArgumentException("Duplicate column name " + this.columnNames.get(i));
			}
		}
		if (validate) {
			this.validate();
		}
	}

	private void validate() {
		for (int r = 0; r < this.values.length; r++) {
			if (this.values[r].length != this.columnNames.size()) {
				throw new IllegalArgumentException("Row " + r + " has " + this.values[r].length + " values but the table has " + this.columnNames.size() + " columns.");
			}
		}
		for (Map.Entry<String, ImmutableList<String>> entry : this.nominalValues.entrySet()) {
			Integer col = this.columnIndexes.get(entry.getKey());
			if (col == null) {
				throw new IllegalArgumentException("Nominal values declared for unknown column " + entry.getKey());
			}
			int numValues = entry.getValue().size();
			for (double[] row : this.values) {
				double v = row[col];
				if (!Double.isNaN(v) && (v < 0 || v >= numValues || v != Math.rint(v))) {
					throw new IllegalArgumentException("Value " + v + " of nominal column " + entry.getKey() + " is not an index into its " + numValues + " values.");
				}
			}
		}
		if (this.sampleWeights != null) {
			if (this.sampleWeights.length != this.values.length) {
				throw new IllegalArgumentException("Got " + this.sampleWeights.length + " sample weights for " + this.values.length + " rows.");
			}
			for (double w : this.sampleWeights) {
				if (!(w >= 0) || Double.isInfinite(w)) {
					throw new IllegalArgumentException("Sample weights must be finite and non-negative but found " + w);
				}
			}
		}
	}

	private static double[][] deepCopy(final double[][] values) {
		Objects.requireNonNull(values, "Values must not be null.");
		double[][] copy = new double[values.length][];
		for (int i = 0; i < values.length; i++) {
			copy[i] = Arrays.copyOf(values[i], values[i].length);
		}
		return copy;
	}

	private static ImmutableMap<String, ImmutableList<String>> copyNominalValues(final Map<String, List<String>> nominalValues) {
		ImmutableMap.Builder<String, ImmutableList<String>> builder = ImmutableMap.builder();
		if (nominalValues != null) {
			nominalValues.forEach((k, v) -> builder.put(k, ImmutableList.copyOf(v)));
		}
		return builder.build();
	}

	public int getNumRows() {
		return this.values.length;
	}

	public int getNumColumns() {
		return this.columnNames.size();
	}

	public boolean isEmpty() {
		return this.values.length == 0;
	}

	public List<String> getColumnNames() {
		return this.columnNames;
	}

	public boolean hasColumn(final String name) {
		return this.columnIndexes.containsKey(name);
	}

	public int getColumnIndex(final String name) {
		Integer index = this.columnIndexes.get(name);
		if (index == null) {
			throw new IllegalArgumentException("No column with name " + name + ". Columns are " + this.columnNames);
		}
		return index;
	}

	public boolean isNominal(final String column) {
		return this.nominalValues.containsKey(column);
	}

	public List<String> getNominalValues(final String column) {
		ImmutableList<String> declared = this.nominalValues.get(column);
		if (declared == null) {
			throw new IllegalArgumentException("Column " + column + " is not nominal.");
		}
		return declared;
	}

	public Map<String, List<String>> getNominalValues() {
		return new LinkedHashMap<>(this.nominalValues);
	}

	public double getValue(final int row, final int column) {
		return this.values[row][column];
	}

	public double[] getRow(final int row) {
		return Arrays.copyOf(this.values[row], this.values[row].length);
	}

	public double[] getColumn(final String name) {
		int col = this.getColumnIndex(name);
		double[] column = new double[this.values.length];
		for (int r = 0; r < this.values.length; r++) {
			column[r] = this.values[r][col];
		}
		return column;
	}

	public boolean hasSampleWeights() {
		return this.sampleWeights != null;
	}

	public double getSampleWeight(final int row) {
		return this.sampleWeights != null ? this.sampleWeights[row] : 1.0;
	}

	public double[] getSampleWeights() {
		return this.sampleWeights != null ? Arrays.copyOf(this.sampleWeights, this.sampleWeights.length) : null;
	}

	public Dataset selectRows(final int[] rows) {
		double[][] selected = new double[rows.length][];
		double[] weights = this.sampleWeights != null ? new double[rows.length] : null;
		for (int i = 0; i < rows.length; i++) {
			selected[i] = this.values[rows[i]];
			if (weights != null) {
				weights[i] = this.sampleWeights[rows[i]];
			}
		}
		/* rows are never mutated, so sharing them between tables is safe */
		return new Dataset(this.columnNames, selected, this.nominalValues, weights, false);
	}

	public Dataset dropColumn(final String name) {
		int col = this.getColumnIndex(name);
		List<String> names = new ArrayList<>(this.columnNames);
		names.remove(col);
		double[][] reduced = new double[this.values.length][];
		for (int r = 0; r < this.values.length; r++) {
			double[] row = new double[names.size()];
			System.arraycopy(this.values[r], 0, row, 0, col);
			System.arraycopy(this.values[r], col + 1, row, col, names.size() - col);
			reduced[r] = row;
		}
		Map<String, ImmutableList<String>> nominal = new LinkedHashMap<>(this.nominalValues);
		nominal.remove(name);
		return new Dataset(names, reduced, ImmutableMap.copyOf(nominal), this.sampleWeights, false);
	}

	/**
	 * Projects the table onto the given columns in the given order.
	 */
	public Dataset project(final List<String> columns) {
		int[] indexes = columns.stream().mapToInt(this::getColumnIndex).toArray();
		double[][] projected = new double[this.values.length][indexes.length];
		for (int r = 0; r < this.values.length; r++) {
			for (int c = 0; c < indexes.length; c++) {
				projected[r][c] = this.values[r][indexes[c]];
			}
		}
		Map<String, ImmutableList<String>> nominal = new LinkedHashMap<>();
		for (String column : columns) {
			if (this.nominalValues.containsKey(column)) {
				nominal.put(column, this.nominalValues.get(column));
			}
		}
		return new Dataset(columns, projected, ImmutableMap.copyOf(nominal), this.sampleWeights, false);
	}

	/**
	 * Re-encodes a nominal column against another value list, matching values by name. Values that the target list does not declare become
	 * missing.
	 */
	public Dataset recodeNominal(final String column, final List<String> targetValues) {
		List<String> declared = this.getNominalValues(column);
		if (declared.equals(targetValues)) {
			return this;
		}
		int col = this.getColumnIndex(column);
		double[] mapping = new double[declared.size()];
		for (int v = 0; v < mapping.length; v++) {
			int target = targetValues.indexOf(declared.get(v));
			mapping[v] = target >= 0 ? target : Double.NaN;
		}
		double[][] recoded = new double[this.values.length][];
		for (int r = 0; r < this.values.length; r++) {
			recoded[r] = Arrays.copyOf(this.values[r], this.values[r].length);
			double v = recoded[r][col];
			recoded[r][col] = Double.isNaN(v) ? Double.NaN : mapping[(int) v];
		}
		Map<String, ImmutableList<String>> nominal = new LinkedHashMap<>(this.nominalValues);
		nominal.put(column, ImmutableList.copyOf(targetValues));
		return new Dataset(this.columnNames, recoded, ImmutableMap.copyOf(nominal), this.sampleWeights, false);
	}

	/**
	 * Appends numeric columns.
	 *
	 * @param names names of the new columns
	 * @param columnValues values indexed by [row][new column]
	 */
	public Dataset appendColumns(final List<String> names, final double[][] columnValues) {
		if (columnValues.length != this.values.length) {
			throw new IllegalArgumentException("Cannot append " + columnValues.length + " rows to a table with " + this.values.length + " rows.");
		}
		Set<String> seen = new HashSet<>(this.columnNames);
		for (String name : names) {
			if (!seen.add(name)) {
				throw new IllegalArgumentException("Column " + name + " already exists.");
			}
		}
		List<String> allNames = new ArrayList<>(this.columnNames);
		allNames.addAll(names);
		double[][] extended = new double[this.values.length][];
		for (int r = 0; r < this.values.length; r++) {
			if (columnValues[r].length != names.size()) {
				throw new IllegalArgumentException("Row " + r + " of the appended block has " + columnValues[r].length + " values, expected " + names.size());
			}
			double[] row = Arrays.copyOf(this.values[r], allNames.size());
			System.arraycopy(columnValues[r], 0, row, this.columnNames.size(), names.size());
			extended[r] = row;
		}
		return new Dataset(allNames, extended, this.nominalValues, this.sampleWeights, false);
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String toString() {
		return "Dataset [rows=" + this.values.length + ", columns=" + this.columnNames + ", nominal=" + this.nominalValues.keySet() + ", weighted=" + (this.sampleWeights != null) + "]";
	}

	/**
	 * Column-wise construction of a table.
	 */
	public static class Builder {
		private final Map<String, double[]> columns = new LinkedHashMap<>();
		private final Map<String, List<String>> nominal = new HashMap<>();
		private double[] weights;
		private int numRows = -1;

		public Builder numericColumn(final String name, final double... columnValues) {
			this.checkLength(name, columnValues.length);
			this.columns.put(name, Arrays.copyOf(columnValues, columnValues.length));
			return this;
		}

		public Builder nominalColumn(final String name, final Collection<String> declaredValues, final String... entries) {
			this.checkLength(name, entries.length);
			List<String> valueList = new ArrayList<>(declaredValues);
			double[] encoded = new double[entries.length];
			for (int i = 0; i < entries.length; i++) {
				if (entries[i] == null) {
					encoded[i] = Double.NaN;
				} else {
					int index = valueList.indexOf(entries[i]);
					if (index < 0) {
						throw new IllegalArgumentException("Value " + entries[i] + " is not declared for column " + name);
					}
					encoded[i] = index;
				}
			}
			this.columns.put(name, encoded);
			this.nominal.put(name, valueList);
			return this;
		}

		public Builder sampleWeights(final double... sampleWeights) {
			this.weights = Arrays.copyOf(sampleWeights, sampleWeights.length);
			return this;
		}

		private void checkLength(final String name, final int length) {
			if (this.columns.containsKey(name)) {
				throw new IllegalArgumentException("Column " + name + " defined twice.");
			}
			if (this.numRows >= 0 && this.numRows != length) {
				throw new IllegalArgumentException("Column " + name + " has " + length + " rows but previous columns have " + this.numRows);
			}
			this.numRows = length;
		}

		public Dataset build() {
			int rows = Math.max(0, this.numRows);
			List<String> names = new ArrayList<>(this.columns.keySet());
			double[][] table = new double[rows][names.size()];
			for (int c = 0; c < names.size(); c++) {
				double[] column = this.columns.get(names.get(c));
				for (int r = 0; r < rows; r++) {
					table[r][c] = column[r];
				}
			}
			return new Dataset(names, table, this.nominal, this.weights);
		}
	}
}
