package autostack.data;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Row-major prediction matrix. Classification predictions hold one probability column per class, regression predictions a single column, and
 * quantile predictions one column per quantile level.
 */
public class Predictions {

	private final ProblemType problemType;
	private final double[][] values;
	private final double[] quantileLevels;

	private Predictions(final ProblemType problemType, final double[][] values, final double[] quantileLevels) {
		super();
		this.problemType = Objects.requireNonNull(problemType);
		this.values = values;
		this.quantileLevels = quantileLevels;
	}

	public static Predictions ofProbabilities(final double[][] probabilities) {
		if (probabilities.length > 0 && probabilities[0].length < 2) {
			throw new IllegalArgumentException("Probabilities need at least two columns.");
		}
		ProblemType type = probabilities.length > 0 && probabilities[0].length > 2 ? ProblemType.MULTICLASS : ProblemType.BINARY;
		return new Predictions(type, copy(probabilities), null);
	}

	public static Predictions ofProbabilities(final ProblemType type, final double[][] probabilities) {
		if (!type.isClassification()) {
			throw new IllegalArgumentException("Probabilities require a classification problem, not " + type);
		}
		return new Predictions(type, copy(probabilities), null);
	}

	public static Predictions ofValues(final double[] values) {
		double[][] column = new double[values.length][1];
		for (int i = 0; i < values.length; i++) {
			column[i][0] = values[i];
		}
		return new Predictions(ProblemType.REGRESSION, column, null);
	}

	public static Predictions ofQuantiles(final double[] quantileLevels, final double[][] values) {
		Objects.requireNonNull(quantileLevels);
		for (double[] row : values) {
			if (row.length != quantileLevels.length) {
				throw new IllegalArgumentException("Expected " + quantileLevels.length + " quantile columns but got " + row.length);
			}
		}
		return new Predictions(ProblemType.QUANTILE, copy(values), Arrays.copyOf(quantileLevels, quantileLevels.length));
	}

	/**
	 * Creates predictions of the same kind as the template, e.g. for averaged or combined predictions.
	 */
	public static Predictions like(final Predictions template, final double[][] values) {
		return new Predictions(template.problemType, copy(values), template.quantileLevels);
	}

	private static double[][] copy(final double[][] values) {
		double[][] copy = new double[values.length][];
		for (int i = 0; i < values.length; i++) {
			copy[i] = Arrays.copyOf(values[i], values[i].length);
		}
		return copy;
	}

	public ProblemType getProblemType() {
		return this.problemType;
	}

	public int getNumRows() {
		return this.values.length;
	}

	public int getNumColumns() {
		return this.values.length == 0 ? (this.quantileLevels != null ? this.quantileLevels.length : 0) : this.values[0].length;
	}

	public double get(final int row, final int column) {
		return this.values[row][column];
	}

	public double[] getRow(final int row) {
		return Arrays.copyOf(this.values[row], this.values[row].length);
	}

	public double[][] toArray() {
		return copy(this.values);
	}

	public double[] getQuantileLevels() {
		return this.quantileLevels != null ? Arrays.copyOf(this.quantileLevels, this.quantileLevels.length) : null;
	}

	public boolean isFinite() {
		for (double[] row : this.values) {
			for (double v : row) {
				if (!Double.isFinite(v)) {
					return false;
				}
			}
		}
		return true;
	}

	/**
	 * @return for each row the index of the most probable class (first one on ties)
	 */
	public int[] getMostLikelyClasses() {
		if (!this.problemType.isClassification()) {
			throw new IllegalStateException("Class decisions are only defined for classification predictions.");
		}
		int[] decisions = new int[this.values.length];
		for (int r = 0; r < this.values.length; r++) {
			int best = 0;
			for (int c = 1; c < this.values[r].length; c++) {
				if (this.values[r][c] > this.values[r][best]) {
					best = c;
				}
			}
			decisions[r] = best;
		}
		return decisions;
	}

	public Predictions selectQuantiles(final double[] levels) {
		if (this.problemType != ProblemType.QUANTILE) {
			throw new IllegalStateException("Not a quantile prediction.");
		}
		int[] columns = new int[levels.length];
		for (int i = 0; i < levels.length; i++) {
			columns[i] = -1;
			for (int j = 0; j < this.quantileLevels.length; j++) {
				if (Double.compare(this.quantileLevels[j], levels[i]) == 0) {
					columns[i] = j;
				}
			}
			if (columns[i] < 0) {
				throw new IllegalArgumentException("Quantile level " + levels[i] + " is not predicted. Levels are " + Arrays.toString(this.quantileLevels));
			}
		}
		double[][] selected = new double[this.values.length][levels.length];
		for (int r = 0; r < this.values.length; r++) {
			for (int i = 0; i < levels.length; i++) {
				selected[r][i] = this.values[r][columns[i]];
			}
		}
		return new Predictions(ProblemType.QUANTILE, selected, Arrays.copyOf(levels, levels.length));
	}

	/**
	 * Element-wise mean of predictions of the same shape.
	 */
	public static Predictions average(final List<Predictions> predictions) {
		if (predictions.isEmpty()) {
			throw new IllegalArgumentException("Cannot average an empty list of predictions.");
		}
		Predictions first = predictions.get(0);
		double[][] sum = new double[first.getNumRows()][first.getNumColumns()];
		for (Predictions p : predictions) {
			if (p.getNumRows() != first.getNumRows() || p.getNumColumns() != first.getNumColumns()) {
				throw new IllegalArgumentException("Cannot average predictions of different shapes.");
			}
			for (int r = 0; r < sum.length; r++) {
				for (int c = 0; c < sum[r].length; c++) {
					sum[r][c] += p.values[r][c];
				}
			}
		}
		for (double[] row : sum) {
			for (int c = 0; c < row.length; c++) {
				row[c] /= predictions.size();
			}
		}
		return new Predictions(first.problemType, sum, first.quantileLevels);
	}

	@Override
	public String toString() {
		return "Predictions [problemType=" + this.problemType + ", rows=" + this.values.length + ", columns=" + this.getNumColumns() + (this.quantileLevels != null ? ", quantiles=" + Arrays.toString(this.quantileLevels) : "") + "]";
	}
}
