package autostack.stacking;

import java.util.BitSet;

import autostack.data.Predictions;

/**
 * Collects held-out predictions of all folds of all repetitions. Within a repetition, every row must be predicted exactly once; the final
 * out-of-fold prediction of a row is the average over repetitions.
 */
public class OofAccumulator {

	private final int numRows;
	private final int numRepetitions;
	private final BitSet[] covered;
	private double[][] sum;
	private Predictions template;

	public OofAccumulator(final int numRows, final int numRepetitions) {
		super();
		this.numRows = numRows;
		this.numRepetitions = numRepetitions;
		this.covered = new BitSet[numRepetitions];
		for (int i = 0; i < numRepetitions; i++) {
			this.covered[i] = new BitSet(numRows);
		}
	}

	public void add(final int repetition, final int[] rows, final Predictions predictions) {
		if (predictions == null || predictions.getNumRows() != rows.length) {
			throw new IllegalArgumentException("Expected predictions for " + rows.length + " held-out rows.");
		}
		if (this.sum == null) {
			this.sum = new double[this.numRows][predictions.getNumColumns()];
			this.template = predictions;
		} else if (predictions.getNumColumns() != this.template.getNumColumns()) {
			throw new IllegalArgumentException("Fold predictions have " + predictions.getNumColumns() + " columns, previous folds had " + this.template.getNumColumns());
		}
		for (int i = 0; i < rows.length; i++) {
			int row = rows[i];
			if (this.covered[repetition].get(row)) {
				throw new IllegalStateException("Row " + row + " has already been predicted in repetition " + repetition);
			}
			this.covered[repetition].set(row);
			for (int c = 0; c < predictions.getNumColumns(); c++) {
				this.sum[row][c] += predictions.get(i, c);
			}
		}
	}

	public boolean isComplete() {
		for (BitSet bits : this.covered) {
			if (bits.cardinality() != this.numRows) {
				return false;
			}
		}
		return this.sum != null;
	}

	public Predictions build() {
		if (!this.isComplete()) {
			throw new IllegalStateException("Not every row has been predicted in every repetition.");
		}
		double[][] avg = new double[this.numRows][];
		for (int r = 0; r < this.numRows; r++) {
			avg[r] = new double[this.sum[r].length];
			for (int c = 0; c < avg[r].length; c++) {
				avg[r][c] = this.sum[r][c] / this.numRepetitions;
			}
		}
		return Predictions.like(this.template, avg);
	}
}
