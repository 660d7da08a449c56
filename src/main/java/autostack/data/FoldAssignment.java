package autostack.data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Partition of row indexes into disjoint validation folds whose union is the full index set.
 */
public class FoldAssignment {

	private final int[] foldOfRow;
	private final int numFolds;
	private final int[][] validationRows;

	public FoldAssignment(final int[] foldOfRow, final int numFolds) {
		super();
		if (numFolds < 2) {
			throw new IllegalArgumentException("At least two folds are required, got " + numFolds);
		}
		this.foldOfRow = Arrays.copyOf(foldOfRow, foldOfRow.length);
		this.numFolds = numFolds;

		/* every row belongs to exactly one fold, and every fold holds at least one row */
		int[] sizes = new int[numFolds];
		for (int r = 0; r < this.foldOfRow.length; r++) {
			int fold = this.foldOfRow[r];
			if (fold < 0 || fold >= numFolds) {
				throw new IllegalArgumentException("Row " + r + " is assigned to fold " + fold + ", which is not in [0, " + numFolds + ").");
			}
			sizes[fold]++;
		}
		this.validationRows = new int[numFolds][];
		int[] fill = new int[numFolds];
		for (int f = 0; f < numFolds; f++) {
			if (sizes[f] == 0) {
				throw new IllegalArgumentException("Fold " + f + " is empty.");
			}
			this.validationRows[f] = new int[sizes[f]];
		}
		for (int r = 0; r < this.foldOfRow.length; r++) {
			int fold = this.foldOfRow[r];
			this.validationRows[fold][fill[fold]++] = r;
		}
	}

	/**
	 * Stratified assignment for classification data: rows of each class are shuffled and dealt to the folds round-robin.
	 */
	public static FoldAssignment stratified(final LabeledDataset data, final int numFolds, final long seed) {
		checkSize(data.size(), numFolds);
		Random random = new Random(seed);
		List<List<Integer>> rowsPerClass = new ArrayList<>();
		for (int c = 0; c < data.getNumClasses(); c++) {
			rowsPerClass.add(new ArrayList<>());
		}
		for (int r = 0; r < data.size(); r++) {
			rowsPerClass.get((int) data.getLabel(r)).add(r);
		}
		int[] folds = new int[data.size()];
		int next = 0;
		for (List<Integer> rows : rowsPerClass) {
			Collections.shuffle(rows, random);
			for (int row : rows) {
				folds[row] = next;
				next = (next + 1) % numFolds;
			}
		}
		return new FoldAssignment(folds, numFolds);
	}

	public static FoldAssignment shuffled(final int numRows, final int numFolds, final long seed) {
		checkSize(numRows, numFolds);
		List<Integer> rows = new ArrayList<>();
		IntStream.range(0, numRows).forEach(rows::add);
		Collections.shuffle(rows, new Random(seed));
		int[] folds = new int[numRows];
		for (int i = 0; i < rows.size(); i++) {
			folds[rows.get(i)] = i % numFolds;
		}
		return new FoldAssignment(folds, numFolds);
	}

	public static FoldAssignment forData(final LabeledDataset data, final int numFolds, final long seed) {
		return data.getProblemType().isClassification() ? stratified(data, numFolds, seed) : shuffled(data.size(), numFolds, seed);
	}

	private static void checkSize(final int numRows, final int numFolds) {
		if (numRows < numFolds) {
			throw new IllegalArgumentException("Cannot split " + numRows + " rows into " + numFolds + " non-empty folds.");
		}
	}

	public int getNumFolds() {
		return this.numFolds;
	}

	public int getNumRows() {
		return this.foldOfRow.length;
	}

	public int getFold(final int row) {
		return this.foldOfRow[row];
	}

	public int[] getValidationRows(final int fold) {
		return Arrays.copyOf(this.validationRows[fold], this.validationRows[fold].length);
	}

	public int[] getTrainingRows(final int fold) {
		int[] rows = new int[this.foldOfRow.length - this.validationRows[fold].length];
		int i = 0;
		for (int r = 0; r < this.foldOfRow.length; r++) {
			if (this.foldOfRow[r] != fold) {
				rows[i++] = r;
			}
		}
		return rows;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + Arrays.hashCode(this.foldOfRow);
		result = prime * result + this.numFolds;
		return result;
	}

	@Override
	public boolean equals(final Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null) {
			return false;
		}
		if (this.getClass() != obj.getClass()) {
			return false;
		}
		FoldAssignment other = (FoldAssignment) obj;
		if (!Arrays.equals(this.foldOfRow, other.foldOfRow)) {
			return false;
		}
		return this.numFolds == other.numFolds;
	}

	@Override
	public String toString() {
		return "FoldAssignment [numRows=" + this.foldOfRow.length + ", numFolds=" + this.numFolds + "]";
	}
}
