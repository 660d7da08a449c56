package autostack.data;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Repeated k-fold: one {@link FoldAssignment} per repetition, each drawn with its own seed. All assignments cover the same rows with the same number of folds.
 */
public class RepeatedFoldAssignment {

	private final ImmutableList<FoldAssignment> repetitions;

	public RepeatedFoldAssignment(final List<FoldAssignment> repetitions) {
		super();
		if (repetitions.isEmpty()) {
			throw new IllegalArgumentException("At least one repetition is required.");
		}
		FoldAssignment first = repetitions.get(0);
		for (FoldAssignment fa : repetitions) {
			if (fa.getNumRows() != first.getNumRows() || fa.getNumFolds() != first.getNumFolds()) {
				throw new IllegalArgumentException("All repetitions must share row count and fold count.");
			}
		}
		this.repetitions = ImmutableList.copyOf(repetitions);
	}

	public static RepeatedFoldAssignment forData(final LabeledDataset data, final int numFolds, final int numRepetitions, final long seed) {
		List<FoldAssignment> assignments = new ArrayList<>();
		for (int i = 0; i < numRepetitions; i++) {
			assignments.add(FoldAssignment.forData(data, numFolds, seed + i));
		}
		return new RepeatedFoldAssignment(assignments);
	}

	public int getNumRepetitions() {
		return this.repetitions.size();
	}

	public int getNumFolds() {
		return this.repetitions.get(0).getNumFolds();
	}

	public int getNumRows() {
		return this.repetitions.get(0).getNumRows();
	}

	public FoldAssignment getRepetition(final int index) {
		return this.repetitions.get(index);
	}

	/**
	 * @return total number of fold models a bagged candidate trains
	 */
	public int getNumFoldFits() {
		return this.getNumFolds() * this.getNumRepetitions();
	}
}
