package autostack.metrics;

import autostack.data.LabeledDataset;
import autostack.data.Predictions;
import autostack.data.ProblemType;

/**
 * Validation metric. Whether higher or lower values are better is declared by the metric and never inferred from observed values.
 */
public interface ScoringFunction {

	public String getName();

	public boolean isHigherBetter();

	public boolean supports(ProblemType problemType);

	public double score(Predictions predictions, LabeledDataset truth);

	/**
	 * Converts a score into a loss that is minimal at the optimum.
	 */
	public default double toLoss(final double score) {
		return this.isHigherBetter() ? 1 - score : score;
	}

	public default double loss(final Predictions predictions, final LabeledDataset truth) {
		return this.toLoss(this.score(predictions, truth));
	}

	/**
	 * @return true iff the first score is strictly better than the second one
	 */
	public default boolean isBetter(final double score, final double other) {
		return this.isHigherBetter() ? score > other : score < other;
	}
}
