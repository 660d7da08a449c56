package autostack.metrics;

import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

import autostack.data.LabeledDataset;
import autostack.data.Predictions;
import autostack.data.ProblemType;

/**
 * Built-in metrics. All of them respect sample weights.
 */
public enum EPerformanceMeasure implements ScoringFunction {

	LOG_LOSS(false, EnumSet.of(ProblemType.BINARY, ProblemType.MULTICLASS)),
	BRIER_SCORE(false, EnumSet.of(ProblemType.BINARY, ProblemType.MULTICLASS)),
	ERROR_RATE(false, EnumSet.of(ProblemType.BINARY, ProblemType.MULTICLASS)),
	ACCURACY(true, EnumSet.of(ProblemType.BINARY, ProblemType.MULTICLASS)),
	ROC_AUC(true, EnumSet.of(ProblemType.BINARY)),
	RMSE(false, EnumSet.of(ProblemType.REGRESSION)),
	MSE(false, EnumSet.of(ProblemType.REGRESSION)),
	MAE(false, EnumSet.of(ProblemType.REGRESSION)),
	R2(true, EnumSet.of(ProblemType.REGRESSION)),
	PINBALL_LOSS(false, EnumSet.of(ProblemType.QUANTILE));

	public static final double EPSILON_PROBABILITY = 1e-15;

	private final boolean higherBetter;
	private final Set<ProblemType> problemTypes;

	EPerformanceMeasure(final boolean higherBetter, final Set<ProblemType> problemTypes) {
		this.higherBetter = higherBetter;
		this.problemTypes = problemTypes;
	}

	/**
	 * @return the metric that is used if the user does not specify one: a proper scoring rule for classification, an error metric for regression and
	 *         the pinball loss for quantile problems
	 */
	public static EPerformanceMeasure defaultFor(final ProblemType problemType) {
		switch (problemType) {
		case BINARY:
		case MULTICLASS:
			return LOG_LOSS;
		case REGRESSION:
			return RMSE;
		case QUANTILE:
			return PINBALL_LOSS;
		default:
			throw new IllegalArgumentException("Unsupported problem type " + problemType);
		}
	}

	@Override
	public String getName() {
		return this.name().toLowerCase(Locale.ROOT);
	}

	@Override
	public boolean isHigherBetter() {
		return this.higherBetter;
	}

	@Override
	public boolean supports(final ProblemType problemType) {
		return this.problemTypes.contains(problemType);
	}

	@Override
	public double score(final Predictions predictions, final LabeledDataset truth) {
		if (predictions.getNumRows() != truth.size()) {
			throw new IllegalArgumentException("Got " + predictions.getNumRows() + " predictions for " + truth.size() + " rows.");
		}
		if (!this.supports(truth.getProblemType())) {
			throw new IllegalArgumentException(this + " is not defined for " + truth.getProblemType() + " problems.");
		}
		switch (this) {
		case LOG_LOSS:
			return logLoss(predictions, truth);
		case BRIER_SCORE:
			return brierScore(predictions, truth);
		case ERROR_RATE:
			return 1 - accuracy(predictions, truth);
		case ACCURACY:
			return accuracy(predictions, truth);
		case ROC_AUC:
			return rocAuc(predictions, truth);
		case RMSE:
			return Math.sqrt(mse(predictions, truth));
		case MSE:
			return mse(predictions, truth);
		case MAE:
			return mae(predictions, truth);
		case R2:
			return r2(predictions, truth);
		case PINBALL_LOSS:
			return pinballLoss(predictions, truth);
		default:
			throw new UnsupportedOperationException("No implementation for " + this);
		}
	}

	private static double totalWeight(final LabeledDataset truth) {
		double total = 0;
		for (int i = 0; i < truth.size(); i++) {
			total += truth.getWeight(i);
		}
		return total;
	}

	private static double logLoss(final Predictions predictions, final LabeledDataset truth) {
		double sum = 0;
		for (int i = 0; i < truth.size(); i++) {
			double p = predictions.get(i, (int) truth.getLabel(i));
			sum -= truth.getWeight(i) * Math.log(Math.max(EPSILON_PROBABILITY, Math.min(1, p)));
		}
		return sum / totalWeight(truth);
	}

	private static double brierScore(final Predictions predictions, final LabeledDataset truth) {
		double sum = 0;
		for (int i = 0; i < truth.size(); i++) {
			int label = (int) truth.getLabel(i);
			double rowSum = 0;
			for (int c = 0; c < predictions.getNumColumns(); c++) {
				double diff = predictions.get(i, c) - (c == label ? 1 : 0);
				rowSum += diff * diff;
			}
			sum += truth.getWeight(i) * rowSum;
		}
		return sum / totalWeight(truth);
	}

	private static double accuracy(final Predictions predictions, final LabeledDataset truth) {
		int[] decisions = predictions.getMostLikelyClasses();
		double correct = 0;
		for (int i = 0; i < truth.size(); i++) {
			if (decisions[i] == (int) truth.getLabel(i)) {
				correct += truth.getWeight(i);
			}
		}
		return correct / totalWeight(truth);
	}

	/**
	 * Weighted Mann-Whitney statistic of the probability of the second class; ties count one half.
	 */
	private static double rocAuc(final Predictions predictions, final LabeledDataset truth) {
		Integer[] order = new Integer[truth.size()];
		for (int i = 0; i < order.length; i++) {
			order[i] = i;
		}
		Arrays.sort(order, Comparator.comparingDouble(i -> predictions.get(i, 1)));
		double positiveWeight = 0;
		double negativeWeight = 0;
		double negativesBelow = 0;
		double concordant = 0;
		int start = 0;
		while (start < order.length) {
			int end = start;
			double score = predictions.get(order[start], 1);
			while (end < order.length && Double.compare(predictions.get(order[end], 1), score) == 0) {
				end++;
			}
			double tiedPositives = 0;
			double tiedNegatives = 0;
			for (int k = start; k < end; k++) {
				double w = truth.getWeight(order[k]);
				if (truth.getLabel(order[k]) == 1) {
					tiedPositives += w;
				} else {
					tiedNegatives += w;
				}
			}
			concordant += tiedPositives * (negativesBelow + tiedNegatives / 2);
			negativesBelow += tiedNegatives;
			positiveWeight += tiedPositives;
			negativeWeight += tiedNegatives;
			start = end;
		}
		if (positiveWeight == 0 || negativeWeight == 0) {
			return Double.NaN;
		}
		return concordant / (positiveWeight * negativeWeight);
	}

	private static double mse(final Predictions predictions, final LabeledDataset truth) {
		double sum = 0;
		for (int i = 0; i < truth.size(); i++) {
			double diff = predictions.get(i, 0) - truth.getLabel(i);
			sum += truth.getWeight(i) * diff * diff;
		}
		return sum / totalWeight(truth);
	}

	private static double mae(final Predictions predictions, final LabeledDataset truth) {
		double sum = 0;
		for (int i = 0; i < truth.size(); i++) {
			sum += truth.getWeight(i) * Math.abs(predictions.get(i, 0) - truth.getLabel(i));
		}
		return sum / totalWeight(truth);
	}

	private static double r2(final Predictions predictions, final LabeledDataset truth) {
		double total = totalWeight(truth);
		double mean = 0;
		for (int i = 0; i < truth.size(); i++) {
			mean += truth.getWeight(i) * truth.getLabel(i);
		}
		mean /= total;
		double residual = 0;
		double variance = 0;
		for (int i = 0; i < truth.size(); i++) {
			double diff = truth.getLabel(i) - predictions.get(i, 0);
			double dev = truth.getLabel(i) - mean;
			residual += truth.getWeight(i) * diff * diff;
			variance += truth.getWeight(i) * dev * dev;
		}
		if (variance == 0) {
			return residual == 0 ? 1 : 0;
		}
		return 1 - residual / variance;
	}

	private static double pinballLoss(final Predictions predictions, final LabeledDataset truth) {
		double[] levels = predictions.getQuantileLevels();
		if (levels == null || levels.length == 0) {
			throw new IllegalArgumentException("Pinball loss requires quantile predictions.");
		}
		double sum = 0;
		for (int i = 0; i < truth.size(); i++) {
			double rowLoss = 0;
			for (int q = 0; q < levels.length; q++) {
				double diff = truth.getLabel(i) - predictions.get(i, q);
				rowLoss += Math.max(levels[q] * diff, (levels[q] - 1) * diff);
			}
			sum += truth.getWeight(i) * rowLoss / levels.length;
		}
		return sum / totalWeight(truth);
	}
}
