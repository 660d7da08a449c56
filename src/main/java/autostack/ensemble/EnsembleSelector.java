package autostack.ensemble;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.api4.java.common.control.ILoggingCustomizable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import autostack.data.LabeledDataset;
import autostack.data.Predictions;
import autostack.metrics.ScoringFunction;

/**
 * Greedy forward selection with replacement. In every round, each candidate (including already selected ones) is tentatively added to the ensemble,
 * and the addition with the lowest validation loss is kept. Selection stops after a fixed number of rounds or as soon as no addition improves the
 * loss by more than the tolerance. Weights are the selection counts divided by the number of selections.
 *
 * The result only depends on the candidates and their insertion order, never on the order in which they are passed.
 */
public class EnsembleSelector implements ILoggingCustomizable {

	public static final int DEFAULT_ROUNDS = 25;
	public static final double DEFAULT_TOLERANCE = 0.0;

	public enum TieBreak {
		/** prefer the candidate with lower fit time, then the one inserted earlier */
		FIT_TIME_THEN_ORDER,
		/** prefer the candidate inserted earlier */
		ORDER_ONLY
	}

	private Logger logger = LoggerFactory.getLogger(EnsembleSelector.class);

	private final ScoringFunction metric;
	private final int rounds;
	private final double tolerance;
	private final TieBreak tieBreak;
	private final boolean parallel;

	public EnsembleSelector(final ScoringFunction metric) {
		this(metric, DEFAULT_ROUNDS, DEFAULT_TOLERANCE, TieBreak.FIT_TIME_THEN_ORDER, false);
	}

	/**
	 * @param parallel
	 *            whether the candidates of one round are evaluated in parallel; does not affect the result
	 */
	public EnsembleSelector(final ScoringFunction metric, final int rounds, final double tolerance, final TieBreak tieBreak, final boolean parallel) {
		super();
		if (rounds < 1) {
			throw new IllegalArgumentException("At least one round is required, got " + rounds);
		}
		if (tolerance < 0 || Double.isNaN(tolerance)) {
			throw new IllegalArgumentException("Tolerance must be non-negative, got " + tolerance);
		}
		this.metric = Objects.requireNonNull(metric);
		this.rounds = rounds;
		this.tolerance = tolerance;
		this.tieBreak = Objects.requireNonNull(tieBreak);
		this.parallel = parallel;
	}

	public ScoringFunction getMetric() {
		return this.metric;
	}

	public int getRounds() {
		return this.rounds;
	}

	public double getTolerance() {
		return this.tolerance;
	}

	public TieBreak getTieBreak() {
		return this.tieBreak;
	}

	public EnsembleSelection select(final List<EnsembleCandidate> candidates, final LabeledDataset truth) {
		if (candidates.isEmpty()) {
			throw new IllegalArgumentException("Cannot select an ensemble from zero candidates.");
		}
		List<EnsembleCandidate> ordered = candidates.stream().sorted(Comparator.comparingInt(EnsembleCandidate::getInsertionOrder).thenComparing(EnsembleCandidate::getModelId)).collect(Collectors.toList());
		int numRows = truth.size();
		int numColumns = ordered.get(0).getOutOfFoldPredictions().getNumColumns();
		for (EnsembleCandidate candidate : ordered) {
			Predictions oof = candidate.getOutOfFoldPredictions();
			if (oof.getNumRows() != numRows || oof.getNumColumns() != numColumns) {
				throw new IllegalArgumentException("Out-of-fold predictions of " + candidate.getModelId() + " have shape " + oof.getNumRows() + "x" + oof.getNumColumns() + ", expected " + numRows + "x" + numColumns);
			}
		}

		double[][] sum = new double[numRows][numColumns];
		int selected = 0;
		double currentLoss = Double.POSITIVE_INFINITY;
		int[] counts = new int[ordered.size()];
		List<String> selectionOrder = new ArrayList<>();
		List<Double> trajectory = new ArrayList<>();
		Predictions template = ordered.get(0).getOutOfFoldPredictions();

		for (int round = 0; round < this.rounds; round++) {
			final int size = selected + 1;
			IntStream indexes = IntStream.range(0, ordered.size());
			if (this.parallel) {
				indexes = indexes.parallel();
			}
			double[] losses = new double[ordered.size()];
			indexes.forEach(i -> losses[i] = this.lossOfAddition(sum, size, ordered.get(i).getOutOfFoldPredictions(), template, truth));

			int best = -1;
			for (int i = 0; i < ordered.size(); i++) {
				if (Double.isNaN(losses[i])) {
					continue;
				}
				if (best < 0 || this.isPreferred(ordered.get(i), losses[i], ordered.get(best), losses[best])) {
					best = i;
				}
			}
			if (best < 0) {
				this.logger.warn("No candidate yields a defined loss in round {}. Stopping selection.", round + 1);
				break;
			}
			if (selected > 0 && !(losses[best] < currentLoss - this.tolerance)) {
				this.logger.debug("Best addition {} would change loss from {} to {}, which is no improvement beyond tolerance {}. Stopping after {} rounds.", ordered.get(best).getModelId(), currentLoss, losses[best],
						this.tolerance, round);
				break;
			}
			Predictions addition = ordered.get(best).getOutOfFoldPredictions();
			for (int r = 0; r < numRows; r++) {
				for (int c = 0; c < numColumns; c++) {
					sum[r][c] += addition.get(r, c);
				}
			}
			selected++;
			counts[best]++;
			currentLoss = losses[best];
			selectionOrder.add(ordered.get(best).getModelId());
			trajectory.add(currentLoss);
			this.logger.debug("Round {}: added {}, loss is now {}", round + 1, ordered.get(best).getModelId(), currentLoss);
		}
		if (selected == 0) {
			throw new IllegalStateException("No candidate has a defined validation loss.");
		}

		Map<String, Integer> countsById = new LinkedHashMap<>();
		for (int i = 0; i < ordered.size(); i++) {
			if (counts[i] > 0) {
				countsById.put(ordered.get(i).getModelId(), counts[i]);
			}
		}
		EnsembleWeights weights = EnsembleWeights.fromCounts(countsById);
		Predictions ensemble = Predictions.like(template, average(sum, selected));
		double score = this.metric.score(ensemble, truth);
		this.logger.info("Selected ensemble {} after {} rounds with {} {}.", weights.asMap(), selected, this.metric.getName(), score);
		return new EnsembleSelection(weights, selectionOrder, trajectory, ensemble, score);
	}

	private double lossOfAddition(final double[][] sum, final int size, final Predictions addition, final Predictions template, final LabeledDataset truth) {
		double[][] candidate = new double[sum.length][];
		for (int r = 0; r < sum.length; r++) {
			candidate[r] = new double[sum[r].length];
			for (int c = 0; c < sum[r].length; c++) {
				candidate[r][c] = (sum[r][c] + addition.get(r, c)) / size;
			}
		}
		return this.metric.loss(Predictions.like(template, candidate), truth);
	}

	private boolean isPreferred(final EnsembleCandidate challenger, final double challengerLoss, final EnsembleCandidate incumbent, final double incumbentLoss) {
		int byLoss = Double.compare(challengerLoss, incumbentLoss);
		if (byLoss != 0) {
			return byLoss < 0;
		}
		if (this.tieBreak == TieBreak.FIT_TIME_THEN_ORDER) {
			int byTime = Double.compare(challenger.getFitSeconds(), incumbent.getFitSeconds());
			if (byTime != 0) {
				return byTime < 0;
			}
		}
		return challenger.getInsertionOrder() < incumbent.getInsertionOrder();
	}

	private static double[][] average(final double[][] sum, final int count) {
		double[][] avg = new double[sum.length][];
		for (int r = 0; r < sum.length; r++) {
			avg[r] = new double[sum[r].length];
			for (int c = 0; c < sum[r].length; c++) {
				avg[r][c] = sum[r][c] / count;
			}
		}
		return avg;
	}

	@Override
	public String getLoggerName() {
		return this.logger.getName();
	}

	@Override
	public void setLoggerName(final String name) {
		this.logger = LoggerFactory.getLogger(name);
	}
}
