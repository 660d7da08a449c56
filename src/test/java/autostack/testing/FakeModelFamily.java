package autostack.testing;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.collect.ImmutableSet;

import autostack.data.Dataset;
import autostack.data.LabeledDataset;
import autostack.data.Predictions;
import autostack.data.ProblemType;
import autostack.family.FitOutcome;
import autostack.family.ModelArtifact;
import autostack.family.ModelFamily;
import autostack.family.ModelFitException;
import autostack.family.TrainingContext;

/**
 * Deterministic family that predicts from a single feature column. For binary data labeled by the sign of that column, a quality of 1 is a
 * perfect model and a quality of 0.5 a coin flip. Regression predictions are the feature scaled by the quality.
 */
public class FakeModelFamily implements ModelFamily {

	public static final String ID = "FAKE";

	public static final String HP_QUALITY = "quality";
	public static final String HP_FEATURE = "feature";
	public static final String HP_FAIL = "fail";
	public static final String HP_CRASH = "crash";
	public static final String HP_SLEEP_MILLIS = "sleepMillis";
	public static final String HP_FIT_SECONDS = "fitSeconds";

	public static final String DEFAULT_FEATURE = "x";
	public static final double DEFAULT_QUALITY = 0.8;

	private final String id;
	private final boolean requiresWeights;
	private final AtomicInteger fits = new AtomicInteger();
	private final AtomicInteger running = new AtomicInteger();
	private final AtomicInteger maxRunning = new AtomicInteger();

	public FakeModelFamily() {
		this(ID, false);
	}

	public FakeModelFamily(final String id, final boolean requiresWeights) {
		this.id = id;
		this.requiresWeights = requiresWeights;
	}

	@Override
	public String getId() {
		return this.id;
	}

	@Override
	public boolean supports(final ProblemType problemType) {
		return true;
	}

	@Override
	public boolean requiresExternalWeights() {
		return this.requiresWeights;
	}

	@Override
	public Set<String> getKnownHyperparameters() {
		return ImmutableSet.of(HP_QUALITY, HP_FEATURE, HP_FAIL, HP_CRASH, HP_SLEEP_MILLIS, HP_FIT_SECONDS);
	}

	/**
	 * @return number of fit calls so far, including refits
	 */
	public int getNumFits() {
		return this.fits.get();
	}

	/**
	 * @return the highest number of fits that ran at the same time
	 */
	public int getMaxConcurrentFits() {
		return this.maxRunning.get();
	}

	@Override
	public FitOutcome fit(final LabeledDataset train, final Dataset validation, final Map<String, Object> hyperparameters, final TrainingContext context) throws ModelFitException, InterruptedException {
		this.fits.incrementAndGet();
		this.maxRunning.accumulateAndGet(this.running.incrementAndGet(), Math::max);
		try {
			if (Boolean.TRUE.equals(hyperparameters.get(HP_FAIL))) {
				throw new ModelFitException("configured to fail");
			}
			if (Boolean.TRUE.equals(hyperparameters.get(HP_CRASH))) {
				throw new IllegalStateException("numerical instability");
			}
			long sleep = ((Number) hyperparameters.getOrDefault(HP_SLEEP_MILLIS, 0)).longValue();
			if (sleep > 0) {
				Thread.sleep(sleep);
			}
			if (this.requiresWeights && context.getWeights() == null) {
				throw new ModelFitException("no weights handed over");
			}
			double quality = ((Number) hyperparameters.getOrDefault(HP_QUALITY, DEFAULT_QUALITY)).doubleValue();
			String feature = (String) hyperparameters.getOrDefault(HP_FEATURE, DEFAULT_FEATURE);
			FakeArtifact artifact = new FakeArtifact(train.getProblemType(), feature, quality, train.getNumClasses(), context.getQuantileLevels());
			double fitSeconds = ((Number) hyperparameters.getOrDefault(HP_FIT_SECONDS, 0.01)).doubleValue();
			Predictions validationPredictions = validation != null ? this.predict(artifact, validation) : null;
			return new FitOutcome(artifact, validationPredictions, fitSeconds, 0.001);
		} finally {
			this.running.decrementAndGet();
		}
	}

	@Override
	public Predictions predict(final ModelArtifact artifact, final Dataset data) throws ModelFitException {
		if (!(artifact instanceof FakeArtifact)) {
			throw new ModelFitException("Unexpected artifact " + artifact);
		}
		FakeArtifact fake = (FakeArtifact) artifact;
		if (!data.hasColumn(fake.getFeature())) {
			throw new ModelFitException("Column " + fake.getFeature() + " is missing.");
		}
		double[] x = data.getColumn(fake.getFeature());
		double q = fake.getQuality();
		int n = x.length;
		switch (fake.getProblemType()) {
		case BINARY:
			double[][] binary = new double[n][2];
			for (int i = 0; i < n; i++) {
				double positive = x[i] > 0 ? q : 1 - q;
				binary[i][0] = 1 - positive;
				binary[i][1] = positive;
			}
			return Predictions.ofProbabilities(ProblemType.BINARY, binary);
		case MULTICLASS:
			int k = fake.getNumClasses();
			double[][] multi = new double[n][k];
			for (int i = 0; i < n; i++) {
				int c = (int) Math.max(0, Math.min(k - 1, Math.round(x[i])));
				for (int j = 0; j < k; j++) {
					multi[i][j] = j == c ? q : (1 - q) / (k - 1);
				}
			}
			return Predictions.ofProbabilities(ProblemType.MULTICLASS, multi);
		case REGRESSION:
			double[] values = new double[n];
			for (int i = 0; i < n; i++) {
				values[i] = q * x[i];
			}
			return Predictions.ofValues(values);
		case QUANTILE:
			double[] levels = fake.getQuantileLevels();
			double[][] quantiles = new double[n][levels.length];
			for (int i = 0; i < n; i++) {
				for (int j = 0; j < levels.length; j++) {
					quantiles[i][j] = q * x[i] + (levels[j] - 0.5);
				}
			}
			return Predictions.ofQuantiles(levels, quantiles);
		default:
			throw new ModelFitException("Unsupported problem type " + fake.getProblemType());
		}
	}
}
