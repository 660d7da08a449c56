package autostack;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.api4.java.algorithm.Timeout;
import org.api4.java.common.control.ILoggingCustomizable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;

import autostack.data.Dataset;
import autostack.data.LabeledDataset;
import autostack.data.ProblemType;
import autostack.data.ProblemTypeInference;
import autostack.data.RepeatedFoldAssignment;
import autostack.ensemble.EnsembleCandidate;
import autostack.ensemble.EnsembleSelection;
import autostack.ensemble.EnsembleSelector;
import autostack.family.ModelFamilyRegistry;
import autostack.family.WekaConversion;
import autostack.leaderboard.InferencePlan;
import autostack.leaderboard.Leaderboard;
import autostack.leaderboard.LeaderboardEntry;
import autostack.leaderboard.ModelRegistry;
import autostack.metrics.EPerformanceMeasure;
import autostack.metrics.ScoringFunction;
import autostack.portfolio.CandidatePortfolio;
import autostack.portfolio.DatasetCharacteristics;
import autostack.portfolio.PortfolioSelection;
import autostack.portfolio.Preset;
import autostack.predictor.FitSummary;
import autostack.predictor.StackedEnsemblePredictor;
import autostack.resources.Parallelism;
import autostack.resources.ResourceProbe;
import autostack.resources.ResourceTracker;
import autostack.stacking.CandidateFailure;
import autostack.stacking.FailureReport;
import autostack.stacking.FittedModel;
import autostack.stacking.LayerOutput;
import autostack.stacking.LayerResult;
import autostack.stacking.LayerSettings;
import autostack.stacking.StackLayerBuilder;
import autostack.storage.ArtifactReference;
import autostack.storage.ArtifactStore;
import autostack.storage.FileArtifactStore;
import autostack.storage.SpillingArtifactStore;
import autostack.weights.WeightsProvider;
import weka.core.Instances;
import weka.core.converters.ConverterUtils.DataSource;

/**
 * Builds a stacked ensemble within a time budget.
 *
 * A fit draws candidates from the portfolio, trains them layer by layer with bagged cross-validation, where every layer above the first sees the
 * out-of-fold predictions of the layer below, and finally combines the models of one layer by greedy ensemble selection. Stacking stops early
 * once a layer fails to produce a model or its best model is worse than the best model of the layer below.
 */
public class AutoStack implements ILoggingCustomizable {

	public static final String ENSEMBLE_NAME_PREFIX = "WeightedEnsemble_L";
	public static final double MEDIAN = 0.5;

	private Logger logger = LoggerFactory.getLogger(AutoStack.class);

	private final AutoStackConfig config;
	private final ModelFamilyRegistry families;
	private final CandidatePortfolio portfolio;
	private final WeightsProvider weightsProvider;
	private final ArtifactStore artifactStore;
	private final ResourceProbe probe;
	private final ScoringFunction metric;
	private final Ticker ticker;

	/**
	 * Use {@link AutoStackBuilder} to create instances.
	 *
	 * @param artifactStore
	 *            store shared by all fits, or null to create a fresh store per fit
	 * @param metric
	 *            validation metric, or null to use the default metric of the problem type
	 */
	AutoStack(final AutoStackConfig config, final ModelFamilyRegistry families, final CandidatePortfolio portfolio, final WeightsProvider weightsProvider, final ArtifactStore artifactStore, final ResourceProbe probe,
			final ScoringFunction metric, final Ticker ticker) {
		super();
		this.config = Objects.requireNonNull(config);
		this.families = Objects.requireNonNull(families);
		this.portfolio = Objects.requireNonNull(portfolio);
		this.weightsProvider = weightsProvider;
		this.artifactStore = artifactStore;
		this.probe = Objects.requireNonNull(probe);
		this.metric = metric;
		this.ticker = Objects.requireNonNull(ticker);
	}

	public AutoStackConfig getConfig() {
		return this.config;
	}

	public CandidatePortfolio getPortfolio() {
		return this.portfolio;
	}

	/**
	 * Fits a stacked ensemble.
	 *
	 * @param labelColumn
	 *            name of the column to predict
	 * @param problemTypeHint
	 *            the problem type, or null to infer it from the label column
	 * @param budget
	 *            wall-clock budget of the fit; running candidates may overrun it by the configured grace period
	 * @throws FitConfigurationException
	 *             if the request cannot be served at all; raised before any model is trained
	 * @throws NoModelsFitException
	 *             if no candidate could be fit on any layer
	 */
	public StackedEnsemblePredictor fit(final Dataset data, final String labelColumn, final ProblemType problemTypeHint, final Timeout budget, final Preset preset) throws AutoStackException, InterruptedException {

		/* fatal configuration errors come first */
		if (budget == null || budget.milliseconds() <= 0) {
			throw new FitConfigurationException("The time budget must be positive, got " + (budget != null ? budget.milliseconds() + "ms" : null));
		}
		if (preset == null) {
			throw new FitConfigurationException("No preset given.");
		}
		LabeledDataset labeled = ProblemTypeInference.toLabeledDataset(data, labelColumn, problemTypeHint);
		ProblemType problemType = labeled.getProblemType();
		if (labeled.size() < 2) {
			throw new FitConfigurationException("At least two labeled rows are required, got " + labeled.size());
		}
		ScoringFunction scoring = this.metric != null ? this.metric : EPerformanceMeasure.defaultFor(problemType);
		if (!scoring.supports(problemType)) {
			throw new FitConfigurationException("Metric " + scoring.getName() + " does not support " + problemType + " problems.");
		}
		double[] requestedQuantiles = null;
		double[] trainedQuantiles = null;
		if (problemType == ProblemType.QUANTILE) {
			requestedQuantiles = validateQuantileLevels(this.config.getQuantileLevels());
			trainedQuantiles = withMedian(requestedQuantiles);
		}

		this.logger.info("Fitting {} rows and {} features as {} problem with preset {}, budget {}s and metric {}.", labeled.size(), labeled.getFeatures().getNumColumns(), problemType, preset, budget.seconds(),
				scoring.getName());
		ResourceTracker tracker = new ResourceTracker(budget, this.probe, this.ticker);
		tracker.setLoggerName(this.getLoggerName() + ".resources");
		Map<String, Integer> runtimesPerStage = new LinkedHashMap<>();
		List<String> notes = new ArrayList<>();
		List<CandidateFailure> failures = new ArrayList<>();

		/* portfolio */
		Stopwatch stage = Stopwatch.createStarted(this.ticker);
		Parallelism parallelism = tracker.getAvailableParallelism();
		PortfolioSelection selection = this.portfolio.getCandidates(DatasetCharacteristics.of(labeled), preset, parallelism);
		notes.addAll(selection.getNotes());
		runtimesPerStage.put("portfolio", (int) stage.elapsed(TimeUnit.MILLISECONDS));
		if (selection.isEmpty()) {
			throw new NoModelsFitException(new FailureReport(failures, notes));
		}
		this.logger.info("Portfolio admits {} candidates: {}", selection.getCandidates().size(), selection.getCandidates());

		int numFolds = Math.min(preset.getNumFolds(), labeled.size());
		RepeatedFoldAssignment folds = RepeatedFoldAssignment.forData(labeled, numFolds, preset.getNumRepetitions(), this.config.getSeed());
		boolean refitFull = this.config.getRefitFull() != null ? this.config.getRefitFull() : preset.isRefitFull();
		LayerSettings settings = new LayerSettings(this.config.getMinModelSeconds(), this.config.getGracePeriodSeconds(), refitFull, this.config.getSeed(), trainedQuantiles,
				this.config.getMaxHeapFraction());
		ArtifactStore store = this.getArtifactStore(tracker);
		ModelRegistry registry = new ModelRegistry();
		Leaderboard leaderboard = new Leaderboard(scoring);
		StackLayerBuilder builder = new StackLayerBuilder(this.families, store, this.weightsProvider, scoring, tracker, leaderboard, registry, settings);
		builder.setLoggerName(this.getLoggerName() + ".layers");

		/* stack layers */
		int numLayers = Math.max(1, Math.min(preset.getNumStackLayers(), this.config.getMaxStackLayers()));
		List<LayerOutput> layers = new ArrayList<>();
		LayerOutput previous = null;
		double previousBest = Double.NaN;
		for (int layer = 0; layer < numLayers; layer++) {
			if (tracker.isExhausted()) {
				notes.add("Budget exhausted before layer L" + (layer + 1) + ".");
				this.logger.info("Budget exhausted, not building layer {}.", layer + 1);
				break;
			}
			stage = Stopwatch.createStarted(this.ticker);
			long layerBudget = tracker.getRemainingMillis() / (numLayers - layer);
			LabeledDataset layerData = labeled;
			List<String> inputs = new ArrayList<>();
			if (previous != null) {
				layerData = labeled.withFeatures(previous.toNextLayerFeatures(labeled.getFeatures(), labeled.getClassLabels()));
				inputs = previous.getModelIds();
			}
			LayerResult result = builder.buildLayer(layer, layerData, inputs, folds, selection.getCandidates(), layerBudget);
			runtimesPerStage.put("layer_" + layer, (int) stage.elapsed(TimeUnit.MILLISECONDS));
			failures.addAll(result.getFailures());
			if (result.isEmpty()) {
				String note = "No model could be fit on layer L" + (layer + 1) + (previous != null ? ", falling back to layer L" + layer : "") + ".";
				this.logger.info(note);
				notes.add(note);
				break;
			}
			double best = result.getBestModel(scoring).map(FittedModel::getScore).orElse(Double.NaN);
			DescriptiveStatistics scores = result.getScoreStatistics();
			this.logger.info("Layer {}: {} models, {} between {} and {} (mean {}).", layer + 1, scores.getN(), scoring.getName(), scores.getMin(), scores.getMax(), scores.getMean());
			if (previous != null && scoring.isBetter(previousBest, best)) {
				String note = String.format("Best model of layer L%d (%s %f) is worse than the best model of layer L%d (%f). Discarding the layer and stopping.", layer + 1, scoring.getName(), best, layer,
						previousBest);
				this.logger.info(note);
				notes.add(note);
				this.discardLayer(registry, store, layer);
				break;
			}
			layers.add(result.getOutput());
			previous = result.getOutput();
			previousBest = best;
		}
		if (layers.isEmpty()) {
			FailureReport report = new FailureReport(failures, notes);
			this.logger.error("Fit failed.\n{}", report.describe());
			throw new NoModelsFitException(report);
		}

		/* ensemble selection on every surviving layer, the best one wins */
		stage = Stopwatch.createStarted(this.ticker);
		EnsembleSelector selector = new EnsembleSelector(scoring, this.config.getEnsembleRounds(), this.config.getEnsembleTolerance(), this.config.getEnsembleTieBreak(), this.config.isParallelEnsembleSearch());
		selector.setLoggerName(this.getLoggerName() + ".ensemble");
		EnsembleSelection bestSelection = null;
		int ensembleLayer = -1;
		for (LayerOutput output : layers) {
			Stopwatch selectionTime = Stopwatch.createStarted(this.ticker);
			List<EnsembleCandidate> candidates = new ArrayList<>();
			double predictSeconds = 0;
			for (FittedModel model : output.getModels()) {
				int insertion = leaderboard.get(model.getId()).map(LeaderboardEntry::getInsertionIndex).orElse(Integer.MAX_VALUE);
				candidates.add(new EnsembleCandidate(model.getId(), model.getOutOfFoldPredictions(), model.getFitSeconds(), insertion));
			}
			EnsembleSelection ensemble = selector.select(candidates, labeled);
			for (String member : ensemble.getWeights().getSupport()) {
				predictSeconds += registry.getOrFail(member).getPredictSeconds();
			}
			leaderboard.append(new LeaderboardEntry(ENSEMBLE_NAME_PREFIX + (output.getLayer() + 2), LeaderboardEntry.ENSEMBLE_FAMILY, output.getLayer() + 1, ensemble.getScore(),
					selectionTime.elapsed(TimeUnit.MILLISECONDS) / 1000.0, predictSeconds, 0));
			if (bestSelection == null || scoring.isBetter(ensemble.getScore(), bestSelection.getScore())) {
				bestSelection = ensemble;
				ensembleLayer = output.getLayer();
			}
		}
		runtimesPerStage.put("ensemble", (int) stage.elapsed(TimeUnit.MILLISECONDS));
		InferencePlan plan = registry.resolve(bestSelection.getWeights());
		this.logger.info("Chose ensemble over layer {} with {} {}. Inference plan: {}", ensembleLayer + 1, scoring.getName(), bestSelection.getScore(), plan);

		FitSummary summary = new FitSummary(preset, selection.getCandidatePreset(), problemType, scoring.getName(), layers.size(), ensembleLayer, bestSelection.getScore(), failures, notes, runtimesPerStage);
		this.logger.info("Fit finished after {}s. {}", tracker.getElapsedSeconds(), summary);
		return new StackedEnsemblePredictor(registry, store, this.families, plan, leaderboard, problemType, labeled.getClassLabels(), labeled.getFeatures().getColumnNames(),
				labeled.getFeatures().getNominalValues(), requestedQuantiles, summary);
	}

	private ArtifactStore getArtifactStore(final ResourceTracker tracker) throws AutoStackException {
		if (this.artifactStore != null) {
			return this.artifactStore;
		}
		if (!this.config.isPersistArtifacts()) {
			double maxHeapFraction = this.config.getMaxHeapFraction();
			return new SpillingArtifactStore(this.config.getArtifactDirectory(), () -> tracker.getHeapHeadroomBytes(maxHeapFraction));
		}
		try {
			return new FileArtifactStore(this.config.getArtifactDirectory() != null ? this.config.getArtifactDirectory() : Files.createTempDirectory("autostack"));
		} catch (IOException e) {
			throw new AutoStackException("Could not create artifact directory.", e);
		}
	}

	/**
	 * Removes the models of a layer from the registry and their artifacts from the store. Leaderboard entries stay.
	 */
	private void discardLayer(final ModelRegistry registry, final ArtifactStore store, final int layer) {
		for (FittedModel model : registry.removeLayer(layer)) {
			List<ArtifactReference> references = new ArrayList<>(model.getFoldArtifacts());
			if (model.hasRefitArtifact()) {
				references.add(model.getRefitArtifact());
			}
			for (ArtifactReference reference : references) {
				try {
					store.delete(reference);
				} catch (IOException e) {
					this.logger.warn("Could not delete artifact {} of discarded model {}: {}", reference, model.getId(), e.getMessage());
				}
			}
		}
	}

	static double[] validateQuantileLevels(final double[] levels) throws FitConfigurationException {
		if (levels == null || levels.length == 0) {
			throw new FitConfigurationException("Quantile problems require at least one quantile level.");
		}
		TreeSet<Double> sorted = new TreeSet<>();
		for (double level : levels) {
			if (!(level > 0 && level < 1)) {
				throw new FitConfigurationException("Quantile levels must lie strictly between 0 and 1, got " + Arrays.toString(levels));
			}
			sorted.add(level);
		}
		return sorted.stream().mapToDouble(Double::doubleValue).toArray();
	}

	/**
	 * Models always predict the median; it is removed again from the predictions unless requested.
	 */
	static double[] withMedian(final double[] levels) {
		if (Arrays.binarySearch(levels, MEDIAN) >= 0) {
			return levels;
		}
		double[] extended = Arrays.copyOf(levels, levels.length + 1);
		extended[levels.length] = MEDIAN;
		Arrays.sort(extended);
		return extended;
	}

	@Override
	public String getLoggerName() {
		return this.logger.getName();
	}

	@Override
	public void setLoggerName(final String name) {
		this.logger = LoggerFactory.getLogger(name);
		this.portfolio.setLoggerName(name + ".portfolio");
	}

	/**
	 * Fits an ARFF file whose last attribute is the label. Arguments: file, budget in seconds, and optionally a preset id.
	 */
	public static void main(final String[] args) throws Exception {
		if (args.length < 2) {
			System.err.println("Usage: AutoStack <arff file> <budget in seconds> [preset]");
			System.exit(1);
		}
		Instances instances = new DataSource(new File(args[0]).getAbsolutePath()).getDataSet();
		instances.setClassIndex(instances.numAttributes() - 1);
		String labelColumn = instances.classAttribute().name();
		Dataset data = WekaConversion.fromInstances(instances, labelColumn);
		Preset preset = args.length > 2 ? Preset.fromId(args[2]) : Preset.MEDIUM_QUALITY;
		AutoStack autoStack = new AutoStackBuilder().build();
		StackedEnsemblePredictor predictor = autoStack.fit(data, labelColumn, null, new Timeout(Long.parseLong(args[1]), TimeUnit.SECONDS), preset);
		autoStack.logger.info("Leaderboard:\n{}", predictor.getLeaderboard());
		autoStack.logger.info("Ensemble: {}", predictor.getEnsembleWeights().asMap());
	}
}
