package autostack.stacking;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import org.api4.java.algorithm.exceptions.AlgorithmTimeoutedException;
import org.api4.java.common.control.ILoggingCustomizable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import autostack.data.Dataset;
import autostack.data.FoldAssignment;
import autostack.data.LabeledDataset;
import autostack.data.Predictions;
import autostack.data.RepeatedFoldAssignment;
import autostack.family.FitOutcome;
import autostack.family.ModelArtifact;
import autostack.family.ModelFamily;
import autostack.family.ModelFamilyRegistry;
import autostack.family.ModelFitException;
import autostack.family.TrainingContext;
import autostack.leaderboard.Leaderboard;
import autostack.leaderboard.LeaderboardEntry;
import autostack.leaderboard.ModelRegistry;
import autostack.metrics.ScoringFunction;
import autostack.portfolio.CandidateConfig;
import autostack.portfolio.ResourceEstimate;
import autostack.resources.Parallelism;
import autostack.resources.ResourceTracker;
import autostack.storage.ArtifactReference;
import autostack.storage.ArtifactSizes;
import autostack.storage.ArtifactStore;
import autostack.weights.WeightsHandle;
import autostack.weights.WeightsProvider;
import autostack.weights.WeightsUnavailableException;

/**
 * Trains the candidates of one stack layer with bagged cross-validation.
 *
 * Candidates are started in rank order as long as CPU and GPU slots are free, their estimated cost fits into the time left for the layer, and at
 * least the minimum model time remains. Training runs in parallel; results are collected on the calling thread, which is the only writer to the
 * artifact store, the model registry and the leaderboard. Candidates still running when the layer deadline plus grace period has passed are
 * cancelled and reported as timed out. A failing candidate never affects its siblings.
 */
public class StackLayerBuilder implements ILoggingCustomizable {

	private Logger logger = LoggerFactory.getLogger(StackLayerBuilder.class);

	private final ModelFamilyRegistry families;
	private final ArtifactStore store;
	private final WeightsProvider weightsProvider;
	private final ScoringFunction metric;
	private final ResourceTracker tracker;
	private final Leaderboard leaderboard;
	private final ModelRegistry registry;
	private final LayerSettings settings;

	/**
	 * @param weightsProvider
	 *            source of pretrained weights; may be null, in which case candidates that need weights fail
	 */
	public StackLayerBuilder(final ModelFamilyRegistry families, final ArtifactStore store, final WeightsProvider weightsProvider, final ScoringFunction metric, final ResourceTracker tracker, final Leaderboard leaderboard,
			final ModelRegistry registry, final LayerSettings settings) {
		super();
		this.families = Objects.requireNonNull(families);
		this.store = Objects.requireNonNull(store);
		this.weightsProvider = weightsProvider;
		this.metric = Objects.requireNonNull(metric);
		this.tracker = Objects.requireNonNull(tracker);
		this.leaderboard = Objects.requireNonNull(leaderboard);
		this.registry = Objects.requireNonNull(registry);
		this.settings = Objects.requireNonNull(settings);
	}

	public LayerSettings getSettings() {
		return this.settings;
	}

	/**
	 * Builds a layer.
	 *
	 * @param layer
	 *            index of the layer, starting at 0
	 * @param data
	 *            training data; for layers above 0 its features already contain the out-of-fold predictions of the input models
	 * @param inputModelIds
	 *            ids of the models of the previous layer whose predictions are part of the features
	 * @param layerBudgetMillis
	 *            time the layer may take before candidates are cut off
	 */
	public LayerResult buildLayer(final int layer, final LabeledDataset data, final List<String> inputModelIds, final RepeatedFoldAssignment folds, final List<CandidateConfig> candidates, final long layerBudgetMillis)
			throws InterruptedException {
		if (folds.getNumRows() != data.size()) {
			throw new IllegalArgumentException("Fold assignment covers " + folds.getNumRows() + " rows but data has " + data.size());
		}
		long layerStart = this.tracker.getElapsedMillis();
		long layerDeadline = Math.min(layerStart + layerBudgetMillis, this.tracker.getBudget().milliseconds());
		long hardDeadline = layerDeadline + this.settings.getGracePeriodMillis();
		Parallelism parallelism = this.tracker.getAvailableParallelism();
		this.logger.info("Building layer {} with {} candidates on {} rows and {} features. Layer deadline in {}ms, {}.", layer + 1, candidates.size(), data.size(), data.getFeatures().getNumColumns(),
				layerDeadline - layerStart, parallelism);

		List<CandidateFailure> failures = new ArrayList<>();
		List<String> notAdmitted = new ArrayList<>();
		LinkedList<CandidateConfig> pending = new LinkedList<>();
		List<CandidateConfig> ranked = candidates.stream().sorted(Comparator.comparingInt(CandidateConfig::getRank).thenComparing(CandidateConfig::getName)).collect(Collectors.toList());
		for (CandidateConfig candidate : ranked) {
			if (!candidate.isAdmissibleInLayer(layer)) {
				this.logger.debug("Candidate {} is not admissible in layer {}.", candidate.getName(), layer + 1);
				notAdmitted.add(candidate.getName());
			} else if (data.size() > candidate.getMaxRows()) {
				this.logger.info("Skipping {} since the data has {} rows, but the candidate accepts at most {}.", candidate.getName(), data.size(), candidate.getMaxRows());
				notAdmitted.add(candidate.getName());
			} else {
				pending.add(candidate);
			}
		}

		long cells = (long) data.size() * data.getFeatures().getNumColumns();
		List<FittedModel> fitted = new ArrayList<>();
		ExecutorService pool = Executors.newFixedThreadPool(parallelism.getCpus(), new ThreadFactoryBuilder().setNameFormat("autostack-layer" + (layer + 1) + "-%d").setDaemon(true).build());
		CompletionService<CandidateOutcome> completionService = new ExecutorCompletionService<>(pool);
		Map<Future<CandidateOutcome>, RunningCandidate> running = new HashMap<>();
		int freeCpus = parallelism.getCpus();
		int freeGpus = parallelism.getGpus();
		try {
			while (!pending.isEmpty() || !running.isEmpty()) {

				/* admit candidates in rank order while resources and budget allow */
				Iterator<CandidateConfig> it = pending.iterator();
				while (it.hasNext()) {
					CandidateConfig candidate = it.next();
					long now = this.tracker.getElapsedMillis();
					double secondsLeft = Math.min(this.tracker.getRemainingSeconds(), (layerDeadline - now) / 1000.0);
					if (secondsLeft < this.settings.getMinModelSeconds() || secondsLeft <= 0) {
						this.logger.info("Only {}s left in layer {}, which is below the minimum model time of {}s. Not starting {} remaining candidates.", secondsLeft, layer + 1, this.settings.getMinModelSeconds(),
								pending.size());
						pending.forEach(c -> notAdmitted.add(c.getName()));
						pending.clear();
						break;
					}
					ResourceEstimate estimate = candidate.getEstimate().forCells(cells);
					double expectedSeconds = estimate.getBaggedFitSeconds(folds.getNumFolds(), folds.getNumRepetitions(), this.settings.isRefitFull());
					int cpus = Math.min(estimate.getCpus(), parallelism.getCpus());
					int gpus = estimate.isGpuSharing() ? 0 : estimate.getGpus();
					if (expectedSeconds > secondsLeft || gpus > parallelism.getGpus() || (estimate.getGpus() > 0 && !parallelism.hasGpu())) {
						this.logger.info("Not starting {}: expected {}s with {} GPU(s), but {}s and {} GPU(s) are available.", candidate.getName(), expectedSeconds, estimate.getGpus(), secondsLeft, parallelism.getGpus());
						notAdmitted.add(candidate.getName());
						it.remove();
						continue;
					}
					long memoryLeft = estimate.getGpus() > 0 ? parallelism.getGpuMemoryBytes() : this.tracker.getHeapHeadroomBytes(this.settings.getMaxHeapFraction());
					if (estimate.getMemoryBytes() > memoryLeft && (estimate.getGpus() == 0 || parallelism.getGpuMemoryBytes() > 0)) {
						this.logger.info("Not starting {}: expected to need {} bytes of {} memory, but only {} bytes are available.", candidate.getName(), estimate.getMemoryBytes(), estimate.getGpus() > 0 ? "GPU" : "heap",
								memoryLeft);
						notAdmitted.add(candidate.getName());
						it.remove();
						continue;
					}
					if (cpus > freeCpus || gpus > freeGpus) {
						continue;
					}
					it.remove();
					freeCpus -= cpus;
					freeGpus -= gpus;
					CandidateTask task = new CandidateTask(candidate, layer, data, folds, hardDeadline);
					running.put(completionService.submit(task), new RunningCandidate(candidate, cpus, gpus));
					this.logger.debug("Started {} using {} CPU(s) and {} GPU(s).", candidate.getName(), cpus, gpus);
				}
				if (running.isEmpty()) {
					if (!pending.isEmpty()) {
						this.logger.warn("Candidates {} can never be started with {}.", pending, parallelism);
						pending.forEach(c -> notAdmitted.add(c.getName()));
						pending.clear();
					}
					break;
				}

				/* wait for the next candidate to finish, but not beyond the hard deadline */
				long waitMillis = hardDeadline - this.tracker.getElapsedMillis();
				Future<CandidateOutcome> done = waitMillis > 0 ? completionService.poll(waitMillis, TimeUnit.MILLISECONDS) : completionService.poll();
				if (done == null) {
					this.logger.info("Layer {} exceeded its deadline and grace period. Cancelling {} running candidates.", layer + 1, running.size());
					for (Map.Entry<Future<CandidateOutcome>, RunningCandidate> entry : running.entrySet()) {
						entry.getKey().cancel(true);
						failures.add(new CandidateFailure(entry.getValue().config.getName(), layer, CandidateFailure.Kind.TIMEOUT, "still running when the layer deadline and grace period had passed", null));
					}
					running.clear();
					pending.forEach(c -> notAdmitted.add(c.getName()));
					pending.clear();
					break;
				}
				RunningCandidate finished = running.remove(done);
				freeCpus += finished.cpus;
				freeGpus += finished.gpus;
				CandidateOutcome outcome = this.getOutcome(done, finished.config, layer);
				if (outcome.failure != null) {
					this.logger.warn("Candidate {} failed in layer {}: {}", finished.config.getName(), layer + 1, outcome.failure.getReason());
					failures.add(outcome.failure);
					continue;
				}
				try {
					fitted.add(this.accept(outcome, layer, inputModelIds, data.getFeatures().getColumnNames()));
				} catch (IOException e) {
					this.logger.warn("Could not store artifacts of candidate {}: {}", finished.config.getName(), e.getMessage());
					failures.add(new CandidateFailure(finished.config.getName(), layer, CandidateFailure.Kind.FAILED, "artifacts could not be stored: " + e.getMessage(), e));
				}
			}
		} catch (InterruptedException e) {
			running.keySet().forEach(f -> f.cancel(true));
			throw e;
		} finally {
			pool.shutdownNow();
		}

		fitted.sort(Comparator.comparingInt((FittedModel m) -> m.getConfig().getRank()).thenComparing(FittedModel::getId));
		double runtime = (this.tracker.getElapsedMillis() - layerStart) / 1000.0;
		this.logger.info("Layer {} finished after {}s with {} fitted models, {} failures and {} candidates not started.", layer + 1, runtime, fitted.size(), failures.size(), notAdmitted.size());
		return new LayerResult(new LayerOutput(layer, fitted), failures, notAdmitted, runtime);
	}

	private CandidateOutcome getOutcome(final Future<CandidateOutcome> future, final CandidateConfig config, final int layer) throws InterruptedException {
		try {
			return future.get();
		} catch (ExecutionException e) {
			Throwable cause = e.getCause() != null ? e.getCause() : e;
			return CandidateOutcome.failed(new CandidateFailure(config.getName(), layer, CandidateFailure.Kind.FAILED, String.valueOf(cause), cause));
		}
	}

	/**
	 * Stores the artifacts of a successful candidate and records it in the registry and on the leaderboard.
	 */
	private FittedModel accept(final CandidateOutcome outcome, final int layer, final List<String> inputModelIds, final List<String> featureNames) throws IOException {
		String id = FittedModel.getModelId(outcome.config, layer);
		List<ArtifactReference> foldReferences = new ArrayList<>();
		ArtifactReference refitReference = null;
		try {
			for (int i = 0; i < outcome.foldArtifacts.size(); i++) {
				foldReferences.add(this.store.put(id + "_F" + (i + 1), outcome.foldArtifacts.get(i)));
			}
			if (outcome.refitArtifact != null) {
				refitReference = this.store.put(id + "_FULL", outcome.refitArtifact);
			}
		} catch (IOException e) {
			for (ArtifactReference reference : foldReferences) {
				this.store.delete(reference);
			}
			throw e;
		}
		FittedModel model = new FittedModel(id, outcome.config, layer, foldReferences, refitReference, outcome.oof, outcome.score, this.metric.getName(), outcome.fitSeconds, outcome.predictSeconds, outcome.memoryBytes,
				inputModelIds, featureNames);
		this.registry.register(model);
		LeaderboardEntry entry = this.leaderboard.append(new LeaderboardEntry(id, outcome.config.getFamilyId(), layer, outcome.score, outcome.fitSeconds, outcome.predictSeconds, outcome.memoryBytes));
		this.logger.info("Fitted {}: {} {} in {}s (leaderboard position {}).", id, this.metric.getName(), outcome.score, outcome.fitSeconds, entry.getInsertionIndex());
		return model;
	}

	private static class RunningCandidate {
		private final CandidateConfig config;
		private final int cpus;
		private final int gpus;

		RunningCandidate(final CandidateConfig config, final int cpus, final int gpus) {
			this.config = config;
			this.cpus = cpus;
			this.gpus = gpus;
		}
	}

	/**
	 * Result of a candidate task: either everything needed for a fitted model or a failure.
	 */
	private static class CandidateOutcome {
		private CandidateConfig config;
		private List<ModelArtifact> foldArtifacts;
		private ModelArtifact refitArtifact;
		private Predictions oof;
		private double score;
		private double fitSeconds;
		private double predictSeconds;
		private long memoryBytes;
		private CandidateFailure failure;

		static CandidateOutcome failed(final CandidateFailure failure) {
			CandidateOutcome outcome = new CandidateOutcome();
			outcome.failure = failure;
			return outcome;
		}
	}

	/**
	 * Bagged training of one candidate. Catches every candidate-local failure and reports it as outcome.
	 */
	private class CandidateTask implements Callable<CandidateOutcome> {

		private final CandidateConfig config;
		private final int layer;
		private final LabeledDataset data;
		private final RepeatedFoldAssignment folds;
		private final long hardDeadline;

		CandidateTask(final CandidateConfig config, final int layer, final LabeledDataset data, final RepeatedFoldAssignment folds, final long hardDeadline) {
			this.config = config;
			this.layer = layer;
			this.data = data;
			this.folds = folds;
			this.hardDeadline = hardDeadline;
		}

		private CandidateOutcome fail(final CandidateFailure.Kind kind, final String reason, final Throwable cause) {
			return CandidateOutcome.failed(new CandidateFailure(this.config.getName(), this.layer, kind, reason, cause));
		}

		private void checkDeadline() throws AlgorithmTimeoutedException, InterruptedException {
			if (Thread.currentThread().isInterrupted()) {
				throw new InterruptedException("Candidate " + this.config.getName() + " has been cancelled.");
			}
			long overrun = StackLayerBuilder.this.tracker.getElapsedMillis() - this.hardDeadline;
			if (overrun > 0) {
				throw new AlgorithmTimeoutedException(overrun);
			}
		}

		@Override
		public CandidateOutcome call() {
			String name = this.config.getName();
			Optional<ModelFamily> optFamily = StackLayerBuilder.this.families.find(this.config.getFamilyId());
			if (!optFamily.isPresent()) {
				return this.fail(CandidateFailure.Kind.UNSUPPORTED, "no model family " + this.config.getFamilyId() + " is registered", null);
			}
			ModelFamily family = optFamily.get();
			if (!family.supports(this.data.getProblemType())) {
				return this.fail(CandidateFailure.Kind.UNSUPPORTED, "family " + family.getId() + " does not support " + this.data.getProblemType() + " problems", null);
			}

			/* fail fast if external weights are needed but unavailable */
			WeightsHandle weights = null;
			if (this.config.requiresExternalWeights() || family.requiresExternalWeights()) {
				String weightsId = this.config.getWeightsId() != null ? this.config.getWeightsId() : this.config.getName();
				if (StackLayerBuilder.this.weightsProvider == null) {
					return this.fail(CandidateFailure.Kind.MISSING_WEIGHTS, "weights " + weightsId + " are required but no weights provider is configured", null);
				}
				try {
					weights = StackLayerBuilder.this.weightsProvider.getWeights(weightsId);
				} catch (WeightsUnavailableException e) {
					return this.fail(CandidateFailure.Kind.MISSING_WEIGHTS, e.getMessage(), e);
				}
			}

			LayerSettings layerSettings = StackLayerBuilder.this.settings;
			TrainingContext context = new TrainingContext(layerSettings.getSeed(), layerSettings.getQuantileLevels(), weights);
			Map<String, Object> hyperparameters = this.config.getModelHyperparameters();
			try {
				OofAccumulator accumulator = new OofAccumulator(this.data.size(), this.folds.getNumRepetitions());
				List<ModelArtifact> artifacts = new ArrayList<>();
				double fitSeconds = 0;
				double predictSeconds = 0;
				for (int rep = 0; rep < this.folds.getNumRepetitions(); rep++) {
					FoldAssignment assignment = this.folds.getRepetition(rep);
					for (int fold = 0; fold < assignment.getNumFolds(); fold++) {
						this.checkDeadline();
						int[] validationRows = assignment.getValidationRows(fold);
						LabeledDataset train = this.data.selectRows(assignment.getTrainingRows(fold));
						Dataset validation = this.data.getFeatures().selectRows(validationRows);
						long seed = layerSettings.getSeed() + (long) rep * assignment.getNumFolds() + fold;
						FitOutcome outcome = family.fit(train, validation, hyperparameters, context.withSeed(seed));
						accumulator.add(rep, validationRows, outcome.getValidationPredictions());
						artifacts.add(outcome.getArtifact());
						fitSeconds += outcome.getFitSeconds();
						predictSeconds += outcome.getPredictSeconds();
						StackLayerBuilder.this.logger.debug("{}: finished fold {}/{} of repetition {}/{}.", name, fold + 1, assignment.getNumFolds(), rep + 1, this.folds.getNumRepetitions());
					}
				}
				Predictions oof = accumulator.build();
				if (!oof.isFinite()) {
					return this.fail(CandidateFailure.Kind.FAILED, "out-of-fold predictions contain non-finite values", null);
				}
				double score = StackLayerBuilder.this.metric.score(oof, this.data);
				if (Double.isNaN(score)) {
					return this.fail(CandidateFailure.Kind.FAILED, "validation score is undefined", null);
				}

				ModelArtifact refit = null;
				if (layerSettings.isRefitFull()) {
					this.checkDeadline();
					FitOutcome full = family.fit(this.data, null, hyperparameters, context);
					refit = full.getArtifact();
					fitSeconds += full.getFitSeconds();
				}
				this.checkDeadline();

				List<ModelArtifact> all = new ArrayList<>(artifacts);
				if (refit != null) {
					all.add(refit);
				}
				CandidateOutcome outcome = new CandidateOutcome();
				outcome.config = this.config;
				outcome.foldArtifacts = artifacts;
				outcome.refitArtifact = refit;
				outcome.oof = oof;
				outcome.score = score;
				outcome.fitSeconds = fitSeconds;
				outcome.predictSeconds = predictSeconds;
				outcome.memoryBytes = ArtifactSizes.serializedSize(all);
				return outcome;
			} catch (AlgorithmTimeoutedException e) {
				return this.fail(CandidateFailure.Kind.TIMEOUT, "layer deadline and grace period passed during training", e);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return this.fail(CandidateFailure.Kind.TIMEOUT, "cancelled", e);
			} catch (ModelFitException | IOException e) {
				return this.fail(CandidateFailure.Kind.FAILED, e.getMessage(), e);
			} catch (RuntimeException e) {
				return this.fail(CandidateFailure.Kind.FAILED, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
			} catch (OutOfMemoryError e) {
				return this.fail(CandidateFailure.Kind.FAILED, "out of memory", e);
			}
		}
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
