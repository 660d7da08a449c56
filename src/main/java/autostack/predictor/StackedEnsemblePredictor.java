package autostack.predictor;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import autostack.AutoStackException;
import autostack.data.Dataset;
import autostack.data.Predictions;
import autostack.data.ProblemType;
import autostack.ensemble.EnsembleWeights;
import autostack.family.ModelFamily;
import autostack.family.ModelFamilyRegistry;
import autostack.leaderboard.InferencePlan;
import autostack.leaderboard.Leaderboard;
import autostack.leaderboard.ModelRegistry;
import autostack.stacking.FittedModel;
import autostack.stacking.StackFeatures;
import autostack.storage.ArtifactReference;
import autostack.storage.ArtifactStore;

/**
 * Evaluates the models of an inference plan layer by layer and combines the ensemble members with their weights. A model uses its refit artifact
 * if it has one, and the average of its fold models otherwise.
 */
public class StackedEnsemblePredictor implements Predictor {

	private final Logger logger = LoggerFactory.getLogger(StackedEnsemblePredictor.class);

	private final ModelRegistry registry;
	private final ArtifactStore store;
	private final ModelFamilyRegistry families;
	private final InferencePlan plan;
	private final Leaderboard leaderboard;
	private final ProblemType problemType;
	private final ImmutableList<String> classLabels;
	private final ImmutableList<String> featureNames;
	private final ImmutableMap<String, ImmutableList<String>> nominalValues;
	private final double[] requestedQuantileLevels;
	private final FitSummary summary;

	public StackedEnsemblePredictor(final ModelRegistry registry, final ArtifactStore store, final ModelFamilyRegistry families, final InferencePlan plan, final Leaderboard leaderboard, final ProblemType problemType,
			final List<String> classLabels, final List<String> featureNames, final Map<String, List<String>> nominalValues, final double[] requestedQuantileLevels, final FitSummary summary) {
		super();
		this.registry = Objects.requireNonNull(registry);
		this.store = Objects.requireNonNull(store);
		this.families = Objects.requireNonNull(families);
		this.plan = Objects.requireNonNull(plan);
		this.leaderboard = Objects.requireNonNull(leaderboard);
		this.problemType = Objects.requireNonNull(problemType);
		this.classLabels = classLabels != null ? ImmutableList.copyOf(classLabels) : ImmutableList.of();
		this.featureNames = ImmutableList.copyOf(featureNames);
		ImmutableMap.Builder<String, ImmutableList<String>> nominal = ImmutableMap.builder();
		nominalValues.forEach((column, values) -> nominal.put(column, ImmutableList.copyOf(values)));
		this.nominalValues = nominal.build();
		this.requestedQuantileLevels = requestedQuantileLevels != null ? Arrays.copyOf(requestedQuantileLevels, requestedQuantileLevels.length) : null;
		this.summary = summary;
	}

	/**
	 * @return the combined ensemble predictions, for quantile problems restricted to the requested levels
	 */
	public Predictions predictEnsemble(final Dataset data) throws AutoStackException {
		Dataset base = this.alignWithTrainingData(data);
		Map<String, Predictions> predictions = new HashMap<>();
		for (Entry<Integer, ImmutableList<String>> layer : this.plan.getModelsPerLayer().entrySet()) {
			Map<List<String>, Dataset> featuresByInputs = new HashMap<>();
			for (String id : layer.getValue()) {
				FittedModel model = this.registry.getOrFail(id);
				Dataset features = featuresByInputs.computeIfAbsent(model.getInputModelIds(), inputs -> inputs.isEmpty() ? base : StackFeatures.augment(base, inputs, predictions, this.classLabels));
				predictions.put(id, this.predictWithModel(model, features.project(model.getFeatureNames())));
			}
			this.logger.debug("Evaluated {} models of layer {}.", layer.getValue().size(), layer.getKey() + 1);
		}
		Predictions combined = this.plan.getWeights().combine(predictions);
		if (this.problemType == ProblemType.QUANTILE && this.requestedQuantileLevels != null) {
			return combined.selectQuantiles(this.requestedQuantileLevels);
		}
		return combined;
	}

	/**
	 * Projects the data onto the training features and re-encodes nominal columns into the value lists seen in training. Values unknown in
	 * training become missing.
	 */
	private Dataset alignWithTrainingData(final Dataset data) throws AutoStackException {
		for (String feature : this.featureNames) {
			if (!data.hasColumn(feature)) {
				throw new AutoStackException("Column " + feature + " of the training data is missing.");
			}
			boolean nominalInTraining = this.nominalValues.containsKey(feature);
			if (data.isNominal(feature) != nominalInTraining) {
				throw new AutoStackException("Column " + feature + " was " + (nominalInTraining ? "nominal" : "numeric") + " in the training data but is " + (nominalInTraining ? "numeric" : "nominal") + " here.");
			}
		}
		Dataset aligned = data.project(this.featureNames);
		for (Entry<String, ImmutableList<String>> nominal : this.nominalValues.entrySet()) {
			if (!aligned.getNominalValues(nominal.getKey()).equals(nominal.getValue())) {
				this.logger.debug("Re-encoding column {} from {} to the training values {}.", nominal.getKey(), aligned.getNominalValues(nominal.getKey()), nominal.getValue());
				aligned = aligned.recodeNominal(nominal.getKey(), nominal.getValue());
			}
		}
		return aligned;
	}

	private Predictions predictWithModel(final FittedModel model, final Dataset features) throws AutoStackException {
		ModelFamily family = this.families.find(model.getFamilyId()).orElseThrow(() -> new IllegalStateException("Family " + model.getFamilyId() + " of model " + model.getId() + " is not registered."));
		try {
			if (model.hasRefitArtifact()) {
				return family.predict(this.store.load(model.getRefitArtifact()), features);
			}
			List<Predictions> perFold = new ArrayList<>();
			for (ArtifactReference reference : model.getFoldArtifacts()) {
				perFold.add(family.predict(this.store.load(reference), features));
			}
			return Predictions.average(perFold);
		} catch (IOException e) {
			throw new AutoStackException("Could not load artifacts of model " + model.getId(), e);
		}
	}

	@Override
	public double[][] predict(final Dataset data) throws AutoStackException {
		Predictions predictions = this.predictEnsemble(data);
		if (this.problemType.isClassification()) {
			int[] classes = predictions.getMostLikelyClasses();
			double[][] result = new double[classes.length][1];
			for (int i = 0; i < classes.length; i++) {
				result[i][0] = classes[i];
			}
			return result;
		}
		return predictions.toArray();
	}

	@Override
	public Predictions predictProba(final Dataset data) throws AutoStackException {
		if (!this.problemType.isClassification()) {
			throw new UnsupportedOperationException("Probabilities are only available for classification, but this is a " + this.problemType + " problem.");
		}
		return this.predictEnsemble(data);
	}

	@Override
	public List<String> predictLabels(final Dataset data) throws AutoStackException {
		if (!this.problemType.isClassification()) {
			throw new UnsupportedOperationException("Labels are only available for classification, but this is a " + this.problemType + " problem.");
		}
		List<String> labels = new ArrayList<>();
		for (int c : this.predictEnsemble(data).getMostLikelyClasses()) {
			labels.add(this.classLabels.get(c));
		}
		return labels;
	}

	public ProblemType getProblemType() {
		return this.problemType;
	}

	public ImmutableList<String> getClassLabels() {
		return this.classLabels;
	}

	public FittedModel getModel(final String id) {
		return this.registry.getOrFail(id);
	}

	@Override
	public Leaderboard getLeaderboard() {
		return this.leaderboard;
	}

	@Override
	public EnsembleWeights getEnsembleWeights() {
		return this.plan.getWeights();
	}

	@Override
	public InferencePlan getInferencePlan() {
		return this.plan;
	}

	@Override
	public FitSummary getFitSummary() {
		return this.summary;
	}
}
