package autostack.family;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableSet;

import autostack.data.Dataset;
import autostack.data.LabeledDataset;
import autostack.data.Predictions;
import autostack.data.ProblemType;
import weka.classifiers.AbstractClassifier;
import weka.classifiers.Classifier;
import weka.core.Instances;
import weka.core.Randomizable;

/**
 * Model family backed by one Weka learner for classification and one for regression. Hyperparameters are passed as Weka options: a key {@code I}
 * with value 100 becomes {@code -I 100}; a value of true becomes the flag {@code -I} alone.
 *
 * Quantile problems are solved with the regressor: the empirical quantiles of its cross-validated residuals are added to the point prediction.
 */
public class WekaModelFamily implements ModelFamily {

	private static final int INNER_FOLDS = 5;
	private static final int MIN_ROWS_PER_INNER_FOLD = 4;

	private final Logger logger;

	private final String id;
	private final String classifierName;
	private final String regressorName;
	private final ImmutableSet<String> knownHyperparameters;

	/**
	 * @param classifierName
	 *            Weka class used for classification, or null if the family cannot classify
	 * @param regressorName
	 *            Weka class used for regression and quantile problems, or null if the family cannot regress
	 */
	public WekaModelFamily(final String id, final String classifierName, final String regressorName, final Set<String> knownHyperparameters) {
		super();
		this.id = id;
		this.classifierName = classifierName;
		this.regressorName = regressorName;
		this.knownHyperparameters = ImmutableSet.copyOf(knownHyperparameters);
		this.logger = LoggerFactory.getLogger(WekaModelFamily.class.getName() + "." + id);
	}

	@Override
	public String getId() {
		return this.id;
	}

	@Override
	public boolean supports(final ProblemType problemType) {
		return problemType.isClassification() ? this.classifierName != null : this.regressorName != null;
	}

	@Override
	public Set<String> getKnownHyperparameters() {
		return this.knownHyperparameters;
	}

	public String getLearnerName(final ProblemType problemType) {
		return problemType.isClassification() ? this.classifierName : this.regressorName;
	}

	/**
	 * Builds Weka options from the hyperparameters. Hyperparameters the family does not know are dropped with a warning.
	 */
	public String[] getOptions(final Map<String, Object> hyperparameters) {
		List<String> options = new ArrayList<>();
		Set<String> unknown = new TreeSet<>();
		for (Entry<String, Object> hp : hyperparameters.entrySet()) {
			if (!this.knownHyperparameters.isEmpty() && !this.knownHyperparameters.contains(hp.getKey())) {
				unknown.add(hp.getKey());
				continue;
			}
			Object value = hp.getValue();
			if (value instanceof Boolean) {
				if ((Boolean) value) {
					options.add("-" + hp.getKey());
				}
				continue;
			}
			options.add("-" + hp.getKey());
			options.add(String.valueOf(value));
		}
		if (!unknown.isEmpty()) {
			this.logger.warn("Ignoring hyperparameters {} that are unknown to family {}. Known are {}.", unknown, this.id, this.knownHyperparameters);
		}
		return options.toArray(new String[0]);
	}

	/**
	 * Creates an untrained learner for the given problem.
	 */
	protected Classifier createClassifier(final ProblemType problemType, final Map<String, Object> hyperparameters, final TrainingContext context) throws Exception {
		String learner = this.getLearnerName(problemType);
		if (learner == null) {
			throw new ModelFitException("Family " + this.id + " does not support " + problemType + " problems.");
		}
		return AbstractClassifier.forName(learner, this.getOptions(hyperparameters));
	}

	@Override
	public FitOutcome fit(final LabeledDataset train, final Dataset validation, final Map<String, Object> hyperparameters, final TrainingContext context) throws ModelFitException, InterruptedException {
		ProblemType problemType = train.getProblemType();
		if (!this.supports(problemType)) {
			throw new ModelFitException("Family " + this.id + " does not support " + problemType + " problems.");
		}
		Stopwatch fitWatch = Stopwatch.createStarted();
		Instances instances = WekaConversion.toInstances(train, this.id);
		Classifier classifier;
		try {
			classifier = this.createClassifier(problemType, hyperparameters, context);
		} catch (ModelFitException e) {
			throw e;
		} catch (Exception e) {
			throw new ModelFitException("Could not instantiate learner of family " + this.id + " with " + hyperparameters, e);
		}
		if (classifier instanceof Randomizable) {
			((Randomizable) classifier).setSeed((int) context.getSeed());
		}
		try {
			classifier.buildClassifier(instances);
		} catch (InterruptedException e) {
			throw e;
		} catch (Exception e) {
			throw new ModelFitException("Training of " + classifier.getClass().getSimpleName() + " failed: " + e.getMessage(), e);
		}
		if (Thread.interrupted()) {
			throw new InterruptedException("Training of family " + this.id + " has been interrupted.");
		}

		List<String> featureNames = train.getFeatures().getColumnNames();
		WekaArtifact artifact;
		if (problemType == ProblemType.QUANTILE) {
			double[] levels = context.getQuantileLevels();
			artifact = new WekaArtifact(classifier, instances, problemType, featureNames, levels, this.getResidualQuantiles(classifier, instances, hyperparameters, context));
		} else {
			artifact = new WekaArtifact(classifier, instances, problemType, featureNames);
		}
		double fitSeconds = fitWatch.elapsed(TimeUnit.NANOSECONDS) / 1e9;

		Predictions validationPredictions = null;
		double predictSeconds = 0;
		if (validation != null) {
			Stopwatch predictWatch = Stopwatch.createStarted();
			validationPredictions = this.predict(artifact, validation);
			predictSeconds = predictWatch.elapsed(TimeUnit.NANOSECONDS) / 1e9;
		}
		this.logger.debug("Fit {} on {} rows in {}s.", classifier.getClass().getSimpleName(), train.size(), fitSeconds);
		return new FitOutcome(artifact, validationPredictions, fitSeconds, predictSeconds);
	}

	/**
	 * Offsets are quantiles of the residuals that fresh copies of the learner make on the held-out parts of an inner cross-validation. Tables too
	 * small to split fall back to the training residuals of the final model.
	 */
	private double[] getResidualQuantiles(final Classifier trained, final Instances instances, final Map<String, Object> hyperparameters, final TrainingContext context)
			throws ModelFitException, InterruptedException {
		DescriptiveStatistics residuals = new DescriptiveStatistics();
		try {
			if (instances.numInstances() < INNER_FOLDS * MIN_ROWS_PER_INNER_FOLD) {
				this.logger.debug("Only {} rows, computing quantile offsets from training residuals.", instances.numInstances());
				addResiduals(residuals, trained, instances);
			} else {
				Instances shuffled = new Instances(instances);
				shuffled.randomize(new Random(context.getSeed()));
				for (int fold = 0; fold < INNER_FOLDS; fold++) {
					Classifier inner = this.createClassifier(ProblemType.QUANTILE, hyperparameters, context);
					if (inner instanceof Randomizable) {
						((Randomizable) inner).setSeed((int) context.getSeed());
					}
					inner.buildClassifier(shuffled.trainCV(INNER_FOLDS, fold));
					addResiduals(residuals, inner, shuffled.testCV(INNER_FOLDS, fold));
					if (Thread.interrupted()) {
						throw new InterruptedException("Computing residuals of family " + this.id + " has been interrupted.");
					}
				}
			}
		} catch (InterruptedException | ModelFitException e) {
			throw e;
		} catch (Exception e) {
			throw new ModelFitException("Could not compute residuals of family " + this.id, e);
		}
		double[] levels = context.getQuantileLevels();
		double[] offsets = new double[levels.length];
		for (int q = 0; q < levels.length; q++) {
			offsets[q] = residuals.getPercentile(levels[q] * 100);
		}
		return offsets;
	}

	private static void addResiduals(final DescriptiveStatistics residuals, final Classifier classifier, final Instances instances) throws Exception {
		for (int i = 0; i < instances.numInstances(); i++) {
			residuals.addValue(instances.instance(i).classValue() - classifier.classifyInstance(instances.instance(i)));
		}
	}

	@Override
	public Predictions predict(final ModelArtifact artifact, final Dataset data) throws ModelFitException {
		if (!(artifact instanceof WekaArtifact)) {
			throw new ModelFitException("Family " + this.id + " cannot interpret artifacts of type " + artifact.getClass().getName());
		}
		WekaArtifact wekaArtifact = (WekaArtifact) artifact;
		Instances instances = WekaConversion.toUnlabeledInstances(data, wekaArtifact.getHeader());
		Classifier classifier = wekaArtifact.getClassifier();
		int n = instances.numInstances();
		try {
			switch (wekaArtifact.getProblemType()) {
			case BINARY:
			case MULTICLASS:
				double[][] probabilities = new double[n][];
				for (int i = 0; i < n; i++) {
					probabilities[i] = classifier.distributionForInstance(instances.instance(i));
				}
				return Predictions.ofProbabilities(wekaArtifact.getProblemType(), probabilities);
			case REGRESSION:
				double[] values = new double[n];
				for (int i = 0; i < n; i++) {
					values[i] = classifier.classifyInstance(instances.instance(i));
				}
				return Predictions.ofValues(values);
			case QUANTILE:
				double[] offsets = wekaArtifact.getQuantileOffsets();
				double[][] quantiles = new double[n][offsets.length];
				for (int i = 0; i < n; i++) {
					double point = classifier.classifyInstance(instances.instance(i));
					for (int q = 0; q < offsets.length; q++) {
						quantiles[i][q] = point + offsets[q];
					}
				}
				return Predictions.ofQuantiles(wekaArtifact.getQuantileLevels(), quantiles);
			default:
				throw new ModelFitException("Unsupported problem type " + wekaArtifact.getProblemType());
			}
		} catch (ModelFitException e) {
			throw e;
		} catch (Exception e) {
			throw new ModelFitException("Prediction with family " + this.id + " failed: " + e.getMessage(), e);
		}
	}

	@Override
	public String toString() {
		return "WekaModelFamily [id=" + this.id + ", classifier=" + this.classifierName + ", regressor=" + this.regressorName + "]";
	}
}
