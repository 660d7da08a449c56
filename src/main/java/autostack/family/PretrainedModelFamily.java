package autostack.family;

import java.util.Map;
import java.util.Set;

import autostack.data.ProblemType;
import weka.classifiers.AbstractClassifier;
import weka.classifiers.Classifier;
import weka.core.OptionHandler;
import weka.core.SerializationHelper;

/**
 * Family whose learner is not configured from scratch but read from a pretrained weights artifact: a serialized Weka classifier acting as prototype.
 * Every fold trains a fresh copy of the prototype.
 */
public class PretrainedModelFamily extends WekaModelFamily {

	public PretrainedModelFamily(final String id, final Set<String> knownHyperparameters) {
		super(id, null, null, knownHyperparameters);
	}

	@Override
	public boolean supports(final ProblemType problemType) {
		return true;
	}

	@Override
	public boolean requiresExternalWeights() {
		return true;
	}

	@Override
	protected Classifier createClassifier(final ProblemType problemType, final Map<String, Object> hyperparameters, final TrainingContext context) throws Exception {
		if (context.getWeights() == null) {
			throw new ModelFitException("Family " + this.getId() + " requires pretrained weights, but none were provided.");
		}
		Object prototype = SerializationHelper.read(context.getWeights().getLocation().toString());
		if (!(prototype instanceof Classifier)) {
			throw new ModelFitException("Weights " + context.getWeights().getModelId() + " do not contain a Weka classifier but " + prototype.getClass().getName());
		}
		Classifier classifier = AbstractClassifier.makeCopy((Classifier) prototype);
		String[] options = this.getOptions(hyperparameters);
		if (options.length > 0 && classifier instanceof OptionHandler) {
			((OptionHandler) classifier).setOptions(options);
		}
		return classifier;
	}
}
