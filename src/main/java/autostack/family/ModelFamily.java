package autostack.family;

import java.util.Map;
import java.util.Set;

import autostack.data.Dataset;
import autostack.data.LabeledDataset;
import autostack.data.Predictions;
import autostack.data.ProblemType;

/**
 * A training algorithm the engine treats as an opaque fit/predict unit.
 */
public interface ModelFamily {

	public String getId();

	public boolean supports(ProblemType problemType);

	/**
	 * @return whether the family needs a pretrained weights artifact, handed over through {@link TrainingContext#getWeights()}
	 */
	public default boolean requiresExternalWeights() {
		return false;
	}

	/**
	 * @return the hyperparameters the family understands; an empty set means that all are accepted
	 */
	public Set<String> getKnownHyperparameters();

	/**
	 * Trains a model on the given rows and predicts the validation rows, if any.
	 *
	 * @param validation
	 *            features of held-out rows, may be null
	 */
	public FitOutcome fit(LabeledDataset train, Dataset validation, Map<String, Object> hyperparameters, TrainingContext context) throws ModelFitException, InterruptedException;

	public Predictions predict(ModelArtifact artifact, Dataset data) throws ModelFitException;
}
