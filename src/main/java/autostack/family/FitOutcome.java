package autostack.family;

import java.util.Objects;

import autostack.data.Predictions;

public class FitOutcome {

	private final ModelArtifact artifact;
	private final Predictions validationPredictions;
	private final double fitSeconds;
	private final double predictSeconds;

	public FitOutcome(final ModelArtifact artifact, final Predictions validationPredictions, final double fitSeconds, final double predictSeconds) {
		super();
		this.artifact = Objects.requireNonNull(artifact);
		this.validationPredictions = validationPredictions;
		this.fitSeconds = fitSeconds;
		this.predictSeconds = predictSeconds;
	}

	public ModelArtifact getArtifact() {
		return this.artifact;
	}

	/**
	 * @return predictions for the validation rows, or null if no validation rows were given
	 */
	public Predictions getValidationPredictions() {
		return this.validationPredictions;
	}

	public double getFitSeconds() {
		return this.fitSeconds;
	}

	public double getPredictSeconds() {
		return this.predictSeconds;
	}
}
