package autostack.weights;

import autostack.AutoStackException;

public class WeightsUnavailableException extends AutoStackException {

	private static final long serialVersionUID = 5218903348742175571L;

	private final String modelId;

	public WeightsUnavailableException(final String modelId, final String message) {
		super("Weights of " + modelId + " are unavailable: " + message);
		this.modelId = modelId;
	}

	public String getModelId() {
		return this.modelId;
	}
}
