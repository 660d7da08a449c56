package autostack.weights;

/**
 * Source of pretrained weight artifacts for candidates that cannot be trained from scratch.
 */
public interface WeightsProvider {

	/**
	 * @throws WeightsUnavailableException
	 *             if the weights cannot be provided, e.g. because they are neither cached nor downloadable
	 */
	public WeightsHandle getWeights(String modelId) throws WeightsUnavailableException;
}
