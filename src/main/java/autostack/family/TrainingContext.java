package autostack.family;

import java.util.Arrays;

import autostack.weights.WeightsHandle;

/**
 * Everything a family may need besides data and hyperparameters.
 */
public class TrainingContext {

	private final long seed;
	private final double[] quantileLevels;
	private final WeightsHandle weights;

	public TrainingContext(final long seed, final double[] quantileLevels, final WeightsHandle weights) {
		super();
		this.seed = seed;
		this.quantileLevels = quantileLevels != null ? Arrays.copyOf(quantileLevels, quantileLevels.length) : new double[0];
		this.weights = weights;
	}

	public long getSeed() {
		return this.seed;
	}

	/**
	 * @return the quantile levels to predict; empty unless the problem is a quantile problem
	 */
	public double[] getQuantileLevels() {
		return Arrays.copyOf(this.quantileLevels, this.quantileLevels.length);
	}

	/**
	 * @return pretrained weights of the candidate, or null if it does not need any
	 */
	public WeightsHandle getWeights() {
		return this.weights;
	}

	public TrainingContext withSeed(final long newSeed) {
		return new TrainingContext(newSeed, this.quantileLevels, this.weights);
	}
}
