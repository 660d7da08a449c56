package autostack.stacking;

import java.util.Arrays;

/**
 * Policy knobs of the layer builder that stay fixed during a fit.
 */
public class LayerSettings {

	public static final double DEFAULT_MIN_MODEL_SECONDS = 1.0;
	public static final double DEFAULT_GRACE_PERIOD_SECONDS = 5.0;
	public static final double DEFAULT_MAX_HEAP_FRACTION = 0.8;

	private final double minModelSeconds;
	private final double gracePeriodSeconds;
	private final boolean refitFull;
	private final long seed;
	private final double[] quantileLevels;
	private final double maxHeapFraction;

	/**
	 * @param minModelSeconds
	 *            no further candidate is started once less than this time remains
	 * @param gracePeriodSeconds
	 *            how long running candidates may overrun the layer deadline
	 * @param quantileLevels
	 *            the levels models predict for quantile problems, including the median
	 */
	public LayerSettings(final double minModelSeconds, final double gracePeriodSeconds, final boolean refitFull, final long seed, final double[] quantileLevels) {
		this(minModelSeconds, gracePeriodSeconds, refitFull, seed, quantileLevels, DEFAULT_MAX_HEAP_FRACTION);
	}

	/**
	 * @param maxHeapFraction
	 *            share of the maximum heap that training may fill; candidates whose memory estimate exceeds what is left are not started
	 */
	public LayerSettings(final double minModelSeconds, final double gracePeriodSeconds, final boolean refitFull, final long seed, final double[] quantileLevels, final double maxHeapFraction) {
		super();
		if (minModelSeconds < 0 || gracePeriodSeconds < 0) {
			throw new IllegalArgumentException("Minimum model time and grace period must not be negative.");
		}
		if (!(maxHeapFraction > 0 && maxHeapFraction <= 1)) {
			throw new IllegalArgumentException("The heap fraction must lie in (0, 1], got " + maxHeapFraction);
		}
		this.maxHeapFraction = maxHeapFraction;
		this.minModelSeconds = minModelSeconds;
		this.gracePeriodSeconds = gracePeriodSeconds;
		this.refitFull = refitFull;
		this.seed = seed;
		this.quantileLevels = quantileLevels != null ? Arrays.copyOf(quantileLevels, quantileLevels.length) : new double[0];
	}

	public double getMinModelSeconds() {
		return this.minModelSeconds;
	}

	public double getGracePeriodSeconds() {
		return this.gracePeriodSeconds;
	}

	public long getGracePeriodMillis() {
		return Math.round(this.gracePeriodSeconds * 1000);
	}

	public boolean isRefitFull() {
		return this.refitFull;
	}

	public long getSeed() {
		return this.seed;
	}

	public double[] getQuantileLevels() {
		return Arrays.copyOf(this.quantileLevels, this.quantileLevels.length);
	}

	public double getMaxHeapFraction() {
		return this.maxHeapFraction;
	}

	@Override
	public String toString() {
		return "LayerSettings [minModelSeconds=" + this.minModelSeconds + ", gracePeriodSeconds=" + this.gracePeriodSeconds + ", refitFull=" + this.refitFull + ", seed=" + this.seed + ", quantileLevels="
				+ Arrays.toString(this.quantileLevels) + ", maxHeapFraction=" + this.maxHeapFraction + "]";
	}
}
