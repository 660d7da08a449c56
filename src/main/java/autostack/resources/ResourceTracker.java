package autostack.resources;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

import org.api4.java.algorithm.Timeout;
import org.api4.java.common.control.ILoggingCustomizable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;

/**
 * Remaining-time clock and resource view of a single fit. The clock starts on construction. Parallelism is probed on first request and then cached
 * until the fit ends, so that co-located jobs cannot change the view mid-fit.
 */
public class ResourceTracker implements ILoggingCustomizable {

	private Logger logger = LoggerFactory.getLogger(ResourceTracker.class);

	private final Timeout budget;
	private final Stopwatch stopwatch;
	private final ResourceProbe probe;
	private Parallelism parallelism;

	public ResourceTracker(final Timeout budget, final ResourceProbe probe) {
		this(budget, probe, Ticker.systemTicker());
	}

	public ResourceTracker(final Timeout budget, final ResourceProbe probe, final Ticker ticker) {
		super();
		this.budget = Objects.requireNonNull(budget);
		this.probe = Objects.requireNonNull(probe);
		this.stopwatch = Stopwatch.createStarted(ticker);
	}

	public Timeout getBudget() {
		return this.budget;
	}

	public long getElapsedMillis() {
		return this.stopwatch.elapsed(TimeUnit.MILLISECONDS);
	}

	public double getElapsedSeconds() {
		return this.stopwatch.elapsed(TimeUnit.NANOSECONDS) / 1e9;
	}

	public long getRemainingMillis() {
		return Math.max(0, this.budget.milliseconds() - this.getElapsedMillis());
	}

	/**
	 * @return seconds left of the original budget; never negative
	 */
	public double getRemainingSeconds() {
		return Math.max(0, this.budget.milliseconds() / 1000.0 - this.getElapsedSeconds());
	}

	public boolean isExhausted() {
		return this.getRemainingMillis() <= 0;
	}

	public synchronized Parallelism getAvailableParallelism() {
		if (this.parallelism == null) {
			try {
				this.parallelism = this.probe.probe();
			} catch (RuntimeException e) {
				this.logger.warn("Resource detection failed, continuing with a single core and no GPU. Reason: {}", e.getMessage());
				this.parallelism = Parallelism.singleCore();
			}
		}
		return this.parallelism;
	}

	/**
	 * @param maxHeapFraction
	 *            share of the maximum heap that the fit may fill
	 * @return bytes that may still be allocated before the used heap exceeds the given share of the maximum heap; {@link Long#MAX_VALUE} if the
	 *         maximum heap is unknown
	 */
	public long getHeapHeadroomBytes(final double maxHeapFraction) {
		long maxHeap = this.probe.getMaxHeapBytes();
		if (maxHeap <= 0 || maxHeap == Long.MAX_VALUE) {
			return Long.MAX_VALUE;
		}
		return Math.max(0, (long) (maxHeap * maxHeapFraction) - this.probe.getUsedHeapBytes());
	}

	@Override
	public String toString() {
		return "ResourceTracker [budget=" + this.budget + ", elapsedMillis=" + this.getElapsedMillis() + ", parallelism=" + this.parallelism + "]";
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
