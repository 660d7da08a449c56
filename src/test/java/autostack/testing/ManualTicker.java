package autostack.testing;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.base.Ticker;

public class ManualTicker extends Ticker {

	private final AtomicLong nanos = new AtomicLong();

	public ManualTicker advance(final long amount, final TimeUnit unit) {
		this.nanos.addAndGet(unit.toNanos(amount));
		return this;
	}

	@Override
	public long read() {
		return this.nanos.get();
	}
}
