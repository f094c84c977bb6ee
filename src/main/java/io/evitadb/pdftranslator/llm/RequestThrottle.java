package io.evitadb.pdftranslator.llm;

import java.util.concurrent.TimeUnit;

/**
 * Spaces out model requests so that at most the configured number of requests start per second.
 */
public final class RequestThrottle {

	private final long intervalNanos;
	private long nextSlotNanos;

	/**
	 * Creates a throttle.
	 *
	 * @param requestsPerSecond maximum number of requests per second, at least 1
	 */
	public RequestThrottle(int requestsPerSecond) {
		if (requestsPerSecond < 1) {
			throw new IllegalArgumentException("requestsPerSecond must be at least 1");
		}
		this.intervalNanos = TimeUnit.SECONDS.toNanos(1) / requestsPerSecond;
		this.nextSlotNanos = System.nanoTime();
	}

	/**
	 * Blocks until the next request may start.
	 *
	 * @throws InterruptedException if the waiting thread is interrupted
	 */
	public void acquire() throws InterruptedException {
		final long waitNanos;
		synchronized (this) {
			final long now = System.nanoTime();
			final long slot = Math.max(now, this.nextSlotNanos);
			this.nextSlotNanos = slot + this.intervalNanos;
			waitNanos = slot - now;
		}
		if (waitNanos > 0) {
			TimeUnit.NANOSECONDS.sleep(waitNanos);
		}
	}

	/**
	 * Returns the minimal spacing between two requests.
	 *
	 * @return interval in milliseconds
	 */
	public long getIntervalMillis() {
		return TimeUnit.NANOSECONDS.toMillis(this.intervalNanos);
	}
}
