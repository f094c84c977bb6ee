package io.evitadb.pdftranslator.llm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RequestThrottle should space out requests")
class RequestThrottleTest {

	@Test
	@DisplayName("shouldComputeIntervalFromRate")
	void shouldComputeIntervalFromRate() {
		assertEquals(250, new RequestThrottle(4).getIntervalMillis());
		assertEquals(1000, new RequestThrottle(1).getIntervalMillis());
	}

	@Test
	@DisplayName("shouldRejectNonPositiveRate")
	void shouldRejectNonPositiveRate() {
		assertThrows(IllegalArgumentException.class, () -> new RequestThrottle(0));
	}

	@Test
	@DisplayName("shouldDelaySubsequentRequests")
	void shouldDelaySubsequentRequests() throws Exception {
		final RequestThrottle throttle = new RequestThrottle(10);

		final long start = System.nanoTime();
		throttle.acquire();
		throttle.acquire();
		throttle.acquire();
		final long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

		assertTrue(elapsedMillis >= 190, "three requests at 10 qps take at least two intervals, took " + elapsedMillis);
	}
}
