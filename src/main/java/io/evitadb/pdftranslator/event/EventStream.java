package io.evitadb.pdftranslator.event;

import java.util.Iterator;

/**
 * Lazy, finite, single-pass sequence of events produced by an engine for one run.
 *
 * `hasNext()` blocks until the next event is available or the stream ends. `next()` may return null,
 * which is an empty placeholder to be skipped. Any runtime exception thrown by `hasNext()` or `next()`
 * signals a failure of the stream itself.
 *
 * Closing the stream releases the underlying resources and tells the producer to stop. `close()` must be
 * idempotent.
 */
public interface EventStream extends Iterator<TranslationEvent>, AutoCloseable {

	/**
	 * Whether `hasNext()` would return without blocking. Streams that cannot tell report false.
	 *
	 * @return true if the next event, the end or the failure of the stream is already available
	 */
	default boolean isReady() {
		return false;
	}

	@Override
	void close();
}
