package io.evitadb.pdftranslator;

import io.evitadb.pdftranslator.event.EventStream;
import io.evitadb.pdftranslator.model.ResultData;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle of a started translation run. The run is consumed on the controller's scheduler; this handle
 * lets the caller wait for its result, bound the wait with a deadline or cancel it.
 *
 * The event stream of the run is released exactly once, whichever of completion, failure or
 * cancellation happens first.
 */
public final class TranslationRun {

	@Nonnull
	private final Path document;
	@Nonnull
	private final EventStream stream;
	@Nonnull
	private final Log log;
	@Nonnull
	private final CompletableFuture<ResultData> result = new CompletableFuture<>();
	@Nonnull
	private final AtomicBoolean released = new AtomicBoolean(false);
	private volatile boolean cancelled;

	TranslationRun(@Nonnull Path document, @Nonnull EventStream stream, @Nonnull Log log) {
		this.document = Objects.requireNonNull(document, "document must not be null");
		this.stream = Objects.requireNonNull(stream, "stream must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Returns the document being translated.
	 *
	 * @return source document
	 */
	@Nonnull
	public Path getDocument() {
		return this.document;
	}

	/**
	 * Waits for the run to finish.
	 *
	 * @return the result of the run
	 * @throws TranslationRunException the failure that ended the run
	 */
	@Nonnull
	public ResultData await() throws TranslationRunException {
		try {
			return this.result.get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			cancel();
			throw new RunCancelledException("Interrupted while waiting for translation of " + this.document);
		} catch (ExecutionException e) {
			throw unwrap(e);
		}
	}

	/**
	 * Waits at most the given time for the run to finish. When the deadline expires the run is cancelled.
	 *
	 * @param timeout maximum time to wait
	 * @return the result of the run
	 * @throws RunCancelledException   if the deadline expired
	 * @throws TranslationRunException the failure that ended the run
	 */
	@Nonnull
	public ResultData await(@Nonnull Duration timeout) throws TranslationRunException {
		Objects.requireNonNull(timeout, "timeout must not be null");
		final long timeoutNanos = toNanosSaturated(timeout);
		try {
			return this.result.get(timeoutNanos, TimeUnit.NANOSECONDS);
		} catch (TimeoutException e) {
			cancel();
			throw new RunCancelledException(
				"Translation of " + this.document + " did not finish within " +
					TimeUnit.NANOSECONDS.toMillis(timeoutNanos) + " ms"
			);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			cancel();
			throw new RunCancelledException("Interrupted while waiting for translation of " + this.document);
		} catch (ExecutionException e) {
			throw unwrap(e);
		}
	}

	/**
	 * Cancels the run: the event stream is released and waiting callers receive
	 * {@link RunCancelledException}. Has no effect on a finished run.
	 *
	 * @return true if the run was still in progress
	 */
	public boolean cancel() {
		if (this.result.isDone()) {
			return false;
		}
		this.cancelled = true;
		final boolean cancelledNow = this.result.completeExceptionally(
			new RunCancelledException("Translation of " + this.document + " was cancelled")
		);
		release();
		return cancelledNow;
	}

	/**
	 * Whether the run has finished, successfully or not.
	 *
	 * @return true once a result or failure is available
	 */
	public boolean isDone() {
		return this.result.isDone();
	}

	/**
	 * Whether {@link #cancel()} was called while the run was in progress.
	 *
	 * @return true if cancelled
	 */
	public boolean isCancelled() {
		return this.cancelled;
	}

	void succeed(@Nonnull ResultData resultData) {
		this.result.complete(resultData);
	}

	void fail(@Nonnull TranslationRunException failure) {
		this.result.completeExceptionally(failure);
	}

	/**
	 * Closes the event stream unless it was closed already.
	 */
	void release() {
		if (this.released.compareAndSet(false, true)) {
			try {
				this.stream.close();
			} catch (RuntimeException e) {
				this.log.warn("Failed to close event stream of " + this.document + ": " + e.getMessage(), e);
			}
		}
	}

	private static long toNanosSaturated(@Nonnull Duration timeout) {
		try {
			return timeout.toNanos();
		} catch (ArithmeticException e) {
			return timeout.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
		}
	}

	@Nonnull
	private static TranslationRunException unwrap(@Nonnull ExecutionException e) {
		final Throwable cause = e.getCause();
		if (cause instanceof TranslationRunException) {
			return (TranslationRunException) cause;
		}
		return new TransportFailureException(cause == null ? e : cause);
	}
}
