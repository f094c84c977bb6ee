package io.evitadb.pdftranslator.event;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * {@link EventStream} fed by a producer thread through a bounded queue.
 *
 * The producer calls {@link #emit(TranslationEvent)} for every event and finally either
 * {@link #complete()} or {@link #fail(Throwable)}. The consumer iterates the stream. Closing the stream
 * discards queued events, wakes a blocked consumer and makes {@link #isClosed()} return true so the
 * producer can stop early.
 */
public final class QueueEventStream implements EventStream {

	public static final int DEFAULT_CAPACITY = 256;

	private static final long OFFER_TIMEOUT_MILLIS = 100;
	private static final Object END = new Object();
	private static final Object EMPTY = new Object();

	@Nonnull
	private final BlockingQueue<Object> queue;
	private volatile boolean closed;
	private volatile boolean producerDone;
	/** Consumer-side state, only touched by the consuming thread. */
	@Nullable
	private Object pending;
	private boolean exhausted;

	public QueueEventStream() {
		this(DEFAULT_CAPACITY);
	}

	/**
	 * Creates a stream whose queue holds at most the given number of events.
	 *
	 * @param capacity queue capacity
	 */
	public QueueEventStream(int capacity) {
		if (capacity < 1) {
			throw new IllegalArgumentException("capacity must be at least 1");
		}
		this.queue = new LinkedBlockingQueue<>(capacity);
	}

	/**
	 * Publishes an event, blocking while the queue is full. A null event is delivered as an empty placeholder.
	 *
	 * @param event the event to publish
	 * @return false if the stream was closed or already completed and the event was dropped
	 */
	public boolean emit(@Nullable TranslationEvent event) {
		if (this.producerDone) {
			return false;
		}
		return enqueue(event == null ? EMPTY : event);
	}

	/**
	 * Marks the regular end of the stream.
	 */
	public void complete() {
		if (!this.producerDone) {
			this.producerDone = true;
			enqueue(END);
		}
	}

	/**
	 * Ends the stream with a failure that the consumer receives as an {@link EventStreamException}.
	 *
	 * @param cause the producer failure
	 */
	public void fail(@Nonnull Throwable cause) {
		Objects.requireNonNull(cause, "cause must not be null");
		if (!this.producerDone) {
			this.producerDone = true;
			enqueue(new Failure(cause));
		}
	}

	/**
	 * Whether the consumer released the stream. Producers check this to stop early.
	 *
	 * @return true once {@link #close()} was called
	 */
	public boolean isClosed() {
		return this.closed;
	}

	@Override
	public boolean isReady() {
		return this.pending != null || this.exhausted || this.closed || !this.queue.isEmpty();
	}

	@Override
	public boolean hasNext() {
		if (this.pending != null) {
			return true;
		}
		if (this.exhausted || this.closed) {
			return false;
		}
		final Object item;
		try {
			item = this.queue.take();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			this.exhausted = true;
			throw new EventStreamException("Interrupted while waiting for the next event", e);
		}
		if (item == END || this.closed) {
			this.exhausted = true;
			return false;
		}
		if (item instanceof Failure) {
			this.exhausted = true;
			final Throwable cause = ((Failure) item).cause();
			throw new EventStreamException("Translation engine failed: " + cause.getMessage(), cause);
		}
		this.pending = item;
		return true;
	}

	@Nullable
	@Override
	public TranslationEvent next() {
		if (!hasNext()) {
			throw new NoSuchElementException("No more translation events");
		}
		final Object item = this.pending;
		this.pending = null;
		return item == EMPTY ? null : (TranslationEvent) item;
	}

	@Override
	public void close() {
		if (this.closed) {
			return;
		}
		this.closed = true;
		this.queue.clear();
		// wakes a consumer blocked in take()
		this.queue.offer(END);
	}

	private boolean enqueue(@Nonnull Object item) {
		try {
			while (!this.closed) {
				if (this.queue.offer(item, OFFER_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
					// the consumer ignores anything enqueued after close
					return !this.closed;
				}
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
		return false;
	}

	private record Failure(@Nonnull Throwable cause) {
	}
}
