package io.evitadb.pdftranslator.event;

import javax.annotation.Nonnull;

/**
 * Raised by an {@link EventStream} when its producer failed. The producer's exception is the cause.
 */
public final class EventStreamException extends RuntimeException {

	public EventStreamException(@Nonnull String message, @Nonnull Throwable cause) {
		super(message, cause);
	}
}
