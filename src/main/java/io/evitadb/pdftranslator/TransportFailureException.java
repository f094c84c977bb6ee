package io.evitadb.pdftranslator;

import javax.annotation.Nonnull;

/**
 * Thrown when the engine's event stream raises. The original failure is kept as the cause.
 */
public final class TransportFailureException extends TranslationRunException {

	public TransportFailureException(@Nonnull Throwable cause) {
		super(FailureKind.TRANSPORT_FAILURE, "Translation event stream failed: " + describe(cause), cause);
	}

	@Nonnull
	private static String describe(@Nonnull Throwable cause) {
		final String message = cause.getMessage();
		return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
	}
}
