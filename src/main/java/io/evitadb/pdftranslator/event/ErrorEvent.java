package io.evitadb.pdftranslator.event;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Non-fatal failure of a single unit of work (a page or a chunk). The run continues.
 *
 * @param errorType short classification of the failure, usually an exception class name
 * @param message   human-readable description
 */
public record ErrorEvent(
	@Nonnull String errorType,
	@Nonnull String message
) implements TranslationEvent {

	public ErrorEvent {
		Objects.requireNonNull(errorType, "errorType must not be null");
		Objects.requireNonNull(message, "message must not be null");
	}

	/**
	 * Creates an error event describing the given exception.
	 *
	 * @param context what was being processed when the exception occurred
	 * @param cause   the exception
	 * @return error event
	 */
	@Nonnull
	public static ErrorEvent of(@Nonnull String context, @Nonnull Throwable cause) {
		final String detail = cause.getMessage() == null ? "" : ": " + cause.getMessage();
		return new ErrorEvent(cause.getClass().getSimpleName(), context + detail);
	}
}
