package io.evitadb.pdftranslator;

import javax.annotation.Nonnull;

/**
 * Thrown when a run is cancelled by its caller or its deadline expires before a result is produced.
 */
public final class RunCancelledException extends TranslationRunException {

	public RunCancelledException(@Nonnull String message) {
		super(FailureKind.CANCELLED, message, null);
	}
}
