package io.evitadb.pdftranslator;

import javax.annotation.Nonnull;

/**
 * Thrown when a run configuration is rejected, e.g. an unsupported engine vendor or a missing credential.
 */
public class InvalidConfigException extends TranslationRunException {

	public InvalidConfigException(@Nonnull String message) {
		super(FailureKind.INVALID_CONFIG, message, null);
	}

	protected InvalidConfigException(@Nonnull String message, @Nonnull Throwable cause) {
		super(FailureKind.INVALID_CONFIG, message, cause);
	}
}
