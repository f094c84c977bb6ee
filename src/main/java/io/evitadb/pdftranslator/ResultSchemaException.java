package io.evitadb.pdftranslator;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Thrown when the engine's terminal payload does not match the documented result schema.
 */
public final class ResultSchemaException extends InvalidConfigException {

	public ResultSchemaException(@Nonnull String message) {
		super(message);
	}

	public ResultSchemaException(@Nonnull String message, @Nullable Throwable cause) {
		super(message, cause == null ? new IllegalArgumentException(message) : cause);
	}
}
