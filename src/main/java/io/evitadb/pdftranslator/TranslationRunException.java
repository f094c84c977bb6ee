package io.evitadb.pdftranslator;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Base class of all fatal translation run failures. The {@link #getKind() kind} lets callers tell
 * the failures apart without inspecting the concrete subclass.
 */
public abstract class TranslationRunException extends Exception {

	@Nonnull
	private final FailureKind kind;

	protected TranslationRunException(@Nonnull FailureKind kind, @Nonnull String message, @Nullable Throwable cause) {
		super(message, cause);
		this.kind = Objects.requireNonNull(kind, "kind must not be null");
	}

	/**
	 * Returns the category of this failure.
	 *
	 * @return failure kind
	 */
	@Nonnull
	public FailureKind getKind() {
		return this.kind;
	}
}
