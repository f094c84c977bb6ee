package io.evitadb.pdftranslator;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Thrown before a run starts when the source document does not exist.
 */
public final class InputNotFoundException extends TranslationRunException {

	@Nonnull
	private final Path document;

	public InputNotFoundException(@Nonnull Path document) {
		super(FailureKind.INPUT_NOT_FOUND, "Source document does not exist: " + document, null);
		this.document = Objects.requireNonNull(document, "document must not be null");
	}

	/**
	 * Returns the path that could not be resolved.
	 *
	 * @return missing document path
	 */
	@Nonnull
	public Path getDocument() {
		return this.document;
	}
}
