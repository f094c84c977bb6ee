package io.evitadb.pdftranslator.llm;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Repairs raw language-model output before it is handed to a strict JSON parser.
 * Implementations must be total (never throw) and safe for concurrent use.
 */
@FunctionalInterface
public interface OutputSanitizer {

	/**
	 * Sanitizer reproducing the engine's native behaviour: wrapper tags and code fences are removed,
	 * control characters are left in place.
	 */
	OutputSanitizer NATIVE = JsonOutputSanitizer::stripWrappers;

	/**
	 * Returns the repaired text.
	 *
	 * @param llmOutput raw text returned by the model, may be null
	 * @return repaired text, never null
	 */
	@Nonnull
	String sanitize(@Nullable String llmOutput);
}
