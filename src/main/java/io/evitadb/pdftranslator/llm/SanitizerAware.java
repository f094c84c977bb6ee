package io.evitadb.pdftranslator.llm;

import javax.annotation.Nonnull;

/**
 * Implemented by translation engines that let callers replace the sanitizer applied to raw model output.
 */
public interface SanitizerAware {

	/**
	 * Replaces the sanitizer used for all subsequent model calls. Installing the sanitizer that is
	 * already active has no effect.
	 *
	 * @param sanitizer the sanitizer to use
	 */
	void installSanitizer(@Nonnull OutputSanitizer sanitizer);

	/**
	 * Returns the sanitizer currently applied to model output.
	 *
	 * @return active sanitizer
	 */
	@Nonnull
	OutputSanitizer getSanitizer();
}
