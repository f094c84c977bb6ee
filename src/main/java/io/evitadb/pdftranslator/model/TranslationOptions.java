package io.evitadb.pdftranslator.model;

import io.evitadb.pdftranslator.InvalidConfigException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Tuning of the translation requests.
 *
 * @param qps                 maximum number of model requests per second
 * @param minTextLength       paragraphs shorter than this are copied untranslated
 * @param debug               whether raw model output is logged
 * @param customSystemPrompt  extra instructions appended to the system prompt, may be null
 */
public record TranslationOptions(
	int qps,
	int minTextLength,
	boolean debug,
	@Nullable String customSystemPrompt
) {

	public static final int DEFAULT_QPS = 4;
	public static final int DEFAULT_MIN_TEXT_LENGTH = 5;

	/**
	 * Returns options with all defaults applied.
	 *
	 * @return default options
	 */
	@Nonnull
	public static TranslationOptions defaults() {
		return new TranslationOptions(DEFAULT_QPS, DEFAULT_MIN_TEXT_LENGTH, false, null);
	}

	/**
	 * Validates value ranges.
	 *
	 * @throws InvalidConfigException if qps is not positive or minTextLength is negative
	 */
	public void validate() throws InvalidConfigException {
		if (this.qps < 1) {
			throw new InvalidConfigException("qps must be at least 1, got " + this.qps);
		}
		if (this.minTextLength < 0) {
			throw new InvalidConfigException("min_text_length must not be negative, got " + this.minTextLength);
		}
	}
}
