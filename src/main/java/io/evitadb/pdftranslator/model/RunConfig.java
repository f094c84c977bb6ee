package io.evitadb.pdftranslator.model;

import io.evitadb.pdftranslator.InvalidConfigException;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable configuration of a single translation run. Built once by the caller, validated once and then
 * handed read-only to the engine.
 *
 * @param sourceDocument  the document to translate
 * @param outputDirectory directory receiving the produced artifacts
 * @param sourceLanguage  language tag of the document, e.g. "en"
 * @param targetLanguage  language tag of the translation, e.g. "zh"
 * @param engine          language-model vendor settings
 * @param translation     request tuning
 * @param output          artifact and page options
 */
public record RunConfig(
	@Nonnull Path sourceDocument,
	@Nonnull Path outputDirectory,
	@Nonnull String sourceLanguage,
	@Nonnull String targetLanguage,
	@Nonnull EngineSettings engine,
	@Nonnull TranslationOptions translation,
	@Nonnull OutputOptions output
) {

	public RunConfig {
		Objects.requireNonNull(sourceDocument, "sourceDocument must not be null");
		Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
		Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null");
		Objects.requireNonNull(targetLanguage, "targetLanguage must not be null");
		Objects.requireNonNull(engine, "engine must not be null");
		Objects.requireNonNull(translation, "translation must not be null");
		Objects.requireNonNull(output, "output must not be null");
	}

	/**
	 * Validates all parts of the configuration. The existence of the source document is checked
	 * separately when the run starts.
	 *
	 * @throws InvalidConfigException if any part is invalid
	 */
	public void validate() throws InvalidConfigException {
		if (this.sourceLanguage.isBlank()) {
			throw new InvalidConfigException("Source language must not be blank");
		}
		if (this.targetLanguage.isBlank()) {
			throw new InvalidConfigException("Target language must not be blank");
		}
		this.engine.validate();
		this.translation.validate();
		this.output.validate();
	}
}
