package io.evitadb.pdftranslator.settings;

import io.evitadb.pdftranslator.InvalidConfigException;
import io.evitadb.pdftranslator.model.OutputOptions;
import io.evitadb.pdftranslator.model.RunConfig;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Assembles and validates the {@link RunConfig} of a run from the settings file and the per-run options.
 */
public final class RunConfigFactory {

	private RunConfigFactory() {
		// Utility class - prevent instantiation
	}

	/**
	 * Builds a validated run configuration.
	 *
	 * @param settings        loaded settings file
	 * @param input           document to translate
	 * @param outputDirectory output directory, null for the directory of the input
	 * @param sourceLanguage  source language tag
	 * @param targetLanguage  target language tag
	 * @param output          artifact and page options
	 * @return validated configuration
	 * @throws InvalidConfigException if the combination is invalid
	 */
	@Nonnull
	public static RunConfig create(
		@Nonnull TranslatorSettings settings,
		@Nonnull Path input,
		@Nullable Path outputDirectory,
		@Nonnull String sourceLanguage,
		@Nonnull String targetLanguage,
		@Nonnull OutputOptions output
	) throws InvalidConfigException {
		Objects.requireNonNull(settings, "settings must not be null");
		Objects.requireNonNull(input, "input must not be null");

		final Path document = input.toAbsolutePath().normalize();
		final Path effectiveOutput = outputDirectory == null
			? Objects.requireNonNullElse(document.getParent(), document.getRoot())
			: outputDirectory.toAbsolutePath().normalize();

		final RunConfig config = new RunConfig(
			document,
			effectiveOutput,
			sourceLanguage,
			targetLanguage,
			settings.toEngineSettings(),
			settings.toTranslationOptions(),
			output
		);
		config.validate();
		return config;
	}
}
