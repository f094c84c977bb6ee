package io.evitadb.pdftranslator;

import io.evitadb.pdftranslator.engine.TextDocumentEngine;
import io.evitadb.pdftranslator.engine.TranslationEngine;
import io.evitadb.pdftranslator.event.ErrorEvent;
import io.evitadb.pdftranslator.llm.JsonOutputSanitizer;
import io.evitadb.pdftranslator.llm.SanitizerInstaller;
import io.evitadb.pdftranslator.model.EngineSettings;
import io.evitadb.pdftranslator.model.OutputOptions;
import io.evitadb.pdftranslator.model.ResultData;
import io.evitadb.pdftranslator.model.RunConfig;
import io.evitadb.pdftranslator.model.WatermarkMode;
import io.evitadb.pdftranslator.settings.RunConfigFactory;
import io.evitadb.pdftranslator.settings.SettingsLoader;
import io.evitadb.pdftranslator.settings.TranslatorSettings;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Main Mojo for the PDF translator plugin providing actions:
 * - show-config: prints the effective settings
 * - create-config: writes an example settings file
 * - translate: translates one document
 */
@Mojo(name = "run", defaultPhase = LifecyclePhase.NONE, threadSafe = true)
public class PdfTranslatorMojo extends AbstractMojo {

	/** Which action to perform: "show-config", "create-config" or "translate". */
	@Parameter(property = "pdftranslator.action", defaultValue = "show-config")
	private String action;

	/** Document to translate (no default). */
	@Parameter(property = "pdftranslator.input")
	private String input;

	/** Output directory, defaults to the directory of the input. */
	@Parameter(property = "pdftranslator.output")
	private String output;

	/** Path of the JSON settings file. */
	@Parameter(property = "pdftranslator.config", defaultValue = "config/config.json")
	private String config = "config/config.json";

	/** Source language. */
	@Parameter(property = "pdftranslator.langIn", defaultValue = "en")
	private String langIn = "en";

	/** Target language. */
	@Parameter(property = "pdftranslator.langOut", defaultValue = "zh")
	private String langOut = "zh";

	/** Skip the dual-language output. */
	@Parameter(property = "pdftranslator.noDual", defaultValue = "false")
	private boolean noDual;

	/** Skip the translation-only output. */
	@Parameter(property = "pdftranslator.noMono", defaultValue = "false")
	private boolean noMono;

	/** Watermark mode: "watermarked", "no_watermark" or "both". */
	@Parameter(property = "pdftranslator.watermark", defaultValue = "watermarked")
	private String watermark = "watermarked";

	/** Pages to translate, e.g. "1,2,1-,-3,3-5" (no default, whole document). */
	@Parameter(property = "pdftranslator.pages")
	private String pages;

	/** Translate in parts of at most this many pages (no default, single part). */
	@Parameter(property = "pdftranslator.maxPagesPerPart")
	private Integer maxPagesPerPart;

	/** Enables compatibility enhancements of the output. */
	@Parameter(property = "pdftranslator.enhanceCompatibility", defaultValue = "false")
	private boolean enhanceCompatibility;

	@Nonnull
	private Function<Log, TranslationEngine> engineFactory = TextDocumentEngine::new;

	@Override
	public void execute() throws MojoExecutionException {
		if (this.action == null || this.action.isBlank()) {
			this.action = "show-config";
		}
		switch (this.action) {
			case "show-config":
				showConfig(getLog());
				break;
			case "create-config":
				createConfig(getLog());
				break;
			case "translate":
				translate(getLog());
				break;
			default:
				throw new MojoExecutionException("Unknown action: " + this.action + ". Supported actions: show-config, create-config, translate");
		}
	}

	private void showConfig(@Nonnull final Log log) throws MojoExecutionException {
		final Path configFile = Path.of(this.config);
		final TranslatorSettings settings;
		if (Files.exists(configFile)) {
			settings = loadSettings(configFile);
		} else {
			log.warn("Settings file " + configFile + " does not exist, showing defaults");
			settings = TranslatorSettings.defaults();
		}
		final EngineSettings engine = settings.toEngineSettings();

		log.info("PDF Translator Configuration:");
		log.info(" - config: " + configFile);
		log.info(" - translation_engine: " + settings.translationEngine());
		if (!EngineSettings.SUPPORTED_VENDORS.contains(engine.normalizedVendor())) {
			log.warn("Unsupported translation engine: " + settings.translationEngine());
		}
		log.info(" - api key: " + (isBlank(engine.apiKey()) ? "<not set>" : mask(engine.apiKey())));
		if (isBlank(engine.apiKey())) {
			log.warn("API key is not set");
		} else if (TranslatorSettings.API_KEY_PLACEHOLDER.equals(engine.apiKey())) {
			log.warn("API key is still the placeholder of the example settings");
		}
		log.info(" - base url: " + engine.baseUrl());
		log.info(" - model: " + engine.model());
		log.info(" - qps: " + settings.qps());
		log.info(" - min_text_length: " + settings.minTextLength());
		log.info(" - debug: " + settings.debug());
		log.info(" - custom_system_prompt: " + (isBlank(settings.customSystemPrompt()) ? "<not set>" : settings.customSystemPrompt()));
		log.info(" - input: " + (isBlank(this.input) ? "<not set>" : this.input));
		if (isBlank(this.input)) {
			log.warn("Input document is not set");
		}
		log.info(" - output: " + (isBlank(this.output) ? "<input directory>" : this.output));
		log.info(" - langIn: " + this.langIn + ", langOut: " + this.langOut);
		log.info(" - noDual: " + this.noDual + ", noMono: " + this.noMono);
		log.info(" - watermark: " + this.watermark);
		log.info(" - pages: " + (isBlank(this.pages) ? "<all>" : this.pages));
		log.info(" - maxPagesPerPart: " + (this.maxPagesPerPart == null ? "<not set>" : this.maxPagesPerPart));
		log.info(" - enhanceCompatibility: " + this.enhanceCompatibility);
	}

	private void createConfig(@Nonnull final Log log) throws MojoExecutionException {
		final Path configFile = Path.of(this.config);
		try {
			new SettingsLoader().createExample(configFile);
		} catch (FileAlreadyExistsException e) {
			throw new MojoExecutionException("Settings file already exists, refusing to overwrite: " + configFile, e);
		} catch (IOException e) {
			throw new MojoExecutionException("Cannot create settings file " + configFile + ": " + e.getMessage(), e);
		}
		log.info("Example settings file created: " + configFile);
		log.info("Edit it and fill in your API key.");
	}

	private void translate(@Nonnull final Log log) throws MojoExecutionException {
		if (isBlank(this.input)) {
			throw new MojoExecutionException("Input document must be specified for translate action (pdftranslator.input)");
		}
		final Path document = Path.of(this.input);
		if (!Files.exists(document)) {
			throw new MojoExecutionException("Input document does not exist: " + document.toAbsolutePath().normalize());
		}
		final Path configFile = Path.of(this.config);
		if (!Files.exists(configFile)) {
			throw new MojoExecutionException(
				"Settings file does not exist: " + configFile + ". Run with -Dpdftranslator.action=create-config to create an example"
			);
		}

		final TranslatorSettings settings = loadSettings(configFile);
		final RunConfig runConfig;
		try {
			runConfig = RunConfigFactory.create(
				settings,
				document,
				isBlank(this.output) ? null : Path.of(this.output),
				this.langIn == null ? "" : this.langIn,
				this.langOut == null ? "" : this.langOut,
				new OutputOptions(
					this.noDual,
					this.noMono,
					WatermarkMode.fromCode(this.watermark),
					this.pages,
					this.maxPagesPerPart,
					this.enhanceCompatibility
				)
			);
		} catch (InvalidConfigException | IllegalArgumentException e) {
			throw new MojoExecutionException("Invalid configuration: " + e.getMessage(), e);
		}

		final TranslationEngine engine = this.engineFactory.apply(log);
		SanitizerInstaller.install(engine, JsonOutputSanitizer.INSTANCE, log);

		final AtomicInteger chunkErrors = new AtomicInteger(0);
		final TranslationJobController controller = new TranslationJobController(engine, log);
		try {
			final ResultData result = controller.run(runConfig, event -> {
				if (event instanceof ErrorEvent) {
					chunkErrors.incrementAndGet();
				}
			});

			log.info("--- Translation Summary ---");
			for (final Path artifact : result.artifacts()) {
				log.info("Output: " + artifact);
			}
			if (result.artifacts().isEmpty()) {
				log.warn("The run produced no output files");
			}
			log.info(String.format(Locale.ROOT, "Time: %.2fs", result.totalSeconds()));
			log.info(String.format(Locale.ROOT, "Peak memory: %.2f MiB", result.peakMemoryUsage()));
			if (chunkErrors.get() > 0) {
				log.warn("Chunk errors: " + chunkErrors.get() + " (affected paragraphs were kept untranslated)");
			}
		} catch (TranslationRunException e) {
			throw new MojoExecutionException("Translation failed (" + e.getKind() + "): " + e.getMessage(), e);
		} finally {
			controller.shutdown();
		}
	}

	@Nonnull
	private static TranslatorSettings loadSettings(@Nonnull final Path configFile) throws MojoExecutionException {
		try {
			return new SettingsLoader().load(configFile);
		} catch (InvalidConfigException e) {
			throw new MojoExecutionException(e.getMessage(), e);
		} catch (IOException e) {
			throw new MojoExecutionException("Cannot read settings file " + configFile + ": " + e.getMessage(), e);
		}
	}

	private static boolean isBlank(@Nullable final String value) {
		return value == null || value.isBlank();
	}

	@Nonnull
	private static String mask(@Nullable final String value) {
		if (value == null || value.length() <= 4) {
			return "****";
		}
		return "****" + value.substring(value.length() - 4);
	}

	// Setters to aid testing without Maven parameter injection
	void setAction(@Nullable final String action) { this.action = action; }
	void setInput(@Nullable final String input) { this.input = input; }
	void setOutput(@Nullable final String output) { this.output = output; }
	void setConfig(@Nonnull final String config) { this.config = config; }
	void setLangIn(@Nullable final String langIn) { this.langIn = langIn; }
	void setLangOut(@Nullable final String langOut) { this.langOut = langOut; }
	void setNoDual(final boolean noDual) { this.noDual = noDual; }
	void setNoMono(final boolean noMono) { this.noMono = noMono; }
	void setWatermark(@Nullable final String watermark) { this.watermark = watermark; }
	void setPages(@Nullable final String pages) { this.pages = pages; }
	void setMaxPagesPerPart(@Nullable final Integer maxPagesPerPart) { this.maxPagesPerPart = maxPagesPerPart; }
	void setEnhanceCompatibility(final boolean enhanceCompatibility) { this.enhanceCompatibility = enhanceCompatibility; }
	void setEngineFactory(@Nonnull final Function<Log, TranslationEngine> engineFactory) { this.engineFactory = engineFactory; }
}
