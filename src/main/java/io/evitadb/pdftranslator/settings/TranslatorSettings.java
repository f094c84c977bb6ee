package io.evitadb.pdftranslator.settings;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.evitadb.pdftranslator.model.EngineSettings;
import io.evitadb.pdftranslator.model.TranslationOptions;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Contents of the JSON settings file. Missing keys take their defaults, unknown keys are ignored.
 *
 * @param translationEngine  vendor selector, "openai" or "anthropic"
 * @param openaiApiKey       OpenAI (or compatible) API key
 * @param openaiBaseUrl      OpenAI (or compatible) endpoint
 * @param openaiModel        OpenAI model
 * @param anthropicApiKey    Anthropic API key
 * @param anthropicBaseUrl   Anthropic endpoint
 * @param anthropicModel     Anthropic model
 * @param qps                model requests per second
 * @param minTextLength      shortest paragraph that is translated
 * @param debug              logs raw model output
 * @param customSystemPrompt extra system instructions, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TranslatorSettings(
	@JsonProperty("translation_engine") @Nonnull String translationEngine,
	@JsonProperty("openai_api_key") @Nullable String openaiApiKey,
	@JsonProperty("openai_base_url") @Nonnull String openaiBaseUrl,
	@JsonProperty("openai_model") @Nonnull String openaiModel,
	@JsonProperty("anthropic_api_key") @Nullable String anthropicApiKey,
	@JsonProperty("anthropic_base_url") @Nonnull String anthropicBaseUrl,
	@JsonProperty("anthropic_model") @Nonnull String anthropicModel,
	@JsonProperty("qps") @Nonnull Integer qps,
	@JsonProperty("min_text_length") @Nonnull Integer minTextLength,
	@JsonProperty("debug") @Nonnull Boolean debug,
	@JsonProperty("custom_system_prompt") @Nullable String customSystemPrompt
) {

	public static final String DEFAULT_ENGINE = EngineSettings.VENDOR_OPENAI;
	public static final String DEFAULT_OPENAI_BASE_URL = "https://api.openai.com/v1";
	public static final String DEFAULT_OPENAI_MODEL = "gpt-4o-mini";
	public static final String DEFAULT_ANTHROPIC_BASE_URL = "https://api.anthropic.com/v1";
	public static final String DEFAULT_ANTHROPIC_MODEL = "claude-3-5-haiku-latest";
	public static final String API_KEY_PLACEHOLDER = "your-api-key-here";

	public TranslatorSettings {
		translationEngine = orDefault(translationEngine, DEFAULT_ENGINE);
		openaiBaseUrl = orDefault(openaiBaseUrl, DEFAULT_OPENAI_BASE_URL);
		openaiModel = orDefault(openaiModel, DEFAULT_OPENAI_MODEL);
		anthropicBaseUrl = orDefault(anthropicBaseUrl, DEFAULT_ANTHROPIC_BASE_URL);
		anthropicModel = orDefault(anthropicModel, DEFAULT_ANTHROPIC_MODEL);
		qps = qps == null ? TranslationOptions.DEFAULT_QPS : qps;
		minTextLength = minTextLength == null ? TranslationOptions.DEFAULT_MIN_TEXT_LENGTH : minTextLength;
		debug = debug != null && debug;
	}

	/**
	 * Returns settings with every default applied and no API key.
	 *
	 * @return default settings
	 */
	@Nonnull
	public static TranslatorSettings defaults() {
		return new TranslatorSettings(null, null, null, null, null, null, null, null, null, null, null);
	}

	/**
	 * Returns the settings written by the create-config action.
	 *
	 * @return example settings with a placeholder key
	 */
	@Nonnull
	public static TranslatorSettings example() {
		return new TranslatorSettings(
			DEFAULT_ENGINE, API_KEY_PLACEHOLDER, DEFAULT_OPENAI_BASE_URL, DEFAULT_OPENAI_MODEL,
			null, null, null, null, null, null, null
		);
	}

	/**
	 * Selects the credentials of the configured vendor. An unknown vendor yields settings that fail
	 * validation with a message naming it.
	 *
	 * @return settings of the selected vendor
	 */
	@JsonIgnore
	@Nonnull
	public EngineSettings toEngineSettings() {
		if (EngineSettings.VENDOR_ANTHROPIC.equals(normalizedEngine())) {
			return new EngineSettings(this.translationEngine, this.anthropicApiKey, this.anthropicBaseUrl, this.anthropicModel);
		}
		return new EngineSettings(this.translationEngine, this.openaiApiKey, this.openaiBaseUrl, this.openaiModel);
	}

	/**
	 * @return request tuning taken from these settings
	 */
	@JsonIgnore
	@Nonnull
	public TranslationOptions toTranslationOptions() {
		return new TranslationOptions(this.qps, this.minTextLength, this.debug, this.customSystemPrompt);
	}

	@Nonnull
	private String normalizedEngine() {
		return new EngineSettings(this.translationEngine, null, null, null).normalizedVendor();
	}

	@Nonnull
	private static String orDefault(@Nullable String value, @Nonnull String defaultValue) {
		return value == null || value.isBlank() ? defaultValue : value;
	}
}
