package io.evitadb.pdftranslator.model;

import io.evitadb.pdftranslator.InvalidConfigException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Locale;
import java.util.Set;

/**
 * Credentials and model selection of the language-model vendor used by the engine.
 *
 * @param vendor  vendor identifier, "openai" or "anthropic"
 * @param apiKey  API key of the vendor
 * @param baseUrl endpoint base URL; OpenAI-compatible vendors are selected through it
 * @param model   model identifier
 */
public record EngineSettings(
	@Nullable String vendor,
	@Nullable String apiKey,
	@Nullable String baseUrl,
	@Nullable String model
) {

	public static final String VENDOR_OPENAI = "openai";
	public static final String VENDOR_ANTHROPIC = "anthropic";
	public static final Set<String> SUPPORTED_VENDORS = Set.of(VENDOR_OPENAI, VENDOR_ANTHROPIC);

	/**
	 * Returns the vendor in lower case, or an empty string when unset.
	 *
	 * @return normalized vendor
	 */
	@Nonnull
	public String normalizedVendor() {
		return this.vendor == null ? "" : this.vendor.trim().toLowerCase(Locale.ROOT);
	}

	/**
	 * Checks that exactly one supported vendor is selected and that its required fields are present.
	 *
	 * @throws InvalidConfigException if the vendor is unsupported or a required field is blank
	 */
	public void validate() throws InvalidConfigException {
		final String normalized = normalizedVendor();
		if (!SUPPORTED_VENDORS.contains(normalized)) {
			throw new InvalidConfigException(
				"Unsupported translation engine: " + (this.vendor == null ? "<not set>" : this.vendor) +
					". Supported engines: " + VENDOR_OPENAI + ", " + VENDOR_ANTHROPIC
			);
		}
		if (this.apiKey == null || this.apiKey.isBlank()) {
			throw new InvalidConfigException("API key is required for translation engine " + normalized);
		}
		if (this.model == null || this.model.isBlank()) {
			throw new InvalidConfigException("Model name is required for translation engine " + normalized);
		}
		if (this.baseUrl != null && this.baseUrl.isBlank()) {
			throw new InvalidConfigException("Base URL must not be blank for translation engine " + normalized);
		}
	}
}
