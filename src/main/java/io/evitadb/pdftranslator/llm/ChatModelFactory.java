package io.evitadb.pdftranslator.llm;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import io.evitadb.pdftranslator.model.EngineSettings;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Objects;

/**
 * Creates LangChain4j ChatModel instances from {@link EngineSettings}.
 * The "openai" vendor covers every OpenAI-compatible endpoint (OpenAI, DeepSeek, GLM, Doubao, etc.)
 * selected through the base URL.
 */
public final class ChatModelFactory {

	public static final String DEFAULT_OPENAI_URL = "https://api.openai.com/v1";
	public static final String DEFAULT_ANTHROPIC_URL = "https://api.anthropic.com/v1";

	private static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);
	private static final double DEFAULT_TEMPERATURE = 0.0;
	private static final int DEFAULT_MAX_RETRIES = 3;

	private ChatModelFactory() {
		// Utility class - prevent instantiation
	}

	/**
	 * Creates a ChatModel for the vendor selected in the settings.
	 *
	 * @param settings validated engine settings
	 * @return configured ChatModel instance
	 * @throws IllegalArgumentException if the vendor is unknown
	 */
	@Nonnull
	public static ChatModel create(@Nonnull EngineSettings settings) {
		Objects.requireNonNull(settings, "settings must not be null");

		final String vendor = settings.normalizedVendor();
		return switch (vendor) {
			case EngineSettings.VENDOR_OPENAI -> OpenAiChatModel.builder()
				.baseUrl(normalizeUrl(settings.baseUrl(), DEFAULT_OPENAI_URL))
				.apiKey(settings.apiKey())
				.modelName(settings.model())
				.timeout(DEFAULT_TIMEOUT)
				.temperature(DEFAULT_TEMPERATURE)
				.maxRetries(DEFAULT_MAX_RETRIES)
				.logRequests(false)
				.logResponses(false)
				.build();
			case EngineSettings.VENDOR_ANTHROPIC -> AnthropicChatModel.builder()
				.baseUrl(normalizeUrl(settings.baseUrl(), DEFAULT_ANTHROPIC_URL))
				.apiKey(settings.apiKey())
				.modelName(settings.model())
				.timeout(DEFAULT_TIMEOUT)
				.temperature(DEFAULT_TEMPERATURE)
				.maxRetries(DEFAULT_MAX_RETRIES)
				.logRequests(false)
				.logResponses(false)
				.build();
			default -> throw new IllegalArgumentException(
				"Unknown provider: " + settings.vendor() + ". Supported providers: " +
					EngineSettings.VENDOR_OPENAI + ", " + EngineSettings.VENDOR_ANTHROPIC
			);
		};
	}

	/**
	 * Removes trailing slashes, falling back to the default URL when none is set.
	 *
	 * @param url        configured URL, may be null
	 * @param defaultUrl URL used when none is configured
	 * @return normalized URL
	 */
	@Nonnull
	static String normalizeUrl(@Nullable String url, @Nonnull String defaultUrl) {
		String normalized = url == null || url.isBlank() ? defaultUrl : url.trim();
		while (normalized.endsWith("/")) {
			normalized = normalized.substring(0, normalized.length() - 1);
		}
		return normalized;
	}
}
