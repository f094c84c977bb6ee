package io.evitadb.pdftranslator.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.NonRetriableException;
import io.evitadb.pdftranslator.event.ErrorEvent;
import io.evitadb.pdftranslator.llm.LlmClient;
import io.evitadb.pdftranslator.llm.OutputSanitizer;
import io.evitadb.pdftranslator.llm.PromptLoader;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Translates paragraphs with a language model, several paragraphs per request.
 *
 * The model receives a JSON array `[{"id":0,"input":"..."}]` and is asked to answer with
 * `[{"id":0,"output":"..."}]`. The raw answer always passes through the current {@link OutputSanitizer}
 * before it is parsed. If the answer cannot be parsed or misses a paragraph, the whole batch falls back to
 * translating its paragraphs one by one as plain text.
 *
 * Non-retriable model failures propagate; every other failure only affects the paragraphs involved.
 */
public final class ParagraphTranslator {

	static final String BATCH_SYSTEM_TEMPLATE = "translate-batch-system.txt";
	static final String BATCH_USER_TEMPLATE = "translate-batch-user.txt";
	static final String SINGLE_SYSTEM_TEMPLATE = "translate-single-system.txt";
	static final String SINGLE_USER_TEMPLATE = "translate-single-user.txt";

	@Nonnull
	private final LlmClient llmClient;
	@Nonnull
	private final PromptLoader promptLoader;
	@Nonnull
	private final Supplier<OutputSanitizer> sanitizer;
	@Nonnull
	private final ObjectMapper objectMapper;
	@Nonnull
	private final Log log;
	@Nonnull
	private final Map<String, String> languages;
	@Nullable
	private final String customSystemPrompt;
	private final boolean debug;

	/**
	 * Creates a translator for one language pair.
	 *
	 * @param llmClient          client used for model requests
	 * @param promptLoader       source of prompt templates
	 * @param sanitizer          supplies the sanitizer applied to each raw answer
	 * @param objectMapper       JSON codec
	 * @param sourceLanguage     language of the paragraphs
	 * @param targetLanguage     language to translate to
	 * @param customSystemPrompt extra instructions appended to the system prompt, may be null
	 * @param debug              whether raw answers are logged
	 * @param log                Maven log
	 */
	public ParagraphTranslator(
		@Nonnull LlmClient llmClient,
		@Nonnull PromptLoader promptLoader,
		@Nonnull Supplier<OutputSanitizer> sanitizer,
		@Nonnull ObjectMapper objectMapper,
		@Nonnull String sourceLanguage,
		@Nonnull String targetLanguage,
		@Nullable String customSystemPrompt,
		boolean debug,
		@Nonnull Log log
	) {
		this.llmClient = Objects.requireNonNull(llmClient, "llmClient must not be null");
		this.promptLoader = Objects.requireNonNull(promptLoader, "promptLoader must not be null");
		this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer must not be null");
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
		this.languages = Map.of(
			"sourceLanguage", Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null"),
			"targetLanguage", Objects.requireNonNull(targetLanguage, "targetLanguage must not be null")
		);
		this.customSystemPrompt = customSystemPrompt == null || customSystemPrompt.isBlank() ? null : customSystemPrompt.trim();
		this.debug = debug;
	}

	/**
	 * Translates a batch of paragraphs.
	 *
	 * @param paragraphs the paragraphs, in document order
	 * @return translations and per-paragraph failures
	 * @throws NonRetriableException if the model fails permanently
	 */
	@Nonnull
	public BatchTranslation translate(@Nonnull List<String> paragraphs) {
		Objects.requireNonNull(paragraphs, "paragraphs must not be null");
		if (paragraphs.isEmpty()) {
			return new BatchTranslation(List.of(), List.of(), false);
		}

		try {
			final String answer = this.llmClient.chat(batchMessages(paragraphs));
			if (this.debug) {
				this.log.debug("Raw batch answer: " + answer);
			}
			final String[] parsed = parseBatchAnswer(this.sanitizer.get().sanitize(answer), paragraphs.size());
			if (parsed != null) {
				return new BatchTranslation(Arrays.asList(parsed), List.of(), false);
			}
			this.log.warn("Unusable batch answer for " + paragraphs.size() + " paragraph(s), translating one by one");
		} catch (NonRetriableException e) {
			throw e;
		} catch (RuntimeException e) {
			this.log.warn("Batch translation of " + paragraphs.size() + " paragraph(s) failed, translating one by one: " + e.getMessage());
		}

		return translateOneByOne(paragraphs);
	}

	@Nonnull
	private BatchTranslation translateOneByOne(@Nonnull List<String> paragraphs) {
		final List<String> translations = new ArrayList<>(paragraphs.size());
		final List<ErrorEvent> errors = new ArrayList<>();
		for (int i = 0; i < paragraphs.size(); i++) {
			try {
				final String answer = this.llmClient.chat(singleMessages(paragraphs.get(i)));
				if (this.debug) {
					this.log.debug("Raw paragraph answer: " + answer);
				}
				translations.add(answer.strip());
			} catch (NonRetriableException e) {
				throw e;
			} catch (RuntimeException e) {
				translations.add(null);
				errors.add(ErrorEvent.of("Paragraph " + (i + 1) + " of batch could not be translated", e));
			}
		}
		return new BatchTranslation(translations, errors, true);
	}

	/**
	 * Reads the model's JSON answer.
	 *
	 * @param cleaned  sanitized answer
	 * @param expected number of paragraphs in the batch
	 * @return translations indexed by paragraph id, or null if the answer is unusable
	 */
	@Nullable
	String[] parseBatchAnswer(@Nonnull String cleaned, int expected) {
		final JsonNode root;
		try {
			root = this.objectMapper.readTree(cleaned);
		} catch (JsonProcessingException e) {
			this.log.debug("Batch answer is not valid JSON: " + e.getOriginalMessage());
			return null;
		}
		if (root == null || !root.isArray()) {
			return null;
		}

		final Map<Integer, String> byId = new HashMap<>();
		for (final JsonNode item : root) {
			final JsonNode id = item.get("id");
			final JsonNode output = item.get("output");
			if (id == null || !id.canConvertToInt() || output == null || !output.isTextual()) {
				return null;
			}
			byId.put(id.asInt(), output.textValue());
		}

		final String[] result = new String[expected];
		for (int i = 0; i < expected; i++) {
			final String translation = byId.get(i);
			if (translation == null) {
				return null;
			}
			result[i] = translation;
		}
		return result;
	}

	@Nonnull
	private List<ChatMessage> batchMessages(@Nonnull List<String> paragraphs) {
		final ArrayNode input = this.objectMapper.createArrayNode();
		for (int i = 0; i < paragraphs.size(); i++) {
			input.addObject().put("id", i).put("input", paragraphs.get(i));
		}
		final Map<String, String> values = new HashMap<>(this.languages);
		values.put("paragraphs", input.toPrettyString());
		return List.of(
			SystemMessage.from(systemPrompt(BATCH_SYSTEM_TEMPLATE)),
			UserMessage.from(this.promptLoader.render(BATCH_USER_TEMPLATE, values))
		);
	}

	@Nonnull
	private List<ChatMessage> singleMessages(@Nonnull String paragraph) {
		return List.of(
			SystemMessage.from(systemPrompt(SINGLE_SYSTEM_TEMPLATE)),
			UserMessage.from(this.promptLoader.render(SINGLE_USER_TEMPLATE, Map.of("text", paragraph)))
		);
	}

	@Nonnull
	private String systemPrompt(@Nonnull String templateName) {
		final String prompt = this.promptLoader.render(templateName, this.languages);
		return this.customSystemPrompt == null ? prompt : prompt + "\n\n" + this.customSystemPrompt;
	}
}
