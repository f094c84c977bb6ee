package io.evitadb.pdftranslator.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import io.evitadb.pdftranslator.event.FinishEvent;
import io.evitadb.pdftranslator.event.ErrorEvent;
import io.evitadb.pdftranslator.event.EventStream;
import io.evitadb.pdftranslator.event.ProgressUpdateEvent;
import io.evitadb.pdftranslator.event.QueueEventStream;
import io.evitadb.pdftranslator.llm.ChatModelFactory;
import io.evitadb.pdftranslator.llm.LlmClient;
import io.evitadb.pdftranslator.llm.OutputSanitizer;
import io.evitadb.pdftranslator.llm.PromptLoader;
import io.evitadb.pdftranslator.llm.RequestThrottle;
import io.evitadb.pdftranslator.llm.SanitizerAware;
import io.evitadb.pdftranslator.model.EngineSettings;
import io.evitadb.pdftranslator.model.OutputOptions;
import io.evitadb.pdftranslator.model.PageSelection;
import io.evitadb.pdftranslator.model.ResultData;
import io.evitadb.pdftranslator.model.RunConfig;
import io.evitadb.pdftranslator.model.WatermarkMode;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Engine translating UTF-8 plain-text documents with a language model.
 *
 * Each call to {@link #stream(RunConfig, Path)} starts a producer on the engine's executor that parses the
 * document, translates the selected pages part by part and writes the requested artifacts. Progress, chunk
 * errors and the final result are reported through the returned stream. Reading failures and permanent model
 * failures fail the stream; failures of single paragraphs are reported as error events and the paragraph is
 * kept in the source language.
 *
 * Raw model output is cleaned by the installed {@link OutputSanitizer} before it is parsed. Until another
 * sanitizer is installed the engine uses {@link OutputSanitizer#NATIVE}.
 */
public final class TextDocumentEngine implements TranslationEngine, SanitizerAware {

	static final int MAX_BATCH_PARAGRAPHS = 8;
	static final int MAX_BATCH_CHARACTERS = 4000;

	static final String STAGE_PARSE = "Parse document";
	static final String STAGE_TRANSLATE = "Translate paragraphs";
	static final String STAGE_WRITE = "Write output";

	private static final double PARSE_SHARE = 5.0;
	private static final double TRANSLATE_SHARE = 90.0;
	private static final double BYTES_PER_MIB = 1024.0 * 1024.0;

	@Nonnull
	private final Function<EngineSettings, ChatModel> modelFactory;
	@Nonnull
	private final Executor executor;
	@Nonnull
	private final Log log;
	@Nonnull
	private final AtomicReference<OutputSanitizer> sanitizer;
	private final PromptLoader promptLoader = new PromptLoader();
	private final ObjectMapper objectMapper = new ObjectMapper();
	private final ArtifactWriter writer = new ArtifactWriter();

	/**
	 * Creates an engine talking to the vendor configured per run, with the native sanitizer.
	 *
	 * @param log Maven log
	 */
	public TextDocumentEngine(@Nonnull Log log) {
		this(ChatModelFactory::create, OutputSanitizer.NATIVE, newDaemonExecutor(), log);
	}

	/**
	 * Creates an engine.
	 *
	 * @param modelFactory creates the chat model for the engine settings of a run
	 * @param sanitizer    sanitizer applied to raw model output
	 * @param executor     runs the producers of the event streams
	 * @param log          Maven log
	 */
	public TextDocumentEngine(
		@Nonnull Function<EngineSettings, ChatModel> modelFactory,
		@Nonnull OutputSanitizer sanitizer,
		@Nonnull Executor executor,
		@Nonnull Log log
	) {
		this.modelFactory = Objects.requireNonNull(modelFactory, "modelFactory must not be null");
		this.sanitizer = new AtomicReference<>(Objects.requireNonNull(sanitizer, "sanitizer must not be null"));
		this.executor = Objects.requireNonNull(executor, "executor must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	@Override
	public void installSanitizer(@Nonnull OutputSanitizer sanitizer) {
		this.sanitizer.set(Objects.requireNonNull(sanitizer, "sanitizer must not be null"));
	}

	@Nonnull
	@Override
	public OutputSanitizer getSanitizer() {
		return this.sanitizer.get();
	}

	@Nonnull
	@Override
	public EventStream stream(@Nonnull RunConfig config, @Nonnull Path document) {
		Objects.requireNonNull(config, "config must not be null");
		Objects.requireNonNull(document, "document must not be null");

		final QueueEventStream stream = new QueueEventStream();
		this.executor.execute(new Producer(config, document, stream));
		return stream;
	}

	@Nonnull
	private static Executor newDaemonExecutor() {
		final AtomicInteger threadCounter = new AtomicInteger(0);
		return Executors.newCachedThreadPool(runnable -> {
			final Thread thread = new Thread(runnable, "text-engine-" + threadCounter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		});
	}

	/**
	 * Paragraph of a selected page that is sent to the model.
	 */
	private record Slot(int page, int paragraph, @Nonnull String text) {
	}

	/**
	 * Translates one document and feeds its stream.
	 */
	private final class Producer implements Runnable {

		@Nonnull
		private final RunConfig config;
		@Nonnull
		private final Path document;
		@Nonnull
		private final QueueEventStream stream;
		private final long startNanos = System.nanoTime();
		private long peakMemoryBytes;

		Producer(@Nonnull RunConfig config, @Nonnull Path document, @Nonnull QueueEventStream stream) {
			this.config = config;
			this.document = document;
			this.stream = stream;
		}

		@Override
		public void run() {
			try {
				if (translate()) {
					this.stream.complete();
				}
			} catch (IOException | RuntimeException e) {
				TextDocumentEngine.this.log.debug("Translation of " + this.document + " failed", e);
				this.stream.fail(e);
			} catch (Error e) {
				// the consumer must not wait for a producer that is gone
				this.stream.fail(e);
				throw e;
			}
		}

		/**
		 * @return false if the consumer abandoned the stream
		 */
		private boolean translate() throws IOException {
			progress(STAGE_PARSE, 0, 0);
			final TextDocument text = TextDocument.parse(Files.readString(this.document, StandardCharsets.UTF_8));
			final OutputOptions output = this.config.output();
			final List<Integer> selected = PageSelection.parse(output.pages()).select(text.getPageCount());
			final List<List<Integer>> parts = partition(selected, output.maxPagesPerPart());
			progress(STAGE_PARSE, 100, PARSE_SHARE);

			final LlmClient llmClient = new LlmClient(
				TextDocumentEngine.this.modelFactory.apply(this.config.engine()),
				new RequestThrottle(this.config.translation().qps())
			);
			final ParagraphTranslator translator = new ParagraphTranslator(
				llmClient,
				TextDocumentEngine.this.promptLoader,
				TextDocumentEngine.this::getSanitizer,
				TextDocumentEngine.this.objectMapper,
				this.config.sourceLanguage(),
				this.config.targetLanguage(),
				this.config.translation().customSystemPrompt(),
				this.config.translation().debug(),
				TextDocumentEngine.this.log
			);

			final String[][] translations = new String[text.getPageCount()][];
			final List<List<Slot>> slotsPerPart = new ArrayList<>(parts.size());
			int total = 0;
			for (final List<Integer> part : parts) {
				final List<Slot> slots = collectSlots(text, part, translations);
				slotsPerPart.add(slots);
				total += slots.size();
			}

			int done = 0;
			for (int p = 0; p < parts.size(); p++) {
				final String stage = parts.size() > 1 ? "Translate part " + (p + 1) + "/" + parts.size() : STAGE_TRANSLATE;
				final List<Slot> slots = slotsPerPart.get(p);
				int partDone = 0;
				progress(stage, 0, overall(done, total));
				for (final List<Slot> batch : batches(slots)) {
					if (this.stream.isClosed()) {
						TextDocumentEngine.this.log.info("Translation of " + this.document + " abandoned by its consumer");
						return false;
					}
					final List<String> sources = new ArrayList<>(batch.size());
					for (final Slot slot : batch) {
						sources.add(slot.text());
					}
					final BatchTranslation result = translator.translate(sources);
					for (final ErrorEvent error : result.errors()) {
						this.stream.emit(error);
					}
					for (int i = 0; i < batch.size(); i++) {
						final Slot slot = batch.get(i);
						translations[slot.page()][slot.paragraph()] = result.translations().get(i);
					}
					done += batch.size();
					partDone += batch.size();
					progress(stage, percent(partDone, slots.size()), overall(done, total));
				}
				if (slots.isEmpty()) {
					progress(stage, 100, overall(done, total));
				}
			}
			TextDocumentEngine.this.log.info(
				"Translated " + total + " paragraph(s) with " + llmClient.getRequestCount() + " request(s), tokens " +
					llmClient.getInputTokenCount() + "/" + llmClient.getOutputTokenCount()
			);

			if (this.stream.isClosed()) {
				return false;
			}
			progress(STAGE_WRITE, 0, PARSE_SHARE + TRANSLATE_SHARE);
			final ResultData resultData = writeArtifacts(text, translations);
			progress(STAGE_WRITE, 100, 100);
			this.stream.emit(new FinishEvent(resultData));
			return true;
		}

		@Nonnull
		private List<Slot> collectSlots(@Nonnull TextDocument text, @Nonnull List<Integer> pages, @Nonnull String[][] translations) {
			final int minTextLength = this.config.translation().minTextLength();
			final List<Slot> slots = new ArrayList<>();
			for (final int page : pages) {
				final List<String> paragraphs = text.getParagraphs(page);
				translations[page] = new String[paragraphs.size()];
				for (int i = 0; i < paragraphs.size(); i++) {
					final String paragraph = paragraphs.get(i);
					if (paragraph.strip().length() >= minTextLength) {
						slots.add(new Slot(page, i, paragraph));
					}
				}
			}
			return slots;
		}

		@Nonnull
		private ResultData writeArtifacts(@Nonnull TextDocument text, @Nonnull String[][] translations) throws IOException {
			final OutputOptions output = this.config.output();
			final WatermarkMode watermarkMode = output.watermarkMode();
			final Path outputDirectory = this.config.outputDirectory();
			final String targetLanguage = this.config.targetLanguage();
			final String banner = "Translated by pdf-translator (" + this.config.sourceLanguage() + " -> " + targetLanguage + ")\n\n";

			Path mono = null;
			Path dual = null;
			Path noWatermarkMono = null;
			Path noWatermarkDual = null;

			if (!output.noMono()) {
				final String body = render(text, translations, false);
				if (watermarkMode.producesWatermarked()) {
					mono = write(banner + body, ArtifactWriter.MONO, true);
				}
				if (watermarkMode.producesUnwatermarked()) {
					noWatermarkMono = write(body, ArtifactWriter.MONO, false);
				}
			}
			if (!output.noDual()) {
				final String body = render(text, translations, true);
				if (watermarkMode.producesWatermarked()) {
					dual = write(banner + body, ArtifactWriter.DUAL, true);
				}
				if (watermarkMode.producesUnwatermarked()) {
					noWatermarkDual = write(body, ArtifactWriter.DUAL, false);
				}
			}
			TextDocumentEngine.this.log.debug("Artifacts written to " + outputDirectory);

			final double seconds = (System.nanoTime() - this.startNanos) / (double) TimeUnit.SECONDS.toNanos(1);
			return new ResultData(
				this.document.toAbsolutePath().normalize(),
				mono,
				dual,
				noWatermarkMono,
				noWatermarkDual,
				null,
				seconds,
				this.peakMemoryBytes / BYTES_PER_MIB
			);
		}

		@Nonnull
		private Path write(@Nonnull String content, @Nonnull String kind, boolean watermarked) throws IOException {
			final String finalContent = this.config.output().enhanceCompatibility()
				? Normalizer.normalize(content, Normalizer.Form.NFC)
				: content;
			final Path target = ArtifactWriter.resolve(
				this.config.outputDirectory(), this.document, this.config.targetLanguage(), kind, watermarked
			);
			return TextDocumentEngine.this.writer.write(finalContent, target);
		}

		/**
		 * Renders the document. Pages that were not selected and paragraphs without translation are copied
		 * as they are. In the dual rendering every translated paragraph is paired with its original.
		 */
		@Nonnull
		private String render(@Nonnull TextDocument text, @Nonnull String[][] translations, boolean dual) {
			final boolean translationFirst = this.config.output().enhanceCompatibility();
			final StringBuilder sb = new StringBuilder();
			for (int page = 0; page < text.getPageCount(); page++) {
				if (page > 0) {
					sb.append('\n').append(TextDocument.PAGE_SEPARATOR).append('\n');
				}
				final List<String> paragraphs = text.getParagraphs(page);
				for (int i = 0; i < paragraphs.size(); i++) {
					if (i > 0) {
						sb.append("\n\n");
					}
					final String original = paragraphs.get(i);
					final String translation = translations[page] == null ? null : translations[page][i];
					if (translation == null) {
						sb.append(original);
					} else if (!dual) {
						sb.append(translation);
					} else if (translationFirst) {
						sb.append(translation).append('\n').append(original);
					} else {
						sb.append(original).append('\n').append(translation);
					}
				}
			}
			return sb.append('\n').toString();
		}

		private void progress(@Nonnull String stage, double stageProgress, double overallProgress) {
			final Runtime runtime = Runtime.getRuntime();
			this.peakMemoryBytes = Math.max(this.peakMemoryBytes, runtime.totalMemory() - runtime.freeMemory());
			this.stream.emit(new ProgressUpdateEvent(stage, stageProgress, overallProgress));
		}

		private double overall(int done, int total) {
			return PARSE_SHARE + TRANSLATE_SHARE * (total == 0 ? 1.0 : done / (double) total);
		}
	}

	private static double percent(int done, int total) {
		return total == 0 ? 100.0 : 100.0 * done / total;
	}

	/**
	 * Splits the selected pages into parts of at most the given size.
	 *
	 * @param pages           selected page indexes
	 * @param maxPagesPerPart part size, null for a single part
	 * @return parts in document order, at least one
	 */
	@Nonnull
	static List<List<Integer>> partition(@Nonnull List<Integer> pages, @Nullable Integer maxPagesPerPart) {
		if (maxPagesPerPart == null || pages.size() <= maxPagesPerPart) {
			return List.of(pages);
		}
		final List<List<Integer>> parts = new ArrayList<>();
		for (int i = 0; i < pages.size(); i += maxPagesPerPart) {
			parts.add(pages.subList(i, Math.min(pages.size(), i + maxPagesPerPart)));
		}
		return parts;
	}

	/**
	 * Groups paragraphs into request batches bounded by paragraph count and total length.
	 */
	@Nonnull
	private static List<List<Slot>> batches(@Nonnull List<Slot> slots) {
		final List<List<Slot>> batches = new ArrayList<>();
		List<Slot> current = new ArrayList<>();
		int characters = 0;
		for (final Slot slot : slots) {
			final int length = slot.text().length();
			if (!current.isEmpty() && (current.size() >= MAX_BATCH_PARAGRAPHS || characters + length > MAX_BATCH_CHARACTERS)) {
				batches.add(current);
				current = new ArrayList<>();
				characters = 0;
			}
			current.add(slot);
			characters += length;
		}
		if (!current.isEmpty()) {
			batches.add(current);
		}
		return batches;
	}
}
