package io.evitadb.pdftranslator;

import io.evitadb.pdftranslator.engine.TranslationEngine;
import io.evitadb.pdftranslator.event.ErrorEvent;
import io.evitadb.pdftranslator.event.FinishEvent;
import io.evitadb.pdftranslator.event.ProgressUpdateEvent;
import io.evitadb.pdftranslator.event.TranslationEvent;
import io.evitadb.pdftranslator.model.EngineSettings;
import io.evitadb.pdftranslator.model.OutputOptions;
import io.evitadb.pdftranslator.model.ResultData;
import io.evitadb.pdftranslator.model.RunConfig;
import io.evitadb.pdftranslator.model.TranslationOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TranslationJobController should drive runs to completion")
class TranslationJobControllerTest {

	@TempDir
	Path tempDir;

	private CapturingLog log;
	private Path document;
	private RunConfig config;
	private List<TranslationEvent> observed;
	private TranslationJobController controller;

	@BeforeEach
	void setUp() throws Exception {
		log = new CapturingLog();
		document = tempDir.resolve("paper.txt");
		Files.writeString(document, "Hello world, this is a paper.", StandardCharsets.UTF_8);
		config = configFor(document);
		observed = Collections.synchronizedList(new ArrayList<>());
	}

	@AfterEach
	void tearDown() {
		if (controller != null) {
			controller.shutdown();
		}
	}

	private RunConfig configFor(Path source) {
		return new RunConfig(
			source,
			tempDir,
			"en",
			"zh",
			new EngineSettings("openai", "sk-test", null, "gpt-4o-mini"),
			TranslationOptions.defaults(),
			OutputOptions.defaults()
		);
	}

	private TranslationJobController controllerFor(ScriptedEventStream stream) {
		controller = new TranslationJobController((runConfig, doc) -> stream, log);
		return controller;
	}

	private static ResultData sampleResult() {
		return new ResultData(
			Path.of("/docs/paper.pdf"),
			Path.of("/docs/paper.zh.mono.pdf"),
			Path.of("/docs/paper.zh.dual.pdf"),
			null,
			null,
			null,
			42.5,
			512.0
		);
	}

	@Nested
	@DisplayName("terminal event")
	class TerminalEvent {

		@Test
		@DisplayName("shouldReturnResultOfFinishEvent")
		void shouldReturnResultOfFinishEvent() throws Exception {
			final ResultData expected = sampleResult();
			final ScriptedEventStream stream = new ScriptedEventStream(
				new ProgressUpdateEvent("Parse document", 100, 5),
				new FinishEvent(expected)
			);

			final ResultData result = controllerFor(stream).run(config, observed::add);

			assertEquals(expected, result);
			assertEquals(1, stream.getCloseCount());
			assertTrue(log.hasInfo("Translation finished"));
		}

		@Test
		@Timeout(value = 10, unit = TimeUnit.SECONDS)
		@DisplayName("shouldSettleRunOnFinishWhenStreamStaysOpen")
		void shouldSettleRunOnFinishWhenStreamStaysOpen() throws Exception {
			final ResultData expected = sampleResult();
			final StalledEventStream stream = new StalledEventStream(
				new ProgressUpdateEvent("Write output", 100, 100),
				new FinishEvent(expected)
			);
			controller = new TranslationJobController((runConfig, doc) -> stream, log);

			final TranslationRun run = controller.start(config, observed::add);

			assertSame(expected, run.await(Duration.ofSeconds(5)));
			assertFalse(run.isCancelled());
			assertEquals(1, observed.size());
			controller.shutdown();
			assertEquals(1, stream.getCloseCount());
		}

		@Test
		@DisplayName("shouldDecodeMappingPayloadWithMissingFields")
		void shouldDecodeMappingPayloadWithMissingFields() throws Exception {
			final Map<String, Object> payload = new HashMap<>();
			payload.put("original_pdf_path", "/docs/paper.pdf");
			payload.put("dual_pdf_path", "/docs/paper.zh.dual.pdf");
			final ScriptedEventStream stream = new ScriptedEventStream(new FinishEvent(payload));

			final ResultData result = controllerFor(stream).run(config, null);

			assertEquals(Path.of("/docs/paper.pdf"), result.originalPdfPath());
			assertEquals(Path.of("/docs/paper.zh.dual.pdf"), result.dualPdfPath());
			assertNull(result.monoPdfPath());
			assertNull(result.noWatermarkMonoPdfPath());
			assertNull(result.noWatermarkDualPdfPath());
			assertNull(result.autoExtractedGlossaryPath());
			assertEquals(0.0, result.totalSeconds());
			assertEquals(0.0, result.peakMemoryUsage());
		}

		@Test
		@DisplayName("shouldFailWithIncompleteRunWithoutFinish")
		void shouldFailWithIncompleteRunWithoutFinish() {
			final ScriptedEventStream stream = new ScriptedEventStream(
				new ProgressUpdateEvent("Translate paragraphs", 50, 50),
				new ErrorEvent("IOException", "page 3 failed"),
				new ProgressUpdateEvent("Translate paragraphs", 100, 95)
			);

			final IncompleteRunException exception = assertThrows(IncompleteRunException.class, () ->
				controllerFor(stream).run(config, observed::add));

			assertEquals(FailureKind.INCOMPLETE_RUN, exception.getKind());
			assertEquals(3, exception.getObservedEvents());
			assertEquals(1, stream.getCloseCount());
		}

		@Test
		@DisplayName("shouldFailWithIncompleteRunOnEmptyStream")
		void shouldFailWithIncompleteRunOnEmptyStream() {
			final ScriptedEventStream stream = new ScriptedEventStream();

			assertThrows(IncompleteRunException.class, () -> controllerFor(stream).run(config, null));
		}

		@Test
		@DisplayName("shouldRejectPayloadNotMatchingResultSchema")
		void shouldRejectPayloadNotMatchingResultSchema() {
			final ScriptedEventStream stream = new ScriptedEventStream(new FinishEvent("done"));

			final ResultSchemaException exception = assertThrows(ResultSchemaException.class, () ->
				controllerFor(stream).run(config, null));

			assertEquals(FailureKind.INVALID_CONFIG, exception.getKind());
			assertEquals(1, stream.getCloseCount());
		}
	}

	@Nested
	@DisplayName("event dispatch")
	class Dispatch {

		@Test
		@DisplayName("shouldContinueAfterErrorEventAndObserveItOnce")
		void shouldContinueAfterErrorEventAndObserveItOnce() throws Exception {
			final ErrorEvent error = new ErrorEvent("RuntimeException", "chunk 4 failed");
			final ProgressUpdateEvent first = new ProgressUpdateEvent("Translate paragraphs", 60, 60);
			final ProgressUpdateEvent second = new ProgressUpdateEvent("Translate paragraphs", 100, 95);
			final ResultData expected = sampleResult();
			final ScriptedEventStream stream = new ScriptedEventStream(
				error, first, second, new FinishEvent(expected)
			);

			final ResultData result = controllerFor(stream).run(config, observed::add);

			assertEquals(expected, result);
			assertEquals(List.of(error, first, second), observed);
			assertEquals(1, observed.stream().filter(e -> e == error).count());
			assertTrue(log.hasError("Error [RuntimeException]: chunk 4 failed"));
		}

		@Test
		@DisplayName("shouldLogProgressLines")
		void shouldLogProgressLines() throws Exception {
			final ScriptedEventStream stream = new ScriptedEventStream(
				new ProgressUpdateEvent("Translate paragraphs", 12.34, 56.78),
				new FinishEvent(sampleResult())
			);

			controllerFor(stream).run(config, null);

			assertTrue(log.hasInfo("[Translate paragraphs] progress: 12.3% | overall: 56.8%"));
		}

		@Test
		@DisplayName("shouldIgnoreEventsAfterFinish")
		void shouldIgnoreEventsAfterFinish() throws Exception {
			final ResultData expected = sampleResult();
			final ScriptedEventStream stream = new ScriptedEventStream(
				new FinishEvent(expected),
				new ProgressUpdateEvent("Write output", 100, 100),
				new ErrorEvent("IllegalStateException", "late"),
				new FinishEvent(Map.of("total_seconds", 1))
			);

			final ResultData result = controllerFor(stream).run(config, observed::add);

			assertSame(expected, result);
			assertTrue(observed.isEmpty());
			assertEquals(4, stream.getDelivered());
			assertTrue(log.hasWarn("Ignoring ProgressUpdateEvent received after the finish event"));
			assertTrue(log.hasWarn("Ignoring FinishEvent received after the finish event"));
		}

		@Test
		@DisplayName("shouldSkipEmptyPlaceholders")
		void shouldSkipEmptyPlaceholders() throws Exception {
			final ScriptedEventStream stream = new ScriptedEventStream(
				null,
				new ProgressUpdateEvent("Parse document", 100, 5),
				null,
				new FinishEvent(sampleResult())
			);

			controllerFor(stream).run(config, observed::add);

			assertEquals(1, observed.size());
			assertFalse(log.hasWarn("Ignoring"));
		}

		@Test
		@DisplayName("shouldNotFailRunWhenObserverThrows")
		void shouldNotFailRunWhenObserverThrows() throws Exception {
			final ScriptedEventStream stream = new ScriptedEventStream(
				new ProgressUpdateEvent("Parse document", 100, 5),
				new FinishEvent(sampleResult())
			);

			final ResultData result = controllerFor(stream).run(config, event -> {
				throw new IllegalStateException("observer bug");
			});

			assertNotNull(result);
			assertTrue(log.hasWarn("observer bug"));
		}
	}

	@Nested
	@DisplayName("failures")
	class Failures {

		@Test
		@DisplayName("shouldFailWithTransportFailureAndStopIterating")
		void shouldFailWithTransportFailureAndStopIterating() {
			final IllegalStateException cause = new IllegalStateException("connection reset");
			final ScriptedEventStream stream = new ScriptedEventStream(
				new ProgressUpdateEvent("Translate paragraphs", 10, 10),
				cause,
				new ProgressUpdateEvent("Translate paragraphs", 20, 20),
				new FinishEvent(sampleResult())
			);

			final TransportFailureException exception = assertThrows(TransportFailureException.class, () ->
				controllerFor(stream).run(config, observed::add));

			assertSame(cause, exception.getCause());
			assertEquals(FailureKind.TRANSPORT_FAILURE, exception.getKind());
			assertEquals(1, stream.getDelivered());
			assertEquals(1, observed.size());
			assertEquals(1, stream.getCloseCount());
		}

		@Test
		@DisplayName("shouldKeepResultWhenStreamFailsAfterFinish")
		void shouldKeepResultWhenStreamFailsAfterFinish() throws Exception {
			final ResultData expected = sampleResult();
			final ScriptedEventStream stream = new ScriptedEventStream(
				new FinishEvent(expected),
				new IllegalStateException("late failure")
			);

			assertSame(expected, controllerFor(stream).run(config, null));
			assertTrue(log.hasWarn("keeping the result"));
		}

		@Test
		@DisplayName("shouldFailWithInputNotFoundBeforeAnyEvent")
		void shouldFailWithInputNotFoundBeforeAnyEvent() {
			final AtomicInteger streamRequests = new AtomicInteger();
			final TranslationEngine engine = (runConfig, doc) -> {
				streamRequests.incrementAndGet();
				return new ScriptedEventStream(new ProgressUpdateEvent("Parse document", 0, 0));
			};
			controller = new TranslationJobController(engine, log);
			final Path missing = tempDir.resolve("missing.txt");

			final InputNotFoundException exception = assertThrows(InputNotFoundException.class, () ->
				controller.run(configFor(missing), observed::add));

			assertEquals(missing, exception.getDocument());
			assertEquals(FailureKind.INPUT_NOT_FOUND, exception.getKind());
			assertEquals(0, streamRequests.get());
			assertTrue(observed.isEmpty());
		}

		@Test
		@DisplayName("shouldFailWithInvalidConfigBeforeStreaming")
		void shouldFailWithInvalidConfigBeforeStreaming() {
			final AtomicInteger streamRequests = new AtomicInteger();
			controller = new TranslationJobController((runConfig, doc) -> {
				streamRequests.incrementAndGet();
				return new ScriptedEventStream();
			}, log);
			final RunConfig invalid = new RunConfig(
				document, tempDir, "en", "zh",
				new EngineSettings("openai", "", null, "gpt-4o-mini"),
				TranslationOptions.defaults(),
				OutputOptions.defaults()
			);

			final InvalidConfigException exception = assertThrows(InvalidConfigException.class, () ->
				controller.run(invalid, null));

			assertTrue(exception.getMessage().contains("API key"));
			assertEquals(0, streamRequests.get());
		}

		@Test
		@DisplayName("shouldWrapEngineFailureToOpenStream")
		void shouldWrapEngineFailureToOpenStream() {
			controller = new TranslationJobController((runConfig, doc) -> {
				throw new IllegalStateException("engine unavailable");
			}, log);

			final TransportFailureException exception = assertThrows(TransportFailureException.class, () ->
				controller.run(config, null));

			assertEquals("engine unavailable", exception.getCause().getMessage());
		}
	}

	@Nested
	@DisplayName("cancellation")
	class Cancellation {

		@Test
		@Timeout(value = 10, unit = TimeUnit.SECONDS)
		@DisplayName("shouldCancelRunAndReleaseStreamOnce")
		void shouldCancelRunAndReleaseStreamOnce() throws Exception {
			final StalledEventStream stream = new StalledEventStream();
			controller = new TranslationJobController((runConfig, doc) -> stream, log);

			final TranslationRun run = controller.start(config, null);
			assertFalse(run.isDone());

			assertTrue(run.cancel());
			assertFalse(run.cancel());

			final RunCancelledException exception = assertThrows(RunCancelledException.class, run::await);
			assertEquals(FailureKind.CANCELLED, exception.getKind());
			assertTrue(run.isCancelled());
			assertTrue(run.isDone());
			controller.shutdown();
			assertEquals(1, stream.getCloseCount());
			assertFalse(log.hasError("Translation failed"));
		}

		@Test
		@Timeout(value = 10, unit = TimeUnit.SECONDS)
		@DisplayName("shouldCancelRunWhenDeadlineExpires")
		void shouldCancelRunWhenDeadlineExpires() throws Exception {
			final StalledEventStream stream = new StalledEventStream();
			controller = new TranslationJobController((runConfig, doc) -> stream, log);

			final TranslationRun run = controller.start(config, null);

			final RunCancelledException exception = assertThrows(RunCancelledException.class, () ->
				run.await(Duration.ofMillis(100)));

			assertTrue(exception.getMessage().contains("did not finish within 100 ms"));
			assertTrue(run.isCancelled());
			controller.shutdown();
			assertEquals(1, stream.getCloseCount());
		}

		@Test
		@DisplayName("shouldStopConsumingWhenCancellationIsSignalled")
		void shouldStopConsumingWhenCancellationIsSignalled() {
			final ScriptedEventStream stream = new ScriptedEventStream(
				new ProgressUpdateEvent("Translate paragraphs", 10, 10),
				new ProgressUpdateEvent("Translate paragraphs", 20, 20),
				new FinishEvent(sampleResult())
			);
			final AtomicInteger checks = new AtomicInteger();

			assertThrows(RunCancelledException.class, () ->
				controllerFor(stream).consume(stream, observed::add, () -> checks.incrementAndGet() > 1));

			assertEquals(1, stream.getDelivered());
			assertEquals(0, stream.getCloseCount());
		}

		@Test
		@DisplayName("shouldAcceptDeadlineBeyondNanosecondRange")
		void shouldAcceptDeadlineBeyondNanosecondRange() throws Exception {
			final ResultData expected = sampleResult();
			final ScriptedEventStream stream = new ScriptedEventStream(new FinishEvent(expected));

			final TranslationRun run = controllerFor(stream).start(config, null);

			assertSame(expected, run.await(Duration.ofSeconds(Long.MAX_VALUE)));
			assertSame(expected, run.await(ChronoUnit.FOREVER.getDuration()));
		}

		@Test
		@DisplayName("shouldNotCancelFinishedRun")
		void shouldNotCancelFinishedRun() throws Exception {
			final ScriptedEventStream stream = new ScriptedEventStream(new FinishEvent(sampleResult()));

			final TranslationRun run = controllerFor(stream).start(config, null);
			run.await();

			assertFalse(run.cancel());
			assertFalse(run.isCancelled());
			assertEquals(1, stream.getCloseCount());
		}
	}

	@Test
	@DisplayName("shouldRunIndependentDocumentsConcurrently")
	void shouldRunIndependentDocumentsConcurrently() throws Exception {
		final Path other = tempDir.resolve("other.txt");
		Files.writeString(other, "Another document.", StandardCharsets.UTF_8);
		controller = new TranslationJobController((runConfig, doc) -> new ScriptedEventStream(
			new ProgressUpdateEvent("Parse document", 100, 5),
			new FinishEvent(Map.of("original_pdf_path", doc.toString()))
		), log);

		final TranslationRun first = controller.start(config, null);
		final TranslationRun second = controller.start(configFor(other), null);

		assertEquals(document, first.await().originalPdfPath());
		assertEquals(other, second.await().originalPdfPath());
		assertEquals(document, first.getDocument());
	}
}
