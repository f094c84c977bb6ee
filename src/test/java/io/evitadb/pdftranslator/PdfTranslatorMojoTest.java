package io.evitadb.pdftranslator;

import io.evitadb.pdftranslator.engine.TranslationEngine;
import io.evitadb.pdftranslator.event.ErrorEvent;
import io.evitadb.pdftranslator.event.FinishEvent;
import io.evitadb.pdftranslator.event.ProgressUpdateEvent;
import io.evitadb.pdftranslator.model.ResultData;
import io.evitadb.pdftranslator.model.RunConfig;
import org.apache.maven.plugin.MojoExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PdfTranslatorMojo should drive the configured action")
class PdfTranslatorMojoTest {

	@TempDir
	Path tempDir;

	private PdfTranslatorMojo mojo;
	private CapturingLog log;
	private Path configFile;

	@BeforeEach
	void setUp() {
		mojo = new PdfTranslatorMojo();
		log = new CapturingLog();
		mojo.setLog(log);
		configFile = tempDir.resolve("config/config.json");
		mojo.setConfig(configFile.toString());
	}

	private void writeSettings(String json) throws Exception {
		Files.createDirectories(configFile.getParent());
		Files.writeString(configFile, json, StandardCharsets.UTF_8);
	}

	private Path writeDocument() throws Exception {
		final Path document = tempDir.resolve("paper.txt");
		Files.writeString(document, "A paragraph worth translating.", StandardCharsets.UTF_8);
		return document;
	}

	@Test
	@DisplayName("shouldRejectUnknownAction")
	void shouldRejectUnknownAction() {
		mojo.setAction("diff");

		final MojoExecutionException ex = assertThrows(MojoExecutionException.class, mojo::execute);
		assertTrue(ex.getMessage().contains("Unknown action: diff"));
	}

	@Nested
	@DisplayName("show-config")
	class ShowConfig {

		@Test
		@DisplayName("shouldShowDefaultsAndWarnWhenSettingsAreMissing")
		void shouldShowDefaultsAndWarnWhenSettingsAreMissing() throws Exception {
			mojo.setAction(null);

			mojo.execute();

			assertTrue(log.hasInfo("PDF Translator Configuration:"));
			assertTrue(log.hasInfo(" - translation_engine: openai"));
			assertTrue(log.hasInfo(" - model: gpt-4o-mini"));
			assertTrue(log.hasInfo(" - qps: 4"));
			assertTrue(log.hasWarn("does not exist, showing defaults"));
			assertTrue(log.hasWarn("API key is not set"));
			assertTrue(log.hasWarn("Input document is not set"));
		}

		@Test
		@DisplayName("shouldMaskApiKey")
		void shouldMaskApiKey() throws Exception {
			writeSettings("{\"openai_api_key\":\"sk-secret-1234\"}");
			mojo.setAction("show-config");

			mojo.execute();

			assertTrue(log.hasInfo(" - api key: ****1234"));
			assertFalse(log.getInfos().stream().anyMatch(line -> line.contains("sk-secret")));
			assertFalse(log.hasWarn("API key"));
		}

		@Test
		@DisplayName("shouldWarnAboutPlaceholderKeyAndUnsupportedEngine")
		void shouldWarnAboutPlaceholderKeyAndUnsupportedEngine() throws Exception {
			writeSettings("{\"translation_engine\":\"deepl\",\"openai_api_key\":\"your-api-key-here\"}");
			mojo.setAction("show-config");

			mojo.execute();

			assertTrue(log.hasWarn("Unsupported translation engine: deepl"));
			assertTrue(log.hasWarn("placeholder"));
		}
	}

	@Nested
	@DisplayName("create-config")
	class CreateConfig {

		@Test
		@DisplayName("shouldCreateExampleAndRefuseToOverwrite")
		void shouldCreateExampleAndRefuseToOverwrite() throws Exception {
			mojo.setAction("create-config");

			mojo.execute();

			assertTrue(Files.exists(configFile));
			assertTrue(log.hasInfo("Example settings file created"));
			final String created = Files.readString(configFile, StandardCharsets.UTF_8);
			assertTrue(created.contains("your-api-key-here"));

			final MojoExecutionException ex = assertThrows(MojoExecutionException.class, mojo::execute);
			assertTrue(ex.getMessage().contains("refusing to overwrite"));
			assertEquals(created, Files.readString(configFile, StandardCharsets.UTF_8));
		}
	}

	@Nested
	@DisplayName("translate")
	class Translate {

		private final AtomicInteger engineCalls = new AtomicInteger();
		private final List<RunConfig> configs = new ArrayList<>();

		private void useEngine(Object... script) {
			mojo.setEngineFactory(engineLog -> (TranslationEngine) (config, document) -> {
				engineCalls.incrementAndGet();
				configs.add(config);
				return new ScriptedEventStream(script);
			});
		}

		@Test
		@DisplayName("shouldRequireInput")
		void shouldRequireInput() {
			mojo.setAction("translate");
			useEngine();

			final MojoExecutionException ex = assertThrows(MojoExecutionException.class, mojo::execute);
			assertTrue(ex.getMessage().contains("Input document must be specified"));
			assertEquals(0, engineCalls.get());
		}

		@Test
		@DisplayName("shouldFailForMissingInputDocument")
		void shouldFailForMissingInputDocument() throws Exception {
			writeSettings("{\"openai_api_key\":\"sk-1\"}");
			mojo.setAction("translate");
			mojo.setInput(tempDir.resolve("missing.txt").toString());
			useEngine();

			final MojoExecutionException ex = assertThrows(MojoExecutionException.class, mojo::execute);
			assertTrue(ex.getMessage().contains("does not exist"));
			assertEquals(0, engineCalls.get());
		}

		@Test
		@DisplayName("shouldPointToCreateConfigWhenSettingsAreMissing")
		void shouldPointToCreateConfigWhenSettingsAreMissing() throws Exception {
			mojo.setAction("translate");
			mojo.setInput(writeDocument().toString());
			useEngine();

			final MojoExecutionException ex = assertThrows(MojoExecutionException.class, mojo::execute);
			assertTrue(ex.getMessage().contains("create-config"));
		}

		@Test
		@DisplayName("shouldRejectInvalidOptions")
		void shouldRejectInvalidOptions() throws Exception {
			writeSettings("{\"openai_api_key\":\"sk-1\"}");
			mojo.setAction("translate");
			mojo.setInput(writeDocument().toString());
			mojo.setNoDual(true);
			mojo.setNoMono(true);
			useEngine();

			final MojoExecutionException ex = assertThrows(MojoExecutionException.class, mojo::execute);
			assertTrue(ex.getMessage().startsWith("Invalid configuration"));
			assertEquals(0, engineCalls.get());
		}

		@Test
		@DisplayName("shouldRejectUnknownWatermarkMode")
		void shouldRejectUnknownWatermarkMode() throws Exception {
			writeSettings("{\"openai_api_key\":\"sk-1\"}");
			mojo.setAction("translate");
			mojo.setInput(writeDocument().toString());
			mojo.setWatermark("faded");
			useEngine();

			final MojoExecutionException ex = assertThrows(MojoExecutionException.class, mojo::execute);
			assertTrue(ex.getMessage().startsWith("Invalid configuration"));
		}

		@Test
		@DisplayName("shouldReportSummaryOfSuccessfulRun")
		void shouldReportSummaryOfSuccessfulRun() throws Exception {
			writeSettings("{\"openai_api_key\":\"sk-1\",\"qps\":2}");
			final Path document = writeDocument();
			final Path mono = tempDir.resolve("paper.zh.mono.txt");
			final Path dual = tempDir.resolve("paper.zh.dual.txt");
			mojo.setAction("translate");
			mojo.setInput(document.toString());
			mojo.setLangOut("de");
			mojo.setPages("1-");
			useEngine(
				new ProgressUpdateEvent("Translate paragraphs", 50.0, 50.0),
				new ErrorEvent("IllegalStateException", "paragraph 2 failed"),
				new FinishEvent(new ResultData(document, mono, dual, null, null, null, 1.5, 12.25))
			);

			mojo.execute();

			assertEquals(1, engineCalls.get());
			final RunConfig config = configs.get(0);
			assertEquals("en", config.sourceLanguage());
			assertEquals("de", config.targetLanguage());
			assertEquals(2, config.translation().qps());
			assertEquals("1-", config.output().pages());
			assertEquals(document.toAbsolutePath().normalize().getParent(), config.outputDirectory());

			assertTrue(log.hasInfo("--- Translation Summary ---"));
			assertTrue(log.hasInfo("Output: " + mono));
			assertTrue(log.hasInfo("Output: " + dual));
			assertTrue(log.hasInfo("Time: 1.50s"));
			assertTrue(log.hasInfo("Peak memory: 12.25 MiB"));
			assertTrue(log.hasWarn("Chunk errors: 1"));
		}

		@Test
		@DisplayName("shouldWarnWhenRunProducesNoArtifacts")
		void shouldWarnWhenRunProducesNoArtifacts() throws Exception {
			writeSettings("{\"openai_api_key\":\"sk-1\"}");
			mojo.setAction("translate");
			mojo.setInput(writeDocument().toString());
			useEngine(new FinishEvent(new ResultData(null, null, null, null, null, null, 0.1, 1.0)));

			mojo.execute();

			assertTrue(log.hasWarn("produced no output files"));
		}

		@Test
		@DisplayName("shouldNameFailureKindWhenRunIsIncomplete")
		void shouldNameFailureKindWhenRunIsIncomplete() throws Exception {
			writeSettings("{\"openai_api_key\":\"sk-1\"}");
			mojo.setAction("translate");
			mojo.setInput(writeDocument().toString());
			useEngine(new ProgressUpdateEvent("Parse document", 100.0, 5.0));

			final MojoExecutionException ex = assertThrows(MojoExecutionException.class, mojo::execute);
			assertTrue(ex.getMessage().contains("INCOMPLETE_RUN"));
			assertInstanceOf(IncompleteRunException.class, ex.getCause());
		}

		@Test
		@DisplayName("shouldNameFailureKindWhenStreamFails")
		void shouldNameFailureKindWhenStreamFails() throws Exception {
			writeSettings("{\"openai_api_key\":\"sk-1\"}");
			mojo.setAction("translate");
			mojo.setInput(writeDocument().toString());
			useEngine(new IllegalStateException("connection reset"));

			final MojoExecutionException ex = assertThrows(MojoExecutionException.class, mojo::execute);
			assertTrue(ex.getMessage().contains("TRANSPORT_FAILURE"));
			assertInstanceOf(TransportFailureException.class, ex.getCause());
		}
	}
}
