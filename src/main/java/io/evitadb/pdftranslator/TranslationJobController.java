package io.evitadb.pdftranslator;

import io.evitadb.pdftranslator.engine.TranslationEngine;
import io.evitadb.pdftranslator.event.ErrorEvent;
import io.evitadb.pdftranslator.event.EventStream;
import io.evitadb.pdftranslator.event.FinishEvent;
import io.evitadb.pdftranslator.event.ProgressUpdateEvent;
import io.evitadb.pdftranslator.event.TranslationEvent;
import io.evitadb.pdftranslator.model.ResultData;
import io.evitadb.pdftranslator.model.ResultDataDecoder;
import io.evitadb.pdftranslator.model.RunConfig;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Drives translation runs to completion. For each run the controller checks the input, obtains the
 * engine's event stream and consumes it on an internal scheduler, dispatching every event by kind:
 *
 * - progress updates are logged and forwarded to the observer
 * - error events are logged and forwarded to the observer; the run continues
 * - the finish event is decoded into {@link ResultData} and ends the iteration; events the engine already
 *   queued after it are logged and ignored, the controller never waits for more
 *
 * A stream that ends without a finish event fails the run with {@link IncompleteRunException}, a stream
 * that raises fails it with {@link TransportFailureException}. Runs share no mutable state, so any number
 * of them may be in flight at once.
 */
public final class TranslationJobController {

	private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

	@Nonnull
	private final TranslationEngine engine;
	@Nonnull
	private final Log log;
	@Nonnull
	private final ExecutorService executor;
	@Nonnull
	private final ResultDataDecoder decoder = new ResultDataDecoder();

	/**
	 * Creates a controller consuming runs of the given engine.
	 *
	 * @param engine the engine producing event streams
	 * @param log    Maven log for progress and diagnostics
	 */
	public TranslationJobController(@Nonnull TranslationEngine engine, @Nonnull Log log) {
		this.engine = Objects.requireNonNull(engine, "engine must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
		final AtomicInteger threadCounter = new AtomicInteger(0);
		this.executor = Executors.newCachedThreadPool(runnable -> {
			final Thread thread = new Thread(runnable, "translation-run-" + threadCounter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		});
	}

	/**
	 * Runs the translation and blocks until it finishes.
	 *
	 * @param config   validated run configuration
	 * @param observer optional observer of progress and error events
	 * @return the result of the run
	 * @throws InputNotFoundException     if the source document does not exist
	 * @throws InvalidConfigException     if the configuration or the result payload is invalid
	 * @throws TransportFailureException  if the event stream fails
	 * @throws IncompleteRunException     if the stream ends without a finish event
	 * @throws RunCancelledException      if the waiting thread is interrupted
	 */
	@Nonnull
	public ResultData run(@Nonnull RunConfig config, @Nullable RunObserver observer) throws TranslationRunException {
		return start(config, observer).await();
	}

	/**
	 * Starts the translation and returns immediately. The input is checked before the engine is asked for
	 * its stream, so a missing document or an invalid configuration fails here and no event is produced.
	 *
	 * @param config   validated run configuration
	 * @param observer optional observer of progress and error events
	 * @return handle of the running translation
	 * @throws InputNotFoundException     if the source document does not exist
	 * @throws InvalidConfigException     if the configuration is invalid
	 * @throws TransportFailureException  if the engine cannot open its stream
	 */
	@Nonnull
	public TranslationRun start(@Nonnull RunConfig config, @Nullable RunObserver observer) throws TranslationRunException {
		Objects.requireNonNull(config, "config must not be null");

		final Path document = config.sourceDocument();
		if (!Files.exists(document)) {
			throw new InputNotFoundException(document);
		}
		config.validate();

		this.log.info("Starting translation: " + document);
		this.log.info("Output directory: " + config.outputDirectory());
		this.log.info("Source language: " + config.sourceLanguage() + ", target language: " + config.targetLanguage());

		final EventStream stream;
		try {
			stream = this.engine.stream(config, document);
		} catch (RuntimeException e) {
			throw new TransportFailureException(e);
		}

		final TranslationRun run = new TranslationRun(document, stream, this.log);
		final RunObserver effectiveObserver = observer == null ? RunObserver.NONE : observer;
		try {
			this.executor.execute(() -> execute(run, stream, effectiveObserver));
		} catch (RejectedExecutionException e) {
			run.release();
			throw new TransportFailureException(e);
		}
		return run;
	}

	/**
	 * Consumes the stream of one run and settles its handle.
	 */
	private void execute(@Nonnull TranslationRun run, @Nonnull EventStream stream, @Nonnull RunObserver observer) {
		ResultData resultData = null;
		TranslationRunException failure = null;
		try {
			resultData = consume(stream, observer, run::isCancelled);
		} catch (TranslationRunException e) {
			failure = e;
		} catch (RuntimeException e) {
			failure = new TransportFailureException(e);
		} finally {
			run.release();
		}

		if (failure != null) {
			if (failure.getKind() != FailureKind.CANCELLED) {
				this.log.error("Translation failed: " + failure.getMessage(), failure);
			}
			run.fail(failure);
		} else {
			run.succeed(resultData);
		}
	}

	/**
	 * Iterates the event stream in emission order and returns the result carried by its finish event.
	 * The stream is not closed by this method.
	 *
	 * @param stream    the event stream of a run
	 * @param observer  receiver of progress and error events
	 * @param cancelled checked between events; when it turns true the run stops
	 * @return result decoded from the finish event
	 * @throws TransportFailureException if the stream raises before the finish event
	 * @throws IncompleteRunException    if the stream ends without a finish event
	 * @throws RunCancelledException     if cancellation is observed
	 * @throws ResultSchemaException     if the finish payload does not follow the result schema
	 */
	@Nonnull
	ResultData consume(
		@Nonnull EventStream stream,
		@Nonnull RunObserver observer,
		@Nonnull BooleanSupplier cancelled
	) throws TranslationRunException {
		ResultData result = null;
		int consumed = 0;

		while (true) {
			if (cancelled.getAsBoolean()) {
				throw new RunCancelledException("Translation cancelled after " + consumed + " event(s)");
			}

			final TranslationEvent event;
			try {
				if (!stream.hasNext()) {
					break;
				}
				event = stream.next();
			} catch (RuntimeException e) {
				if (cancelled.getAsBoolean()) {
					throw new RunCancelledException("Translation cancelled after " + consumed + " event(s)");
				}
				throw new TransportFailureException(e);
			}

			if (event == null) {
				continue;
			}
			consumed++;

			if (event instanceof ProgressUpdateEvent) {
				final ProgressUpdateEvent progress = (ProgressUpdateEvent) event;
				this.log.info(String.format(
					Locale.ROOT, "[%s] progress: %.1f%% | overall: %.1f%%",
					progress.stage(), progress.stageProgress(), progress.overallProgress()
				));
				notifyObserver(observer, event);
			} else if (event instanceof ErrorEvent) {
				final ErrorEvent error = (ErrorEvent) event;
				this.log.error("Error [" + error.errorType() + "]: " + error.message());
				notifyObserver(observer, event);
			} else if (event instanceof FinishEvent) {
				result = this.decoder.decode(((FinishEvent) event).translateResult());
				this.log.info("Translation finished");
				this.log.info(result.toString());
				drainAfterFinish(stream);
				break;
			}
		}

		if (cancelled.getAsBoolean()) {
			throw new RunCancelledException("Translation cancelled after " + consumed + " event(s)");
		}
		if (result == null) {
			throw new IncompleteRunException(consumed);
		}
		return result;
	}

	/**
	 * Logs events that the engine already queued after its finish event. Never waits for more.
	 */
	private void drainAfterFinish(@Nonnull EventStream stream) {
		try {
			while (stream.isReady() && stream.hasNext()) {
				final TranslationEvent late = stream.next();
				if (late != null) {
					this.log.warn("Ignoring " + describe(late) + " received after the finish event");
				}
			}
		} catch (RuntimeException e) {
			this.log.warn("Event stream failed after the finish event, keeping the result: " + e.getMessage());
		}
	}

	private void notifyObserver(@Nonnull RunObserver observer, @Nonnull TranslationEvent event) {
		try {
			observer.onEvent(event);
		} catch (RuntimeException e) {
			this.log.warn("Run observer failed on " + describe(event) + ": " + e.getMessage(), e);
		}
	}

	@Nonnull
	private static String describe(@Nonnull TranslationEvent event) {
		return event.getClass().getSimpleName();
	}

	/**
	 * Shuts down the scheduler, waiting for runs in flight to complete.
	 */
	public void shutdown() {
		this.executor.shutdown();
		try {
			if (!this.executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
				this.log.warn("Translation runs did not terminate in time, forcing shutdown");
				this.executor.shutdownNow();
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			this.executor.shutdownNow();
		}
	}
}
