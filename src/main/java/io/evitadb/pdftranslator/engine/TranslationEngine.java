package io.evitadb.pdftranslator.engine;

import io.evitadb.pdftranslator.event.EventStream;
import io.evitadb.pdftranslator.model.RunConfig;

import javax.annotation.Nonnull;
import java.nio.file.Path;

/**
 * Streaming entry point of a translation engine. The engine translates one document per call and reports
 * its lifecycle through the returned event stream, ending with a finish event on success.
 *
 * Implementations produce events asynchronously; the caller owns the returned stream and must close it.
 */
public interface TranslationEngine {

	/**
	 * Starts translating the document and returns the stream of its lifecycle events.
	 *
	 * @param config   validated run configuration
	 * @param document the document to translate
	 * @return stream of events of this run
	 */
	@Nonnull
	EventStream stream(@Nonnull RunConfig config, @Nonnull Path document);
}
