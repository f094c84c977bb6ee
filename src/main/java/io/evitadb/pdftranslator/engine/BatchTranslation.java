package io.evitadb.pdftranslator.engine;

import io.evitadb.pdftranslator.event.ErrorEvent;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Outcome of translating one batch of paragraphs.
 *
 * @param translations one entry per input paragraph, in input order; null where translation failed
 * @param errors       failures of individual paragraphs
 * @param fallbackUsed whether the batch answer was unusable and paragraphs were translated one by one
 */
public record BatchTranslation(
	@Nonnull List<String> translations,
	@Nonnull List<ErrorEvent> errors,
	boolean fallbackUsed
) {
}
