package io.evitadb.pdftranslator.event;

import javax.annotation.Nullable;

/**
 * Terminal event of a successful run. The payload is decoded by the job controller, which accepts a
 * {@code ResultData} instance as well as loosely-typed maps following the documented result schema.
 *
 * @param translateResult result payload reported by the engine
 */
public record FinishEvent(@Nullable Object translateResult) implements TranslationEvent {

	@Override
	public boolean isTerminal() {
		return true;
	}
}
