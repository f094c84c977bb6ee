package io.evitadb.pdftranslator;

import io.evitadb.pdftranslator.event.TranslationEvent;

import javax.annotation.Nonnull;

/**
 * Callback receiving the non-terminal events of a run: every progress update and every chunk error.
 * It is invoked synchronously on the thread consuming the run, in event order and never concurrently
 * with itself. Exceptions thrown by the observer are logged and do not affect the run.
 */
@FunctionalInterface
public interface RunObserver {

	/**
	 * Observer that ignores all events.
	 */
	RunObserver NONE = event -> {
	};

	/**
	 * Called for each progress update or error event.
	 *
	 * @param event the event
	 */
	void onEvent(@Nonnull TranslationEvent event);
}
