package io.evitadb.pdftranslator.event;

/**
 * Lifecycle notification emitted by a translation engine during a run.
 * A {@link FinishEvent} is terminal; any number of {@link ProgressUpdateEvent} and {@link ErrorEvent}
 * instances may precede it.
 */
public sealed interface TranslationEvent permits ProgressUpdateEvent, ErrorEvent, FinishEvent {

	/**
	 * Whether no further events are expected after this one.
	 *
	 * @return true for terminal events
	 */
	default boolean isTerminal() {
		return false;
	}
}
