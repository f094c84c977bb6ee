package io.evitadb.pdftranslator;

/**
 * Thrown when the engine's event stream closed cleanly without ever producing a finish event.
 */
public final class IncompleteRunException extends TranslationRunException {

	private final int observedEvents;

	public IncompleteRunException(int observedEvents) {
		super(
			FailureKind.INCOMPLETE_RUN,
			"Translation event stream ended without a finish event after " + observedEvents + " event(s)",
			null
		);
		this.observedEvents = observedEvents;
	}

	/**
	 * Returns how many events were consumed before the stream ended.
	 *
	 * @return number of consumed events
	 */
	public int getObservedEvents() {
		return this.observedEvents;
	}
}
