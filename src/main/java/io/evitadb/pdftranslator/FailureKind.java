package io.evitadb.pdftranslator;

/**
 * Classifies the fatal conditions that end a translation run.
 */
public enum FailureKind {

	/** The source document does not exist. No run was attempted. */
	INPUT_NOT_FOUND,
	/** The run configuration or the engine's terminal payload is not acceptable. */
	INVALID_CONFIG,
	/** The event stream itself failed. */
	TRANSPORT_FAILURE,
	/** The event stream ended without a terminal event. */
	INCOMPLETE_RUN,
	/** The caller cancelled the run or its deadline expired. */
	CANCELLED

}
