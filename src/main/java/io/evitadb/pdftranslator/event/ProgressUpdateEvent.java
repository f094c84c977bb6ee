package io.evitadb.pdftranslator.event;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Progress of the current stage and of the whole run, both in percent.
 *
 * @param stage           human-readable name of the current stage
 * @param stageProgress   progress of the stage, 0..100
 * @param overallProgress progress of the run, 0..100
 */
public record ProgressUpdateEvent(
	@Nonnull String stage,
	double stageProgress,
	double overallProgress
) implements TranslationEvent {

	public ProgressUpdateEvent {
		Objects.requireNonNull(stage, "stage must not be null");
		stageProgress = clamp(stageProgress);
		overallProgress = clamp(overallProgress);
	}

	private static double clamp(double percent) {
		if (Double.isNaN(percent)) {
			return 0.0;
		}
		return Math.max(0.0, Math.min(100.0, percent));
	}
}
