package io.evitadb.pdftranslator.llm;

import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Wires the corrected {@link OutputSanitizer} into an engine at startup.
 *
 * Installation is best-effort: engines that do not expose a sanitizer injection point keep their native
 * sanitization and only a warning is logged. This class never throws.
 */
public final class SanitizerInstaller {

	private SanitizerInstaller() {
		// Utility class - prevent instantiation
	}

	/**
	 * Installs the sanitizer into the engine if the engine supports it.
	 *
	 * @param engine    the engine to configure
	 * @param sanitizer the sanitizer to install
	 * @param log       log for the outcome
	 * @return true when the sanitizer is active on the engine after the call
	 */
	public static boolean install(
		@Nonnull Object engine,
		@Nonnull OutputSanitizer sanitizer,
		@Nonnull Log log
	) {
		Objects.requireNonNull(sanitizer, "sanitizer must not be null");
		Objects.requireNonNull(log, "log must not be null");

		if (!(engine instanceof SanitizerAware)) {
			log.warn("Engine " + (engine == null ? "<none>" : engine.getClass().getName()) +
				" does not accept a custom output sanitizer, native sanitization stays in place");
			return false;
		}

		final SanitizerAware target = (SanitizerAware) engine;
		try {
			if (target.getSanitizer() == sanitizer) {
				log.debug("Output sanitizer already installed");
				return true;
			}
			target.installSanitizer(sanitizer);
			log.info("Installed output sanitizer " + sanitizer.getClass().getSimpleName());
			return true;
		} catch (RuntimeException e) {
			log.warn("Failed to install output sanitizer, native sanitization stays in place: " + e.getMessage(), e);
			return false;
		}
	}
}
