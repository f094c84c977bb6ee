package io.evitadb.pdftranslator.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Locale;

/**
 * Controls which watermark variants of the translated artifacts are produced.
 */
public enum WatermarkMode {

	/** Only watermarked artifacts. */
	WATERMARKED("watermarked"),
	/** Only artifacts without a watermark. */
	NO_WATERMARK("no_watermark"),
	/** Both variants. */
	BOTH("both");

	@Nonnull
	private final String code;

	WatermarkMode(@Nonnull String code) {
		this.code = code;
	}

	/**
	 * Returns the configuration value of this mode.
	 *
	 * @return code such as "no_watermark"
	 */
	@Nonnull
	public String getCode() {
		return this.code;
	}

	/**
	 * Whether watermarked artifacts are produced.
	 *
	 * @return true for {@link #WATERMARKED} and {@link #BOTH}
	 */
	public boolean producesWatermarked() {
		return this != NO_WATERMARK;
	}

	/**
	 * Whether artifacts without a watermark are produced.
	 *
	 * @return true for {@link #NO_WATERMARK} and {@link #BOTH}
	 */
	public boolean producesUnwatermarked() {
		return this != WATERMARKED;
	}

	/**
	 * Parses a configuration value. Null or blank yields {@link #WATERMARKED}.
	 *
	 * @param code value such as "watermarked", "no_watermark" or "both"
	 * @return parsed mode
	 * @throws IllegalArgumentException for unknown values
	 */
	@Nonnull
	public static WatermarkMode fromCode(@Nullable String code) {
		if (code == null || code.isBlank()) {
			return WATERMARKED;
		}
		final String normalized = code.trim().toLowerCase(Locale.ROOT).replace('-', '_');
		for (final WatermarkMode mode : values()) {
			if (mode.code.equals(normalized)) {
				return mode;
			}
		}
		throw new IllegalArgumentException(
			"Unknown watermark mode: " + code + ". Supported modes: watermarked, no_watermark, both"
		);
	}
}
