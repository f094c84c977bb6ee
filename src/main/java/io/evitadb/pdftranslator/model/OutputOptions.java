package io.evitadb.pdftranslator.model;

import io.evitadb.pdftranslator.InvalidConfigException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Controls which artifacts a run produces and which part of the document is translated.
 *
 * @param noDual               skip the dual-language artifact
 * @param noMono               skip the mono (translation only) artifact
 * @param watermarkMode        which watermark variants to produce
 * @param pages                page selector such as "1,2,1-,-3,3-5", null for the whole document
 * @param maxPagesPerPart      translate in parts of at most this many pages, null for no batching
 * @param enhanceCompatibility enables compatibility enhancements of the output
 */
public record OutputOptions(
	boolean noDual,
	boolean noMono,
	@Nonnull WatermarkMode watermarkMode,
	@Nullable String pages,
	@Nullable Integer maxPagesPerPart,
	boolean enhanceCompatibility
) {

	public OutputOptions {
		Objects.requireNonNull(watermarkMode, "watermarkMode must not be null");
	}

	/**
	 * Returns options with all defaults applied: both outputs, watermarked, whole document,
	 * no batching and no compatibility enhancements.
	 *
	 * @return default options
	 */
	@Nonnull
	public static OutputOptions defaults() {
		return new OutputOptions(false, false, WatermarkMode.WATERMARKED, null, null, false);
	}

	/**
	 * Validates the option combination.
	 *
	 * @throws InvalidConfigException if no output is requested, the page selector is malformed
	 *                                or the part size is not positive
	 */
	public void validate() throws InvalidConfigException {
		if (this.noDual && this.noMono) {
			throw new InvalidConfigException("At least one of the dual and mono outputs must be enabled");
		}
		if (this.maxPagesPerPart != null && this.maxPagesPerPart < 1) {
			throw new InvalidConfigException("max_pages_per_part must be positive, got " + this.maxPagesPerPart);
		}
		if (this.pages != null && !this.pages.isBlank()) {
			try {
				PageSelection.parse(this.pages);
			} catch (IllegalArgumentException e) {
				throw new InvalidConfigException("Invalid page selection '" + this.pages + "': " + e.getMessage());
			}
		}
	}
}
