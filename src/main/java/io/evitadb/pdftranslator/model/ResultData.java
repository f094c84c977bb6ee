package io.evitadb.pdftranslator.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Immutable outcome of a completed translation run. Every artifact path is optional; an artifact that
 * was not produced is reported as null, never fabricated.
 *
 * @param originalPdfPath           the translated source document
 * @param monoPdfPath               watermarked translation-only artifact
 * @param dualPdfPath               watermarked dual-language artifact
 * @param noWatermarkMonoPdfPath    translation-only artifact without watermark
 * @param noWatermarkDualPdfPath    dual-language artifact without watermark
 * @param autoExtractedGlossaryPath glossary extracted during translation
 * @param totalSeconds              elapsed wall-clock seconds
 * @param peakMemoryUsage           peak memory usage in MiB
 */
public record ResultData(
	@Nullable Path originalPdfPath,
	@Nullable Path monoPdfPath,
	@Nullable Path dualPdfPath,
	@Nullable Path noWatermarkMonoPdfPath,
	@Nullable Path noWatermarkDualPdfPath,
	@Nullable Path autoExtractedGlossaryPath,
	double totalSeconds,
	double peakMemoryUsage
) {

	/**
	 * Returns all produced artifacts in a fixed order (mono, dual, their unwatermarked variants, glossary).
	 *
	 * @return list of present artifact paths
	 */
	@Nonnull
	public List<Path> artifacts() {
		final List<Path> artifacts = new ArrayList<>(5);
		for (final Path path : new Path[]{
			this.monoPdfPath, this.dualPdfPath, this.noWatermarkMonoPdfPath,
			this.noWatermarkDualPdfPath, this.autoExtractedGlossaryPath
		}) {
			if (path != null) {
				artifacts.add(path);
			}
		}
		return artifacts;
	}

	@Override
	public String toString() {
		return "ResultData:\n" +
			"  Original: " + this.originalPdfPath + "\n" +
			"  Mono: " + this.monoPdfPath + "\n" +
			"  Dual: " + this.dualPdfPath + "\n" +
			String.format(Locale.ROOT, "  Time: %.2fs%n  Memory: %.2f", this.totalSeconds, this.peakMemoryUsage);
	}
}
