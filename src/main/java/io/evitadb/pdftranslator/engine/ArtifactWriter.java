package io.evitadb.pdftranslator.engine;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes translated artifacts and derives their file names.
 *
 * Names follow the convention `<stem>[.no_watermark].<lang>.<mono|dual>.<ext>`, e.g.
 * `paper.zh.mono.txt` or `paper.no_watermark.zh.dual.txt`.
 */
public final class ArtifactWriter {

	public static final String MONO = "mono";
	public static final String DUAL = "dual";

	private static final String NO_WATERMARK = "no_watermark";
	private static final String DEFAULT_EXTENSION = "txt";

	/**
	 * Writes the content to the target file in UTF-8, creating parent directories as needed and
	 * replacing an existing file.
	 *
	 * @param content    the text to write
	 * @param targetFile the file to write
	 * @return the absolute, normalized path of the written file
	 * @throws IOException if an I/O error occurs while creating directories or writing the file
	 */
	@Nonnull
	public Path write(@Nonnull String content, @Nonnull Path targetFile) throws IOException {
		Objects.requireNonNull(content, "content must not be null");
		Objects.requireNonNull(targetFile, "targetFile must not be null");

		final Path absolute = targetFile.toAbsolutePath().normalize();
		final Path parent = absolute.getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Files.writeString(absolute, content, StandardCharsets.UTF_8);
		return absolute;
	}

	/**
	 * Derives the artifact path for a source document.
	 *
	 * @param outputDirectory directory receiving the artifact
	 * @param sourceDocument  the translated document
	 * @param targetLanguage  language tag of the translation
	 * @param kind            {@link #MONO} or {@link #DUAL}
	 * @param watermarked     whether the artifact carries the watermark
	 * @return path of the artifact
	 */
	@Nonnull
	public static Path resolve(
		@Nonnull Path outputDirectory,
		@Nonnull Path sourceDocument,
		@Nonnull String targetLanguage,
		@Nonnull String kind,
		boolean watermarked
	) {
		final Path fileName = sourceDocument.getFileName();
		final String name = fileName == null ? "document" : fileName.toString();
		final int dot = name.lastIndexOf('.');
		final String stem = dot > 0 ? name.substring(0, dot) : name;
		final String extension = dot > 0 && dot < name.length() - 1 ? name.substring(dot + 1) : DEFAULT_EXTENSION;

		final StringBuilder sb = new StringBuilder(stem);
		if (!watermarked) {
			sb.append('.').append(NO_WATERMARK);
		}
		sb.append('.').append(targetLanguage).append('.').append(kind).append('.').append(extension);
		return outputDirectory.resolve(sb.toString());
	}
}
