package io.evitadb.pdftranslator.engine;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Plain-text document split into pages and paragraphs. Pages are separated by form feeds,
 * paragraphs by one or more blank lines.
 */
public final class TextDocument {

	public static final char PAGE_SEPARATOR = '\f';

	private static final Pattern PARAGRAPH_SEPARATOR = Pattern.compile("\\n[ \\t]*\\n\\s*");

	@Nonnull
	private final List<List<String>> pages;

	private TextDocument(@Nonnull List<List<String>> pages) {
		this.pages = pages;
	}

	/**
	 * Parses document content. Line endings are normalized to `\n`.
	 *
	 * @param content the document text
	 * @return parsed document, with at least one (possibly empty) page
	 */
	@Nonnull
	public static TextDocument parse(@Nonnull String content) {
		Objects.requireNonNull(content, "content must not be null");

		final String normalized = content.replace("\r\n", "\n").replace('\r', '\n');
		final String[] rawPages = normalized.split(Pattern.quote(String.valueOf(PAGE_SEPARATOR)), -1);
		final List<List<String>> pages = new ArrayList<>(rawPages.length);
		for (final String rawPage : rawPages) {
			final List<String> paragraphs = new ArrayList<>();
			for (final String paragraph : PARAGRAPH_SEPARATOR.split(rawPage.strip())) {
				if (!paragraph.isBlank()) {
					paragraphs.add(paragraph.stripTrailing());
				}
			}
			pages.add(Collections.unmodifiableList(paragraphs));
		}
		return new TextDocument(Collections.unmodifiableList(pages));
	}

	/**
	 * Returns the number of pages.
	 *
	 * @return page count
	 */
	public int getPageCount() {
		return this.pages.size();
	}

	/**
	 * Returns the paragraphs of a page.
	 *
	 * @param pageIndex 0-based page index
	 * @return paragraphs in document order
	 */
	@Nonnull
	public List<String> getParagraphs(int pageIndex) {
		return this.pages.get(pageIndex);
	}
}
