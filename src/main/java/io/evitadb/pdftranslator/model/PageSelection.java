package io.evitadb.pdftranslator.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Parsed page selector. The syntax is a comma separated list of 1-based items:
 * a single page ("3"), a closed range ("3-5"), an open end ("3-", page 3 to the last page)
 * or an open start ("-3", first page to page 3).
 */
public final class PageSelection {

	private static final PageSelection ALL = new PageSelection(List.of(new Range(1, Integer.MAX_VALUE)));

	@Nonnull
	private final List<Range> ranges;

	private PageSelection(@Nonnull List<Range> ranges) {
		this.ranges = ranges;
	}

	/**
	 * Returns a selection containing every page.
	 *
	 * @return selection of all pages
	 */
	@Nonnull
	public static PageSelection all() {
		return ALL;
	}

	/**
	 * Parses a selector. Null or blank selects all pages.
	 *
	 * @param selector selector such as "1,2,1-,-3,3-5"
	 * @return parsed selection
	 * @throws IllegalArgumentException if the selector is malformed
	 */
	@Nonnull
	public static PageSelection parse(@Nullable String selector) {
		if (selector == null || selector.isBlank()) {
			return ALL;
		}
		final List<Range> ranges = new ArrayList<>();
		for (final String rawItem : selector.split(",")) {
			final String item = rawItem.trim();
			if (item.isEmpty()) {
				throw new IllegalArgumentException("empty item in page selection");
			}
			final int dash = item.indexOf('-');
			if (dash < 0) {
				final int page = parsePage(item);
				ranges.add(new Range(page, page));
			} else if (dash == 0) {
				ranges.add(new Range(1, parsePage(item.substring(1))));
			} else if (dash == item.length() - 1) {
				ranges.add(new Range(parsePage(item.substring(0, dash)), Integer.MAX_VALUE));
			} else {
				final int from = parsePage(item.substring(0, dash));
				final int to = parsePage(item.substring(dash + 1));
				if (from > to) {
					throw new IllegalArgumentException("range start " + from + " is after its end " + to);
				}
				ranges.add(new Range(from, to));
			}
		}
		return new PageSelection(Collections.unmodifiableList(ranges));
	}

	/**
	 * Checks whether the 1-based page number is selected.
	 *
	 * @param pageNumber 1-based page number
	 * @return true if selected
	 */
	public boolean contains(int pageNumber) {
		for (final Range range : this.ranges) {
			if (pageNumber >= range.from() && pageNumber <= range.to()) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Returns the selected 0-based page indexes of a document with the given page count, in document order.
	 *
	 * @param pageCount number of pages of the document
	 * @return ascending list of selected indexes
	 */
	@Nonnull
	public List<Integer> select(int pageCount) {
		final List<Integer> selected = new ArrayList<>();
		for (int i = 0; i < pageCount; i++) {
			if (contains(i + 1)) {
				selected.add(i);
			}
		}
		return selected;
	}

	private static int parsePage(@Nonnull String value) {
		final int page;
		try {
			page = Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("not a page number: '" + value + "'", e);
		}
		if (page < 1) {
			throw new IllegalArgumentException("page numbers start at 1, got " + page);
		}
		return page;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof PageSelection)) {
			return false;
		}
		return this.ranges.equals(((PageSelection) o).ranges);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.ranges);
	}

	@Override
	public String toString() {
		return "PageSelection" + this.ranges;
	}

	private record Range(int from, int to) {
	}
}
