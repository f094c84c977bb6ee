package io.evitadb.pdftranslator.llm;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Cleanup of JSON produced by a language model.
 *
 * Models occasionally wrap their JSON in `<json>` tags or markdown code fences and sometimes emit stray
 * low-range control bytes next to the text they translate. A strict JSON parser rejects unescaped control
 * characters, so this sanitizer removes exactly those (everything in U+0000..U+001F except tab, line feed
 * and carriage return) and nothing else.
 *
 * The steps run in a fixed order:
 * 1. trim
 * 2. strip a leading `<json>`
 * 3. strip a trailing `</json>`
 * 4. strip a leading ```` ```json ````, otherwise a bare leading ```` ``` ````
 * 5. strip a trailing ```` ``` ````
 * 6. drop disallowed control characters
 * 7. trim
 *
 * Trimming removes ASCII whitespace and control characters as well as Unicode spaces such as U+3000.
 *
 * The class can be used either as a plain function ({@link #clean(String)}) or as an
 * {@link OutputSanitizer} instance ({@link #INSTANCE}); both produce identical output.
 */
public final class JsonOutputSanitizer implements OutputSanitizer {

	/**
	 * Shared stateless instance used wherever an {@link OutputSanitizer} is expected.
	 */
	public static final JsonOutputSanitizer INSTANCE = new JsonOutputSanitizer();

	private static final String JSON_TAG_OPEN = "<json>";
	private static final String JSON_TAG_CLOSE = "</json>";
	private static final String FENCE_JSON = "```json";
	private static final String FENCE = "```";

	private JsonOutputSanitizer() {
		// use INSTANCE or the static clean method
	}

	@Nonnull
	@Override
	public String sanitize(@Nullable String llmOutput) {
		return clean(llmOutput);
	}

	/**
	 * Cleans raw model output so it can be handed to a strict JSON parser.
	 * Never throws; a null input yields an empty string.
	 *
	 * @param llmOutput raw model output
	 * @return cleaned text
	 */
	@Nonnull
	public static String clean(@Nullable String llmOutput) {
		final String stripped = stripWrappers(llmOutput);
		return trimWhitespace(removeControlCharacters(stripped));
	}

	/**
	 * Performs steps 1 to 5: trimming and removal of the `<json>` tags and code fences.
	 *
	 * @param llmOutput raw model output
	 * @return text without wrappers, trimmed
	 */
	@Nonnull
	static String stripWrappers(@Nullable String llmOutput) {
		if (llmOutput == null) {
			return "";
		}
		String text = trimWhitespace(llmOutput);
		if (text.startsWith(JSON_TAG_OPEN)) {
			text = text.substring(JSON_TAG_OPEN.length());
		}
		if (text.endsWith(JSON_TAG_CLOSE)) {
			text = text.substring(0, text.length() - JSON_TAG_CLOSE.length());
		}
		if (text.startsWith(FENCE_JSON)) {
			text = text.substring(FENCE_JSON.length());
		} else if (text.startsWith(FENCE)) {
			text = text.substring(FENCE.length());
		}
		if (text.endsWith(FENCE)) {
			text = text.substring(0, text.length() - FENCE.length());
		}
		return trimWhitespace(text);
	}

	/**
	 * Drops every character in U+0000..U+001F except tab, line feed and carriage return,
	 * keeping the relative order of everything else.
	 *
	 * @param text text to filter
	 * @return filtered text
	 */
	@Nonnull
	static String removeControlCharacters(@Nonnull String text) {
		StringBuilder sb = null;
		for (int i = 0; i < text.length(); i++) {
			final char c = text.charAt(i);
			if (isDisallowed(c)) {
				if (sb == null) {
					sb = new StringBuilder(text.length());
					sb.append(text, 0, i);
				}
			} else if (sb != null) {
				sb.append(c);
			}
		}
		return sb == null ? text : sb.toString();
	}

	@Nonnull
	static String trimWhitespace(@Nonnull String text) {
		int start = 0;
		int end = text.length();
		while (start < end && isTrimmable(text.charAt(start))) {
			start++;
		}
		while (end > start && isTrimmable(text.charAt(end - 1))) {
			end--;
		}
		return text.substring(start, end);
	}

	private static boolean isTrimmable(char c) {
		return c <= ' ' || Character.isWhitespace(c) || Character.isSpaceChar(c);
	}

	private static boolean isDisallowed(char c) {
		return c < 0x20 && c != '\t' && c != '\n' && c != '\r';
	}
}
