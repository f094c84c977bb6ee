package io.evitadb.pdftranslator.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import io.evitadb.pdftranslator.ResultSchemaException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.URI;
import java.nio.file.Path;

/**
 * Decodes the payload of a finish event into {@link ResultData}.
 *
 * Accepted shapes are a {@link ResultData} instance, a `Map` or JSON object with snake_case keys, and any
 * structured object whose bean properties carry the same names in camelCase. Schema:
 *
 * | field                          | type   | default |
 * |--------------------------------|--------|---------|
 * | `original_pdf_path`            | string | unset   |
 * | `mono_pdf_path`                | string | unset   |
 * | `dual_pdf_path`                | string | unset   |
 * | `no_watermark_mono_pdf_path`   | string | unset   |
 * | `no_watermark_dual_pdf_path`   | string | unset   |
 * | `auto_extracted_glossary_path` | string | unset   |
 * | `total_seconds`                | number | 0       |
 * | `peak_memory_usage`            | number | 0       |
 *
 * `Path` properties of structured payloads are read as written, a relative path stays relative.
 *
 * All fields are optional and unknown fields are ignored, but a payload that is not an object or a field of
 * the wrong type is rejected with {@link ResultSchemaException}.
 */
public final class ResultDataDecoder {

	public static final String ORIGINAL_PDF_PATH = "original_pdf_path";
	public static final String MONO_PDF_PATH = "mono_pdf_path";
	public static final String DUAL_PDF_PATH = "dual_pdf_path";
	public static final String NO_WATERMARK_MONO_PDF_PATH = "no_watermark_mono_pdf_path";
	public static final String NO_WATERMARK_DUAL_PDF_PATH = "no_watermark_dual_pdf_path";
	public static final String AUTO_EXTRACTED_GLOSSARY_PATH = "auto_extracted_glossary_path";
	public static final String TOTAL_SECONDS = "total_seconds";
	public static final String PEAK_MEMORY_USAGE = "peak_memory_usage";

	@Nonnull
	private final ObjectMapper objectMapper;

	public ResultDataDecoder() {
		this.objectMapper = new ObjectMapper()
			.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
			.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
			.registerModule(new SimpleModule("result-paths").addSerializer(Path.class, ToStringSerializer.instance));
	}

	/**
	 * Decodes the payload.
	 *
	 * @param payload the terminal payload reported by the engine
	 * @return decoded result
	 * @throws ResultSchemaException if the payload does not follow the schema
	 */
	@Nonnull
	public ResultData decode(@Nullable Object payload) throws ResultSchemaException {
		if (payload instanceof ResultData) {
			return (ResultData) payload;
		}
		if (payload == null) {
			throw new ResultSchemaException("Finish event carries no result payload");
		}

		final JsonNode tree;
		try {
			tree = payload instanceof JsonNode ? (JsonNode) payload : this.objectMapper.valueToTree(payload);
		} catch (IllegalArgumentException e) {
			throw new ResultSchemaException(
				"Result payload of type " + payload.getClass().getName() + " cannot be read: " + e.getMessage(), e
			);
		}
		if (tree == null || !tree.isObject()) {
			throw new ResultSchemaException(
				"Result payload must be an object, got " + (tree == null ? "nothing" : tree.getNodeType()) +
					" from " + payload.getClass().getName()
			);
		}

		return new ResultData(
			readPath(tree, ORIGINAL_PDF_PATH),
			readPath(tree, MONO_PDF_PATH),
			readPath(tree, DUAL_PDF_PATH),
			readPath(tree, NO_WATERMARK_MONO_PDF_PATH),
			readPath(tree, NO_WATERMARK_DUAL_PDF_PATH),
			readPath(tree, AUTO_EXTRACTED_GLOSSARY_PATH),
			readNumber(tree, TOTAL_SECONDS),
			readNumber(tree, PEAK_MEMORY_USAGE)
		);
	}

	@Nullable
	private static Path readPath(@Nonnull JsonNode tree, @Nonnull String field) throws ResultSchemaException {
		final JsonNode node = tree.get(field);
		if (node == null || node.isNull()) {
			return null;
		}
		if (!node.isTextual()) {
			throw new ResultSchemaException(
				"Result field '" + field + "' must be a string, got " + node.getNodeType()
			);
		}
		final String value = node.textValue();
		if (value.isBlank()) {
			return null;
		}
		try {
			// file URIs come from payloads serialized elsewhere
			return value.startsWith("file:") ? Path.of(URI.create(value)) : Path.of(value);
		} catch (RuntimeException e) {
			throw new ResultSchemaException("Result field '" + field + "' is not a valid path: " + value, e);
		}
	}

	private static double readNumber(@Nonnull JsonNode tree, @Nonnull String field) throws ResultSchemaException {
		final JsonNode node = tree.get(field);
		if (node == null || node.isNull()) {
			return 0.0;
		}
		if (!node.isNumber()) {
			throw new ResultSchemaException(
				"Result field '" + field + "' must be a number, got " + node.getNodeType()
			);
		}
		return node.doubleValue();
	}
}
