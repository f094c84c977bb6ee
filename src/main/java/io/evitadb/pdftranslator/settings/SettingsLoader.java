package io.evitadb.pdftranslator.settings;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.evitadb.pdftranslator.InvalidConfigException;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads and creates the JSON settings file.
 */
public final class SettingsLoader {

	private final ObjectMapper objectMapper;

	public SettingsLoader() {
		this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
	}

	/**
	 * Loads the settings file.
	 *
	 * @param file path of the JSON settings file
	 * @return parsed settings with defaults applied
	 * @throws InvalidConfigException if the file is not a JSON object of the expected shape
	 * @throws IOException            if the file cannot be read
	 */
	@Nonnull
	public TranslatorSettings load(@Nonnull Path file) throws InvalidConfigException, IOException {
		Objects.requireNonNull(file, "file must not be null");
		final String content = Files.readString(file, StandardCharsets.UTF_8);
		if (content.isBlank()) {
			throw new InvalidConfigException("Settings file is empty: " + file);
		}
		try {
			final TranslatorSettings settings = this.objectMapper.readValue(content, TranslatorSettings.class);
			if (settings == null) {
				throw new InvalidConfigException("Settings file does not contain a JSON object: " + file);
			}
			return settings;
		} catch (JsonProcessingException e) {
			throw new InvalidConfigException("Cannot parse settings file " + file + ": " + e.getOriginalMessage());
		}
	}

	/**
	 * Writes an example settings file with a placeholder API key, creating parent directories.
	 *
	 * @param file target path
	 * @throws FileAlreadyExistsException if the file exists; it is never overwritten
	 * @throws IOException                if the file cannot be written
	 */
	public void createExample(@Nonnull Path file) throws IOException {
		Objects.requireNonNull(file, "file must not be null");
		if (Files.exists(file)) {
			throw new FileAlreadyExistsException(file.toString(), null, "settings file already exists");
		}
		final Path parent = file.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		final String json = this.objectMapper.writeValueAsString(TranslatorSettings.example());
		Files.writeString(file, json + System.lineSeparator(), StandardCharsets.UTF_8);
	}
}
