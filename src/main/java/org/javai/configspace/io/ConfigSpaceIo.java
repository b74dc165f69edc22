package org.javai.configspace.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.javai.configspace.model.ConfigurationSpace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for reading and writing configuration spaces by format id.
 *
 * <pre>
 * ConfigSpaceIo io = ConfigSpaceIo.withDefaults();
 * ConfigurationSpace space = io.read("pcs_new", Path.of("space.pcs"));
 * io.write("irace", space, Path.of("parameters.txt"));
 * </pre>
 */
public final class ConfigSpaceIo {

	private static final Logger logger = LoggerFactory.getLogger(ConfigSpaceIo.class);

	private final ConfigSpaceFormats formats;

	public ConfigSpaceIo(ConfigSpaceFormats formats) {
		this.formats = Objects.requireNonNull(formats, "formats must not be null");
	}

	/**
	 * Built-in formats configured from {@value ConfigSpaceIoConfigLoader#DEFAULT_RESOURCE}
	 * when present on the classpath.
	 */
	public static ConfigSpaceIo withDefaults() {
		ConfigSpaceIoConfig config = new ConfigSpaceIoConfigLoader().loadDefault(ConfigSpaceIo.class.getClassLoader());
		return new ConfigSpaceIo(ConfigSpaceFormats.withDefaults(config));
	}

	public ConfigSpaceFormats formats() {
		return formats;
	}

	/**
	 * Reads text in the given format. Any line terminator ({@code \n}, {@code \r\n}, {@code \r}) is accepted.
	 *
	 * @throws IllegalArgumentException if the format id is unknown
	 * @throws ConfigSpaceParseException naming the offending line
	 */
	public ConfigurationSpace read(String formatId, String text) {
		Objects.requireNonNull(text, "text must not be null");
		return formats.require(formatId).read(text.lines().collect(Collectors.toList()));
	}

	/**
	 * Reads all lines from the reader. The reader is not closed; read failures surface as
	 * {@link UncheckedIOException}.
	 */
	public ConfigurationSpace read(String formatId, Reader reader) {
		Objects.requireNonNull(reader, "reader must not be null");
		ConfigSpaceFormat format = formats.require(formatId);
		BufferedReader buffered = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
		return format.read(buffered.lines().collect(Collectors.toList()));
	}

	/**
	 * Reads a UTF-8 file.
	 */
	public ConfigurationSpace read(String formatId, Path path) {
		Objects.requireNonNull(path, "path must not be null");
		ConfigSpaceFormat format = formats.require(formatId);
		List<String> lines;
		try {
			lines = Files.readAllLines(path, StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to read " + formatId + " file " + path, e);
		}
		logger.debug("Reading {} lines of {} from {}", lines.size(), formatId, path);
		return format.read(lines);
	}

	/**
	 * Renders the space in the given format.
	 *
	 * @throws IllegalArgumentException if the format id is unknown
	 */
	public String write(String formatId, ConfigurationSpace space) {
		return formats.require(formatId).write(space);
	}

	/**
	 * Renders the space and writes it to a UTF-8 file, replacing any existing content.
	 */
	public void write(String formatId, ConfigurationSpace space, Path path) {
		Objects.requireNonNull(path, "path must not be null");
		String text = write(formatId, space);
		try {
			Files.writeString(path, text, StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to write " + formatId + " file " + path, e);
		}
		logger.debug("Wrote {} space with {} hyperparameters to {}", formatId, space.size(), path);
	}
}
