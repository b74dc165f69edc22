package org.javai.configspace.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads {@link ConfigSpaceIoConfig} from YAML. Missing keys keep their defaults.
 *
 * <pre>
 * comment_marker: "#"
 * quote_characters: "\"'"
 * line_separator: "\n"
 * </pre>
 */
public class ConfigSpaceIoConfigLoader {

	public static final String DEFAULT_RESOURCE = "META-INF/configspace-io.yml";

	private final Yaml yaml = new Yaml();

	/**
	 * Load from a path.
	 */
	public ConfigSpaceIoConfig load(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return load(reader);
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalArgumentException("Failed to load configuration from path: " + path, e);
		}
	}

	/**
	 * Load from an input stream.
	 */
	public ConfigSpaceIoConfig load(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalArgumentException("Failed to load configuration from input stream", e);
		}
	}

	/**
	 * Load from a reader.
	 */
	public ConfigSpaceIoConfig load(Reader reader) {
		try {
			return build(yaml.load(reader));
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalArgumentException("Failed to load configuration from reader", e);
		}
	}

	/**
	 * Load from a YAML string.
	 */
	public ConfigSpaceIoConfig loadString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalArgumentException("Failed to load configuration from string", e);
		}
	}

	/**
	 * Load {@value #DEFAULT_RESOURCE} from the class loader, falling back to
	 * {@link ConfigSpaceIoConfig#defaults()} when the resource is absent.
	 */
	public ConfigSpaceIoConfig loadDefault(ClassLoader loader) {
		InputStream stream = loader.getResourceAsStream(DEFAULT_RESOURCE);
		if (stream == null) {
			return ConfigSpaceIoConfig.defaults();
		}
		try (stream) {
			return load(stream);
		} catch (IOException e) {
			throw new IllegalArgumentException("Failed to close configuration resource " + DEFAULT_RESOURCE, e);
		}
	}

	private ConfigSpaceIoConfig build(Object data) {
		if (data == null) {
			return ConfigSpaceIoConfig.defaults();
		}
		if (!(data instanceof Map<?, ?> map)) {
			throw new IllegalArgumentException("Configuration must be a YAML mapping, got: " + data.getClass().getSimpleName());
		}
		ConfigSpaceIoConfig.Builder builder = ConfigSpaceIoConfig.builder();
		String commentMarker = stringValue(map, "comment_marker");
		if (commentMarker != null) {
			builder.commentMarker(commentMarker);
		}
		String quoteCharacters = stringValue(map, "quote_characters");
		if (quoteCharacters != null) {
			builder.quoteCharacters(quoteCharacters);
		}
		String lineSeparator = stringValue(map, "line_separator");
		if (lineSeparator != null) {
			builder.lineSeparator(lineSeparator);
		}
		return builder.build();
	}

	private String stringValue(Map<?, ?> map, String key) {
		Object value = map.get(key);
		return value == null ? null : String.valueOf(value);
	}
}
