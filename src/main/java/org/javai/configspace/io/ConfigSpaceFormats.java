package org.javai.configspace.io;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.configspace.io.irace.IraceFormat;
import org.javai.configspace.io.pcs.PcsFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of text formats, looked up by format id.
 * <p>
 * Registrations are idempotent per id: the first format registered under an id wins.
 * The registry is not synchronized; populate it at start-up and share it read-only.
 */
public final class ConfigSpaceFormats {

	private static final Logger logger = LoggerFactory.getLogger(ConfigSpaceFormats.class);

	private final Map<String, ConfigSpaceFormat> formats = new LinkedHashMap<>();

	private ConfigSpaceFormats() {
	}

	/**
	 * Create an empty registry.
	 */
	public static ConfigSpaceFormats create() {
		return new ConfigSpaceFormats();
	}

	/**
	 * Create a registry holding the built-in {@code irace} and {@code pcs_new} formats.
	 */
	public static ConfigSpaceFormats withDefaults(ConfigSpaceIoConfig config) {
		Objects.requireNonNull(config, "config must not be null");
		return create()
				.register(new IraceFormat(config))
				.register(new PcsFormat(config));
	}

	/**
	 * Register a format. If a format with the same id is already present, the existing one is kept.
	 */
	public ConfigSpaceFormats register(ConfigSpaceFormat format) {
		Objects.requireNonNull(format, "format must not be null");
		String id = format.id();
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("Format is missing an id");
		}
		if (formats.containsKey(id)) {
			logger.debug("Format with id '{}' already registered; skipping", id);
			return this;
		}
		formats.put(id, format);
		return this;
	}

	/**
	 * Retrieve a format by id.
	 */
	public Optional<ConfigSpaceFormat> formatFor(String id) {
		return Optional.ofNullable(formats.get(id));
	}

	/**
	 * Retrieve a format by id or throw if not present.
	 *
	 * @throws IllegalArgumentException if no format is registered under the id
	 */
	public ConfigSpaceFormat require(String id) {
		return formatFor(id).orElseThrow(() -> new IllegalArgumentException(
				"No format registered for id '" + id + "'; known formats: " + formats.keySet()));
	}

	/**
	 * All registered formats in insertion order.
	 */
	public List<ConfigSpaceFormat> formats() {
		return List.copyOf(formats.values());
	}
}
