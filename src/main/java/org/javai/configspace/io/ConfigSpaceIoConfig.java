package org.javai.configspace.io;

/**
 * Settings shared by all text dialects.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Use defaults
 * ConfigSpaceIoConfig config = ConfigSpaceIoConfig.defaults();
 *
 * // Custom configuration
 * ConfigSpaceIoConfig config = ConfigSpaceIoConfig.builder()
 *         .lineSeparator("\r\n")
 *         .build();
 * }</pre>
 *
 * @param commentMarker text that starts a comment running to the end of the line
 * @param quoteCharacters characters removed anywhere in a line before parsing
 * @param lineSeparator separator between lines of written text
 */
public record ConfigSpaceIoConfig(
		String commentMarker,
		String quoteCharacters,
		String lineSeparator
) {

	public static final String DEFAULT_COMMENT_MARKER = "#";

	public static final String DEFAULT_QUOTE_CHARACTERS = "\"'";

	public static final String DEFAULT_LINE_SEPARATOR = "\n";

	public ConfigSpaceIoConfig {
		if (commentMarker == null || commentMarker.isEmpty()) {
			throw new IllegalArgumentException("commentMarker must not be empty");
		}
		if (quoteCharacters == null) {
			throw new IllegalArgumentException("quoteCharacters must not be null");
		}
		if (lineSeparator == null || lineSeparator.isEmpty()) {
			throw new IllegalArgumentException("lineSeparator must not be empty");
		}
	}

	/**
	 * Creates a configuration with default values.
	 *
	 * @return default configuration
	 */
	public static ConfigSpaceIoConfig defaults() {
		return new ConfigSpaceIoConfig(DEFAULT_COMMENT_MARKER, DEFAULT_QUOTE_CHARACTERS, DEFAULT_LINE_SEPARATOR);
	}

	/**
	 * Creates a new builder for custom configuration.
	 *
	 * @return a new builder
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link ConfigSpaceIoConfig}.
	 */
	public static class Builder {
		private String commentMarker = DEFAULT_COMMENT_MARKER;
		private String quoteCharacters = DEFAULT_QUOTE_CHARACTERS;
		private String lineSeparator = DEFAULT_LINE_SEPARATOR;

		private Builder() {
		}

		public Builder commentMarker(String commentMarker) {
			this.commentMarker = commentMarker;
			return this;
		}

		public Builder quoteCharacters(String quoteCharacters) {
			this.quoteCharacters = quoteCharacters;
			return this;
		}

		public Builder lineSeparator(String lineSeparator) {
			this.lineSeparator = lineSeparator;
			return this;
		}

		public ConfigSpaceIoConfig build() {
			return new ConfigSpaceIoConfig(commentMarker, quoteCharacters, lineSeparator);
		}
	}
}
