package org.javai.configspace.io.write;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable text made of sections of lines. Sections are separated by one blank line;
 * empty sections are dropped. The text is joined once, in {@link #render(String)}.
 */
public final class TextDocument {

	private final List<List<String>> sections;

	private TextDocument(List<List<String>> sections) {
		this.sections = sections;
	}

	public static Builder builder() {
		return new Builder();
	}

	public List<List<String>> sections() {
		return sections;
	}

	/**
	 * Joins all sections; every line, including the last, ends with the separator.
	 */
	public String render(String lineSeparator) {
		StringBuilder sb = new StringBuilder();
		for (List<String> section : sections) {
			if (sb.length() > 0) {
				sb.append(lineSeparator);
			}
			for (String line : section) {
				sb.append(line).append(lineSeparator);
			}
		}
		return sb.toString();
	}

	/**
	 * Builder for {@link TextDocument}.
	 */
	public static class Builder {
		private final List<List<String>> sections = new ArrayList<>();

		private Builder() {
		}

		public Builder section(List<String> lines) {
			if (lines != null && !lines.isEmpty()) {
				sections.add(List.copyOf(lines));
			}
			return this;
		}

		public TextDocument build() {
			return new TextDocument(List.copyOf(sections));
		}
	}
}
