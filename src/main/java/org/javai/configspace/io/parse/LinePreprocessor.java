package org.javai.configspace.io.parse;

import org.javai.configspace.io.ConfigSpaceIoConfig;

/**
 * Normalises one physical line before classification: cuts the comment, removes quote
 * characters anywhere in the line and trims surrounding whitespace.
 */
public class LinePreprocessor {

	private final String commentMarker;
	private final String quoteCharacters;

	public LinePreprocessor(ConfigSpaceIoConfig config) {
		this.commentMarker = config.commentMarker();
		this.quoteCharacters = config.quoteCharacters();
	}

	/**
	 * @return the normalised line, empty if nothing but whitespace or a comment remains
	 */
	public String preprocess(String rawLine) {
		if (rawLine == null) {
			return "";
		}
		String line = rawLine;
		int comment = line.indexOf(commentMarker);
		if (comment >= 0) {
			line = line.substring(0, comment);
		}
		StringBuilder sb = new StringBuilder(line.length());
		for (int i = 0; i < line.length(); i++) {
			char c = line.charAt(i);
			if (quoteCharacters.indexOf(c) < 0) {
				sb.append(c);
			}
		}
		return sb.toString().strip();
	}
}
