package org.javai.configspace.io;

import org.javai.configspace.ConfigSpaceException;

/**
 * Exception thrown when a text description of a configuration space cannot be read.
 * Carries the 1-based number and the preprocessed text of the offending line.
 */
public class ConfigSpaceParseException extends ConfigSpaceException {

	private final int lineNumber;
	private final String line;

	public ConfigSpaceParseException(int lineNumber, String line, String message) {
		super(format(lineNumber, line, message));
		this.lineNumber = lineNumber;
		this.line = line;
	}

	public ConfigSpaceParseException(int lineNumber, String line, String message, Throwable cause) {
		super(format(lineNumber, line, message), cause);
		this.lineNumber = lineNumber;
		this.line = line;
	}

	public int lineNumber() {
		return lineNumber;
	}

	public String line() {
		return line;
	}

	private static String format(int lineNumber, String line, String message) {
		return "Line " + lineNumber + ": " + message + ": " + line;
	}
}
