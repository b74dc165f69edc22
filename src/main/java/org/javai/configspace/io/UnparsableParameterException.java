package org.javai.configspace.io;

/**
 * A line classified as a parameter declaration matched none of the dialect's parameter shapes.
 */
public class UnparsableParameterException extends ConfigSpaceParseException {

	public UnparsableParameterException(int lineNumber, String line) {
		super(lineNumber, line, "Could not parse parameter declaration");
	}
}
