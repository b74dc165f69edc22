package org.javai.configspace.io;

/**
 * A line containing the condition separator does not match the dialect's condition grammar.
 */
public class UnparsableConditionException extends ConfigSpaceParseException {

	public UnparsableConditionException(int lineNumber, String line) {
		super(lineNumber, line, "Could not parse condition");
	}
}
