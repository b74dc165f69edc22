package org.javai.configspace.io;

/**
 * A forbidden-clause literal is structurally broken (missing name or value, stray tokens).
 */
public class UnparsableForbiddenClauseException extends ConfigSpaceParseException {

	public UnparsableForbiddenClauseException(int lineNumber, String line, String detail) {
		super(lineNumber, line, "Could not parse forbidden clause (" + detail + ")");
	}
}
