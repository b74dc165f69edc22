package org.javai.configspace.io;

/**
 * A forbidden-clause literal uses an operator other than {@code =}.
 */
public class UnsupportedForbiddenOperatorException extends ConfigSpaceParseException {

	private final String operator;

	public UnsupportedForbiddenOperatorException(int lineNumber, String line, String operator) {
		super(lineNumber, line, "Forbidden clauses only support '=', found '" + operator + "'");
		this.operator = operator;
	}

	public String operator() {
		return operator;
	}
}
