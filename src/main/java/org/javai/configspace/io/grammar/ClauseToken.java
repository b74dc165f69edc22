package org.javai.configspace.io.grammar;

/**
 * Represents a token of a forbidden-clause literal.
 *
 * @param type the token type
 * @param value the token text
 * @param position the character position in the literal
 */
public record ClauseToken(TokenType type, String value, int position) {

	public enum TokenType {
		WORD,          // names and values
		OPERATOR,      // = == != <= >=
		LBRACE,        // {
		RBRACE,        // }
		COMMA,         // ,
		EOF            // end of input
	}

	@Override
	public String toString() {
		return switch (type) {
			case WORD, OPERATOR -> type + "(" + value + ")";
			default -> type.toString();
		};
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}
}
