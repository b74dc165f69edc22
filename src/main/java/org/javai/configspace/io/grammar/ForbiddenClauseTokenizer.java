package org.javai.configspace.io.grammar;

import java.util.ArrayList;
import java.util.List;
import org.javai.configspace.io.UnparsableForbiddenClauseException;

/**
 * Splits a forbidden-clause literal such as {@code {a=1, b = x}} into a flat token stream.
 * <p>
 * Words are runs of identifier characters. A word stops in front of {@code =}, {@code !=},
 * {@code <=} and {@code >=} so that {@code a!=1} yields {@code a}, {@code !=}, {@code 1}.
 */
public class ForbiddenClauseTokenizer {

	private final String input;
	private final int lineNumber;
	private int pos = 0;

	public ForbiddenClauseTokenizer(String input, int lineNumber) {
		this.input = input != null ? input : "";
		this.lineNumber = lineNumber;
	}

	/**
	 * Tokenizes the entire literal.
	 *
	 * @return list of tokens (includes EOF token at end)
	 * @throws UnparsableForbiddenClauseException if a character cannot start any token
	 */
	public List<ClauseToken> tokenize() {
		List<ClauseToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			skipWhitespace();
			if (isAtEnd()) break;

			tokens.add(nextToken());
		}

		tokens.add(new ClauseToken(ClauseToken.TokenType.EOF, "", pos));
		return tokens;
	}

	private ClauseToken nextToken() {
		int start = pos;
		char c = peek();

		return switch (c) {
			case '{' -> {
				advance();
				yield new ClauseToken(ClauseToken.TokenType.LBRACE, "{", start);
			}
			case '}' -> {
				advance();
				yield new ClauseToken(ClauseToken.TokenType.RBRACE, "}", start);
			}
			case ',' -> {
				advance();
				yield new ClauseToken(ClauseToken.TokenType.COMMA, ",", start);
			}
			case '=' -> {
				advance();
				if (peek() == '=') {
					advance();
					yield new ClauseToken(ClauseToken.TokenType.OPERATOR, "==", start);
				}
				yield new ClauseToken(ClauseToken.TokenType.OPERATOR, "=", start);
			}
			default -> {
				if (operatorLengthAt(pos) == 2) {
					advance();
					advance();
					yield new ClauseToken(ClauseToken.TokenType.OPERATOR, input.substring(start, pos), start);
				} else if (isNameChar(c)) {
					yield scanWord();
				} else {
					throw new UnparsableForbiddenClauseException(lineNumber, input,
							"unexpected character '" + c + "' at position " + pos);
				}
			}
		};
	}

	private ClauseToken scanWord() {
		int start = pos;

		while (!isAtEnd() && isNameChar(peek()) && operatorLengthAt(pos) == 0) {
			advance();
		}

		return new ClauseToken(ClauseToken.TokenType.WORD, input.substring(start, pos), start);
	}

	/**
	 * Length of the comparison operator starting at {@code index}, or 0 if none does.
	 */
	private int operatorLengthAt(int index) {
		if (index >= input.length()) {
			return 0;
		}
		char c = input.charAt(index);
		if (c == '=') {
			return 1;
		}
		if ((c == '!' || c == '<' || c == '>') && index + 1 < input.length() && input.charAt(index + 1) == '=') {
			return 2;
		}
		return 0;
	}

	private void skipWhitespace() {
		while (!isAtEnd() && Character.isWhitespace(peek())) {
			advance();
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char advance() {
		return input.charAt(pos++);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isNameChar(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
				|| "_-@.:;\\/?!$%&*+<>".indexOf(c) >= 0;
	}
}
