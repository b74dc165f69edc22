package org.javai.configspace.io.parse;

import java.util.Optional;

/**
 * Boolean connective joining two condition facts on one line.
 */
public enum Connective {

	AND("&&"),
	OR("||");

	private final String symbol;

	Connective(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}

	public static Optional<Connective> fromSymbol(String symbol) {
		for (Connective connective : values()) {
			if (connective.symbol.equals(symbol)) {
				return Optional.of(connective);
			}
		}
		return Optional.empty();
	}
}
