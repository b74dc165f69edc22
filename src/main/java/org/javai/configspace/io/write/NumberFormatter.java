package org.javai.configspace.io.write;

import java.math.BigDecimal;

/**
 * Formats bounds and defaults the way the configuration tools print them.
 */
public final class NumberFormatter {

	private static final BigDecimal PLAIN_LOWER = new BigDecimal("1e-4");
	private static final BigDecimal PLAIN_UPPER = new BigDecimal("1e16");

	private NumberFormatter() {
		// Utility class - no instantiation
	}

	/**
	 * Integral value without a fractional part, e.g. {@code 10}. Exact beyond the {@code long} range.
	 */
	public static String formatInteger(double value) {
		requireFinite(value);
		return new BigDecimal(value).toBigInteger().toString();
	}

	/**
	 * Shortest text that reads back to the same double. Magnitudes in {@code [1e-4, 1e16)}
	 * are printed plainly with at least one fractional digit ({@code 10.0}, {@code 0.001});
	 * others in exponent form ({@code 1e-05}, {@code 2.5e+20}).
	 */
	public static String formatReal(double value) {
		requireFinite(value);
		if (value == 0.0) {
			return "0.0";
		}
		BigDecimal decimal = new BigDecimal(Double.toString(value)).stripTrailingZeros();
		BigDecimal magnitude = decimal.abs();
		if (magnitude.compareTo(PLAIN_LOWER) >= 0 && magnitude.compareTo(PLAIN_UPPER) < 0) {
			String plain = decimal.toPlainString();
			return plain.indexOf('.') >= 0 ? plain : plain + ".0";
		}
		int exponent = decimal.precision() - decimal.scale() - 1;
		String mantissa = decimal.movePointLeft(exponent).toPlainString();
		return mantissa + "e" + (exponent < 0 ? "-" : "+") + String.format("%02d", Math.abs(exponent));
	}

	private static void requireFinite(double value) {
		if (!Double.isFinite(value)) {
			throw new IllegalArgumentException("Cannot format non-finite value " + value);
		}
	}
}
