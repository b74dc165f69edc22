package org.javai.configspace.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A named, typed tunable parameter. Sealed so that every consumer handles the same three shapes.
 * <p>
 * Variants:
 * <ul>
 *   <li>{@link Continuous} - a bounded numeric range, optionally integer valued and/or log scaled</li>
 *   <li>{@link Categorical} - an ordered set of distinct choices</li>
 *   <li>{@link Constant} - a single fixed value</li>
 * </ul>
 * Names are only checked for being non-blank and free of whitespace here; the
 * stricter identifier rules of a text dialect are applied when writing.
 */
public sealed interface Hyperparameter {

	String name();

	/**
	 * Whether the textual value lies inside this hyperparameter's domain.
	 */
	boolean isLegalValue(String value);

	<R> R accept(HyperparameterVisitor<R> visitor);

	/**
	 * A numeric range {@code [lower, upper]}.
	 *
	 * @param name the parameter name
	 * @param lower inclusive lower bound
	 * @param upper inclusive upper bound
	 * @param defaultValue default inside the bounds
	 * @param integer whether only integral values are allowed
	 * @param log whether the range is searched on a log scale
	 * @param quantization optional quantization step, {@code null} when absent
	 */
	record Continuous(
			String name,
			double lower,
			double upper,
			double defaultValue,
			boolean integer,
			boolean log,
			Double quantization
	) implements Hyperparameter {

		// Plain decimal, float or exponent notation; no type suffixes or hex literals
		private static final Pattern NUMERIC_LITERAL =
				Pattern.compile("[+-]?(?:\\d+|\\d*\\.\\d+)(?:[eE][+-]?\\d+)?");

		public Continuous {
			requireValidName(name);
			if (!Double.isFinite(lower) || !Double.isFinite(upper) || !Double.isFinite(defaultValue)) {
				throw new ValidationException("Hyperparameter '" + name + "' has a non-finite bound or default: ["
						+ lower + ", " + upper + "], default " + defaultValue);
			}
			if (lower >= upper) {
				throw new ValidationException("Hyperparameter '" + name + "': lower bound " + lower
						+ " must be smaller than upper bound " + upper);
			}
			if (defaultValue < lower || defaultValue > upper) {
				throw new ValidationException("Hyperparameter '" + name + "': default " + defaultValue
						+ " is outside [" + lower + ", " + upper + "]");
			}
			if (integer && !(isIntegral(lower) && isIntegral(upper) && isIntegral(defaultValue))) {
				throw new ValidationException("Integer hyperparameter '" + name
						+ "' requires integral bounds and default");
			}
			if (log && lower <= 0) {
				throw new ValidationException("Log-scaled hyperparameter '" + name
						+ "' requires a positive lower bound, got " + lower);
			}
			if (quantization != null && !(quantization > 0)) {
				throw new ValidationException("Hyperparameter '" + name
						+ "': quantization must be positive, got " + quantization);
			}
		}

		public static Continuous real(String name, double lower, double upper, double defaultValue) {
			return new Continuous(name, lower, upper, defaultValue, false, false, null);
		}

		public static Continuous integer(String name, long lower, long upper, long defaultValue) {
			return new Continuous(name, lower, upper, defaultValue, true, false, null);
		}

		public Continuous withLog(boolean log) {
			return new Continuous(name, lower, upper, defaultValue, integer, log, quantization);
		}

		public Continuous withQuantization(Double quantization) {
			return new Continuous(name, lower, upper, defaultValue, integer, log, quantization);
		}

		public boolean hasQuantization() {
			return quantization != null;
		}

		@Override
		public boolean isLegalValue(String value) {
			if (value == null || !NUMERIC_LITERAL.matcher(value.trim()).matches()) {
				return false;
			}
			double parsed = Double.parseDouble(value.trim());
			if (integer && !isIntegral(parsed)) {
				return false;
			}
			return parsed >= lower && parsed <= upper;
		}

		@Override
		public <R> R accept(HyperparameterVisitor<R> visitor) {
			return visitor.visitContinuous(this);
		}

		private static boolean isIntegral(double value) {
			return !Double.isInfinite(value) && value == Math.rint(value);
		}
	}

	/**
	 * An enumerated domain.
	 *
	 * @param name the parameter name
	 * @param choices ordered, distinct, non-empty choices
	 * @param defaultValue one of the choices
	 */
	record Categorical(String name, List<String> choices, String defaultValue) implements Hyperparameter {

		public Categorical {
			requireValidName(name);
			if (choices == null || choices.isEmpty()) {
				throw new ValidationException("Categorical hyperparameter '" + name + "' needs at least one choice");
			}
			choices = List.copyOf(choices);
			Set<String> seen = new HashSet<>();
			for (String choice : choices) {
				if (!seen.add(choice)) {
					throw new ValidationException("Categorical hyperparameter '" + name
							+ "' lists choice '" + choice + "' more than once");
				}
			}
			if (!choices.contains(defaultValue)) {
				throw new ValidationException("Categorical hyperparameter '" + name + "': default '"
						+ defaultValue + "' is not one of " + choices);
			}
		}

		/**
		 * Creates a categorical whose default is its first choice.
		 */
		public static Categorical of(String name, List<String> choices) {
			if (choices == null || choices.isEmpty()) {
				throw new ValidationException("Categorical hyperparameter '" + name + "' needs at least one choice");
			}
			return new Categorical(name, choices, choices.get(0));
		}

		@Override
		public boolean isLegalValue(String value) {
			return choices.contains(value);
		}

		@Override
		public <R> R accept(HyperparameterVisitor<R> visitor) {
			return visitor.visitCategorical(this);
		}
	}

	/**
	 * A hyperparameter fixed to one value.
	 */
	record Constant(String name, String value) implements Hyperparameter {

		public Constant {
			requireValidName(name);
			if (value == null || value.isEmpty()) {
				throw new ValidationException("Constant hyperparameter '" + name + "' needs a value");
			}
		}

		@Override
		public boolean isLegalValue(String candidate) {
			return value.equals(candidate);
		}

		@Override
		public <R> R accept(HyperparameterVisitor<R> visitor) {
			return visitor.visitConstant(this);
		}
	}

	private static void requireValidName(String name) {
		if (name == null || name.isBlank()) {
			throw new ValidationException("Hyperparameter name must not be blank");
		}
		for (int i = 0; i < name.length(); i++) {
			if (Character.isWhitespace(name.charAt(i))) {
				throw new ValidationException("Hyperparameter name '" + name + "' must not contain whitespace");
			}
		}
	}
}
