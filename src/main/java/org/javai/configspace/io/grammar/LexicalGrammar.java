package org.javai.configspace.io.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Token patterns shared by both text dialects.
 * <p>
 * The constants are non-capturing regular expression fragments, so line grammars can
 * compose them freely and wrap the parts they need in their own capture groups.
 */
public final class LexicalGrammar {

	/**
	 * Characters allowed in an identifier: ASCII alphanumerics plus {@code _-@.:;\/?!$%&*+<>}.
	 */
	public static final String NAME_CHAR = "[A-Za-z0-9_\\-@.:;\\\\/?!$%&*+<>]";

	public static final String NAME = NAME_CHAR + "+";

	public static final String INTEGER = "[+-]?\\d+";

	public static final String FLOAT = "[+-]?\\d*\\.\\d+";

	public static final String EXPONENTIAL = "(?:" + FLOAT + "|" + INTEGER + ")[eE][+-]?\\d+";

	public static final String NUMBER = "(?:" + EXPONENTIAL + "|" + FLOAT + "|" + INTEGER + ")";

	public static final String NUMBER_OR_NAME = "(?:" + NUMBER + "|" + NAME + ")";

	/**
	 * One or more identifiers separated by commas.
	 */
	public static final String CHOICES = NAME + "(?:\\s*,\\s*" + NAME + ")*";

	private static final Pattern NAME_PATTERN = Pattern.compile(NAME);
	private static final Pattern NUMBER_PATTERN = Pattern.compile(NUMBER);
	private static final Pattern NUMBER_OR_NAME_PATTERN = Pattern.compile(NUMBER_OR_NAME);

	private LexicalGrammar() {
		// Utility class - no instantiation
	}

	/**
	 * Wraps a fragment in a named capture group.
	 */
	public static String capture(String group, String fragment) {
		return "(?<" + group + ">" + fragment + ")";
	}

	/**
	 * Compiles a fragment so that it has to match a whole (already trimmed) line.
	 */
	public static Pattern fullLine(String fragment) {
		return Pattern.compile("^" + fragment + "$");
	}

	public static boolean isIdentifier(String text) {
		return text != null && NAME_PATTERN.matcher(text).matches();
	}

	public static boolean isNumber(String text) {
		return text != null && NUMBER_PATTERN.matcher(text).matches();
	}

	public static boolean isNumberOrName(String text) {
		return text != null && NUMBER_OR_NAME_PATTERN.matcher(text).matches();
	}

	/**
	 * Splits text matched by {@link #CHOICES} into its identifiers.
	 */
	public static List<String> splitChoices(String choices) {
		List<String> result = new ArrayList<>();
		for (String choice : choices.split(",")) {
			String trimmed = choice.trim();
			if (!trimmed.isEmpty()) {
				result.add(trimmed);
			}
		}
		return result;
	}
}
