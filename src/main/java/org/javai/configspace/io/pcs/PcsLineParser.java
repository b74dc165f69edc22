package org.javai.configspace.io.pcs;

import static org.javai.configspace.io.grammar.LexicalGrammar.CHOICES;
import static org.javai.configspace.io.grammar.LexicalGrammar.NAME;
import static org.javai.configspace.io.grammar.LexicalGrammar.NUMBER;
import static org.javai.configspace.io.grammar.LexicalGrammar.NUMBER_OR_NAME;
import static org.javai.configspace.io.grammar.LexicalGrammar.capture;
import static org.javai.configspace.io.grammar.LexicalGrammar.fullLine;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.configspace.io.grammar.LexicalGrammar;
import org.javai.configspace.io.grammar.LineMatcher;
import org.javai.configspace.io.parse.AbstractLineParser;
import org.javai.configspace.io.parse.ConditionFact;
import org.javai.configspace.io.parse.ConditionMatch;
import org.javai.configspace.io.parse.Connective;
import org.javai.configspace.model.Hyperparameter;
import org.javai.configspace.model.ValidationException;

/**
 * Line grammars of the explicit ("new pcs") dialect.
 * <pre>
 * lr real [1e-05, 1.0] [0.001]log
 * depth integer [1, 10] [3]
 * kernel categorical {rbf, poly, linear} [rbf]
 * seed {42} [42]
 * degree | kernel == poly
 * gamma | kernel in {rbf, poly} || depth != 1
 * </pre>
 */
public class PcsLineParser extends AbstractLineParser {

	private static final Pattern CONTINUOUS = fullLine(
			capture("name", NAME) + "\\s+" + capture("type", "integer|real")
					+ "\\s*\\[\\s*" + capture("lower", NUMBER) + "\\s*,\\s*" + capture("upper", NUMBER) + "\\s*\\]"
					+ "\\s*\\[\\s*" + capture("default", NUMBER) + "\\s*\\]"
					+ "\\s*" + capture("log", "log") + "?");

	private static final Pattern CATEGORICAL = fullLine(
			capture("name", NAME) + "\\s+categorical"
					+ "\\s*\\{\\s*" + capture("choices", CHOICES) + "\\s*\\}"
					+ "\\s*\\[\\s*" + capture("default", NAME) + "\\s*\\]");

	private static final Pattern CONSTANT = fullLine(
			capture("name", NAME)
					+ "\\s*\\{\\s*" + capture("value", NUMBER_OR_NAME) + "\\s*\\}"
					+ "\\s*\\[\\s*" + capture("default", NUMBER_OR_NAME) + "\\s*\\]");

	private static final Pattern CONDITION = fullLine(
			capture("child", NAME) + "\\s*\\|\\s*" + fact("first")
					+ "(?:\\s*" + capture("connective", "&&|\\|\\|") + "\\s*" + fact("second") + ")?");

	private final List<LineMatcher<Hyperparameter>> parameterMatchers = List.of(
			LineMatcher.ofPattern(CONTINUOUS, PcsLineParser::continuous),
			LineMatcher.ofPattern(CATEGORICAL, PcsLineParser::categorical),
			LineMatcher.ofPattern(CONSTANT, PcsLineParser::constant));

	private final List<LineMatcher<ConditionMatch>> conditionMatchers = List.of(
			LineMatcher.ofPattern(CONDITION, PcsLineParser::condition));

	@Override
	protected List<LineMatcher<ConditionMatch>> conditionMatchers() {
		return conditionMatchers;
	}

	@Override
	protected List<LineMatcher<Hyperparameter>> parameterMatchers() {
		return parameterMatchers;
	}

	/**
	 * One parent test: {@code parent == v}, {@code parent != v} or {@code parent in {v1, v2}}.
	 */
	private static String fact(String prefix) {
		String comparison = capture(prefix + "Parent", NAME) + "\\s*" + capture(prefix + "Op", "==|!=")
				+ "\\s*" + capture(prefix + "Value", NUMBER_OR_NAME);
		String membership = capture(prefix + "InParent", NAME) + "\\s+in\\s*\\{\\s*"
				+ capture(prefix + "Values", CHOICES) + "\\s*\\}";
		return "(?:" + comparison + "|" + membership + ")";
	}

	private static Hyperparameter continuous(Matcher m) {
		boolean integer = "integer".equals(m.group("type"));
		return new Hyperparameter.Continuous(
				m.group("name"),
				Double.parseDouble(m.group("lower")),
				Double.parseDouble(m.group("upper")),
				Double.parseDouble(m.group("default")),
				integer,
				m.group("log") != null,
				null);
	}

	private static Hyperparameter categorical(Matcher m) {
		return new Hyperparameter.Categorical(m.group("name"), LexicalGrammar.splitChoices(m.group("choices")),
				m.group("default"));
	}

	private static Hyperparameter constant(Matcher m) {
		String value = m.group("value");
		if (!value.equals(m.group("default"))) {
			throw new ValidationException("Constant hyperparameter '" + m.group("name") + "' has value '" + value
					+ "' but default '" + m.group("default") + "'");
		}
		return new Hyperparameter.Constant(m.group("name"), value);
	}

	private static ConditionMatch condition(Matcher m) {
		List<ConditionFact> facts = new ArrayList<>(2);
		facts.add(fact(m, "first"));
		Connective connective = null;
		if (m.group("connective") != null) {
			connective = Connective.fromSymbol(m.group("connective")).orElseThrow();
			facts.add(fact(m, "second"));
		}
		return ConditionMatch.of(m.group("child"), facts, connective);
	}

	private static ConditionFact fact(Matcher m, String prefix) {
		if (m.group(prefix + "InParent") != null) {
			return ConditionFact.in(m.group(prefix + "InParent"), LexicalGrammar.splitChoices(m.group(prefix + "Values")));
		}
		String parent = m.group(prefix + "Parent");
		String value = m.group(prefix + "Value");
		return "==".equals(m.group(prefix + "Op"))
				? ConditionFact.equalTo(parent, value)
				: ConditionFact.notEqualTo(parent, value);
	}
}
