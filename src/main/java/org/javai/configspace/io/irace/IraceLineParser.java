package org.javai.configspace.io.irace;

import static org.javai.configspace.io.grammar.LexicalGrammar.CHOICES;
import static org.javai.configspace.io.grammar.LexicalGrammar.NAME;
import static org.javai.configspace.io.grammar.LexicalGrammar.NUMBER;
import static org.javai.configspace.io.grammar.LexicalGrammar.NUMBER_OR_NAME;
import static org.javai.configspace.io.grammar.LexicalGrammar.capture;
import static org.javai.configspace.io.grammar.LexicalGrammar.fullLine;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.configspace.io.grammar.LexicalGrammar;
import org.javai.configspace.io.grammar.LineMatcher;
import org.javai.configspace.io.grammar.MatchResult;
import org.javai.configspace.io.parse.AbstractLineParser;
import org.javai.configspace.io.parse.ConditionFact;
import org.javai.configspace.io.parse.ConditionMatch;
import org.javai.configspace.model.Hyperparameter;

/**
 * Line grammars of the compact (irace) dialect.
 * <p>
 * Two families of declarations are accepted. The classic shapes carry a default:
 * <pre>
 * depth [1, 10] [3]i
 * lr [0.0001, 1.0] [0.01]l
 * kernel {rbf, poly} [rbf]
 * degree | kernel in {poly}
 * </pre>
 * The native irace shapes (quotes already stripped) have no default and may carry their
 * condition on the same line:
 * <pre>
 * depth --depth  i (1, 10)
 * lr --lr  r,log (0.0001, 1.0)
 * kernel --kernel  c (rbf,poly)
 * degree --degree  i (2, 5) | kernel %in% c(poly)
 * </pre>
 * Native declarations get the default the irace format leaves implicit: the first choice,
 * or the middle of the range (geometric middle on a log scale, rounded for integers).
 */
public class IraceLineParser extends AbstractLineParser {

	private static final Pattern CLASSIC_CONTINUOUS = fullLine(
			capture("name", NAME)
					+ "\\s*\\[\\s*" + capture("lower", NUMBER) + "\\s*,\\s*" + capture("upper", NUMBER) + "\\s*\\]"
					+ "\\s*\\[\\s*" + capture("default", NUMBER) + "\\s*\\]"
					+ "\\s*" + capture("flags", "[il]+") + "?");

	private static final Pattern CLASSIC_CATEGORICAL = fullLine(
			capture("name", NAME)
					+ "\\s*\\{\\s*" + capture("choices", CHOICES) + "\\s*\\}"
					+ "\\s*\\[\\s*" + capture("default", NAME) + "\\s*\\]");

	private static final String SWITCH = "(?:\\s+\\S+)?";

	private static final Pattern NATIVE_NUMERIC = fullLine(
			capture("name", NAME) + SWITCH + "\\s+" + capture("type", "[ir]") + capture("log", ",\\s*log") + "?"
					+ "\\s*\\(\\s*" + capture("lower", NUMBER) + "\\s*,\\s*" + capture("upper", NUMBER) + "\\s*\\)");

	private static final Pattern NATIVE_CATEGORICAL = fullLine(
			capture("name", NAME) + SWITCH + "\\s+[co]"
					+ "\\s*\\(\\s*" + capture("choices", CHOICES) + "\\s*\\)");

	private static final Pattern CLASSIC_CONDITION = fullLine(
			capture("child", NAME) + "\\s*\\|\\s*" + capture("parent", NAME)
					+ "\\s+in\\s*\\{\\s*" + capture("values", CHOICES) + "\\s*\\}");

	private static final Pattern SPLICED_CONDITION = fullLine(
			capture("head", "[^|]+?") + "\\s*\\|\\s*" + capture("expression", ".+"));

	private static final Pattern CONJUNCTION_SEPARATOR = Pattern.compile("\\s*&&\\s*");

	private static final Pattern NATIVE_MEMBERSHIP = fullLine(
			capture("parent", NAME) + "\\s+%?in%?\\s*[cior]?\\s*\\(\\s*" + capture("values", CHOICES) + "\\s*\\)");

	private static final Pattern BRACE_MEMBERSHIP = fullLine(
			capture("parent", NAME) + "\\s+in\\s*\\{\\s*" + capture("values", CHOICES) + "\\s*\\}");

	private static final Pattern EQUALITY = fullLine(
			capture("parent", NAME) + "\\s*==\\s*" + capture("value", NUMBER_OR_NAME));

	private static final Pattern BARE_NAME = fullLine(NAME);

	private final List<LineMatcher<Hyperparameter>> parameterMatchers = List.of(
			LineMatcher.ofPattern(CLASSIC_CONTINUOUS, IraceLineParser::classicContinuous),
			LineMatcher.ofPattern(CLASSIC_CATEGORICAL, IraceLineParser::classicCategorical),
			LineMatcher.ofPattern(NATIVE_NUMERIC, IraceLineParser::nativeNumeric),
			LineMatcher.ofPattern(NATIVE_CATEGORICAL, IraceLineParser::nativeCategorical));

	private final List<LineMatcher<ConditionMatch>> conditionMatchers = List.of(
			LineMatcher.ofPattern(CLASSIC_CONDITION, IraceLineParser::classicCondition),
			this::splicedCondition);

	@Override
	protected List<LineMatcher<ConditionMatch>> conditionMatchers() {
		return conditionMatchers;
	}

	@Override
	protected List<LineMatcher<Hyperparameter>> parameterMatchers() {
		return parameterMatchers;
	}

	@Override
	protected String constructClosers() {
		return "}])";
	}

	private static Hyperparameter classicContinuous(Matcher m) {
		String flags = m.group("flags") != null ? m.group("flags") : "";
		return new Hyperparameter.Continuous(
				m.group("name"),
				Double.parseDouble(m.group("lower")),
				Double.parseDouble(m.group("upper")),
				Double.parseDouble(m.group("default")),
				flags.indexOf('i') >= 0,
				flags.indexOf('l') >= 0,
				null);
	}

	private static Hyperparameter classicCategorical(Matcher m) {
		return new Hyperparameter.Categorical(m.group("name"), LexicalGrammar.splitChoices(m.group("choices")),
				m.group("default"));
	}

	private static Hyperparameter nativeNumeric(Matcher m) {
		boolean integer = "i".equals(m.group("type"));
		boolean log = m.group("log") != null;
		double lower = Double.parseDouble(m.group("lower"));
		double upper = Double.parseDouble(m.group("upper"));
		return new Hyperparameter.Continuous(m.group("name"), lower, upper, implicitDefault(lower, upper, integer, log),
				integer, log, null);
	}

	private static Hyperparameter nativeCategorical(Matcher m) {
		List<String> choices = LexicalGrammar.splitChoices(m.group("choices"));
		if (choices.size() == 1) {
			return new Hyperparameter.Constant(m.group("name"), choices.get(0));
		}
		return Hyperparameter.Categorical.of(m.group("name"), choices);
	}

	/**
	 * Middle of the range; geometric middle on a log scale, rounded (and clamped) for integers.
	 */
	static double implicitDefault(double lower, double upper, boolean integer, boolean log) {
		double middle = log && lower > 0
				? Math.exp((Math.log(lower) + Math.log(upper)) / 2)
				: (lower + upper) / 2;
		if (integer) {
			middle = Math.min(upper, Math.max(lower, Math.round(middle)));
		}
		return middle;
	}

	private static ConditionMatch classicCondition(Matcher m) {
		return ConditionMatch.of(m.group("child"),
				List.of(ConditionFact.in(m.group("parent"), LexicalGrammar.splitChoices(m.group("values")))), null);
	}

	/**
	 * {@code head | expression}, where the head is either the child's name or its full
	 * declaration and the expression is one or more facts joined by {@code &&}.
	 */
	private MatchResult<ConditionMatch> splicedCondition(String line) {
		Matcher m = SPLICED_CONDITION.matcher(line);
		if (!m.matches()) {
			return MatchResult.noMatch();
		}
		Optional<List<ConditionFact>> facts = facts(m.group("expression"));
		if (facts.isEmpty()) {
			return MatchResult.noMatch();
		}
		String head = m.group("head").strip();
		if (BARE_NAME.matcher(head).matches()) {
			return MatchResult.matched(ConditionMatch.of(head, facts.get(), null));
		}
		return LineMatcher.firstMatch(parameterMatchers, head)
				.map(declaration -> new ConditionMatch(declaration, declaration.name(), facts.get(), null));
	}

	private static Optional<List<ConditionFact>> facts(String expression) {
		List<ConditionFact> facts = new ArrayList<>();
		for (String part : CONJUNCTION_SEPARATOR.split(expression.strip())) {
			Optional<ConditionFact> fact = fact(part);
			if (fact.isEmpty()) {
				return Optional.empty();
			}
			facts.add(fact.get());
		}
		return Optional.of(facts);
	}

	private static Optional<ConditionFact> fact(String part) {
		Matcher m = NATIVE_MEMBERSHIP.matcher(part);
		if (m.matches()) {
			return Optional.of(ConditionFact.in(m.group("parent"), LexicalGrammar.splitChoices(m.group("values"))));
		}
		m = BRACE_MEMBERSHIP.matcher(part);
		if (m.matches()) {
			return Optional.of(ConditionFact.in(m.group("parent"), LexicalGrammar.splitChoices(m.group("values"))));
		}
		m = EQUALITY.matcher(part);
		if (m.matches()) {
			return Optional.of(ConditionFact.equalTo(m.group("parent"), m.group("value")));
		}
		return Optional.empty();
	}
}
