package org.javai.configspace.io.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.javai.configspace.io.UnparsableConditionException;
import org.javai.configspace.io.UnparsableParameterException;
import org.javai.configspace.io.grammar.LineMatcher;
import org.javai.configspace.model.Hyperparameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies lines the same way for every dialect and delegates the decoding to
 * dialect-specific, ordered matcher lists.
 * <p>
 * Classification order:
 * <ol>
 *   <li>a line containing {@code |} is a condition</li>
 *   <li>a line without any of the dialect's closing characters is skipped</li>
 *   <li>a line wrapped in braces is a forbidden-clause literal</li>
 *   <li>anything else is a parameter declaration</li>
 * </ol>
 */
public abstract class AbstractLineParser implements LineParser {

	private static final Logger logger = LoggerFactory.getLogger(AbstractLineParser.class);

	/**
	 * Condition grammars in priority order.
	 */
	protected abstract List<LineMatcher<ConditionMatch>> conditionMatchers();

	/**
	 * Parameter grammars in priority order.
	 */
	protected abstract List<LineMatcher<Hyperparameter>> parameterMatchers();

	/**
	 * Characters at least one of which a declaration or forbidden literal contains.
	 */
	protected String constructClosers() {
		return "}]";
	}

	@Override
	public List<LineFragment> parseLine(int lineNumber, String line) {
		if (line.indexOf('|') >= 0) {
			ConditionMatch match = LineMatcher.firstMatch(conditionMatchers(), line).toOptional()
					.orElseThrow(() -> new UnparsableConditionException(lineNumber, line));
			return toFragments(lineNumber, line, match);
		}
		if (!containsCloser(line)) {
			logger.trace("Skipping line {} without a recognised construct: {}", lineNumber, line);
			return List.of();
		}
		if (line.startsWith("{") && line.endsWith("}")) {
			return List.of(new LineFragment.ForbiddenStated(lineNumber, line));
		}
		Optional<Hyperparameter> hyperparameter = LineMatcher.firstMatch(parameterMatchers(), line).toOptional();
		return List.of(new LineFragment.ParameterDeclared(lineNumber, line,
				hyperparameter.orElseThrow(() -> new UnparsableParameterException(lineNumber, line))));
	}

	private List<LineFragment> toFragments(int lineNumber, String line, ConditionMatch match) {
		List<LineFragment> fragments = new ArrayList<>(2);
		if (match.declaration() != null) {
			fragments.add(new LineFragment.ParameterDeclared(lineNumber, line, match.declaration()));
		}
		fragments.add(new LineFragment.ConditionStated(lineNumber, line, match.child(), match.facts(),
				match.connective()));
		return fragments;
	}

	private boolean containsCloser(String line) {
		String closers = constructClosers();
		for (int i = 0; i < closers.length(); i++) {
			if (line.indexOf(closers.charAt(i)) >= 0) {
				return true;
			}
		}
		return false;
	}
}
