package org.javai.configspace.io.grammar;

import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One typed line grammar. Matchers are tried in a fixed priority order and the first
 * {@link MatchResult.Matched} wins, so a matcher must never throw to signal "not mine".
 *
 * @param <T> the fragment type produced on success
 */
@FunctionalInterface
public interface LineMatcher<T> {

	MatchResult<T> match(String line);

	/**
	 * A matcher backed by a whole-line regular expression.
	 */
	static <T> LineMatcher<T> ofPattern(Pattern pattern, Function<Matcher, T> decoder) {
		return line -> {
			Matcher matcher = pattern.matcher(line);
			return matcher.matches() ? MatchResult.matched(decoder.apply(matcher)) : MatchResult.noMatch();
		};
	}

	/**
	 * Tries the matchers in order and returns the first match.
	 */
	static <T> MatchResult<T> firstMatch(List<? extends LineMatcher<? extends T>> matchers, String line) {
		for (LineMatcher<? extends T> matcher : matchers) {
			MatchResult<? extends T> result = matcher.match(line);
			if (result instanceof MatchResult.Matched<? extends T> matched) {
				return MatchResult.matched(matched.value());
			}
		}
		return MatchResult.noMatch();
	}
}
