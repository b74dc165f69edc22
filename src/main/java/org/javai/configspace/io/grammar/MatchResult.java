package org.javai.configspace.io.grammar;

import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of trying one line grammar against one line.
 *
 * @param <T> the fragment type produced on success
 */
public sealed interface MatchResult<T> {

	record Matched<T>(T value) implements MatchResult<T> {
	}

	record NoMatch<T>() implements MatchResult<T> {
	}

	static <T> MatchResult<T> matched(T value) {
		return new Matched<>(value);
	}

	static <T> MatchResult<T> noMatch() {
		return new NoMatch<>();
	}

	default Optional<T> toOptional() {
		return this instanceof Matched<T> m ? Optional.of(m.value()) : Optional.empty();
	}

	default <U> MatchResult<U> map(Function<? super T, ? extends U> mapper) {
		return this instanceof Matched<T> m ? matched(mapper.apply(m.value())) : noMatch();
	}
}
