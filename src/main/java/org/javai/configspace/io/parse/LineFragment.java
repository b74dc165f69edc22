package org.javai.configspace.io.parse;

import java.util.List;
import org.javai.configspace.model.Hyperparameter;

/**
 * A piece of model information decoded from one line. Sealed so that all fragment kinds are known.
 * <p>
 * Every fragment remembers where it came from so that failures while assembling the
 * space can still point at the offending line.
 */
public sealed interface LineFragment {

	int lineNumber();

	String line();

	/**
	 * A hyperparameter declaration; attached immediately.
	 */
	record ParameterDeclared(int lineNumber, String line, Hyperparameter hyperparameter) implements LineFragment {
	}

	/**
	 * A condition line; resolved once all hyperparameters are known.
	 *
	 * @param connective the connective on this line, or {@code null}
	 */
	record ConditionStated(int lineNumber, String line, String child, List<ConditionFact> facts,
			Connective connective) implements LineFragment {

		public ConditionStated {
			facts = List.copyOf(facts);
		}
	}

	/**
	 * A forbidden-clause literal; resolved once all hyperparameters are known.
	 */
	record ForbiddenStated(int lineNumber, String line) implements LineFragment {
	}
}
