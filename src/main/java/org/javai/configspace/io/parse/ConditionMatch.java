package org.javai.configspace.io.parse;

import java.util.List;
import org.javai.configspace.model.Hyperparameter;

/**
 * What a condition grammar extracts from one line.
 *
 * @param declaration a hyperparameter declared on the same line, or {@code null}
 * @param child the governed hyperparameter
 * @param facts one or more parent tests in line order
 * @param connective the connective written on the line, or {@code null} if there was none
 */
public record ConditionMatch(Hyperparameter declaration, String child, List<ConditionFact> facts,
		Connective connective) {

	public ConditionMatch {
		facts = List.copyOf(facts);
	}

	public static ConditionMatch of(String child, List<ConditionFact> facts, Connective connective) {
		return new ConditionMatch(null, child, facts, connective);
	}
}
