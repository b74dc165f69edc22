package org.javai.configspace.io.parse;

import java.util.List;

/**
 * One parent test read from a condition line, before it is bound to a child.
 *
 * @param parent the parent hyperparameter name
 * @param operator the comparison
 * @param values the compared value(s); exactly one unless the operator is {@link Operator#IN}
 */
public record ConditionFact(String parent, Operator operator, List<String> values) {

	public enum Operator {
		EQUALS,
		NOT_EQUALS,
		IN
	}

	public ConditionFact {
		values = List.copyOf(values);
	}

	public static ConditionFact equalTo(String parent, String value) {
		return new ConditionFact(parent, Operator.EQUALS, List.of(value));
	}

	public static ConditionFact notEqualTo(String parent, String value) {
		return new ConditionFact(parent, Operator.NOT_EQUALS, List.of(value));
	}

	public static ConditionFact in(String parent, List<String> values) {
		return new ConditionFact(parent, Operator.IN, values);
	}
}
