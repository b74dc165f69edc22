package org.javai.configspace.model;

/**
 * Visitor over the closed set of {@link Condition} variants.
 *
 * @param <R> the result type
 */
public interface ConditionVisitor<R> {

	R visitEquals(Condition.Equals condition);

	R visitNotEquals(Condition.NotEquals condition);

	R visitIn(Condition.In condition);

	R visitAnd(Condition.And conjunction);

	R visitOr(Condition.Or disjunction);
}
