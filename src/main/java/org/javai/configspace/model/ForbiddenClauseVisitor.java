package org.javai.configspace.model;

/**
 * Visitor over the closed set of {@link ForbiddenClause} variants.
 *
 * @param <R> the result type
 */
public interface ForbiddenClauseVisitor<R> {

	R visitEquals(ForbiddenClause.Equals clause);

	R visitIn(ForbiddenClause.In clause);

	R visitAnd(ForbiddenClause.And conjunction);
}
