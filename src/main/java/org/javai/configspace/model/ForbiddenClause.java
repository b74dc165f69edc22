package org.javai.configspace.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * A combination of hyperparameter values that must never hold at the same time.
 * <p>
 * {@link In} is a compact in-memory form; text writers expand it into plain {@link Equals}
 * atomics before rendering.
 */
public sealed interface ForbiddenClause {

	/**
	 * The atomic clauses below this node in visit order, nested conjunctions flattened.
	 */
	List<ForbiddenClause> literals();

	<R> R accept(ForbiddenClauseVisitor<R> visitor);

	/**
	 * Forbids {@code hyperparameter = value}.
	 */
	record Equals(String hyperparameter, String value) implements ForbiddenClause {

		public Equals {
			requireName(hyperparameter);
			if (value == null || value.isEmpty()) {
				throw new ValidationException("Forbidden clause on '" + hyperparameter + "' has an empty value");
			}
		}

		@Override
		public List<ForbiddenClause> literals() {
			return List.of(this);
		}

		@Override
		public <R> R accept(ForbiddenClauseVisitor<R> visitor) {
			return visitor.visitEquals(this);
		}
	}

	/**
	 * Forbids the hyperparameter taking any of the given values.
	 */
	record In(String hyperparameter, List<String> values) implements ForbiddenClause {

		public In {
			requireName(hyperparameter);
			if (values == null || values.isEmpty()) {
				throw new ValidationException("Forbidden in-clause on '" + hyperparameter + "' needs at least one value");
			}
			for (String value : values) {
				if (value == null || value.isEmpty()) {
					throw new ValidationException("Forbidden in-clause on '" + hyperparameter + "' has an empty value");
				}
			}
			values = List.copyOf(new LinkedHashSet<>(values));
		}

		@Override
		public List<ForbiddenClause> literals() {
			return List.of(this);
		}

		@Override
		public <R> R accept(ForbiddenClauseVisitor<R> visitor) {
			return visitor.visitIn(this);
		}
	}

	/**
	 * Forbids all components holding together.
	 */
	record And(List<ForbiddenClause> components) implements ForbiddenClause {

		public And {
			if (components == null || components.isEmpty()) {
				throw new ValidationException("Forbidden conjunction needs at least one component");
			}
			components.forEach(component -> Objects.requireNonNull(component, "component must not be null"));
			components = List.copyOf(components);
		}

		public static And of(ForbiddenClause... components) {
			return new And(List.of(components));
		}

		@Override
		public List<ForbiddenClause> literals() {
			List<ForbiddenClause> literals = new ArrayList<>();
			for (ForbiddenClause component : components) {
				literals.addAll(component.literals());
			}
			return List.copyOf(literals);
		}

		@Override
		public <R> R accept(ForbiddenClauseVisitor<R> visitor) {
			return visitor.visitAnd(this);
		}
	}

	private static void requireName(String hyperparameter) {
		if (hyperparameter == null || hyperparameter.isBlank()) {
			throw new ValidationException("Forbidden clause requires a hyperparameter name");
		}
	}
}
