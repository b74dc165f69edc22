package org.javai.configspace.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Append-only container of hyperparameters, their activation conditions and forbidden clauses.
 * <p>
 * Hyperparameters keep insertion order. Conditions and forbidden clauses reference
 * hyperparameters by name, so the referenced hyperparameters must be added first.
 * <p>
 * Not thread-safe while being populated; once built it can be shared for reading.
 */
public final class ConfigurationSpace {

	private final Map<String, Hyperparameter> hyperparameters = new LinkedHashMap<>();
	private final Map<String, Condition> conditionsByChild = new LinkedHashMap<>();
	private final List<ForbiddenClause> forbiddenClauses = new ArrayList<>();

	/**
	 * Adds a hyperparameter.
	 *
	 * @return the added hyperparameter
	 * @throws DuplicateNameException if the name is already taken
	 */
	public Hyperparameter addHyperparameter(Hyperparameter hyperparameter) {
		Objects.requireNonNull(hyperparameter, "hyperparameter must not be null");
		if (hyperparameters.containsKey(hyperparameter.name())) {
			throw new DuplicateNameException(hyperparameter.name());
		}
		hyperparameters.put(hyperparameter.name(), hyperparameter);
		return hyperparameter;
	}

	/**
	 * @throws UnknownNameException if no hyperparameter has that name
	 */
	public Hyperparameter getHyperparameter(String name) {
		Hyperparameter hyperparameter = hyperparameters.get(name);
		if (hyperparameter == null) {
			throw new UnknownNameException(name);
		}
		return hyperparameter;
	}

	public boolean hasHyperparameter(String name) {
		return hyperparameters.containsKey(name);
	}

	/**
	 * Attaches the single top-level condition of a child hyperparameter.
	 *
	 * @throws UnknownNameException if the child or a parent is missing
	 * @throws ValidationException if the child already has a condition or a value is outside the parent's domain
	 */
	public Condition addCondition(Condition condition) {
		Objects.requireNonNull(condition, "condition must not be null");
		String child = condition.child();
		getHyperparameter(child);
		if (conditionsByChild.containsKey(child)) {
			throw new ValidationException("Hyperparameter '" + child + "' already has a condition");
		}
		for (Condition leaf : condition.leaves()) {
			leaf.accept(new ConditionVisitor<Void>() {
				@Override
				public Void visitEquals(Condition.Equals equals) {
					requireLegal(equals.parent(), equals.value());
					return null;
				}

				@Override
				public Void visitNotEquals(Condition.NotEquals notEquals) {
					requireLegal(notEquals.parent(), notEquals.value());
					return null;
				}

				@Override
				public Void visitIn(Condition.In in) {
					in.values().forEach(value -> requireLegal(in.parent(), value));
					return null;
				}

				@Override
				public Void visitAnd(Condition.And conjunction) {
					return null;
				}

				@Override
				public Void visitOr(Condition.Or disjunction) {
					return null;
				}
			});
		}
		conditionsByChild.put(child, condition);
		return condition;
	}

	/**
	 * Adds a forbidden clause; every referenced hyperparameter must exist and every value must be legal.
	 */
	public ForbiddenClause addForbiddenClause(ForbiddenClause clause) {
		Objects.requireNonNull(clause, "clause must not be null");
		for (ForbiddenClause literal : clause.literals()) {
			if (literal instanceof ForbiddenClause.Equals equals) {
				requireLegal(equals.hyperparameter(), equals.value());
			} else if (literal instanceof ForbiddenClause.In in) {
				in.values().forEach(value -> requireLegal(in.hyperparameter(), value));
			}
		}
		forbiddenClauses.add(clause);
		return clause;
	}

	public List<Hyperparameter> hyperparameters() {
		return List.copyOf(hyperparameters.values());
	}

	public List<String> hyperparameterNames() {
		return List.copyOf(hyperparameters.keySet());
	}

	/**
	 * Top-level conditions in the order they were attached.
	 */
	public List<Condition> conditions() {
		return List.copyOf(conditionsByChild.values());
	}

	public Optional<Condition> conditionFor(String child) {
		return Optional.ofNullable(conditionsByChild.get(child));
	}

	public List<ForbiddenClause> forbiddenClauses() {
		return List.copyOf(forbiddenClauses);
	}

	public int size() {
		return hyperparameters.size();
	}

	private void requireLegal(String name, String value) {
		Hyperparameter hyperparameter = getHyperparameter(name);
		if (!hyperparameter.isLegalValue(value)) {
			throw new ValidationException("Value '" + value + "' is not legal for hyperparameter '" + name + "'");
		}
	}

	@Override
	public String toString() {
		return "ConfigurationSpace[hyperparameters=" + hyperparameters.size()
				+ ", conditions=" + conditionsByChild.size()
				+ ", forbiddenClauses=" + forbiddenClauses.size() + "]";
	}
}
