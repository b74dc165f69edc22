package org.javai.configspace.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * A rule that makes a child hyperparameter active only when its parent(s) take certain values.
 * <p>
 * Leaves reference hyperparameters by name; the owning {@link ConfigurationSpace} resolves them.
 * Composite nodes ({@link And}, {@link Or}) combine at least two conditions that all govern the
 * same child.
 */
public sealed interface Condition {

	/**
	 * Name of the hyperparameter this condition activates.
	 */
	String child();

	/**
	 * The leaf conditions below this node in visit order; a leaf returns itself.
	 */
	List<Condition> leaves();

	<R> R accept(ConditionVisitor<R> visitor);

	/**
	 * Active when {@code parent == value}.
	 */
	record Equals(String child, String parent, String value) implements Condition {

		public Equals {
			requireLeaf(child, parent);
			requireValue(child, value);
		}

		@Override
		public List<Condition> leaves() {
			return List.of(this);
		}

		@Override
		public <R> R accept(ConditionVisitor<R> visitor) {
			return visitor.visitEquals(this);
		}
	}

	/**
	 * Active when {@code parent != value}.
	 */
	record NotEquals(String child, String parent, String value) implements Condition {

		public NotEquals {
			requireLeaf(child, parent);
			requireValue(child, value);
		}

		@Override
		public List<Condition> leaves() {
			return List.of(this);
		}

		@Override
		public <R> R accept(ConditionVisitor<R> visitor) {
			return visitor.visitNotEquals(this);
		}
	}

	/**
	 * Active when the parent takes any of the given values.
	 */
	record In(String child, String parent, List<String> values) implements Condition {

		public In {
			requireLeaf(child, parent);
			if (values == null || values.isEmpty()) {
				throw new ValidationException("In-condition on '" + child + "' needs at least one value");
			}
			values.forEach(value -> requireValue(child, value));
			values = List.copyOf(new LinkedHashSet<>(values));
		}

		@Override
		public List<Condition> leaves() {
			return List.of(this);
		}

		@Override
		public <R> R accept(ConditionVisitor<R> visitor) {
			return visitor.visitIn(this);
		}
	}

	/**
	 * Active when all components are.
	 */
	record And(List<Condition> components) implements Condition {

		public And {
			components = requireComposite("AND", components);
		}

		public static And of(Condition... components) {
			return new And(List.of(components));
		}

		@Override
		public String child() {
			return components.get(0).child();
		}

		@Override
		public List<Condition> leaves() {
			return flatten(components);
		}

		@Override
		public <R> R accept(ConditionVisitor<R> visitor) {
			return visitor.visitAnd(this);
		}
	}

	/**
	 * Active when any component is.
	 */
	record Or(List<Condition> components) implements Condition {

		public Or {
			components = requireComposite("OR", components);
		}

		public static Or of(Condition... components) {
			return new Or(List.of(components));
		}

		@Override
		public String child() {
			return components.get(0).child();
		}

		@Override
		public List<Condition> leaves() {
			return flatten(components);
		}

		@Override
		public <R> R accept(ConditionVisitor<R> visitor) {
			return visitor.visitOr(this);
		}
	}

	private static void requireLeaf(String child, String parent) {
		if (child == null || child.isBlank() || parent == null || parent.isBlank()) {
			throw new ValidationException("Condition requires both a child and a parent name");
		}
		if (child.equals(parent)) {
			throw new ValidationException("Hyperparameter '" + child + "' cannot be conditioned on itself");
		}
	}

	private static void requireValue(String child, String value) {
		if (value == null || value.isEmpty()) {
			throw new ValidationException("Condition on '" + child + "' has an empty value");
		}
	}

	private static List<Condition> requireComposite(String kind, List<Condition> components) {
		if (components == null || components.size() < 2) {
			throw new ValidationException(kind + "-conjunction needs at least two components");
		}
		components.forEach(component -> Objects.requireNonNull(component, "component must not be null"));
		String child = components.get(0).child();
		for (Condition component : components) {
			if (!component.child().equals(child)) {
				throw new ValidationException(kind + "-conjunction mixes children '" + child + "' and '"
						+ component.child() + "'");
			}
		}
		return List.copyOf(components);
	}

	private static List<Condition> flatten(List<Condition> components) {
		List<Condition> leaves = new ArrayList<>();
		for (Condition component : components) {
			leaves.addAll(component.leaves());
		}
		return List.copyOf(leaves);
	}
}
