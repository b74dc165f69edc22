package org.javai.configspace.io.parse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.configspace.model.Condition;
import org.javai.configspace.model.ConfigurationSpace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns per-line condition facts into exactly one top-level {@link Condition} per child.
 * <p>
 * Lines are grouped by child, keeping line order inside each group. A group with a single
 * fact becomes that leaf; larger groups are combined according to the {@link Policy}.
 */
public final class ConditionAssembler {

	private static final Logger logger = LoggerFactory.getLogger(ConditionAssembler.class);

	public enum Policy {
		/**
		 * Always combine with AND.
		 */
		CONJUNCTIVE,
		/**
		 * Combine with the connective of the last line in the group that carried one, AND if none did.
		 */
		LAST_CONNECTIVE
	}

	private final Policy policy;
	private final boolean singleValueMembershipAsEquals;

	private ConditionAssembler(Policy policy, boolean singleValueMembershipAsEquals) {
		this.policy = policy;
		this.singleValueMembershipAsEquals = singleValueMembershipAsEquals;
	}

	/**
	 * AND-only assembly; {@code x in {a}} is read as {@code x == a}.
	 */
	public static ConditionAssembler conjunctive() {
		return new ConditionAssembler(Policy.CONJUNCTIVE, true);
	}

	/**
	 * AND/OR assembly driven by the connectives written on the lines.
	 */
	public static ConditionAssembler lastConnective() {
		return new ConditionAssembler(Policy.LAST_CONNECTIVE, false);
	}

	/**
	 * Groups the condition lines by child, in order of first appearance.
	 */
	public Map<String, List<LineFragment.ConditionStated>> groupByChild(List<LineFragment.ConditionStated> lines) {
		Map<String, List<LineFragment.ConditionStated>> groups = new LinkedHashMap<>();
		for (LineFragment.ConditionStated line : lines) {
			groups.computeIfAbsent(line.child(), child -> new ArrayList<>()).add(line);
		}
		return groups;
	}

	/**
	 * Builds the condition tree for one child from its lines.
	 */
	public Condition combine(String child, List<LineFragment.ConditionStated> group) {
		List<Condition> leaves = new ArrayList<>();
		Connective connective = null;
		for (LineFragment.ConditionStated line : group) {
			for (ConditionFact fact : line.facts()) {
				leaves.add(toLeaf(child, fact));
			}
			if (line.connective() != null) {
				connective = line.connective();
			}
		}
		if (leaves.size() == 1) {
			return leaves.get(0);
		}
		Connective effective = policy == Policy.CONJUNCTIVE || connective == null ? Connective.AND : connective;
		logger.debug("Combining {} condition facts for '{}' with {}", leaves.size(), child, effective);
		return effective == Connective.OR ? new Condition.Or(leaves) : new Condition.And(leaves);
	}

	/**
	 * Groups, combines and attaches every condition to the space. Failures point at the
	 * first line of the offending group.
	 */
	public void assemble(List<LineFragment.ConditionStated> lines, ConfigurationSpace space) {
		for (Map.Entry<String, List<LineFragment.ConditionStated>> group : groupByChild(lines).entrySet()) {
			LineFragment.ConditionStated first = group.getValue().get(0);
			LineErrors.atLine(first.lineNumber(), first.line(),
					() -> space.addCondition(combine(group.getKey(), group.getValue())));
		}
	}

	private Condition toLeaf(String child, ConditionFact fact) {
		return switch (fact.operator()) {
			case EQUALS -> new Condition.Equals(child, fact.parent(), fact.values().get(0));
			case NOT_EQUALS -> new Condition.NotEquals(child, fact.parent(), fact.values().get(0));
			case IN -> singleValueMembershipAsEquals && fact.values().size() == 1
					? new Condition.Equals(child, fact.parent(), fact.values().get(0))
					: new Condition.In(child, fact.parent(), fact.values());
		};
	}
}
