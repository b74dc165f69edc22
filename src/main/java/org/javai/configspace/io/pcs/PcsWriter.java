package org.javai.configspace.io.pcs;

import static org.javai.configspace.io.write.NumberFormatter.formatInteger;
import static org.javai.configspace.io.write.NumberFormatter.formatReal;

import java.util.ArrayList;
import java.util.List;
import org.javai.configspace.io.ConfigSpaceIoConfig;
import org.javai.configspace.io.UnsupportedConstructException;
import org.javai.configspace.io.forbidden.ForbiddenClauseEngine;
import org.javai.configspace.io.write.AbstractConfigSpaceWriter;
import org.javai.configspace.io.write.TextDocument;
import org.javai.configspace.model.Condition;
import org.javai.configspace.model.ConditionVisitor;
import org.javai.configspace.model.ConfigurationSpace;
import org.javai.configspace.model.Hyperparameter;
import org.javai.configspace.model.HyperparameterVisitor;

/**
 * Writes the explicit ("new pcs") dialect: declarations, then a condition block, then the
 * sorted forbidden clauses, separated by blank lines.
 * <p>
 * A composite condition is written as lines of at most two facts. When the number of facts
 * is odd, the single fact goes first so that the last line carries the connective.
 */
public class PcsWriter extends AbstractConfigSpaceWriter {

	private static final HyperparameterVisitor<String> TEMPLATE = new HyperparameterVisitor<>() {
		@Override
		public String visitContinuous(Hyperparameter.Continuous p) {
			String prefix = p.hasQuantization() ? "Q" + (long) p.quantization().doubleValue() + "_" : "";
			String line = p.integer()
					? "%s%s integer [%s, %s] [%s]".formatted(prefix, p.name(), formatInteger(p.lower()),
							formatInteger(p.upper()), formatInteger(p.defaultValue()))
					: "%s%s real [%s, %s] [%s]".formatted(prefix, p.name(), formatReal(p.lower()),
							formatReal(p.upper()), formatReal(p.defaultValue()));
			return p.log() ? line + "log" : line;
		}

		@Override
		public String visitCategorical(Hyperparameter.Categorical p) {
			return "%s categorical {%s} [%s]".formatted(p.name(), String.join(", ", p.choices()), p.defaultValue());
		}

		@Override
		public String visitConstant(Hyperparameter.Constant p) {
			return "%s {%s} [%s]".formatted(p.name(), p.value(), p.value());
		}
	};

	public PcsWriter(ConfigSpaceIoConfig config, ForbiddenClauseEngine forbiddenClauseEngine) {
		super(PcsFormat.ID, config, forbiddenClauseEngine);
	}

	@Override
	protected HyperparameterVisitor<String> declarationTemplate() {
		return TEMPLATE;
	}

	@Override
	protected TextDocument compose(ConfigurationSpace space, List<String> declarations) {
		List<String> conditionLines = new ArrayList<>();
		for (Condition condition : space.conditions()) {
			conditionLines.addAll(conditionLines(condition));
		}
		List<String> forbiddenLines = new ArrayList<>(forbiddenClauseEngine.renderAll(space));
		forbiddenLines.sort(null);
		return TextDocument.builder()
				.section(declarations)
				.section(conditionLines)
				.section(forbiddenLines)
				.build();
	}

	/**
	 * The lines for one top-level condition.
	 */
	List<String> conditionLines(Condition condition) {
		return condition.accept(new ConditionVisitor<List<String>>() {
			@Override
			public List<String> visitEquals(Condition.Equals c) {
				return List.of(line(c.child(), fact(c)));
			}

			@Override
			public List<String> visitNotEquals(Condition.NotEquals c) {
				return List.of(line(c.child(), fact(c)));
			}

			@Override
			public List<String> visitIn(Condition.In c) {
				return List.of(line(c.child(), fact(c)));
			}

			@Override
			public List<String> visitAnd(Condition.And c) {
				return compositeLines(c.child(), c.components(), " && ");
			}

			@Override
			public List<String> visitOr(Condition.Or c) {
				return compositeLines(c.child(), c.components(), " || ");
			}
		});
	}

	private List<String> compositeLines(String child, List<Condition> components, String connective) {
		List<String> facts = new ArrayList<>(components.size());
		for (Condition component : components) {
			facts.add(fact(component));
		}
		List<String> lines = new ArrayList<>();
		int start = 0;
		if (facts.size() % 2 == 1) {
			lines.add(line(child, facts.get(0)));
			start = 1;
		}
		for (int i = start; i < facts.size(); i += 2) {
			lines.add(line(child, facts.get(i) + connective + facts.get(i + 1)));
		}
		return lines;
	}

	private String line(String child, String facts) {
		return child + " | " + facts;
	}

	private String fact(Condition leaf) {
		return leaf.accept(new ConditionVisitor<String>() {
			@Override
			public String visitEquals(Condition.Equals c) {
				return c.parent() + " == " + c.value();
			}

			@Override
			public String visitNotEquals(Condition.NotEquals c) {
				return c.parent() + " != " + c.value();
			}

			@Override
			public String visitIn(Condition.In c) {
				return c.parent() + " in {" + String.join(", ", c.values()) + "}";
			}

			@Override
			public String visitAnd(Condition.And c) {
				throw new UnsupportedConstructException(formatId, "a nested AND-conjunction for '" + c.child() + "'");
			}

			@Override
			public String visitOr(Condition.Or c) {
				throw new UnsupportedConstructException(formatId, "a nested OR-conjunction for '" + c.child() + "'");
			}
		});
	}
}
