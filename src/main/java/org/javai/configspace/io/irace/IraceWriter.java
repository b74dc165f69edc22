package org.javai.configspace.io.irace;

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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the compact (irace) dialect. Each declaration carries its condition on the same line:
 * <pre>
 * kernel '--kernel ' c (rbf,poly)
 * degree '--degree ' i (2, 5) | kernel %in% c(poly)
 * </pre>
 * Defaults and quantization have no place in this dialect and are not written. OR and
 * not-equals conditions cannot be expressed at all.
 */
public class IraceWriter extends AbstractConfigSpaceWriter {

	private static final Logger logger = LoggerFactory.getLogger(IraceWriter.class);

	private static final HyperparameterVisitor<String> TEMPLATE = new HyperparameterVisitor<>() {
		@Override
		public String visitContinuous(Hyperparameter.Continuous p) {
			if (p.hasQuantization()) {
				logger.warn("Dropping quantization {} of '{}': not expressible in {}", p.quantization(), p.name(),
						IraceFormat.ID);
			}
			String type = (p.integer() ? "i" : "r") + (p.log() ? ",log" : "");
			String lower = p.integer() ? formatInteger(p.lower()) : formatReal(p.lower());
			String upper = p.integer() ? formatInteger(p.upper()) : formatReal(p.upper());
			return "%s '--%s ' %s (%s, %s)".formatted(p.name(), p.name(), type, lower, upper);
		}

		@Override
		public String visitCategorical(Hyperparameter.Categorical p) {
			return "%s '--%s ' c (%s)".formatted(p.name(), p.name(), String.join(",", p.choices()));
		}

		@Override
		public String visitConstant(Hyperparameter.Constant p) {
			return "%s '--%s ' c (%s)".formatted(p.name(), p.name(), p.value());
		}
	};

	public IraceWriter(ConfigSpaceIoConfig config, ForbiddenClauseEngine forbiddenClauseEngine) {
		super(IraceFormat.ID, config, forbiddenClauseEngine);
	}

	@Override
	protected HyperparameterVisitor<String> declarationTemplate() {
		return TEMPLATE;
	}

	@Override
	protected TextDocument compose(ConfigurationSpace space, List<String> declarations) {
		List<String> lines = new ArrayList<>(declarations.size());
		List<String> names = space.hyperparameterNames();
		for (int i = 0; i < declarations.size(); i++) {
			String declaration = declarations.get(i);
			String name = names.get(i);
			lines.add(space.conditionFor(name)
					.map(condition -> declaration + " | " + expression(space, condition))
					.orElse(declaration));
		}
		return TextDocument.builder()
				.section(lines)
				.section(forbiddenClauseEngine.renderAll(space))
				.build();
	}

	/**
	 * The condition expression spliced after a declaration, e.g. {@code a %in% c(x, y) && b %in% i(3)}.
	 */
	String expression(ConfigurationSpace space, Condition condition) {
		return condition.accept(new ConditionVisitor<String>() {
			@Override
			public String visitEquals(Condition.Equals c) {
				return membership(space, c.parent(), List.of(c.value()));
			}

			@Override
			public String visitNotEquals(Condition.NotEquals c) {
				throw new UnsupportedConstructException(formatId,
						"a not-equals condition for '" + c.child() + "' on '" + c.parent() + "'");
			}

			@Override
			public String visitIn(Condition.In c) {
				return membership(space, c.parent(), c.values());
			}

			@Override
			public String visitAnd(Condition.And c) {
				List<String> parts = new ArrayList<>(c.components().size());
				for (Condition component : c.components()) {
					parts.add(component.accept(this));
				}
				return String.join(" && ", parts);
			}

			@Override
			public String visitOr(Condition.Or c) {
				throw new UnsupportedConstructException(formatId, "an OR-conjunction for '" + c.child() + "'");
			}
		});
	}

	private String membership(ConfigurationSpace space, String parent, List<String> values) {
		return "%s %%in%% %s(%s)".formatted(parent, typeCode(space.getHyperparameter(parent)), String.join(", ", values));
	}

	private static String typeCode(Hyperparameter parent) {
		return parent.accept(new HyperparameterVisitor<String>() {
			@Override
			public String visitContinuous(Hyperparameter.Continuous p) {
				return p.integer() ? "i" : "r";
			}

			@Override
			public String visitCategorical(Hyperparameter.Categorical p) {
				return "c";
			}

			@Override
			public String visitConstant(Hyperparameter.Constant p) {
				return "c";
			}
		});
	}
}
