package org.javai.configspace.io.write;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.configspace.io.ConfigSpaceIoConfig;
import org.javai.configspace.io.IllegalNameException;
import org.javai.configspace.io.forbidden.ForbiddenClauseEngine;
import org.javai.configspace.io.grammar.LexicalGrammar;
import org.javai.configspace.model.ConfigurationSpace;
import org.javai.configspace.model.Hyperparameter;
import org.javai.configspace.model.HyperparameterVisitor;

/**
 * Shared write pipeline: checks names, renders each declaration with the dialect's template
 * and lets the dialect arrange declarations, conditions and forbidden clauses into sections.
 */
public abstract class AbstractConfigSpaceWriter {

	protected final String formatId;
	protected final ConfigSpaceIoConfig config;
	protected final ForbiddenClauseEngine forbiddenClauseEngine;

	protected AbstractConfigSpaceWriter(String formatId, ConfigSpaceIoConfig config,
			ForbiddenClauseEngine forbiddenClauseEngine) {
		this.formatId = Objects.requireNonNull(formatId, "formatId must not be null");
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.forbiddenClauseEngine = Objects.requireNonNull(forbiddenClauseEngine, "forbiddenClauseEngine must not be null");
	}

	/**
	 * Renders the space as text.
	 *
	 * @throws IllegalNameException if a name is not a legal identifier of this dialect
	 * @throws org.javai.configspace.io.UnsupportedConstructException if a construct cannot be expressed
	 */
	public String write(ConfigurationSpace space) {
		Objects.requireNonNull(space, "space must not be null");
		List<String> declarations = new ArrayList<>(space.size());
		HyperparameterVisitor<String> template = declarationTemplate();
		for (Hyperparameter hyperparameter : space.hyperparameters()) {
			requireLegalName(hyperparameter.name());
			declarations.add(hyperparameter.accept(template));
		}
		return compose(space, declarations).render(config.lineSeparator());
	}

	/**
	 * Per-variant declaration template of this dialect.
	 */
	protected abstract HyperparameterVisitor<String> declarationTemplate();

	/**
	 * Arranges the rendered declarations (in space order) with conditions and forbidden clauses.
	 */
	protected abstract TextDocument compose(ConfigurationSpace space, List<String> declarations);

	protected void requireLegalName(String name) {
		if (!LexicalGrammar.isIdentifier(name)) {
			throw new IllegalNameException(formatId, name);
		}
	}
}
