package org.javai.configspace.io.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.configspace.io.ConfigSpaceIoConfig;
import org.javai.configspace.io.ConfigSpaceParseException;
import org.javai.configspace.io.forbidden.ForbiddenClauseEngine;
import org.javai.configspace.model.ConfigurationSpace;
import org.javai.configspace.model.Hyperparameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the lines of one dialect into a {@link ConfigurationSpace}.
 * <p>
 * Lines are consumed once, left to right. Hyperparameters are added as they are read;
 * conditions and forbidden clauses are collected and resolved afterwards, because they may
 * refer to hyperparameters declared further down.
 */
public class ConfigSpaceReader {

	private static final Logger logger = LoggerFactory.getLogger(ConfigSpaceReader.class);

	private final String formatId;
	private final LineParser lineParser;
	private final ConditionAssembler conditionAssembler;
	private final ForbiddenClauseEngine forbiddenClauseEngine;
	private final LinePreprocessor preprocessor;

	public ConfigSpaceReader(String formatId, LineParser lineParser, ConditionAssembler conditionAssembler,
			ForbiddenClauseEngine forbiddenClauseEngine, ConfigSpaceIoConfig config) {
		this.formatId = Objects.requireNonNull(formatId, "formatId must not be null");
		this.lineParser = Objects.requireNonNull(lineParser, "lineParser must not be null");
		this.conditionAssembler = Objects.requireNonNull(conditionAssembler, "conditionAssembler must not be null");
		this.forbiddenClauseEngine = Objects.requireNonNull(forbiddenClauseEngine, "forbiddenClauseEngine must not be null");
		this.preprocessor = new LinePreprocessor(Objects.requireNonNull(config, "config must not be null"));
	}

	/**
	 * Parses the lines into a fully populated space.
	 *
	 * @throws ConfigSpaceParseException naming the first offending line
	 */
	public ConfigurationSpace read(List<String> lines) {
		Objects.requireNonNull(lines, "lines must not be null");
		ConfigurationSpace space = new ConfigurationSpace();
		List<LineFragment.ConditionStated> conditions = new ArrayList<>();
		List<LineFragment.ForbiddenStated> forbidden = new ArrayList<>();
		int numerical = 0;
		int categorical = 0;

		int lineNumber = 0;
		for (String rawLine : lines) {
			lineNumber++;
			String line = preprocessor.preprocess(rawLine);
			if (line.isEmpty()) {
				continue;
			}
			int current = lineNumber;
			for (LineFragment fragment : LineErrors.decode(current, line, () -> lineParser.parseLine(current, line))) {
				if (fragment instanceof LineFragment.ParameterDeclared declared) {
					Hyperparameter hyperparameter = declared.hyperparameter();
					LineErrors.atLine(declared.lineNumber(), declared.line(),
							() -> space.addHyperparameter(hyperparameter));
					if (hyperparameter instanceof Hyperparameter.Continuous) {
						numerical++;
					} else {
						categorical++;
					}
				} else if (fragment instanceof LineFragment.ConditionStated condition) {
					conditions.add(condition);
				} else if (fragment instanceof LineFragment.ForbiddenStated clause) {
					forbidden.add(clause);
				}
			}
		}

		conditionAssembler.assemble(conditions, space);
		for (LineFragment.ForbiddenStated clause : forbidden) {
			LineErrors.atLine(clause.lineNumber(), clause.line(),
					() -> space.addForbiddenClause(forbiddenClauseEngine.parse(clause.lineNumber(), clause.line())));
		}

		logger.debug("Read {} lines of {}: {} hyperparameters ({} numerical, {} categorical/constant), "
				+ "{} conditions, {} forbidden clauses", lineNumber, formatId, space.size(), numerical, categorical,
				space.conditions().size(), space.forbiddenClauses().size());
		return space;
	}
}
