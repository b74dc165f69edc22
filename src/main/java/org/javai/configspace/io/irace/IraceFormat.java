package org.javai.configspace.io.irace;

import java.util.List;
import java.util.Objects;
import org.javai.configspace.io.ConfigSpaceFormat;
import org.javai.configspace.io.ConfigSpaceIoConfig;
import org.javai.configspace.io.forbidden.ForbiddenClauseEngine;
import org.javai.configspace.io.parse.ConditionAssembler;
import org.javai.configspace.io.parse.ConfigSpaceReader;
import org.javai.configspace.model.ConfigurationSpace;

/**
 * The compact dialect of the irace tuner. Conditions are AND-only; forbidden clauses follow
 * the declarations in a trailing block.
 */
public final class IraceFormat implements ConfigSpaceFormat {

	public static final String ID = "irace";

	private final ConfigSpaceReader reader;
	private final IraceWriter writer;

	public IraceFormat() {
		this(ConfigSpaceIoConfig.defaults());
	}

	public IraceFormat(ConfigSpaceIoConfig config) {
		Objects.requireNonNull(config, "config must not be null");
		ForbiddenClauseEngine forbiddenClauseEngine = new ForbiddenClauseEngine();
		this.reader = new ConfigSpaceReader(ID, new IraceLineParser(), ConditionAssembler.conjunctive(),
				forbiddenClauseEngine, config);
		this.writer = new IraceWriter(config, forbiddenClauseEngine);
	}

	@Override
	public String id() {
		return ID;
	}

	@Override
	public ConfigurationSpace read(List<String> lines) {
		return reader.read(lines);
	}

	@Override
	public String write(ConfigurationSpace space) {
		return writer.write(space);
	}
}
