package org.javai.configspace.io.pcs;

import java.util.List;
import java.util.Objects;
import org.javai.configspace.io.ConfigSpaceFormat;
import org.javai.configspace.io.ConfigSpaceIoConfig;
import org.javai.configspace.io.forbidden.ForbiddenClauseEngine;
import org.javai.configspace.io.parse.ConditionAssembler;
import org.javai.configspace.io.parse.ConfigSpaceReader;
import org.javai.configspace.model.ConfigurationSpace;

/**
 * The explicit dialect used by SMAC ("new pcs"): typed declarations with defaults, conditions
 * with {@code ==}, {@code !=} and {@code in} joined by {@code &&} or {@code ||}, and forbidden
 * clauses as a sorted trailing block.
 */
public final class PcsFormat implements ConfigSpaceFormat {

	public static final String ID = "pcs_new";

	private final ConfigSpaceReader reader;
	private final PcsWriter writer;

	public PcsFormat() {
		this(ConfigSpaceIoConfig.defaults());
	}

	public PcsFormat(ConfigSpaceIoConfig config) {
		Objects.requireNonNull(config, "config must not be null");
		ForbiddenClauseEngine forbiddenClauseEngine = new ForbiddenClauseEngine();
		this.reader = new ConfigSpaceReader(ID, new PcsLineParser(), ConditionAssembler.lastConnective(),
				forbiddenClauseEngine, config);
		this.writer = new PcsWriter(config, forbiddenClauseEngine);
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
