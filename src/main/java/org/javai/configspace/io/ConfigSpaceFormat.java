package org.javai.configspace.io;

import java.util.List;
import org.javai.configspace.model.ConfigurationSpace;

/**
 * A flat text dialect that a configuration space can be read from and written to.
 * Implementations are stateless and can be shared between threads.
 */
public interface ConfigSpaceFormat {

	/**
	 * Stable identifier used to look the format up, e.g. {@code pcs_new} or {@code irace}.
	 */
	String id();

	/**
	 * Parses the physical lines of a file in this dialect.
	 *
	 * @param lines the lines, without line terminators
	 * @return the populated space
	 * @throws ConfigSpaceParseException naming the offending line
	 */
	ConfigurationSpace read(List<String> lines);

	/**
	 * Renders the space in this dialect.
	 *
	 * @throws IllegalNameException if a hyperparameter name is not a legal identifier of the dialect
	 * @throws UnsupportedConstructException if the space uses a construct the dialect cannot express
	 */
	String write(ConfigurationSpace space);
}
