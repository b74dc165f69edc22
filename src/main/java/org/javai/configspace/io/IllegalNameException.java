package org.javai.configspace.io;

import org.javai.configspace.ConfigSpaceException;

/**
 * A hyperparameter name is valid in the model but not in the identifier grammar of the target dialect.
 */
public class IllegalNameException extends ConfigSpaceException {

	private final String name;

	public IllegalNameException(String formatId, String name) {
		super("Illegal hyperparameter name for " + formatId + ": " + name);
		this.name = name;
	}

	public String name() {
		return name;
	}
}
