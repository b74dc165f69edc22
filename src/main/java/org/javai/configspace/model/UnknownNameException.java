package org.javai.configspace.model;

import org.javai.configspace.ConfigSpaceException;

/**
 * Thrown when a lookup names a hyperparameter the space does not contain.
 */
public class UnknownNameException extends ConfigSpaceException {

	private final String name;

	public UnknownNameException(String name) {
		super("Unknown hyperparameter '" + name + "'");
		this.name = name;
	}

	public String name() {
		return name;
	}
}
