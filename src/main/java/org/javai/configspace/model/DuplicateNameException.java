package org.javai.configspace.model;

import org.javai.configspace.ConfigSpaceException;

/**
 * Thrown when a hyperparameter is added under a name the space already holds.
 */
public class DuplicateNameException extends ConfigSpaceException {

	private final String name;

	public DuplicateNameException(String name) {
		super("Hyperparameter '" + name + "' is already defined");
		this.name = name;
	}

	public String name() {
		return name;
	}
}
