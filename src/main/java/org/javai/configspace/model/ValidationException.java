package org.javai.configspace.model;

import org.javai.configspace.ConfigSpaceException;

/**
 * Thrown when a hyperparameter, condition or forbidden clause violates one of its local invariants.
 */
public class ValidationException extends ConfigSpaceException {

	public ValidationException(String message) {
		super(message);
	}
}
