package org.javai.configspace;

/**
 * Root of all failures raised while building, reading or writing a configuration space.
 */
public class ConfigSpaceException extends RuntimeException {

	public ConfigSpaceException(String message) {
		super(message);
	}

	public ConfigSpaceException(String message, Throwable cause) {
		super(message, cause);
	}
}
