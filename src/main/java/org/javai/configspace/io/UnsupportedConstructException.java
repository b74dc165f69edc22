package org.javai.configspace.io;

import org.javai.configspace.ConfigSpaceException;

/**
 * The target dialect cannot represent a construct it was asked to write.
 */
public class UnsupportedConstructException extends ConfigSpaceException {

	public UnsupportedConstructException(String formatId, String message) {
		super(formatId + " cannot represent " + message);
	}
}
