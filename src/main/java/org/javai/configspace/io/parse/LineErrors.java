package org.javai.configspace.io.parse;

import java.util.function.Supplier;
import org.javai.configspace.ConfigSpaceException;
import org.javai.configspace.io.ConfigSpaceParseException;

/**
 * Ties model failures raised while assembling a space to the line that caused them.
 */
public final class LineErrors {

	private LineErrors() {
		// Utility class - no instantiation
	}

	/**
	 * Runs the action; a model exception is rethrown as a {@link ConfigSpaceParseException}
	 * for the given line with the original as cause. Parse exceptions pass through unchanged.
	 */
	public static void atLine(int lineNumber, String line, Runnable action) {
		try {
			action.run();
		} catch (ConfigSpaceParseException e) {
			throw e;
		} catch (ConfigSpaceException e) {
			throw new ConfigSpaceParseException(lineNumber, line, e.getMessage(), e);
		}
	}

	/**
	 * Like {@link #atLine(int, String, Runnable)} for actions that produce a value.
	 */
	public static <T> T decode(int lineNumber, String line, Supplier<T> action) {
		try {
			return action.get();
		} catch (ConfigSpaceParseException e) {
			throw e;
		} catch (ConfigSpaceException e) {
			throw new ConfigSpaceParseException(lineNumber, line, e.getMessage(), e);
		}
	}
}
