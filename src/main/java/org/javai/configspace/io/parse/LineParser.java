package org.javai.configspace.io.parse;

import java.util.List;
import org.javai.configspace.io.ConfigSpaceParseException;

/**
 * Strategy interface for decoding one preprocessed line of a dialect.
 * Different dialects plug in different parameter and condition grammars.
 */
public interface LineParser {

	/**
	 * Decodes one non-blank, preprocessed line.
	 *
	 * @param lineNumber 1-based physical line number
	 * @param line the preprocessed line
	 * @return the fragments on this line; empty if the line holds no recognised construct
	 * @throws ConfigSpaceParseException if the line looks like a construct but matches no grammar
	 */
	List<LineFragment> parseLine(int lineNumber, String line) throws ConfigSpaceParseException;
}
