package org.rubyshift.transpiler.parser;

/**
 * Turns source text into a tree plus its raw comments.
 */
public interface SourceParser {

    /**
     * @param source   The source text.
     * @param fileName The logical file name recorded in every location, or {@code null}.
     * @return The parsed tree and comments.
     * @throws SourceParseException If the source is malformed.
     */
    ParseResult parse(String source, String fileName);
}
