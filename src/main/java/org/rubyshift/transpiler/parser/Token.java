package org.rubyshift.transpiler.parser;

/**
 * A single token produced by the {@link SexpLexer}.
 *
 * @param type     The token kind.
 * @param text     The exact source text.
 * @param value    The decoded value of literals, {@code null} otherwise.
 * @param line     The line the token starts on.
 * @param column   The column the token starts at.
 * @param fileName The logical file name.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {
}
