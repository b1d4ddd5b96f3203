package org.rubyshift.transpiler.parser;

/**
 * Token kinds of the s-expression format.
 */
public enum TokenType {
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACKET, RIGHT_BRACKET,
    IDENTIFIER, ATOM, STRING, INTEGER, FLOAT, BOOLEAN, NIL,
    END_OF_FILE
}
