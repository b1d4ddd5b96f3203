package org.rubyshift.transpiler.parser;

import java.util.ArrayList;
import java.util.List;

import org.rubyshift.transpiler.annotation.Comment;
import org.rubyshift.transpiler.api.SourceLocation;

/**
 * Converts s-expression source text into tokens, collecting comments on the side.
 */
public class SexpLexer {

    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();
    private final List<Comment> comments = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startColumn = 1;
    private boolean tokenOnLine = false;

    /**
     * @param source   The source text.
     * @param fileName The logical file name recorded in locations, may be {@code null}.
     */
    public SexpLexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    /**
     * Tokenizes the whole source.
     *
     * @return The tokens, terminated by {@link TokenType#END_OF_FILE}.
     * @throws SourceParseException On unterminated strings or malformed numbers.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, column, fileName));
        return tokens;
    }

    /**
     * @return The comments seen by {@link #scanTokens()}, in source order.
     */
    public List<Comment> comments() {
        return comments;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(' -> addToken(TokenType.LEFT_PAREN, null);
            case ')' -> addToken(TokenType.RIGHT_PAREN, null);
            case '[' -> addToken(TokenType.LEFT_BRACKET, null);
            case ']' -> addToken(TokenType.RIGHT_BRACKET, null);
            case '"' -> addToken(TokenType.STRING, string());
            case ':' -> atom();
            case '#' -> comment();
            case ' ', '\r', '\t', ',' -> {
                // whitespace
            }
            case '\n' -> {
                line++;
                column = 1;
                tokenOnLine = false;
            }
            default -> {
                if (isDigit(c) || (c == '-' && isDigit(peek()))) {
                    number();
                } else {
                    word();
                }
            }
        }
    }

    private void comment() {
        while (peek() != '\n' && !isAtEnd()) {
            advance();
        }
        String text = source.substring(start, current).stripTrailing();
        comments.add(new Comment(text, location(), !tokenOnLine));
    }

    private String string() {
        StringBuilder value = new StringBuilder();
        while (peek() != '"') {
            if (isAtEnd()) {
                throw new SourceParseException("Unterminated string", location());
            }
            char c = advance();
            if (c == '\n') {
                line++;
                column = 1;
            }
            if (c == '\\' && !isAtEnd()) {
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case 'r' -> value.append('\r');
                    default -> value.append(escaped);
                }
            } else {
                value.append(c);
            }
        }
        advance();
        return value.toString();
    }

    private void atom() {
        if (peek() == '"') {
            advance();
            addToken(TokenType.ATOM, string());
            return;
        }
        while (!isAtEnd() && !isDelimiter(peek())) {
            advance();
        }
        String name = source.substring(start + 1, current);
        if (name.isEmpty()) {
            throw new SourceParseException("Empty atom", location());
        }
        addToken(TokenType.ATOM, name);
    }

    private void number() {
        while (isDigit(peek())) {
            advance();
        }
        boolean isFloat = false;
        if (peek() == '.' && isDigit(peekNext())) {
            isFloat = true;
            advance();
            while (isDigit(peek())) {
                advance();
            }
        }
        if (peek() == 'e' || peek() == 'E') {
            isFloat = true;
            advance();
            if (peek() == '-' || peek() == '+') {
                advance();
            }
            while (isDigit(peek())) {
                advance();
            }
        }
        String text = source.substring(start, current);
        try {
            if (isFloat) {
                addToken(TokenType.FLOAT, Double.parseDouble(text));
            } else {
                addToken(TokenType.INTEGER, Long.parseLong(text));
            }
        } catch (NumberFormatException e) {
            throw new SourceParseException("Invalid number: " + text, location());
        }
    }

    private void word() {
        while (!isAtEnd() && !isDelimiter(peek())) {
            advance();
        }
        String text = source.substring(start, current);
        switch (text) {
            case "nil" -> addToken(TokenType.NIL, null);
            case "true" -> addToken(TokenType.BOOLEAN, Boolean.TRUE);
            case "false" -> addToken(TokenType.BOOLEAN, Boolean.FALSE);
            default -> addToken(TokenType.IDENTIFIER, text);
        }
    }

    private void addToken(TokenType type, Object value) {
        tokens.add(new Token(type, source.substring(start, current), value, tokenLine(), startColumn, fileName));
        tokenOnLine = true;
    }

    private int tokenLine() {
        int newlines = 0;
        for (int i = start; i < current; i++) {
            if (source.charAt(i) == '\n') {
                newlines++;
            }
        }
        return line - newlines;
    }

    private SourceLocation location() {
        return new SourceLocation(fileName, tokenLine(), startColumn);
    }

    private static boolean isDelimiter(char c) {
        return Character.isWhitespace(c) || c == '(' || c == ')' || c == '[' || c == ']' || c == '"' || c == '#' || c == ',';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private char advance() {
        column++;
        return source.charAt(current++);
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(current);
    }

    private char peekNext() {
        return current + 1 >= source.length() ? '\0' : source.charAt(current + 1);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }
}
