package org.rubyshift.transpiler.parser;

import java.util.ArrayList;
import java.util.List;

import org.rubyshift.transpiler.api.SourceLocation;
import org.rubyshift.transpiler.ast.Atom;
import org.rubyshift.transpiler.ast.Node;

/**
 * Parses the s-expression dump format into nodes.
 * <p>
 * Grammar: {@code (tag child*)} for nodes, {@code [value*]} for lists, {@code nil},
 * {@code true}/{@code false}, integers, floats, {@code "strings"} and {@code :atoms}.
 * {@code #} starts a comment running to the end of the line. Several top-level nodes are
 * wrapped in an unlocated {@code begin}. Each parsed node is located at its opening parenthesis.
 */
public class SexpParser implements SourceParser {

    @Override
    public ParseResult parse(String source, String fileName) {
        SexpLexer lexer = new SexpLexer(source, fileName);
        List<Token> tokens = lexer.scanTokens();
        Node root = new Reader(tokens).program();
        return new ParseResult(root, lexer.comments());
    }

    /**
     * Recursive-descent reader over one token list.
     */
    private static final class Reader {

        private final List<Token> tokens;
        private int current = 0;

        Reader(List<Token> tokens) {
            this.tokens = tokens;
        }

        Node program() {
            List<Node> statements = new ArrayList<>();
            while (peek().type() != TokenType.END_OF_FILE) {
                Token first = peek();
                Object value = value();
                if (!(value instanceof Node node)) {
                    throw new SourceParseException("Expected a node at top level but found '" + first.text() + "'", locationOf(first));
                }
                statements.add(node);
            }
            if (statements.isEmpty()) {
                return null;
            }
            if (statements.size() == 1) {
                return statements.get(0);
            }
            return Node.of("begin", statements);
        }

        private Object value() {
            Token token = advance();
            return switch (token.type()) {
                case LEFT_PAREN -> node(token);
                case LEFT_BRACKET -> list();
                case NIL -> null;
                case BOOLEAN, INTEGER, FLOAT, STRING -> token.value();
                case ATOM -> Atom.of((String) token.value());
                case END_OF_FILE -> throw new SourceParseException("Unexpected end of input", locationOf(token));
                default -> throw new SourceParseException("Unexpected '" + token.text() + "'", locationOf(token));
            };
        }

        private Node node(Token open) {
            Token tag = advance();
            if (tag.type() != TokenType.IDENTIFIER) {
                throw new SourceParseException("Expected a tag after '(' but found '" + tag.text() + "'", locationOf(tag));
            }
            List<Object> children = new ArrayList<>();
            while (peek().type() != TokenType.RIGHT_PAREN) {
                if (peek().type() == TokenType.END_OF_FILE) {
                    throw new SourceParseException("Unclosed '(" + tag.text() + "'", locationOf(open));
                }
                children.add(value());
            }
            advance();
            return new Node((String) tag.value(), children, locationOf(open));
        }

        private List<Object> list() {
            List<Object> elements = new ArrayList<>();
            while (peek().type() != TokenType.RIGHT_BRACKET) {
                if (peek().type() == TokenType.END_OF_FILE) {
                    throw new SourceParseException("Unclosed '['", locationOf(peek()));
                }
                elements.add(value());
            }
            advance();
            return elements;
        }

        private Token advance() {
            Token token = tokens.get(current);
            if (token.type() != TokenType.END_OF_FILE) {
                current++;
            }
            return token;
        }

        private Token peek() {
            return tokens.get(current);
        }

        private static SourceLocation locationOf(Token token) {
            return new SourceLocation(token.fileName(), token.line(), token.column());
        }
    }
}
