package org.rubyshift.transpiler.parser;

import java.util.List;

import org.rubyshift.transpiler.annotation.Comment;
import org.rubyshift.transpiler.ast.Node;

/**
 * The product of parsing one source.
 *
 * @param root     The root node, or {@code null} for an empty source.
 * @param comments All comments of the source, in source order.
 */
public record ParseResult(Node root, List<Comment> comments) {

    public ParseResult {
        comments = List.copyOf(comments);
    }
}
