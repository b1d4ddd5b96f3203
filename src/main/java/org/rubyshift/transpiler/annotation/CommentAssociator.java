package org.rubyshift.transpiler.annotation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.rubyshift.transpiler.ast.Node;
import org.rubyshift.transpiler.ast.Nodes;

/**
 * Associates leading comments with the nearest following node.
 * <p>
 * Only comments standing on a line of their own are considered. A comment belongs to the
 * outermost node that starts on the first line below it that carries any node; nodes
 * without location are never associated.
 */
public final class CommentAssociator {

    private static final Comparator<Node> BY_POSITION = Comparator
            .comparingInt((Node n) -> n.location().line())
            .thenComparingInt(n -> n.location().column());

    private CommentAssociator() {}

    /**
     * @param root     The tree whose nodes may receive comments, may be {@code null}.
     * @param comments Candidate comments.
     * @return The associations, keyed by node identity.
     */
    public static Map<Node, List<Comment>> associate(Node root, List<Comment> comments) {
        Map<Node, List<Comment>> result = new IdentityHashMap<>();
        if (root == null || comments.isEmpty()) {
            return result;
        }

        Map<String, List<Node>> nodesByFile = new HashMap<>();
        Nodes.walk(root, node -> {
            if (node.hasLocation()) {
                nodesByFile.computeIfAbsent(fileKey(node.location().fileName()), k -> new ArrayList<>()).add(node);
            }
        });
        nodesByFile.values().forEach(list -> list.sort(BY_POSITION));

        for (Comment comment : comments) {
            if (!comment.ownLine() || comment.location() == null) {
                continue;
            }
            List<Node> candidates = nodesByFile.get(fileKey(comment.fileName()));
            Node target = candidates == null ? null : firstAfterLine(candidates, comment.line());
            if (target != null) {
                result.computeIfAbsent(target, k -> new ArrayList<>()).add(comment);
            }
        }
        return result;
    }

    private static Node firstAfterLine(List<Node> sorted, int line) {
        int low = 0;
        int high = sorted.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (sorted.get(mid).location().line() <= line) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low < sorted.size() ? sorted.get(low) : null;
    }

    private static String fileKey(String fileName) {
        return Objects.requireNonNullElse(fileName, "");
    }
}
