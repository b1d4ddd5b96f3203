package org.rubyshift.transpiler.annotation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.rubyshift.transpiler.ast.Node;

/**
 * Comment bookkeeping shared by every file of one transpilation.
 * <p>
 * Raw comments form an append-only log; readers such as the pragma engine remember how far
 * they have read and only look at what was appended since. Node associations are keyed by
 * node identity and only ever grow: associating comments with a node that already has some
 * produces the union.
 */
public class AnnotationStore {

    private final List<Comment> raw = new ArrayList<>();
    private final Map<LineKey, Set<String>> byLine = new LinkedHashMap<>();
    private final Map<Node, List<Comment>> associations = new IdentityHashMap<>();

    /**
     * Appends raw comments to the log.
     */
    public void append(Collection<Comment> comments) {
        for (Comment comment : comments) {
            raw.add(comment);
            if (comment.location() != null) {
                byLine.computeIfAbsent(LineKey.of(comment.location()), k -> new LinkedHashSet<>()).add(comment.text());
            }
        }
    }

    /**
     * @return An unmodifiable view of the raw comment log.
     */
    public List<Comment> rawComments() {
        return Collections.unmodifiableList(raw);
    }

    public int size() {
        return raw.size();
    }

    /**
     * @return The comments appended at or after {@code index}.
     */
    public List<Comment> commentsSince(int index) {
        if (index >= raw.size()) {
            return List.of();
        }
        return Collections.unmodifiableList(raw.subList(index, raw.size()));
    }

    /**
     * @return The texts of all comments on the given line of the given file.
     */
    public Set<String> commentsAt(String fileName, int line) {
        Set<String> texts = byLine.get(new LineKey(fileName, line));
        return texts == null ? Set.of() : Collections.unmodifiableSet(texts);
    }

    /**
     * Associates comments with a node, unioning with any comments it already has.
     */
    public void associate(Node node, Collection<Comment> comments) {
        if (node == null || comments.isEmpty()) {
            return;
        }
        List<Comment> existing = associations.computeIfAbsent(node, k -> new ArrayList<>());
        for (Comment comment : comments) {
            if (!existing.contains(comment)) {
                existing.add(comment);
            }
        }
    }

    /**
     * Merges a whole association map, as produced when another file is parsed.
     */
    public void associateAll(Map<Node, List<Comment>> contribution) {
        contribution.forEach(this::associate);
    }

    /**
     * @return The comments associated with {@code node}, empty if none.
     */
    public List<Comment> commentsFor(Node node) {
        List<Comment> comments = node == null ? null : associations.get(node);
        return comments == null ? List.of() : Collections.unmodifiableList(comments);
    }

    public boolean hasComments(Node node) {
        return !commentsFor(node).isEmpty();
    }
}
