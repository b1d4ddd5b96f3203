package org.rubyshift.transpiler.pragma;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.rubyshift.transpiler.annotation.AnnotationStore;
import org.rubyshift.transpiler.annotation.Comment;
import org.rubyshift.transpiler.annotation.LineKey;
import org.rubyshift.transpiler.api.SourceLocation;
import org.rubyshift.transpiler.ast.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers "does this node's line carry pragma P?".
 * <p>
 * The engine reads the raw comment log of an {@link AnnotationStore} incrementally: every
 * query first scans the comments appended since the previous query, so comments contributed
 * by files inlined mid-traversal become visible without rescanning earlier ones.
 */
public class PragmaEngine {

    private static final Logger log = LoggerFactory.getLogger(PragmaEngine.class);

    private static final Pattern PRAGMA_PATTERN = Pattern.compile("#\\s*Pragma:\\s*(\\S+)", Pattern.CASE_INSENSITIVE);

    private final AnnotationStore annotations;
    private final Map<LineKey, Set<Pragma>> pragmas = new HashMap<>();
    private int scannedCount;

    public PragmaEngine(AnnotationStore annotations) {
        this.annotations = annotations;
    }

    /**
     * Checks whether the line a node starts on carries the given pragma.
     * <p>
     * The (file, line) key is authoritative. Only when no pragma at all is recorded for it is
     * the file-less key for the same line consulted.
     *
     * @return {@code false} for nodes without location.
     */
    public boolean hasPragma(Node node, Pragma pragma) {
        if (node == null || !node.hasLocation()) {
            return false;
        }
        return pragmasAt(node.location()).contains(pragma);
    }

    /**
     * @return The pragmas in effect for the line of {@code location}.
     */
    public Set<Pragma> pragmasAt(SourceLocation location) {
        scan();
        LineKey key = LineKey.of(location);
        Set<Pragma> qualified = pragmas.get(key);
        if (qualified != null && !qualified.isEmpty()) {
            return qualified;
        }
        Set<Pragma> fallback = pragmas.get(key.withoutFile());
        return fallback != null ? fallback : Set.of();
    }

    /**
     * Scans the comments appended since the last scan.
     */
    void scan() {
        if (annotations.size() == scannedCount) {
            return;
        }
        for (Comment comment : annotations.commentsSince(scannedCount)) {
            if (comment.location() == null) {
                continue;
            }
            Matcher matcher = PRAGMA_PATTERN.matcher(comment.text());
            if (!matcher.find()) {
                continue;
            }
            String name = matcher.group(1);
            Pragma.fromName(name).ifPresentOrElse(
                    pragma -> pragmas.computeIfAbsent(LineKey.of(comment.location()), k -> EnumSet.noneOf(Pragma.class)).add(pragma),
                    () -> log.debug("Ignoring unknown pragma '{}' at {}", name, comment.location()));
        }
        scannedCount = annotations.size();
    }

    int scannedCount() {
        return scannedCount;
    }
}
