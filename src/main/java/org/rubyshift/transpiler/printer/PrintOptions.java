package org.rubyshift.transpiler.printer;

import org.rubyshift.transpiler.annotation.AnnotationStore;

/**
 * @param includeComments Print associated comments above top-level statements.
 * @param annotations     Where associated comments are looked up, may be {@code null} when comments are off.
 */
public record PrintOptions(boolean includeComments, AnnotationStore annotations) {

    public static PrintOptions plain() {
        return new PrintOptions(false, null);
    }
}
