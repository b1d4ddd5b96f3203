package org.rubyshift.transpiler.filter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Which method-call rewrites filters may apply.
 * <p>
 * Starts out including everything. {@link #includeOnly(Collection)} switches to an explicit
 * allow-list; while an allow-list is active, {@link #include} and {@link #exclude} edit it,
 * otherwise they edit the deny-list.
 */
public class MethodSelection {

    private Set<String> included;
    private final Set<String> excluded = new LinkedHashSet<>();

    public void includeAll() {
        included = null;
        excluded.clear();
    }

    public void includeOnly(Collection<String> methods) {
        included = new LinkedHashSet<>(methods);
    }

    public void include(Collection<String> methods) {
        if (included != null) {
            included.addAll(methods);
        } else {
            excluded.removeAll(methods);
        }
    }

    public void exclude(Collection<String> methods) {
        if (included != null) {
            included.removeAll(methods);
        } else {
            excluded.addAll(methods);
        }
    }

    public boolean isExcluded(String method) {
        if (included != null) {
            return !included.contains(method);
        }
        return excluded.contains(method);
    }

    /**
     * Builds a selection by applying the options in the order include-all, include-only,
     * include, exclude.
     */
    public static MethodSelection of(boolean includeAll, List<String> includeOnly, List<String> include, List<String> exclude) {
        MethodSelection selection = new MethodSelection();
        if (includeAll) {
            selection.includeAll();
        }
        if (!includeOnly.isEmpty()) {
            selection.includeOnly(includeOnly);
        }
        selection.include(include);
        selection.exclude(exclude);
        return selection;
    }

    @Override
    public String toString() {
        return included != null ? "only " + new ArrayList<>(included) : "all except " + new ArrayList<>(excluded);
    }
}
