package org.rubyshift.transpiler.filter;

import java.util.Map;

/**
 * Synthetic tags introduced by filters, mapped to the tag whose handlers apply when no filter
 * handles the synthetic tag itself.
 */
public final class TagAliases {

    private static final Map<String, String> CANONICAL = Map.ofEntries(
            Map.entry("hide", "begin"),
            Map.entry("call", "send"),
            Map.entry("attr", "send"),
            Map.entry("await", "send"),
            Map.entry("csend", "send"),
            Map.entry("nullish_or", "or"),
            Map.entry("logical_or", "or"),
            Map.entry("nullish_asgn", "or_asgn"),
            Map.entry("logical_asgn", "or_asgn"),
            Map.entry("deff", "def"),
            Map.entry("async", "def"),
            Map.entry("constructor", "def"),
            Map.entry("defm", "defs"),
            Map.entry("defp", "defs"),
            Map.entry("for_of", "for"),
            Map.entry("module_hash", "module"),
            Map.entry("class_hash", "class"),
            Map.entry("numblock", "block"));

    private TagAliases() {}

    /**
     * @return The canonical tag for a synthetic tag, or {@code null} if {@code tag} is not an alias.
     */
    public static String canonical(String tag) {
        return CANONICAL.get(tag);
    }
}
