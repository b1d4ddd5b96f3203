package org.rubyshift.transpiler.filter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

import org.rubyshift.transpiler.diagnostics.DiagnosticsEngine;
import org.rubyshift.transpiler.filter.features.combiner.CombinerFilter;
import org.rubyshift.transpiler.filter.features.pragma.PragmaFilter;
import org.rubyshift.transpiler.filter.features.require.RequireFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps filter ids to factories. Filters hold traversal state, so a fresh instance is created
 * for every transpilation.
 */
public class FilterRegistry {

    private static final Logger log = LoggerFactory.getLogger(FilterRegistry.class);

    /** The filters applied when none are configured. */
    public static final List<String> DEFAULT_FILTERS = List.of(RequireFilter.ID, PragmaFilter.ID);

    private final Map<String, Supplier<? extends Filter>> factories = new LinkedHashMap<>();

    /**
     * Registers a factory under an id, replacing any previous one.
     */
    public void register(String filterId, Supplier<? extends Filter> factory) {
        factories.put(filterId, factory);
    }

    public Optional<Supplier<? extends Filter>> get(String filterId) {
        return Optional.ofNullable(factories.get(filterId));
    }

    public Set<String> registeredIds() {
        return factories.keySet();
    }

    /**
     * Instantiates the named filters in the given order. Duplicates are dropped; unknown ids are
     * reported as warnings and skipped.
     */
    public List<Filter> create(List<String> filterIds, DiagnosticsEngine diagnostics) {
        List<Filter> filters = new ArrayList<>();
        for (String filterId : new LinkedHashSet<>(filterIds)) {
            Supplier<? extends Filter> factory = factories.get(filterId);
            if (factory == null) {
                log.warn("Unknown filter '{}', ignoring it", filterId);
                diagnostics.reportWarning("Unknown filter '" + filterId + "'", null, 0);
                continue;
            }
            filters.add(factory.get());
        }
        return filters;
    }

    /**
     * @return A registry with all bundled filters.
     */
    public static FilterRegistry initialize() {
        FilterRegistry registry = new FilterRegistry();
        registry.register(RequireFilter.ID, RequireFilter::new);
        registry.register(CombinerFilter.ID, CombinerFilter::new);
        registry.register(PragmaFilter.ID, PragmaFilter::new);
        return registry;
    }
}
