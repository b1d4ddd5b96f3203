package org.rubyshift.transpiler.filter.ordering;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.rubyshift.transpiler.filter.Filter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reorders a filter list so that every filter's {@link OrderingConstraint}s hold.
 * <p>
 * Constraints are applied in list order and, per filter, in declaration order. A satisfied
 * constraint, or one whose anchors are all absent, leaves the order alone. Passes repeat
 * until nothing moves, so resolving an already resolved list returns it unchanged.
 */
public final class OrderingResolver {

    private static final Logger log = LoggerFactory.getLogger(OrderingResolver.class);

    private OrderingResolver() {}

    /**
     * @param filters The configured filters.
     * @return The filters in resolved order.
     */
    public static List<Filter> resolve(List<Filter> filters) {
        Map<String, Filter> byId = new LinkedHashMap<>();
        Map<String, List<OrderingConstraint>> constraints = new LinkedHashMap<>();
        for (Filter filter : filters) {
            byId.put(filter.id(), filter);
            constraints.put(filter.id(), filter.orderingConstraints());
        }
        List<String> order = resolveIds(new ArrayList<>(byId.keySet()), constraints);
        List<Filter> resolved = new ArrayList<>(order.size());
        for (String id : order) {
            resolved.add(byId.get(id));
        }
        return resolved;
    }

    /**
     * Resolves an order of ids against the constraints declared per id.
     */
    public static List<String> resolveIds(List<String> ids, Map<String, List<OrderingConstraint>> constraints) {
        List<String> declared = List.copyOf(ids);
        List<String> order = declared;
        int maxPasses = declared.size() + 1;
        for (int pass = 0; pass < maxPasses; pass++) {
            List<String> before = order;
            for (String id : declared) {
                for (OrderingConstraint constraint : constraints.getOrDefault(id, List.of())) {
                    List<String> next = constraint.apply(id, order);
                    if (next != order) {
                        log.debug("Moved filter '{}' to satisfy {}: {}", id, constraint, next);
                        order = next;
                    }
                }
            }
            if (order.equals(before)) {
                return order;
            }
        }
        log.warn("Filter ordering constraints conflict, using {}", order);
        return order;
    }
}
