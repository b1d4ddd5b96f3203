package org.rubyshift.transpiler.filter.ordering;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * A filter's requirement on its position relative to other filters.
 */
public interface OrderingConstraint {

    /**
     * Applies the constraint for the filter {@code self}.
     *
     * @param self  The id of the constrained filter.
     * @param order The current order of filter ids.
     * @return The same list if the constraint is satisfied or does not apply, otherwise a new
     *         list with {@code self} moved.
     */
    List<String> apply(String self, List<String> order);

    /**
     * @return {@code true} if applying the constraint would leave {@code order} unchanged.
     */
    default boolean isSatisfied(String self, List<String> order) {
        return apply(self, order) == order;
    }

    static OrderingConstraint runAfter(String... anchors) {
        return new RunAfter(Set.of(anchors));
    }

    static OrderingConstraint runBefore(String... anchors) {
        return new RunBefore(Set.of(anchors));
    }

    /**
     * Run after the last present member of {@code anchors}.
     */
    record RunAfter(Set<String> anchors) implements OrderingConstraint {

        public RunAfter {
            anchors = Set.copyOf(anchors);
        }

        @Override
        public List<String> apply(String self, List<String> order) {
            int selfIndex = order.indexOf(self);
            int last = lastAnchor(self, order);
            if (selfIndex < 0 || last < 0 || selfIndex > last) {
                return order;
            }
            List<String> moved = new ArrayList<>(order);
            moved.remove(selfIndex);
            moved.add(lastAnchor(self, moved) + 1, self);
            return moved;
        }

        private int lastAnchor(String self, List<String> order) {
            int last = -1;
            for (int i = 0; i < order.size(); i++) {
                if (!order.get(i).equals(self) && anchors.contains(order.get(i))) {
                    last = i;
                }
            }
            return last;
        }
    }

    /**
     * Run before the earliest present member of {@code anchors}.
     */
    record RunBefore(Set<String> anchors) implements OrderingConstraint {

        public RunBefore {
            anchors = Set.copyOf(anchors);
        }

        @Override
        public List<String> apply(String self, List<String> order) {
            int selfIndex = order.indexOf(self);
            int first = firstAnchor(self, order);
            if (selfIndex < 0 || first < 0 || selfIndex < first) {
                return order;
            }
            List<String> moved = new ArrayList<>(order);
            moved.remove(selfIndex);
            moved.add(firstAnchor(self, moved), self);
            return moved;
        }

        private int firstAnchor(String self, List<String> order) {
            for (int i = 0; i < order.size(); i++) {
                if (!order.get(i).equals(self) && anchors.contains(order.get(i))) {
                    return i;
                }
            }
            return -1;
        }
    }
}
