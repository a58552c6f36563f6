package com.rolebind.engine.resolve;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Result of resolving an activation: either a rejection, or the exact role
 * changes to apply.
 */
public sealed interface Outcome {

    record Rejected(RejectReason reason) implements Outcome {
    }

    /**
     * Roles to add and remove. The two sets are disjoint.
     */
    record Applied(Set<String> add, Set<String> remove) implements Outcome {

        private static final Applied EMPTY = new Applied(Set.of(), Set.of());

        public Applied {
            add = Collections.unmodifiableSet(new LinkedHashSet<>(add));
            remove = Collections.unmodifiableSet(new LinkedHashSet<>(remove));
        }

        public static Applied empty() {
            return EMPTY;
        }

        public boolean noop() {
            return add.isEmpty() && remove.isEmpty();
        }
    }

    static Rejected rejected(RejectReason reason) {
        return new Rejected(reason);
    }
}
