// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.destructure;

import java.util.Map;
import conj.collection.Absent;
import conj.collection.Associative;
import conj.collection.PersistentHashMap;
import conj.collection.PersistentSet;
import conj.collection.Sequence;
import conj.dispatch.Abstractions;
import conj.dispatch.Capability;
import conj.dispatch.UnsupportedCapabilityCondition;
import conj.util.annotation.Nullable;
import conj.util.condition.ConditionContext;

/**
 * One step of a {@link BindingPlan}: computes a value from values already stored in earlier slots.
 * <p>
 * {@link Absent#MARKER} flows through every extraction unchanged, so parts of a missing value are missing too.
 */
public sealed interface Extraction {
    /**
     * Computes this step's value from the slots filled so far.
     */
    @Nullable Object extract(@Nullable Object[] slots);

    /**
     * Views the slot's value as a sequence; empty sequences and {@code null} become {@link Absent#MARKER}.
     */
    record SequenceView(int source) implements Extraction {
        @Override
        public @Nullable Object extract(final @Nullable Object[] slots) {
            final var value = slots[source];
            if (value == Absent.MARKER) {
                return Absent.MARKER;
            }
            final var sequence = Abstractions.seq(value);
            return (sequence == null) ? Absent.MARKER : sequence;
        }
    }

    /**
     * Takes the first element of a sequence produced by {@link SequenceView} or {@link Next}.
     */
    record First(int source) implements Extraction {
        @Override
        public @Nullable Object extract(final @Nullable Object[] slots) {
            final var value = slots[source];
            return (value instanceof final Sequence<?> sequence) ? sequence.first() : Absent.MARKER;
        }
    }

    /**
     * Takes the elements after the first; {@link Absent#MARKER} when nothing remains.
     */
    record Next(int source) implements Extraction {
        @Override
        public @Nullable Object extract(final @Nullable Object[] slots) {
            final var value = slots[source];
            if (!(value instanceof final Sequence<?> sequence)) {
                return Absent.MARKER;
            }
            final var next = sequence.next();
            return (next == null) ? Absent.MARKER : next;
        }
    }

    /**
     * Turns a non-associative sequence of alternating keys and values into a map; leaves anything else alone.
     */
    record ToAssociative(int source) implements Extraction {
        @Override
        public @Nullable Object extract(final @Nullable Object[] slots) {
            final var value = slots[source];
            if (!(value instanceof final Sequence<?> sequence) || value instanceof Associative<?, ?>) {
                return value;
            }
            PersistentHashMap<@Nullable Object, @Nullable Object> result = PersistentHashMap.empty();
            Sequence<?> current = sequence;
            while (!current.isEmpty()) {
                final var key = current.first();
                final var rest = current.next();
                if (rest == null) {
                    throw new IllegalArgumentException("Keyword arguments need a value for key " + key);
                }
                result = result.assoc(key, rest.first());
                current = rest.rest();
            }
            return result;
        }
    }

    /**
     * Looks the selector up, falling back to the default when the key is absent. Presence decides, never the value:
     * a key present with {@code null} or {@code false} keeps that value.
     */
    record Lookup(
        int source,
        @Nullable Object selector,
        boolean hasDefault,
        @Nullable Object defaultValue
    ) implements Extraction {
        @Override
        public @Nullable Object extract(final @Nullable Object[] slots) {
            final var value = slots[source];
            final var found = (value == Absent.MARKER || value == null) ? Absent.MARKER : lookUp(value);
            return (found == Absent.MARKER && hasDefault) ? defaultValue : found;
        }

        private @Nullable Object lookUp(final Object value) {
            if (value instanceof final Associative<?, ?> associative) {
                return associative.valAt(selector, Absent.MARKER);
            }
            if (value instanceof final PersistentSet<?> set) {
                return set.contains(selector) ? set.get(selector) : Absent.MARKER;
            }
            if (value instanceof final Map<?, ?> map) {
                return map.containsKey(selector) ? map.get(selector) : Absent.MARKER;
            }
            if (selector instanceof final Number index && Abstractions.supports(value, Capability.SEQUENCEABLE)
                && !(value instanceof Sequence<?>)) {
                return Abstractions.nth(value, index.longValue(), Absent.MARKER);
            }
            throw ConditionContext.error(new UnsupportedCapabilityCondition(
                Capability.ASSOCIATIVE,
                "look up " + selector + " in",
                value
            ));
        }
    }

    /**
     * Passes the slot's value on unchanged.
     */
    record Copy(int source) implements Extraction {
        @Override
        public @Nullable Object extract(final @Nullable Object[] slots) {
            return slots[source];
        }
    }
}
