// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.dispatch;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import conj.collection.Associative;
import conj.collection.Indexed;
import conj.collection.PersistentCollection;
import conj.collection.PersistentSet;
import conj.collection.PersistentStack;
import conj.collection.Reversible;
import conj.collection.Sequence;
import conj.collection.Sorted;
import conj.util.SimpleClassValue;
import conj.util.annotation.Nullable;

/**
 * Maps each concrete class to the set of capabilities its instances have.
 * <p>
 * The table is computed once per class from the interfaces the class implements and never changes afterwards.
 */
public final class CapabilityTable {
    private CapabilityTable() {
    }

    /**
     * Returns the capabilities of the value; {@code null} has none.
     */
    public static Set<Capability> of(final @Nullable Object value) {
        return (value == null) ? none : table.get(value.getClass());
    }

    public static Set<Capability> ofClass(final Class<?> clazz) {
        return table.get(clazz);
    }

    private static Set<Capability> compute(final Class<?> clazz) {
        final var result = EnumSet.noneOf(Capability.class);
        if (PersistentCollection.class.isAssignableFrom(clazz)) {
            result.add(Capability.COLLECTION);
        }
        if (PersistentCollection.class.isAssignableFrom(clazz) || Iterable.class.isAssignableFrom(clazz)
            || CharSequence.class.isAssignableFrom(clazz) || Object[].class.isAssignableFrom(clazz)) {
            result.add(Capability.SEQUENCEABLE);
        }
        if (Sequence.class.isAssignableFrom(clazz)) {
            result.add(Capability.SEQUENCE);
        }
        if (Associative.class.isAssignableFrom(clazz)) {
            result.add(Capability.ASSOCIATIVE);
        }
        if (Indexed.class.isAssignableFrom(clazz)) {
            result.add(Capability.INDEXED);
        }
        if (PersistentStack.class.isAssignableFrom(clazz)) {
            result.add(Capability.STACK);
        }
        if (PersistentSet.class.isAssignableFrom(clazz)) {
            result.add(Capability.SET);
        }
        if (Sorted.class.isAssignableFrom(clazz)) {
            result.add(Capability.SORTED);
        }
        if (Reversible.class.isAssignableFrom(clazz)) {
            result.add(Capability.REVERSIBLE);
        }
        return Collections.unmodifiableSet(result);
    }

    private static final Set<Capability> none = Collections.unmodifiableSet(EnumSet.noneOf(Capability.class));
    private static final SimpleClassValue<Set<Capability>> table = new SimpleClassValue<>(CapabilityTable::compute);
}
