// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import java.util.Iterator;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An unordered persistent set: a {@link PersistentHashMap} mapping each member to itself.
 */
public final class PersistentHashSet<T> extends ImmutableCollection<T> implements PersistentSet<T>, Counted {
    private PersistentHashSet(final PersistentHashMap<T, T> map) {
        this.map = map;
    }

    @SuppressWarnings("unchecked")
    public static <T> PersistentHashSet<T> empty() {
        return (PersistentHashSet<T>) empty;
    }

    @SafeVarargs
    public static <T> PersistentHashSet<T> of(final T... elements) {
        PersistentHashSet<T> result = empty();
        for (final var element : elements) {
            result = result.conj(element);
        }
        return result;
    }

    public static <T> PersistentHashSet<T> fromIterable(final Iterable<? extends T> iterable) {
        PersistentHashSet<T> result = empty();
        for (final var element : iterable) {
            result = result.conj(element);
        }
        return result;
    }

    @Override
    public long count() {
        return map.count();
    }

    @Override
    public boolean isEmpty() {
        return map.isEmpty();
    }

    @Override
    public boolean contains(final @Nullable Object element) {
        return map.containsKey(element);
    }

    @Override
    public @Nullable T get(final @Nullable Object element) {
        final var entry = map.find(element);
        return (entry == null) ? null : entry.key();
    }

    /**
     * Returns a set with the element added; returns this set if an equal member is already present, keeping the
     * stored member.
     */
    @Override
    public PersistentHashSet<T> conj(final T element) {
        if (map.containsKey(element)) {
            return this;
        }
        return new PersistentHashSet<>(map.assoc(element, element));
    }

    @Override
    public PersistentHashSet<T> disj(final @Nullable Object element) {
        final var newMap = map.without(element);
        return (newMap == map) ? this : new PersistentHashSet<>(newMap);
    }

    @Override
    public PersistentHashSet<T> cleared() {
        return empty();
    }

    @Override
    public Sequence<T> seq() {
        return map.keys();
    }

    @Override
    public @NonNull Iterator<T> iterator() {
        return seq().iterator();
    }

    @Override
    public boolean equals(final @Nullable Object object) {
        return Equivalence.setEquals(this, object);
    }

    @Override
    public int hashCode() {
        return Equivalence.setHash(this);
    }

    @Override
    public String toString() {
        return printElements("#{", "}");
    }

    private static final PersistentHashSet<?> empty = new PersistentHashSet<>(PersistentHashMap.empty());

    private final PersistentHashMap<T, T> map;
}
