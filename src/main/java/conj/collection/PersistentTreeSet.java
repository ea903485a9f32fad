// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import java.util.Comparator;
import java.util.Iterator;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A persistent set kept sorted by a comparator: a {@link PersistentTreeMap} mapping each member to itself.
 */
public final class PersistentTreeSet<T> extends ImmutableCollection<T>
    implements PersistentSet<T>, Sorted<T, T>, Counted {
    private PersistentTreeSet(final PersistentTreeMap<T, T> map) {
        this.map = map;
    }

    /**
     * Returns an empty set ordered by {@link Comparison#natural()}.
     */
    @SuppressWarnings("unchecked")
    public static <T> PersistentTreeSet<T> empty() {
        return (PersistentTreeSet<T>) empty;
    }

    public static <T> PersistentTreeSet<T> empty(final Comparator<? super T> comparator) {
        return new PersistentTreeSet<>(PersistentTreeMap.empty(comparator));
    }

    @SafeVarargs
    public static <T> PersistentTreeSet<T> of(final T... elements) {
        PersistentTreeSet<T> result = empty();
        for (final var element : elements) {
            result = result.conj(element);
        }
        return result;
    }

    public static <T> PersistentTreeSet<T> fromIterable(
        final Comparator<? super T> comparator,
        final Iterable<? extends T> iterable
    ) {
        var result = PersistentTreeSet.<T>empty(comparator);
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
    public Comparator<? super T> comparator() {
        return map.comparator();
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

    @Override
    public PersistentTreeSet<T> conj(final T element) {
        if (map.containsKey(element)) {
            return this;
        }
        return new PersistentTreeSet<>(map.assoc(element, element));
    }

    @Override
    public PersistentTreeSet<T> disj(final @Nullable Object element) {
        final var newMap = map.without(element);
        return (newMap == map) ? this : new PersistentTreeSet<>(newMap);
    }

    @Override
    public PersistentTreeSet<T> cleared() {
        return map.isEmpty() ? this : new PersistentTreeSet<>(map.cleared());
    }

    public @Nullable T firstElement() {
        final var entry = map.firstEntry();
        return (entry == null) ? null : entry.key();
    }

    public @Nullable T lastElement() {
        final var entry = map.lastEntry();
        return (entry == null) ? null : entry.key();
    }

    @Override
    public Sequence<T> seq() {
        return map.walk(true, AvlTree.Node::key);
    }

    @Override
    public Sequence<T> rseq() {
        return map.walk(false, AvlTree.Node::key);
    }

    @Override
    public Sequence<T> range(final @Nullable Bound<T> lower, final @Nullable Bound<T> upper) {
        return map.rangeOf(lower, upper, true, AvlTree.Node::key);
    }

    @Override
    public Sequence<T> reverseRange(final @Nullable Bound<T> lower, final @Nullable Bound<T> upper) {
        return map.rangeOf(lower, upper, false, AvlTree.Node::key);
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

    PersistentTreeMap<T, T> map() {
        return map;
    }

    private static final PersistentTreeSet<?> empty = new PersistentTreeSet<>(PersistentTreeMap.empty());

    private final PersistentTreeMap<T, T> map;
}
