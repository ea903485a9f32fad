// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import java.util.Iterator;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A key and its value, as stored by maps.
 * <p>
 * An entry is also a two-element sequential collection: it equals, and hashes like, the vector {@code [key value]},
 * and positional destructuring takes it apart like one.
 */
public final class MapEntry<K, V> extends ImmutableCollection<@Nullable Object>
    implements Indexed<@Nullable Object>, Reversible<@Nullable Object>, Sequential, Counted {
    private MapEntry(final K key, final V value) {
        this.key = key;
        this.value = value;
    }

    public static <K, V> MapEntry<K, V> of(final K key, final V value) {
        return new MapEntry<>(key, value);
    }

    public K key() {
        return key;
    }

    public V value() {
        return value;
    }

    @Override
    public long count() {
        return 2;
    }

    @Override
    public boolean isEmpty() {
        return false;
    }

    @Override
    public @Nullable Object nth(final long index) {
        return (Objects.checkIndex(index, 2) == 0) ? key : value;
    }

    @Override
    public @Nullable Object nth(final long index, final @Nullable Object notFound) {
        if (index == 0) {
            return key;
        }
        return (index == 1) ? value : notFound;
    }

    /**
     * Returns the three-element vector of the key, the value and the new element.
     */
    @Override
    public PersistentVector<@Nullable Object> conj(final @Nullable Object element) {
        return toVector().conj(element);
    }

    @Override
    public PersistentVector<@Nullable Object> cleared() {
        return PersistentVector.empty();
    }

    @Override
    public Sequence<@Nullable Object> seq() {
        return PersistentList.of(key, value);
    }

    @Override
    public Sequence<@Nullable Object> rseq() {
        return PersistentList.of(value, key);
    }

    /**
     * Returns the vector {@code [key value]}.
     */
    public PersistentVector<@Nullable Object> toVector() {
        return PersistentVector.of(key, value);
    }

    @Override
    public @NonNull Iterator<@Nullable Object> iterator() {
        return seq().iterator();
    }

    @Override
    public boolean equals(final @Nullable Object object) {
        return Equivalence.sequentialEquals(this, object);
    }

    @Override
    public int hashCode() {
        return Equivalence.sequentialHash(this);
    }

    @Override
    public String toString() {
        return printElements("[", "]");
    }

    private final K key;
    private final V value;
}
