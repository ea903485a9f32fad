// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An associative collection of {@link MapEntry} values with unique keys.
 * <p>
 * Maps are equal to any other map with the same entries, whatever their implementation.
 */
public interface PersistentMap<K, V> extends Associative<K, V>, PersistentCollection<MapEntry<K, V>> {
    /**
     * Returns the value associated with the key, or {@code null} if there is none. Use
     * {@link #find(Object)} or {@link #valAt(Object, Object)} when {@code null} values matter.
     */
    @Nullable V get(@Nullable Object key);

    @Override
    @CheckReturnValue
    PersistentMap<K, V> assoc(K key, V value);

    /**
     * Returns a map without the key; returns this map if the key is absent.
     */
    @CheckReturnValue
    PersistentMap<K, V> without(@Nullable Object key);

    /**
     * Same as associating the entry's key with its value.
     */
    @Override
    @CheckReturnValue
    PersistentMap<K, V> conj(MapEntry<K, V> entry);

    @Override
    PersistentMap<K, V> cleared();

    /**
     * Returns a lazy sequence of the keys, in entry order.
     */
    Sequence<K> keys();

    /**
     * Returns a lazy sequence of the values, in entry order.
     */
    Sequence<V> values();
}
