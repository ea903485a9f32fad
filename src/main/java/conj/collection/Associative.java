// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The Associative abstraction: values found by key. Maps are associative by key, vectors by index.
 */
public interface Associative<K, V> {
    /**
     * Returns the value associated with the key, or {@code notFound} if there is none.
     * <p>
     * Pass {@link Absent#MARKER} to tell a missing key apart from one associated with {@code null}.
     */
    @Nullable Object valAt(@Nullable Object key, @Nullable Object notFound);

    /**
     * Returns the entry for the key, or {@code null} if there is none. A returned entry may hold a {@code null} value.
     */
    @Nullable MapEntry<K, V> find(@Nullable Object key);

    boolean containsKey(@Nullable Object key);

    @CheckReturnValue
    Associative<K, V> assoc(K key, V value);
}
