// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The Set abstraction: distinct members, membership tests and removal.
 * <p>
 * Sets are equal to any other set with the same members, whatever their implementation.
 */
public interface PersistentSet<T> extends PersistentCollection<T> {
    boolean contains(@Nullable Object element);

    /**
     * Returns the stored member equal to the given value, or {@code null} if there is none.
     */
    @Nullable T get(@Nullable Object element);

    @Override
    @CheckReturnValue
    PersistentSet<T> conj(T element);

    /**
     * Returns a set without the given element; returns this set if the element is not a member.
     */
    @CheckReturnValue
    PersistentSet<T> disj(@Nullable Object element);

    @Override
    PersistentSet<T> cleared();
}
