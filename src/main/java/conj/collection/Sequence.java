// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The Sequence abstraction: a first element and the rest.
 * <p>
 * Implementations may be lazy: {@link #rest()} never forces more than the current cell, while {@link #next()} also
 * forces the head of the tail to tell whether anything remains.
 */
public interface Sequence<T> extends PersistentCollection<T>, Sequential {
    /**
     * Returns the first element, or {@code null} if the sequence is empty.
     */
    @Nullable T first();

    /**
     * Returns everything after the first element, possibly empty, without realizing any of it.
     */
    Sequence<T> rest();

    /**
     * Returns everything after the first element, or {@code null} if nothing remains.
     */
    @Nullable Sequence<T> next();

    /**
     * Returns a sequence with the given element in front of this one.
     */
    @CheckReturnValue
    Sequence<T> cons(T element);

    /**
     * Same as {@link #cons(Object)}: sequences grow at the front.
     */
    @Override
    @CheckReturnValue
    Sequence<T> conj(T element);
}
