// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import edu.umd.cs.findbugs.annotations.CheckReturnValue;

/**
 * The Collection abstraction: an immutable value that can be counted, extended and viewed as a {@link Sequence}.
 * <p>
 * Every implementation is persistent: {@link #conj(Object)} returns a new collection and leaves this one untouched.
 */
public interface PersistentCollection<T> extends Iterable<T> {
    /**
     * Returns the number of elements.
     * <p>
     * Constant time for every collection except lazy and concatenated sequences, where it walks, and so realizes, the
     * whole sequence.
     */
    long count();

    boolean isEmpty();

    /**
     * Adds an element where this kind of collection adds most cheaply: the end of a vector, the front of a list or
     * sequence, anywhere for sets and maps.
     */
    @CheckReturnValue
    PersistentCollection<T> conj(T element);

    /**
     * Returns an empty collection of the same kind, keeping configuration such as the comparator of sorted
     * collections.
     */
    PersistentCollection<T> cleared();

    /**
     * Returns a sequence over the elements; empty collections return an empty sequence.
     */
    Sequence<T> seq();
}
