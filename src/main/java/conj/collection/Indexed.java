// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The Indexed abstraction: positional access in logarithmic or better time.
 */
public interface Indexed<T> {
    /**
     * Returns the element at the index.
     *
     * @throws IndexOutOfBoundsException If the index is negative or not less than the count.
     */
    T nth(long index);

    /**
     * Returns the element at the index, or {@code notFound} if the index is out of range.
     */
    @Nullable Object nth(long index, @Nullable Object notFound);
}
