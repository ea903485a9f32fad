// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import java.util.Comparator;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The Sorted abstraction: elements kept in comparator order, with range views in either direction.
 *
 * @param <K> The type the comparator orders.
 * @param <E> The element type: the key itself for sets, an entry for maps.
 */
public interface Sorted<K, E> extends Reversible<E> {
    Comparator<? super K> comparator();

    /**
     * Returns a lazy ascending sequence of the elements whose keys lie within the bounds. A {@code null} bound leaves
     * that side open.
     * <p>
     * Complexity: logarithmic time to find the start, then amortized constant time per element.
     */
    Sequence<E> range(@Nullable Bound<K> lower, @Nullable Bound<K> upper);

    /**
     * Returns a lazy descending sequence of the elements whose keys lie within the bounds.
     */
    Sequence<E> reverseRange(@Nullable Bound<K> lower, @Nullable Bound<K> upper);
}
