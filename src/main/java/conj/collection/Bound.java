// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

/**
 * One end of a range over a {@link Sorted} collection.
 *
 * @param key       The key the range starts or stops at.
 * @param inclusive Whether an element equal to the key belongs to the range.
 */
public record Bound<K>(K key, boolean inclusive) {
    public static <K> Bound<K> inclusive(final K key) {
        return new Bound<>(key, true);
    }

    public static <K> Bound<K> exclusive(final K key) {
        return new Bound<>(key, false);
    }

    // The comparison is compare(element, key).
    boolean admitsAsLower(final int comparison) {
        return inclusive ? comparison >= 0 : comparison > 0;
    }

    boolean admitsAsUpper(final int comparison) {
        return inclusive ? comparison <= 0 : comparison < 0;
    }
}
