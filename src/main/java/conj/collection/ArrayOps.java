// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import java.util.Arrays;
import org.checkerframework.checker.nullness.qual.Nullable;

final class ArrayOps {
    private ArrayOps() {
    }

    static @Nullable Object[] updated(final @Nullable Object[] array, final int index, final @Nullable Object element) {
        final var newArray = array.clone();
        newArray[index] = element;
        return newArray;
    }

    static @Nullable Object[] updated(
        final @Nullable Object[] array,
        final int firstIndex,
        final @Nullable Object first,
        final int secondIndex,
        final @Nullable Object second
    ) {
        final var newArray = array.clone();
        newArray[firstIndex] = first;
        newArray[secondIndex] = second;
        return newArray;
    }

    static @Nullable Object[] appended(final @Nullable Object[] array, final @Nullable Object element) {
        final var oldLength = array.length;
        final var newArray = Arrays.copyOf(array, oldLength + 1);
        newArray[oldLength] = element;
        return newArray;
    }

    static @Nullable Object[] withoutLast(final @Nullable Object[] array) {
        assert array.length > 0;
        return Arrays.copyOf(array, array.length - 1);
    }

    // Pair operations treat the array as consecutive (key, value) slots; pairIndex counts pairs, not slots.
    static @Nullable Object[] insertedPair(
        final @Nullable Object[] array,
        final int pairIndex,
        final @Nullable Object key,
        final @Nullable Object value
    ) {
        final var slot = 2 * pairIndex;
        final var newArray = new Object[array.length + 2];
        System.arraycopy(array, 0, newArray, 0, slot);
        newArray[slot] = key;
        newArray[slot + 1] = value;
        System.arraycopy(array, slot, newArray, slot + 2, array.length - slot);
        return newArray;
    }

    static @Nullable Object[] removedPair(final @Nullable Object[] array, final int pairIndex) {
        final var slot = 2 * pairIndex;
        final var newArray = new Object[array.length - 2];
        System.arraycopy(array, 0, newArray, 0, slot);
        System.arraycopy(array, slot + 2, newArray, slot, newArray.length - slot);
        return newArray;
    }

    static @Nullable Object[] appendedPair(
        final @Nullable Object[] array,
        final @Nullable Object key,
        final @Nullable Object value
    ) {
        return insertedPair(array, array.length / 2, key, value);
    }
}
