// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Predicate;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The common base of the library's collections, making each of them a read-only {@link Collection}.
 * <p>
 * The mutating methods of {@link Collection} are unsupported: they always throw
 * {@link UnsupportedOperationException}. They are deprecated so the compiler flags accidental calls wherever the
 * static type is a persistent collection.
 */
public abstract class ImmutableCollection<T> implements Collection<T>, PersistentCollection<T> {
    ImmutableCollection() {
    }

    /**
     * Returns the count, saturated to {@link Integer#MAX_VALUE}. Prefer {@link #count()}.
     */
    @Override
    public final int size() {
        return (int) Long.min(count(), Integer.MAX_VALUE);
    }

    /**
     * Linear search, overridden with a key lookup by sets and maps.
     */
    @Override
    public boolean contains(final @Nullable Object object) {
        for (final var element : this) {
            if (Equivalence.equal(element, object)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public final boolean containsAll(final @NonNull Collection<?> collection) {
        for (final var element : collection) {
            if (!contains(element)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public final Object @NonNull [] toArray() {
        final var array = new Object[size()];
        var index = 0;
        for (final var element : this) {
            array[index] = element;
            index += 1;
        }
        return array;
    }

    @Override
    @SuppressWarnings("unchecked")
    public final <U> U @NonNull [] toArray(final U @NonNull [] array) {
        final var length = size();
        final var target = (array.length >= length) ? array : Arrays.copyOf(array, length);
        var index = 0;
        for (final var element : this) {
            target[index] = (U) element;
            index += 1;
        }
        if (target.length > length) {
            target[length] = null;
        }
        return target;
    }

    @Override
    public @NonNull Spliterator<T> spliterator() {
        return Spliterators.spliterator(iterator(), count(), Spliterator.ORDERED | Spliterator.IMMUTABLE);
    }

    /**
     * Unsupported; use {@link #conj(Object)}.
     */
    @Deprecated
    @Override
    public final boolean add(final T element) {
        throw unsupportedModification();
    }

    /**
     * Unsupported.
     */
    @Deprecated
    @Override
    public final boolean remove(final @Nullable Object object) {
        throw unsupportedModification();
    }

    /**
     * Unsupported.
     */
    @Deprecated
    @Override
    public final boolean addAll(final @NonNull Collection<? extends T> collection) {
        throw unsupportedModification();
    }

    /**
     * Unsupported.
     */
    @Deprecated
    @Override
    public final boolean removeAll(final @NonNull Collection<?> collection) {
        throw unsupportedModification();
    }

    /**
     * Unsupported.
     */
    @Deprecated
    @Override
    public final boolean removeIf(final @NonNull Predicate<? super T> filter) {
        throw unsupportedModification();
    }

    /**
     * Unsupported.
     */
    @Deprecated
    @Override
    public final boolean retainAll(final @NonNull Collection<?> collection) {
        throw unsupportedModification();
    }

    /**
     * Unsupported; use {@link #cleared()}.
     */
    @Deprecated
    @Override
    public final void clear() {
        throw unsupportedModification();
    }

    final String printElements(final String open, final String close) {
        final var builder = new StringBuilder(open);
        final Iterator<T> iterator = iterator();
        while (iterator.hasNext()) {
            builder.append(iterator.next());
            if (iterator.hasNext()) {
                builder.append(' ');
            }
        }
        return builder.append(close).toString();
    }

    private static UnsupportedOperationException unsupportedModification() {
        throw new UnsupportedOperationException("Persistent collections don't support in-place mutation");
    }
}
