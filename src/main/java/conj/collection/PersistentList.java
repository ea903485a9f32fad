// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An immutable singly linked list that knows its length.
 * <p>
 * {@link #conj(Object)}, {@link #peek()} and {@link #pop()} all work at the front, in constant time. {@code null}
 * elements are allowed.
 */
public final class PersistentList<T> extends AbstractSequence<T> implements PersistentStack<T>, Counted {
    private PersistentList(final @Nullable T head, final @Nullable PersistentList<T> tail, final int count) {
        this.head = head;
        this.tail = tail;
        this.count = count;
    }

    @SuppressWarnings("unchecked")
    public static <T> PersistentList<T> empty() {
        return (PersistentList<T>) empty;
    }

    /**
     * Returns a list of the given elements, in order.
     * <p>
     * Complexity: linear time.
     */
    @SafeVarargs
    public static <T> PersistentList<T> of(final T... elements) {
        PersistentList<T> list = empty();
        for (int i = elements.length - 1; i >= 0; i -= 1) {
            list = list.cons(elements[i]);
        }
        return list;
    }

    /**
     * Returns a list of the elements of the iterable, in iteration order.
     * <p>
     * Complexity: linear time.
     */
    public static <T> PersistentList<T> fromIterable(final Iterable<? extends T> iterable) {
        PersistentList<T> reversed = empty();
        for (final var element : iterable) {
            reversed = reversed.cons(element);
        }
        return reversed.reversed();
    }

    @Override
    public long count() {
        return count;
    }

    @Override
    public boolean isEmpty() {
        return count == 0;
    }

    @Override
    public @Nullable T first() {
        return head;
    }

    @Override
    public PersistentList<T> rest() {
        return (tail == null) ? this : tail;
    }

    @Override
    public @Nullable PersistentList<T> next() {
        return (count > 1) ? tail : null;
    }

    /**
     * Complexity: constant time.
     */
    @Override
    public PersistentList<T> cons(final T element) {
        return new PersistentList<>(element, this, count + 1);
    }

    @Override
    public @Nullable T peek() {
        return head;
    }

    /**
     * Complexity: constant time.
     */
    @Override
    public PersistentList<T> pop() {
        if (tail == null) {
            throw new IllegalStateException("Cannot pop an empty list");
        }
        return tail;
    }

    /**
     * Returns a list of the same elements in reverse order.
     * <p>
     * Complexity: linear time.
     */
    public PersistentList<T> reversed() {
        PersistentList<T> result = empty();
        for (var current = this; current.tail != null; current = current.tail) {
            result = result.cons(current.head);
        }
        return result;
    }

    private static final PersistentList<?> empty = new PersistentList<>(null, null, 0);

    private final @Nullable T head;
    // Null only for the empty list.
    private final @Nullable PersistentList<T> tail;
    private final int count;
}
