// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import java.util.Iterator;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Operations producing and consuming sequences.
 * <p>
 * Unless documented otherwise the operations are lazy: they return at once, and each element is computed only when
 * something asks for it, so they work on infinite sequences too. Functions passed in are called at most once per
 * element, on whatever thread forces that element.
 */
public final class Sequences {
    private Sequences() {
    }

    /**
     * Returns a sequence of {@code element} followed by {@code more}, without forcing {@code more}.
     */
    public static <T> Sequence<T> cons(final T element, final Sequence<? extends T> more) {
        return new Cons<>(element, more);
    }

    /**
     * Returns a sequence over the given iterable. Persistent collections provide their own sequence; anything else is
     * read through a single iterator, one element per realized cell.
     */
    @SuppressWarnings("unchecked")
    public static <T> Sequence<T> of(final Iterable<? extends T> iterable) {
        if (iterable instanceof final PersistentCollection<?> collection) {
            return (Sequence<T>) collection.seq();
        }
        return fromIterator(iterable.iterator());
    }

    private static <T> Sequence<T> fromIterator(final Iterator<? extends T> iterator) {
        return LazySeq.of(() -> iterator.hasNext() ? new Cons<T>(iterator.next(), fromIterator(iterator)) : null);
    }

    /**
     * Returns the infinite sequence {@code seed, f(seed), f(f(seed)), ...}.
     */
    public static <T> Sequence<T> iterate(final T seed, final UnaryOperator<T> function) {
        return new Cons<>(seed, LazySeq.of(() -> iterate(function.apply(seed), function)));
    }

    /**
     * Returns the infinite sequence of the natural numbers, starting at zero.
     */
    public static Sequence<Long> range() {
        return iterate(0L, n -> n + 1);
    }

    /**
     * Returns the numbers from {@code start}, inclusive, to {@code end}, exclusive.
     */
    public static Sequence<Long> range(final long start, final long end) {
        return LazySeq.of(() -> (start < end) ? new Cons<Long>(start, range(start + 1, end)) : null);
    }

    /**
     * Returns an infinite sequence of the same value.
     */
    public static <T> Sequence<T> repeat(final T value) {
        return LazySeq.of(() -> new Cons<T>(value, repeat(value)));
    }

    public static <T, R> Sequence<R> map(
        final Sequence<? extends T> source,
        final Function<? super T, ? extends R> function
    ) {
        return LazySeq.of(() -> {
            if (source.isEmpty()) {
                return null;
            }
            return new Cons<R>(function.apply(source.first()), map(source.rest(), function));
        });
    }

    /**
     * Returns the elements satisfying the predicate.
     * <p>
     * Realizing one element of the result may force arbitrarily many elements of the source: all the rejected ones in
     * between. On an infinite source with no further matches, it never returns.
     */
    public static <T> Sequence<T> filter(final Sequence<? extends T> source, final Predicate<? super T> predicate) {
        return LazySeq.of(() -> {
            Sequence<? extends T> current = source;
            while (!current.isEmpty()) {
                final var head = current.first();
                if (predicate.test(head)) {
                    return new Cons<T>(head, filter(current.rest(), predicate));
                }
                current = current.rest();
            }
            return null;
        });
    }

    /**
     * Applies the function to each element in turn, returning the first result that is neither {@code null} nor
     * {@link Boolean#FALSE}, or {@code null} if there is none. Eager: realizes elements until a result is found.
     * <p>
     * Passing a set's {@link PersistentSet#get(Object)} tests whether any element is a member, returning that member.
     */
    public static <T, R> @Nullable R some(
        final Sequence<? extends T> source,
        final Function<? super T, ? extends @Nullable R> function
    ) {
        Sequence<? extends T> current = source;
        while (!current.isEmpty()) {
            final var result = function.apply(current.first());
            if (result != null && !Boolean.FALSE.equals(result)) {
                return result;
            }
            current = current.rest();
        }
        return null;
    }

    public static <T> Sequence<T> remove(final Sequence<? extends T> source, final Predicate<? super T> predicate) {
        return filter(source, predicate.negate());
    }

    /**
     * Returns the first {@code n} elements, forcing no element past them.
     */
    public static <T> Sequence<T> take(final Sequence<? extends T> source, final long n) {
        return LazySeq.of(() -> {
            if (n <= 0 || source.isEmpty()) {
                return null;
            }
            return new Cons<T>(source.first(), take(source.rest(), n - 1));
        });
    }

    public static <T> Sequence<T> drop(final Sequence<? extends T> source, final long n) {
        return LazySeq.of(() -> {
            Sequence<? extends T> current = source;
            for (long i = 0; i < n && !current.isEmpty(); i += 1) {
                current = current.rest();
            }
            return current;
        });
    }

    public static <T> Sequence<T> takeWhile(final Sequence<? extends T> source, final Predicate<? super T> predicate) {
        return LazySeq.of(() -> {
            if (source.isEmpty()) {
                return null;
            }
            final var head = source.first();
            return predicate.test(head) ? new Cons<T>(head, takeWhile(source.rest(), predicate)) : null;
        });
    }

    public static <T> Sequence<T> dropWhile(final Sequence<? extends T> source, final Predicate<? super T> predicate) {
        return LazySeq.of(() -> {
            Sequence<? extends T> current = source;
            while (!current.isEmpty() && predicate.test(current.first())) {
                current = current.rest();
            }
            return current;
        });
    }

    /**
     * Returns the elements of {@code first} followed by those of {@code second}. Neither is forced until needed.
     */
    public static <T> Sequence<T> concat(final Sequence<? extends T> first, final Sequence<? extends T> second) {
        return LazySeq.of(() -> {
            if (first.isEmpty()) {
                return second;
            }
            return new Cons<T>(first.first(), concat(first.rest(), second));
        });
    }

    @SafeVarargs
    public static <T> Sequence<T> concat(final Sequence<? extends T>... parts) {
        return concatFrom(parts, 0);
    }

    private static <T> Sequence<T> concatFrom(final Sequence<? extends T>[] parts, final int index) {
        if (index >= parts.length) {
            return PersistentList.empty();
        }
        if (index == parts.length - 1) {
            return LazySeq.<T>of(() -> parts[index]);
        }
        return concat(parts[index], LazySeq.<T>of(() -> concatFrom(parts, index + 1)));
    }

    /**
     * Eagerly realizes every element of the sequence and returns it.
     */
    public static <T> Sequence<T> doall(final Sequence<T> sequence) {
        var current = sequence.next();
        while (current != null) {
            current = current.next();
        }
        return sequence;
    }

    /**
     * Eagerly walks to the element at the index.
     * <p>
     * Complexity: linear time.
     *
     * @throws IndexOutOfBoundsException If the index is negative or the sequence has no more than {@code index}
     *                                   elements.
     */
    public static <T> @Nullable T nth(final Sequence<T> sequence, final long index) {
        if (index < 0) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds");
        }
        Sequence<T> current = sequence;
        for (long i = 0; i < index; i += 1) {
            final var next = current.next();
            if (next == null) {
                throw new IndexOutOfBoundsException("Index " + index + " out of bounds for length " + (i + 1));
            }
            current = next;
        }
        if (current.isEmpty()) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for length 0");
        }
        return current.first();
    }

    /**
     * Eagerly collects the elements into a list in reverse order.
     */
    public static <T> PersistentList<T> reverse(final Iterable<? extends T> elements) {
        PersistentList<T> result = PersistentList.empty();
        for (final var element : elements) {
            result = result.cons(element);
        }
        return result;
    }

    /**
     * Eagerly conjoins every element into the target collection, in iteration order.
     */
    public static <T> PersistentCollection<T> into(
        final PersistentCollection<T> target,
        final Iterable<? extends T> elements
    ) {
        var result = target;
        for (final var element : elements) {
            result = result.conj(element);
        }
        return result;
    }
}
