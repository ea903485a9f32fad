// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Base class of the sequence implementations: iteration, counting, equality and printing in terms of
 * {@link #first()} and {@link #next()}.
 */
public abstract class AbstractSequence<T> extends ImmutableCollection<T> implements Sequence<T> {
    AbstractSequence() {
    }

    /**
     * Walks the sequence to count it.
     * <p>
     * Complexity: linear time, realizing every lazy cell; never returns for an infinite sequence.
     */
    @Override
    public long count() {
        long count = 0;
        for (Sequence<T> current = isEmpty() ? null : this; current != null; current = current.next()) {
            count += 1;
        }
        return count;
    }

    @Override
    public @Nullable Sequence<T> next() {
        final var tail = rest();
        return tail.isEmpty() ? null : tail;
    }

    @Override
    public Sequence<T> cons(final T element) {
        return new Cons<>(element, this);
    }

    @Override
    public final Sequence<T> conj(final T element) {
        return cons(element);
    }

    @Override
    public PersistentList<T> cleared() {
        return PersistentList.empty();
    }

    @Override
    public Sequence<T> seq() {
        return this;
    }

    @Override
    public @NonNull Iterator<T> iterator() {
        return new Itr<>(isEmpty() ? null : this);
    }

    /**
     * Spliterators over sequences don't report a size, as that could mean walking an infinite sequence.
     */
    @Override
    public @NonNull Spliterator<T> spliterator() {
        return Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.IMMUTABLE);
    }

    @Override
    public final boolean equals(final @Nullable Object object) {
        return Equivalence.sequentialEquals(this, object);
    }

    @Override
    public final int hashCode() {
        return Equivalence.sequentialHash(this);
    }

    @Override
    public final String toString() {
        return printElements("(", ")");
    }

    private static final class Itr<T> implements Iterator<T> {
        private Itr(final @Nullable Sequence<T> start) {
            current = start;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public T next() {
            final var sequence = current;
            if (sequence == null) {
                throw new NoSuchElementException("Sequence exhausted");
            }
            final var element = sequence.first();
            current = sequence.next();
            return element;
        }

        private @Nullable Sequence<T> current;
    }
}
