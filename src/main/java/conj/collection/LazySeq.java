// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A sequence whose content is computed on first demand by a {@link Producer} and cached afterwards.
 * <p>
 * A cell is either unrealized, holding its producer, or realized, holding the sequence the producer returned. The
 * transition happens at most once, under the cell's own monitor: threads forcing the same cell concurrently run the
 * producer exactly once and all observe its result, while unrelated cells never contend. Once realized, reads take no
 * lock.
 * <p>
 * If the producer throws, the cell stays unrealized and the next access runs the producer again. A producer that
 * forces its own cell recurses without bound.
 * <p>
 * Realizing a cell realizes only what its producer computes: typically one element and an unrealized tail, which is
 * what allows infinite sequences.
 */
public final class LazySeq<T> extends AbstractSequence<T> {
    private LazySeq(final Producer<T> producer) {
        this.producer = producer;
    }

    /**
     * Returns an unrealized sequence that will call the producer when first accessed.
     */
    public static <T> LazySeq<T> of(final Producer<T> producer) {
        return new LazySeq<>(producer);
    }

    /**
     * Returns {@code true} iff the producer has already run.
     */
    public boolean isRealized() {
        return producer == null;
    }

    @Override
    public boolean isEmpty() {
        return realize().isEmpty();
    }

    @Override
    public @Nullable T first() {
        return realize().first();
    }

    @Override
    public Sequence<T> rest() {
        return realize().rest();
    }

    @Override
    public @Nullable Sequence<T> next() {
        return realize().next();
    }

    @Override
    public long count() {
        return realize().count();
    }

    Sequence<T> realize() {
        if (producer == null) {
            return realizedValue();
        }
        synchronized (this) {
            final var pending = producer;
            if (pending != null) {
                realized = unwrap(pending.produce());
                // Publishing through the volatile write makes the realized value visible to lock-free readers.
                producer = null;
            }
            return realizedValue();
        }
    }

    private Sequence<T> realizedValue() {
        final var value = realized;
        assert value != null : "Realized lazy sequence without a value";
        return value;
    }

    @SuppressWarnings("unchecked")
    private static <T> Sequence<T> unwrap(final @Nullable Sequence<? extends T> produced) {
        if (produced == null) {
            return PersistentList.empty();
        }
        if (produced instanceof final LazySeq<? extends T> lazy) {
            return (Sequence<T>) lazy.realize();
        }
        return (Sequence<T>) produced;
    }

    private volatile @Nullable Producer<T> producer;
    private @Nullable Sequence<T> realized = null;

    /**
     * Computes the content of a lazy sequence.
     */
    @FunctionalInterface
    public interface Producer<T> {
        /**
         * Returns the sequence the lazy sequence stands for; {@code null} means empty.
         */
        @Nullable Sequence<? extends T> produce();
    }
}
