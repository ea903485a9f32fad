// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A back-to-front sequence over an indexed collection.
 */
final class ReversedIndexedSeq<T> extends AbstractSequence<T> implements Counted {
    ReversedIndexedSeq(final Indexed<T> source, final long index) {
        assert index >= 0;
        this.source = source;
        this.index = index;
    }

    @Override
    public boolean isEmpty() {
        return false;
    }

    @Override
    public T first() {
        return source.nth(index);
    }

    @Override
    public Sequence<T> rest() {
        final var next = next();
        return (next == null) ? PersistentList.empty() : next;
    }

    @Override
    public @Nullable Sequence<T> next() {
        return (index > 0) ? new ReversedIndexedSeq<>(source, index - 1) : null;
    }

    @Override
    public long count() {
        return index + 1;
    }

    private final Indexed<T> source;
    private final long index;
}
