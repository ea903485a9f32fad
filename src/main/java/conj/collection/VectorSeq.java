// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A sequence over a vector that walks one leaf array at a time, so stepping costs a trie descent only once every 32
 * elements.
 */
final class VectorSeq<T> extends AbstractSequence<T> implements Counted {
    VectorSeq(final PersistentVector<T> vector, final @Nullable Object[] leaf, final int base, final int offset) {
        assert offset < leaf.length;
        this.vector = vector;
        this.leaf = leaf;
        this.base = base;
        this.offset = offset;
    }

    @Override
    public boolean isEmpty() {
        return false;
    }

    @Override
    @SuppressWarnings("unchecked")
    public T first() {
        return (T) leaf[offset];
    }

    @Override
    public Sequence<T> rest() {
        final var next = next();
        return (next == null) ? PersistentList.empty() : next;
    }

    @Override
    public @Nullable Sequence<T> next() {
        if (offset + 1 < leaf.length) {
            return new VectorSeq<>(vector, leaf, base, offset + 1);
        }
        final var nextBase = base + leaf.length;
        if (nextBase < vector.count()) {
            return new VectorSeq<>(vector, vector.leafFor(nextBase), nextBase, 0);
        }
        return null;
    }

    @Override
    public long count() {
        return vector.count() - base - offset;
    }

    private final PersistentVector<T> vector;
    private final @Nullable Object[] leaf;
    private final int base;
    private final int offset;
}
