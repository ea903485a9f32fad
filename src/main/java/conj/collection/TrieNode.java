// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The fixed-fanout node shared by {@link PersistentVector} and the dense nodes of {@link PersistentHashMap}.
 * <p>
 * A leaf holds up to {@link #width} values; an inner node holds exactly {@link #width} slots, each either empty
 * ({@code null}) or a child. Nodes never change after construction: every "update" copies the slot array once and
 * shares every other child with the original, so an update path from the root to depth {@code d} allocates {@code d}
 * nodes and nothing else.
 */
final class TrieNode {
    private TrieNode(final @Nullable Object[] slots, final boolean leaf) {
        this.slots = slots;
        this.leaf = leaf;
    }

    /**
     * Creates a leaf holding the given values. The array is adopted as is and must not be modified afterwards.
     */
    static TrieNode leaf(final @Nullable Object[] values) {
        assert values.length <= width;
        return new TrieNode(values, true);
    }

    /**
     * Creates an inner node over the given child slots. The array is adopted as is and must not be modified
     * afterwards.
     */
    static TrieNode inner(final @Nullable Object[] children) {
        assert children.length == width;
        return new TrieNode(children, false);
    }

    static TrieNode emptyInner() {
        return emptyInner;
    }

    /**
     * Returns the child or value at the given slot; fails with {@link IndexOutOfBoundsException} outside the node.
     */
    @Nullable Object childAt(final int index) {
        return slots[Objects.checkIndex(index, slots.length)];
    }

    /**
     * Returns a node of the same kind with one slot replaced, sharing every other slot with this node.
     */
    TrieNode withChildAt(final int index, final @Nullable Object child) {
        Objects.checkIndex(index, slots.length);
        return new TrieNode(ArrayOps.updated(slots, index, child), leaf);
    }

    boolean isLeaf() {
        return leaf;
    }

    /**
     * Exposes the slot array itself. Callers must treat it as read-only.
     */
    @Nullable Object[] slots() {
        return slots;
    }

    static final int bits = 5;
    static final int width = 1 << bits;
    static final int mask = width - 1;

    private static final TrieNode emptyInner = new TrieNode(new Object[width], false);

    private final @Nullable Object[] slots;
    private final boolean leaf;
}
