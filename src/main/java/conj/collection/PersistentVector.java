// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A persistent vector: an indexed sequence with efficient access and update anywhere and efficient growth at the end.
 * <p>
 * The elements live in a trie of {@link TrieNode}s with a fanout of 32, except for the last up to 32 elements, which
 * are kept in a separate tail array. Appending copies only the tail until it fills up, at which point the tail is
 * pushed into the trie as a new leaf, copying one node per level. Random access and update walk
 * {@code log32(count)} levels, which is at most 7 for any vector that fits in memory.
 * <p>
 * {@code null} elements are allowed. Vectors are also associative by index, so {@link #assoc(Integer, Object)} with
 * {@code index == count()} appends.
 * <p>
 * Unless noted otherwise, complexity guarantees are worst-case, and an update allocates as much as it takes time.
 * <p>
 * Vectors equal any {@link Sequential} collection with equal elements in the same order, and the shape of the trie
 * never influences equality: a vector built by many {@link #conj(Object)} calls equals one built in bulk.
 */
public final class PersistentVector<T> extends ImmutableCollection<T>
    implements Indexed<T>, Associative<Integer, T>, PersistentStack<T>, Reversible<T>, Sequential, Counted {
    private PersistentVector(final int count, final int shift, final TrieNode root, final @Nullable Object[] tail) {
        this.count = count;
        this.shift = shift;
        this.root = root;
        this.tail = tail;
    }

    /**
     * Returns the empty vector.
     */
    @SuppressWarnings("unchecked")
    public static <T> PersistentVector<T> empty() {
        return (PersistentVector<T>) empty;
    }

    /**
     * Returns a vector of the given elements, in order.
     * <p>
     * Complexity: linear time.
     */
    @SafeVarargs
    public static <T> PersistentVector<T> of(final T... elements) {
        return fromArray(elements.clone());
    }

    /**
     * Returns a vector of the elements of the iterable, in iteration order.
     * <p>
     * Complexity: constant time if the iterable is already a vector, linear time otherwise.
     */
    @SuppressWarnings("unchecked")
    public static <T> PersistentVector<T> fromIterable(final Iterable<? extends T> iterable) {
        if (iterable instanceof PersistentVector<? extends T> vector) {
            return (PersistentVector<T>) vector; // Vectors are immutable, so widening the element type is safe.
        }
        final var builder = new Builder<T>();
        for (final var element : iterable) {
            builder.append(element);
        }
        return builder.toVector();
    }

    /**
     * Complexity: constant time.
     */
    @Override
    public long count() {
        return count;
    }

    @Override
    public boolean isEmpty() {
        return count == 0;
    }

    /**
     * Complexity: logarithmic time; constant time for the last 32 elements.
     */
    @Override
    public T nth(final long index) {
        return elementAt((int) Objects.checkIndex(index, count));
    }

    @Override
    public @Nullable Object nth(final long index, final @Nullable Object notFound) {
        return (index >= 0 && index < count) ? elementAt((int) index) : notFound;
    }

    /**
     * Returns a vector with the element appended at the end.
     * <p>
     * Complexity: amortized constant time, logarithmic time once every 32 appends.
     */
    @Override
    @CheckReturnValue
    public PersistentVector<T> conj(final T element) {
        if (count - tailOffset() < TrieNode.width) {
            return new PersistentVector<>(count + 1, shift, root, ArrayOps.appended(tail, element));
        }
        final var fullTail = TrieNode.leaf(tail);
        final @Nullable Object[] newTail = {element};
        if ((count >>> TrieNode.bits) > (1 << shift)) {
            // The trie is full at this depth; grow a new root on top.
            final var children = new Object[TrieNode.width];
            children[0] = root;
            children[1] = pathTo(shift, fullTail);
            return new PersistentVector<>(count + 1, shift + TrieNode.bits, TrieNode.inner(children), newTail);
        }
        return new PersistentVector<>(count + 1, shift, pushedTail(shift, root, fullTail), newTail);
    }

    /**
     * Returns a vector with the element at the index replaced, or appended if the index equals the count.
     * <p>
     * Complexity: logarithmic time.
     *
     * @throws IndexOutOfBoundsException If the index is negative or greater than the count.
     */
    @CheckReturnValue
    public PersistentVector<T> assocN(final long index, final T element) {
        if (index == count) {
            return conj(element);
        }
        final var i = (int) Objects.checkIndex(index, count);
        if (i >= tailOffset()) {
            return new PersistentVector<>(count, shift, root, ArrayOps.updated(tail, i & TrieNode.mask, element));
        }
        return new PersistentVector<>(count, shift, replaced(shift, root, i, element), tail);
    }

    @Override
    @CheckReturnValue
    public PersistentVector<T> assoc(final Integer key, final T value) {
        return assocN(key, value);
    }

    /**
     * Returns the element at the index the key denotes, or {@code notFound} if the key is not an integer index within
     * the vector.
     */
    @Override
    public @Nullable Object valAt(final @Nullable Object key, final @Nullable Object notFound) {
        final var index = indexOf(key);
        return (index >= 0) ? elementAt(index) : notFound;
    }

    @Override
    public @Nullable MapEntry<Integer, T> find(final @Nullable Object key) {
        final var index = indexOf(key);
        return (index >= 0) ? MapEntry.of(index, elementAt(index)) : null;
    }

    @Override
    public boolean containsKey(final @Nullable Object key) {
        return indexOf(key) >= 0;
    }

    /**
     * Returns the last element, or {@code null} if the vector is empty.
     */
    @Override
    public @Nullable T peek() {
        return (count > 0) ? elementAt(count - 1) : null;
    }

    /**
     * Returns a vector without its last element.
     * <p>
     * Complexity: amortized constant time, logarithmic time when the tail runs out.
     *
     * @throws IllegalStateException If the vector is empty.
     */
    @Override
    @CheckReturnValue
    public PersistentVector<T> pop() {
        if (count == 0) {
            throw new IllegalStateException("Cannot pop an empty vector");
        }
        if (count == 1) {
            return empty();
        }
        if (count - tailOffset() > 1) {
            return new PersistentVector<>(count - 1, shift, root, ArrayOps.withoutLast(tail));
        }
        // The tail is about to become empty: the last leaf of the trie becomes the new tail.
        final var newTail = leafFor(count - 2);
        var newRoot = poppedTail(shift, root);
        var newShift = shift;
        if (newRoot == null) {
            newRoot = TrieNode.emptyInner();
        }
        if (shift > TrieNode.bits && newRoot.childAt(1) == null) {
            newRoot = (TrieNode) Objects.requireNonNull(newRoot.childAt(0));
            newShift -= TrieNode.bits;
        }
        return new PersistentVector<>(count - 1, newShift, newRoot, newTail);
    }

    @Override
    public PersistentVector<T> cleared() {
        return empty();
    }

    @Override
    public Sequence<T> seq() {
        return (count == 0) ? PersistentList.empty() : new VectorSeq<>(this, leafFor(0), 0, 0);
    }

    @Override
    public Sequence<T> rseq() {
        return (count == 0) ? PersistentList.empty() : new ReversedIndexedSeq<>(this, count - 1);
    }

    @Override
    public @NonNull Iterator<T> iterator() {
        return new Itr();
    }

    @Override
    public boolean equals(final @Nullable Object object) {
        if (object instanceof final PersistentVector<?> other && other.count != count) {
            return false;
        }
        return Equivalence.sequentialEquals(this, object);
    }

    @Override
    public int hashCode() {
        return Equivalence.sequentialHash(this);
    }

    /**
     * Returns the elements separated by spaces and enclosed in square brackets.
     */
    @Override
    public String toString() {
        return printElements("[", "]");
    }

    @SuppressWarnings("unchecked")
    private T elementAt(final int index) {
        return (T) leafFor(index)[index & TrieNode.mask];
    }

    // Returns the array holding the element at the index: either the tail or a leaf's slots. Read-only.
    @Nullable Object[] leafFor(final int index) {
        if (index >= tailOffset()) {
            return tail;
        }
        var node = root;
        for (int level = shift; level > 0; level -= TrieNode.bits) {
            node = (TrieNode) Objects.requireNonNull(node.childAt((index >>> level) & TrieNode.mask));
        }
        return node.slots();
    }

    // The root, exposed for structural sharing checks.
    TrieNode root() {
        return root;
    }

    private int tailOffset() {
        return (count < TrieNode.width) ? 0 : ((count - 1) >>> TrieNode.bits) << TrieNode.bits;
    }

    private static int indexOf(final @Nullable Object key, final int count) {
        if (!(key instanceof Integer || key instanceof Long || key instanceof Short || key instanceof Byte)) {
            return -1;
        }
        final var index = ((Number) key).longValue();
        return (index >= 0 && index < count) ? (int) index : -1;
    }

    private int indexOf(final @Nullable Object key) {
        return indexOf(key, count);
    }

    private TrieNode pushedTail(final int level, final TrieNode parent, final TrieNode tailNode) {
        final var slot = ((count - 1) >>> level) & TrieNode.mask;
        final TrieNode inserted;
        if (level == TrieNode.bits) {
            inserted = tailNode;
        } else {
            final var child = (TrieNode) parent.childAt(slot);
            inserted = (child == null)
                ? pathTo(level - TrieNode.bits, tailNode)
                : pushedTail(level - TrieNode.bits, child, tailNode);
        }
        return parent.withChildAt(slot, inserted);
    }

    private static TrieNode pathTo(final int level, final TrieNode node) {
        if (level == 0) {
            return node;
        }
        final var children = new Object[TrieNode.width];
        children[0] = pathTo(level - TrieNode.bits, node);
        return TrieNode.inner(children);
    }

    private static TrieNode replaced(
        final int level,
        final TrieNode node,
        final int index,
        final @Nullable Object value
    ) {
        if (level == 0) {
            return node.withChildAt(index & TrieNode.mask, value);
        }
        final var slot = (index >>> level) & TrieNode.mask;
        final var child = (TrieNode) Objects.requireNonNull(node.childAt(slot));
        return node.withChildAt(slot, replaced(level - TrieNode.bits, child, index, value));
    }

    private @Nullable TrieNode poppedTail(final int level, final TrieNode node) {
        final var slot = ((count - 2) >>> level) & TrieNode.mask;
        if (level > TrieNode.bits) {
            final var child = poppedTail(level - TrieNode.bits, (TrieNode) Objects.requireNonNull(node.childAt(slot)));
            if (child == null && slot == 0) {
                return null;
            }
            return node.withChildAt(slot, child);
        }
        return (slot == 0) ? null : node.withChildAt(slot, null);
    }

    // Builds the trie bottom-up: full leaves first, then as many levels of inner nodes as needed.
    private static <T> PersistentVector<T> fromArray(final @Nullable Object[] elements) {
        final var count = elements.length;
        if (count == 0) {
            return empty();
        }
        final var tailOffset = (count < TrieNode.width) ? 0 : ((count - 1) >>> TrieNode.bits) << TrieNode.bits;
        final var tail = new Object[count - tailOffset];
        System.arraycopy(elements, tailOffset, tail, 0, tail.length);

        var level = new ArrayList<TrieNode>();
        for (int start = 0; start < tailOffset; start += TrieNode.width) {
            final var values = new Object[TrieNode.width];
            System.arraycopy(elements, start, values, 0, TrieNode.width);
            level.add(TrieNode.leaf(values));
        }
        var shift = TrieNode.bits;
        while (level.size() > TrieNode.width) {
            final var parents = new ArrayList<TrieNode>();
            for (int start = 0; start < level.size(); start += TrieNode.width) {
                parents.add(TrieNode.inner(slotsOf(level, start)));
            }
            level = parents;
            shift += TrieNode.bits;
        }
        final var root = level.isEmpty() ? TrieNode.emptyInner() : TrieNode.inner(slotsOf(level, 0));
        return new PersistentVector<>(count, shift, root, tail);
    }

    private static @Nullable Object[] slotsOf(final ArrayList<TrieNode> nodes, final int start) {
        final var slots = new Object[TrieNode.width];
        final var end = Integer.min(start + TrieNode.width, nodes.size());
        for (int i = start; i < end; i += 1) {
            slots[i - start] = nodes.get(i);
        }
        return slots;
    }

    private static final PersistentVector<?> empty =
        new PersistentVector<>(0, TrieNode.bits, TrieNode.emptyInner(), new Object[0]);

    private final int count;
    private final int shift;
    private final TrieNode root;
    private final @Nullable Object[] tail;

    /**
     * A builder of vectors, collecting elements before building the trie in one pass.
     * <p>
     * The builder can be reused after {@link #toVector()}: further appends don't affect vectors already built.
     */
    public static final class Builder<T> {
        /**
         * Appends an element to the vector being built.
         * <p>
         * Complexity: amortized constant time.
         */
        public Builder<T> append(final T element) {
            elements.add(element);
            return this;
        }

        /**
         * Returns a vector of every element appended so far.
         * <p>
         * Complexity: linear time.
         */
        public PersistentVector<T> toVector() {
            return fromArray(elements.toArray());
        }

        private final ArrayList<@Nullable Object> elements = new ArrayList<>();
    }

    private final class Itr implements Iterator<T> {
        @Override
        public boolean hasNext() {
            return index < count;
        }

        @Override
        @SuppressWarnings("unchecked")
        public T next() {
            if (index >= count) {
                throw new NoSuchElementException("Vector exhausted");
            }
            if ((index & TrieNode.mask) == 0) {
                leaf = leafFor(index);
            }
            final var element = (T) leaf[index & TrieNode.mask];
            index += 1;
            return element;
        }

        private int index = 0;
        private @Nullable Object[] leaf = tail;
    }
}
