// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The nodes of the hash array mapped trie behind {@link PersistentHashMap}.
 * <p>
 * Each level consumes 5 bits of the key's hash. A {@link BitmapNode} stores only its occupied slots, packed, with a
 * 32-bit bitmap telling which are present; each packed slot is either a key and its value, or a {@code null} key and
 * a child node. Once a bitmap node would hold more than 16 slots, it is promoted to a {@link DenseNode}: a plain
 * 32-slot {@link TrieNode} of children, which is demoted back when it drops below 8 children. Keys whose full 32-bit
 * hashes collide end up together in a {@link CollisionNode}.
 * <p>
 * Nodes are immutable; updates copy the path from the root and share everything else. Null keys never reach the trie,
 * the map stores them separately.
 */
final class HashTrie {
    private HashTrie() {
    }

    static int hash(final Object key) {
        return Equivalence.hash(key);
    }

    static int slotOf(final int hash, final int shift) {
        return (hash >>> shift) & TrieNode.mask;
    }

    static int bitOf(final int hash, final int shift) {
        return 1 << slotOf(hash, shift);
    }

    static Node emptyNode() {
        return BitmapNode.empty;
    }

    /**
     * Reports whether an update added a new key rather than replacing a value.
     */
    static final class AddedLeaf {
        boolean added = false;
    }

    sealed interface Node permits BitmapNode, DenseNode, CollisionNode {
        @Nullable MapEntry<Object, Object> find(int shift, int hash, Object key);

        /**
         * Returns this node itself if the key was already associated with the identical value.
         */
        Node assoc(int shift, int hash, Object key, @Nullable Object value, AddedLeaf addedLeaf);

        /**
         * Returns this node itself if the key was absent, and {@code null} if the node became empty.
         */
        @Nullable Node without(int shift, int hash, Object key);

        /**
         * Returns a lazy sequence of this node's entries followed by {@code tail}.
         */
        Sequence<MapEntry<Object, Object>> entries(Sequence<MapEntry<Object, Object>> tail);
    }

    static final class BitmapNode implements Node {
        BitmapNode(final int bitmap, final @Nullable Object[] array) {
            this.bitmap = bitmap;
            this.array = array;
        }

        @Override
        public @Nullable MapEntry<Object, Object> find(final int shift, final int hash, final Object key) {
            final var bit = bitOf(hash, shift);
            if ((bitmap & bit) == 0) {
                return null;
            }
            final var index = indexOf(bit);
            final var keyOrNull = array[2 * index];
            final var valueOrNode = array[2 * index + 1];
            if (keyOrNull == null) {
                return ((Node) valueOrNode).find(shift + TrieNode.bits, hash, key);
            }
            return Equivalence.equal(key, keyOrNull) ? MapEntry.of(keyOrNull, valueOrNode) : null;
        }

        @Override
        public Node assoc(
            final int shift,
            final int hash,
            final Object key,
            final @Nullable Object value,
            final AddedLeaf addedLeaf
        ) {
            final var bit = bitOf(hash, shift);
            final var index = indexOf(bit);
            if ((bitmap & bit) != 0) {
                final var keyOrNull = array[2 * index];
                final var valueOrNode = array[2 * index + 1];
                if (keyOrNull == null) {
                    final var child = (Node) valueOrNode;
                    final var newChild = child.assoc(shift + TrieNode.bits, hash, key, value, addedLeaf);
                    return (newChild == child)
                        ? this
                        : new BitmapNode(bitmap, ArrayOps.updated(array, 2 * index + 1, newChild));
                }
                if (Equivalence.equal(key, keyOrNull)) {
                    return (value == valueOrNode)
                        ? this
                        : new BitmapNode(bitmap, ArrayOps.updated(array, 2 * index + 1, value));
                }
                // Two different keys share this slot: push both one level down.
                addedLeaf.added = true;
                final var child = pairNode(shift + TrieNode.bits, keyOrNull, valueOrNode, hash, key, value);
                return new BitmapNode(bitmap, ArrayOps.updated(array, 2 * index, null, 2 * index + 1, child));
            }
            final var occupied = Integer.bitCount(bitmap);
            if (occupied >= denseThreshold) {
                return promoted(shift, hash, key, value, addedLeaf);
            }
            addedLeaf.added = true;
            return new BitmapNode(bitmap | bit, ArrayOps.insertedPair(array, index, key, value));
        }

        @Override
        public @Nullable Node without(final int shift, final int hash, final Object key) {
            final var bit = bitOf(hash, shift);
            if ((bitmap & bit) == 0) {
                return this;
            }
            final var index = indexOf(bit);
            final var keyOrNull = array[2 * index];
            final var valueOrNode = array[2 * index + 1];
            if (keyOrNull == null) {
                final var child = (Node) valueOrNode;
                final var newChild = child.without(shift + TrieNode.bits, hash, key);
                if (newChild == child) {
                    return this;
                }
                if (newChild != null) {
                    return new BitmapNode(bitmap, ArrayOps.updated(array, 2 * index + 1, newChild));
                }
                return removedSlot(bit, index);
            }
            return Equivalence.equal(key, keyOrNull) ? removedSlot(bit, index) : this;
        }

        @Override
        public Sequence<MapEntry<Object, Object>> entries(final Sequence<MapEntry<Object, Object>> tail) {
            return entriesFrom(0, tail);
        }

        private Sequence<MapEntry<Object, Object>> entriesFrom(
            final int slot,
            final Sequence<MapEntry<Object, Object>> tail
        ) {
            return LazySeq.of(() -> {
                if (slot >= array.length) {
                    return tail;
                }
                final var keyOrNull = array[slot];
                final var valueOrNode = array[slot + 1];
                final var rest = entriesFrom(slot + 2, tail);
                if (keyOrNull == null) {
                    return ((Node) valueOrNode).entries(rest);
                }
                return new Cons<>(MapEntry.of(keyOrNull, valueOrNode), rest);
            });
        }

        private @Nullable Node removedSlot(final int bit, final int index) {
            if (bitmap == bit) {
                return null;
            }
            return new BitmapNode(bitmap ^ bit, ArrayOps.removedPair(array, index));
        }

        private Node promoted(
            final int shift,
            final int hash,
            final Object key,
            final @Nullable Object value,
            final AddedLeaf addedLeaf
        ) {
            final var children = new Object[TrieNode.width];
            children[slotOf(hash, shift)] = empty.assoc(shift + TrieNode.bits, hash, key, value, addedLeaf);
            var packed = 0;
            for (int slot = 0; slot < TrieNode.width; slot += 1) {
                if (((bitmap >>> slot) & 1) == 0) {
                    continue;
                }
                final var keyOrNull = array[packed];
                final var valueOrNode = array[packed + 1];
                children[slot] = (keyOrNull == null)
                    ? valueOrNode
                    : empty.assoc(shift + TrieNode.bits, hash(keyOrNull), keyOrNull, valueOrNode, new AddedLeaf());
                packed += 2;
            }
            return new DenseNode(Integer.bitCount(bitmap) + 1, TrieNode.inner(children));
        }

        private int indexOf(final int bit) {
            return Integer.bitCount(bitmap & (bit - 1));
        }

        int bitmap() {
            return bitmap;
        }

        private static final BitmapNode empty = new BitmapNode(0, new Object[0]);

        private final int bitmap;
        private final @Nullable Object[] array;
    }

    static final class DenseNode implements Node {
        DenseNode(final int childCount, final TrieNode children) {
            this.childCount = childCount;
            this.children = children;
        }

        @Override
        public @Nullable MapEntry<Object, Object> find(final int shift, final int hash, final Object key) {
            final var child = (Node) children.childAt(slotOf(hash, shift));
            return (child == null) ? null : child.find(shift + TrieNode.bits, hash, key);
        }

        @Override
        public Node assoc(
            final int shift,
            final int hash,
            final Object key,
            final @Nullable Object value,
            final AddedLeaf addedLeaf
        ) {
            final var slot = slotOf(hash, shift);
            final var child = (Node) children.childAt(slot);
            if (child == null) {
                final var newChild = BitmapNode.empty.assoc(shift + TrieNode.bits, hash, key, value, addedLeaf);
                return new DenseNode(childCount + 1, children.withChildAt(slot, newChild));
            }
            final var newChild = child.assoc(shift + TrieNode.bits, hash, key, value, addedLeaf);
            return (newChild == child) ? this : new DenseNode(childCount, children.withChildAt(slot, newChild));
        }

        @Override
        public @Nullable Node without(final int shift, final int hash, final Object key) {
            final var slot = slotOf(hash, shift);
            final var child = (Node) children.childAt(slot);
            if (child == null) {
                return this;
            }
            final var newChild = child.without(shift + TrieNode.bits, hash, key);
            if (newChild == child) {
                return this;
            }
            if (newChild != null) {
                return new DenseNode(childCount, children.withChildAt(slot, newChild));
            }
            if (childCount <= sparseThreshold) {
                return packedWithout(slot);
            }
            return new DenseNode(childCount - 1, children.withChildAt(slot, null));
        }

        @Override
        public Sequence<MapEntry<Object, Object>> entries(final Sequence<MapEntry<Object, Object>> tail) {
            return entriesFrom(0, tail);
        }

        private Sequence<MapEntry<Object, Object>> entriesFrom(
            final int slot,
            final Sequence<MapEntry<Object, Object>> tail
        ) {
            return LazySeq.of(() -> {
                for (int i = slot; i < TrieNode.width; i += 1) {
                    final var child = (Node) children.childAt(i);
                    if (child != null) {
                        return child.entries(entriesFrom(i + 1, tail));
                    }
                }
                return tail;
            });
        }

        // Demotes to a bitmap node holding the remaining children.
        private BitmapNode packedWithout(final int removedSlot) {
            final var array = new Object[2 * (childCount - 1)];
            var bitmap = 0;
            var packed = 1;
            for (int slot = 0; slot < TrieNode.width; slot += 1) {
                final var child = children.childAt(slot);
                if (slot != removedSlot && child != null) {
                    array[packed] = child;
                    bitmap |= 1 << slot;
                    packed += 2;
                }
            }
            return new BitmapNode(bitmap, array);
        }

        TrieNode children() {
            return children;
        }

        private final int childCount;
        private final TrieNode children;
    }

    static final class CollisionNode implements Node {
        CollisionNode(final int hash, final @Nullable Object[] array) {
            this.hash = hash;
            this.array = array;
        }

        @Override
        public @Nullable MapEntry<Object, Object> find(final int shift, final int hash, final Object key) {
            final var index = indexOf(key);
            return (index < 0) ? null : MapEntry.of(array[index], array[index + 1]);
        }

        @Override
        public Node assoc(
            final int shift,
            final int hash,
            final Object key,
            final @Nullable Object value,
            final AddedLeaf addedLeaf
        ) {
            if (hash != this.hash) {
                // A different hash at this depth: nest this node under a bitmap node and retry there.
                final @Nullable Object[] nested = {null, this};
                return new BitmapNode(bitOf(this.hash, shift), nested).assoc(shift, hash, key, value, addedLeaf);
            }
            final var index = indexOf(key);
            if (index >= 0) {
                return (array[index + 1] == value)
                    ? this
                    : new CollisionNode(hash, ArrayOps.updated(array, index + 1, value));
            }
            addedLeaf.added = true;
            return new CollisionNode(hash, ArrayOps.appendedPair(array, key, value));
        }

        @Override
        public @Nullable Node without(final int shift, final int hash, final Object key) {
            final var index = indexOf(key);
            if (index < 0) {
                return this;
            }
            if (array.length == 2) {
                return null;
            }
            return new CollisionNode(hash, ArrayOps.removedPair(array, index / 2));
        }

        @Override
        public Sequence<MapEntry<Object, Object>> entries(final Sequence<MapEntry<Object, Object>> tail) {
            Sequence<MapEntry<Object, Object>> result = tail;
            for (int i = array.length - 2; i >= 0; i -= 2) {
                result = new Cons<>(MapEntry.of(array[i], array[i + 1]), result);
            }
            return result;
        }

        private int indexOf(final Object key) {
            for (int i = 0; i < array.length; i += 2) {
                if (Equivalence.equal(key, array[i])) {
                    return i;
                }
            }
            return -1;
        }

        private final int hash;
        private final @Nullable Object[] array;
    }

    private static Node pairNode(
        final int shift,
        final Object firstKey,
        final @Nullable Object firstValue,
        final int secondHash,
        final Object secondKey,
        final @Nullable Object secondValue
    ) {
        final var firstHash = hash(firstKey);
        if (firstHash == secondHash) {
            final @Nullable Object[] pairs = {firstKey, firstValue, secondKey, secondValue};
            return new CollisionNode(firstHash, pairs);
        }
        final var addedLeaf = new AddedLeaf();
        return BitmapNode.empty
            .assoc(shift, firstHash, firstKey, firstValue, addedLeaf)
            .assoc(shift, secondHash, secondKey, secondValue, addedLeaf);
    }

    private static final int denseThreshold = 16;
    private static final int sparseThreshold = 8;
}
