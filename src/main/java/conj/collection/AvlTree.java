// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import java.util.Comparator;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Operations on immutable height-balanced binary search trees.
 * <p>
 * An empty tree is {@code null}. Every operation returns a new root, copying only the nodes on the path it walked and
 * sharing all other subtrees; after every insertion and deletion the heights of any node's two subtrees differ by at
 * most one. The operations only follow the signs of comparator results, so a comparator that is not a total order
 * yields an unspecified arrangement but every operation still terminates.
 */
final class AvlTree {
    private AvlTree() {
    }

    static final class Node<K, V> {
        Node(
            final K key,
            final V value,
            final @Nullable Node<K, V> left,
            final @Nullable Node<K, V> right
        ) {
            this.key = key;
            this.value = value;
            this.left = left;
            this.right = right;
            height = Math.max(AvlTree.height(left), AvlTree.height(right)) + 1;
        }

        K key() {
            return key;
        }

        V value() {
            return value;
        }

        @Nullable Node<K, V> left() {
            return left;
        }

        @Nullable Node<K, V> right() {
            return right;
        }

        int height() {
            return height;
        }

        private Node<K, V> withChildren(final @Nullable Node<K, V> newLeft, final @Nullable Node<K, V> newRight) {
            return (newLeft == left && newRight == right) ? this : balanced(key, value, newLeft, newRight);
        }

        private final K key;
        private final V value;
        private final @Nullable Node<K, V> left;
        private final @Nullable Node<K, V> right;
        private final int height;
    }

    /**
     * Reports what an update did to the set of keys.
     */
    static final class Result {
        boolean changedCount = false;
    }

    static int height(final @Nullable Node<?, ?> node) {
        return (node == null) ? 0 : node.height;
    }

    @SuppressWarnings("unchecked")
    static <K, V> @Nullable Node<K, V> find(
        final @Nullable Node<K, V> root,
        final @Nullable Object key,
        final Comparator<? super K> comparator
    ) {
        var node = root;
        while (node != null) {
            final var comparison = comparator.compare((K) key, node.key);
            if (comparison == 0) {
                return node;
            }
            node = (comparison < 0) ? node.left : node.right;
        }
        return null;
    }

    /**
     * Inserts the key with the value, or replaces the value of an equal key, which keeps the stored key. Returns the
     * same root when the key is present with the identical value.
     */
    static <K, V> Node<K, V> insert(
        final @Nullable Node<K, V> node,
        final K key,
        final V value,
        final Comparator<? super K> comparator,
        final Result result
    ) {
        if (node == null) {
            result.changedCount = true;
            return new Node<>(key, value, null, null);
        }
        final var comparison = comparator.compare(key, node.key);
        if (comparison < 0) {
            return node.withChildren(insert(node.left, key, value, comparator, result), node.right);
        }
        if (comparison > 0) {
            return node.withChildren(node.left, insert(node.right, key, value, comparator, result));
        }
        return (node.value == value) ? node : new Node<>(node.key, value, node.left, node.right);
    }

    /**
     * Removes the key; returns the same root if it is absent.
     */
    @SuppressWarnings("unchecked")
    static <K, V> @Nullable Node<K, V> delete(
        final @Nullable Node<K, V> node,
        final @Nullable Object key,
        final Comparator<? super K> comparator,
        final Result result
    ) {
        if (node == null) {
            return null;
        }
        final var comparison = comparator.compare((K) key, node.key);
        if (comparison < 0) {
            return node.withChildren(delete(node.left, key, comparator, result), node.right);
        }
        if (comparison > 0) {
            return node.withChildren(node.left, delete(node.right, key, comparator, result));
        }
        result.changedCount = true;
        return glue(node.left, node.right);
    }

    static <K, V> @Nullable Node<K, V> first(final @Nullable Node<K, V> root) {
        if (root == null) {
            return null;
        }
        var node = root;
        while (node.left != null) {
            node = node.left;
        }
        return node;
    }

    static <K, V> @Nullable Node<K, V> last(final @Nullable Node<K, V> root) {
        if (root == null) {
            return null;
        }
        var node = root;
        while (node.right != null) {
            node = node.right;
        }
        return node;
    }

    // Joins two subtrees of a deleted node; every key of left is smaller than every key of right.
    private static <K, V> @Nullable Node<K, V> glue(final @Nullable Node<K, V> left, final @Nullable Node<K, V> right) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        // The replacement comes from the taller side.
        if (left.height > right.height) {
            final var max = last(left);
            assert max != null;
            return balanced(max.key, max.value, deleteMax(left), right);
        }
        final var min = first(right);
        assert min != null;
        return balanced(min.key, min.value, left, deleteMin(right));
    }

    private static <K, V> @Nullable Node<K, V> deleteMin(final Node<K, V> node) {
        if (node.left == null) {
            return node.right;
        }
        return node.withChildren(deleteMin(node.left), node.right);
    }

    private static <K, V> @Nullable Node<K, V> deleteMax(final Node<K, V> node) {
        if (node.right == null) {
            return node.left;
        }
        return node.withChildren(node.left, deleteMax(node.right));
    }

    // Builds a node whose children's heights differ by at most two, rotating to restore the balance.
    private static <K, V> Node<K, V> balanced(
        final K key,
        final V value,
        final @Nullable Node<K, V> left,
        final @Nullable Node<K, V> right
    ) {
        final var leftHeight = height(left);
        final var rightHeight = height(right);
        if (leftHeight > rightHeight + 1) {
            assert left != null;
            if (height(left.left) >= height(left.right)) {
                return rotateRight(key, value, left, right);
            }
            final var pivot = left.right;
            assert pivot != null;
            return new Node<>(
                pivot.key,
                pivot.value,
                new Node<>(left.key, left.value, left.left, pivot.left),
                new Node<>(key, value, pivot.right, right)
            );
        }
        if (rightHeight > leftHeight + 1) {
            assert right != null;
            if (height(right.right) >= height(right.left)) {
                return rotateLeft(key, value, left, right);
            }
            final var pivot = right.left;
            assert pivot != null;
            return new Node<>(
                pivot.key,
                pivot.value,
                new Node<>(key, value, left, pivot.left),
                new Node<>(right.key, right.value, pivot.right, right.right)
            );
        }
        return new Node<>(key, value, left, right);
    }

    private static <K, V> Node<K, V> rotateRight(
        final K key,
        final V value,
        final Node<K, V> left,
        final @Nullable Node<K, V> right
    ) {
        return new Node<>(left.key, left.value, left.left, new Node<>(key, value, left.right, right));
    }

    private static <K, V> Node<K, V> rotateLeft(
        final K key,
        final V value,
        final @Nullable Node<K, V> left,
        final Node<K, V> right
    ) {
        return new Node<>(right.key, right.value, new Node<>(key, value, left, right.left), right.right);
    }
}
