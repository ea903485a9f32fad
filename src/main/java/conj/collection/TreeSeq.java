// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import java.util.Comparator;
import java.util.function.Function;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An in-order walk over an {@link AvlTree}, in either direction.
 * <p>
 * The walk keeps the path of nodes still to visit as a persistent stack, so each step does amortized constant work and
 * shares the stack with the step before it. Never empty.
 */
final class TreeSeq<K, V, E> extends AbstractSequence<E> {
    private TreeSeq(
        final PersistentList<AvlTree.Node<K, V>> stack,
        final boolean ascending,
        final Function<? super AvlTree.Node<K, V>, ? extends E> projection,
        final long count
    ) {
        assert !stack.isEmpty();
        this.stack = stack;
        this.ascending = ascending;
        this.projection = projection;
        this.count = count;
    }

    /**
     * Returns a walk over the whole tree, or an empty sequence if it is empty.
     */
    static <K, V, E> Sequence<E> over(
        final AvlTree.@Nullable Node<K, V> root,
        final boolean ascending,
        final Function<? super AvlTree.Node<K, V>, ? extends E> projection,
        final long count
    ) {
        return of(pushPath(root, PersistentList.empty(), ascending), ascending, projection, count);
    }

    /**
     * Returns a walk starting at the first node not before {@code key} in walk order, or an empty sequence if there is
     * none.
     */
    static <K, V, E> Sequence<E> from(
        final AvlTree.@Nullable Node<K, V> root,
        final K key,
        final Comparator<? super K> comparator,
        final boolean ascending,
        final Function<? super AvlTree.Node<K, V>, ? extends E> projection
    ) {
        var stack = PersistentList.<AvlTree.Node<K, V>>empty();
        var node = root;
        while (node != null) {
            final var comparison = comparator.compare(key, node.key());
            if (comparison == 0) {
                stack = stack.cons(node);
                break;
            }
            if (ascending == (comparison < 0)) {
                stack = stack.cons(node);
                node = ascending ? node.left() : node.right();
            } else {
                node = ascending ? node.right() : node.left();
            }
        }
        return of(stack, ascending, projection, -1);
    }

    @Override
    public long count() {
        return (count >= 0) ? count : super.count();
    }

    @Override
    public boolean isEmpty() {
        return false;
    }

    @Override
    public E first() {
        return projection.apply(top());
    }

    @Override
    public Sequence<E> rest() {
        final var next = next();
        return (next == null) ? PersistentList.empty() : next;
    }

    @Override
    public @Nullable Sequence<E> next() {
        final var node = top();
        final var child = ascending ? node.right() : node.left();
        final var newStack = pushPath(child, stack.pop(), ascending);
        if (newStack.isEmpty()) {
            return null;
        }
        return new TreeSeq<>(newStack, ascending, projection, (count >= 0) ? count - 1 : -1);
    }

    private AvlTree.Node<K, V> top() {
        final var node = stack.peek();
        assert node != null;
        return node;
    }

    private static <K, V, E> Sequence<E> of(
        final PersistentList<AvlTree.Node<K, V>> stack,
        final boolean ascending,
        final Function<? super AvlTree.Node<K, V>, ? extends E> projection,
        final long count
    ) {
        if (stack.isEmpty()) {
            return PersistentList.empty();
        }
        return new TreeSeq<>(stack, ascending, projection, count);
    }

    private static <K, V> PersistentList<AvlTree.Node<K, V>> pushPath(
        final AvlTree.@Nullable Node<K, V> start,
        final PersistentList<AvlTree.Node<K, V>> base,
        final boolean ascending
    ) {
        var stack = base;
        var node = start;
        while (node != null) {
            stack = stack.cons(node);
            node = ascending ? node.left() : node.right();
        }
        return stack;
    }

    private final PersistentList<AvlTree.Node<K, V>> stack;
    private final boolean ascending;
    private final Function<? super AvlTree.Node<K, V>, ? extends E> projection;
    private final long count;
}
