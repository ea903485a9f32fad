// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import java.util.Comparator;
import java.util.Iterator;
import java.util.function.Function;
import java.util.function.Predicate;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A persistent map kept sorted by key, built on an AVL tree.
 * <p>
 * Lookup and updates take logarithmic time. Keys are ordered, and considered equal, by the map's comparator alone;
 * {@link Comparison#natural()} is the default. Sequences come out in key order, and {@link #range(Bound, Bound)} walks
 * any key interval without re-sorting.
 */
public final class PersistentTreeMap<K, V> extends ImmutableCollection<MapEntry<K, V>>
    implements PersistentMap<K, V>, Sorted<K, MapEntry<K, V>>, Counted {
    private PersistentTreeMap(
        final Comparator<? super K> comparator,
        final AvlTree.@Nullable Node<K, V> root,
        final long count
    ) {
        this.comparator = comparator;
        this.root = root;
        this.count = count;
    }

    /**
     * Returns an empty map ordered by {@link Comparison#natural()}.
     */
    @SuppressWarnings("unchecked")
    public static <K, V> PersistentTreeMap<K, V> empty() {
        return (PersistentTreeMap<K, V>) empty;
    }

    public static <K, V> PersistentTreeMap<K, V> empty(final Comparator<? super K> comparator) {
        return new PersistentTreeMap<>(comparator, null, 0);
    }

    /**
     * Creates a naturally ordered map from alternating keys and values; later duplicates win.
     *
     * @throws IllegalArgumentException If the number of arguments is odd.
     */
    @SuppressWarnings("unchecked")
    public static <K, V> PersistentTreeMap<K, V> ofPairs(final @Nullable Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Odd number of arguments: " + keysAndValues.length);
        }
        PersistentTreeMap<K, V> result = empty();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            result = result.assoc((K) keysAndValues[i], (V) keysAndValues[i + 1]);
        }
        return result;
    }

    public static <K, V> PersistentTreeMap<K, V> fromEntries(
        final Comparator<? super K> comparator,
        final Iterable<? extends MapEntry<K, V>> entries
    ) {
        var result = PersistentTreeMap.<K, V>empty(comparator);
        for (final var entry : entries) {
            result = result.assoc(entry.key(), entry.value());
        }
        return result;
    }

    @Override
    public long count() {
        return count;
    }

    @Override
    public boolean isEmpty() {
        return root == null;
    }

    @Override
    public Comparator<? super K> comparator() {
        return comparator;
    }

    @Override
    public @Nullable Object valAt(final @Nullable Object key, final @Nullable Object notFound) {
        final var node = AvlTree.find(root, key, comparator);
        return (node == null) ? notFound : node.value();
    }

    @Override
    public @Nullable V get(final @Nullable Object key) {
        final var node = AvlTree.find(root, key, comparator);
        return (node == null) ? null : node.value();
    }

    @Override
    public @Nullable MapEntry<K, V> find(final @Nullable Object key) {
        final var node = AvlTree.find(root, key, comparator);
        return (node == null) ? null : entryOf(node);
    }

    @Override
    public boolean containsKey(final @Nullable Object key) {
        return AvlTree.find(root, key, comparator) != null;
    }

    /**
     * Returns {@code true} iff the argument is a {@link MapEntry} present in this map.
     */
    @Override
    public boolean contains(final @Nullable Object object) {
        if (!(object instanceof final MapEntry<?, ?> entry)) {
            return false;
        }
        final var node = AvlTree.find(root, entry.key(), comparator);
        return node != null && Equivalence.equal(node.value(), entry.value());
    }

    @Override
    public PersistentTreeMap<K, V> assoc(final K key, final V value) {
        final var result = new AvlTree.Result();
        final var newRoot = AvlTree.insert(root, key, value, comparator, result);
        if (newRoot == root) {
            return this;
        }
        return new PersistentTreeMap<>(comparator, newRoot, result.changedCount ? count + 1 : count);
    }

    @Override
    public PersistentTreeMap<K, V> without(final @Nullable Object key) {
        final var result = new AvlTree.Result();
        final var newRoot = AvlTree.delete(root, key, comparator, result);
        if (!result.changedCount) {
            return this;
        }
        return new PersistentTreeMap<>(comparator, newRoot, count - 1);
    }

    @Override
    public PersistentTreeMap<K, V> conj(final MapEntry<K, V> entry) {
        return assoc(entry.key(), entry.value());
    }

    /**
     * Returns an empty map with the same comparator.
     */
    @Override
    public PersistentTreeMap<K, V> cleared() {
        return (count == 0) ? this : new PersistentTreeMap<>(comparator, null, 0);
    }

    /**
     * Returns the entry with the smallest key, or {@code null} if the map is empty.
     */
    public @Nullable MapEntry<K, V> firstEntry() {
        final var node = AvlTree.first(root);
        return (node == null) ? null : entryOf(node);
    }

    /**
     * Returns the entry with the greatest key, or {@code null} if the map is empty.
     */
    public @Nullable MapEntry<K, V> lastEntry() {
        final var node = AvlTree.last(root);
        return (node == null) ? null : entryOf(node);
    }

    @Override
    public Sequence<MapEntry<K, V>> seq() {
        return walk(true, PersistentTreeMap::entryOf);
    }

    @Override
    public Sequence<MapEntry<K, V>> rseq() {
        return walk(false, PersistentTreeMap::entryOf);
    }

    @Override
    public Sequence<K> keys() {
        return walk(true, AvlTree.Node::key);
    }

    @Override
    public Sequence<V> values() {
        return walk(true, AvlTree.Node::value);
    }

    @Override
    public Sequence<MapEntry<K, V>> range(final @Nullable Bound<K> lower, final @Nullable Bound<K> upper) {
        return rangeOf(lower, upper, true, PersistentTreeMap::entryOf);
    }

    @Override
    public Sequence<MapEntry<K, V>> reverseRange(final @Nullable Bound<K> lower, final @Nullable Bound<K> upper) {
        return rangeOf(lower, upper, false, PersistentTreeMap::entryOf);
    }

    @Override
    public @NonNull Iterator<MapEntry<K, V>> iterator() {
        return seq().iterator();
    }

    @Override
    public boolean equals(final @Nullable Object object) {
        return Equivalence.mapEquals(this, object);
    }

    @Override
    public int hashCode() {
        return Equivalence.mapHash(this);
    }

    @Override
    public String toString() {
        return PersistentHashMap.printEntries(this);
    }

    <E> Sequence<E> walk(final boolean ascending, final Function<? super AvlTree.Node<K, V>, ? extends E> projection) {
        return TreeSeq.over(root, ascending, projection, count);
    }

    <E> Sequence<E> rangeOf(
        final @Nullable Bound<K> lower,
        final @Nullable Bound<K> upper,
        final boolean ascending,
        final Function<? super AvlTree.Node<K, V>, ? extends E> projection
    ) {
        return LazySeq.of(() -> {
            final Predicate<AvlTree.Node<K, V>> aboveLower = node -> lower == null
                || lower.admitsAsLower(comparator.compare(node.key(), lower.key()));
            final Predicate<AvlTree.Node<K, V>> belowUpper = node -> upper == null
                || upper.admitsAsUpper(comparator.compare(node.key(), upper.key()));
            final var start = ascending ? lower : upper;
            Sequence<AvlTree.Node<K, V>> nodes = (start == null)
                ? TreeSeq.over(root, ascending, Function.identity(), -1)
                : TreeSeq.from(root, start.key(), comparator, ascending, Function.identity());
            // Starting from the bound's key leaves at most one excluded element in front.
            nodes = Sequences.dropWhile(nodes, (ascending ? aboveLower : belowUpper).negate());
            return Sequences.map(Sequences.takeWhile(nodes, ascending ? belowUpper : aboveLower), projection);
        });
    }

    AvlTree.@Nullable Node<K, V> root() {
        return root;
    }

    private static <K, V> MapEntry<K, V> entryOf(final AvlTree.Node<K, V> node) {
        return MapEntry.of(node.key(), node.value());
    }

    private static final PersistentTreeMap<?, ?> empty = new PersistentTreeMap<>(Comparison.natural(), null, 0);

    private final Comparator<? super K> comparator;
    private final AvlTree.@Nullable Node<K, V> root;
    private final long count;
}
