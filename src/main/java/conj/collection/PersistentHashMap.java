// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import java.util.Iterator;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An unordered persistent map built on a hash array mapped trie.
 * <p>
 * Lookup, {@link #assoc(Object, Object)} and {@link #without(Object)} take time logarithmic in the size, base 32,
 * so effectively constant; every update shares all nodes off the path to the changed key. Keys are compared with
 * {@link Object#equals(Object)} and hashed with {@link Object#hashCode()}, except that numbers hash by numeric value;
 * {@code null} is a valid key and a valid value. Iteration order is unspecified but stable for a given map.
 */
public final class PersistentHashMap<K, V> extends ImmutableCollection<MapEntry<K, V>>
    implements PersistentMap<K, V>, Counted {
    private PersistentHashMap(
        final long count,
        final HashTrie.@Nullable Node root,
        final boolean hasNull,
        final @Nullable Object nullValue
    ) {
        this.count = count;
        this.root = root;
        this.hasNull = hasNull;
        this.nullValue = nullValue;
    }

    @SuppressWarnings("unchecked")
    public static <K, V> PersistentHashMap<K, V> empty() {
        return (PersistentHashMap<K, V>) empty;
    }

    public static <K, V> PersistentHashMap<K, V> of(final K key, final V value) {
        return PersistentHashMap.<K, V>empty().assoc(key, value);
    }

    public static <K, V> PersistentHashMap<K, V> of(final K key1, final V value1, final K key2, final V value2) {
        return PersistentHashMap.<K, V>empty().assoc(key1, value1).assoc(key2, value2);
    }

    public static <K, V> PersistentHashMap<K, V> of(
        final K key1,
        final V value1,
        final K key2,
        final V value2,
        final K key3,
        final V value3
    ) {
        return PersistentHashMap.<K, V>empty().assoc(key1, value1).assoc(key2, value2).assoc(key3, value3);
    }

    /**
     * Creates a map from alternating keys and values; later duplicates win.
     *
     * @throws IllegalArgumentException If the number of arguments is odd.
     */
    @SuppressWarnings("unchecked")
    public static <K, V> PersistentHashMap<K, V> ofPairs(final @Nullable Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Odd number of arguments: " + keysAndValues.length);
        }
        PersistentHashMap<K, V> result = empty();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            result = result.assoc((K) keysAndValues[i], (V) keysAndValues[i + 1]);
        }
        return result;
    }

    public static <K, V> PersistentHashMap<K, V> fromEntries(final Iterable<? extends MapEntry<K, V>> entries) {
        PersistentHashMap<K, V> result = empty();
        for (final var entry : entries) {
            result = result.assoc(entry.key(), entry.value());
        }
        return result;
    }

    public static <K, V> PersistentHashMap<K, V> fromMap(final Map<? extends K, ? extends V> map) {
        PersistentHashMap<K, V> result = empty();
        for (final var entry : map.entrySet()) {
            result = result.assoc(entry.getKey(), entry.getValue());
        }
        return result;
    }

    @Override
    public long count() {
        return count;
    }

    @Override
    public boolean isEmpty() {
        return count == 0;
    }

    @Override
    public @Nullable Object valAt(final @Nullable Object key, final @Nullable Object notFound) {
        final var entry = find(key);
        return (entry == null) ? notFound : entry.value();
    }

    @Override
    @SuppressWarnings("unchecked")
    public @Nullable V get(final @Nullable Object key) {
        return (V) valAt(key, null);
    }

    @Override
    @SuppressWarnings("unchecked")
    public @Nullable MapEntry<K, V> find(final @Nullable Object key) {
        if (key == null) {
            return hasNull ? MapEntry.of(null, (V) nullValue) : null;
        }
        final var node = root;
        return (node == null) ? null : (MapEntry<K, V>) (MapEntry<?, ?>) node.find(0, HashTrie.hash(key), key);
    }

    @Override
    public boolean containsKey(final @Nullable Object key) {
        return find(key) != null;
    }

    /**
     * Returns {@code true} iff the argument is a {@link MapEntry} present in this map.
     */
    @Override
    public boolean contains(final @Nullable Object object) {
        if (!(object instanceof final MapEntry<?, ?> entry)) {
            return false;
        }
        final var found = find(entry.key());
        return found != null && Equivalence.equal(found.value(), entry.value());
    }

    @Override
    public PersistentHashMap<K, V> assoc(final K key, final V value) {
        if (key == null) {
            if (hasNull && nullValue == value) {
                return this;
            }
            return new PersistentHashMap<>(hasNull ? count : count + 1, root, true, value);
        }
        final var addedLeaf = new HashTrie.AddedLeaf();
        final var oldRoot = (root == null) ? HashTrie.emptyNode() : root;
        final var newRoot = oldRoot.assoc(0, HashTrie.hash(key), key, value, addedLeaf);
        if (newRoot == root) {
            return this;
        }
        return new PersistentHashMap<>(addedLeaf.added ? count + 1 : count, newRoot, hasNull, nullValue);
    }

    @Override
    public PersistentHashMap<K, V> without(final @Nullable Object key) {
        if (key == null) {
            return hasNull ? new PersistentHashMap<>(count - 1, root, false, null) : this;
        }
        final var node = root;
        if (node == null) {
            return this;
        }
        final var newRoot = node.without(0, HashTrie.hash(key), key);
        if (newRoot == node) {
            return this;
        }
        return new PersistentHashMap<>(count - 1, newRoot, hasNull, nullValue);
    }

    @Override
    public PersistentHashMap<K, V> conj(final MapEntry<K, V> entry) {
        return assoc(entry.key(), entry.value());
    }

    /**
     * Returns a map with every entry of {@code other} added, its values winning over this map's.
     */
    public PersistentHashMap<K, V> merge(final PersistentMap<? extends K, ? extends V> other) {
        var result = this;
        for (final var entry : other) {
            result = result.assoc(entry.key(), entry.value());
        }
        return result;
    }

    @Override
    public PersistentHashMap<K, V> cleared() {
        return empty();
    }

    @Override
    @SuppressWarnings("unchecked")
    public Sequence<MapEntry<K, V>> seq() {
        final var node = root;
        Sequence<MapEntry<Object, Object>> entries = (node == null) ? PersistentList.empty() : node.entries(
            PersistentList.empty()
        );
        if (hasNull) {
            entries = new Cons<>(MapEntry.of(null, nullValue), entries);
        }
        return (Sequence<MapEntry<K, V>>) (Sequence<?>) entries;
    }

    @Override
    public Sequence<K> keys() {
        return Sequences.map(seq(), MapEntry::key);
    }

    @Override
    public Sequence<V> values() {
        return Sequences.map(seq(), MapEntry::value);
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
        return printEntries(this);
    }

    static String printEntries(final PersistentMap<?, ?> map) {
        final var builder = new StringBuilder("{");
        var first = true;
        for (final var entry : map) {
            if (!first) {
                builder.append(", ");
            }
            builder.append(entry.key()).append(' ').append(entry.value());
            first = false;
        }
        return builder.append('}').toString();
    }

    HashTrie.@Nullable Node root() {
        return root;
    }

    private static final PersistentHashMap<?, ?> empty = new PersistentHashMap<>(0, null, false, null);

    private final long count;
    private final HashTrie.@Nullable Node root;
    private final boolean hasNull;
    private final @Nullable Object nullValue;
}
