// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.dispatch;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import conj.collection.Associative;
import conj.collection.Bound;
import conj.collection.Indexed;
import conj.collection.LazySeq;
import conj.collection.MapEntry;
import conj.collection.PersistentCollection;
import conj.collection.PersistentHashMap;
import conj.collection.PersistentList;
import conj.collection.PersistentMap;
import conj.collection.PersistentSet;
import conj.collection.PersistentStack;
import conj.collection.PersistentVector;
import conj.collection.Reversible;
import conj.collection.Sequence;
import conj.collection.Sequences;
import conj.collection.Sequential;
import conj.collection.Sorted;
import conj.util.annotation.Nullable;
import conj.util.condition.ConditionContext;
import conj.util.condition.UnhandledErrorError;

/**
 * The generic collection operations, applicable to any value.
 * <p>
 * Each operation looks at what the value can do and forwards to the matching capability interface. A value without the
 * needed capability signals {@link UnsupportedCapabilityCondition} as an error; nothing is emulated. {@code null}
 * stands for the empty collection wherever that makes sense.
 */
public final class Abstractions {
    private Abstractions() {
    }

    public static Set<Capability> capabilitiesOf(final @Nullable Object value) {
        return CapabilityTable.of(value);
    }

    public static boolean supports(final @Nullable Object value, final Capability capability) {
        return CapabilityTable.of(value).contains(capability);
    }

    // Collection

    /**
     * Adds the element the way the collection adds most cheaply. {@code null} becomes a one-element list.
     * <p>
     * Maps accept a {@link MapEntry}, any two-element sequential value as a key and a value, or another map, whose
     * entries are all added.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static Object conj(final @Nullable Object collection, final @Nullable Object element) {
        if (collection == null) {
            return PersistentList.of(element);
        }
        if (collection instanceof final PersistentMap map) {
            return conjToMap(map, element);
        }
        if (collection instanceof final PersistentCollection persistent) {
            return persistent.conj(element);
        }
        throw unsupported(Capability.COLLECTION, "conj onto", collection);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Object conjToMap(final PersistentMap map, final @Nullable Object element) {
        if (element == null) {
            return map;
        }
        if (element instanceof final MapEntry entry) {
            return map.conj(entry);
        }
        if (element instanceof final PersistentMap other) {
            var result = map;
            for (final var entry : (Iterable<MapEntry>) other) {
                result = result.conj(entry);
            }
            return result;
        }
        if (element instanceof Sequential && count(element) == 2) {
            return map.assoc(nth(element, 0), nth(element, 1));
        }
        throw new IllegalArgumentException("Cannot conj " + element + " onto a map: expected an entry or a map");
    }

    /**
     * Returns a sequence over the value, or {@code null} if it is empty.
     */
    public static @Nullable Sequence<?> seq(final @Nullable Object value) {
        final var sequence = sequenceView(value);
        return sequence.isEmpty() ? null : sequence;
    }

    /**
     * Returns the number of elements.
     * <p>
     * Constant time for persistent collections except lazy sequences, which are walked, and realized, in full.
     */
    public static long count(final @Nullable Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof final PersistentCollection<?> collection) {
            return collection.count();
        }
        if (value instanceof final Collection<?> collection) {
            return collection.size();
        }
        if (value instanceof final CharSequence string) {
            return string.length();
        }
        if (value instanceof final Object[] array) {
            return array.length;
        }
        throw unsupported(Capability.COLLECTION, "count", value);
    }

    public static boolean isEmpty(final @Nullable Object value) {
        if (value instanceof final PersistentCollection<?> collection) {
            return collection.isEmpty();
        }
        return seq(value) == null;
    }

    // Sequence

    public static @Nullable Object first(final @Nullable Object value) {
        return sequenceView(value).first();
    }

    public static Sequence<?> rest(final @Nullable Object value) {
        return sequenceView(value).rest();
    }

    public static @Nullable Sequence<?> next(final @Nullable Object value) {
        return sequenceView(value).next();
    }

    // Associative

    public static @Nullable Object get(final @Nullable Object collection, final @Nullable Object key) {
        return valAt(collection, key, null);
    }

    /**
     * Looks the key up in a map or vector, or the member in a set.
     */
    public static @Nullable Object valAt(
        final @Nullable Object collection,
        final @Nullable Object key,
        final @Nullable Object notFound
    ) {
        if (collection == null) {
            return notFound;
        }
        if (collection instanceof final Associative<?, ?> associative) {
            return associative.valAt(key, notFound);
        }
        if (collection instanceof final PersistentSet<?> set) {
            return set.contains(key) ? set.get(key) : notFound;
        }
        throw unsupported(Capability.ASSOCIATIVE, "look up a key in", collection);
    }

    public static @Nullable MapEntry<?, ?> find(final @Nullable Object collection, final @Nullable Object key) {
        if (collection == null) {
            return null;
        }
        if (collection instanceof final Associative<?, ?> associative) {
            return associative.find(key);
        }
        throw unsupported(Capability.ASSOCIATIVE, "find an entry in", collection);
    }

    public static boolean containsKey(final @Nullable Object collection, final @Nullable Object key) {
        if (collection == null) {
            return false;
        }
        if (collection instanceof final Associative<?, ?> associative) {
            return associative.containsKey(key);
        }
        if (collection instanceof final PersistentSet<?> set) {
            return set.contains(key);
        }
        throw unsupported(Capability.ASSOCIATIVE, "look up a key in", collection);
    }

    /**
     * Associates the key with the value. {@code null} becomes a one-entry hash map; vectors take any integral index.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static Object assoc(
        final @Nullable Object collection,
        final @Nullable Object key,
        final @Nullable Object value
    ) {
        if (collection == null) {
            return PersistentHashMap.of(key, value);
        }
        if (collection instanceof final PersistentVector vector && key instanceof final Number index) {
            return vector.assocN(index.longValue(), value);
        }
        if (collection instanceof final Associative associative) {
            return associative.assoc(key, value);
        }
        throw unsupported(Capability.ASSOCIATIVE, "assoc onto", collection);
    }

    public static @Nullable Object dissoc(final @Nullable Object collection, final @Nullable Object key) {
        if (collection == null) {
            return null;
        }
        if (collection instanceof final PersistentMap<?, ?> map) {
            return map.without(key);
        }
        throw unsupported(Capability.ASSOCIATIVE, "dissoc from", collection);
    }

    // Indexed

    /**
     * Returns the element at the index.
     * <p>
     * Indexed collections answer in logarithmic time or better; other sequential values are walked from the start.
     *
     * @throws IndexOutOfBoundsException If the index is out of range.
     */
    public static @Nullable Object nth(final @Nullable Object collection, final long index) {
        if (collection == null) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for length 0");
        }
        if (collection instanceof final Indexed<?> indexed) {
            return indexed.nth(index);
        }
        if (collection instanceof final Sequence<?> sequence && collection instanceof Sequential) {
            return Sequences.nth(sequence, index);
        }
        if (collection instanceof final List<?> list) {
            return list.get((int) Objects.checkIndex(index, list.size()));
        }
        if (collection instanceof final CharSequence string) {
            return string.charAt((int) Objects.checkIndex(index, string.length()));
        }
        if (collection instanceof final Object[] array) {
            return array[(int) Objects.checkIndex(index, array.length)];
        }
        throw unsupported(Capability.INDEXED, "index into", collection);
    }

    /**
     * Returns the element at the index, or {@code notFound} if the index is out of range.
     */
    public static @Nullable Object nth(
        final @Nullable Object collection,
        final long index,
        final @Nullable Object notFound
    ) {
        if (collection == null) {
            return notFound;
        }
        if (collection instanceof final Indexed<?> indexed) {
            return indexed.nth(index, notFound);
        }
        if (collection instanceof final Sequence<?> sequence && collection instanceof Sequential) {
            if (index < 0) {
                return notFound;
            }
            Sequence<?> current = sequence;
            for (long i = 0; i < index; i += 1) {
                final var next = current.next();
                if (next == null) {
                    return notFound;
                }
                current = next;
            }
            return current.isEmpty() ? notFound : current.first();
        }
        if (collection instanceof final List<?> list) {
            return (index >= 0 && index < list.size()) ? list.get((int) index) : notFound;
        }
        if (collection instanceof final CharSequence string) {
            return (index >= 0 && index < string.length()) ? string.charAt((int) index) : notFound;
        }
        if (collection instanceof final Object[] array) {
            return (index >= 0 && index < array.length) ? array[(int) index] : notFound;
        }
        throw unsupported(Capability.INDEXED, "index into", collection);
    }

    // Stack

    public static @Nullable Object peek(final @Nullable Object collection) {
        if (collection == null) {
            return null;
        }
        if (collection instanceof final PersistentStack<?> stack) {
            return stack.peek();
        }
        throw unsupported(Capability.STACK, "peek at", collection);
    }

    /**
     * @throws IllegalStateException If the stack is empty.
     */
    public static @Nullable Object pop(final @Nullable Object collection) {
        if (collection == null) {
            return null;
        }
        if (collection instanceof final PersistentStack<?> stack) {
            return stack.pop();
        }
        throw unsupported(Capability.STACK, "pop from", collection);
    }

    // Set

    public static @Nullable Object disj(final @Nullable Object set, final @Nullable Object element) {
        if (set == null) {
            return null;
        }
        if (set instanceof final PersistentSet<?> persistentSet) {
            return persistentSet.disj(element);
        }
        throw unsupported(Capability.SET, "disj from", set);
    }

    /**
     * Tests membership: of a member in a set, of a key in a map, of an index in a vector.
     */
    public static boolean contains(final @Nullable Object collection, final @Nullable Object element) {
        if (collection == null) {
            return false;
        }
        if (collection instanceof final PersistentSet<?> set) {
            return set.contains(element);
        }
        if (collection instanceof final Associative<?, ?> associative) {
            return associative.containsKey(element);
        }
        throw unsupported(Capability.SET, "test membership in", collection);
    }

    // Sorted

    @SuppressWarnings({"unchecked", "rawtypes"})
    public static Sequence<?> range(
        final @Nullable Object collection,
        final @Nullable Bound<?> lower,
        final @Nullable Bound<?> upper
    ) {
        if (collection instanceof final Sorted sorted) {
            return sorted.range(lower, upper);
        }
        throw unsupported(Capability.SORTED, "take a range of", collection);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    public static Sequence<?> reverseRange(
        final @Nullable Object collection,
        final @Nullable Bound<?> lower,
        final @Nullable Bound<?> upper
    ) {
        if (collection instanceof final Sorted sorted) {
            return sorted.reverseRange(lower, upper);
        }
        throw unsupported(Capability.SORTED, "take a range of", collection);
    }

    // Reversible

    /**
     * Returns a sequence over the elements in reverse order, or {@code null} if there are none.
     */
    public static @Nullable Sequence<?> rseq(final @Nullable Object collection) {
        if (collection == null) {
            return null;
        }
        if (collection instanceof final Reversible<?> reversible) {
            final var sequence = reversible.rseq();
            return sequence.isEmpty() ? null : sequence;
        }
        throw unsupported(Capability.REVERSIBLE, "reverse", collection);
    }

    /**
     * Returns a possibly empty sequence over the value, signalling a capability error if it has no sequence view.
     */
    public static Sequence<?> sequenceView(final @Nullable Object value) {
        if (value == null) {
            return PersistentList.empty();
        }
        if (value instanceof final PersistentCollection<?> collection) {
            return collection.seq();
        }
        if (value instanceof final Iterable<?> iterable) {
            return Sequences.of(iterable);
        }
        if (value instanceof final CharSequence string) {
            return charactersOf(string, 0);
        }
        if (value instanceof final Object[] array) {
            return Sequences.of(Arrays.asList(array));
        }
        throw unsupported(Capability.SEQUENCEABLE, "take a sequence of", value);
    }

    private static Sequence<Character> charactersOf(final CharSequence string, final int index) {
        return LazySeq.of(() -> (index < string.length())
            ? Sequences.cons(string.charAt(index), charactersOf(string, index + 1))
            : null);
    }

    private static UnhandledErrorError unsupported(
        final Capability capability,
        final String operation,
        final @Nullable Object value
    ) {
        return ConditionContext.error(new UnsupportedCapabilityCondition(capability, operation, value));
    }
}
