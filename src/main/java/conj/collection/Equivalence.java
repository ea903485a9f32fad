// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import conj.util.condition.ConditionContext;
import conj.util.condition.Handler;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Structural equality and hashing shared by the collection families.
 * <p>
 * Elements are equal under {@link Object#equals(Object)}, but numbers hash by numeric value, so numbers the default
 * sorted-collection comparator considers the same also hash the same. Map and set equality check containment both
 * ways, which keeps it symmetric between hash-based and comparator-based collections. A sorted collection asked about
 * a key its comparator cannot order is not equal to the collection that holds that key.
 */
final class Equivalence {
    private Equivalence() {
    }

    static boolean equal(final @Nullable Object left, final @Nullable Object right) {
        return Objects.equals(left, right);
    }

    static int hash(final @Nullable Object object) {
        if (object instanceof final Number number) {
            return numericHash(number);
        }
        return Objects.hashCode(object);
    }

    // Integral values in the range of long hash as that long; everything else hashes as its double.
    private static int numericHash(final Number number) {
        if (number instanceof Long || number instanceof Integer || number instanceof Short
            || number instanceof Byte) {
            return Long.hashCode(number.longValue());
        }
        if (number instanceof final BigInteger integer) {
            return (integer.bitLength() < Long.SIZE) ? Long.hashCode(integer.longValue()) : doubleHash(integer);
        }
        if (number instanceof final BigDecimal decimal) {
            final var stripped = decimal.stripTrailingZeros();
            return (stripped.scale() <= 0) ? numericHash(stripped.toBigInteger()) : doubleHash(decimal);
        }
        final var value = number.doubleValue();
        if (value == Math.rint(value) && value >= minLong && value < maxLongExclusive) {
            return Long.hashCode((long) value);
        }
        return doubleHash(number);
    }

    private static int doubleHash(final Number number) {
        return Double.hashCode(number.doubleValue());
    }

    static boolean sequentialEquals(final Iterable<?> self, final @Nullable Object object) {
        if (self == object) {
            return true;
        }
        if (!(object instanceof Sequential) || !(object instanceof final Iterable<?> other)) {
            return false;
        }
        if (self instanceof final PersistentCollection<?> left && object instanceof final PersistentCollection<?> right
            && isCounted(left) && isCounted(right) && left.count() != right.count()) {
            return false;
        }
        final var leftIterator = self.iterator();
        final var rightIterator = other.iterator();
        while (leftIterator.hasNext() && rightIterator.hasNext()) {
            if (!equal(leftIterator.next(), rightIterator.next())) {
                return false;
            }
        }
        return !leftIterator.hasNext() && !rightIterator.hasNext();
    }

    static int sequentialHash(final Iterable<?> self) {
        var hash = 1;
        for (final var element : self) {
            hash = 31 * hash + hash(element);
        }
        return hash;
    }

    static boolean mapEquals(final PersistentMap<?, ?> self, final @Nullable Object object) {
        if (self == object) {
            return true;
        }
        if (!(object instanceof final PersistentMap<?, ?> other) || self.count() != other.count()) {
            return false;
        }
        return unlessIncomparable(
            self,
            other,
            () -> containsAllEntries(other, self) && containsAllEntries(self, other)
        );
    }

    private static boolean containsAllEntries(final PersistentMap<?, ?> map, final PersistentMap<?, ?> entries) {
        for (final var entry : entries) {
            final var found = map.valAt(entry.key(), Absent.MARKER);
            if (found == Absent.MARKER || !equal(found, entry.value())) {
                return false;
            }
        }
        return true;
    }

    static int mapHash(final PersistentMap<?, ?> self) {
        var hash = 0;
        for (final var entry : self) {
            hash += hash(entry.key()) ^ hash(entry.value());
        }
        return hash;
    }

    static boolean setEquals(final PersistentSet<?> self, final @Nullable Object object) {
        if (self == object) {
            return true;
        }
        if (!(object instanceof final PersistentSet<?> other) || self.count() != other.count()) {
            return false;
        }
        return unlessIncomparable(
            self,
            other,
            () -> containsAllElements(other, self) && containsAllElements(self, other)
        );
    }

    private static boolean containsAllElements(final PersistentSet<?> set, final PersistentSet<?> elements) {
        for (final var element : elements) {
            if (!set.contains(element)) {
                return false;
            }
        }
        return true;
    }

    static int setHash(final PersistentSet<?> self) {
        var hash = 0;
        for (final var element : self) {
            hash += hash(element);
        }
        return hash;
    }

    // Runs the comparison, answering false if a sorted side signals IncomparableValuesCondition during it.
    private static boolean unlessIncomparable(
        final Object self,
        final Object other,
        final BooleanSupplier comparison
    ) {
        if (!(self instanceof Sorted<?, ?>) && !(other instanceof Sorted<?, ?>)) {
            return comparison.getAsBoolean();
        }
        final Boolean result = ConditionContext.withRestart("treat the collections as unequal", restart -> {
            try (final var handler = new Handler(signaled -> {
                if (signaled.condition() instanceof IncomparableValuesCondition) {
                    restart.unwindTo();
                }
            })) {
                handler.use();
                return comparison.getAsBoolean();
            }
        });
        return result != null && result;
    }

    // Counting a lazy sequence would realize it, which equality must not do beyond what it compares.
    private static boolean isCounted(final PersistentCollection<?> collection) {
        return collection instanceof Counted;
    }

    private static final double minLong = -0x1p63;
    private static final double maxLongExclusive = 0x1p63;
}
