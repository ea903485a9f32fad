// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Comparator;
import conj.util.SimpleClassValue;
import conj.util.condition.ConditionContext;
import conj.util.condition.UnhandledErrorError;
import conj.value.Keyword;
import conj.value.Symbol;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The default ordering of sorted collections.
 * <p>
 * {@code null} sorts before everything else. Numbers compare numerically, whatever their boxed type; strings,
 * characters and booleans compare naturally; keywords and symbols by name; vectors first by length, then element by
 * element. Any other {@link Comparable} value compares with values of exactly the same class. Everything else,
 * including values of two different kinds, is incomparable: comparing them signals
 * {@link IncomparableValuesCondition}.
 */
public final class Comparison {
    private Comparison() {
    }

    public static Comparator<@Nullable Object> natural() {
        return natural;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    public static int compare(final @Nullable Object left, final @Nullable Object right) {
        if (left == right) {
            return 0;
        }
        if (left == null) {
            return -1;
        }
        if (right == null) {
            return 1;
        }
        final var leftKind = kinds.get(left.getClass());
        if (leftKind != kinds.get(right.getClass())) {
            throw incomparable(left, right);
        }
        return switch (leftKind) {
            case NUMBER -> compareNumbers((Number) left, (Number) right);
            case STRING, CHARACTER, BOOLEAN, KEYWORD, SYMBOL -> ((Comparable) left).compareTo(right);
            case VECTOR -> compareVectors(left, right);
            case COMPARABLE -> {
                if (left.getClass() != right.getClass()) {
                    throw incomparable(left, right);
                }
                yield ((Comparable) left).compareTo(right);
            }
            case OPAQUE -> throw incomparable(left, right);
        };
    }

    private static int compareNumbers(final Number left, final Number right) {
        final var leftType = numberTypes.get(left.getClass());
        final var rightType = numberTypes.get(right.getClass());
        if (leftType == NumberType.INTEGRAL && rightType == NumberType.INTEGRAL) {
            return Long.compare(left.longValue(), right.longValue());
        }
        if (leftType == NumberType.FLOATING || rightType == NumberType.FLOATING) {
            return Double.compare(left.doubleValue(), right.doubleValue());
        }
        if (leftType == NumberType.DECIMAL || rightType == NumberType.DECIMAL) {
            return toBigDecimal(left, leftType).compareTo(toBigDecimal(right, rightType));
        }
        return toBigInteger(left, leftType).compareTo(toBigInteger(right, rightType));
    }

    private static BigInteger toBigInteger(final Number number, final NumberType type) {
        return (type == NumberType.BIG_INTEGER) ? (BigInteger) number : BigInteger.valueOf(number.longValue());
    }

    private static BigDecimal toBigDecimal(final Number number, final NumberType type) {
        return switch (type) {
            case DECIMAL -> (BigDecimal) number;
            case BIG_INTEGER -> new BigDecimal((BigInteger) number);
            case INTEGRAL -> BigDecimal.valueOf(number.longValue());
            case FLOATING -> BigDecimal.valueOf(number.doubleValue());
        };
    }

    private static int compareVectors(final Object left, final Object right) {
        final var leftCount = ((PersistentCollection<?>) left).count();
        final var rightCount = ((PersistentCollection<?>) right).count();
        if (leftCount != rightCount) {
            return Long.compare(leftCount, rightCount);
        }
        final var leftIndexed = (Indexed<?>) left;
        final var rightIndexed = (Indexed<?>) right;
        for (long i = 0; i < leftCount; i += 1) {
            final var result = compare(leftIndexed.nth(i), rightIndexed.nth(i));
            if (result != 0) {
                return result;
            }
        }
        return 0;
    }

    private static UnhandledErrorError incomparable(final Object left, final Object right) {
        return ConditionContext.error(new IncomparableValuesCondition(left, right));
    }

    private static Kind classify(final Class<?> clazz) {
        if (Number.class.isAssignableFrom(clazz)) {
            return Kind.NUMBER;
        }
        if (clazz == String.class) {
            return Kind.STRING;
        }
        if (clazz == Character.class) {
            return Kind.CHARACTER;
        }
        if (clazz == Boolean.class) {
            return Kind.BOOLEAN;
        }
        if (clazz == Keyword.class) {
            return Kind.KEYWORD;
        }
        if (clazz == Symbol.class) {
            return Kind.SYMBOL;
        }
        if (Indexed.class.isAssignableFrom(clazz) && Sequential.class.isAssignableFrom(clazz)
            && PersistentCollection.class.isAssignableFrom(clazz)) {
            return Kind.VECTOR;
        }
        if (Comparable.class.isAssignableFrom(clazz)) {
            return Kind.COMPARABLE;
        }
        return Kind.OPAQUE;
    }

    private static NumberType classifyNumber(final Class<?> clazz) {
        if (clazz == Long.class || clazz == Integer.class || clazz == Short.class || clazz == Byte.class) {
            return NumberType.INTEGRAL;
        }
        if (clazz == BigInteger.class) {
            return NumberType.BIG_INTEGER;
        }
        if (clazz == BigDecimal.class) {
            return NumberType.DECIMAL;
        }
        return NumberType.FLOATING;
    }

    private enum Kind {
        NUMBER,
        STRING,
        CHARACTER,
        BOOLEAN,
        KEYWORD,
        SYMBOL,
        VECTOR,
        COMPARABLE,
        OPAQUE,
    }

    private enum NumberType {
        INTEGRAL,
        BIG_INTEGER,
        DECIMAL,
        FLOATING,
    }

    private static final SimpleClassValue<Kind> kinds = new SimpleClassValue<>(Comparison::classify);
    private static final SimpleClassValue<NumberType> numberTypes = new SimpleClassValue<>(Comparison::classifyNumber);
    private static final Comparator<@Nullable Object> natural = Comparison::compare;
}
