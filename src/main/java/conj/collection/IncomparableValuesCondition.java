// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import conj.util.condition.Condition;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Signalled by {@link Comparison#natural()} when asked to order two values of different kinds, such as a number and a
 * string, or values of a kind that has no natural order.
 */
public final class IncomparableValuesCondition extends Condition {
    public IncomparableValuesCondition(final @Nullable Object left, final @Nullable Object right) {
        super("Cannot compare " + describe(left) + " with " + describe(right));
        this.left = left;
        this.right = right;
    }

    public @Nullable Object left() {
        return left;
    }

    public @Nullable Object right() {
        return right;
    }

    private static String describe(final @Nullable Object value) {
        return (value == null) ? "nil" : value + " (" + value.getClass().getSimpleName() + ")";
    }

    private final @Nullable Object left;
    private final @Nullable Object right;
}
