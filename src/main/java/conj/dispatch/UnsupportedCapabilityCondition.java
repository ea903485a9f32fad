// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.dispatch;

import conj.util.annotation.Nullable;
import conj.util.condition.Condition;

/**
 * Signalled when an operation is applied to a value that lacks the capability the operation needs, such as
 * {@code nth} on a map or {@code assoc} on a list.
 */
public final class UnsupportedCapabilityCondition extends Condition {
    public UnsupportedCapabilityCondition(
        final Capability capability,
        final String operation,
        final @Nullable Object value
    ) {
        super("Cannot " + operation + " " + describe(value) + ": it is not " + capability.description());
        this.capability = capability;
        this.operation = operation;
        this.value = value;
    }

    public Capability capability() {
        return capability;
    }

    public String operation() {
        return operation;
    }

    public @Nullable Object value() {
        return value;
    }

    private static String describe(final @Nullable Object value) {
        return (value == null) ? "nil" : "a " + value.getClass().getSimpleName();
    }

    private final Capability capability;
    private final String operation;
    private final @Nullable Object value;
}
