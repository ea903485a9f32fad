// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.util.condition;

/**
 * Thrown by {@link ConditionContext#error(Condition)} when no handler took a non-local exit.
 * <p>
 * Reaching this means the caller used an operation in a way it cannot support, so it is an {@link AssertionError}.
 */
public final class UnhandledErrorError extends AssertionError {
    UnhandledErrorError(final Condition condition) {
        super(condition.detailedMessage());
        this.condition = condition;
    }

    /**
     * Retrieves the condition nobody handled.
     */
    public Condition condition() {
        return condition;
    }

    private final transient Condition condition;
}
