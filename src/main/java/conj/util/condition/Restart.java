// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.util.condition;

import conj.util.SneakyThrow;
import conj.util.annotation.Nullable;

/**
 * A point the stack can be unwound to, established by {@link ConditionContext#withRestart(String, RestartCallback)}.
 */
public final class Restart {
    Restart(final String name) {
        final var context = ConditionContext.localContext();
        next = context.firstRestart;
        this.name = name;
        owner = context;
        context.firstRestart = this;
    }

    /**
     * Retrieves the user-readable name of this restart.
     */
    public String name() {
        return name;
    }

    /**
     * Unwinds the stack to this restart, making the corresponding {@code withRestart} call return {@code null}.
     * <p>
     * Never returns normally.
     */
    public void unwindTo() {
        throw SneakyThrow.doThrow(new Unwind(this));
    }

    void unlink() {
        assert owner == ConditionContext.localContext() : "Restart unlinked by a different thread";
        assert owner.firstRestart == this : "Restarts unlinked out of order";
        owner.firstRestart = next;
    }

    @Override
    public String toString() {
        return "#<restart " + name + ">";
    }

    final @Nullable Restart next;
    private final String name;
    private final ConditionContext owner;
}
