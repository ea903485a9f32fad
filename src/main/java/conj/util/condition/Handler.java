// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.util.condition;

import conj.util.SneakyThrow;
import conj.util.annotation.Nullable;

/**
 * A condition handler, installed for the duration of a try-with-resources block.
 * <p>
 * When a condition is signalled, the procedures of the installed handlers run from the most recently installed one to
 * the oldest, until one of them transfers control elsewhere.
 */
public final class Handler implements AutoCloseable {
    /**
     * Installs a handler running the given procedure in the calling thread's {@link ConditionContext}.
     */
    public Handler(final HandlerProcedure procedure) {
        final var context = ConditionContext.localContext();
        next = context.firstHandler;
        this.procedure = procedure;
        owner = context;
        context.firstHandler = this;
    }

    /**
     * Does nothing; referencing the resource silences unused-variable warnings in try-with-resources blocks.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Uninstalls the handler. Handlers must be closed by their own thread, newest first.
     */
    @Override
    public void close() {
        assert owner == ConditionContext.localContext() : "Handler closed by a different thread";
        assert owner.firstHandler == this : "Handlers closed out of order";
        owner.firstHandler = next;
    }

    void handle(final SignaledCondition condition) {
        try {
            procedure.handle(condition);
        } catch (final Unwind unwind) {
            throw SneakyThrow.doThrow(unwind);
        }
    }

    final @Nullable Handler next;
    private final HandlerProcedure procedure;
    private final ConditionContext owner;
}
