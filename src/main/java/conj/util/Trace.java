// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.util;

import conj.collection.PersistentList;
import conj.collection.PersistentVector;
import conj.util.condition.MessageSupplier;

/**
 * A user-readable note about what the current thread is doing, established with try-with-resources.
 * <p>
 * Traces describe operations in terms of the library's domain ("destructuring a map pattern against a vector"), not
 * in terms of Java frames. They are the library's only diagnostic channel: every
 * {@link conj.util.condition.Condition} captures the active traces when it is created.
 * <p>
 * A trace must be closed by the thread that created it, in reverse order of creation.
 */
public final class Trace implements AutoCloseable {
    /**
     * Establishes a trace whose message is computed only if somebody asks for it. The supplier runs at most once.
     */
    public Trace(final MessageSupplier supplier) {
        this((Object) supplier);
    }

    /**
     * Establishes a trace with a fixed message.
     */
    public Trace(final String message) {
        this((Object) message);
    }

    private Trace(final Object messageOrSupplier) {
        this.messageOrSupplier = messageOrSupplier;
        final var stack = traceStack.get();
        stack.traces = stack.traces.cons(this);
        owner = stack;
    }

    /**
     * Returns the messages of the calling thread's active traces, innermost first.
     */
    public static PersistentVector<String> activeTraces() {
        final var builder = new PersistentVector.Builder<String>();
        for (final var trace : traceStack.get().traces) {
            builder.append(trace.message());
        }
        return builder.toVector();
    }

    /**
     * Does nothing; referencing the resource silences unused-variable warnings in try-with-resources blocks.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Removes this trace from the calling thread's stack.
     */
    @Override
    public void close() {
        assert owner == traceStack.get() : "Trace closed by a different thread";
        assert owner.traces.peek() == this : "Traces closed out of order";
        owner.traces = owner.traces.pop();
    }

    private String message() {
        if (messageOrSupplier instanceof final MessageSupplier supplier) {
            final var computed = supplier.get();
            messageOrSupplier = computed;
            return computed;
        }
        return (String) messageOrSupplier;
    }

    @SuppressWarnings("nullness:type.argument")
    private static final ThreadLocal<TraceStack> traceStack = ThreadLocal.withInitial(TraceStack::new);

    // Either the final String or the MessageSupplier that has not run yet.
    private Object messageOrSupplier;
    private final TraceStack owner;

    private static final class TraceStack {
        private PersistentList<Trace> traces = PersistentList.empty();
    }
}
