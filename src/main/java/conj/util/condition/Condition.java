// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.util.condition;

import conj.collection.PersistentVector;
import conj.util.Trace;

/**
 * The base type for all conditions.
 * <p>
 * A condition describes a situation code further up the stack may want to react to. Handlers run <em>before</em> the
 * stack unwinds, so they can choose a restart established after the handler itself was installed.
 * <p>
 * Each condition remembers the {@link Trace} messages active on the signalling thread at construction time.
 */
public abstract class Condition {
    /**
     * Initializes a new condition with the given user-readable message, capturing the active traces.
     */
    protected Condition(final String message) {
        this.message = message;
        traces = Trace.activeTraces();
    }

    /**
     * Retrieves the one-line user-readable message of this condition.
     */
    public final String message() {
        return message;
    }

    /**
     * Retrieves the traces that were active when this condition was created, innermost first.
     */
    public final PersistentVector<String> traces() {
        return traces;
    }

    /**
     * Retrieves the message followed by one line per captured trace.
     */
    public String detailedMessage() {
        final var builder = new StringBuilder(message);
        for (final var trace : traces) {
            builder.append(System.lineSeparator()).append("  while ").append(trace);
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + ": " + message;
    }

    private final String message;
    private final PersistentVector<String> traces;
}
