// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.util.condition;

import java.util.Iterator;
import java.util.NoSuchElementException;
import conj.util.SneakyThrow;
import conj.util.annotation.Nullable;

/**
 * The per-thread registry of condition handlers and restart points.
 * <p>
 * Instances are never exposed; the static methods operate on the calling thread's context. Contexts of different
 * threads are independent: a handler installed by one thread never sees conditions signalled by another, including
 * conditions signalled while a lazy sequence is realized on a different thread.
 *
 * @see Handler
 * @see Restart
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Offers the given condition to the installed handlers, newest first.
     * <p>
     * Returns normally when every handler declines. A handler may instead unwind to a restart, in which case this
     * method completes abruptly with {@link Unwind}.
     */
    public static void signal(final Condition condition) {
        localContext().offer(new SignaledCondition(condition, false));
    }

    /**
     * Offers the given condition to the installed handlers as a fatal one.
     * <p>
     * If every handler declines, {@link UnhandledErrorError} is thrown. This method therefore never returns normally;
     * it is declared to return the error type so call sites can write {@code throw ConditionContext.error(...)}.
     */
    public static UnhandledErrorError error(final Condition condition) {
        localContext().offer(new SignaledCondition(condition, true));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Calls {@code callback} with a fresh restart point established around the call.
     *
     * @param restartName A user-readable name describing what unwinding to the restart means.
     * @param callback    The code to run; receives the restart.
     * @return The callback's result, or {@code null} if a handler unwound to this restart.
     */
    public static <T> @Nullable T withRestart(final String restartName, final RestartCallback<? extends T> callback) {
        final var restart = new Restart(restartName);
        try {
            return callback.call(restart);
        } catch (final Unwind unwind) {
            if (unwind.target() != restart) {
                throw SneakyThrow.doThrow(unwind);
            }
            return null;
        } finally {
            restart.unlink();
        }
    }

    /**
     * Returns the calling thread's active restarts, newest first.
     */
    public static Iterable<Restart> restarts() {
        final var context = localContext();
        return () -> new RestartIterator(context.firstRestart);
    }

    static ConditionContext localContext() {
        return localContext.get();
    }

    private void offer(final SignaledCondition condition) {
        // A condition signalled from inside a handler is only offered to the handlers installed before that one.
        final var start = (runningHandler == null) ? firstHandler : runningHandler.next;
        for (var handler = start; handler != null; handler = handler.next) {
            final var previous = runningHandler;
            runningHandler = handler;
            try {
                handler.handle(condition);
            } finally {
                runningHandler = previous;
            }
        }
    }

    @Nullable Handler firstHandler = null;
    @Nullable Restart firstRestart = null;
    private @Nullable Handler runningHandler = null;

    private static final ThreadLocal<ConditionContext> localContext = ThreadLocal.withInitial(ConditionContext::new);

    private static final class RestartIterator implements Iterator<Restart> {
        private RestartIterator(final @Nullable Restart first) {
            current = first;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public Restart next() {
            final var result = current;
            if (result == null) {
                throw new NoSuchElementException("No more restarts");
            }
            current = result.next;
            return result;
        }

        private @Nullable Restart current;
    }
}
