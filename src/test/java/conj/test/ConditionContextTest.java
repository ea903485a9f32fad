// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.test;

import java.util.ArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import conj.collection.PersistentVector;
import conj.util.Trace;
import conj.util.condition.Condition;
import conj.util.condition.ConditionContext;
import conj.util.condition.Handler;
import conj.util.condition.Restart;
import conj.util.condition.UnhandledErrorError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import org.junit.jupiter.api.Test;

final class ConditionContextTest {
    @Test
    void unhandledErrorsCarryTheirCondition() {
        final var condition = new TestCondition("boom");
        final var error = catchThrowableOfType(() -> {
            throw ConditionContext.error(condition);
        }, UnhandledErrorError.class);
        assertThat(error.condition()).isSameAs(condition);
        assertThat(error).hasMessage("boom");
    }

    @Test
    void signalWithoutHandlersReturns() {
        ConditionContext.signal(new TestCondition("nobody listens"));
        assertThat(ConditionContext.restarts()).isEmpty();
    }

    @Test
    void decliningHandlersSeeTheCondition() {
        final var seen = new ArrayList<String>();
        try (final var handler = new Handler(signaled -> seen.add(signaled.condition().message()))) {
            handler.use();
            ConditionContext.signal(new TestCondition("first"));
            assertThatThrownBy(() -> {
                throw ConditionContext.error(new TestCondition("second"));
            }).isInstanceOf(UnhandledErrorError.class);
        }
        assertThat(seen).containsExactly("first", "second");
    }

    @Test
    void handlersUnwindToRestarts() {
        final var reachedEnd = new AtomicInteger();
        try (final var handler = new Handler(signaled -> restartNamed("skip").unwindTo())) {
            handler.use();
            final var result = ConditionContext.<String>withRestart("skip", restart -> {
                ConditionContext.signal(new TestCondition("skip me"));
                reachedEnd.incrementAndGet();
                return "finished";
            });
            assertThat(result).isNull();
        }
        assertThat(reachedEnd).hasValue(0);
        assertThat(ConditionContext.restarts()).isEmpty();
    }

    @Test
    void restartsReturnTheCallbackResultWhenNotUsed() {
        final String result = ConditionContext.withRestart("unused", restart -> restart.name());
        assertThat(result).isEqualTo("unused");
    }

    @Test
    void innerRestartsAreListedFirst() {
        final var names = new ArrayList<String>();
        ConditionContext.withRestart("outer", outer -> ConditionContext.withRestart("inner", inner -> {
            for (final var restart : ConditionContext.restarts()) {
                names.add(restart.name());
            }
            return null;
        }));
        assertThat(names).containsExactly("inner", "outer");
    }

    @Test
    void unwindingPassesThroughInnerRestarts() {
        final var innerResult = new ArrayList<String>();
        try (final var handler = new Handler(signaled -> restartNamed("outer").unwindTo())) {
            handler.use();
            final var outerResult = ConditionContext.<String>withRestart("outer", outer -> {
                innerResult.add(String.valueOf(ConditionContext.<String>withRestart("inner", inner -> {
                    throw ConditionContext.error(new TestCondition("deep"));
                })));
                return "outer finished";
            });
            assertThat(outerResult).isNull();
        }
        assertThat(innerResult).isEmpty();
    }

    @Test
    void newestHandlerRunsFirst() {
        final var order = new ArrayList<String>();
        try (final var outer = new Handler(signaled -> order.add("outer"))) {
            outer.use();
            try (final var inner = new Handler(signaled -> order.add("inner"))) {
                inner.use();
                ConditionContext.signal(new TestCondition("ping"));
            }
            ConditionContext.signal(new TestCondition("ping"));
        }
        assertThat(order).containsExactly("inner", "outer", "outer");
    }

    @Test
    void conditionsSignaledByHandlersSkipNewerHandlers() {
        final var seen = new ArrayList<String>();
        try (final var outer = new Handler(signaled -> seen.add("outer saw " + signaled.condition().message()))) {
            outer.use();
            try (final var inner = new Handler(signaled -> {
                seen.add("inner saw " + signaled.condition().message());
                if (!signaled.condition().message().equals("nested")) {
                    ConditionContext.signal(new TestCondition("nested"));
                }
            })) {
                inner.use();
                ConditionContext.signal(new TestCondition("original"));
            }
        }
        assertThat(seen).containsExactly("inner saw original", "outer saw nested", "outer saw original");
    }

    @Test
    void fatalityIsReported() {
        final var fatality = new ArrayList<Boolean>();
        try (final var handler = new Handler(signaled -> fatality.add(signaled.isFatal()))) {
            handler.use();
            ConditionContext.signal(new TestCondition("mild"));
            catchThrowableOfType(() -> {
                throw ConditionContext.error(new TestCondition("fatal"));
            }, UnhandledErrorError.class);
        }
        assertThat(fatality).containsExactly(false, true);
    }

    @Test
    void conditionsCaptureActiveTraces() {
        final TestCondition condition;
        try (final var outer = new Trace("doing the outer thing")) {
            outer.use();
            try (final var inner = new Trace(() -> "doing the inner thing")) {
                inner.use();
                condition = new TestCondition("oops");
            }
        }
        assertThat(condition.traces()).containsExactly("doing the inner thing", "doing the outer thing");
        assertThat(condition.detailedMessage()).isEqualTo(String.join(
            System.lineSeparator(),
            "oops",
            "  while doing the inner thing",
            "  while doing the outer thing"
        ));
        assertThat(Trace.activeTraces()).isEmpty();
    }

    @Test
    void traceMessagesAreComputedOnDemandAndOnce() {
        final var computed = new AtomicInteger();
        try (final var trace = new Trace(() -> "computed " + computed.incrementAndGet() + " time(s)")) {
            trace.use();
            assertThat(computed).hasValue(0);
            final var first = new TestCondition("one");
            final var second = new TestCondition("two");
            assertThat(first.traces()).containsExactly("computed 1 time(s)");
            assertThat(second.traces()).containsExactly("computed 1 time(s)");
        }
        assertThat(computed).hasValue(1);
    }

    @Test
    void threadsHaveSeparateContexts() throws Exception {
        final var seen = new AtomicInteger();
        final var executor = Executors.newSingleThreadExecutor();
        try (final var handler = new Handler(signaled -> seen.incrementAndGet())) {
            handler.use();
            final var traces = executor.submit(() -> {
                final PersistentVector<String> result;
                try (final var trace = new Trace("working elsewhere")) {
                    trace.use();
                    final var condition = new TestCondition("elsewhere");
                    ConditionContext.signal(condition);
                    result = condition.traces();
                }
                return result;
            }).get();
            assertThat(traces).containsExactly("working elsewhere");
        } finally {
            executor.shutdown();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }
        assertThat(seen).hasValue(0);
    }

    private static Restart restartNamed(final String name) {
        for (final var restart : ConditionContext.restarts()) {
            if (restart.name().equals(name)) {
                return restart;
            }
        }
        throw new AssertionError("No restart named " + name);
    }

    private static final class TestCondition extends Condition {
        private TestCondition(final String message) {
            super(message);
        }
    }
}
