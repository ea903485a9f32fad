// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.comprehension;

import java.util.function.Function;
import java.util.function.Predicate;
import conj.collection.LazySeq;
import conj.collection.PersistentList;
import conj.collection.PersistentVector;
import conj.collection.Sequence;
import conj.collection.Sequences;
import conj.destructure.BindingPlan;
import conj.destructure.Bindings;
import conj.destructure.DestructuringCompiler;
import conj.destructure.PatternParser;
import conj.dispatch.Abstractions;
import conj.util.Trace;
import conj.util.annotation.Nullable;

/**
 * A lazy sequence comprehension: nested generators, each destructuring its elements, with filters, stop conditions and
 * derived bindings.
 * <p>
 * A comprehension is built clause by clause. {@link #from(Object, Function)} adds a generator: for every element of
 * the generated collection, the element is destructured with the binding form and the rest of the comprehension is
 * evaluated with those bindings, so later generators vary fastest. The modifiers following a generator apply to its
 * elements, in order: {@link #when(Predicate)} skips the element, {@link #whileTrue(Predicate)} stops the generator
 * altogether, {@link #let(Object, Function)} binds a derived value. {@link #yield(Function)} finally produces the
 * result sequence, which is lazy: nothing is evaluated until it is consumed, and infinite generators are fine.
 * <p>
 * Builders are immutable; every clause returns a new one.
 */
public final class Comprehension {
    private Comprehension(final PersistentVector<Generator> generators) {
        this.generators = generators;
    }

    /**
     * Starts a comprehension with its outermost generator.
     *
     * @param bindingForm A binding form, as accepted by {@link PatternParser}.
     * @param generator   Computes the collection to iterate from the bindings established so far.
     */
    public static Comprehension over(final Object bindingForm, final Function<Bindings, ?> generator) {
        return new Comprehension(PersistentVector.<Generator>empty()).from(bindingForm, generator);
    }

    /**
     * Adds a generator nested inside all previous ones.
     */
    public Comprehension from(final Object bindingForm, final Function<Bindings, ?> generator) {
        final var plan = DestructuringCompiler.compile(PatternParser.parse(bindingForm));
        return new Comprehension(generators.conj(new Generator(plan, generator, PersistentVector.empty())));
    }

    /**
     * Skips the current element of the innermost generator unless the predicate holds.
     */
    public Comprehension when(final Predicate<Bindings> predicate) {
        return withModifier(new When(predicate));
    }

    /**
     * Stops the innermost generator at the first element for which the predicate fails.
     */
    public Comprehension whileTrue(final Predicate<Bindings> predicate) {
        return withModifier(new While(predicate));
    }

    /**
     * Destructures a value derived from the current bindings, making its names visible to later clauses.
     */
    public Comprehension let(final Object bindingForm, final Function<Bindings, ?> value) {
        final var plan = DestructuringCompiler.compile(PatternParser.parse(bindingForm));
        return withModifier(new Let(plan, value));
    }

    /**
     * Returns the lazy sequence of the expression's values, one per surviving combination of bindings.
     */
    public <R> Sequence<R> yield(final Function<Bindings, ? extends R> expression) {
        return new Evaluation<R>(generators, expression).generate(0, Bindings.empty());
    }

    private Comprehension withModifier(final Modifier modifier) {
        final var last = generators.peek();
        assert last != null : "Comprehension without a generator";
        final var updated = new Generator(last.plan(), last.function(), last.modifiers().conj(modifier));
        return new Comprehension(generators.pop().conj(updated));
    }

    private final PersistentVector<Generator> generators;

    private record Generator(
        BindingPlan plan,
        Function<Bindings, ?> function,
        PersistentVector<Modifier> modifiers
    ) {
    }

    private sealed interface Modifier permits When, While, Let {
    }

    private record When(Predicate<Bindings> predicate) implements Modifier {
    }

    private record While(Predicate<Bindings> predicate) implements Modifier {
    }

    private record Let(BindingPlan plan, Function<Bindings, ?> value) implements Modifier {
    }

    private static final class Evaluation<R> {
        private Evaluation(
            final PersistentVector<Generator> generators,
            final Function<Bindings, ? extends R> expression
        ) {
            this.generators = generators;
            this.expression = expression;
        }

        private Sequence<R> generate(final int index, final Bindings environment) {
            return LazySeq.of(() -> {
                if (index == generators.count()) {
                    return PersistentList.of(evaluate(environment));
                }
                final var generator = generators.nth(index);
                final Object source;
                try (final var trace = new Trace(() -> "evaluating generator for " + generator.plan().pattern())) {
                    trace.use();
                    source = generator.function().apply(environment);
                }
                return elements(index, generator, environment, Abstractions.sequenceView(source));
            });
        }

        private Sequence<R> elements(
            final int index,
            final Generator generator,
            final Bindings environment,
            final Sequence<?> source
        ) {
            return LazySeq.of(() -> {
                Sequence<?> current = source;
                while (!current.isEmpty()) {
                    final var outcome = modified(generator, environment.with(generator.plan().bind(current.first())));
                    switch (outcome.verdict()) {
                        case STOP:
                            return null;
                        case KEEP:
                            return Sequences.concat(
                                generate(index + 1, outcome.bindings()),
                                elements(index, generator, environment, current.rest())
                            );
                        case SKIP:
                            break;
                    }
                    current = current.rest();
                }
                return null;
            });
        }

        private static Outcome modified(final Generator generator, final Bindings initial) {
            var bindings = initial;
            for (final var modifier : generator.modifiers()) {
                try (final var trace = new Trace(() -> "evaluating " + describe(modifier) + " clause")) {
                    trace.use();
                    if (modifier instanceof final When when) {
                        if (!when.predicate().test(bindings)) {
                            return new Outcome(Verdict.SKIP, bindings);
                        }
                    } else if (modifier instanceof final While whileClause) {
                        if (!whileClause.predicate().test(bindings)) {
                            return new Outcome(Verdict.STOP, bindings);
                        }
                    } else if (modifier instanceof final Let let) {
                        bindings = bindings.with(let.plan().bind(let.value().apply(bindings)));
                    }
                }
            }
            return new Outcome(Verdict.KEEP, bindings);
        }

        private @Nullable R evaluate(final Bindings environment) {
            try (final var trace = new Trace("evaluating the yielded expression")) {
                trace.use();
                return expression.apply(environment);
            }
        }

        private static String describe(final Modifier modifier) {
            if (modifier instanceof final Let let) {
                return "let " + let.plan().pattern();
            }
            return (modifier instanceof When) ? "when" : "while";
        }

        private final PersistentVector<Generator> generators;
        private final Function<Bindings, ? extends R> expression;
    }

    private enum Verdict {
        KEEP,
        SKIP,
        STOP,
    }

    private record Outcome(Verdict verdict, Bindings bindings) {
    }
}
