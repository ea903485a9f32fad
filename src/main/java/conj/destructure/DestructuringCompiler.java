// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.destructure;

import conj.collection.PersistentHashMap;
import conj.collection.PersistentVector;
import conj.util.Trace;
import conj.util.UnreachableCodeReachedError;
import conj.util.annotation.Nullable;
import conj.util.condition.ConditionContext;
import conj.util.condition.UnhandledErrorError;
import conj.value.Symbol;

/**
 * Compiles {@link Pattern}s into {@link BindingPlan}s.
 * <p>
 * Positional patterns walk a sequence view of their value with {@link Extraction.First} and {@link Extraction.Next};
 * keyed patterns look their selectors up, after turning a keyword-argument sequence into a map. Missing positions and
 * keys bind {@link conj.collection.Absent#MARKER}, or the pattern's default for that name if it has one.
 */
public final class DestructuringCompiler {
    private DestructuringCompiler() {
    }

    /**
     * Compiles the pattern, signalling {@link MalformedPatternCondition} if it is structurally invalid.
     */
    public static BindingPlan compile(final Pattern pattern) {
        try (final var trace = new Trace(() -> "compiling binding pattern " + pattern)) {
            trace.use();
            final var emitter = new Emitter();
            emitter.emitInto(pattern, new Extraction.Copy(0));
            return new BindingPlan(pattern, emitter.steps.toVector());
        }
    }

    /**
     * Binds a function's parameter list to its arguments. A rest pattern receives the surplus arguments as a
     * sequence, or as keyword arguments if it is a keyed pattern.
     */
    public static Bindings bindParameters(final Pattern.Positional parameters, final PersistentVector<?> arguments) {
        return compile(parameters).bind(arguments);
    }

    private static final class Emitter {
        private void emitInto(final Pattern pattern, final Extraction extraction) {
            if (pattern instanceof final Pattern.Name name) {
                emitName(name, extraction);
            } else if (pattern instanceof final Pattern.Positional positional) {
                emitPositional(positional, extraction);
            } else if (pattern instanceof final Pattern.Keyed keyed) {
                emitKeyed(keyed, extraction);
            } else {
                throw new UnreachableCodeReachedError("Unknown pattern " + pattern);
            }
        }

        private void emitName(final Pattern.Name name, final Extraction extraction) {
            checkName(name.symbol(), name);
            emit(name.isDiscard() ? null : name.symbol(), extraction);
        }

        private void emitPositional(final Pattern.Positional pattern, final Extraction extraction) {
            final var whole = pattern.whole();
            if (whole != null) {
                checkWhole(whole, pattern);
            }
            final var value = emit(whole, extraction);
            var current = emit(null, new Extraction.SequenceView(value));
            final var elements = pattern.elements();
            final var count = elements.count();
            for (int i = 0; i < count; i += 1) {
                emitInto(elements.nth(i), new Extraction.First(current));
                if (i + 1 < count || pattern.rest() != null) {
                    current = emit(null, new Extraction.Next(current));
                }
            }
            final var rest = pattern.rest();
            if (rest != null) {
                emitInto(rest, new Extraction.Copy(current));
            }
        }

        private void emitKeyed(final Pattern.Keyed pattern, final Extraction extraction) {
            final var whole = pattern.whole();
            if (whole != null) {
                checkWhole(whole, pattern);
            }
            checkDefaults(pattern);
            final var value = emit(whole, extraction);
            final var map = emit(null, new Extraction.ToAssociative(value));
            final var defaults = pattern.defaults();
            for (final var binding : pattern.bindings()) {
                final var target = binding.target();
                final var hasDefault = target instanceof final Pattern.Name name && defaults.containsKey(name.symbol());
                final var defaultValue = hasDefault ? defaults.get(((Pattern.Name) target).symbol()) : null;
                emitInto(target, new Extraction.Lookup(map, binding.selector(), hasDefault, defaultValue));
            }
            for (final var shorthand : pattern.shorthands()) {
                for (final var name : shorthand.names()) {
                    checkName(name, pattern);
                    final var selector = shorthand.family().selectorFor(name);
                    final var hasDefault = defaults.containsKey(name);
                    emit(name, new Extraction.Lookup(map, selector, hasDefault, defaults.get(name)));
                }
            }
        }

        // Every default must belong to a name this pattern binds directly.
        private static void checkDefaults(final Pattern.Keyed pattern) {
            var bound = PersistentHashMap.<Symbol, Boolean>empty();
            for (final var binding : pattern.bindings()) {
                if (binding.target() instanceof final Pattern.Name name) {
                    bound = bound.assoc(name.symbol(), Boolean.TRUE);
                }
            }
            for (final var shorthand : pattern.shorthands()) {
                for (final var name : shorthand.names()) {
                    bound = bound.assoc(name, Boolean.TRUE);
                }
            }
            for (final var name : pattern.defaults().keys()) {
                if (!bound.containsKey(name)) {
                    throw malformed("Default given for " + name + ", which the pattern does not bind", pattern);
                }
            }
        }

        private static void checkName(final Symbol name, final Pattern pattern) {
            if (name.name().equals("&")) {
                throw malformed("& cannot be used as a name", pattern);
            }
        }

        private static void checkWhole(final Symbol name, final Pattern pattern) {
            if (name.name().equals("_")) {
                throw malformed("_ cannot be used as a whole-value name", pattern);
            }
            checkName(name, pattern);
        }

        private int emit(final @Nullable Symbol name, final Extraction extraction) {
            nextSlot += 1;
            steps.append(new BindingPlan.Step(nextSlot, name, extraction));
            return nextSlot;
        }

        private final PersistentVector.Builder<BindingPlan.Step> steps = new PersistentVector.Builder<>();
        private int nextSlot = 0;
    }

    private static UnhandledErrorError malformed(final String message, final Object pattern) {
        return ConditionContext.error(new MalformedPatternCondition(message, pattern));
    }
}
