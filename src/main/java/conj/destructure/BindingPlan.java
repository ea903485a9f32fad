// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.destructure;

import conj.collection.PersistentVector;
import conj.util.Trace;
import conj.util.annotation.Nullable;
import conj.value.Symbol;

/**
 * A compiled binding pattern: a flat list of steps, each filling one slot from the source value or earlier slots.
 * <p>
 * Slot 0 holds the source. Steps never read a user-visible binding, only the source and unnamed intermediate slots,
 * so every name is bound from the original value regardless of the names bound before it. Plans are immutable and may
 * be applied to any number of values, from any number of threads.
 */
public final class BindingPlan {
    BindingPlan(final Pattern pattern, final PersistentVector<Step> steps) {
        this.pattern = pattern;
        this.steps = steps;
    }

    public Pattern pattern() {
        return pattern;
    }

    public PersistentVector<Step> steps() {
        return steps;
    }

    /**
     * Destructures the source value, returning the bindings in pattern order.
     */
    public Bindings bind(final @Nullable Object source) {
        final var slots = new Object[(int) steps.count() + 1];
        slots[0] = source;
        var result = Bindings.empty();
        for (final var step : steps) {
            try (final var trace = new Trace(() -> "extracting " + step.describe() + " while binding " + pattern)) {
                trace.use();
                final var value = step.extraction().extract(slots);
                slots[step.slot()] = value;
                final var name = step.name();
                if (name != null) {
                    result = result.with(name, value);
                }
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "BindingPlan" + steps;
    }

    private final Pattern pattern;
    private final PersistentVector<Step> steps;

    /**
     * Fills {@code slot} with the result of {@code extraction}, binding it to {@code name} unless that is
     * {@code null}.
     */
    public record Step(int slot, @Nullable Symbol name, Extraction extraction) {
        String describe() {
            return (name == null) ? "slot " + slot : name.toString();
        }
    }
}
