// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.util;

import java.util.function.Function;

/**
 * A {@link ClassValue} computed by a function, for per-class dispatch tables.
 * <p>
 * Values are computed lazily, once per class, and cached by the JVM alongside the class itself, so lookups after the
 * first are as cheap as a field read. The function must be free of side effects: it may run more than once for the
 * same class under contention.
 */
public final class SimpleClassValue<T> extends ClassValue<T> {
    public SimpleClassValue(final Function<? super Class<?>, ? extends T> computation) {
        this.computation = computation;
    }

    @Override
    protected T computeValue(final Class<?> clazz) {
        return computation.apply(clazz);
    }

    private final Function<? super Class<?>, ? extends T> computation;
}
