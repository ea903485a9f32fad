// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.util.condition;

/**
 * The throwable that carries control from {@link Restart#unwindTo()} to its restart point.
 * <p>
 * Public only so that callbacks can declare it. It is neither an {@link Exception} nor an {@link Error}: it is not a
 * failure, and generic {@code catch (Exception e)} blocks must not intercept it.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final Restart target) {
        super("Unwinding to " + target.name(), null, false, false);
        this.target = target;
    }

    Restart target() {
        return target;
    }

    private final transient Restart target;
}
