// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.util;

/**
 * Throws checked throwables without declaring them.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws the given throwable, whatever its type, without the compiler requiring a {@code throws} clause.
     * <p>
     * Reserved for {@link conj.util.condition.Unwind}, which crosses arbitrary user callbacks (lazy sequence
     * producers, comparators, comprehension clauses) that cannot be expected to declare it.
     * <p>
     * Never returns normally; the declared return type lets call sites write {@code throw SneakyThrow.doThrow(t)}.
     */
    public static UnreachableCodeReachedError doThrow(final Throwable throwable) {
        throw SneakyThrow.<RuntimeException>rethrow(throwable);
    }

    // The cast to E is erased, so the JVM throws the original object; javac only sees an unchecked E.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> UnreachableCodeReachedError rethrow(final Throwable throwable) throws E {
        throw (E) throwable;
    }
}
