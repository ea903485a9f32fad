// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

/**
 * Set algebra over {@link PersistentSet} values. Results keep the kind, and the comparator, of the first argument.
 */
public final class Sets {
    private Sets() {
    }

    public static <T> PersistentSet<T> union(final PersistentSet<T> first, final PersistentSet<? extends T> second) {
        var result = first;
        for (final var element : second) {
            result = result.conj(element);
        }
        return result;
    }

    public static <T> PersistentSet<T> intersection(final PersistentSet<T> first, final PersistentSet<?> second) {
        var result = first;
        for (final var element : first) {
            if (!second.contains(element)) {
                result = result.disj(element);
            }
        }
        return result;
    }

    public static <T> PersistentSet<T> difference(final PersistentSet<T> first, final PersistentSet<?> second) {
        var result = first;
        for (final var element : second) {
            result = result.disj(element);
        }
        return result;
    }

    /**
     * Returns {@code true} iff every member of {@code candidate} is a member of {@code of}.
     */
    public static boolean isSubset(final PersistentSet<?> candidate, final PersistentSet<?> of) {
        if (candidate.count() > of.count()) {
            return false;
        }
        for (final var element : candidate) {
            if (!of.contains(element)) {
                return false;
            }
        }
        return true;
    }

    public static boolean isSuperset(final PersistentSet<?> candidate, final PersistentSet<?> of) {
        return isSubset(of, candidate);
    }
}
