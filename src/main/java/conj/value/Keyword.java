// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.value;

import java.util.concurrent.ConcurrentHashMap;

/**
 * A self-evaluating name, written {@code :name}, typically used as a map key.
 * <p>
 * Keywords are interned: two keywords with the same name are the same object, so they can be compared by identity.
 * Interning is thread-safe and needs no external synchronization.
 */
public final class Keyword implements Comparable<Keyword> {
    private Keyword(final String name) {
        this.name = name;
    }

    /**
     * Returns the canonical keyword with the given name, without the leading colon.
     *
     * @throws IllegalArgumentException If the name is empty.
     */
    public static Keyword intern(final String name) {
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Keyword names must not be empty");
        }
        return table.computeIfAbsent(name, Keyword::new);
    }

    public String name() {
        return name;
    }

    @Override
    public int compareTo(final Keyword other) {
        return name.compareTo(other.name);
    }

    // Identity equality and hashing are inherited: interning makes them agree with name equality.

    @Override
    public String toString() {
        return ":" + name;
    }

    private final String name;

    private static final ConcurrentHashMap<String, Keyword> table = new ConcurrentHashMap<>();
}
