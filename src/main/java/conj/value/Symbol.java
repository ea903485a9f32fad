// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.value;

import conj.util.annotation.Nullable;

/**
 * A name, as used by binding patterns. Symbols are compared by name.
 */
public final class Symbol implements Comparable<Symbol> {
    private Symbol(final String name) {
        this.name = name;
    }

    /**
     * @throws IllegalArgumentException If the name is empty.
     */
    public static Symbol of(final String name) {
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Symbol names must not be empty");
        }
        return new Symbol(name);
    }

    public String name() {
        return name;
    }

    @Override
    public int compareTo(final Symbol other) {
        return name.compareTo(other.name);
    }

    @Override
    public boolean equals(final @Nullable Object object) {
        return object instanceof final Symbol other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode() + 0x9e3779b9;
    }

    @Override
    public String toString() {
        return name;
    }

    private final String name;
}
