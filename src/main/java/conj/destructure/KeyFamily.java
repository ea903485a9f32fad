// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.destructure;

import conj.value.Keyword;
import conj.value.Symbol;

/**
 * The ways a shorthand key pattern turns a name into the key to look up.
 */
public enum KeyFamily {
    /** {@code :keys [x]} looks up {@code :x}. */
    KEYWORDS(":keys") {
        @Override
        public Object selectorFor(final Symbol name) {
            return Keyword.intern(name.name());
        }
    },
    /** {@code :strs [x]} looks up {@code "x"}. */
    STRINGS(":strs") {
        @Override
        public Object selectorFor(final Symbol name) {
            return name.name();
        }
    },
    /** {@code :syms [x]} looks up the symbol {@code x}. */
    SYMBOLS(":syms") {
        @Override
        public Object selectorFor(final Symbol name) {
            return name;
        }
    };

    KeyFamily(final String tag) {
        this.tag = tag;
    }

    public abstract Object selectorFor(Symbol name);

    /**
     * Returns the keyword introducing this family in a pattern form, with its colon.
     */
    public String tag() {
        return tag;
    }

    private final String tag;
}
