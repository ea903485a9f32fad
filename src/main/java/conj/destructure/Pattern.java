// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.destructure;

import conj.collection.PersistentHashMap;
import conj.collection.PersistentVector;
import conj.util.annotation.Nullable;
import conj.value.Symbol;

/**
 * A binding pattern: a tree describing which names receive which parts of a value.
 * <p>
 * Patterns are usually built from data forms by {@link PatternParser}, but can be constructed directly as well.
 */
public sealed interface Pattern permits Pattern.Name, Pattern.Positional, Pattern.Keyed {
    /**
     * Binds the whole value to a name. The name {@code _} extracts the value but binds nothing.
     */
    record Name(Symbol symbol) implements Pattern {
        public static Name of(final String name) {
            return new Name(Symbol.of(name));
        }

        public boolean isDiscard() {
            return symbol.name().equals("_");
        }

        @Override
        public String toString() {
            return symbol.toString();
        }
    }

    /**
     * Destructures a sequenceable value element by element.
     *
     * @param elements The patterns for the leading elements, in order.
     * @param rest     The pattern receiving the remaining elements as a sequence, if any.
     * @param whole    The name receiving the original value, if any.
     */
    record Positional(
        PersistentVector<Pattern> elements,
        @Nullable Pattern rest,
        @Nullable Symbol whole
    ) implements Pattern {
        @Override
        public String toString() {
            final var builder = new StringBuilder("[");
            var separator = "";
            for (final var element : elements) {
                builder.append(separator).append(element);
                separator = " ";
            }
            if (rest != null) {
                builder.append(separator).append("& ").append(rest);
                separator = " ";
            }
            if (whole != null) {
                builder.append(separator).append(":as ").append(whole);
            }
            return builder.append(']').toString();
        }
    }

    /**
     * Destructures an associative value by looking keys up.
     *
     * @param bindings   Explicit (pattern, selector) pairs.
     * @param shorthands Names whose selectors are derived from the names themselves.
     * @param defaults   Values for names bound directly by this pattern, used when their key is absent.
     * @param whole      The name receiving the original value, if any.
     */
    record Keyed(
        PersistentVector<KeyBinding> bindings,
        PersistentVector<Shorthand> shorthands,
        PersistentHashMap<Symbol, @Nullable Object> defaults,
        @Nullable Symbol whole
    ) implements Pattern {
        @Override
        public String toString() {
            final var builder = new StringBuilder("{");
            var separator = "";
            for (final var binding : bindings) {
                builder.append(separator).append(binding.target()).append(' ').append(binding.selector());
                separator = ", ";
            }
            for (final var shorthand : shorthands) {
                builder.append(separator).append(shorthand.family().tag()).append(' ').append(shorthand.names());
                separator = ", ";
            }
            if (!defaults.isEmpty()) {
                builder.append(separator).append(":or ").append(defaults);
                separator = ", ";
            }
            if (whole != null) {
                builder.append(separator).append(":as ").append(whole);
            }
            return builder.append('}').toString();
        }
    }

    /**
     * Looks {@code selector} up and destructures the result with {@code target}.
     */
    record KeyBinding(Pattern target, @Nullable Object selector) {
    }

    /**
     * Binds each name to the value under the key the family derives from it.
     */
    record Shorthand(KeyFamily family, PersistentVector<Symbol> names) {
    }
}
