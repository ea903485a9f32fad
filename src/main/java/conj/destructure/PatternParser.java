// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.destructure;

import conj.collection.PersistentHashMap;
import conj.collection.PersistentMap;
import conj.collection.PersistentVector;
import conj.collection.Sequence;
import conj.util.Trace;
import conj.util.annotation.Nullable;
import conj.util.condition.ConditionContext;
import conj.util.condition.UnhandledErrorError;
import conj.value.Keyword;
import conj.value.Symbol;

/**
 * Builds {@link Pattern}s from binding forms written as data.
 * <p>
 * The forms are:
 * <ul>
 *     <li>a {@link Symbol}, binding the whole value;</li>
 *     <li>a {@link PersistentVector} of forms, destructuring positionally, where {@code & form} binds the remaining
 *     elements and {@code :as name} the original value;</li>
 *     <li>a {@link PersistentMap} from forms to the keys they look up, where the keyword keys {@code :keys},
 *     {@code :strs} and {@code :syms} take vectors of names, {@code :or} takes a map from names to defaults and
 *     {@code :as} takes a name.</li>
 * </ul>
 * Anything else signals {@link MalformedPatternCondition}.
 */
public final class PatternParser {
    private PatternParser() {
    }

    public static Pattern parse(final @Nullable Object form) {
        try (final var trace = new Trace(() -> "parsing binding form " + form)) {
            trace.use();
            return parseForm(form);
        }
    }

    private static Pattern parseForm(final @Nullable Object form) {
        if (form instanceof final Symbol symbol) {
            return new Pattern.Name(plainName(symbol, form));
        }
        if (form instanceof final PersistentVector<?> vector) {
            return parsePositional(vector);
        }
        if (form instanceof final PersistentMap<?, ?> map) {
            return parseKeyed(map);
        }
        throw malformed("Unsupported binding form", form);
    }

    private static Pattern parsePositional(final PersistentVector<?> form) {
        final var elements = new PersistentVector.Builder<Pattern>();
        @Nullable Pattern rest = null;
        @Nullable Symbol whole = null;
        final var count = form.count();
        var i = 0;
        while (i < count) {
            final var element = form.nth(i);
            if (element instanceof final Symbol symbol && symbol.name().equals("&")) {
                if (rest != null || whole != null || i + 1 >= count) {
                    throw malformed("Misplaced & in positional pattern", form);
                }
                rest = parseForm(form.nth(i + 1));
                i += 2;
            } else if (element == as) {
                if (whole != null || i + 1 >= count || !(form.nth(i + 1) instanceof final Symbol name)) {
                    throw malformed(":as must be followed by a name", form);
                }
                whole = wholeName(name, form);
                i += 2;
            } else {
                if (rest != null || whole != null) {
                    throw malformed("Unexpected element after & or :as", form);
                }
                elements.append(parseForm(element));
                i += 1;
            }
        }
        return new Pattern.Positional(elements.toVector(), rest, whole);
    }

    private static Pattern parseKeyed(final PersistentMap<?, ?> form) {
        final var bindings = new PersistentVector.Builder<Pattern.KeyBinding>();
        final var shorthands = new PersistentVector.Builder<Pattern.Shorthand>();
        PersistentHashMap<Symbol, @Nullable Object> defaults = PersistentHashMap.empty();
        @Nullable Symbol whole = null;
        for (final var entry : form) {
            final var key = entry.key();
            final var value = entry.value();
            final var family = familyOf(key);
            if (family != null) {
                shorthands.append(new Pattern.Shorthand(family, names(value, form)));
            } else if (key == or) {
                if (!(value instanceof final PersistentMap<?, ?> defaultsForm)) {
                    throw malformed(":or must be followed by a map", form);
                }
                for (final var defaultEntry : defaultsForm) {
                    if (!(defaultEntry.key() instanceof final Symbol name)) {
                        throw malformed(":or keys must be names", form);
                    }
                    defaults = defaults.assoc(name, defaultEntry.value());
                }
            } else if (key == as) {
                if (!(value instanceof final Symbol name)) {
                    throw malformed(":as must be followed by a name", form);
                }
                whole = wholeName(name, form);
            } else {
                bindings.append(new Pattern.KeyBinding(parseForm(key), value));
            }
        }
        return new Pattern.Keyed(bindings.toVector(), shorthands.toVector(), defaults, whole);
    }

    private static @Nullable KeyFamily familyOf(final @Nullable Object key) {
        if (key == keys) {
            return KeyFamily.KEYWORDS;
        }
        if (key == strs) {
            return KeyFamily.STRINGS;
        }
        if (key == syms) {
            return KeyFamily.SYMBOLS;
        }
        return null;
    }

    private static PersistentVector<Symbol> names(final @Nullable Object value, final Object form) {
        if (!(value instanceof PersistentVector<?> || value instanceof Sequence<?>)) {
            throw malformed("Shorthand keys must be followed by a vector of names", form);
        }
        final var result = new PersistentVector.Builder<Symbol>();
        for (final var element : (Iterable<?>) value) {
            if (!(element instanceof final Symbol symbol)) {
                throw malformed("Shorthand keys must be followed by a vector of names", form);
            }
            result.append(plainName(symbol, form));
        }
        return result.toVector();
    }

    private static Symbol plainName(final Symbol symbol, final @Nullable Object form) {
        if (symbol.name().equals("&")) {
            throw malformed("& cannot be used as a name", form);
        }
        return symbol;
    }

    private static Symbol wholeName(final Symbol symbol, final Object form) {
        if (symbol.name().equals("_")) {
            throw malformed("_ cannot be used with :as", form);
        }
        return plainName(symbol, form);
    }

    private static UnhandledErrorError malformed(final String message, final @Nullable Object form) {
        return ConditionContext.error(new MalformedPatternCondition(message, form));
    }

    private static final Keyword as = Keyword.intern("as");
    private static final Keyword or = Keyword.intern("or");
    private static final Keyword keys = Keyword.intern("keys");
    private static final Keyword strs = Keyword.intern("strs");
    private static final Keyword syms = Keyword.intern("syms");
}
