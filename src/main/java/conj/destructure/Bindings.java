// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.destructure;

import java.util.NoSuchElementException;
import conj.collection.Absent;
import conj.collection.PersistentHashMap;
import conj.collection.PersistentVector;
import conj.util.annotation.Nullable;
import conj.value.Symbol;

/**
 * An immutable, ordered set of name-to-value bindings produced by a {@link BindingPlan}.
 * <p>
 * A name bound more than once keeps its latest value. A name bound to {@link Absent#MARKER} is bound: the marker records
 * that the destructured value had nothing at that position or key.
 */
public final class Bindings {
    private Bindings(
        final PersistentVector<Binding> ordered,
        final PersistentHashMap<Symbol, @Nullable Object> byName
    ) {
        this.ordered = ordered;
        this.byName = byName;
    }

    public static Bindings empty() {
        return empty;
    }

    /**
     * Returns these bindings with one more, shadowing any earlier binding of the same name.
     */
    public Bindings with(final Symbol name, final @Nullable Object value) {
        return new Bindings(ordered.conj(new Binding(name, value)), byName.assoc(name, value));
    }

    /**
     * Returns these bindings followed by all of {@code later}, whose names shadow these.
     */
    public Bindings with(final Bindings later) {
        if (ordered.isEmpty()) {
            return later;
        }
        var result = this;
        for (final var binding : later.ordered) {
            result = result.with(binding.name(), binding.value());
        }
        return result;
    }

    public boolean isBound(final Symbol name) {
        return byName.containsKey(name);
    }

    public boolean isBound(final String name) {
        return isBound(Symbol.of(name));
    }

    /**
     * @throws NoSuchElementException If the name is not bound.
     */
    public @Nullable Object valueOf(final Symbol name) {
        final var entry = byName.find(name);
        if (entry == null) {
            throw new NoSuchElementException("Unbound name " + name);
        }
        return entry.value();
    }

    /**
     * @throws NoSuchElementException If the name is not bound.
     */
    public @Nullable Object valueOf(final String name) {
        return valueOf(Symbol.of(name));
    }

    /**
     * Returns every binding in the order it was made, including shadowed ones.
     */
    public PersistentVector<Binding> ordered() {
        return ordered;
    }

    /**
     * Returns the bound names in the order they were first bound.
     */
    public PersistentVector<Symbol> names() {
        final var result = new PersistentVector.Builder<Symbol>();
        var seen = PersistentHashMap.<Symbol, Boolean>empty();
        for (final var binding : ordered) {
            if (!seen.containsKey(binding.name())) {
                seen = seen.assoc(binding.name(), Boolean.TRUE);
                result.append(binding.name());
            }
        }
        return result.toVector();
    }

    public PersistentHashMap<Symbol, @Nullable Object> toMap() {
        return byName;
    }

    @Override
    public boolean equals(final @Nullable Object object) {
        return object instanceof final Bindings other && byName.equals(other.byName);
    }

    @Override
    public int hashCode() {
        return byName.hashCode();
    }

    @Override
    public String toString() {
        return ordered.toString();
    }

    private static final Bindings empty = new Bindings(PersistentVector.empty(), PersistentHashMap.empty());

    private final PersistentVector<Binding> ordered;
    private final PersistentHashMap<Symbol, @Nullable Object> byName;

    /**
     * One name bound to one value.
     */
    public record Binding(Symbol name, @Nullable Object value) {
        @Override
        public String toString() {
            return name + " " + value;
        }
    }
}
