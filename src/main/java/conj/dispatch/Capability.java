// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.dispatch;

/**
 * The abstractions a value can take part in.
 */
public enum Capability {
    /** A {@link conj.collection.PersistentCollection}. */
    COLLECTION("a collection"),
    /** Anything {@link Abstractions#seq(Object)} can view as a sequence. */
    SEQUENCEABLE("sequenceable"),
    /** A {@link conj.collection.Sequence}. */
    SEQUENCE("a sequence"),
    /** An {@link conj.collection.Associative}. */
    ASSOCIATIVE("associative"),
    /** An {@link conj.collection.Indexed}. */
    INDEXED("indexed"),
    /** A {@link conj.collection.PersistentStack}. */
    STACK("a stack"),
    /** A {@link conj.collection.PersistentSet}. */
    SET("a set"),
    /** A {@link conj.collection.Sorted}. */
    SORTED("sorted"),
    /** A {@link conj.collection.Reversible}. */
    REVERSIBLE("reversible");

    Capability(final String description) {
        this.description = description;
    }

    /**
     * Returns a phrase completing "the value is not ...".
     */
    public String description() {
        return description;
    }

    private final String description;
}
