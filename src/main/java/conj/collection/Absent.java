// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

/**
 * The absence marker: the default "not found" result of lookups and the value destructuring binds to missing keys and
 * positions.
 * <p>
 * It is distinct from every value a collection can store, {@code null} included, so a lookup returning it always
 * means the key was not there.
 */
public enum Absent {
    MARKER;

    @Override
    public String toString() {
        return "#<absent>";
    }
}
