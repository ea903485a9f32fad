// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.test;

import java.util.ArrayList;
import java.util.List;

final class Elements {
    private Elements() {
    }

    /**
     * Copies the elements of a wildcard-typed iterable, so assertions can compare them with plain values.
     */
    static List<Object> of(final Iterable<?> iterable) {
        final var result = new ArrayList<Object>();
        for (final var element : iterable) {
            result.add(element);
        }
        return result;
    }
}
