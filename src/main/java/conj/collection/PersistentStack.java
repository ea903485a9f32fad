// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The Stack abstraction, operating at whichever end {@link PersistentCollection#conj(Object)} adds to.
 */
public interface PersistentStack<T> {
    /**
     * Returns the most recently conjoined element, or {@code null} if empty.
     */
    @Nullable T peek();

    /**
     * Returns the collection without its most recently conjoined element.
     *
     * @throws IllegalStateException If the collection is empty.
     */
    @CheckReturnValue
    PersistentStack<T> pop();
}
