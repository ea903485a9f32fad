// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

/**
 * Collections that can be traversed back to front without copying.
 */
public interface Reversible<T> {
    /**
     * Returns a sequence over the elements in reverse order; empty collections return an empty sequence.
     */
    Sequence<T> rseq();
}
