// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

/**
 * Marks ordered collections whose equality is element-wise in order: a vector, a list and a lazy sequence holding the
 * same elements are equal and hash identically.
 * <p>
 * Every implementation is also {@link Iterable}.
 */
public interface Sequential {
}
