// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

/**
 * Marks collections whose {@link PersistentCollection#count()} runs in constant time.
 */
interface Counted {
}
