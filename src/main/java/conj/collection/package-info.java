// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Persistent collections: immutable values whose updates return new versions sharing most of their structure with the
 * old ones.
 * <p>
 * The concrete families are {@link conj.collection.PersistentVector}, {@link conj.collection.PersistentHashMap} and
 * {@link conj.collection.PersistentHashSet}, {@link conj.collection.PersistentTreeMap} and
 * {@link conj.collection.PersistentTreeSet}, {@link conj.collection.PersistentList}, and the lazy
 * {@link conj.collection.LazySeq}. What they can do is described by small capability interfaces:
 * {@link conj.collection.PersistentCollection}, {@link conj.collection.Sequence}, {@link conj.collection.Associative},
 * {@link conj.collection.Indexed}, {@link conj.collection.PersistentStack}, {@link conj.collection.PersistentSet},
 * {@link conj.collection.Sorted} and {@link conj.collection.Reversible}.
 * <p>
 * All collections are safe to share between threads without synchronization.
 */
package conj.collection;
