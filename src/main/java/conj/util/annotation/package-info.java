// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Nullness annotations shared by the whole library.
 */
package conj.util.annotation;
