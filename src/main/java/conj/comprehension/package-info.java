// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Lazy sequence comprehensions over destructured generators.
 */
@NonNullByDefault
package conj.comprehension;

import conj.util.annotation.NonNullByDefault;
