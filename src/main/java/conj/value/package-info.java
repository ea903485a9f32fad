// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Name values: interned {@link conj.value.Keyword}s and plain {@link conj.value.Symbol}s.
 */
@NonNullByDefault
package conj.value;

import conj.util.annotation.NonNullByDefault;
