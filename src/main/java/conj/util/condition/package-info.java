// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * A condition and restart system modelled on Common Lisp's, used to report capability, comparison and pattern errors.
 */
@NonNullByDefault
package conj.util.condition;

import conj.util.annotation.NonNullByDefault;
