// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Generic operations over untyped values, dispatched by capability.
 */
@NonNullByDefault
package conj.dispatch;

import conj.util.annotation.NonNullByDefault;
