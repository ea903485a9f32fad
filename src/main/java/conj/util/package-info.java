// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Small utilities used throughout the library: diagnostic traces, per-class dispatch tables and sneaky throws.
 */
@NonNullByDefault
package conj.util;

import conj.util.annotation.NonNullByDefault;
