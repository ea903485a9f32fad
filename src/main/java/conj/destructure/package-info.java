// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Destructuring: binding the parts of a value to names according to a {@link conj.destructure.Pattern}.
 * <p>
 * Patterns are compiled once by {@link conj.destructure.DestructuringCompiler} into a flat
 * {@link conj.destructure.BindingPlan}, which can then be applied to any number of values.
 */
@NonNullByDefault
package conj.destructure;

import conj.util.annotation.NonNullByDefault;
