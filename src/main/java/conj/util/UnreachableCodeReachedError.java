// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.util;

/**
 * Thrown when control reaches a branch that the surrounding invariants rule out, such as an unknown node variant.
 */
public final class UnreachableCodeReachedError extends AssertionError {
    public UnreachableCodeReachedError(final String message) {
        super(message);
    }
}
