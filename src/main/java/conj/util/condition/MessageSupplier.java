// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.util.condition;

/**
 * A trace message computed only when it is needed.
 */
@FunctionalInterface
public interface MessageSupplier {
    String get();
}
