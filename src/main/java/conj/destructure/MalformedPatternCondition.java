// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.destructure;

import conj.util.annotation.Nullable;
import conj.util.condition.Condition;

/**
 * Signalled when a binding pattern, or the data form it was parsed from, is structurally invalid.
 */
public final class MalformedPatternCondition extends Condition {
    public MalformedPatternCondition(final String message, final @Nullable Object form) {
        super(message + ": " + form);
        this.form = form;
    }

    /**
     * Returns the offending form or pattern.
     */
    public @Nullable Object form() {
        return form;
    }

    private final @Nullable Object form;
}
