// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.util.condition;

/**
 * The body of a {@link Handler}.
 */
@FunctionalInterface
public interface HandlerProcedure {
    /**
     * Reacts to a signalled condition.
     * <p>
     * Returning normally declines the condition and lets older handlers see it. Handling it means leaving
     * non-locally, typically through {@link Restart#unwindTo()}.
     */
    void handle(SignaledCondition condition) throws Unwind;
}
