// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.util.condition;

/**
 * What a {@link HandlerProcedure} receives: the condition plus how it was signalled.
 *
 * @param condition The condition.
 * @param isFatal   {@code true} iff it was signalled by {@link ConditionContext#error(Condition)}, meaning the
 *                  signaller cannot continue if every handler declines.
 */
public record SignaledCondition(Condition condition, boolean isFatal) {
}
