// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.test;

import java.math.BigDecimal;
import java.math.BigInteger;
import conj.collection.Comparison;
import conj.collection.IncomparableValuesCondition;
import conj.collection.PersistentTreeSet;
import conj.collection.PersistentVector;
import conj.value.Keyword;
import conj.value.Symbol;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class ComparisonTest {
    @Test
    void numbersCompareAcrossTypes() {
        assertThat(Comparison.compare(1, 2L)).isNegative();
        assertThat(Comparison.compare(2L, 2)).isZero();
        assertThat(Comparison.compare(2.5, 2)).isPositive();
        assertThat(Comparison.compare(BigInteger.TEN.pow(30), Long.MAX_VALUE)).isPositive();
        assertThat(Comparison.compare(new BigDecimal("1.50"), new BigDecimal("1.5"))).isZero();
        assertThat(Comparison.compare(new BigDecimal("0.1"), BigInteger.ONE)).isNegative();
    }

    @Test
    void nullSortsFirst() {
        assertThat(Comparison.compare(null, 0)).isNegative();
        assertThat(Comparison.compare("a", null)).isPositive();
        assertThat(Comparison.compare(null, null)).isZero();
    }

    @Test
    void namedValuesCompareByName() {
        assertThat(Comparison.compare(Keyword.intern("a"), Keyword.intern("b"))).isNegative();
        assertThat(Comparison.compare(Symbol.of("z"), Symbol.of("y"))).isPositive();
        assertThat(Comparison.compare("abc", "abd")).isNegative();
        assertThat(Comparison.compare(false, true)).isNegative();
    }

    @Test
    void vectorsCompareByLengthThenElements() {
        assertThat(Comparison.compare(PersistentVector.of(9), PersistentVector.of(1, 1))).isNegative();
        assertThat(Comparison.compare(PersistentVector.of(1, 3), PersistentVector.of(1, 2))).isPositive();
        assertThat(Comparison.compare(PersistentVector.of(1, 2), PersistentVector.of(1L, 2L))).isZero();
    }

    @Test
    void differentKindsAreIncomparable() {
        final var condition = Conditions.signaledBy(
            IncomparableValuesCondition.class,
            () -> Comparison.compare("1", 1)
        );
        assertThat(condition.left()).isEqualTo("1");
        assertThat(condition.right()).isEqualTo(1);
        assertThat(condition.message()).contains("String").contains("Integer");
        Conditions.signaledBy(IncomparableValuesCondition.class, () -> Comparison.compare(new Object(), new Object()));
        Conditions.signaledBy(IncomparableValuesCondition.class, () -> PersistentTreeSet.of(Keyword.intern("a"), "a"));
    }
}
