// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.TreeMap;
import java.util.stream.LongStream;
import conj.collection.Bound;
import conj.collection.IncomparableValuesCondition;
import conj.collection.MapEntry;
import conj.collection.PersistentHashMap;
import conj.collection.PersistentTreeMap;
import conj.collection.PersistentTreeSet;
import conj.collection.Sequence;
import conj.util.condition.ConditionContext;
import conj.util.condition.UnhandledErrorError;
import conj.value.Keyword;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

final class PersistentTreeMapTest {
    static LongStream provideSeeds() {
        return RandomUtils.seeds(8);
    }

    @Test
    void entriesComeOutSorted() {
        final PersistentTreeMap<Integer, String> map = PersistentTreeMap.ofPairs(3, "c", 1, "a", 2, "b");
        assertThat(map.keys()).containsExactly(1, 2, 3);
        assertThat(map.values()).containsExactly("a", "b", "c");
        assertThat(map.rseq()).containsExactly(MapEntry.of(3, "c"), MapEntry.of(2, "b"), MapEntry.of(1, "a"));
        assertThat(map).asString().isEqualTo("{1 a, 2 b, 3 c}");
        assertThat(map.firstEntry()).isEqualTo(MapEntry.of(1, "a"));
        assertThat(map.lastEntry()).isEqualTo(MapEntry.of(3, "c"));
    }

    @Test
    void equalityWithHashMapsIsSymmetric() {
        final PersistentTreeMap<Object, String> sorted = PersistentTreeMap.ofPairs(1, "a");
        final PersistentHashMap<Object, String> hashed = PersistentHashMap.ofPairs(1L, "a");
        assertThat(sorted.equals(hashed)).isFalse();
        assertThat(hashed.equals(sorted)).isFalse();

        final PersistentHashMap<Object, String> sameKeys = PersistentHashMap.ofPairs(1, "a");
        assertThat(sorted).isEqualTo(sameKeys);
        assertThat(sameKeys).isEqualTo(sorted);
        assertThat(sorted.hashCode()).isEqualTo(sameKeys.hashCode());

        final PersistentHashMap<Object, String> stringKeys = PersistentHashMap.ofPairs("x", "a");
        assertThat(sorted.equals(stringKeys)).isFalse();
        assertThat(stringKeys.equals(sorted)).isFalse();
    }

    @Test
    void lookupOfIncomparableKeyStillSignals() {
        final PersistentTreeMap<Object, String> map = PersistentTreeMap.ofPairs(1, "a");
        assertThatExceptionOfType(UnhandledErrorError.class)
            .isThrownBy(() -> map.get("x"))
            .satisfies(error -> assertThat(error.condition()).isInstanceOf(IncomparableValuesCondition.class));
        assertThat(ConditionContext.restarts()).isEmpty();
    }

    @Test
    void emptyMapHasNoEnds() {
        final var map = PersistentTreeMap.<Integer, String>empty();
        assertThat(map.firstEntry()).isNull();
        assertThat(map.lastEntry()).isNull();
        assertThat(map.seq()).isEmpty();
        assertThat(map.range(Bound.inclusive(0), null)).isEmpty();
    }

    @Test
    void rangesHonorBounds() {
        var set = PersistentTreeSet.<Integer>empty();
        for (int i = 0; i < 100; i += 10) {
            set = set.conj(i);
        }
        assertThat(set.range(Bound.inclusive(20), Bound.inclusive(50))).containsExactly(20, 30, 40, 50);
        assertThat(set.range(Bound.exclusive(20), Bound.exclusive(50))).containsExactly(30, 40);
        assertThat(set.range(Bound.inclusive(15), Bound.inclusive(35))).containsExactly(20, 30);
        assertThat(set.range(null, Bound.exclusive(30))).containsExactly(0, 10, 20);
        assertThat(set.range(Bound.exclusive(70), null)).containsExactly(80, 90);
        assertThat(set.range(Bound.inclusive(50), Bound.inclusive(20))).isEmpty();
        assertThat(set.reverseRange(Bound.inclusive(20), Bound.inclusive(50))).containsExactly(50, 40, 30, 20);
        assertThat(set.reverseRange(Bound.exclusive(20), Bound.exclusive(50))).containsExactly(40, 30);
        assertThat(set.reverseRange(null, Bound.inclusive(25))).containsExactly(20, 10, 0);
    }

    @ParameterizedTest(name = RandomUtils.seededTestDisplayName)
    @MethodSource("provideSeeds")
    void randomOperationsMatchTreeMap(final long seed) {
        final var random = RandomUtils.createGenerator(seed);
        final var expected = new TreeMap<Integer, Integer>();
        var map = PersistentTreeMap.<Integer, Integer>empty();
        for (int i = 0; i < 20_000; i += 1) {
            final var key = random.nextInt(2_000);
            if (random.nextInt(3) == 0) {
                expected.remove(key);
                map = map.without(key);
            } else {
                expected.put(key, i);
                map = map.assoc(key, i);
            }
        }
        assertThat(map.count()).isEqualTo(expected.size());
        assertThat(map.keys()).containsExactlyElementsOf(expected.keySet());
        assertThat(map.values()).containsExactlyElementsOf(expected.values());
        final var low = random.nextInt(2_000);
        final var high = low + random.nextInt(500);
        assertThat(map.range(Bound.inclusive(low), Bound.exclusive(high)))
            .containsExactlyElementsOf(entries(expected.subMap(low, true, high, false)));
        assertThat(map.reverseRange(Bound.exclusive(low), Bound.inclusive(high)))
            .containsExactlyElementsOf(entries(expected.subMap(low, false, high, true).descendingMap()));
    }

    @Test
    void customComparatorDecidesOrderAndIdentity() {
        final Comparator<String> caseInsensitive = String.CASE_INSENSITIVE_ORDER;
        final var map = PersistentTreeMap.<String, Integer>empty(caseInsensitive)
            .assoc("Beta", 1)
            .assoc("alpha", 2)
            .assoc("BETA", 3);
        assertThat(map.count()).isEqualTo(2);
        assertThat(map.keys()).containsExactly("alpha", "Beta");
        assertThat(map.get("beta")).isEqualTo(3);
        assertThat(map.cleared().comparator()).isSameAs(caseInsensitive);
    }

    @Test
    void mixedNumbersCompareByValue() {
        final PersistentTreeMap<Number, String> map = PersistentTreeMap.ofPairs(2L, "two", 1, "one", 1.5, "one and a half");
        assertThat(map.values()).containsExactly("one", "one and a half", "two");
        assertThat(map.get(2)).isEqualTo("two");
    }

    @Test
    void keywordsSortByName() {
        final var set = PersistentTreeSet.of(Keyword.intern("c"), Keyword.intern("a"), Keyword.intern("b"));
        assertThat(set).asString().isEqualTo("#{:a :b :c}");
        assertThat(set.firstElement()).isEqualTo(Keyword.intern("a"));
        assertThat(set.lastElement()).isEqualTo(Keyword.intern("c"));
    }

    @Test
    void rangeIsLazy() {
        var map = PersistentTreeMap.<Integer, Integer>empty();
        for (int i = 0; i < 1_000; i += 1) {
            map = map.assoc(i, i);
        }
        final Sequence<MapEntry<Integer, Integer>> range = map.range(Bound.inclusive(10), null);
        assertThat(range.first()).isEqualTo(MapEntry.of(10, 10));
        assertThat(range.rest().first()).isEqualTo(MapEntry.of(11, 11));
    }

    private static ArrayList<MapEntry<Integer, Integer>> entries(final java.util.Map<Integer, Integer> map) {
        final var result = new ArrayList<MapEntry<Integer, Integer>>();
        for (final var entry : map.entrySet()) {
            result.add(MapEntry.of(entry.getKey(), entry.getValue()));
        }
        return result;
    }
}
