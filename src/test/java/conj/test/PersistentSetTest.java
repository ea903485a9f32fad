// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.test;

import java.util.HashSet;
import java.util.stream.LongStream;
import conj.collection.PersistentHashSet;
import conj.collection.PersistentTreeSet;
import conj.collection.Sets;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

final class PersistentSetTest {
    static LongStream provideSeeds() {
        return RandomUtils.seeds(8);
    }

    @Test
    void membershipWorks() {
        final var set = PersistentHashSet.of("a", "b", "c");
        assertThat(set.count()).isEqualTo(3);
        assertThat(set.contains("b")).isTrue();
        assertThat(set.contains("d")).isFalse();
        assertThat(set.get("c")).isEqualTo("c");
        assertThat(set.get("d")).isNull();
        assertThat(set.disj("b").contains("b")).isFalse();
        assertThat(set.disj("z")).isSameAs(set);
        assertThat(set.conj("a")).isSameAs(set);
        assertThat(set.cleared()).isEmpty();
    }

    @Test
    void getReturnsStoredElement() {
        final var stored = new String("key");
        final var set = PersistentHashSet.of(stored);
        assertThat(set.get(new String("key"))).isSameAs(stored);
        assertThat(set.conj(new String("key")).get("key")).isSameAs(stored);
    }

    @Test
    void nullIsAnElement() {
        final var set = PersistentHashSet.<String>empty().conj(null);
        assertThat(set.contains(null)).isTrue();
        assertThat(set.count()).isEqualTo(1);
        assertThat(set.disj(null)).isEmpty();
    }

    @Test
    void equalityIgnoresOrderAndImplementation() {
        final var hashed = PersistentHashSet.of(3, 1, 2);
        final var sorted = PersistentTreeSet.of(1, 2, 3);
        assertThat(hashed).isEqualTo(sorted);
        assertThat(sorted).isEqualTo(hashed);
        assertThat(hashed.hashCode()).isEqualTo(sorted.hashCode());
        assertThat(hashed).isNotEqualTo(PersistentHashSet.of(1, 2));
        assertThat(PersistentHashSet.of(1)).asString().isEqualTo("#{1}");
    }

    @Test
    void equalityIsSymmetricBetweenHashedAndSortedSets() {
        final PersistentTreeSet<Number> sorted = PersistentTreeSet.of(1, 2);
        final PersistentHashSet<Number> hashed = PersistentHashSet.of(1L, 2L);
        assertThat(sorted.equals(hashed)).isFalse();
        assertThat(hashed.equals(sorted)).isFalse();

        final PersistentTreeSet<Number> mixed = PersistentTreeSet.of(1L, 2);
        final PersistentTreeSet<Number> otherMixed = PersistentTreeSet.of(1, 2L);
        assertThat(mixed).isEqualTo(otherMixed);
        assertThat(mixed.hashCode()).isEqualTo(otherMixed.hashCode());
    }

    @Test
    void setsOfIncomparableElementsAreUnequal() {
        final var numbers = PersistentTreeSet.of(1, 2);
        final var strings = PersistentHashSet.of("a", "b");
        assertThat(numbers.equals(strings)).isFalse();
        assertThat(strings.equals(numbers)).isFalse();
        assertThat(PersistentTreeSet.of("a", "b").equals(strings)).isTrue();
    }

    @Test
    void setAlgebraWorks() {
        final var odd = PersistentHashSet.of(1, 3, 5, 7);
        final var small = PersistentHashSet.of(1, 2, 3);
        assertThat(Sets.union(odd, small)).isEqualTo(PersistentHashSet.of(1, 2, 3, 5, 7));
        assertThat(Sets.intersection(odd, small)).isEqualTo(PersistentHashSet.of(1, 3));
        assertThat(Sets.difference(odd, small)).isEqualTo(PersistentHashSet.of(5, 7));
        assertThat(Sets.difference(small, odd)).isEqualTo(PersistentHashSet.of(2));
        assertThat(Sets.isSubset(PersistentHashSet.of(1, 3), odd)).isTrue();
        assertThat(Sets.isSubset(small, odd)).isFalse();
        assertThat(Sets.isSuperset(odd, PersistentHashSet.of(5))).isTrue();
        assertThat(Sets.isSubset(PersistentHashSet.empty(), odd)).isTrue();
    }

    @Test
    void sortedSetAlgebraKeepsOrder() {
        final var union = Sets.union(PersistentTreeSet.of(5, 1), PersistentHashSet.of(3));
        assertThat(union).isInstanceOf(PersistentTreeSet.class);
        assertThat(union).containsExactly(1, 3, 5);
    }

    @ParameterizedTest(name = RandomUtils.seededTestDisplayName)
    @MethodSource("provideSeeds")
    void randomOperationsMatchHashSet(final long seed) {
        final var random = RandomUtils.createGenerator(seed);
        final var expected = new HashSet<Integer>();
        var set = PersistentHashSet.<Integer>empty();
        for (int i = 0; i < 20_000; i += 1) {
            final var element = random.nextInt(3_000);
            if (random.nextBoolean()) {
                expected.add(element);
                set = set.conj(element);
            } else {
                expected.remove(element);
                set = set.disj(element);
            }
        }
        assertThat(set.count()).isEqualTo(expected.size());
        assertThat(set).containsExactlyInAnyOrderElementsOf(expected);
        assertThat(PersistentHashSet.fromIterable(expected)).isEqualTo(set);
    }
}
