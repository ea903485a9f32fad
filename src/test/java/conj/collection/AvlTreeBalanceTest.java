// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import java.security.SecureRandom;
import static org.assertj.core.api.Assertions.assertThat;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

final class AvlTreeBalanceTest {
    @Test
    void ascendingInsertionStaysBalanced() {
        var map = PersistentTreeMap.<Integer, Integer>empty();
        for (int i = 0; i < 10_000; i += 1) {
            map = map.assoc(i, i);
        }
        assertThat(checkedHeight(map.root())).isLessThanOrEqualTo(maxHeight(10_000));
        for (int i = 0; i < 10_000; i += 2) {
            map = map.without(i);
        }
        assertThat(map.count()).isEqualTo(5_000);
        assertThat(checkedHeight(map.root())).isLessThanOrEqualTo(maxHeight(5_000));
    }

    @RepeatedTest(8)
    void randomUpdatesStayBalanced() {
        final var random = new SecureRandom();
        var set = PersistentTreeSet.<Integer>empty();
        for (int i = 0; i < 20_000; i += 1) {
            final var value = random.nextInt(5_000);
            set = random.nextBoolean() ? set.conj(value) : set.disj(value);
            if (i % 1_000 == 0) {
                checkedHeight(set.map().root());
            }
        }
        assertThat(checkedHeight(set.map().root())).isLessThanOrEqualTo(maxHeight(set.count()));
    }

    @Test
    void updatesShareUntouchedSubtrees() {
        var map = PersistentTreeMap.<Integer, String>empty();
        for (int i = 0; i < 1_000; i += 1) {
            map = map.assoc(i, "v" + i);
        }
        final var root = map.root();
        assertThat(root).isNotNull();
        final var updated = map.assoc(999, "changed").root();
        assertThat(updated).isNotNull();
        assertThat(updated.left()).isSameAs(root.left());
    }

    // Checks the ordering, the AVL balance condition and the cached heights, returning the height.
    private static int checkedHeight(final AvlTree.@Nullable Node<Integer, ?> node) {
        if (node == null) {
            return 0;
        }
        final var left = node.left();
        final var right = node.right();
        if (left != null) {
            assertThat(left.key()).isLessThan(node.key());
        }
        if (right != null) {
            assertThat(right.key()).isGreaterThan(node.key());
        }
        final var leftHeight = checkedHeight(left);
        final var rightHeight = checkedHeight(right);
        assertThat(Math.abs(leftHeight - rightHeight)).isLessThanOrEqualTo(1);
        final var height = Math.max(leftHeight, rightHeight) + 1;
        assertThat(node.height()).isEqualTo(height);
        return height;
    }

    // An AVL tree of n nodes is at most about 1.44 log2(n + 2) high.
    private static int maxHeight(final long count) {
        return (int) Math.floor(1.45 * (Math.log(count + 2) / Math.log(2)));
    }
}
