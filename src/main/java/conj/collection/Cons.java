// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.collection;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A sequence cell made of an element and any sequence after it, lazy ones included.
 * <p>
 * {@link #rest()} hands back the tail as is, so consing in front of an unrealized {@link LazySeq} keeps it unrealized.
 */
public final class Cons<T> extends AbstractSequence<T> {
    @SuppressWarnings("unchecked")
    Cons(final T head, final Sequence<? extends T> more) {
        this.head = head;
        this.more = (Sequence<T>) more; // Sequences are immutable, so widening the element type is safe.
    }

    @Override
    public boolean isEmpty() {
        return false;
    }

    @Override
    public T first() {
        return head;
    }

    @Override
    public Sequence<T> rest() {
        return more;
    }

    private final T head;
    private final Sequence<T> more;
}
