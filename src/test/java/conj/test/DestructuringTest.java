// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import conj.collection.Absent;
import conj.collection.PersistentHashMap;
import conj.collection.PersistentList;
import conj.collection.PersistentVector;
import conj.collection.Sequence;
import conj.collection.Sequences;
import conj.destructure.Bindings;
import conj.destructure.DestructuringCompiler;
import conj.destructure.Pattern;
import conj.destructure.PatternParser;
import conj.dispatch.Capability;
import conj.dispatch.UnsupportedCapabilityCondition;
import conj.value.Keyword;
import conj.value.Symbol;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;

final class DestructuringTest {
    @Test
    void positionalPatternsWalkTheSource() {
        final var bindings = bind(vector(sym("x"), sym("_"), sym("y")), sample);
        assertThat(bindings.valueOf("x")).isEqualTo(51);
        assertThat(bindings.valueOf("y")).isEqualTo(3);
        assertThat(bindings.isBound("_")).isFalse();
        assertThat(bindings.names()).containsExactly(Symbol.of("x"), Symbol.of("y"));
    }

    @Test
    void nestedPositionalPatternsWork() {
        final var pattern = vector(
            sym("_"), sym("_"), sym("_"), sym("_"), sym("_"), sym("_"),
            vector(sym("_"), vector(sym("_"), sym("x")), sym("y"))
        );
        final var bindings = bind(pattern, sample);
        assertThat(bindings.valueOf("x")).isEqualTo(11);
        assertThat(bindings.valueOf("y")).isEqualTo(33);
    }

    @Test
    void restBindsTheRemainingSequence() {
        final var source = PersistentVector.of(10, 20, PersistentVector.of(1, 2, 3), 30, 40);
        final var pattern = vector(sym("a"), sym("_"), vector(sym("_"), sym("b")), sym("&"), sym("rest"));
        final var bindings = bind(pattern, source);
        assertThat(bindings.valueOf("a")).isEqualTo(10);
        assertThat(bindings.valueOf("b")).isEqualTo(2);
        assertThat(bindings.valueOf("rest")).isInstanceOf(Sequence.class).isEqualTo(PersistentList.of(30, 40));
    }

    @Test
    void restOfNothingIsAbsent() {
        final var values = PersistentVector.of("hi", "there", "koko", "moko");
        assertThat(bind(vector(sym("_"), sym("&"), sym("the-rest")), values).valueOf("the-rest"))
            .isEqualTo(PersistentList.of("there", "koko", "moko"));
        assertThat(bind(vector(sym("&"), sym("the-rest")), values).valueOf("the-rest")).isEqualTo(values);
        assertThat(bind(vector(sym("_"), sym("_"), sym("_"), sym("_"), sym("&"), sym("the-rest")), values)
            .valueOf("the-rest")).isSameAs(Absent.MARKER);
    }

    @Test
    void missingPositionsBindAbsent() {
        final var bindings = bind(vector(sym("a"), sym("b"), sym("c")), PersistentVector.of(1));
        assertThat(bindings.valueOf("a")).isEqualTo(1);
        assertThat(bindings.valueOf("b")).isSameAs(Absent.MARKER);
        assertThat(bindings.valueOf("c")).isSameAs(Absent.MARKER);
        assertThat(bind(vector(sym("a")), null).valueOf("a")).isSameAs(Absent.MARKER);
    }

    @Test
    void wholeBindingKeepsTheOriginal() {
        final var coll = PersistentVector.of(3, 5, 8, 9);
        final var bindings = bind(
            vector(sym("x"), sym("y"), sym("&"), sym("the-rest"), kw("as"), sym("orig-coll")),
            coll
        );
        assertThat(bindings.valueOf("x")).isEqualTo(3);
        assertThat(bindings.valueOf("y")).isEqualTo(5);
        assertThat(bindings.valueOf("the-rest")).isEqualTo(PersistentList.of(8, 9));
        assertThat(bindings.valueOf("orig-coll")).isSameAs(coll);
    }

    @Test
    void positionalPatternsAcceptAnythingSequenceable() {
        assertThat(bind(vector(sym("a"), sym("_"), sym("c")), PersistentList.of(1, 2, 3)).valueOf("c")).isEqualTo(3);
        final var odd = Sequences.filter(Sequences.range(1, 8), n -> n % 2 == 1);
        assertThat(bind(vector(sym("a"), sym("_"), sym("c")), odd).valueOf("c")).isEqualTo(5L);
        final var arrayList = new ArrayList<>(List.of(1, 2, 3));
        assertThat(bind(vector(sym("a"), sym("_"), sym("c")), arrayList).valueOf("c")).isEqualTo(3);
        final var array = new Integer[] {1, 2, 3};
        final var bindings = bind(vector(sym("a"), sym("_"), sym("c"), sym("d")), array);
        assertThat(bindings.valueOf("c")).isEqualTo(3);
        assertThat(bindings.valueOf("d")).isSameAs(Absent.MARKER);
        assertThat(bind(vector(sym("&"), sym("characters")), "koko").valueOf("characters"))
            .isEqualTo(PersistentList.of('k', 'o', 'k', 'o'));
    }

    @Test
    void keyedPatternsLookUpSelectors() {
        final var bindings = bind(map(sym("x"), kw("a"), sym("y"), kw("b")), aMap);
        assertThat(bindings.valueOf("x")).isEqualTo(1);
        assertThat(bindings.valueOf("y")).isEqualTo(3);
        assertThat(bind(map(sym("y"), "foo"), aMap).valueOf("y")).isEqualTo(88);
        assertThat(bind(map(sym("y"), sym("g")), aMap).valueOf("y")).isEqualTo(99);
        assertThat(bind(map(sym("y"), 9), aMap).valueOf("y")).isEqualTo("nine");
        assertThat(bind(map(sym("x"), PersistentVector.of(1, 3)), aMap).valueOf("x")).isEqualTo("hola");
        assertThat(bind(map(sym("k"), kw("unknown")), aMap).valueOf("k")).isSameAs(Absent.MARKER);
    }

    @Test
    void nestedKeyedPatternsWork() {
        assertThat(bind(map(map(sym("word"), kw("f")), kw("d")), aMap).valueOf("word")).isEqualTo("moko");
        final var mapWithVector = PersistentHashMap.of(kw("a"), "koko", kw("b"), PersistentVector.of("hello", "two"));
        assertThat(bind(map(vector(sym("_"), sym("number")), kw("b")), mapWithVector).valueOf("number"))
            .isEqualTo("two");
        assertThat(bind(vector(sym("_"), map(sym("x"), kw("b"))), PersistentVector.of(1, map(kw("a"), "x", kw("b"), 7)))
            .valueOf("x")).isEqualTo(7);
        assertThat(bind(map(map(map(sym("x"), 1), 1, sym("y"), 2), 6), sample).valueOf("x")).isEqualTo(11);
    }

    @Test
    void keyedPatternsWorkOnIndexablesAndJavaMaps() {
        assertThat(bind(map(sym("x"), 0, sym("y"), 1), PersistentVector.of(1, 2)).valueOf("y")).isEqualTo(2);
        final var bindings = bind(map(sym("a"), 0, sym("c"), 2), "koko");
        assertThat(bindings.valueOf("a")).isEqualTo('k');
        assertThat(bindings.valueOf("c")).isEqualTo('k');
        final var javaMap = new HashMap<String, Integer>();
        javaMap.put("a", 1);
        javaMap.put("c", 3);
        assertThat(bind(map(sym("x"), "a", sym("y"), "c"), javaMap).valueOf("y")).isEqualTo(3);
    }

    @Test
    void defaultsApplyOnlyToAbsentKeys() {
        final var pattern = map(sym("k"), kw("missing"), kw("or"), map(sym("k"), "d"));
        assertThat(bind(pattern, map(kw("present"), 5)).valueOf("k")).isEqualTo("d");
        assertThat(bind(pattern, map(kw("missing"), false)).valueOf("k")).isEqualTo(false);
        assertThat(bind(pattern, map(kw("missing"), null)).valueOf("k")).isNull();
        assertThat(bind(pattern, null).valueOf("k")).isEqualTo("d");
    }

    @Test
    void wholeBindingOfKeyedPattern() {
        final var source = map(kw("a"), "koko");
        final var bindings = bind(map(sym("a"), kw("a"), kw("as"), sym("orig-map")), source);
        assertThat(bindings.valueOf("a")).isEqualTo("koko");
        assertThat(bindings.valueOf("orig-map")).isSameAs(source);
    }

    @Test
    void shorthandsDeriveSelectorsFromNames() {
        assertThat(bind(map(kw("keys"), vector(sym("x"), sym("y"))), map(kw("x"), 1, kw("y"), 2)).toMap())
            .isEqualTo(PersistentHashMap.of(Symbol.of("x"), 1, Symbol.of("y"), 2));
        assertThat(bind(map(kw("strs"), vector(sym("x"), sym("y"))), map("x", 1, "y", 2)).valueOf("y")).isEqualTo(2);
        assertThat(bind(map(kw("syms"), vector(sym("x"), sym("y"))), map(sym("x"), 1, sym("y"), 2)).valueOf("x"))
            .isEqualTo(1);
        final var mixed = map(kw("x"), 1, "y", 2);
        final var keysOnly = bind(map(kw("keys"), vector(sym("x"), sym("y"))), mixed);
        assertThat(keysOnly.valueOf("x")).isEqualTo(1);
        assertThat(keysOnly.valueOf("y")).isSameAs(Absent.MARKER);
        final var keysAndStrs = bind(map(kw("keys"), vector(sym("x")), kw("strs"), vector(sym("y"))), mixed);
        assertThat(keysAndStrs.valueOf("y")).isEqualTo(2);
        assertThat(bind(map(kw("keys"), vector(sym("x")), sym("pepito"), "y"), mixed).valueOf("pepito")).isEqualTo(2);
    }

    @Test
    void keyedPatternsReadKeywordArguments() {
        final var userInfo = PersistentVector.of("Koko", 47, kw("address"), "Sesamo Street 26", kw("color"), "blue");
        final var pattern = vector(
            sym("name"), sym("age"), sym("&"),
            map(kw("keys"), vector(sym("address"), sym("color")))
        );
        final var bindings = bind(pattern, userInfo);
        assertThat(bindings.valueOf("name")).isEqualTo("Koko");
        assertThat(bindings.valueOf("age")).isEqualTo(47);
        assertThat(bindings.valueOf("address")).isEqualTo("Sesamo Street 26");
        assertThat(bindings.valueOf("color")).isEqualTo("blue");
        final var listPattern = map(kw("keys"), vector(sym("x"), sym("y")));
        assertThat(bind(listPattern, PersistentList.of(kw("x"), 1, kw("y"), 2)).valueOf("y")).isEqualTo(2);
    }

    @Test
    void keywordArgumentsNeedValues() {
        final var pattern = map(kw("keys"), vector(sym("x")));
        assertThatExceptionOfType(IllegalArgumentException.class)
            .isThrownBy(() -> bind(pattern, PersistentList.of(kw("x"), 1, kw("y"))));
    }

    @Test
    void parameterListsTakeKeywordArgumentsWithDefaults() {
        final var parameters = (Pattern.Positional) PatternParser.parse(vector(
            sym("&"),
            map(kw("keys"), vector(sym("fulness"), sym("tiredness")), kw("or"), map(sym("fulness"), 0, sym("tiredness"), 0))
        ));
        assertThat(tamagotchi(parameters)).isEqualTo(PersistentVector.of(0, 0));
        assertThat(tamagotchi(parameters, kw("tiredness"), 4)).isEqualTo(PersistentVector.of(0, 4));
        assertThat(tamagotchi(parameters, kw("fulness"), 4)).isEqualTo(PersistentVector.of(4, 0));
        assertThat(tamagotchi(parameters, kw("fulness"), 4, kw("tiredness"), 8)).isEqualTo(PersistentVector.of(4, 8));
    }

    @Test
    void plansAreReusable() {
        final var plan = DestructuringCompiler.compile(PatternParser.parse(vector(sym("a"), sym("b"))));
        assertThat(plan.bind(PersistentVector.of(1, 2)).valueOf("b")).isEqualTo(2);
        assertThat(plan.bind(PersistentVector.of(3, 4)).valueOf("b")).isEqualTo(4);
        assertThat(plan.bind(PersistentVector.of(1, 2))).isEqualTo(plan.bind(PersistentList.of(1, 2)));
    }

    @Test
    void capabilityMismatchesSignal() {
        final var notSequenceable = Conditions.signaledBy(
            UnsupportedCapabilityCondition.class,
            () -> bind(vector(sym("a")), 42)
        );
        assertThat(notSequenceable.capability()).isEqualTo(Capability.SEQUENCEABLE);
        assertThat(notSequenceable.traces()).anySatisfy(trace -> assertThat(trace).contains("while binding"));
        final var notAssociative = Conditions.signaledBy(
            UnsupportedCapabilityCondition.class,
            () -> bind(map(sym("a"), kw("a")), 42)
        );
        assertThat(notAssociative.capability()).isEqualTo(Capability.ASSOCIATIVE);
    }

    private static PersistentVector<Object> tamagotchi(final Pattern.Positional parameters, final Object... arguments) {
        final var bindings = DestructuringCompiler.bindParameters(parameters, PersistentVector.of(arguments));
        return PersistentVector.of(bindings.valueOf("fulness"), bindings.valueOf("tiredness"));
    }

    private static Bindings bind(final Object form, final Object source) {
        return DestructuringCompiler.compile(PatternParser.parse(form)).bind(source);
    }

    private static Symbol sym(final String name) {
        return Symbol.of(name);
    }

    private static Keyword kw(final String name) {
        return Keyword.intern(name);
    }

    private static PersistentVector<Object> vector(final Object... elements) {
        return PersistentVector.of(elements);
    }

    private static PersistentHashMap<Object, Object> map(final Object... keysAndValues) {
        return PersistentHashMap.ofPairs(keysAndValues);
    }

    private static final PersistentVector<Object> sample = PersistentVector.of(
        51, 25, 3, PersistentVector.of(4, 5), 6, 7,
        PersistentVector.of(88, PersistentVector.of(99, 11), 33)
    );
    private static final PersistentHashMap<Object, Object> aMap = PersistentHashMap.ofPairs(
        Keyword.intern("a"), 1,
        Keyword.intern("b"), 3,
        Keyword.intern("c"), PersistentVector.of(7, 8, 9),
        Keyword.intern("d"), PersistentHashMap.ofPairs(Keyword.intern("e"), "koko", Keyword.intern("f"), "moko"),
        "foo", 88,
        Symbol.of("g"), 99,
        9, "nine",
        PersistentVector.of(1, 3), "hola"
    );
}
