// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conj.test;

import conj.collection.PersistentHashMap;
import conj.collection.PersistentVector;
import conj.destructure.DestructuringCompiler;
import conj.destructure.KeyFamily;
import conj.destructure.MalformedPatternCondition;
import conj.destructure.Pattern;
import conj.destructure.PatternParser;
import conj.value.Keyword;
import conj.value.Symbol;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class PatternParserTest {
    @Test
    void symbolsBecomeNames() {
        assertThat(PatternParser.parse(Symbol.of("x"))).isEqualTo(Pattern.Name.of("x"));
        assertThat(Pattern.Name.of("_").isDiscard()).isTrue();
    }

    @Test
    void vectorsBecomePositionalPatterns() {
        final var pattern = PatternParser.parse(PersistentVector.of(
            Symbol.of("a"),
            PersistentVector.of(Symbol.of("b")),
            Symbol.of("&"),
            Symbol.of("more"),
            Keyword.intern("as"),
            Symbol.of("all")
        ));
        assertThat(pattern).isInstanceOf(Pattern.Positional.class);
        final var positional = (Pattern.Positional) pattern;
        assertThat(positional.elements()).hasSize(2);
        assertThat(positional.rest()).isEqualTo(Pattern.Name.of("more"));
        assertThat(positional.whole()).isEqualTo(Symbol.of("all"));
        assertThat(pattern).asString().isEqualTo("[a [b] & more :as all]");
    }

    @Test
    void mapsBecomeKeyedPatterns() {
        final var pattern = (Pattern.Keyed) PatternParser.parse(PersistentHashMap.ofPairs(
            Symbol.of("a"), Keyword.intern("a"),
            Keyword.intern("strs"), PersistentVector.of(Symbol.of("b")),
            Keyword.intern("or"), PersistentHashMap.of(Symbol.of("b"), "default"),
            Keyword.intern("as"), Symbol.of("all")
        ));
        assertThat(pattern.bindings()).containsExactly(new Pattern.KeyBinding(Pattern.Name.of("a"), Keyword.intern("a")));
        assertThat(pattern.shorthands())
            .containsExactly(new Pattern.Shorthand(KeyFamily.STRINGS, PersistentVector.of(Symbol.of("b"))));
        assertThat(pattern.defaults().get(Symbol.of("b"))).isEqualTo("default");
        assertThat(pattern.whole()).isEqualTo(Symbol.of("all"));
    }

    @Test
    void unsupportedFormsAreMalformed() {
        final var condition = malformed(42);
        assertThat(condition.form()).isEqualTo(42);
        assertThat(condition.traces()).anySatisfy(trace -> assertThat(trace).startsWith("parsing binding form"));
        malformed("x");
        malformed(null);
    }

    @Test
    void misplacedMarkersAreMalformed() {
        malformed(PersistentVector.of(Symbol.of("a"), Symbol.of("&")));
        malformed(PersistentVector.of(Symbol.of("&"), Symbol.of("a"), Symbol.of("b")));
        malformed(PersistentVector.of(Symbol.of("&"), Symbol.of("a"), Symbol.of("&"), Symbol.of("b")));
        malformed(PersistentVector.of(Keyword.intern("as")));
        malformed(PersistentVector.of(Keyword.intern("as"), Symbol.of("a"), Symbol.of("b")));
        malformed(PersistentVector.of(Keyword.intern("as"), PersistentVector.of()));
        malformed(PersistentVector.of(Keyword.intern("as"), Symbol.of("_")));
        malformed(Symbol.of("&"));
    }

    @Test
    void badKeyedClausesAreMalformed() {
        malformed(PersistentHashMap.of(Keyword.intern("keys"), Symbol.of("x")));
        malformed(PersistentHashMap.of(Keyword.intern("keys"), PersistentVector.of("x")));
        malformed(PersistentHashMap.of(Keyword.intern("or"), PersistentVector.of()));
        malformed(PersistentHashMap.of(Keyword.intern("as"), "name"));
        malformed(PersistentHashMap.of(
            Symbol.of("x"), Keyword.intern("x"),
            Keyword.intern("or"), PersistentHashMap.of("x", 1)
        ));
    }

    @Test
    void defaultsForUnboundNamesAreMalformed() {
        final var form = PersistentHashMap.ofPairs(
            Symbol.of("x"), Keyword.intern("x"),
            Keyword.intern("or"), PersistentHashMap.of(Symbol.of("y"), 1)
        );
        final var pattern = PatternParser.parse(form);
        final var condition = Conditions.signaledBy(
            MalformedPatternCondition.class,
            () -> DestructuringCompiler.compile(pattern)
        );
        assertThat(condition.message()).contains("y");
        assertThat(condition.traces()).anySatisfy(trace -> assertThat(trace).startsWith("compiling binding pattern"));
    }

    @Test
    void directlyBuiltPatternsAreCheckedToo() {
        Conditions.signaledBy(
            MalformedPatternCondition.class,
            () -> DestructuringCompiler.compile(Pattern.Name.of("&"))
        );
        Conditions.signaledBy(
            MalformedPatternCondition.class,
            () -> DestructuringCompiler.compile(new Pattern.Positional(PersistentVector.empty(), null, Symbol.of("_")))
        );
    }

    private static MalformedPatternCondition malformed(final Object form) {
        return Conditions.signaledBy(MalformedPatternCondition.class, () -> PatternParser.parse(form));
    }
}
