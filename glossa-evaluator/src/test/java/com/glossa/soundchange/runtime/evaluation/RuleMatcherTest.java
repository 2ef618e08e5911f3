package com.glossa.soundchange.runtime.evaluation;

import com.glossa.soundchange.api.model.MatchSpec;
import com.glossa.soundchange.api.model.SoundChangeRule;
import com.glossa.soundchange.runtime.model.Inventory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RuleMatcherTest {

    private RuleMatcher matcher;
    private SymbolMatcher symbolMatcher;

    @BeforeEach
    void setUp() {
        Inventory inventory = Inventory.builder()
                .registerConsonant("t", "voiceless", "dental", "plosive")
                .registerConsonant("b", "voiced", "bilabial", "plosive")
                .registerVowel("a", "unrounded", "open", "central")
                .build();
        symbolMatcher = new SymbolMatcher(inventory);
        matcher = new RuleMatcher(symbolMatcher);
    }

    private static SoundChangeRule rule(List<MatchSpec> source, List<MatchSpec> environment) {
        return new SoundChangeRule("r", source, source, environment);
    }

    @Test
    @DisplayName("Should never let a feature specifier match a boundary")
    void shouldNotMatchBoundaryWithFeatures() {
        assertThat(symbolMatcher.matches(MatchSpec.features("voiced"), "#")).isFalse();
        assertThat(symbolMatcher.matches(MatchSpec.features("voiced"), "b")).isTrue();
        assertThat(symbolMatcher.matches(MatchSpec.consonant(), "a")).isFalse();
        assertThat(symbolMatcher.matches(MatchSpec.boundary(), "#")).isTrue();
    }

    @Test
    @DisplayName("Should find non-overlapping windows left to right")
    void shouldFindNonOverlappingWindows() {
        SoundChangeRule doubleA = SoundChangeRule.unconditional("aa",
                List.of(MatchSpec.literal("a"), MatchSpec.literal("a")),
                List.of(MatchSpec.literal("a"), MatchSpec.literal("a")));

        assertThat(matcher.findWindows(List.of("a", "a", "a"), doubleA).toIntArray()).containsExactly(0);
        assertThat(matcher.findWindows(List.of("a", "a", "a", "a"), doubleA).toIntArray()).containsExactly(0, 2);
    }

    @Test
    @DisplayName("Should retry the mismatching symbol as a fresh start")
    void shouldRetryAfterPartialMismatch() {
        SoundChangeRule ta = SoundChangeRule.unconditional("ta",
                List.of(MatchSpec.literal("t"), MatchSpec.literal("a")),
                List.of(MatchSpec.literal("t"), MatchSpec.literal("a")));

        assertThat(matcher.findWindows(List.of("t", "t", "a"), ta).toIntArray()).containsExactly(1);
    }

    @Test
    @DisplayName("Should check environment against symbols around the window")
    void shouldCheckEnvironment() {
        SoundChangeRule intervocalic = rule(List.of(MatchSpec.literal("t")),
                List.of(MatchSpec.vowel(), MatchSpec.focus(), MatchSpec.vowel()));

        assertThat(matcher.findWindows(List.of("#", "t", "a", "t", "a", "#"), intervocalic).toIntArray()).containsExactly(3);
    }

    @Test
    @DisplayName("Should treat positions outside the word as a boundary")
    void shouldTreatWordEdgeAsBoundary() {
        SoundChangeRule initial = rule(List.of(MatchSpec.boundary(), MatchSpec.literal("t")),
                List.of(MatchSpec.boundary(), MatchSpec.focus(), MatchSpec.vowel()));

        assertThat(matcher.findWindows(List.of("#", "t", "a", "t", "a", "#"), initial).toIntArray()).containsExactly(0);
        assertThat(matcher.findWindows(List.of("t", "a"), rule(List.of(MatchSpec.literal("t")),
                List.of(MatchSpec.boundary(), MatchSpec.focus()))).toIntArray()).containsExactly(0);
    }

    @Test
    @DisplayName("Should release a window rejected by its environment")
    void shouldResumeAfterRejectedWindow() {
        SoundChangeRule beforeT = rule(List.of(MatchSpec.vowel(), MatchSpec.vowel()),
                List.of(MatchSpec.focus(), MatchSpec.literal("t")));

        // "aa" at 0 is followed by a, "aa" at 1 is followed by t
        assertThat(matcher.findWindows(List.of("a", "a", "a", "t"), beforeT).toIntArray()).containsExactly(1);
    }

    @Test
    @DisplayName("Should find nothing in an empty word")
    void shouldIgnoreEmptyWord() {
        SoundChangeRule any = rule(List.of(MatchSpec.literal("t")), List.of(MatchSpec.focus()));

        assertThat(matcher.findWindows(List.of(), any).toIntArray()).isEmpty();
    }

    @Test
    @DisplayName("Should find nothing for an empty source pattern")
    void shouldIgnoreEmptySource() {
        SoundChangeRule empty = rule(List.of(), List.of(MatchSpec.focus()));

        assertThat(matcher.findWindows(List.of("#", "t", "a", "#"), empty).toIntArray()).isEmpty();
    }
}
