package com.glossa.soundchange.runtime.evaluation;

import com.glossa.soundchange.api.RuleApplicationListener;
import com.glossa.soundchange.api.model.DerivationResult;
import com.glossa.soundchange.api.model.MatchSpec;
import com.glossa.soundchange.api.model.SoundChangeRule;
import com.glossa.soundchange.api.model.UnresolvableTarget;
import com.glossa.soundchange.runtime.model.Inventory;
import com.glossa.soundchange.runtime.model.RuleSet;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SoundChangeEvaluatorTest {

    private static final List<String> TATA = List.of("#", "t", "a", "t", "a", "#");

    private Inventory inventory;
    private RuleSet ruleSet;
    private SoundChangeEvaluator evaluator;

    @BeforeEach
    void setUp() {
        inventory = Inventory.builder()
                .registerConsonant("t", "voiceless", "dental", "plosive")
                .registerConsonant("d", "voiced", "dental", "plosive")
                .registerConsonant("b", "voiced", "bilabial", "plosive")
                .registerConsonant("β", "voiced", "bilabial", "fricative")
                .registerConsonant("h", "voiceless", "glottal", "fricative")
                .registerVowel("a", "unrounded", "open", "central")
                .registerVowel("i", "unrounded", "close", "front")
                .build();
        ruleSet = new RuleSet();
        evaluator = new SoundChangeEvaluator(inventory, ruleSet, OpenTelemetry.noop().getTracer("test"));
    }

    @Test
    @DisplayName("Should leave empty words and empty rule sets alone")
    void shouldNoOpOnEmptyInput() {
        assertThat(evaluator.apply(TATA)).isEqualTo(TATA);

        ruleSet.addRule(List.of(MatchSpec.literal("t")), List.of(MatchSpec.literal("d")));
        assertThat(evaluator.apply(List.of())).isEmpty();
    }

    @Test
    @DisplayName("Should leave word unchanged for a rule rewriting to itself")
    void shouldBeIdempotentForStableRule() {
        ruleSet.addRule(List.of(MatchSpec.vowel(), MatchSpec.features("voiced", "plosive")),
                List.of(MatchSpec.vowel(), MatchSpec.features("voiced", "plosive")));

        List<String> word = List.of("#", "a", "b", "a", "d", "i", "#");
        assertThat(evaluator.apply(word)).isEqualTo(word);
    }

    @Test
    @DisplayName("Should rewrite only the word-initial t before a vowel")
    void shouldAnchorAtBoundary() {
        ruleSet.addRule(List.of(MatchSpec.literal("t")), List.of(MatchSpec.literal("d")),
                List.of(MatchSpec.boundary(), MatchSpec.focus(), MatchSpec.vowel()));

        assertThat(evaluator.apply(TATA)).containsExactly("#", "d", "a", "t", "a", "#");
    }

    @Test
    @DisplayName("Should anchor a source that starts with a boundary")
    void shouldKeepBoundaryAnchorInSource() {
        ruleSet.addRule(List.of(MatchSpec.boundary(), MatchSpec.literal("t")),
                List.of(MatchSpec.boundary(), MatchSpec.literal("d")),
                List.of(MatchSpec.boundary(), MatchSpec.focus(), MatchSpec.vowel()));

        assertThat(evaluator.apply(TATA)).containsExactly("#", "d", "a", "t", "a", "#");
    }

    @Test
    @DisplayName("Should turn intervocalic b into a fricative")
    void shouldRewriteFeatures() {
        ruleSet.addRule(List.of(MatchSpec.features("voiced", "plosive")),
                List.of(MatchSpec.features("voiced", "fricative")),
                List.of(MatchSpec.vowel(), MatchSpec.focus(), MatchSpec.vowel()));

        assertThat(evaluator.apply(List.of("#", "a", "b", "a", "#"))).containsExactly("#", "a", "β", "a", "#");
        // d has no registered fricative counterpart
        assertThat(evaluator.apply(List.of("#", "a", "d", "a", "#"))).containsExactly("#", "a", "d", "a", "#");
    }

    @Test
    @DisplayName("Should keep b and report it when no fricative is registered")
    void shouldKeepSymbolWhenTargetUnresolvable() {
        Inventory plosivesOnly = Inventory.builder()
                .registerConsonant("b", "voiced", "bilabial", "plosive")
                .registerVowel("a", "unrounded", "open", "central")
                .build();
        RuleSet rules = new RuleSet();
        rules.addRule(List.of(MatchSpec.features("voiced", "plosive")),
                List.of(MatchSpec.features("voiced", "fricative")),
                List.of(MatchSpec.vowel(), MatchSpec.focus(), MatchSpec.vowel()));
        SoundChangeEvaluator engine = new SoundChangeEvaluator(plosivesOnly, rules);
        List<UnresolvableTarget> reported = new ArrayList<>();
        engine.setRuleApplicationListener(new RuleApplicationListener() {
            @Override
            public void onUnresolvableTarget(UnresolvableTarget target) {
                reported.add(target);
            }
        });

        assertThat(engine.apply(List.of("#", "a", "b", "a", "#"))).containsExactly("#", "a", "b", "a", "#");
        assertThat(reported).singleElement().satisfies(target -> {
            assertThat(target.symbol()).isEqualTo("b");
            assertThat(target.index()).isEqualTo(2);
            assertThat(target.requestedFeatures()).containsExactly("voiced", "fricative");
        });
    }

    @Test
    @DisplayName("Should delete h before a consonant")
    void shouldDelete() {
        ruleSet.addRule(List.of(MatchSpec.literal("h")), List.of(MatchSpec.deletion()),
                List.of(MatchSpec.focus(), MatchSpec.consonant()));

        List<String> result = evaluator.apply(List.of("#", "a", "h", "t", "a", "#"));

        assertThat(result).containsExactly("#", "a", "t", "a", "#");
    }

    @Test
    @DisplayName("Should rewrite only the middle slot of a multi-slot rule")
    void shouldNotRewriteAnchors() {
        ruleSet.addRule(
                List.of(MatchSpec.vowel(), MatchSpec.features("voiced", "plosive"), MatchSpec.vowel()),
                List.of(MatchSpec.vowel(), MatchSpec.features("fricative"), MatchSpec.vowel()));

        assertThat(evaluator.apply(List.of("#", "i", "b", "a", "#"))).containsExactly("#", "i", "β", "a", "#");
    }

    @Test
    @DisplayName("Should not rewrite symbols already consumed in the same pass")
    void shouldNotOverlap() {
        ruleSet.addRule(List.of(MatchSpec.literal("a"), MatchSpec.literal("a")),
                List.of(MatchSpec.literal("i"), MatchSpec.literal("a")));

        assertThat(evaluator.apply(List.of("a", "a", "a"))).containsExactly("i", "a", "a");
    }

    @Test
    @DisplayName("Should feed each rule the output of the previous one")
    void shouldFoldRulesInOrder() {
        ruleSet.addRule(List.of(MatchSpec.literal("t")), List.of(MatchSpec.literal("d")));
        ruleSet.addRule(List.of(MatchSpec.literal("d")), List.of(MatchSpec.literal("b")));

        assertThat(evaluator.apply(List.of("t", "a"))).containsExactly("b", "a");

        ruleSet.moveTo("rule-2", 0);
        assertThat(evaluator.apply(List.of("t", "a"))).containsExactly("d", "a");
    }

    @Test
    @DisplayName("Should not modify the caller's word")
    void shouldNotMutateInput() {
        ruleSet.addRule(List.of(MatchSpec.literal("t")), List.of(MatchSpec.deletion()));
        List<String> word = new ArrayList<>(TATA);

        evaluator.apply(word);

        assertThat(word).isEqualTo(TATA);
    }

    @Test
    @DisplayName("Should record one step per rule that changed the word")
    void shouldTraceDerivation() {
        ruleSet.addRule(List.of(MatchSpec.literal("t")), List.of(MatchSpec.literal("d")),
                List.of(MatchSpec.vowel(), MatchSpec.focus(), MatchSpec.vowel()));
        ruleSet.addRule(List.of(MatchSpec.literal("h")), List.of(MatchSpec.deletion()));
        ruleSet.addRule(List.of(MatchSpec.literal("a")), List.of(MatchSpec.literal("i")),
                List.of(MatchSpec.focus(), MatchSpec.boundary()));

        DerivationResult result = evaluator.applyWithTrace(TATA);

        assertThat(result.surface()).containsExactly("#", "t", "a", "d", "i", "#");
        assertThat(result.changed()).isTrue();
        assertThat(result.steps()).extracting(DerivationResult.DerivationStep::ruleId)
                .containsExactly("rule-1", "rule-3");
        assertThat(result.steps().get(0).after()).containsExactly("#", "t", "a", "d", "a", "#");
    }

    @Test
    @DisplayName("Should notify listener once per applied rule")
    void shouldNotifyListener() {
        ruleSet.addRule(List.of(MatchSpec.literal("t")), List.of(MatchSpec.literal("d")));
        List<Integer> windows = new ArrayList<>();
        evaluator.setRuleApplicationListener(new RuleApplicationListener() {
            @Override
            public void onRuleApplied(SoundChangeRule rule, int count, List<String> before, List<String> after) {
                windows.add(count);
            }
        });

        evaluator.apply(TATA);

        assertThat(windows).containsExactly(2);
    }

    @Test
    @DisplayName("Should apply a plain rule list without a rule set")
    void shouldApplyRuleList() {
        SoundChangeRule voicing = SoundChangeRule.unconditional("voicing",
                List.of(MatchSpec.literal("t")), List.of(MatchSpec.literal("d")));

        assertThat(SoundChangeEvaluator.applyRules(List.of(), inventory, List.of(voicing))).isEmpty();
        assertThat(SoundChangeEvaluator.applyRules(TATA, inventory, List.of())).isEqualTo(TATA);
        assertThat(SoundChangeEvaluator.applyRules(TATA, inventory, List.of(voicing)))
                .containsExactly("#", "d", "a", "d", "a", "#");
    }

    @Test
    @DisplayName("Should never rewrite a boundary written as a literal")
    void shouldKeepLiteralBoundary() {
        ruleSet.addRule(List.of(MatchSpec.literal("#"), MatchSpec.literal("t")),
                List.of(MatchSpec.literal("a"), MatchSpec.literal("d")));

        assertThat(evaluator.apply(List.of("#", "t", "a", "#"))).containsExactly("#", "d", "a", "#");
    }

    @Test
    @DisplayName("Should ignore the target at anchor slots")
    void shouldIgnoreTargetOfAnchors() {
        ruleSet.addRule(List.of(MatchSpec.consonant()), List.of(MatchSpec.deletion()),
                List.of(MatchSpec.focus(), MatchSpec.boundary()));
        ruleSet.addRule(List.of(MatchSpec.vowel(), MatchSpec.literal("t"), MatchSpec.vowel()),
                List.of(MatchSpec.literal("i"), MatchSpec.literal("d"), MatchSpec.literal("i")));

        assertThat(evaluator.apply(List.of("#", "a", "t", "a", "t", "#"))).containsExactly("#", "a", "d", "a", "t", "#");
    }

    @Test
    @DisplayName("Should leave the word unchanged for an empty source pattern")
    void shouldNoOpOnEmptySource() {
        ruleSet.add(new SoundChangeRule("empty", List.of(), List.of(), List.of(MatchSpec.focus())));

        assertThat(evaluator.apply(List.of("#", "t", "a", "#"))).containsExactly("#", "t", "a", "#");
        assertThat(evaluator.applyWithTrace(List.of("#", "t", "a", "#")).steps()).isEmpty();
    }

    @Test
    @DisplayName("Should apply a rule set through the static entry point")
    void shouldApplyRuleSet() {
        ruleSet.addRule(List.of(MatchSpec.literal("t")), List.of(MatchSpec.literal("d")),
                List.of(MatchSpec.vowel(), MatchSpec.focus()));

        assertThat(SoundChangeEvaluator.applyRules(TATA, inventory, ruleSet))
                .containsExactly("#", "t", "a", "d", "a", "#");
        assertThat(SoundChangeEvaluator.applyRules(List.of(), inventory, ruleSet)).isEmpty();
    }
}
