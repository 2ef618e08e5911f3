/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.runtime.evaluation;

import com.glossa.soundchange.api.ISoundChangeEngine;
import com.glossa.soundchange.api.RuleApplicationListener;
import com.glossa.soundchange.api.model.DerivationResult;
import com.glossa.soundchange.api.model.SoundChangeRule;
import com.glossa.soundchange.runtime.model.Inventory;
import com.glossa.soundchange.runtime.model.LanguageModel;
import com.glossa.soundchange.runtime.model.RuleSet;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies an ordered rule set to words.
 *
 * <h2>Semantics</h2>
 * <p>Every rule makes one complete left-to-right pass over the output of the
 * previous rule. Matching always reads the word the rule received; rewrites
 * produce a new list, so the caller's word is never modified.
 *
 * <h2>Failure policy</h2>
 * <p>Applying rules never fails. An unmatched rule is a no-op and an
 * unresolvable feature rewrite keeps the original symbol, logs a warning and
 * notifies the {@link RuleApplicationListener}.
 *
 * <h2>Thread Safety</h2>
 * <p>The inventory is immutable and the rule set hands out snapshots, so one
 * evaluator may serve concurrent callers as long as each passes its own word.
 */
public final class SoundChangeEvaluator implements ISoundChangeEngine {
    private static final Logger logger = Logger.getLogger(SoundChangeEvaluator.class.getName());

    private final Inventory inventory;
    private final RuleSet ruleSet;
    private final RuleMatcher matcher;
    private final RuleRewriter rewriter;
    private volatile Tracer tracer;
    private volatile RuleApplicationListener listener = RuleApplicationListener.NONE;

    public SoundChangeEvaluator(Inventory inventory, RuleSet ruleSet, Tracer tracer) {
        this.inventory = Objects.requireNonNull(inventory, "Inventory cannot be null");
        this.ruleSet = Objects.requireNonNull(ruleSet, "Rule set cannot be null");
        this.tracer = tracer;
        this.matcher = new RuleMatcher(new SymbolMatcher(inventory));
        this.rewriter = new RuleRewriter(inventory);
    }

    public SoundChangeEvaluator(Inventory inventory, RuleSet ruleSet) {
        this(inventory, ruleSet, OpenTelemetry.noop().getTracer("glossa-evaluator"));
    }

    public SoundChangeEvaluator(LanguageModel model, Tracer tracer) {
        this(model.inventory(), model.ruleSet(), tracer);
    }

    /**
     * Folds a rule set over a word without a listener.
     */
    public static List<String> applyRules(List<String> word, Inventory inventory, RuleSet ruleSet) {
        return new SoundChangeEvaluator(inventory, ruleSet).apply(word);
    }

    /**
     * Folds the given rules, in list order, over a word.
     */
    public static List<String> applyRules(List<String> word, Inventory inventory, List<SoundChangeRule> rules) {
        RuleSet ruleSet = new RuleSet();
        rules.forEach(ruleSet::add);
        return applyRules(word, inventory, ruleSet);
    }

    public Inventory getInventory() {
        return inventory;
    }

    public RuleSet getRuleSet() {
        return ruleSet;
    }

    @Override
    public void setRuleApplicationListener(RuleApplicationListener listener) {
        this.listener = listener != null ? listener : RuleApplicationListener.NONE;
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public List<String> apply(List<String> word) {
        return run(word, null);
    }

    @Override
    public DerivationResult applyWithTrace(List<String> word) {
        List<DerivationResult.DerivationStep> steps = new ArrayList<>();
        List<String> surface = run(word, steps);
        return new DerivationResult(word, surface, steps);
    }

    @Override
    public List<String> applyRule(List<String> word, SoundChangeRule rule) {
        Objects.requireNonNull(word, "Word cannot be null");
        return List.copyOf(pass(word, rule).word());
    }

    private List<String> run(List<String> word, List<DerivationResult.DerivationStep> steps) {
        Objects.requireNonNull(word, "Word cannot be null");
        List<SoundChangeRule> rules = ruleSet.rules();

        Span span = tracer.spanBuilder("apply-rules").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("wordLength", word.size());
            span.setAttribute("ruleCount", rules.size());

            List<String> current = word;
            int applied = 0;
            for (SoundChangeRule rule : rules) {
                RulePass result = pass(current, rule);
                if (result.windows() > 0) {
                    applied++;
                    if (steps != null) {
                        steps.add(new DerivationResult.DerivationStep(
                                rule.id(), current, result.word(), result.windows()));
                    }
                }
                current = result.word();
            }

            span.setAttribute("rulesApplied", applied);
            return List.copyOf(current);
        } finally {
            span.end();
        }
    }

    private RulePass pass(List<String> word, SoundChangeRule rule) {
        IntList windows = matcher.findWindows(word, rule);
        if (windows.isEmpty()) {
            return new RulePass(word, 0);
        }
        RuleApplicationListener current = listener;
        List<String> output = rewriter.rewrite(word, rule, windows, current::onUnresolvableTarget);

        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Rule %s rewrote %d window(s): %s -> %s", rule.id(), windows.size(), word, output));
        }
        current.onRuleApplied(rule, windows.size(), word, output);
        return new RulePass(output, windows.size());
    }

    private record RulePass(List<String> word, int windows) {
    }
}
