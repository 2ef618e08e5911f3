/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.api.model;

import java.util.List;

/**
 * Underlying and surface forms of a word together with the rules that changed it.
 *
 * <h2>Usage</h2>
 * <pre>
 * DerivationResult result = engine.applyWithTrace(List.of("#", "a", "b", "a", "#"));
 * for (DerivationStep step : result.steps()) {
 *     System.out.println(step.ruleId() + ": " + step.before() + " -> " + step.after());
 * }
 * </pre>
 *
 * @param underlying the word before any rule
 * @param surface    the word after the last rule
 * @param steps      one entry per rule that rewrote at least one window, in rule order
 */
public record DerivationResult(
        List<String> underlying,
        List<String> surface,
        List<DerivationStep> steps) {

    public DerivationResult {
        underlying = List.copyOf(underlying);
        surface = List.copyOf(surface);
        steps = List.copyOf(steps);
    }

    /**
     * Returns true if any rule changed the word.
     */
    public boolean changed() {
        return !underlying.equals(surface);
    }

    /**
     * A single rule application.
     *
     * @param ruleId  the rule applied
     * @param before  the word the rule received
     * @param after   the word the rule produced
     * @param windows number of match windows rewritten
     */
    public record DerivationStep(
            String ruleId,
            List<String> before,
            List<String> after,
            int windows) {

        public DerivationStep {
            before = List.copyOf(before);
            after = List.copyOf(after);
        }
    }
}
