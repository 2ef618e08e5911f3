/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.api;

import com.glossa.soundchange.api.model.SoundChangeRule;
import com.glossa.soundchange.api.model.UnresolvableTarget;

import java.util.List;

/**
 * Callback interface for rule application events.
 * Lets authoring tools see which rules fire and which feature rewrites had no
 * matching letter.
 *
 * <h2>Usage</h2>
 * <pre>
 * engine.setRuleApplicationListener(new RuleApplicationListener() {
 *     {@literal @}Override
 *     public void onUnresolvableTarget(UnresolvableTarget target) {
 *         System.err.println(target.describe());
 *     }
 * });
 * </pre>
 */
public interface RuleApplicationListener {

    RuleApplicationListener NONE = new RuleApplicationListener() {
    };

    /**
     * Called after a rule rewrote at least one window of a word.
     *
     * @param rule    the rule applied
     * @param windows number of windows rewritten
     * @param before  word passed to the rule
     * @param after   word produced by the rule
     */
    default void onRuleApplied(SoundChangeRule rule, int windows, List<String> before, List<String> after) {
    }

    /**
     * Called when a feature rewrite resolved to no registered letter and the
     * original symbol was kept.
     */
    default void onUnresolvableTarget(UnresolvableTarget target) {
    }
}
