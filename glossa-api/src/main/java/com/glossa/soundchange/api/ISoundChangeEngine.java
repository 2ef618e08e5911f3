/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.api;

import com.glossa.soundchange.api.model.DerivationResult;
import com.glossa.soundchange.api.model.SoundChangeRule;
import io.opentelemetry.api.trace.Tracer;

import java.util.List;

/**
 * Contract for turning underlying words into surface words with an ordered rule set.
 *
 * <p>Application is total: an unmatched rule or an unresolvable feature rewrite is a
 * no-op on that word, never an exception. Implementations are stateless per call and
 * may be shared between threads.
 */
public interface ISoundChangeEngine {

    /**
     * Applies every rule of the rule set in order, each rule seeing the complete
     * output of the previous one.
     *
     * @param word symbol sequence, normally bounded by {@code #}
     * @return the surface word
     */
    List<String> apply(List<String> word);

    /**
     * Applies a single rule in one left-to-right pass.
     */
    List<String> applyRule(List<String> word, SoundChangeRule rule);

    /**
     * Applies every rule and records which ones changed the word.
     */
    DerivationResult applyWithTrace(List<String> word);

    /**
     * Sets the listener notified of rule applications and unresolvable rewrites.
     *
     * @param listener the listener (null to disable)
     */
    default void setRuleApplicationListener(RuleApplicationListener listener) {
    }

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }
}
