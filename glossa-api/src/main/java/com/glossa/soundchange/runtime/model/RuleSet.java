/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.runtime.model;

import com.glossa.soundchange.api.exceptions.MalformedRuleException;
import com.glossa.soundchange.api.model.MatchSpec;
import com.glossa.soundchange.api.model.SoundChangeRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * An ordered list of sound change rules. Order is significant: rules apply one after
 * another and are never reordered implicitly.
 *
 * <p>Every rule is validated when it is added, so a malformed rule is rejected before
 * any word is processed.
 *
 * <p><b>Concurrency:</b> the ordered list is held in an atomic reference and replaced
 * as a whole on every change. {@link #rules()} therefore always returns a consistent
 * snapshot, and a derivation that took one keeps using it even if the set is edited
 * meanwhile.
 */
public final class RuleSet {
    private static final Logger logger = Logger.getLogger(RuleSet.class.getName());

    private final AtomicReference<List<SoundChangeRule>> rules = new AtomicReference<>(List.of());
    private final AtomicInteger ruleCount = new AtomicInteger();

    /**
     * Adds a rule at the end of the order under a generated id ({@code rule-1}, {@code rule-2}, ...).
     *
     * @return the id of the new rule
     * @throws MalformedRuleException if the rule is structurally invalid
     */
    public synchronized String addRule(List<MatchSpec> source, List<MatchSpec> target, List<MatchSpec> environment) {
        String id = nextId();
        add(new SoundChangeRule(id, source, target, environment));
        return id;
    }

    /**
     * Adds a rule that applies in any context.
     */
    public String addRule(List<MatchSpec> source, List<MatchSpec> target) {
        return addRule(source, target, List.of(MatchSpec.focus()));
    }

    /**
     * Adds a prebuilt rule at the end of the order.
     *
     * @throws MalformedRuleException if a rule with the same id already exists
     */
    public synchronized void add(SoundChangeRule rule) {
        if (has(rule.id())) {
            throw new MalformedRuleException("Duplicate rule id: " + rule.id());
        }
        List<SoundChangeRule> updated = new ArrayList<>(rules.get());
        updated.add(rule);
        rules.set(List.copyOf(updated));
        logger.fine("Added " + rule);
    }

    public Optional<SoundChangeRule> get(String id) {
        return rules.get().stream().filter(r -> r.id().equals(id)).findFirst();
    }

    public boolean has(String id) {
        return indexOf(rules.get(), id) >= 0;
    }

    /**
     * Removes a rule.
     *
     * @return the removed rule, or empty if the id is unknown
     */
    public synchronized Optional<SoundChangeRule> remove(String id) {
        List<SoundChangeRule> updated = new ArrayList<>(rules.get());
        int index = indexOf(updated, id);
        if (index < 0) {
            return Optional.empty();
        }
        SoundChangeRule removed = updated.remove(index);
        rules.set(List.copyOf(updated));
        return Optional.of(removed);
    }

    /**
     * Moves a rule so that it applies directly before another one.
     *
     * @return false if either id is unknown
     */
    public synchronized boolean moveBefore(String id, String beforeId) {
        List<SoundChangeRule> updated = new ArrayList<>(rules.get());
        int from = indexOf(updated, id);
        if (from < 0 || indexOf(updated, beforeId) < 0) {
            return false;
        }
        if (id.equals(beforeId)) {
            return true;
        }
        SoundChangeRule moved = updated.remove(from);
        updated.add(indexOf(updated, beforeId), moved);
        rules.set(List.copyOf(updated));
        return true;
    }

    /**
     * Moves a rule to an absolute position in the order, clamped to the valid range.
     *
     * @return false if the id is unknown
     */
    public synchronized boolean moveTo(String id, int position) {
        List<SoundChangeRule> updated = new ArrayList<>(rules.get());
        int from = indexOf(updated, id);
        if (from < 0) {
            return false;
        }
        SoundChangeRule moved = updated.remove(from);
        updated.add(Math.max(0, Math.min(position, updated.size())), moved);
        rules.set(List.copyOf(updated));
        return true;
    }

    /**
     * Exchanges the positions of two rules.
     *
     * @return false if either id is unknown
     */
    public synchronized boolean swap(String first, String second) {
        List<SoundChangeRule> updated = new ArrayList<>(rules.get());
        int a = indexOf(updated, first);
        int b = indexOf(updated, second);
        if (a < 0 || b < 0) {
            return false;
        }
        Collections.swap(updated, a, b);
        rules.set(List.copyOf(updated));
        return true;
    }

    /**
     * Returns the rules in application order.
     */
    public List<SoundChangeRule> rules() {
        return rules.get();
    }

    /**
     * Returns the rules from last to first.
     */
    public List<SoundChangeRule> reversed() {
        List<SoundChangeRule> reversed = new ArrayList<>(rules.get());
        Collections.reverse(reversed);
        return Collections.unmodifiableList(reversed);
    }

    public int size() {
        return rules.get().size();
    }

    public boolean isEmpty() {
        return rules.get().isEmpty();
    }

    private String nextId() {
        String id;
        do {
            id = "rule-" + ruleCount.incrementAndGet();
        } while (has(id));
        return id;
    }

    private static int indexOf(List<SoundChangeRule> list, String id) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }
}
