/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.api.model;

import com.glossa.soundchange.api.exceptions.MalformedRuleException;

import java.util.List;
import java.util.logging.Logger;

/**
 * An immutable, validated sound change: rewrite {@code source} as {@code target}
 * wherever the surrounding symbols fit {@code environment}.
 *
 * <p>Invariants checked on construction:
 * <ul>
 * <li>source and target have the same length, slot for slot</li>
 * <li>the environment holds exactly one focus ({@code _})</li>
 * <li>focus never appears in source or target; deletion never in source or environment</li>
 * <li>a rewritable target slot is a literal, a boundary, a feature list or a deletion</li>
 * </ul>
 *
 * <p>Anchor slots (C, V, #) of the source are never rewritten; whatever the
 * target holds at such a slot is ignored with a warning.
 *
 * @param id          identifier unique within a rule set
 * @param source      pattern to find
 * @param target      replacement, aligned with source
 * @param environment context around the focus
 */
public record SoundChangeRule(
        String id,
        List<MatchSpec> source,
        List<MatchSpec> target,
        List<MatchSpec> environment) {
    private static final Logger logger = Logger.getLogger(SoundChangeRule.class.getName());

    public SoundChangeRule {
        if (id == null || id.isBlank()) {
            throw new MalformedRuleException("Rule id cannot be empty");
        }
        if (source == null || target == null || environment == null) {
            throw new MalformedRuleException("Rule '" + id + "' needs a source, a target and an environment");
        }
        source = List.copyOf(source);
        target = List.copyOf(target);
        environment = List.copyOf(environment);
        validate(id, source, target, environment);
    }

    /**
     * Creates a rule that applies in any context.
     */
    public static SoundChangeRule unconditional(String id, List<MatchSpec> source, List<MatchSpec> target) {
        return new SoundChangeRule(id, source, target, List.of(MatchSpec.focus()));
    }

    public int focusIndex() {
        return environment.indexOf(MatchSpec.focus());
    }

    /**
     * Environment slots left of the focus, nearest last.
     */
    public List<MatchSpec> environmentBefore() {
        return environment.subList(0, focusIndex());
    }

    /**
     * Environment slots right of the focus, nearest first.
     */
    public List<MatchSpec> environmentAfter() {
        return environment.subList(focusIndex() + 1, environment.size());
    }

    private static void validate(String id, List<MatchSpec> source, List<MatchSpec> target,
                                 List<MatchSpec> environment) {
        if (source.size() != target.size()) {
            throw new MalformedRuleException("Rule '" + id + "' source has " + source.size()
                    + " slots but target has " + target.size());
        }

        long focusCount = environment.stream().filter(MatchSpec.Focus.class::isInstance).count();
        if (focusCount != 1) {
            throw new MalformedRuleException("Rule '" + id + "' environment must contain exactly one '_', found "
                    + focusCount);
        }
        for (MatchSpec spec : environment) {
            if (spec instanceof MatchSpec.Deletion) {
                throw new MalformedRuleException("Rule '" + id + "' environment cannot contain a deletion");
            }
        }

        for (int i = 0; i < source.size(); i++) {
            MatchSpec from = source.get(i);
            MatchSpec to = target.get(i);
            if (from instanceof MatchSpec.Focus || to instanceof MatchSpec.Focus) {
                throw new MalformedRuleException("Rule '" + id + "' slot " + i + ": '_' is only allowed in the environment");
            }
            if (from instanceof MatchSpec.Deletion) {
                throw new MalformedRuleException("Rule '" + id + "' slot " + i + ": source cannot be empty");
            }
            if (from.isAnchor()) {
                if (!from.equals(to)) {
                    logger.warning("Rule '" + id + "' slot " + i + ": anchor " + from.notation()
                            + " is kept, target " + to.notation() + " ignored");
                }
            } else if (to instanceof MatchSpec.NaturalClass) {
                throw new MalformedRuleException("Rule '" + id + "' slot " + i + ": target cannot be a natural class");
            }
        }
    }

    @Override
    public String toString() {
        return String.format("Rule[id=%s, source=%s, target=%s, environment=%s]",
                id, notationOf(source), notationOf(target), notationOf(environment));
    }

    private static String notationOf(List<MatchSpec> specs) {
        StringBuilder sb = new StringBuilder();
        for (MatchSpec spec : specs) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(spec.notation());
        }
        return sb.toString();
    }
}
