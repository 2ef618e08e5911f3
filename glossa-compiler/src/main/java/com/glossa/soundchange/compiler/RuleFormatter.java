/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.compiler;

import com.glossa.soundchange.api.model.MatchSpec;
import com.glossa.soundchange.api.model.SoundChangeRule;
import com.glossa.soundchange.api.model.SoundClass;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders rules for people: linguistic notation or a plain sentence.
 *
 * <pre>
 * RuleFormatter.notation(rule);  // t -> d / #_V
 * RuleFormatter.describe(rule);  // Change t to d when it is after a word boundary and before a vowel.
 * </pre>
 */
public final class RuleFormatter {

    private RuleFormatter() {
    }

    public static String notation(SoundChangeRule rule) {
        return slots(rule.source(), " ") + " -> " + slots(rule.target(), " ")
                + " / " + slots(rule.environment(), "");
    }

    public static String describe(SoundChangeRule rule) {
        StringBuilder text = new StringBuilder("Change ")
                .append(phrase(rule.source()))
                .append(" to ")
                .append(phrase(rule.target()));

        List<MatchSpec> before = rule.environmentBefore();
        List<MatchSpec> after = rule.environmentAfter();
        if (before.isEmpty() && after.isEmpty()) {
            text.append(" in any context");
        } else {
            text.append(" when it is");
            if (!before.isEmpty()) {
                text.append(" after ").append(phrase(before));
            }
            if (!before.isEmpty() && !after.isEmpty()) {
                text.append(" and");
            }
            if (!after.isEmpty()) {
                text.append(" before ").append(phrase(after));
            }
        }
        return text.append('.').toString();
    }

    private static String slots(List<MatchSpec> specs, String separator) {
        if (specs.isEmpty()) {
            return "∅";
        }
        return specs.stream().map(MatchSpec::notation).collect(Collectors.joining(separator));
    }

    private static String phrase(List<MatchSpec> specs) {
        if (specs.isEmpty()) {
            return "nothing";
        }
        return specs.stream().map(RuleFormatter::slotPhrase).collect(Collectors.joining(" followed by "));
    }

    private static String slotPhrase(MatchSpec spec) {
        if (spec instanceof MatchSpec.Literal literal) {
            return literal.symbol();
        }
        if (spec instanceof MatchSpec.NaturalClass naturalClass) {
            return naturalClass.soundClass() == SoundClass.CONSONANT ? "a consonant" : "a vowel";
        }
        if (spec instanceof MatchSpec.Features features) {
            String words = String.join(" ", features.features());
            return ("aeiou".indexOf(words.charAt(0)) >= 0 ? "an " : "a ") + words + " sound";
        }
        if (spec instanceof MatchSpec.Boundary) {
            return "a word boundary";
        }
        if (spec instanceof MatchSpec.Deletion) {
            return "nothing";
        }
        return spec.notation();
    }
}
