/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.compiler;

import com.glossa.soundchange.api.exceptions.MalformedRuleException;
import com.glossa.soundchange.api.model.FeatureTaxonomy;
import com.glossa.soundchange.api.model.MatchSpec;
import com.glossa.soundchange.api.model.SoundClass;
import com.glossa.soundchange.runtime.model.Inventory;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Resolves textual pattern slots into {@link MatchSpec}s against an inventory.
 *
 * <p>Resolution order for one slot:
 * <ol>
 * <li>{@code ""} is a deletion; {@code _}, {@code #}, {@code C} and {@code V} are the structural slots</li>
 * <li>a registered letter is a literal</li>
 * <li>a comma separated list, or a single taxonomy feature, is a feature specifier;
 * every listed feature must exist ({@code "voiced, fricative"} is accepted)</li>
 * <li>anything else is a literal symbol, with a warning</li>
 * </ol>
 *
 * <p>Environments may be written as space separated slots ({@code "V _ V"}) or, when
 * they only use {@code C V _ #}, compactly ({@code "#_V"}).
 */
public final class MatchSpecParser {
    private static final Logger logger = Logger.getLogger(MatchSpecParser.class.getName());

    private static final String COMPACT_SLOTS = "CV_#";

    private final Inventory inventory;
    private final FeatureTaxonomy taxonomy;

    public MatchSpecParser(Inventory inventory) {
        this.inventory = inventory;
        this.taxonomy = inventory.taxonomy();
    }

    public MatchSpec parse(String slot) {
        if (slot == null) {
            throw new MalformedRuleException("Pattern slot cannot be null");
        }
        String text = slot.trim();
        if (text.isEmpty()) {
            return MatchSpec.deletion();
        }
        if (text.equals(MatchSpec.FOCUS_SYMBOL)) {
            return MatchSpec.focus();
        }
        if (text.equals(MatchSpec.BOUNDARY_SYMBOL)) {
            return MatchSpec.boundary();
        }
        SoundClass soundClass = SoundClass.fromAbbreviation(text);
        if (soundClass != null) {
            return new MatchSpec.NaturalClass(soundClass);
        }
        if (inventory.isLetter(text)) {
            return MatchSpec.literal(text);
        }
        if (text.indexOf(',') >= 0) {
            return parseFeatures(text);
        }
        if (taxonomy.isFeature(text)) {
            return MatchSpec.features(text);
        }
        logger.warning("'" + text + "' is neither a registered letter nor a feature, matching it as a literal symbol");
        return MatchSpec.literal(text);
    }

    public List<MatchSpec> parseAll(List<String> slots) {
        if (slots == null) {
            throw new MalformedRuleException("Pattern cannot be null");
        }
        List<MatchSpec> specs = new ArrayList<>(slots.size());
        for (String slot : slots) {
            specs.add(parse(slot));
        }
        return specs;
    }

    /**
     * Parses an environment string. A blank environment means "anywhere" ({@code _}).
     */
    public List<MatchSpec> parseEnvironment(String environment) {
        if (environment == null || environment.isBlank()) {
            return List.of(MatchSpec.focus());
        }
        String normalized = environment.trim().replaceAll("\\s*,\\s*", ",");
        String[] tokens = normalized.split("\\s+");

        List<MatchSpec> specs = new ArrayList<>();
        if (tokens.length == 1 && isCompact(tokens[0])) {
            for (char c : tokens[0].toCharArray()) {
                specs.add(parse(String.valueOf(c)));
            }
            return specs;
        }
        for (String token : tokens) {
            specs.add(parse(token));
        }
        return specs;
    }

    private MatchSpec parseFeatures(String text) {
        List<String> features = new ArrayList<>();
        for (String part : text.split(",")) {
            String feature = part.trim();
            if (!taxonomy.isFeature(feature)) {
                throw new MalformedRuleException("Unknown feature '" + feature + "' in '" + text + "'");
            }
            features.add(feature);
        }
        return new MatchSpec.Features(features);
    }

    private static boolean isCompact(String token) {
        if (token.length() < 2) {
            return false;
        }
        for (char c : token.toCharArray()) {
            if (COMPACT_SLOTS.indexOf(c) < 0) {
                return false;
            }
        }
        return true;
    }
}
