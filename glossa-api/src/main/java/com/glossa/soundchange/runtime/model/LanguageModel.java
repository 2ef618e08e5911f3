/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.runtime.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A compiled language: everything the word pipeline needs, already validated.
 *
 * @param name               native name of the language
 * @param inventory          letters and their features
 * @param ruleSet            ordered sound changes
 * @param syllableStructures syllable shapes as slot lists, e.g. [C, V, C]
 * @param affixes            property to affix, "-" marking the attachment side
 */
public record LanguageModel(
        String name,
        Inventory inventory,
        RuleSet ruleSet,
        List<List<String>> syllableStructures,
        Map<String, List<String>> affixes) {

    public LanguageModel {
        Objects.requireNonNull(inventory, "Inventory cannot be null");
        Objects.requireNonNull(ruleSet, "Rule set cannot be null");
        syllableStructures = syllableStructures.stream().map(List::copyOf).toList();
        affixes = affixes.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> List.copyOf(e.getValue())));
    }
}
