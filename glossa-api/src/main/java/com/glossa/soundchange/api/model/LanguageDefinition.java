/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * JSON representation of a whole language: sounds, syllable shapes, affixes and
 * ordered sound changes. A simple Data Transfer Object used only for loading.
 */
public record LanguageDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("consonants") List<SoundDefinition> consonants,
        @JsonProperty("vowels") List<SoundDefinition> vowels,
        @JsonProperty("syllables") List<List<String>> syllables,
        @JsonProperty("affixes") Map<String, List<String>> affixes,
        @JsonProperty("rules") List<RuleDefinition> rules
) {
    /**
     * DTO for one letter and its three features.
     */
    public record SoundDefinition(
            @JsonProperty("symbol") String symbol,
            @JsonProperty("features") List<String> features
    ) {}

    // Default values for optional fields

    public List<SoundDefinition> consonants() {
        return consonants != null ? consonants : List.of();
    }

    public List<SoundDefinition> vowels() {
        return vowels != null ? vowels : List.of();
    }

    public List<List<String>> syllables() {
        return syllables != null ? syllables : List.of();
    }

    public Map<String, List<String>> affixes() {
        return affixes != null ? affixes : Map.of();
    }

    public List<RuleDefinition> rules() {
        return rules != null ? rules : List.of();
    }
}
