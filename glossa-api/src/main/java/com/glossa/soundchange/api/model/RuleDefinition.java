/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON representation of a sound change rule for deserialization.
 * Slots are still text here; the compiler resolves them into {@link MatchSpec}s.
 *
 * <pre>
 * { "id": "lenition", "source": ["voiced,plosive"], "target": ["voiced,fricative"], "environment": "V _ V" }
 * </pre>
 */
public record RuleDefinition(
        @JsonProperty("id") String id,
        @JsonProperty("source") List<String> source,
        @JsonProperty("target") List<String> target,
        @JsonProperty("environment") String environment
) {

    // Default values for optional fields

    public String environment() {
        return environment != null ? environment : MatchSpec.FOCUS_SYMBOL;
    }
}
