/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.api.model;

import java.util.List;

/**
 * Report of a feature rewrite that produced no registered letter. The engine keeps
 * the original symbol and publishes this record instead of failing.
 *
 * @param ruleId            the rule being applied
 * @param index             position of the symbol in the word the rule was applied to
 * @param symbol            the symbol that was kept
 * @param requestedFeatures the target features of the rule slot
 */
public record UnresolvableTarget(
        String ruleId,
        int index,
        String symbol,
        List<String> requestedFeatures) {

    public UnresolvableTarget {
        requestedFeatures = List.copyOf(requestedFeatures);
    }

    public String describe() {
        return String.format("Rule '%s' could not rewrite '%s' at %d with features %s: no such letter, kept as is",
                ruleId, symbol, index, requestedFeatures);
    }
}
