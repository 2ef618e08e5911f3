/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.api.model;

import java.util.List;
import java.util.Objects;

/**
 * A named group of mutually exclusive features, e.g. voicing = {voiced, voiceless}.
 *
 * @param name     category name
 * @param features the features of this category, in declaration order
 */
public record FeatureCategory(String name, List<String> features) {

    public FeatureCategory {
        Objects.requireNonNull(name, "Category name cannot be null");
        features = List.copyOf(features);
        if (features.isEmpty()) {
            throw new IllegalArgumentException("Category '" + name + "' has no features");
        }
    }

    public static FeatureCategory of(String name, String... features) {
        return new FeatureCategory(name, List.of(features));
    }

    public boolean contains(String feature) {
        return features.contains(feature);
    }
}
