/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.api.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * A full set of features identifying one sound, stored in category order.
 * Used as the composite key of the inventory's bundle-to-symbol map.
 *
 * @param soundClass the class whose categories the features span
 * @param features   one feature per category, in category order
 */
public record FeatureBundle(SoundClass soundClass, List<String> features) {

    public FeatureBundle {
        Objects.requireNonNull(soundClass, "Sound class cannot be null");
        features = List.copyOf(features);
    }

    public boolean contains(String feature) {
        return features.contains(feature);
    }

    public boolean containsAll(Collection<String> required) {
        return features.containsAll(required);
    }

    public String feature(int categoryIndex) {
        return features.get(categoryIndex);
    }

    /**
     * Returns a copy of this bundle with the feature of one category replaced.
     */
    public FeatureBundle with(int categoryIndex, String feature) {
        List<String> changed = new ArrayList<>(features);
        changed.set(categoryIndex, feature);
        return new FeatureBundle(soundClass, changed);
    }

    @Override
    public String toString() {
        return String.join(",", features);
    }
}
