/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.api.model;

import com.glossa.soundchange.api.exceptions.CompilationException;
import com.glossa.soundchange.api.exceptions.InvalidFeatureMatrixException;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable catalogue of feature categories per sound class.
 *
 * <p>Every feature belongs to exactly one category, and every category to exactly
 * one sound class. A well-formed bundle for a class takes one feature from each of
 * that class's categories; {@link #bundleOf(SoundClass, Collection)} validates this
 * and returns the bundle in category order, so the order in which callers list
 * features does not matter.
 *
 * <h2>Usage</h2>
 * <pre>
 * FeatureTaxonomy taxonomy = FeatureTaxonomy.standard();
 * FeatureBundle b = taxonomy.bundleOf(SoundClass.CONSONANT, List.of("plosive", "voiced", "bilabial"));
 * // b = voiced,bilabial,plosive
 * </pre>
 */
public final class FeatureTaxonomy {

    private static final FeatureTaxonomy STANDARD = builder()
            .consonantCategories(
                    FeatureCategory.of("voicing", "voiced", "voiceless"),
                    FeatureCategory.of("place", "bilabial", "labiodental", "dental", "alveolar",
                            "palatal", "velar", "uvular", "pharyngeal", "glottal"),
                    FeatureCategory.of("manner", "nasal", "plosive", "affricate", "fricative",
                            "approximant", "lateral"))
            .vowelCategories(
                    FeatureCategory.of("rounding", "rounded", "unrounded"),
                    FeatureCategory.of("height", "close", "mid", "open"),
                    FeatureCategory.of("backness", "front", "central", "back"))
            .build();

    private final Map<SoundClass, List<FeatureCategory>> categories;
    private final Object2IntMap<String> categoryIndex;
    private final Map<String, SoundClass> featureClass;

    private FeatureTaxonomy(Builder builder) {
        this.categories = new EnumMap<>(SoundClass.class);
        this.categoryIndex = new Object2IntOpenHashMap<>();
        this.categoryIndex.defaultReturnValue(-1);
        this.featureClass = new HashMap<>();

        for (SoundClass soundClass : SoundClass.values()) {
            List<FeatureCategory> declared = builder.categories.get(soundClass);
            if (declared == null || declared.isEmpty()) {
                throw new CompilationException("Taxonomy has no categories for " + soundClass);
            }
            for (int i = 0; i < declared.size(); i++) {
                for (String feature : declared.get(i).features()) {
                    if (featureClass.containsKey(feature)) {
                        throw new CompilationException("Feature '" + feature + "' belongs to more than one category");
                    }
                    featureClass.put(feature, soundClass);
                    categoryIndex.put(feature, i);
                }
            }
            categories.put(soundClass, List.copyOf(declared));
        }
    }

    /**
     * Returns the taxonomy of the classic inventory: voicing, place and manner for
     * consonants; rounding, height and backness for vowels.
     */
    public static FeatureTaxonomy standard() {
        return STANDARD;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<FeatureCategory> categoriesOf(SoundClass soundClass) {
        return categories.get(soundClass);
    }

    public boolean isFeature(String feature) {
        return featureClass.containsKey(feature);
    }

    public Optional<SoundClass> soundClassOf(String feature) {
        return Optional.ofNullable(featureClass.get(feature));
    }

    /**
     * Position of the feature's category within its sound class, or -1 if unknown.
     */
    public int categoryIndexOf(String feature) {
        return categoryIndex.getInt(feature);
    }

    /**
     * Validates the features against the categories of the class and returns them
     * as a bundle in category order.
     *
     * @throws InvalidFeatureMatrixException if a feature is unknown, belongs to the
     *                                       other class, or a category is missing or repeated
     */
    public FeatureBundle bundleOf(SoundClass soundClass, Collection<String> features) {
        List<FeatureCategory> required = categories.get(soundClass);
        if (features == null || features.size() != required.size()) {
            throw new InvalidFeatureMatrixException("A " + soundClass.name().toLowerCase()
                    + " needs exactly " + required.size() + " features, got " + features);
        }
        String[] ordered = new String[required.size()];
        for (String feature : features) {
            SoundClass owner = featureClass.get(feature);
            if (owner == null) {
                throw new InvalidFeatureMatrixException("Unknown feature: " + feature);
            }
            if (owner != soundClass) {
                throw new InvalidFeatureMatrixException("Feature '" + feature + "' is not a "
                        + soundClass.name().toLowerCase() + " feature");
            }
            int index = categoryIndex.getInt(feature);
            if (ordered[index] != null) {
                throw new InvalidFeatureMatrixException("Features '" + ordered[index] + "' and '" + feature
                        + "' both belong to category " + required.get(index).name());
            }
            ordered[index] = feature;
        }
        return new FeatureBundle(soundClass, List.of(ordered));
    }

    public static final class Builder {
        private final Map<SoundClass, List<FeatureCategory>> categories = new EnumMap<>(SoundClass.class);

        private Builder() {
        }

        public Builder consonantCategories(FeatureCategory... consonantCategories) {
            categories.put(SoundClass.CONSONANT, new ArrayList<>(List.of(consonantCategories)));
            return this;
        }

        public Builder vowelCategories(FeatureCategory... vowelCategories) {
            categories.put(SoundClass.VOWEL, new ArrayList<>(List.of(vowelCategories)));
            return this;
        }

        public FeatureTaxonomy build() {
            return new FeatureTaxonomy(this);
        }
    }
}
