/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.runtime.model;

import com.glossa.soundchange.api.exceptions.CompilationException;
import com.glossa.soundchange.api.exceptions.DuplicateBundleException;
import com.glossa.soundchange.api.model.FeatureBundle;
import com.glossa.soundchange.api.model.FeatureTaxonomy;
import com.glossa.soundchange.api.model.MatchSpec;
import com.glossa.soundchange.api.model.SoundClass;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * The sound inventory of a language: a bijection between letters and feature bundles.
 *
 * <p>An inventory is assembled once through {@link Builder} and is immutable afterwards,
 * so it can be read concurrently by any number of word derivations. Registration
 * validates each bundle against the {@link FeatureTaxonomy} and refuses to bind a
 * bundle to a second symbol.
 *
 * <h2>Usage</h2>
 * <pre>
 * Inventory inventory = Inventory.builder(FeatureTaxonomy.standard())
 *     .registerConsonant("b", "voiced", "bilabial", "plosive")
 *     .registerVowel("a", "unrounded", "open", "central")
 *     .build();
 *
 * inventory.featuresOf("b");          // voiced,bilabial,plosive
 * inventory.isVowel("a");             // true
 * </pre>
 */
public final class Inventory {
    private static final Logger logger = Logger.getLogger(Inventory.class.getName());

    private static final Set<String> RESERVED = Set.of(
            MatchSpec.BOUNDARY_SYMBOL, MatchSpec.FOCUS_SYMBOL,
            SoundClass.CONSONANT.abbreviation(), SoundClass.VOWEL.abbreviation());

    private final FeatureTaxonomy taxonomy;
    private final Map<String, FeatureBundle> bundlesBySymbol;
    private final Map<FeatureBundle, String> symbolsByBundle;
    private final Map<String, Set<String>> symbolsByFeature;
    private final NaturalClassIndex naturalClasses;

    private Inventory(Builder builder) {
        this.taxonomy = builder.taxonomy;
        this.bundlesBySymbol = Collections.unmodifiableMap(new LinkedHashMap<>(builder.bundlesBySymbol));
        this.symbolsByBundle = Map.copyOf(builder.symbolsByBundle);

        Map<String, Set<String>> byFeature = new HashMap<>();
        bundlesBySymbol.forEach((symbol, bundle) -> {
            for (String feature : bundle.features()) {
                byFeature.computeIfAbsent(feature, f -> new LinkedHashSet<>()).add(symbol);
            }
        });
        byFeature.replaceAll((feature, symbols) -> Collections.unmodifiableSet(symbols));
        this.symbolsByFeature = Collections.unmodifiableMap(byFeature);
        this.naturalClasses = NaturalClassIndex.from(bundlesBySymbol);
    }

    public static Builder builder(FeatureTaxonomy taxonomy) {
        return new Builder(taxonomy);
    }

    public static Builder builder() {
        return new Builder(FeatureTaxonomy.standard());
    }

    public FeatureTaxonomy taxonomy() {
        return taxonomy;
    }

    public NaturalClassIndex naturalClasses() {
        return naturalClasses;
    }

    /**
     * Looks up the bundle of a letter. Markers such as {@code #} have none.
     */
    public Optional<FeatureBundle> featuresOf(String symbol) {
        return Optional.ofNullable(bundlesBySymbol.get(symbol));
    }

    /**
     * Exact bundle lookup.
     *
     * @param bundle   the complete bundle
     * @param fallback returned when no letter has exactly this bundle
     * @return the letter, or {@code fallback}
     */
    public String symbolOf(FeatureBundle bundle, String fallback) {
        return symbolsByBundle.getOrDefault(bundle, fallback);
    }

    public Optional<String> symbolOf(FeatureBundle bundle) {
        return Optional.ofNullable(symbolsByBundle.get(bundle));
    }

    public boolean isConsonant(String symbol) {
        return naturalClasses.contains(SoundClass.CONSONANT, symbol);
    }

    public boolean isVowel(String symbol) {
        return naturalClasses.contains(SoundClass.VOWEL, symbol);
    }

    public boolean isLetter(String symbol) {
        return bundlesBySymbol.containsKey(symbol);
    }

    public Set<String> consonants() {
        return naturalClasses.members(SoundClass.CONSONANT);
    }

    public Set<String> vowels() {
        return naturalClasses.members(SoundClass.VOWEL);
    }

    /**
     * All letters carrying the feature, in registration order.
     */
    public Set<String> symbolsWith(String feature) {
        return symbolsByFeature.getOrDefault(feature, Set.of());
    }

    /**
     * All letters carrying every one of the features, in registration order.
     */
    public Set<String> symbolsWithAll(Collection<String> features) {
        Set<String> result = new LinkedHashSet<>();
        bundlesBySymbol.forEach((symbol, bundle) -> {
            if (bundle.containsAll(features)) {
                result.add(symbol);
            }
        });
        return result;
    }

    public int size() {
        return bundlesBySymbol.size();
    }

    public static final class Builder {
        private final FeatureTaxonomy taxonomy;
        private final Map<String, FeatureBundle> bundlesBySymbol = new LinkedHashMap<>();
        private final Map<FeatureBundle, String> symbolsByBundle = new HashMap<>();

        private Builder(FeatureTaxonomy taxonomy) {
            this.taxonomy = taxonomy;
        }

        public Builder registerConsonant(String symbol, String... features) {
            return register(symbol, SoundClass.CONSONANT, List.of(features));
        }

        public Builder registerVowel(String symbol, String... features) {
            return register(symbol, SoundClass.VOWEL, List.of(features));
        }

        /**
         * Registers a letter.
         *
         * @throws com.glossa.soundchange.api.exceptions.InvalidFeatureMatrixException
         *         if the features do not span the categories of the class
         * @throws DuplicateBundleException if the bundle or the symbol is already taken
         */
        public Builder register(String symbol, SoundClass soundClass, List<String> features) {
            if (symbol == null || symbol.isBlank()) {
                throw new CompilationException("Letter symbol cannot be empty");
            }
            if (RESERVED.contains(symbol)) {
                throw new CompilationException("Symbol '" + symbol + "' is reserved for rule patterns");
            }

            FeatureBundle bundle = taxonomy.bundleOf(soundClass, features);

            String owner = symbolsByBundle.get(bundle);
            if (owner != null) {
                throw new DuplicateBundleException("Features " + bundle + " already belong to '" + owner
                        + "', cannot register '" + symbol + "'");
            }
            FeatureBundle existing = bundlesBySymbol.get(symbol);
            if (existing != null) {
                throw new DuplicateBundleException("Symbol '" + symbol + "' is already registered as " + existing);
            }

            bundlesBySymbol.put(symbol, bundle);
            symbolsByBundle.put(bundle, symbol);
            return this;
        }

        public Inventory build() {
            Inventory inventory = new Inventory(this);
            logger.info("Inventory built: " + inventory.consonants().size() + " consonants, "
                    + inventory.vowels().size() + " vowels");
            return inventory;
        }
    }
}
