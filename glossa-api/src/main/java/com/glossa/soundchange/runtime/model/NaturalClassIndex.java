/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.runtime.model;

import com.glossa.soundchange.api.model.FeatureBundle;
import com.glossa.soundchange.api.model.SoundClass;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The aggregate sets of all consonants and all vowels, derived from an inventory's
 * letters. Backs the C and V slots of rule patterns and syllable templates.
 */
public final class NaturalClassIndex {

    private final Map<SoundClass, Set<String>> members = new EnumMap<>(SoundClass.class);

    private NaturalClassIndex(Map<String, FeatureBundle> bundlesBySymbol) {
        for (SoundClass soundClass : SoundClass.values()) {
            members.put(soundClass, new LinkedHashSet<>());
        }
        bundlesBySymbol.forEach((symbol, bundle) -> members.get(bundle.soundClass()).add(symbol));
        members.replaceAll((soundClass, symbols) -> Collections.unmodifiableSet(symbols));
    }

    /**
     * Builds the index from registered letters, preserving registration order.
     */
    static NaturalClassIndex from(Map<String, FeatureBundle> bundlesBySymbol) {
        return new NaturalClassIndex(bundlesBySymbol);
    }

    public boolean contains(SoundClass soundClass, String symbol) {
        return members.get(soundClass).contains(symbol);
    }

    public Set<String> members(SoundClass soundClass) {
        return members.get(soundClass);
    }

    public Optional<SoundClass> classOf(String symbol) {
        for (Map.Entry<SoundClass, Set<String>> entry : members.entrySet()) {
            if (entry.getValue().contains(symbol)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }
}
