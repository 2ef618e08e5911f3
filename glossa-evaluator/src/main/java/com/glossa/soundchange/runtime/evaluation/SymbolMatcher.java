/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.runtime.evaluation;

import com.glossa.soundchange.api.model.MatchSpec;
import com.glossa.soundchange.runtime.model.Inventory;
import com.glossa.soundchange.runtime.model.NaturalClassIndex;

import java.util.List;

/**
 * Tests a single word symbol against a single {@link MatchSpec}.
 */
final class SymbolMatcher {

    private final Inventory inventory;
    private final NaturalClassIndex naturalClasses;

    SymbolMatcher(Inventory inventory) {
        this.inventory = inventory;
        this.naturalClasses = inventory.naturalClasses();
    }

    boolean matches(MatchSpec spec, String symbol) {
        if (spec instanceof MatchSpec.Literal literal) {
            return literal.symbol().equals(symbol);
        }
        if (spec instanceof MatchSpec.NaturalClass naturalClass) {
            return naturalClasses.contains(naturalClass.soundClass(), symbol);
        }
        if (spec instanceof MatchSpec.Features features) {
            // markers like # have no bundle and never satisfy a feature specifier
            return inventory.featuresOf(symbol)
                    .map(bundle -> bundle.containsAll(features.features()))
                    .orElse(false);
        }
        if (spec instanceof MatchSpec.Boundary) {
            return MatchSpec.BOUNDARY_SYMBOL.equals(symbol);
        }
        return false;
    }

    /**
     * Like {@link #matches} but for a word position. Positions outside the word
     * behave as a word boundary.
     */
    boolean matchesAt(MatchSpec spec, List<String> word, int index) {
        if (index < 0 || index >= word.size()) {
            return spec instanceof MatchSpec.Boundary;
        }
        return matches(spec, word.get(index));
    }
}
