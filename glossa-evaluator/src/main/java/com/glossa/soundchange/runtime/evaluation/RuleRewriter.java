/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.runtime.evaluation;

import com.glossa.soundchange.api.model.FeatureBundle;
import com.glossa.soundchange.api.model.FeatureTaxonomy;
import com.glossa.soundchange.api.model.MatchSpec;
import com.glossa.soundchange.api.model.SoundChangeRule;
import com.glossa.soundchange.api.model.SoundClass;
import com.glossa.soundchange.api.model.UnresolvableTarget;
import com.glossa.soundchange.runtime.model.Inventory;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Builds the output word of one rule pass from the accepted windows.
 *
 * <p>Per source slot: anchors ({@code C}, {@code V}, {@code #}) are copied,
 * a deletion drops the symbol, a literal or boundary target replaces it, and a
 * feature target overwrites the named categories of the symbol's bundle. A
 * feature rewrite that lands on no registered letter keeps the original symbol
 * and is reported as an {@link UnresolvableTarget}.
 */
final class RuleRewriter {
    private static final Logger logger = Logger.getLogger(RuleRewriter.class.getName());

    private final Inventory inventory;
    private final FeatureTaxonomy taxonomy;

    RuleRewriter(Inventory inventory) {
        this.inventory = inventory;
        this.taxonomy = inventory.taxonomy();
    }

    List<String> rewrite(List<String> word, SoundChangeRule rule, IntList windows,
                         Consumer<UnresolvableTarget> unresolved) {
        if (windows.isEmpty()) {
            return word;
        }
        int length = rule.source().size();
        List<String> output = new ArrayList<>(word.size());
        int next = 0;
        for (int w = 0; w < windows.size(); w++) {
            int start = windows.getInt(w);
            output.addAll(word.subList(next, start));
            for (int k = 0; k < length; k++) {
                String replaced = replace(rule, start + k, word.get(start + k),
                        rule.source().get(k), rule.target().get(k), unresolved);
                if (replaced != null) {
                    output.add(replaced);
                }
            }
            next = start + length;
        }
        output.addAll(word.subList(next, word.size()));
        return output;
    }

    /**
     * @return the replacement symbol, or null when the symbol is deleted
     */
    private String replace(SoundChangeRule rule, int index, String symbol, MatchSpec from, MatchSpec to,
                           Consumer<UnresolvableTarget> unresolved) {
        if (from.isAnchor()) {
            return symbol;
        }
        if (to instanceof MatchSpec.Deletion) {
            return null;
        }
        if (to instanceof MatchSpec.Literal literal) {
            return literal.symbol();
        }
        if (to instanceof MatchSpec.Boundary) {
            return MatchSpec.BOUNDARY_SYMBOL;
        }
        if (to instanceof MatchSpec.Features features) {
            Optional<String> resolved = resolve(symbol, features.features());
            if (resolved.isPresent()) {
                return resolved.get();
            }
            UnresolvableTarget target = new UnresolvableTarget(rule.id(), index, symbol, features.features());
            logger.warning(target.describe());
            unresolved.accept(target);
        }
        return symbol;
    }

    private Optional<String> resolve(String symbol, List<String> features) {
        Optional<FeatureBundle> current = inventory.featuresOf(symbol);
        if (current.isEmpty()) {
            return Optional.empty();
        }
        FeatureBundle bundle = current.get();
        for (String feature : features) {
            Optional<SoundClass> owner = taxonomy.soundClassOf(feature);
            if (owner.isEmpty() || owner.get() != bundle.soundClass()) {
                return Optional.empty();
            }
            bundle = bundle.with(taxonomy.categoryIndexOf(feature), feature);
        }
        return inventory.symbolOf(bundle);
    }
}
