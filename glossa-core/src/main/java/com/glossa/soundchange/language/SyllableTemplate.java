/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.language;

import com.glossa.soundchange.api.exceptions.CompilationException;
import com.glossa.soundchange.api.model.MatchSpec;
import com.glossa.soundchange.api.model.SoundClass;
import com.glossa.soundchange.compiler.MatchSpecParser;
import com.glossa.soundchange.runtime.model.Inventory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Expands syllable shapes such as {@code [C, V, C]} into letters.
 *
 * <p>Each slot is resolved once into its candidate letters: {@code C} and
 * {@code V} to their natural class, a letter to itself, a feature list to every
 * letter carrying those features, and {@code ""} to nothing. Building a
 * syllable picks a shape and then one candidate per slot, uniformly.
 * Slots without candidates are dropped.
 */
public final class SyllableTemplate {
    private static final Logger logger = Logger.getLogger(SyllableTemplate.class.getName());

    private final List<List<String>> structures;
    private final List<List<List<String>>> candidates;

    public SyllableTemplate(List<List<String>> structures, Inventory inventory) {
        if (structures == null || structures.isEmpty()) {
            throw new CompilationException("At least one syllable structure is required");
        }
        MatchSpecParser parser = new MatchSpecParser(inventory);
        this.structures = structures.stream().map(List::copyOf).toList();
        List<List<List<String>>> resolved = new ArrayList<>(structures.size());
        for (List<String> structure : this.structures) {
            List<List<String>> slots = new ArrayList<>(structure.size());
            for (String slot : structure) {
                slots.add(candidatesFor(parser.parse(slot), inventory, structure));
            }
            resolved.add(List.copyOf(slots));
        }
        this.candidates = List.copyOf(resolved);
    }

    public List<List<String>> structures() {
        return structures;
    }

    public List<String> buildSyllable(Random random) {
        List<List<String>> shape = candidates.get(random.nextInt(candidates.size()));
        List<String> syllable = new ArrayList<>(shape.size());
        for (List<String> slot : shape) {
            if (!slot.isEmpty()) {
                syllable.add(slot.get(random.nextInt(slot.size())));
            }
        }
        return syllable;
    }

    /**
     * Concatenates {@code count} syllables into an unbounded root.
     */
    public List<String> buildRoot(int count, Random random) {
        List<String> root = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            root.addAll(buildSyllable(random));
        }
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Built root: " + String.join("", root));
        }
        return root;
    }

    private static List<String> candidatesFor(MatchSpec spec, Inventory inventory, List<String> structure) {
        if (spec instanceof MatchSpec.NaturalClass naturalClass) {
            return List.copyOf(naturalClass.soundClass() == SoundClass.CONSONANT
                    ? inventory.consonants() : inventory.vowels());
        }
        if (spec instanceof MatchSpec.Literal literal) {
            return List.of(literal.symbol());
        }
        if (spec instanceof MatchSpec.Features features) {
            return List.copyOf(inventory.symbolsWithAll(features.features()));
        }
        if (spec instanceof MatchSpec.Deletion) {
            return List.of();
        }
        throw new CompilationException("Syllable structure " + structure + " cannot contain '" + spec.notation() + "'");
    }
}
