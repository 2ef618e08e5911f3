/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.api.model;

import java.util.List;
import java.util.Objects;

/**
 * One slot of a rule pattern.
 *
 * <p>Textual rule slots are resolved into one of these variants once, when the
 * rule is built, so matching never re-parses strings:
 * <ul>
 * <li>{@link Literal}: a specific symbol</li>
 * <li>{@link NaturalClass}: any consonant (C) or any vowel (V)</li>
 * <li>{@link Features}: any letter carrying all listed features</li>
 * <li>{@link Boundary}: the word boundary marker {@code #}</li>
 * <li>{@link Focus}: the {@code _} of an environment, where source and target align</li>
 * <li>{@link Deletion}: an empty target slot, removing the matched symbol</li>
 * </ul>
 */
public sealed interface MatchSpec
        permits MatchSpec.Literal, MatchSpec.NaturalClass, MatchSpec.Features,
        MatchSpec.Boundary, MatchSpec.Focus, MatchSpec.Deletion {

    String BOUNDARY_SYMBOL = "#";
    String FOCUS_SYMBOL = "_";

    /**
     * True for slots that only anchor a match (C, V, #) and are never rewritten.
     */
    default boolean isAnchor() {
        return this instanceof NaturalClass || this instanceof Boundary;
    }

    /**
     * Compact notation used when printing rules.
     */
    String notation();

    /**
     * A slot for one symbol. The reserved markers resolve to their structural
     * slots, so {@code literal("#")} is the boundary anchor.
     */
    static MatchSpec literal(String symbol) {
        if (BOUNDARY_SYMBOL.equals(symbol)) {
            return boundary();
        }
        if (FOCUS_SYMBOL.equals(symbol)) {
            return focus();
        }
        SoundClass soundClass = SoundClass.fromAbbreviation(symbol);
        return soundClass != null ? new NaturalClass(soundClass) : new Literal(symbol);
    }

    static MatchSpec consonant() {
        return new NaturalClass(SoundClass.CONSONANT);
    }

    static MatchSpec vowel() {
        return new NaturalClass(SoundClass.VOWEL);
    }

    static MatchSpec features(String... features) {
        return new Features(List.of(features));
    }

    static MatchSpec boundary() {
        return new Boundary();
    }

    static MatchSpec focus() {
        return new Focus();
    }

    static MatchSpec deletion() {
        return new Deletion();
    }

    record Literal(String symbol) implements MatchSpec {
        public Literal {
            Objects.requireNonNull(symbol, "Literal symbol cannot be null");
            if (symbol.isEmpty()) {
                throw new IllegalArgumentException("Literal symbol cannot be empty, use a deletion");
            }
            if (BOUNDARY_SYMBOL.equals(symbol) || FOCUS_SYMBOL.equals(symbol)
                    || SoundClass.fromAbbreviation(symbol) != null) {
                throw new IllegalArgumentException("Symbol '" + symbol + "' is reserved for rule patterns");
            }
        }

        @Override
        public String notation() {
            return symbol;
        }
    }

    record NaturalClass(SoundClass soundClass) implements MatchSpec {
        public NaturalClass {
            Objects.requireNonNull(soundClass, "Sound class cannot be null");
        }

        @Override
        public String notation() {
            return soundClass.abbreviation();
        }
    }

    /**
     * A partial or full feature specification. Matches a letter whose bundle
     * contains every listed feature.
     */
    record Features(List<String> features) implements MatchSpec {
        public Features {
            features = List.copyOf(features);
            if (features.isEmpty()) {
                throw new IllegalArgumentException("Feature specifier needs at least one feature");
            }
        }

        @Override
        public String notation() {
            return "[" + String.join(",", features) + "]";
        }
    }

    record Boundary() implements MatchSpec {
        @Override
        public String notation() {
            return BOUNDARY_SYMBOL;
        }
    }

    record Focus() implements MatchSpec {
        @Override
        public String notation() {
            return FOCUS_SYMBOL;
        }
    }

    record Deletion() implements MatchSpec {
        @Override
        public String notation() {
            return "∅";
        }
    }
}
