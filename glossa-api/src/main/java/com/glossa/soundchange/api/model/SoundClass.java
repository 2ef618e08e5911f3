/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.api.model;

/**
 * The two natural classes a letter can belong to.
 */
public enum SoundClass {
    CONSONANT("C"),
    VOWEL("V");

    private final String abbreviation;

    SoundClass(String abbreviation) {
        this.abbreviation = abbreviation;
    }

    /**
     * Returns the one-letter pattern abbreviation ("C" or "V").
     */
    public String abbreviation() {
        return abbreviation;
    }

    /**
     * Resolves a pattern abbreviation.
     *
     * @param text "C" or "V"
     * @return the class, or null if the text is not an abbreviation
     */
    public static SoundClass fromAbbreviation(String text) {
        for (SoundClass soundClass : values()) {
            if (soundClass.abbreviation.equals(text)) {
                return soundClass;
            }
        }
        return null;
    }
}
