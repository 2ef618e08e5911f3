/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.language;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Two-way dictionary between spelled words and their translations.
 * Adding a translation again replaces its word.
 */
public final class Lexicon {

    private final Map<String, List<String>> wordsByTranslation = new HashMap<>();
    private final Map<String, String> translationsBySpelling = new TreeMap<>();

    public synchronized void addEntry(List<String> word, String translation) {
        List<String> previous = wordsByTranslation.put(translation, List.copyOf(word));
        if (previous != null) {
            translationsBySpelling.remove(spell(previous), translation);
        }
        translationsBySpelling.put(spell(word), translation);
    }

    public synchronized Optional<List<String>> lookup(String translation) {
        return Optional.ofNullable(wordsByTranslation.get(translation));
    }

    public synchronized Optional<String> translate(String spelling) {
        return Optional.ofNullable(translationsBySpelling.get(spelling));
    }

    public synchronized int size() {
        return translationsBySpelling.size();
    }

    /**
     * One {@code spelling: translation} line per entry, sorted by spelling.
     */
    public synchronized String print() {
        StringBuilder sb = new StringBuilder();
        translationsBySpelling.forEach((spelling, translation) ->
                sb.append(spelling).append(": ").append(translation).append('\n'));
        return sb.toString();
    }

    static String spell(List<String> word) {
        return String.join("", word);
    }
}
