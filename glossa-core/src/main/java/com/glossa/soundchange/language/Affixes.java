/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.language;

import com.glossa.soundchange.api.exceptions.CompilationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Affixes keyed by the property they mark. The {@code "-"} element shows where
 * the stem goes: {@code [t, -]} is a prefix, {@code [-, i, d]} a suffix.
 */
public final class Affixes {

    static final String STEM = "-";

    private final Map<String, List<String>> affixes;

    public Affixes(Map<String, List<String>> affixes) {
        this.affixes = affixes.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> List.copyOf(e.getValue())));
        this.affixes.forEach(Affixes::validate);
    }

    public Set<String> properties() {
        return affixes.keySet();
    }

    public boolean isPrefix(String property) {
        List<String> affix = affixOf(property);
        return STEM.equals(affix.get(affix.size() - 1));
    }

    /**
     * Returns a new word with the affix of the property attached.
     *
     * @throws IllegalArgumentException if no affix is defined for the property
     */
    public List<String> attach(List<String> word, String property) {
        List<String> affix = affixOf(property);
        List<String> result = new ArrayList<>(word.size() + affix.size() - 1);
        if (isPrefix(property)) {
            result.addAll(affix.subList(0, affix.size() - 1));
            result.addAll(word);
        } else {
            result.addAll(word);
            result.addAll(affix.subList(1, affix.size()));
        }
        return result;
    }

    private List<String> affixOf(String property) {
        List<String> affix = affixes.get(property);
        if (affix == null) {
            throw new IllegalArgumentException("No affix defined for property: " + property);
        }
        return affix;
    }

    private static void validate(String property, List<String> affix) {
        boolean prefix = affix.size() > 1 && STEM.equals(affix.get(affix.size() - 1));
        boolean suffix = affix.size() > 1 && STEM.equals(affix.get(0));
        if (prefix == suffix || affix.stream().filter(STEM::equals).count() != 1) {
            throw new CompilationException("Affix '" + property + "' must have exactly one '-' at its start or end, got "
                    + affix);
        }
    }
}
