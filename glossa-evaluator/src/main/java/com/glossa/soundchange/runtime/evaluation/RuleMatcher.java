/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.runtime.evaluation;

import com.glossa.soundchange.api.model.MatchSpec;
import com.glossa.soundchange.api.model.SoundChangeRule;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.List;

/**
 * Finds the windows of a word a rule applies to.
 *
 * <p>One left-to-right scan keeps a running count of satisfied source slots.
 * A mismatch part way through resets the count and tests the same symbol again
 * as a fresh start. A complete source match is accepted only if its
 * environment holds; the focus {@code _} stands for the whole window, so slots
 * before it are compared with the symbols preceding the window and slots after
 * it with the symbols following the window.
 *
 * <p>Accepted windows never overlap: scanning resumes right after an accepted
 * window. A window rejected by its environment releases its symbols and the
 * scan resumes one position after the window start.
 */
final class RuleMatcher {

    private final SymbolMatcher symbolMatcher;

    RuleMatcher(SymbolMatcher symbolMatcher) {
        this.symbolMatcher = symbolMatcher;
    }

    /**
     * @return start indices of the accepted windows, ascending
     */
    IntList findWindows(List<String> word, SoundChangeRule rule) {
        IntList windows = new IntArrayList();
        List<MatchSpec> source = rule.source();
        int length = source.size();
        if (length == 0 || word.isEmpty()) {
            return windows;
        }

        int count = 0;
        int index = 0;
        while (index < word.size()) {
            if (symbolMatcher.matches(source.get(count), word.get(index))) {
                count++;
                index++;
                if (count == length) {
                    int start = index - length;
                    count = 0;
                    if (environmentHolds(word, rule, start, length)) {
                        windows.add(start);
                    } else {
                        index = start + 1;
                    }
                }
            } else if (count > 0) {
                count = 0;
            } else {
                index++;
            }
        }
        return windows;
    }

    boolean environmentHolds(List<String> word, SoundChangeRule rule, int start, int length) {
        List<MatchSpec> before = rule.environmentBefore();
        for (int k = 0; k < before.size(); k++) {
            if (!symbolMatcher.matchesAt(before.get(k), word, start - before.size() + k)) {
                return false;
            }
        }
        List<MatchSpec> after = rule.environmentAfter();
        for (int k = 0; k < after.size(); k++) {
            if (!symbolMatcher.matchesAt(after.get(k), word, start + length + k)) {
                return false;
            }
        }
        return true;
    }
}
