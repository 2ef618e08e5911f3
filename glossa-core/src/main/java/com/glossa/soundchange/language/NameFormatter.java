/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.language;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Formats words as proper names: the first letter upper case, everything else lower case.
 */
public final class NameFormatter {

    private NameFormatter() {
    }

    public static List<String> format(List<String> word) {
        int first = -1;
        for (int i = 0; i < word.size(); i++) {
            String symbol = word.get(i);
            if (symbol != null && !symbol.isEmpty()) {
                first = i;
                break;
            }
        }
        if (first < 0) {
            return word;
        }

        List<String> formatted = new ArrayList<>(word.size());
        for (int i = 0; i < word.size(); i++) {
            String symbol = word.get(i);
            if (i < first || symbol == null) {
                formatted.add(symbol);
            } else if (i == first) {
                int split = symbol.offsetByCodePoints(0, 1);
                formatted.add(symbol.substring(0, split).toUpperCase(Locale.ROOT)
                        + symbol.substring(split).toLowerCase(Locale.ROOT));
            } else {
                formatted.add(symbol.toLowerCase(Locale.ROOT));
            }
        }
        return formatted;
    }
}
