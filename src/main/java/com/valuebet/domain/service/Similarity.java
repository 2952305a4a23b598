package com.valuebet.domain.service;

import me.xdrop.fuzzywuzzy.FuzzySearch;

/**
 * Symmetric string similarity on a 0-100 scale (normalized Indel distance).
 */
public final class Similarity {

    private Similarity() {
    }

    public static int ratio(String a, String b) {
        if (a == null || b == null) {
            return 0;
        }
        if (a.isEmpty() && b.isEmpty()) {
            return 100;
        }
        return FuzzySearch.ratio(a, b);
    }
}
