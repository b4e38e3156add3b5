package de.mirkosertic.mcp.wikiassistant.search;

import java.util.Locale;

/**
 * A search term with its importance, 1 (marginal) to 10 (essential).
 * The term is stored trimmed and lowercased.
 */
public record WeightedKeyword(String term, double weight) {

    public static final double MIN_WEIGHT = 1.0;
    public static final double MAX_WEIGHT = 10.0;

    public WeightedKeyword {
        if (term == null || term.isBlank()) {
            throw new IllegalArgumentException("Keyword term must not be blank");
        }
        if (!(weight >= MIN_WEIGHT && weight <= MAX_WEIGHT)) {
            throw new IllegalArgumentException("Keyword weight must be within [1, 10], was " + weight);
        }
        term = term.trim().toLowerCase(Locale.ROOT);
    }
}
