package com.valuebet.domain.model;

import java.util.List;

/**
 * Canonical market as known to the directory (e.g. "match odds").
 */
public record MarketDefinition(
    String name,
    String sport,
    List<String> aliases,
    List<String> typeCodes,
    String description
) {

    public MarketDefinition {
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        typeCodes = typeCodes == null ? List.of() : List.copyOf(typeCodes);
    }
}
