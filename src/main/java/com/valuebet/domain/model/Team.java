package com.valuebet.domain.model;

import java.util.List;

/**
 * Canonical team. The canonical name is its identity.
 */
public record Team(String name, String sport, List<String> aliases) {

    public Team {
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }
}
