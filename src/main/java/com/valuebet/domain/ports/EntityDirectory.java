package com.valuebet.domain.ports;

import com.valuebet.domain.model.EntityKind;
import com.valuebet.domain.model.MarketDefinition;
import com.valuebet.domain.model.Team;

import java.util.List;
import java.util.Map;

/**
 * Port for the directory of known teams and markets.
 */
public interface EntityDirectory {

    /**
     * Version of the directory contents. Increases on every successful mutation, so
     * anything derived from a snapshot can tell when it is stale.
     */
    long version();

    /**
     * Snapshot of all teams keyed by canonical name, in insertion order.
     */
    Map<String, Team> teams();

    /**
     * Snapshot of all markets keyed by canonical name, in insertion order.
     */
    Map<String, MarketDefinition> markets();

    /**
     * Attaches an alias to an existing entity.
     *
     * @return true if the alias was added, false if the entity is unknown or already had it
     */
    boolean addAlias(EntityKind kind, String canonicalName, String alias);

    /**
     * Creates a team. Does nothing if a team with that name already exists.
     *
     * @return the canonical (lower-cased, trimmed) name
     */
    String addTeam(String name, String sport, List<String> aliases);

    /**
     * Creates a market. Does nothing if a market with that name already exists.
     *
     * @return the canonical (lower-cased, trimmed) name
     */
    String addMarket(String name, String sport, List<String> typeCodes, List<String> aliases);
}
