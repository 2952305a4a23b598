package com.valuebet.infrastructure.persistence;

import com.valuebet.domain.model.EntityKind;
import com.valuebet.domain.model.MarketDefinition;
import com.valuebet.domain.model.Team;
import com.valuebet.domain.ports.EntityDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Entity directory kept in memory. Subclasses persist the contents by overriding {@link #onChange()}.
 */
public class InMemoryEntityDirectory implements EntityDirectory {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryEntityDirectory.class);

    static final String USER_ADDED_DESCRIPTION = "User-added market";

    protected final Map<String, Team> teams = new LinkedHashMap<>();
    protected final Map<String, MarketDefinition> markets = new LinkedHashMap<>();
    private long version;

    public InMemoryEntityDirectory() {
    }

    public InMemoryEntityDirectory(Collection<Team> teams, Collection<MarketDefinition> markets) {
        replaceContents(teams, markets);
    }

    /**
     * Replaces everything without bumping the version or calling {@link #onChange()}. Used while loading.
     */
    protected synchronized void replaceContents(Collection<Team> newTeams, Collection<MarketDefinition> newMarkets) {
        teams.clear();
        markets.clear();
        newTeams.forEach(t -> teams.put(t.name(), t));
        newMarkets.forEach(m -> markets.put(m.name(), m));
    }

    @Override
    public synchronized long version() {
        return version;
    }

    @Override
    public synchronized Map<String, Team> teams() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(teams));
    }

    @Override
    public synchronized Map<String, MarketDefinition> markets() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(markets));
    }

    @Override
    public synchronized boolean addAlias(EntityKind kind, String canonicalName, String alias) {
        if (alias == null || alias.isBlank()) {
            return false;
        }
        String normalizedAlias = alias.toLowerCase(Locale.ROOT).trim();

        if (kind == EntityKind.TEAM) {
            Team team = teams.get(canonicalName);
            if (team == null || containsIgnoreCase(team.aliases(), normalizedAlias)) {
                return false;
            }
            List<String> aliases = new ArrayList<>(team.aliases());
            aliases.add(normalizedAlias);
            teams.put(team.name(), new Team(team.name(), team.sport(), aliases));
        } else {
            MarketDefinition market = markets.get(canonicalName);
            if (market == null || containsIgnoreCase(market.aliases(), normalizedAlias)) {
                return false;
            }
            List<String> aliases = new ArrayList<>(market.aliases());
            aliases.add(normalizedAlias);
            markets.put(market.name(), new MarketDefinition(market.name(), market.sport(), aliases,
                market.typeCodes(), market.description()));
        }

        logger.info("Added alias '{}' to {} '{}'", normalizedAlias, kind, canonicalName);
        changed();
        return true;
    }

    @Override
    public synchronized String addTeam(String name, String sport, List<String> aliases) {
        String canonical = canonical(name);
        if (sport == null || sport.isBlank()) {
            logger.warn("No sport specified for team '{}'", canonical);
        }
        if (!teams.containsKey(canonical)) {
            teams.put(canonical, new Team(canonical, sport, aliases));
            logger.info("Added new team: {} (Sport: {}, Aliases: {})", canonical, sport, aliases);
            changed();
        }
        return canonical;
    }

    @Override
    public synchronized String addMarket(String name, String sport, List<String> typeCodes, List<String> aliases) {
        String canonical = canonical(name);
        if (sport == null || sport.isBlank()) {
            logger.warn("No sport specified for market '{}'", canonical);
        }
        if (typeCodes == null || typeCodes.isEmpty()) {
            logger.warn("No market type specified for '{}'", canonical);
        }
        if (!markets.containsKey(canonical)) {
            List<String> allAliases = aliases == null ? new ArrayList<>() : new ArrayList<>(aliases);
            if (!allAliases.contains(canonical)) {
                allAliases.add(canonical);
            }
            markets.put(canonical, new MarketDefinition(canonical, sport, allAliases, typeCodes,
                USER_ADDED_DESCRIPTION));
            logger.info("Added new market: {} (Sport: {}, Types: {}, Aliases: {})", canonical, sport, typeCodes,
                allAliases);
            changed();
        }
        return canonical;
    }

    /**
     * Called after every mutation while the directory lock is held.
     */
    protected void onChange() {
    }

    private void changed() {
        version++;
        onChange();
    }

    private static String canonical(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Entity name must not be blank");
        }
        return name.toLowerCase(Locale.ROOT).trim();
    }

    private static boolean containsIgnoreCase(List<String> values, String value) {
        return values.stream().anyMatch(v -> v.equalsIgnoreCase(value));
    }
}
