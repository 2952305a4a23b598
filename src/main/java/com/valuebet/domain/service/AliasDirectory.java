package com.valuebet.domain.service;

import com.valuebet.domain.model.AliasConflictPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Lookup from any normalized alias to the canonical name of its entity.
 * Every canonical name is present as a key mapping to itself.
 */
public final class AliasDirectory {

    private static final Logger logger = LoggerFactory.getLogger(AliasDirectory.class);

    /**
     * Alias claimed by two different canonical entities.
     */
    public record AliasConflict(String alias, String existingCanonical, String incomingCanonical) {}

    private final Map<String, String> aliasToCanonical;
    private final List<AliasConflict> conflicts;

    private AliasDirectory(Map<String, String> aliasToCanonical, List<AliasConflict> conflicts) {
        this.aliasToCanonical = Map.copyOf(aliasToCanonical);
        this.conflicts = List.copyOf(conflicts);
    }

    public static AliasDirectory empty() {
        return new AliasDirectory(Map.of(), List.of());
    }

    /**
     * Builds the alias map for a set of entities.
     *
     * @param entities  entities in directory order
     * @param nameOf    canonical name accessor
     * @param aliasesOf alias accessor, may or may not include the canonical name
     * @param policy    how to treat an alias shared by two entities
     * @throws AliasConflictException under {@link AliasConflictPolicy#REJECT} when a conflict exists
     */
    public static <E> AliasDirectory build(
            Collection<E> entities,
            Function<E, String> nameOf,
            Function<E, List<String>> aliasesOf,
            AliasConflictPolicy policy) {
        if (entities == null || entities.isEmpty()) {
            logger.warn("No entities provided, alias directory is empty");
            return empty();
        }

        Map<String, String> map = new LinkedHashMap<>();
        List<AliasConflict> conflicts = new ArrayList<>();

        for (E entity : entities) {
            String canonical = nameOf.apply(entity);
            if (canonical == null || canonical.isBlank()) {
                continue;
            }
            put(map, conflicts, TextNormalizer.normalize(canonical), canonical, policy);

            List<String> aliases = aliasesOf.apply(entity);
            if (aliases == null) {
                continue;
            }
            for (String alias : aliases) {
                if (alias == null || alias.isBlank()) {
                    continue;
                }
                put(map, conflicts, TextNormalizer.normalize(alias), canonical, policy);
            }
        }

        if (!conflicts.isEmpty() && policy == AliasConflictPolicy.REJECT) {
            throw new AliasConflictException(conflicts);
        }

        logger.debug("Alias directory built. Entities: {}, Aliases: {}, Conflicts: {}",
            entities.size(), map.size(), conflicts.size());
        return new AliasDirectory(map, conflicts);
    }

    private static void put(
            Map<String, String> map,
            List<AliasConflict> conflicts,
            String key,
            String canonical,
            AliasConflictPolicy policy) {
        String existing = map.get(key);
        if (existing != null && !existing.equals(canonical)) {
            AliasConflict conflict = new AliasConflict(key, existing, canonical);
            conflicts.add(conflict);
            if (policy != AliasConflictPolicy.REJECT) {
                logger.warn("Alias '{}' is shared by '{}' and '{}', keeping '{}'", key, existing, canonical,
                    policy == AliasConflictPolicy.FIRST_WINS ? existing : canonical);
            }
            if (policy == AliasConflictPolicy.FIRST_WINS) {
                return;
            }
        }
        map.put(key, canonical);
    }

    /**
     * @param normalizedAlias alias already passed through {@link TextNormalizer#normalize}
     */
    public Optional<String> canonicalOf(String normalizedAlias) {
        if (normalizedAlias == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(aliasToCanonical.get(normalizedAlias));
    }

    public boolean contains(String normalizedAlias) {
        return aliasToCanonical.containsKey(normalizedAlias);
    }

    public List<AliasConflict> conflicts() {
        return conflicts;
    }

    public int size() {
        return aliasToCanonical.size();
    }

    public boolean isEmpty() {
        return aliasToCanonical.isEmpty();
    }

    public Map<String, String> asMap() {
        return aliasToCanonical;
    }
}
