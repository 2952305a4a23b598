package com.valuebet.domain.service;

import com.valuebet.domain.model.Team;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Suggests known team names and aliases that look like an unknown token.
 */
public class ClosestAliasFinder {

    private final int limit;
    private final int cutoff;

    private record Suggestion(String name, int score) {}

    public ClosestAliasFinder(int limit, int cutoff) {
        this.limit = limit;
        this.cutoff = cutoff;
    }

    /**
     * @return at most {@code limit} lower-cased names or aliases scoring at least {@code cutoff}, best first
     */
    public List<String> closest(String alias, Collection<Team> teams) {
        String query = alias == null ? "" : alias.toLowerCase(Locale.ROOT).trim();

        Set<String> names = new LinkedHashSet<>();
        for (Team team : teams) {
            names.add(team.name().toLowerCase(Locale.ROOT).trim());
        }
        for (Team team : teams) {
            for (String a : team.aliases()) {
                names.add(a.toLowerCase(Locale.ROOT).trim());
            }
        }

        List<Suggestion> suggestions = new ArrayList<>();
        for (String name : names) {
            int score = Similarity.ratio(query, name);
            if (score >= cutoff) {
                suggestions.add(new Suggestion(name, score));
            }
        }
        suggestions.sort(Comparator.comparingInt(Suggestion::score).reversed());

        return suggestions.stream()
            .limit(limit)
            .map(Suggestion::name)
            .toList();
    }
}
