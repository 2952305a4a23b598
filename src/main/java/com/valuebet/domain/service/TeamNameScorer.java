package com.valuebet.domain.service;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Scores how well an exchange event or side name matches a team.
 */
public final class TeamNameScorer {

    private static final Pattern EVENT_SIDES = Pattern.compile("\\s+v\\s+|\\s+vs\\s+|\\s+@\\s+",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern HOME_AWAY = Pattern.compile("\\sv\\s", Pattern.CASE_INSENSITIVE);

    public static final int EXACT_MATCH_SCORE = 300;
    private static final int PREFIX_MATCH_SCORE = 250;

    /**
     * Home and away side of an "A v B" event name, trimmed.
     */
    public record Sides(String home, String away) {}

    private TeamNameScorer() {
    }

    /**
     * 300 for an exact match, up to 250 when the side starts with the team (less the longer the side),
     * otherwise the similarity ratio.
     */
    public static int scoreTeamInName(String sideName, String teamName) {
        String side = sideName.toLowerCase(Locale.ROOT).trim();
        String team = teamName.toLowerCase(Locale.ROOT).trim();
        if (side.equals(team)) {
            return EXACT_MATCH_SCORE;
        }
        if (side.startsWith(team)) {
            int diff = side.length() - team.length();
            return Math.max(1, PREFIX_MATCH_SCORE - diff * 10);
        }
        return Similarity.ratio(team, side);
    }

    public static int scoreEvent(String eventName, String teamName) {
        String[] parts = EVENT_SIDES.split(eventName, -1);
        if (parts.length == 2) {
            return Math.max(scoreTeamInName(parts[0], teamName), scoreTeamInName(parts[1], teamName));
        }
        return scoreTeamInName(eventName, teamName);
    }

    public static Optional<Sides> sides(String eventName) {
        if (eventName == null) {
            return Optional.empty();
        }
        String[] parts = HOME_AWAY.split(eventName, -1);
        if (parts.length != 2) {
            return Optional.empty();
        }
        return Optional.of(new Sides(parts[0].trim(), parts[1].trim()));
    }

    /**
     * True when the team is closer to the home side, or when the sides cannot be told apart.
     */
    public static boolean isHomeSide(String eventName, String teamName) {
        return sides(eventName)
            .map(s -> scoreTeamInName(s.home(), teamName) >= scoreTeamInName(s.away(), teamName))
            .orElse(true);
    }
}
