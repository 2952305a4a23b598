package com.valuebet.domain.model;

import java.util.List;

/**
 * Structured result of interpreting one free-text bet.
 *
 * @param teams        canonical team names in recognition order
 * @param markets      canonical market names in recognition order
 * @param scores       correct-score predictions, empty when none were given
 * @param unrecognized leftover text fragments nothing could be matched against
 */
public record ParsedBet(
    List<String> teams,
    List<String> markets,
    List<Score> scores,
    List<String> unrecognized
) {

    public ParsedBet {
        teams = List.copyOf(teams);
        markets = List.copyOf(markets);
        scores = List.copyOf(scores);
        unrecognized = List.copyOf(unrecognized);
    }

    public boolean isEmpty() {
        return teams.isEmpty() && markets.isEmpty();
    }
}
