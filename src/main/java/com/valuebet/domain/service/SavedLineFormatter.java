package com.valuebet.domain.service;

import com.valuebet.domain.model.ValueDecision;

import java.util.Locale;
import java.util.Set;

/**
 * Formats a value bet as "bookmaker - Sport - bet - odds / price", with " 2pc" appended
 * for bets that are only within two percent.
 */
public class SavedLineFormatter {

    private static final Set<String> UPPER_CASE_SPORTS = Set.of("nba", "nfl", "nhl");

    public String format(String bookmaker, String sport, String betText, double odds, double price,
                         ValueDecision decision) {
        String line = bookmaker + " - " + displaySport(sport) + " - " + betText.trim() + " - " + odds + " / " + price;
        if (decision == ValueDecision.TWO_PERCENT) {
            line += " 2pc";
        }
        return line;
    }

    static String displaySport(String sport) {
        String lower = sport.toLowerCase(Locale.ROOT);
        if (UPPER_CASE_SPORTS.contains(lower)) {
            return lower.toUpperCase(Locale.ROOT);
        }
        if (lower.isEmpty()) {
            return lower;
        }
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
