package com.valuebet.domain.service;

import com.valuebet.domain.model.BetLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/**
 * Splits a user line of the form "bookmaker - sport - bet - odds".
 * Any other line is taken as bet text only.
 */
public class BetLineParser {

    private static final Logger logger = LoggerFactory.getLogger(BetLineParser.class);

    private static final Pattern SEPARATOR = Pattern.compile("\\s-\\s");

    /**
     * @param fallbackOdds odds to use when the line carries none (or unusable ones), may be null
     * @throws IllegalArgumentException if no positive odds are available
     */
    public BetLine parse(String line, Double fallbackOdds) {
        if (line == null || line.isBlank()) {
            throw new IllegalArgumentException("Bet line must not be empty");
        }

        long separators = SEPARATOR.matcher(line).results().count();
        if (separators == 3) {
            String[] parts = SEPARATOR.split(line, 4);
            String bookmaker = parts[0].trim();
            String sport = parts[1].trim();
            String betText = parts[2].trim();
            String oddsText = parts[3].trim();

            Double odds = parseOdds(oddsText);
            if (odds != null) {
                logger.debug("Detected format: bookmaker='{}', sport='{}', bet='{}', odds={}", bookmaker, sport,
                    betText, odds);
                return new BetLine(bookmaker, sport, betText, odds, true);
            }
            logger.warn("Odds '{}' are not a positive decimal number, using the supplied odds", oddsText);
            return new BetLine(bookmaker, sport, betText, requireOdds(fallbackOdds), false);
        }

        return new BetLine(null, null, line.trim(), requireOdds(fallbackOdds), false);
    }

    private static Double parseOdds(String text) {
        try {
            double odds = Double.parseDouble(text);
            return odds > 0 && Double.isFinite(odds) ? odds : null;
        } catch (NumberFormatException e) {
            logger.debug("Unparseable odds '{}'", text);
            return null;
        }
    }

    private static double requireOdds(Double odds) {
        if (odds == null || !(odds > 0) || Double.isInfinite(odds)) {
            throw new IllegalArgumentException("Odds must be a positive decimal number, got: " + odds);
        }
        return odds;
    }
}
