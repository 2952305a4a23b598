package com.valuebet.domain.service;

import com.valuebet.domain.model.InterpreterSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Maps human-readable market names to exchange market type codes.
 *
 * Examples:
 * - "match odds" (football) -> [MATCH_ODDS]
 * - "over/under 2.5 goals" -> [OVER_UNDER_25] when configured
 * - "to win to nil" -> [] (the side is only known once the event is picked)
 * - unknown market -> [MATCH_ODDS] for the primary sport, [MONEY_LINE] otherwise
 */
public class MarketTypeMapper {

    private static final Logger logger = LoggerFactory.getLogger(MarketTypeMapper.class);

    public static final String TO_WIN_TO_NIL = "to win to nil";

    private final InterpreterSettings settings;

    public MarketTypeMapper(InterpreterSettings settings) {
        this.settings = settings;
    }

    public List<String> mapMarketNameToType(String marketName, String sport) {
        String name = marketName == null || marketName.isBlank()
            ? settings.defaultMatchResultMarket()
            : marketName.trim().toLowerCase(Locale.ROOT);

        if (TO_WIN_TO_NIL.equals(name)) {
            return List.of();
        }

        List<String> mapped = settings.marketNameToTypes().get(name);
        if (mapped != null) {
            logger.debug("Market '{}' maps to {}", name, mapped);
            return mapped;
        }

        String effectiveSport = sport == null ? settings.primarySport() : sport.toLowerCase(Locale.ROOT);
        String fallback = effectiveSport.equals(settings.primarySport())
            ? settings.primaryFallbackType()
            : settings.genericFallbackType();
        logger.debug("No mapping for market '{}' ({}), falling back to {}", name, effectiveSport, fallback);
        return List.of(fallback);
    }
}
