package com.valuebet.domain.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable configuration shared by the interpreter components. Built once at startup.
 *
 * @param fuzzyThreshold            minimum similarity (0-100) for a market alias to be accepted
 * @param fillerWords               words dropped before every fuzzy market attempt
 * @param sportKeywords             league and sport names removed before market recognition
 * @param sportEventTypeIds         sport name to exchange event type id
 * @param marketNameToTypes         canonical market name to exchange market type codes
 * @param defaultMarketBySport      market used for a sport when none was recognized
 * @param primarySport              sport whose fallback market type is {@code primaryFallbackType}
 * @param aliasConflictPolicy       handling of aliases shared by two entities
 * @param maxClassificationAttempts times a strategy may answer Retry before the token is left alone
 * @param maxReparses               re-parses allowed after the directory changed during a parse
 * @param closestAliasLimit         suggestions returned by the closest-alias helper
 * @param closestAliasCutoff        minimum similarity (0-100) for a suggestion
 * @param autoAcceptThreshold       similarity at which the automatic strategy attaches an alias
 * @param classifyUnrecognized      offer leftover fragments to the classification strategy
 */
public record InterpreterSettings(
    int fuzzyThreshold,
    Set<String> fillerWords,
    Set<String> sportKeywords,
    Map<String, String> sportEventTypeIds,
    Map<String, List<String>> marketNameToTypes,
    Map<String, String> defaultMarketBySport,
    String primarySport,
    String primaryFallbackType,
    String genericFallbackType,
    String defaultMatchResultMarket,
    String correctScoreMarket,
    AliasConflictPolicy aliasConflictPolicy,
    int maxClassificationAttempts,
    int maxReparses,
    int closestAliasLimit,
    int closestAliasCutoff,
    int autoAcceptThreshold,
    boolean classifyUnrecognized
) {

    public static final String DEFAULT_SPORT = "football";

    public InterpreterSettings {
        fillerWords = Set.copyOf(fillerWords);
        sportKeywords = Set.copyOf(sportKeywords);
        sportEventTypeIds = Map.copyOf(sportEventTypeIds);
        Map<String, List<String>> types = new LinkedHashMap<>();
        marketNameToTypes.forEach((name, codes) -> types.put(name, List.copyOf(codes)));
        marketNameToTypes = Map.copyOf(types);
        defaultMarketBySport = Map.copyOf(defaultMarketBySport);
    }

    public static InterpreterSettings defaults() {
        return new InterpreterSettings(
            80,
            Set.of("and", "or", "the", "a", "an", "v"),
            Set.of("nfl", "nba", "nhl", "football", "soccer"),
            Map.of("football", "1", "nba", "7522", "nfl", "6423", "nhl", "7524"),
            Map.of("match odds", List.of("MATCH_ODDS")),
            Map.of(
                "football", "match odds",
                "nba", "moneyline_nba",
                "nfl", "moneyline_nfl",
                "nhl", "moneyline_nhl"),
            DEFAULT_SPORT,
            "MATCH_ODDS",
            "MONEY_LINE",
            "match odds",
            "correct score",
            AliasConflictPolicy.LAST_WINS,
            3,
            3,
            5,
            60,
            90,
            true
        );
    }

    public InterpreterSettings withMarketNameToTypes(Map<String, List<String>> table) {
        return new InterpreterSettings(fuzzyThreshold, fillerWords, sportKeywords, sportEventTypeIds, table,
            defaultMarketBySport, primarySport, primaryFallbackType, genericFallbackType, defaultMatchResultMarket,
            correctScoreMarket, aliasConflictPolicy, maxClassificationAttempts, maxReparses, closestAliasLimit,
            closestAliasCutoff, autoAcceptThreshold, classifyUnrecognized);
    }

    public InterpreterSettings withAliasConflictPolicy(AliasConflictPolicy policy) {
        return new InterpreterSettings(fuzzyThreshold, fillerWords, sportKeywords, sportEventTypeIds,
            marketNameToTypes, defaultMarketBySport, primarySport, primaryFallbackType, genericFallbackType,
            defaultMatchResultMarket, correctScoreMarket, policy, maxClassificationAttempts, maxReparses,
            closestAliasLimit, closestAliasCutoff, autoAcceptThreshold, classifyUnrecognized);
    }

    public InterpreterSettings withClassifyUnrecognized(boolean enabled) {
        return new InterpreterSettings(fuzzyThreshold, fillerWords, sportKeywords, sportEventTypeIds,
            marketNameToTypes, defaultMarketBySport, primarySport, primaryFallbackType, genericFallbackType,
            defaultMatchResultMarket, correctScoreMarket, aliasConflictPolicy, maxClassificationAttempts,
            maxReparses, closestAliasLimit, closestAliasCutoff, autoAcceptThreshold, enabled);
    }

    /** Exchange event type id for a sport, falling back to the primary sport's id. */
    public String sportEventTypeId(String sport) {
        String id = sport == null ? null : sportEventTypeIds.get(sport.toLowerCase());
        if (id != null) {
            return id;
        }
        return sportEventTypeIds.getOrDefault(primarySport, "1");
    }

    public String defaultMarketFor(String sport) {
        return defaultMarketBySport.getOrDefault(sport == null ? primarySport : sport.toLowerCase(),
            defaultMatchResultMarket);
    }
}
