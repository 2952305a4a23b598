package com.valuebet.domain.service;

import com.valuebet.domain.model.MarketDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MarketRecognizer.
 */
class MarketRecognizerTest {

    private static final Set<String> FILLER = Set.of("and", "or", "the", "a", "an", "v");

    private final MarketRecognizer recognizer = new MarketRecognizer(80, FILLER);

    private final List<MarketRecognizer.MarketAlias> candidates = MarketRecognizer.candidates(List.of(
        new MarketDefinition("match odds", "football", List.of("full time result"), List.of("MATCH_ODDS"), null),
        new MarketDefinition("both teams to score", "football", List.of("btts"), List.of("BOTH_TEAMS_TO_SCORE"),
            null)
    ));

    @Test
    void testCandidatesAlwaysIncludeCanonicalName() {
        assertEquals(4, candidates.size());
        assertEquals(new MarketRecognizer.MarketAlias("match odds", "full time result", "full time result"),
            candidates.get(0));
        assertEquals(new MarketRecognizer.MarketAlias("match odds", "match odds", "match odds"), candidates.get(1));
    }

    @Test
    void testSingleMarket() {
        MarketRecognizer.MarketReduction result = recognizer.reduce("v match odds", candidates);

        assertEquals(List.of("match odds"), result.markets());
        assertTrue(result.leftoverTokens().isEmpty());
        assertEquals(1, result.iterations());
    }

    @Test
    void testSeveralMarketsAreConsumedOneByOne() {
        MarketRecognizer.MarketReduction result = recognizer.reduce("match odds and btts", candidates);

        assertEquals(List.of("match odds", "both teams to score"), result.markets());
        assertTrue(result.leftoverTokens().isEmpty());
        assertEquals(2, result.iterations());
    }

    @Test
    void testStopsBelowThreshold() {
        MarketRecognizer.MarketReduction result = recognizer.reduce("to win", candidates);

        assertTrue(result.markets().isEmpty());
        assertEquals(List.of("to", "win"), result.leftoverTokens());
        assertEquals(1, result.iterations());
    }

    @Test
    void testOnlyFillerOrNothing() {
        MarketRecognizer.MarketReduction filler = recognizer.reduce("the and v", candidates);
        assertTrue(filler.markets().isEmpty());
        assertTrue(filler.leftoverTokens().isEmpty());
        assertEquals(0, filler.iterations());

        MarketRecognizer.MarketReduction empty = recognizer.reduce("", candidates);
        assertEquals(0, empty.iterations());

        MarketRecognizer.MarketReduction tooShort = recognizer.reduce("x", candidates);
        assertEquals(List.of("x"), tooShort.leftoverTokens());
        assertEquals(0, tooShort.iterations());
    }

    @Test
    void testIterationsNeverExceedTokenCount() {
        List<MarketRecognizer.MarketAlias> tricky = MarketRecognizer.candidates(List.of(
            new MarketDefinition("odds", "football", List.of("odds odds", "match"), List.of(), null),
            new MarketDefinition("match odds", "football", List.of("match match odds"), List.of(), null)
        ));
        MarketRecognizer permissive = new MarketRecognizer(1, FILLER);

        String[] inputs = {
            "match match odds odds match",
            "odds odds odds odds odds odds",
            "zz yy xx ww vv",
            "match and odds or the match odds",
            "a b c d e f g h"
        };
        for (String input : inputs) {
            int tokenCount = TextNormalizer.tokens(input).length;
            MarketRecognizer.MarketReduction result = permissive.reduce(input, tricky);
            assertTrue(result.iterations() <= tokenCount,
                input + " took " + result.iterations() + " iterations for " + tokenCount + " tokens");
        }
    }

    @Test
    void testRemoveAliasPrefersContiguousRun() {
        List<String> result = MarketRecognizer.removeAlias(
            List.of("odds", "x", "match", "odds"), List.of("match", "odds"));

        assertEquals(List.of("odds", "x"), result);
    }

    @Test
    void testRemoveAliasFallsBackToTokenBag() {
        List<String> result = MarketRecognizer.removeAlias(
            List.of("odds", "x", "match"), List.of("match", "odds"));

        assertEquals(List.of("x"), result);
    }
}
