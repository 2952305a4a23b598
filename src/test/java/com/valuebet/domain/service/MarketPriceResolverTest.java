package com.valuebet.domain.service;

import com.valuebet.domain.model.ExchangeEvent;
import com.valuebet.domain.model.InterpreterSettings;
import com.valuebet.domain.model.MarketCatalogue;
import com.valuebet.domain.model.Runner;
import com.valuebet.domain.model.Score;
import com.valuebet.domain.ports.MarketDataProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MarketPriceResolver.
 */
class MarketPriceResolverTest {

    private static final ExchangeEvent EVENT =
        new ExchangeEvent("E1", "Chelsea v Arsenal", Instant.parse("2026-10-25T15:00:00Z"));

    private FakeMarketData marketData;
    private MarketPriceResolver resolver;

    @BeforeEach
    void setUp() {
        marketData = new FakeMarketData();
        InterpreterSettings settings = InterpreterSettings.defaults().withMarketNameToTypes(Map.of(
            "match odds", List.of("MATCH_ODDS"),
            "correct score", List.of("CORRECT_SCORE")));
        resolver = new MarketPriceResolver(marketData, new MarketTypeMapper(settings), new MarketSelector(),
            new RunnerSelector(), new PriceAggregator());
    }

    @Test
    void testMatchOddsPrice() {
        marketData.catalogue("E1", "MATCH_ODDS", new MarketCatalogue("1.10", "Match Odds", null, List.of(
            new Runner(1, "Chelsea"), new Runner(2, "Arsenal"), new Runner(3, "The Draw"))));
        marketData.prices.put(2L, 3.5);

        Optional<Double> price = resolver.fetchBestLayPrice(EVENT, "arsenal", "match odds", "football", List.of());

        assertEquals(3.5, price.orElseThrow());
        assertEquals(List.of(List.of("MATCH_ODDS")), marketData.requestedTypes);
    }

    @Test
    void testCorrectScoresAreSwappedForAwayTeamAndCombined() {
        marketData.catalogue("E1", "CORRECT_SCORE", new MarketCatalogue("1.20", "Correct Score", null, List.of(
            new Runner(11, "1 - 2"), new Runner(12, "0 - 1"), new Runner(13, "2 - 1"), new Runner(14, "1 - 0"))));
        marketData.prices.put(11L, 12.0);
        marketData.prices.put(12L, 6.0);
        marketData.prices.put(13L, 9.0);
        marketData.prices.put(14L, 7.0);

        Optional<Double> price = resolver.fetchBestLayPrice(EVENT, "arsenal", "correct score", "football",
            List.of(new Score(2, 1), new Score(1, 0)));

        assertEquals(4.0, price.orElseThrow());
    }

    @Test
    void testCorrectScoresForHomeTeam() {
        marketData.catalogue("E1", "CORRECT_SCORE", new MarketCatalogue("1.20", "Correct Score", null, List.of(
            new Runner(11, "1 - 2"), new Runner(13, "2 - 1"))));
        marketData.prices.put(11L, 12.0);
        marketData.prices.put(13L, 9.0);

        Optional<Double> price = resolver.fetchBestLayPrice(EVENT, "chelsea", "correct score", "football",
            List.of(new Score(2, 1)));

        assertEquals(9.0, price.orElseThrow());
    }

    @Test
    void testCorrectScoresWithoutAnyPrice() {
        marketData.catalogue("E1", "CORRECT_SCORE", new MarketCatalogue("1.20", "Correct Score", null, List.of(
            new Runner(13, "2 - 1"))));

        assertTrue(resolver.fetchBestLayPrice(EVENT, "chelsea", "correct score", "football",
            List.of(new Score(2, 1), new Score(5, 5))).isEmpty());
    }

    @Test
    void testWinToNilSideFollowsTeam() {
        marketData.catalogue("E1", "TEAM_B_WIN_TO_NIL", new MarketCatalogue("1.30", "Arsenal Win to Nil", null,
            List.of(new Runner(21, "Yes"), new Runner(22, "No"))));
        marketData.prices.put(21L, 5.2);

        Optional<Double> price = resolver.fetchBestLayPrice(EVENT, "arsenal", "to win to nil", "football", List.of());

        assertEquals(5.2, price.orElseThrow());
        assertEquals(List.of("TEAM_A_WIN_TO_NIL"),
            resolver.marketTypesFor(EVENT, "chelsea", "To Win To Nil", "football"));
    }

    @Test
    void testNoMarket() {
        assertTrue(resolver.fetchBestLayPrice(EVENT, "chelsea", "match odds", "football", List.of()).isEmpty());
    }

    @Test
    void testNoPrice() {
        marketData.catalogue("E1", "MATCH_ODDS", new MarketCatalogue("1.10", "Match Odds", null, List.of(
            new Runner(1, "Chelsea"), new Runner(2, "Arsenal"))));

        assertTrue(resolver.fetchBestLayPrice(EVENT, "chelsea", "match odds", "football", List.of()).isEmpty());
    }

    @Test
    void testMarketWithoutRunners() {
        marketData.catalogue("E1", "MATCH_ODDS", new MarketCatalogue("1.10", "Match Odds", null, List.of()));

        assertTrue(resolver.fetchBestLayPrice(EVENT, "chelsea", "match odds", "football", List.of()).isEmpty());
    }

    /**
     * Serves catalogues per event and type code, and prices per selection.
     */
    private static class FakeMarketData implements MarketDataProvider {

        private final Map<String, List<MarketCatalogue>> catalogues = new HashMap<>();
        private final Map<Long, Double> prices = new HashMap<>();
        private final List<List<String>> requestedTypes = new ArrayList<>();

        void catalogue(String eventId, String typeCode, MarketCatalogue catalogue) {
            catalogues.computeIfAbsent(eventId + "/" + typeCode, k -> new ArrayList<>()).add(catalogue);
        }

        @Override
        public List<ExchangeEvent> findEvents(String teamQuery, String sportId) {
            return List.of();
        }

        @Override
        public List<MarketCatalogue> listMarketCatalogue(String eventId, List<String> typeCodes) {
            requestedTypes.add(typeCodes);
            return catalogues.getOrDefault(eventId + "/" + String.join(",", typeCodes), List.of());
        }

        @Override
        public Optional<Double> bestLayPrice(String marketId, long selectionId) {
            return Optional.ofNullable(prices.get(selectionId));
        }
    }
}
