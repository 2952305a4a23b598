package com.valuebet.infrastructure.rest;

import com.valuebet.application.usecase.EvaluateBetUseCase;
import com.valuebet.application.usecase.InterpretBetUseCase;
import com.valuebet.domain.model.ClassificationResult;
import com.valuebet.domain.model.EvaluationStatus;
import com.valuebet.domain.model.ExchangeEvent;
import com.valuebet.domain.model.InterpreterSettings;
import com.valuebet.domain.model.MarketCatalogue;
import com.valuebet.domain.model.MarketDefinition;
import com.valuebet.domain.model.ParsedBet;
import com.valuebet.domain.model.SavedBet;
import com.valuebet.domain.model.Team;
import com.valuebet.domain.ports.MarketDataProvider;
import com.valuebet.domain.ports.SavedBetRepository;
import com.valuebet.domain.service.BetLineParser;
import com.valuebet.domain.service.BetParser;
import com.valuebet.domain.service.EventSelector;
import com.valuebet.domain.service.MarketPriceResolver;
import com.valuebet.domain.service.MarketSelector;
import com.valuebet.domain.service.MarketTypeMapper;
import com.valuebet.domain.service.MultipleMatchParser;
import com.valuebet.domain.service.PriceAggregator;
import com.valuebet.domain.service.RunnerSelector;
import com.valuebet.domain.service.SavedLineFormatter;
import com.valuebet.domain.service.UnknownEntityResolver;
import com.valuebet.domain.service.ValueClassifier;
import com.valuebet.infrastructure.persistence.InMemoryEntityDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BetController.
 */
class BetControllerTest {

    private BetController controller;

    @BeforeEach
    void setUp() {
        InMemoryEntityDirectory directory = new InMemoryEntityDirectory(
            List.of(new Team("chelsea", "football", List.of())),
            List.of(new MarketDefinition("match odds", "football", List.of(), List.of("MATCH_ODDS"), null)));
        InterpreterSettings settings = InterpreterSettings.defaults().withClassifyUnrecognized(false);

        UnknownEntityResolver resolver = new UnknownEntityResolver((token, dir) -> ClassificationResult.ignore(), 3);
        InterpretBetUseCase interpret = new InterpretBetUseCase(new BetParser(settings, resolver), resolver,
            new MultipleMatchParser(), directory, settings);
        MarketDataProvider noMarkets = new EmptyMarketData();
        EvaluateBetUseCase evaluate = new EvaluateBetUseCase(interpret, new BetLineParser(), directory, noMarkets,
            new EventSelector(), new MarketPriceResolver(noMarkets, new MarketTypeMapper(settings),
            new MarketSelector(), new RunnerSelector(), new PriceAggregator()), new ValueClassifier(),
            new SavedLineFormatter(), new EmptySavedBetRepository(), settings);

        controller = new BetController(interpret, evaluate);
    }

    @Test
    void testParse() {
        ResponseEntity<ParsedBet> response = controller.parse(new BetController.ParseRequest("Chelsea match odds"));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(List.of("chelsea"), response.getBody().teams());
        assertEquals(List.of("match odds"), response.getBody().markets());
    }

    @Test
    void testParseRejectsBlankText() {
        assertEquals(HttpStatus.BAD_REQUEST, controller.parse(new BetController.ParseRequest(" ")).getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST, controller.parse(null).getStatusCode());
    }

    @Test
    void testEvaluate() {
        ResponseEntity<EvaluateBetUseCase.EvaluationReport> response =
            controller.evaluate(new BetController.EvaluateRequest("chelsea match odds", 2.0, null));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(EvaluationStatus.NO_EVENT, response.getBody().evaluation().status());
    }

    @Test
    void testEvaluateWithoutOdds() {
        ResponseEntity<EvaluateBetUseCase.EvaluationReport> response =
            controller.evaluate(new BetController.EvaluateRequest("chelsea match odds", null, true));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
    }

    @Test
    void testSaved() {
        ResponseEntity<List<SavedBet>> response = controller.saved(20);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertTrue(response.getBody().isEmpty());
    }

    private static class EmptyMarketData implements MarketDataProvider {

        @Override
        public List<ExchangeEvent> findEvents(String teamQuery, String sportId) {
            return List.of();
        }

        @Override
        public List<MarketCatalogue> listMarketCatalogue(String eventId, List<String> typeCodes) {
            return List.of();
        }

        @Override
        public Optional<Double> bestLayPrice(String marketId, long selectionId) {
            return Optional.empty();
        }
    }

    private static class EmptySavedBetRepository implements SavedBetRepository {

        @Override
        public void save(SavedBet bet) {
            throw new UnsupportedOperationException("Nothing is saved in these tests");
        }

        @Override
        public List<SavedBet> findRecent(int limit) {
            return List.of();
        }
    }
}
