package com.valuebet.application.usecase;

import com.valuebet.domain.model.BetEvaluation;
import com.valuebet.domain.model.BetLine;
import com.valuebet.domain.model.EvaluationStatus;
import com.valuebet.domain.model.ExchangeEvent;
import com.valuebet.domain.model.InterpreterSettings;
import com.valuebet.domain.model.MarketDefinition;
import com.valuebet.domain.model.ParsedBet;
import com.valuebet.domain.model.SavedBet;
import com.valuebet.domain.model.Team;
import com.valuebet.domain.model.ValueDecision;
import com.valuebet.domain.ports.EntityDirectory;
import com.valuebet.domain.ports.MarketDataProvider;
import com.valuebet.domain.ports.SavedBetRepository;
import com.valuebet.domain.service.BetLineParser;
import com.valuebet.domain.service.EventSelector;
import com.valuebet.domain.service.MarketPriceResolver;
import com.valuebet.domain.service.SavedLineFormatter;
import com.valuebet.domain.service.ValueClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Use case for pricing a bet on the exchange and deciding whether it is value.
 */
@Service
public class EvaluateBetUseCase {

    private static final Logger logger = LoggerFactory.getLogger(EvaluateBetUseCase.class);

    private final InterpretBetUseCase interpretBetUseCase;
    private final BetLineParser betLineParser;
    private final EntityDirectory directory;
    private final MarketDataProvider marketData;
    private final EventSelector eventSelector;
    private final MarketPriceResolver priceResolver;
    private final ValueClassifier valueClassifier;
    private final SavedLineFormatter lineFormatter;
    private final SavedBetRepository savedBetRepository;
    private final InterpreterSettings settings;

    public EvaluateBetUseCase(
            InterpretBetUseCase interpretBetUseCase,
            BetLineParser betLineParser,
            EntityDirectory directory,
            MarketDataProvider marketData,
            EventSelector eventSelector,
            MarketPriceResolver priceResolver,
            ValueClassifier valueClassifier,
            SavedLineFormatter lineFormatter,
            SavedBetRepository savedBetRepository,
            InterpreterSettings settings) {
        this.interpretBetUseCase = interpretBetUseCase;
        this.betLineParser = betLineParser;
        this.directory = directory;
        this.marketData = marketData;
        this.eventSelector = eventSelector;
        this.priceResolver = priceResolver;
        this.valueClassifier = valueClassifier;
        this.lineFormatter = lineFormatter;
        this.savedBetRepository = savedBetRepository;
        this.settings = settings;
    }

    /**
     * Parses a user line, prices it and optionally saves it when it is value.
     *
     * @param line  "bookmaker - sport - bet - odds" or free bet text
     * @param odds  odds to use when the line does not carry them
     * @param save  keep the bet if it turns out to be value
     * @throws IllegalArgumentException if no positive odds are available
     */
    public EvaluationReport execute(String line, Double odds, boolean save) {
        BetLine betLine = betLineParser.parse(line, odds);
        ParsedBet parsed = interpretBetUseCase.execute(betLine.betText());
        BetEvaluation evaluation = evaluate(parsed, betLine.odds());
        logger.info("Evaluation of '{}': {} {}", betLine.betText(), evaluation.status(), evaluation.message());

        String savedLine = null;
        if (save && evaluation.isPriced() && evaluation.decision().isWorthSaving()) {
            savedLine = saveBet(betLine, parsed, evaluation);
        }
        return new EvaluationReport(parsed, evaluation, savedLine);
    }

    /**
     * Prices every team of the bet in recognition order and multiplies the prices.
     * Stops at the first team without an event or without a price.
     */
    public BetEvaluation evaluate(ParsedBet parsed, double odds) {
        if (parsed.teams().isEmpty()) {
            return BetEvaluation.unpriced(EvaluationStatus.NO_TEAMS, "No teams recognized");
        }

        Map<String, Team> teams = directory.teams();
        Map<String, MarketDefinition> markets = directory.markets();
        Map<String, String> teamSports = teamSports(parsed, teams);

        List<String> identifiedMarkets = parsed.markets();
        if (identifiedMarkets.isEmpty()) {
            Set<String> sports = new HashSet<>(teamSports.values());
            if (sports.size() == 1) {
                String defaultMarket = settings.defaultMarketFor(sports.iterator().next());
                identifiedMarkets = List.of(defaultMarket);
                logger.debug("No markets identified, defaulting to '{}'", defaultMarket);
            }
        }

        Set<String> queriedEvents = new HashSet<>();
        List<Double> layPrices = new ArrayList<>();

        for (String team : parsed.teams()) {
            String sport = teamSports.get(team);
            List<String> compatibleMarkets = identifiedMarkets.stream()
                .filter(m -> markets.containsKey(m) && sport.equalsIgnoreCase(markets.get(m).sport()))
                .toList();
            if (compatibleMarkets.isEmpty()) {
                compatibleMarkets = List.of(settings.defaultMarketFor(sport));
                logger.debug("No compatible markets for {} ({}), using default {}", team, sport, compatibleMarkets);
            }

            List<ExchangeEvent> events = marketData.findEvents(team, settings.sportEventTypeId(sport));
            Optional<ExchangeEvent> bestEvent = eventSelector.pickBestEvent(events, team);
            if (bestEvent.isEmpty()) {
                logger.info("No suitable event found for team '{}', stopping", team);
                return BetEvaluation.unpriced(EvaluationStatus.NO_EVENT,
                    "No suitable event found for team '" + team + "'");
            }

            ExchangeEvent event = bestEvent.get();
            logger.info("Selected Event: '{}' (ID={}, Start={})", event.name(), event.id(), event.openDate());
            if (!queriedEvents.add(event.id())) {
                logger.info("Skipping duplicate match for event {}", event.id());
                continue;
            }

            Optional<Double> price = Optional.empty();
            for (String market : compatibleMarkets) {
                price = priceResolver.fetchBestLayPrice(event, team, market, sport, parsed.scores());
                if (price.isPresent()) {
                    logger.debug("Found lay price {} for team {} in market {}", price.get(), team, market);
                    break;
                }
            }

            if (price.isEmpty()) {
                logger.info("No lay price for {}/{}, stopping", team, compatibleMarkets.get(0));
                return BetEvaluation.unpriced(EvaluationStatus.NO_PRICE,
                    "Could not find a suitable lay price for " + team + "/" + compatibleMarkets.get(0));
            }
            layPrices.add(price.get());
        }

        double product = 1.0;
        for (double price : layPrices) {
            product *= price;
        }
        double displayPrice = BigDecimal.valueOf(product)
            .setScale(3, RoundingMode.HALF_EVEN)
            .setScale(2, RoundingMode.HALF_EVEN)
            .doubleValue();
        ValueDecision decision = valueClassifier.classify(product, odds);

        logger.info("Multiplied Lay Price: {} -> {}", displayPrice, decision);
        return new BetEvaluation(EvaluationStatus.PRICED, layPrices, product, displayPrice, decision,
            "Multiplied lay price " + displayPrice + " against odds " + odds);
    }

    public List<SavedBet> recentSavedBets(int limit) {
        return savedBetRepository.findRecent(limit);
    }

    private Map<String, String> teamSports(ParsedBet parsed, Map<String, Team> teams) {
        Map<String, String> sports = new LinkedHashMap<>();
        for (String team : parsed.teams()) {
            Team known = teams.get(team);
            String sport = known == null || known.sport() == null || known.sport().isBlank()
                ? InterpreterSettings.DEFAULT_SPORT
                : known.sport();
            sports.put(team, sport);
        }
        return sports;
    }

    private String saveBet(BetLine betLine, ParsedBet parsed, BetEvaluation evaluation) {
        if (betLine.bookmaker() == null || betLine.bookmaker().isBlank()) {
            logger.warn("Cannot save '{}' without a bookmaker, use 'bookmaker - sport - bet - odds'",
                betLine.betText());
            return null;
        }

        String sport = betLine.sport();
        if (sport == null || sport.isBlank()) {
            Set<String> sports = new LinkedHashSet<>(teamSports(parsed, directory.teams()).values());
            sport = sports.size() == 1 ? sports.iterator().next() : InterpreterSettings.DEFAULT_SPORT;
        }

        String line = lineFormatter.format(betLine.bookmaker(), sport, betLine.betText(), betLine.odds(),
            evaluation.displayPrice(), evaluation.decision());

        SavedBet bet = new SavedBet();
        bet.setLine(line);
        bet.setBookmaker(betLine.bookmaker());
        bet.setSport(sport.toLowerCase(Locale.ROOT));
        bet.setBetText(betLine.betText());
        bet.setOdds(betLine.odds());
        bet.setPrice(evaluation.displayPrice());
        bet.setDecision(evaluation.decision());
        bet.setSavedAt(Instant.now());

        try {
            savedBetRepository.save(bet);
            logger.info("Saved line: {}", line);
            return line;
        } catch (Exception e) {
            logger.error("Error saving bet '{}'", line, e);
            return null;
        }
    }

    public record EvaluationReport(
        ParsedBet parsed,
        BetEvaluation evaluation,
        String savedLine
    ) {}
}
