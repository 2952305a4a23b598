package com.valuebet.domain.service;

import com.valuebet.domain.model.ExchangeEvent;
import com.valuebet.domain.model.MarketCatalogue;
import com.valuebet.domain.model.Runner;
import com.valuebet.domain.model.Score;
import com.valuebet.domain.ports.MarketDataProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Finds the best lay price for one team in one market of an already selected event.
 */
public class MarketPriceResolver {

    private static final Logger logger = LoggerFactory.getLogger(MarketPriceResolver.class);

    static final String CORRECT_SCORE = "CORRECT_SCORE";

    private final MarketDataProvider marketData;
    private final MarketTypeMapper typeMapper;
    private final MarketSelector marketSelector;
    private final RunnerSelector runnerSelector;
    private final PriceAggregator priceAggregator;

    public MarketPriceResolver(
            MarketDataProvider marketData,
            MarketTypeMapper typeMapper,
            MarketSelector marketSelector,
            RunnerSelector runnerSelector,
            PriceAggregator priceAggregator) {
        this.marketData = marketData;
        this.typeMapper = typeMapper;
        this.marketSelector = marketSelector;
        this.runnerSelector = runnerSelector;
        this.priceAggregator = priceAggregator;
    }

    /**
     * @param scores correct-score predictions; only used when the market maps to CORRECT_SCORE
     * @return the lay price, or the combined price of all scores for a correct score market
     */
    public Optional<Double> fetchBestLayPrice(ExchangeEvent event, String team, String marketName, String sport,
                                              List<Score> scores) {
        List<String> marketTypes = marketTypesFor(event, team, marketName, sport);

        List<MarketCatalogue> catalogues = marketData.listMarketCatalogue(event.id(), marketTypes);
        if (catalogues.isEmpty()) {
            logger.info("No suitable market found for '{}' in event '{}'", marketName, event.name());
            return Optional.empty();
        }
        logger.debug("Found {} market catalogue(s) for event '{}'", catalogues.size(), event.name());

        Optional<MarketCatalogue> selected = marketSelector.pickBestMarket(catalogues, marketName);
        if (selected.isEmpty()) {
            return Optional.empty();
        }
        MarketCatalogue market = selected.get();
        logger.info("Selected Market: '{}' (ID={})", market.marketName(), market.marketId());

        if (market.runners().isEmpty()) {
            logger.debug("No runners in market {}", market.marketId());
            return Optional.empty();
        }

        if (marketTypes.contains(CORRECT_SCORE) && scores != null && !scores.isEmpty()) {
            return priceCorrectScores(market, event, team, scores);
        }

        Optional<Runner> runner = runnerSelector.pickBestRunner(market.runners(), team, marketTypes, marketName,
            event.name());
        if (runner.isEmpty()) {
            logger.debug("No suitable runner for team '{}' in market '{}'", team, marketName);
            return Optional.empty();
        }
        logger.info("Selected Runner: '{}' (SelectionId={})", runner.get().name(), runner.get().selectionId());

        Optional<Double> price = marketData.bestLayPrice(market.marketId(), runner.get().selectionId());
        if (price.isPresent()) {
            logger.info("Best Lay Price: {}", price.get());
        } else {
            logger.debug("No lay price for runner {}", runner.get().selectionId());
        }
        return price;
    }

    /**
     * Market type codes for a market name. "To win to nil" depends on which side the team is.
     */
    List<String> marketTypesFor(ExchangeEvent event, String team, String marketName, String sport) {
        String name = marketName == null ? "" : marketName.trim().toLowerCase(Locale.ROOT);
        if (MarketTypeMapper.TO_WIN_TO_NIL.equals(name)) {
            String code = TeamNameScorer.isHomeSide(event.name(), team) ? "TEAM_A_WIN_TO_NIL" : "TEAM_B_WIN_TO_NIL";
            return List.of(code);
        }
        return typeMapper.mapMarketNameToType(marketName, sport);
    }

    private Optional<Double> priceCorrectScores(MarketCatalogue market, ExchangeEvent event, String team,
                                                List<Score> scores) {
        boolean home = TeamNameScorer.isHomeSide(event.name(), team);
        List<Double> prices = new ArrayList<>();

        for (Score score : scores) {
            Score oriented = home ? score : score.swapped();
            String runnerName = oriented.runnerName();
            Optional<Runner> runner = market.runners().stream()
                .filter(r -> r.name().trim().equalsIgnoreCase(runnerName))
                .findFirst();
            if (runner.isEmpty()) {
                logger.info("No runner for score '{}' in correct score market", runnerName);
                continue;
            }

            logger.info("Selected Runner: '{}' (SelectionId={}) for score {}", runner.get().name(),
                runner.get().selectionId(), score);
            Optional<Double> price = marketData.bestLayPrice(market.marketId(), runner.get().selectionId());
            if (price.isPresent()) {
                logger.info("Best Lay Price for {}: {}", runnerName, price.get());
                prices.add(price.get());
            } else {
                logger.info("No lay price found for {}", runnerName);
            }
        }

        return priceAggregator.combine(prices);
    }
}
