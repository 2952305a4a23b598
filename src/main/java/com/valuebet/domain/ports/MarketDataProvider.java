package com.valuebet.domain.ports;

import com.valuebet.domain.model.ExchangeEvent;
import com.valuebet.domain.model.MarketCatalogue;

import java.util.List;
import java.util.Optional;

/**
 * Port for reading events, markets and prices from a betting exchange.
 * Absent data is reported as an empty result, never as an exception.
 */
public interface MarketDataProvider {

    /**
     * Finds events whose name matches a free-text team query.
     *
     * @param teamQuery team name to search for
     * @param sportId   exchange event type id (e.g. "1" for football)
     */
    List<ExchangeEvent> findEvents(String teamQuery, String sportId);

    /**
     * Lists market catalogues of one event restricted to the given market type codes.
     */
    List<MarketCatalogue> listMarketCatalogue(String eventId, List<String> typeCodes);

    /**
     * Best price available to lay for one runner.
     */
    Optional<Double> bestLayPrice(String marketId, long selectionId);
}
