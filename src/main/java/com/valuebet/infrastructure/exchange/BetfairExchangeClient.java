package com.valuebet.infrastructure.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.valuebet.domain.model.ExchangeEvent;
import com.valuebet.domain.model.MarketCatalogue;
import com.valuebet.domain.model.Runner;
import com.valuebet.domain.ports.MarketDataProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Betfair Exchange JSON-RPC adapter for the market data port.
 *
 * Needs a pre-issued session token and an application key. Without them every query
 * returns an empty result.
 */
@Component
public class BetfairExchangeClient implements MarketDataProvider {

    private static final Logger logger = LoggerFactory.getLogger(BetfairExchangeClient.class);

    static final String LIST_EVENTS = "SportsAPING/v1.0/listEvents";
    static final String LIST_MARKET_CATALOGUE = "SportsAPING/v1.0/listMarketCatalogue";
    static final String LIST_MARKET_BOOK = "SportsAPING/v1.0/listMarketBook";
    private static final int MAX_CATALOGUE_RESULTS = 100;

    private final String rpcBaseUrl;
    private final String appKey;
    private final String sessionToken;

    public BetfairExchangeClient(
            @Value("${betfair.rpc.base-url:https://api.betfair.com/exchange/betting/json-rpc/v1}") String rpcBaseUrl,
            @Value("${betfair.app-key:}") String appKey,
            @Value("${betfair.session-token:}") String sessionToken) {
        this.rpcBaseUrl = rpcBaseUrl;
        this.appKey = appKey == null ? "" : appKey;
        this.sessionToken = sessionToken == null ? "" : sessionToken;
    }

    public boolean isEnabled() {
        return !appKey.isBlank() && !sessionToken.isBlank();
    }

    @Override
    public List<ExchangeEvent> findEvents(String teamQuery, String sportId) {
        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put("eventTypeIds", List.of(sportId));
        filter.put("textQuery", teamQuery);

        Optional<JsonNode> result = call(LIST_EVENTS, Map.of("filter", filter));
        List<ExchangeEvent> events = result.map(BetfairExchangeClient::parseEvents).orElse(List.of());
        if (events.isEmpty()) {
            logger.debug("No events found for team '{}' and sport id '{}'", teamQuery, sportId);
        }
        return events;
    }

    @Override
    public List<MarketCatalogue> listMarketCatalogue(String eventId, List<String> typeCodes) {
        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put("eventIds", List.of(eventId));
        filter.put("marketTypeCodes", typeCodes);

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("filter", filter);
        params.put("maxResults", MAX_CATALOGUE_RESULTS);
        params.put("marketProjection", List.of("RUNNER_DESCRIPTION", "MARKET_START_TIME"));

        Optional<JsonNode> result = call(LIST_MARKET_CATALOGUE, params);
        List<MarketCatalogue> catalogues = result.map(BetfairExchangeClient::parseCatalogues).orElse(List.of());
        if (catalogues.isEmpty()) {
            logger.debug("No market catalogues for event {} and types {}", eventId, typeCodes);
        }
        for (MarketCatalogue catalogue : catalogues) {
            logger.debug("  MarketName='{}', MarketId={}, StartTime={}", catalogue.marketName(),
                catalogue.marketId(), catalogue.startTime());
        }
        return catalogues;
    }

    @Override
    public Optional<Double> bestLayPrice(String marketId, long selectionId) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("marketIds", List.of(marketId));
        params.put("priceProjection", Map.of("priceData", List.of("EX_BEST_OFFERS")));

        Optional<Double> price = call(LIST_MARKET_BOOK, params)
            .flatMap(result -> parseBestLayPrice(result, selectionId));
        if (price.isEmpty()) {
            logger.debug("No lay price found for runner {} in market {}", selectionId, marketId);
        }
        return price;
    }

    /**
     * Sends one JSON-RPC request and returns its "result" node.
     */
    Optional<JsonNode> call(String method, Map<String, Object> params) {
        if (!isEnabled()) {
            logger.warn("Betfair API disabled. appKeyPresent={}, sessionTokenPresent={}", !appKey.isBlank(),
                !sessionToken.isBlank());
            return Optional.empty();
        }

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", "2.0");
        request.put("method", method);
        request.put("params", params);
        request.put("id", 1);

        try {
            JsonNode response = send(List.of(request));
            return extractResult(response, method);
        } catch (IOException e) {
            logger.warn("Betfair {} failed: {}", method, e.getMessage());
            return Optional.empty();
        }
    }

    JsonNode send(Object body) throws IOException {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-Application", appKey);
        headers.put("X-Authentication", sessionToken);
        headers.put("Accept", "application/json");
        return HttpClientUtil.postJson(rpcBaseUrl, body, headers);
    }

    static Optional<JsonNode> extractResult(JsonNode response, String method) {
        if (response == null) {
            return Optional.empty();
        }
        JsonNode first = response.isArray() ? response.path(0) : response;
        if (first.has("error")) {
            logger.error("Betfair {} returned error: {}", method, first.get("error"));
            return Optional.empty();
        }
        JsonNode result = first.get("result");
        return result == null || result.isNull() ? Optional.empty() : Optional.of(result);
    }

    static List<ExchangeEvent> parseEvents(JsonNode result) {
        List<ExchangeEvent> events = new ArrayList<>();
        for (JsonNode item : result) {
            JsonNode event = item.path("event");
            String id = event.path("id").asText(null);
            if (id == null) {
                continue;
            }
            String name = event.hasNonNull("name") ? event.get("name").asText() : event.path("eventName").asText("");
            events.add(new ExchangeEvent(id, name, parseInstant(event.path("openDate").asText(null))));
        }
        return events;
    }

    static List<MarketCatalogue> parseCatalogues(JsonNode result) {
        List<MarketCatalogue> catalogues = new ArrayList<>();
        for (JsonNode market : result) {
            String marketId = market.path("marketId").asText(null);
            if (marketId == null) {
                continue;
            }
            List<Runner> runners = new ArrayList<>();
            for (JsonNode runner : market.path("runners")) {
                runners.add(new Runner(runner.path("selectionId").asLong(), runner.path("runnerName").asText("")));
            }
            catalogues.add(new MarketCatalogue(marketId, market.path("marketName").asText(""),
                parseInstant(market.path("marketStartTime").asText(null)), runners));
        }
        return catalogues;
    }

    static Optional<Double> parseBestLayPrice(JsonNode result, long selectionId) {
        JsonNode book = result.path(0);
        for (JsonNode runner : book.path("runners")) {
            if (runner.path("selectionId").asLong() != selectionId) {
                continue;
            }
            JsonNode layOffers = runner.path("ex").path("availableToLay");
            JsonNode price = layOffers.path(0).path("price");
            if (price.isNumber() && price.asDouble() > 0) {
                return Optional.of(price.asDouble());
            }
        }
        return Optional.empty();
    }

    private static Instant parseInstant(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            logger.debug("Unparseable date '{}'", text);
            return null;
        }
    }
}
