package com.valuebet.domain.service;

import com.valuebet.domain.model.MarketCatalogue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Chooses a market among the catalogues returned for the requested type codes.
 * The exchange already filtered by type, so the first catalogue is taken.
 */
public class MarketSelector {

    private static final Logger logger = LoggerFactory.getLogger(MarketSelector.class);

    public Optional<MarketCatalogue> pickBestMarket(List<MarketCatalogue> catalogues, String desiredMarket) {
        if (catalogues == null || catalogues.isEmpty()) {
            logger.debug("No catalogues to pick from for '{}'", desiredMarket);
            return Optional.empty();
        }
        return Optional.of(catalogues.get(0));
    }
}
