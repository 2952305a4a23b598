package com.valuebet.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Market catalogue entry for one event. {@code startTime} may be null.
 */
public record MarketCatalogue(String marketId, String marketName, Instant startTime, List<Runner> runners) {

    public MarketCatalogue {
        runners = runners == null ? List.of() : List.copyOf(runners);
    }
}
