package com.valuebet.domain.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * Combines the prices of several mutually exclusive outcomes into one price.
 *
 * Example: [2.0, 3.0] -> 1 / (1/2 + 1/3) = 1.2
 */
public class PriceAggregator {

    private static final Logger logger = LoggerFactory.getLogger(PriceAggregator.class);

    /**
     * @return the combined price rounded up to one decimal, or empty if there is no price
     */
    public Optional<Double> combine(List<Double> prices) {
        if (prices == null || prices.isEmpty()) {
            logger.debug("No prices to combine");
            return Optional.empty();
        }

        double totalProbability = 0.0;
        for (double price : prices) {
            totalProbability += 1.0 / price;
        }
        double combined = 1.0 / totalProbability;

        // 1/(1/2 + 1/3) is 1.2000000000000002 in binary, which must not round up to 1.3
        BigDecimal rounded = BigDecimal.valueOf(combined)
            .setScale(6, RoundingMode.HALF_UP)
            .setScale(1, RoundingMode.CEILING);

        logger.debug("Prices: {}, total probability: {}, combined (rounded up): {}", prices, totalProbability,
            rounded);
        return Optional.of(rounded.doubleValue());
    }
}
