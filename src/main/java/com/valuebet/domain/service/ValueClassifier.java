package com.valuebet.domain.service;

import com.valuebet.domain.model.ValueDecision;

/**
 * Compares the exchange price with the price the bettor was offered.
 */
public class ValueClassifier {

    static final double VALUE_FACTOR = 0.9999;
    static final double TWO_PERCENT_FACTOR = 1.0199;

    public ValueDecision classify(double exchangePrice, double offeredOdds) {
        if (exchangePrice < VALUE_FACTOR * offeredOdds) {
            return ValueDecision.VALUE;
        }
        if (exchangePrice <= TWO_PERCENT_FACTOR * offeredOdds) {
            return ValueDecision.TWO_PERCENT;
        }
        return ValueDecision.NOT_VALUE;
    }
}
