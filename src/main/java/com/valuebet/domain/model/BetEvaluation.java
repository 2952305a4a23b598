package com.valuebet.domain.model;

import java.util.List;

/**
 * Result of pricing a parsed bet against the exchange.
 *
 * @param layPrices     one price per priced team, in recognition order
 * @param combinedPrice product of the lay prices, null unless priced
 * @param displayPrice  combined price rounded to two decimals, null unless priced
 * @param decision      value decision, null unless priced
 * @param message       human readable explanation of the outcome
 */
public record BetEvaluation(
    EvaluationStatus status,
    List<Double> layPrices,
    Double combinedPrice,
    Double displayPrice,
    ValueDecision decision,
    String message
) {

    public BetEvaluation {
        layPrices = List.copyOf(layPrices);
    }

    public static BetEvaluation unpriced(EvaluationStatus status, String message) {
        return new BetEvaluation(status, List.of(), null, null, null, message);
    }

    public boolean isPriced() {
        return status == EvaluationStatus.PRICED;
    }
}
