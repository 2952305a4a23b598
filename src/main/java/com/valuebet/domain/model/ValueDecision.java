package com.valuebet.domain.model;

/**
 * Outcome of comparing the exchange price with the bettor's price.
 */
public enum ValueDecision {
    NOT_VALUE("NOT VALUE"),
    TWO_PERCENT("2PC"),
    VALUE("VALUE");

    private final String label;

    ValueDecision(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isWorthSaving() {
        return this != NOT_VALUE;
    }

    @Override
    public String toString() {
        return label;
    }
}
