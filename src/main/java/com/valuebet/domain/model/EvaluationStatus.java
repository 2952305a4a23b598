package com.valuebet.domain.model;

public enum EvaluationStatus {
    PRICED,
    NO_TEAMS,
    NO_EVENT,
    NO_PRICE
}
