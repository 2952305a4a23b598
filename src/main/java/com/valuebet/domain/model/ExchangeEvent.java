package com.valuebet.domain.model;

import java.time.Instant;

/**
 * Event listed on the exchange, e.g. "Chelsea v Arsenal".
 */
public record ExchangeEvent(String id, String name, Instant openDate) {}
