package com.valuebet.domain.model;

/**
 * A single selectable outcome inside a market.
 */
public record Runner(long selectionId, String name) {}
