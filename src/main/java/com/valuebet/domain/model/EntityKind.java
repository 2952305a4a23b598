package com.valuebet.domain.model;

/**
 * Kinds of canonical entities held by the entity directory.
 */
public enum EntityKind {
    TEAM,
    MARKET
}
