package com.valuebet.domain.model;

/**
 * What to do when two canonical entities share a normalized alias.
 */
public enum AliasConflictPolicy {
    /** Later entity wins, a warning is logged. */
    LAST_WINS,
    /** Earlier entity keeps the alias, a warning is logged. */
    FIRST_WINS,
    /** Building the alias map fails. */
    REJECT
}
