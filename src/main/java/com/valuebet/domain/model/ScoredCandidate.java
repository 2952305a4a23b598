package com.valuebet.domain.model;

/**
 * Transient candidate used while ranking events, markets or runners.
 */
public record ScoredCandidate<T, K extends Comparable<? super K>>(T candidate, int score, K tieBreak) {}
