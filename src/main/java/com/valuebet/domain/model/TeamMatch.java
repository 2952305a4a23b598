package com.valuebet.domain.model;

/**
 * A team found in free text together with the surface text that matched it.
 */
public record TeamMatch(String canonicalName, String matchedText) {}
