package com.valuebet.domain.model;

/**
 * One user-supplied bet line, either free text or "bookmaker - sport - bet - odds".
 * Bookmaker and sport are null unless the explicit format was used.
 */
public record BetLine(String bookmaker, String sport, String betText, double odds, boolean explicitFormat) {}
