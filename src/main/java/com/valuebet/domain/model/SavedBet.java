package com.valuebet.domain.model;

import java.time.Instant;

/**
 * A value bet the user chose to keep.
 */
public class SavedBet {

    /** Formatted line, e.g. "bet365 - Football - chelsea - 2.1 / 1.95". */
    private String line;

    private String bookmaker;
    private String sport;
    private String betText;
    private double odds;

    /** Exchange price the bet was judged against. */
    private double price;

    private ValueDecision decision;
    private Instant savedAt;

    public String getLine() {
        return line;
    }

    public void setLine(String line) {
        this.line = line;
    }

    public String getBookmaker() {
        return bookmaker;
    }

    public void setBookmaker(String bookmaker) {
        this.bookmaker = bookmaker;
    }

    public String getSport() {
        return sport;
    }

    public void setSport(String sport) {
        this.sport = sport;
    }

    public String getBetText() {
        return betText;
    }

    public void setBetText(String betText) {
        this.betText = betText;
    }

    public double getOdds() {
        return odds;
    }

    public void setOdds(double odds) {
        this.odds = odds;
    }

    public double getPrice() {
        return price;
    }

    public void setPrice(double price) {
        this.price = price;
    }

    public ValueDecision getDecision() {
        return decision;
    }

    public void setDecision(ValueDecision decision) {
        this.decision = decision;
    }

    public Instant getSavedAt() {
        return savedAt;
    }

    public void setSavedAt(Instant savedAt) {
        this.savedAt = savedAt;
    }
}
