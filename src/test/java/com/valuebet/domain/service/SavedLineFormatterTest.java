package com.valuebet.domain.service;

import com.valuebet.domain.model.ValueDecision;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SavedLineFormatter.
 */
class SavedLineFormatterTest {

    private final SavedLineFormatter formatter = new SavedLineFormatter();

    @Test
    void testValueLine() {
        assertEquals("bet365 - Football - chelsea to win - 2.0 / 1.9",
            formatter.format("bet365", "football", " chelsea to win ", 2.0, 1.9, ValueDecision.VALUE));
    }

    @Test
    void testTwoPercentLine() {
        assertEquals("williamhill - NBA - lakers - 1.95 / 1.97 2pc",
            formatter.format("williamhill", "nba", "lakers", 1.95, 1.97, ValueDecision.TWO_PERCENT));
    }

    @Test
    void testDisplaySport() {
        assertEquals("NFL", SavedLineFormatter.displaySport("NFL"));
        assertEquals("NHL", SavedLineFormatter.displaySport("nhl"));
        assertEquals("Tennis", SavedLineFormatter.displaySport("TENNIS"));
        assertEquals("", SavedLineFormatter.displaySport(""));
    }
}
