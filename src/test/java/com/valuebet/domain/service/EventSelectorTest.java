package com.valuebet.domain.service;

import com.valuebet.domain.model.ExchangeEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EventSelector.
 */
class EventSelectorTest {

    private final EventSelector selector = new EventSelector();

    @Test
    void testBestScoreWins() {
        ExchangeEvent exact = new ExchangeEvent("1", "Chelsea v Arsenal", Instant.parse("2026-10-25T15:00:00Z"));
        ExchangeEvent prefix = new ExchangeEvent("2", "Chelsea Women v Arsenal Women",
            Instant.parse("2026-10-20T15:00:00Z"));

        assertEquals(exact, selector.pickBestEvent(List.of(prefix, exact), "chelsea").orElseThrow());
    }

    @Test
    void testEarliestKickOffBreaksTies() {
        ExchangeEvent later = new ExchangeEvent("1", "Chelsea v Arsenal", Instant.parse("2026-10-25T15:00:00Z"));
        ExchangeEvent earlier = new ExchangeEvent("2", "Leeds v Chelsea", Instant.parse("2026-10-19T15:00:00Z"));

        assertEquals(earlier, selector.pickBestEvent(List.of(later, earlier), "chelsea").orElseThrow());
    }

    @Test
    void testMissingDateSortsLast() {
        ExchangeEvent undated = new ExchangeEvent("1", "Chelsea v Arsenal", null);
        ExchangeEvent dated = new ExchangeEvent("2", "Chelsea v Leeds", Instant.parse("2026-12-01T20:00:00Z"));

        assertEquals(dated, selector.pickBestEvent(List.of(undated, dated), "chelsea").orElseThrow());
    }

    @Test
    void testUnrelatedEventsAreRejected() {
        ExchangeEvent unrelated = new ExchangeEvent("1", "zzz v qqq", Instant.parse("2026-10-25T15:00:00Z"));

        assertTrue(selector.pickBestEvent(List.of(unrelated), "chelsea").isEmpty());
        assertTrue(selector.pickBestEvent(List.of(), "chelsea").isEmpty());
        assertTrue(selector.pickBestEvent(null, "chelsea").isEmpty());
    }
}
