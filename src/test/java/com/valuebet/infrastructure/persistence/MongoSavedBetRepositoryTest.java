package com.valuebet.infrastructure.persistence;

import com.valuebet.domain.model.SavedBet;
import com.valuebet.domain.model.ValueDecision;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MongoSavedBetRepository document mapping.
 */
class MongoSavedBetRepositoryTest {

    @Test
    void testSavedAtIsStoredAsDate() {
        SavedBet bet = new SavedBet();
        bet.setLine("bet365 - Football - chelsea - 2.0 / 1.9");
        bet.setBookmaker("bet365");
        bet.setSport("football");
        bet.setBetText("chelsea");
        bet.setOdds(2.0);
        bet.setPrice(1.9);
        bet.setDecision(ValueDecision.VALUE);
        bet.setSavedAt(Instant.parse("2026-10-18T12:30:00Z"));

        Document doc = MongoSavedBetRepository.toDocument(bet);

        assertEquals(Date.from(Instant.parse("2026-10-18T12:30:00Z")), doc.get("savedAt"));
        assertEquals("VALUE", doc.get("decision"));
        assertEquals(1.9, doc.get("price"));
    }

    @Test
    void testFromDocument() {
        Document doc = new Document("_id", "65f0c0ffee")
            .append("line", "bet365 - NBA - lakers - 2.0 / 2.02 2pc")
            .append("bookmaker", "bet365")
            .append("sport", "nba")
            .append("betText", "lakers")
            .append("odds", 2.0)
            .append("price", 2.02)
            .append("decision", "TWO_PERCENT")
            .append("savedAt", Date.from(Instant.parse("2026-10-18T12:30:00Z")));

        SavedBet bet = MongoSavedBetRepository.fromDocument(doc);

        assertEquals("bet365 - NBA - lakers - 2.0 / 2.02 2pc", bet.getLine());
        assertEquals(ValueDecision.TWO_PERCENT, bet.getDecision());
        assertEquals(2.02, bet.getPrice());
        assertEquals(Instant.parse("2026-10-18T12:30:00Z"), bet.getSavedAt());
    }
}
