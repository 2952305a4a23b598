package com.valuebet.domain.service;

import com.valuebet.domain.model.ExchangeEvent;
import com.valuebet.domain.model.ScoredCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks the event that best matches a team, preferring the earliest kick-off among equal scores.
 */
public class EventSelector {

    private static final Logger logger = LoggerFactory.getLogger(EventSelector.class);

    private static final Comparator<ScoredCandidate<ExchangeEvent, Instant>> BEST_FIRST =
        Comparator.comparingInt((ScoredCandidate<ExchangeEvent, Instant> c) -> c.score()).reversed()
            .thenComparing(c -> c.tieBreak(), Comparator.nullsLast(Comparator.<Instant>naturalOrder()));

    public Optional<ExchangeEvent> pickBestEvent(List<ExchangeEvent> events, String teamName) {
        if (events == null || events.isEmpty()) {
            logger.debug("No events to pick from for team '{}'", teamName);
            return Optional.empty();
        }

        ScoredCandidate<ExchangeEvent, Instant> best = events.stream()
            .map(e -> new ScoredCandidate<>(e, TeamNameScorer.scoreEvent(e.name(), teamName), e.openDate()))
            .min(BEST_FIRST)
            .orElseThrow();

        if (best.score() < 1) {
            logger.debug("No event scored above 1 for team '{}'", teamName);
            return Optional.empty();
        }
        logger.debug("Best event for '{}': '{}' (score {})", teamName, best.candidate().name(), best.score());
        return Optional.of(best.candidate());
    }
}
