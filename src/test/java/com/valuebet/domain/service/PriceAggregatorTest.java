package com.valuebet.domain.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PriceAggregator.
 */
class PriceAggregatorTest {

    private final PriceAggregator aggregator = new PriceAggregator();

    @Test
    void testSinglePriceIsKept() {
        assertEquals(2.5, aggregator.combine(List.of(2.5)).orElseThrow());
    }

    @Test
    void testExactCombinationIsNotRoundedUp() {
        assertEquals(1.2, aggregator.combine(List.of(2.0, 3.0)).orElseThrow());
        assertEquals(4.0, aggregator.combine(List.of(6.0, 12.0)).orElseThrow());
        assertEquals(1.5, aggregator.combine(List.of(3.0, 3.0)).orElseThrow());
    }

    @Test
    void testCombinationRoundsUp() {
        // 1 / (1/2.1 + 1/3.7) = 1.3396...
        assertEquals(1.4, aggregator.combine(List.of(2.1, 3.7)).orElseThrow());
    }

    @Test
    void testNoPrices() {
        assertTrue(aggregator.combine(List.of()).isEmpty());
        assertTrue(aggregator.combine(null).isEmpty());
    }
}
