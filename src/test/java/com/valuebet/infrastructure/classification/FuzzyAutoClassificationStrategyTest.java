package com.valuebet.infrastructure.classification;

import com.valuebet.domain.model.ClassificationResult;
import com.valuebet.domain.model.EntityKind;
import com.valuebet.domain.model.MarketDefinition;
import com.valuebet.domain.model.Team;
import com.valuebet.domain.service.ClosestAliasFinder;
import com.valuebet.infrastructure.persistence.InMemoryEntityDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FuzzyAutoClassificationStrategy.
 */
class FuzzyAutoClassificationStrategyTest {

    private InMemoryEntityDirectory directory;
    private FuzzyAutoClassificationStrategy strategy;

    @BeforeEach
    void setUp() {
        directory = new InMemoryEntityDirectory(
            List.of(
                new Team("manchester united", "football", List.of("man utd")),
                new Team("chelsea", "football", List.of())
            ),
            List.of(
                new MarketDefinition("match odds", "football", List.of("full time result"), List.of("MATCH_ODDS"),
                    null),
                new MarketDefinition("both teams to score", "football", List.of("btts"),
                    List.of("BOTH_TEAMS_TO_SCORE"), null)
            ));
        strategy = new FuzzyAutoClassificationStrategy(new ClosestAliasFinder(5, 60), 90);
    }

    @Test
    void testCloseTeamAliasIsLearned() {
        ClassificationResult result = strategy.classify("Man Utdd", directory);

        assertEquals(new ClassificationResult.ExistingEntity(EntityKind.TEAM, "manchester united"), result);
        assertTrue(directory.teams().get("manchester united").aliases().contains("man utdd"));
        assertEquals(1, directory.version());
    }

    @Test
    void testCloseMarketAliasIsLearned() {
        ClassificationResult result = strategy.classify("full time resul", directory);

        assertEquals(new ClassificationResult.ExistingEntity(EntityKind.MARKET, "match odds"), result);
        assertTrue(directory.markets().get("match odds").aliases().contains("full time resul"));
    }

    @Test
    void testSuggestionBelowThresholdIsIgnored() {
        ClassificationResult result = strategy.classify("chelsey", directory);

        assertInstanceOf(ClassificationResult.Ignore.class, result);
        assertEquals(0, directory.version());
    }

    @Test
    void testUnrelatedTokenIsIgnored() {
        assertInstanceOf(ClassificationResult.Ignore.class, strategy.classify("xyz", directory));
        assertInstanceOf(ClassificationResult.Ignore.class, strategy.classify("  ", directory));
        assertInstanceOf(ClassificationResult.Ignore.class, strategy.classify(null, directory));
        assertEquals(0, directory.version());
    }
}
