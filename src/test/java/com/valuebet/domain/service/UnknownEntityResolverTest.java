package com.valuebet.domain.service;

import com.valuebet.domain.model.ClassificationResult;
import com.valuebet.domain.model.EntityKind;
import com.valuebet.domain.ports.ClassificationStrategy;
import com.valuebet.domain.ports.EntityDirectory;
import com.valuebet.infrastructure.persistence.InMemoryEntityDirectory;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for UnknownEntityResolver.
 */
class UnknownEntityResolverTest {

    private final EntityDirectory directory = new InMemoryEntityDirectory();

    @Test
    void testRetryIsBounded() {
        ScriptedStrategy strategy = new ScriptedStrategy();
        UnknownEntityResolver resolver = new UnknownEntityResolver(strategy, 3);

        ClassificationResult result = resolver.classify("Spurs", directory);

        assertInstanceOf(ClassificationResult.Ignore.class, result);
        assertEquals(3, strategy.calls);
    }

    @Test
    void testRetryThenAnswer() {
        ScriptedStrategy strategy = new ScriptedStrategy(
            new ClassificationResult.Retry("bad input"),
            new ClassificationResult.ExistingEntity(EntityKind.TEAM, "tottenham"));
        UnknownEntityResolver resolver = new UnknownEntityResolver(strategy, 3);

        assertEquals("tottenham", resolver.resolveTeam("Spurs", directory));
        assertEquals(2, strategy.calls);
    }

    @Test
    void testNewEntityName() {
        ScriptedStrategy strategy = new ScriptedStrategy(
            new ClassificationResult.NewEntity(EntityKind.TEAM, "brentford"));
        UnknownEntityResolver resolver = new UnknownEntityResolver(strategy, 3);

        assertEquals("brentford", resolver.resolveTeam("Bees", directory));
    }

    @Test
    void testUnresolvedAliasComesBackLowerCased() {
        UnknownEntityResolver resolver = new UnknownEntityResolver(new ScriptedStrategy(), 2);

        assertEquals("spurs", resolver.resolveTeam(" Spurs ", directory));
    }

    @Test
    void testAtLeastOneAttempt() {
        ScriptedStrategy strategy = new ScriptedStrategy(ClassificationResult.ignore());
        UnknownEntityResolver resolver = new UnknownEntityResolver(strategy, 0);

        assertInstanceOf(ClassificationResult.Ignore.class, resolver.classify("x", directory));
        assertEquals(1, strategy.calls);
    }

    /**
     * Answers from a script, then keeps asking for a retry.
     */
    private static class ScriptedStrategy implements ClassificationStrategy {

        private final Deque<ClassificationResult> answers;
        private int calls;

        ScriptedStrategy(ClassificationResult... answers) {
            this.answers = new ArrayDeque<>(List.of(answers));
        }

        @Override
        public ClassificationResult classify(String token, EntityDirectory directory) {
            calls++;
            ClassificationResult next = answers.poll();
            return next != null ? next : new ClassificationResult.Retry("no answer");
        }
    }
}
