package com.valuebet.domain.service;

import com.valuebet.domain.model.ClassificationResult;
import com.valuebet.domain.ports.ClassificationStrategy;
import com.valuebet.domain.ports.EntityDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Asks the classification strategy about a token the directory does not know,
 * re-asking on {@link ClassificationResult.Retry} up to a fixed number of attempts.
 */
public class UnknownEntityResolver {

    private static final Logger logger = LoggerFactory.getLogger(UnknownEntityResolver.class);

    private final ClassificationStrategy strategy;
    private final int maxAttempts;

    public UnknownEntityResolver(ClassificationStrategy strategy, int maxAttempts) {
        this.strategy = strategy;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    /**
     * @return the strategy's final answer, or Ignore once every attempt asked for a retry
     */
    public ClassificationResult classify(String token, EntityDirectory directory) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            ClassificationResult result = strategy.classify(token, directory);
            if (result instanceof ClassificationResult.Retry retry) {
                logger.debug("Classification of '{}' asked for retry ({}/{}): {}", token, attempt, maxAttempts,
                    retry.reason());
                continue;
            }
            logger.debug("Classification of '{}': {}", token, result);
            return result;
        }
        logger.warn("Giving up on classifying '{}' after {} attempts", token, maxAttempts);
        return ClassificationResult.ignore();
    }

    /**
     * Resolves an unknown team alias to a canonical name. Unresolved aliases come back lower-cased.
     */
    public String resolveTeam(String alias, EntityDirectory directory) {
        ClassificationResult result = classify(alias, directory);
        if (result instanceof ClassificationResult.ExistingEntity existing) {
            return existing.canonicalName();
        }
        if (result instanceof ClassificationResult.NewEntity created) {
            return created.canonicalName();
        }
        return alias.toLowerCase(Locale.ROOT).trim();
    }
}
