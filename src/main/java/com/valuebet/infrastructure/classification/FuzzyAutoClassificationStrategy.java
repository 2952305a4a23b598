package com.valuebet.infrastructure.classification;

import com.valuebet.domain.model.ClassificationResult;
import com.valuebet.domain.model.EntityKind;
import com.valuebet.domain.model.MarketDefinition;
import com.valuebet.domain.model.Team;
import com.valuebet.domain.ports.ClassificationStrategy;
import com.valuebet.domain.ports.EntityDirectory;
import com.valuebet.domain.service.ClosestAliasFinder;
import com.valuebet.domain.service.Similarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Non-interactive classification: a token close enough to a known team or market becomes one
 * of its aliases. Anything else is ignored. New entities are never created since their sport
 * cannot be inferred from a token.
 */
public class FuzzyAutoClassificationStrategy implements ClassificationStrategy {

    private static final Logger logger = LoggerFactory.getLogger(FuzzyAutoClassificationStrategy.class);

    private final ClosestAliasFinder closestAliasFinder;
    private final int autoAcceptThreshold;

    public FuzzyAutoClassificationStrategy(ClosestAliasFinder closestAliasFinder, int autoAcceptThreshold) {
        this.closestAliasFinder = closestAliasFinder;
        this.autoAcceptThreshold = autoAcceptThreshold;
    }

    @Override
    public ClassificationResult classify(String token, EntityDirectory directory) {
        String alias = token == null ? "" : token.toLowerCase(Locale.ROOT).trim();
        if (alias.isEmpty()) {
            return ClassificationResult.ignore();
        }

        List<String> suggestions = closestAliasFinder.closest(alias, directory.teams().values());
        if (!suggestions.isEmpty()) {
            String best = suggestions.get(0);
            int score = Similarity.ratio(alias, best);
            Optional<String> team = findTeamByAlias(best, directory);
            logger.debug("Closest team matches for '{}': {} (best score {})", alias, suggestions, score);
            if (team.isPresent() && score >= autoAcceptThreshold) {
                directory.addAlias(EntityKind.TEAM, team.get(), alias);
                return new ClassificationResult.ExistingEntity(EntityKind.TEAM, team.get());
            }
        }

        Optional<String> market = closestMarket(alias, directory);
        if (market.isPresent()) {
            directory.addAlias(EntityKind.MARKET, market.get(), alias);
            return new ClassificationResult.ExistingEntity(EntityKind.MARKET, market.get());
        }

        logger.debug("No entity close enough to '{}', ignoring it", alias);
        return ClassificationResult.ignore();
    }

    private Optional<String> closestMarket(String alias, EntityDirectory directory) {
        String bestMarket = null;
        int bestScore = -1;
        for (MarketDefinition market : directory.markets().values()) {
            int score = Similarity.ratio(alias, market.name().toLowerCase(Locale.ROOT));
            for (String a : market.aliases()) {
                score = Math.max(score, Similarity.ratio(alias, a.toLowerCase(Locale.ROOT).trim()));
            }
            if (score > bestScore) {
                bestScore = score;
                bestMarket = market.name();
            }
        }
        if (bestMarket == null || bestScore < autoAcceptThreshold) {
            return Optional.empty();
        }
        logger.debug("Closest market for '{}': '{}' (score {})", alias, bestMarket, bestScore);
        return Optional.of(bestMarket);
    }

    private static Optional<String> findTeamByAlias(String alias, EntityDirectory directory) {
        for (Team team : directory.teams().values()) {
            if (team.name().equalsIgnoreCase(alias)
                    || team.aliases().stream().anyMatch(a -> a.trim().equalsIgnoreCase(alias))) {
                return Optional.of(team.name());
            }
        }
        return Optional.empty();
    }
}
