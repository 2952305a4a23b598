package com.valuebet.domain.service;

import com.valuebet.domain.model.MarketDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Extracts markets from the text left over after team removal by repeatedly fuzzy matching
 * the whole remainder against every known market alias and consuming the best one.
 */
public class MarketRecognizer {

    private static final Logger logger = LoggerFactory.getLogger(MarketRecognizer.class);

    private final int threshold;
    private final Set<String> fillerWords;

    /**
     * One alias of one market. The canonical name is always present as an alias of itself.
     */
    public record MarketAlias(String canonicalName, String rawAlias, String normalizedAlias) {}

    /**
     * @param markets        canonical markets in recognition order
     * @param leftoverTokens tokens nothing consumed, filler words removed
     * @param iterations     number of scoring rounds the loop ran
     */
    public record MarketReduction(List<String> markets, List<String> leftoverTokens, int iterations) {}

    public MarketRecognizer(int threshold, Set<String> fillerWords) {
        this.threshold = threshold;
        this.fillerWords = Set.copyOf(fillerWords);
    }

    public static List<MarketAlias> candidates(Collection<MarketDefinition> markets) {
        List<MarketAlias> candidates = new ArrayList<>();
        for (MarketDefinition market : markets) {
            List<String> aliases = new ArrayList<>(market.aliases());
            if (!aliases.contains(market.name())) {
                aliases.add(market.name());
            }
            for (String alias : aliases) {
                if (alias == null || alias.isBlank()) {
                    continue;
                }
                candidates.add(new MarketAlias(market.name(), alias, TextNormalizer.normalize(alias)));
            }
        }
        return candidates;
    }

    /**
     * Runs the reduction loop. Every round that does not stop consumes at least one token,
     * so the loop runs at most as many rounds as the input has tokens.
     */
    public MarketReduction reduce(String leftover, List<MarketAlias> candidates) {
        List<String> markets = new ArrayList<>();
        String remaining = leftover == null ? "" : TextNormalizer.collapseWhitespace(leftover);
        int iterations = 0;

        while (true) {
            if (remaining.isEmpty()) {
                logger.debug("Leftover empty, stopping market matching");
                break;
            }

            List<String> withoutFiller = withoutFiller(Arrays.asList(TextNormalizer.tokens(remaining)));
            if (withoutFiller.isEmpty()) {
                logger.debug("Only filler words left, stopping market matching");
                break;
            }
            remaining = String.join(" ", withoutFiller);
            String before = remaining;

            if (remaining.length() < 2) {
                logger.debug("Leftover '{}' too short to match", remaining);
                break;
            }

            iterations++;
            MarketAlias best = null;
            int bestScore = 0;
            for (MarketAlias candidate : candidates) {
                int score = Similarity.ratio(remaining, candidate.normalizedAlias());
                if (score > bestScore) {
                    bestScore = score;
                    best = candidate;
                }
            }

            if (best == null || bestScore < threshold) {
                logger.debug("Best market score {} below threshold {} for '{}'", bestScore, threshold, remaining);
                break;
            }

            logger.debug("Matched market '{}' via alias '{}' (score {})", best.canonicalName(), best.rawAlias(),
                bestScore);
            if (!markets.contains(best.canonicalName())) {
                markets.add(best.canonicalName());
            }
            remaining = String.join(" ", removeAlias(
                new ArrayList<>(Arrays.asList(TextNormalizer.tokens(remaining))),
                Arrays.asList(TextNormalizer.tokens(best.normalizedAlias()))));

            if (remaining.equals(before)) {
                logger.debug("Leftover '{}' unchanged after match, stopping", remaining);
                break;
            }
        }

        List<String> leftoverTokens = withoutFiller(Arrays.asList(TextNormalizer.tokens(remaining)));
        return new MarketReduction(List.copyOf(markets), List.copyOf(leftoverTokens), iterations);
    }

    /**
     * Removes the alias tokens as a contiguous run if present, otherwise one by one in any order.
     */
    static List<String> removeAlias(List<String> tokens, List<String> aliasTokens) {
        List<String> normalized = tokens.stream().map(TextNormalizer::normalize).toList();
        int start = findSequence(normalized, aliasTokens);
        if (start != -1) {
            List<String> result = new ArrayList<>(tokens.subList(0, start));
            result.addAll(tokens.subList(start + aliasTokens.size(), tokens.size()));
            return result;
        }

        List<String> pending = new ArrayList<>(aliasTokens);
        List<String> result = new ArrayList<>();
        for (String token : tokens) {
            if (!pending.remove(TextNormalizer.normalize(token))) {
                result.add(token);
            }
        }
        return result;
    }

    static int findSequence(List<String> haystack, List<String> needle) {
        if (needle.isEmpty()) {
            return -1;
        }
        for (int i = 0; i + needle.size() <= haystack.size(); i++) {
            if (haystack.subList(i, i + needle.size()).equals(needle)) {
                return i;
            }
        }
        return -1;
    }

    private List<String> withoutFiller(List<String> tokens) {
        return tokens.stream().filter(t -> !fillerWords.contains(t)).toList();
    }
}
