package com.valuebet.domain.service;

import com.valuebet.domain.model.TeamMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Finds teams in normalized bet text by greedy longest-match against the team aliases.
 */
public class TeamRecognizer {

    private static final Logger logger = LoggerFactory.getLogger(TeamRecognizer.class);

    private record Hit(int start, TeamMatch match) {}

    /**
     * Longer spans are tried first, so "real madrid" wins over "madrid" when both are known.
     * Matches never overlap and are returned in left-to-right order.
     */
    public List<TeamMatch> findTeams(String text, AliasDirectory teamAliases) {
        String[] rawTokens = TextNormalizer.tokens(text);
        String[] tokens = new String[rawTokens.length];
        for (int i = 0; i < rawTokens.length; i++) {
            tokens[i] = TextNormalizer.cleanToken(rawTokens[i]);
        }

        boolean[] used = new boolean[tokens.length];
        List<Hit> hits = new ArrayList<>();

        for (int length = tokens.length; length > 0; length--) {
            int i = 0;
            while (i + length <= tokens.length) {
                if (overlapsUsed(used, i, length)) {
                    i++;
                    continue;
                }
                String candidate = String.join(" ", Arrays.copyOfRange(tokens, i, i + length));
                Optional<String> canonical = teamAliases.canonicalOf(TextNormalizer.normalize(candidate));
                if (canonical.isPresent()) {
                    hits.add(new Hit(i, new TeamMatch(canonical.get(), candidate)));
                    for (int x = 0; x < length; x++) {
                        used[i + x] = true;
                    }
                    i += length;
                } else {
                    i++;
                }
            }
        }

        hits.sort(Comparator.comparingInt(Hit::start));
        List<TeamMatch> matches = hits.stream().map(Hit::match).toList();
        logger.debug("Teams found in '{}': {}", text, matches);
        return matches;
    }

    /**
     * Removes every matched surface text from the input as whole words and collapses the spaces left behind.
     */
    public String removeMatches(String text, List<TeamMatch> matches) {
        String leftover = text;
        for (TeamMatch match : matches) {
            if (match.matchedText().isBlank()) {
                continue;
            }
            Pattern pattern = Pattern.compile("\\b" + Pattern.quote(match.matchedText()) + "\\b",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS);
            leftover = pattern.matcher(leftover).replaceAll("");
        }
        return TextNormalizer.collapseWhitespace(leftover);
    }

    private static boolean overlapsUsed(boolean[] used, int start, int length) {
        for (int x = 0; x < length; x++) {
            if (used[start + x]) {
                return true;
            }
        }
        return false;
    }
}
