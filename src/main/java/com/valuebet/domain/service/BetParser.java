package com.valuebet.domain.service;

import com.valuebet.domain.model.InterpreterSettings;
import com.valuebet.domain.model.MarketDefinition;
import com.valuebet.domain.model.ParsedBet;
import com.valuebet.domain.model.Team;
import com.valuebet.domain.model.TeamMatch;
import com.valuebet.domain.ports.EntityDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Turns free-text bet descriptions into teams, markets and correct scores.
 *
 * Example:
 *   "Manchester United v Chelsea match odds and over 2.5"
 *   -> teams [manchester united, chelsea], markets [match odds, over/under 2.5 goals]
 *
 * Alias maps are cached per directory version and rebuilt when the directory changes.
 */
public class BetParser {

    private static final Logger logger = LoggerFactory.getLogger(BetParser.class);

    private final InterpreterSettings settings;
    private final UnknownEntityResolver resolver;
    private final TeamRecognizer teamRecognizer = new TeamRecognizer();
    private final MarketRecognizer marketRecognizer;
    private final CorrectScoreDetector scoreDetector = new CorrectScoreDetector();

    private EntityDirectory cachedDirectory;
    private long cachedVersion = -1;
    private AliasDirectory teamAliases = AliasDirectory.empty();
    private AliasDirectory marketAliases = AliasDirectory.empty();
    private List<MarketRecognizer.MarketAlias> marketCandidates = List.of();

    public BetParser(InterpreterSettings settings, UnknownEntityResolver resolver) {
        this.settings = settings;
        this.resolver = resolver;
        this.marketRecognizer = new MarketRecognizer(settings.fuzzyThreshold(), settings.fillerWords());
    }

    /**
     * Parses a bet, starting over whenever resolving an unknown team changed the directory.
     */
    public synchronized ParsedBet parse(String input, EntityDirectory directory) {
        ParsedBet parsed = parseOnce(input, directory);
        int reparses = 0;
        while (directory.version() != cachedVersion && reparses < settings.maxReparses()) {
            reparses++;
            logger.debug("Directory changed while parsing, re-parsing ({}/{})", reparses, settings.maxReparses());
            parsed = parseOnce(input, directory);
        }
        return parsed;
    }

    private ParsedBet parseOnce(String input, EntityDirectory directory) {
        refresh(directory);
        Map<String, Team> teams = directory.teams();
        if (teams.isEmpty()) {
            logger.warn("No teams known. Parsing will continue but may fail to identify teams.");
        }
        if (marketCandidates.isEmpty()) {
            logger.warn("No markets known. Parsing may fail to identify markets.");
        }

        String text = TextNormalizer.fullyNormalize(input);
        logger.debug("Parsing '{}', normalized: '{}'", input, text);

        List<TeamMatch> teamMatches = teamRecognizer.findTeams(text, teamAliases);
        String leftover = teamRecognizer.removeMatches(text, teamMatches);
        logger.debug("After removing teams, leftover: '{}'", leftover);

        leftover = String.join(" ", Arrays.stream(TextNormalizer.tokens(leftover))
            .filter(token -> !settings.sportKeywords().contains(token))
            .toList());
        logger.debug("After removing sport keywords, leftover: '{}'", leftover);

        MarketRecognizer.MarketReduction reduction = marketRecognizer.reduce(leftover, marketCandidates);
        List<String> markets = new ArrayList<>(reduction.markets());
        List<String> leftoverTokens = new ArrayList<>(reduction.leftoverTokens());

        List<String> finalTeams = new ArrayList<>();
        for (TeamMatch match : teamMatches) {
            if (teams.containsKey(match.canonicalName())) {
                finalTeams.add(match.canonicalName());
            } else {
                logger.debug("Handling unknown team: {}", match.canonicalName());
                finalTeams.add(resolver.resolveTeam(match.canonicalName(), directory));
            }
        }

        if (markets.isEmpty() && !finalTeams.isEmpty() && leftoverTokens.contains("win")) {
            markets.add(settings.defaultMatchResultMarket());
            leftoverTokens.removeIf(token -> token.equals("win") || token.equals("to"));
        }

        CorrectScoreDetector.Detection detection = scoreDetector.detect(leftoverTokens);
        if (!detection.scores().isEmpty() && !markets.contains(settings.correctScoreMarket())) {
            markets.add(settings.correctScoreMarket());
        }

        List<String> unrecognized = detection.remaining().isEmpty()
            ? List.of()
            : List.of(String.join(" ", detection.remaining()));

        if (finalTeams.isEmpty() && markets.isEmpty()) {
            logger.warn("No teams or markets identified in '{}'", input);
        }

        ParsedBet parsed = new ParsedBet(finalTeams, markets, detection.scores(), unrecognized);
        logger.debug("Parse result: {}", parsed);
        return parsed;
    }

    public synchronized AliasDirectory teamAliases(EntityDirectory directory) {
        refresh(directory);
        return teamAliases;
    }

    public synchronized AliasDirectory marketAliases(EntityDirectory directory) {
        refresh(directory);
        return marketAliases;
    }

    private void refresh(EntityDirectory directory) {
        long version = directory.version();
        if (directory == cachedDirectory && version == cachedVersion) {
            return;
        }
        Map<String, Team> teams = directory.teams();
        Map<String, MarketDefinition> markets = directory.markets();
        teamAliases = AliasDirectory.build(teams.values(), Team::name, Team::aliases,
            settings.aliasConflictPolicy());
        marketAliases = AliasDirectory.build(markets.values(), MarketDefinition::name, MarketDefinition::aliases,
            settings.aliasConflictPolicy());
        marketCandidates = MarketRecognizer.candidates(markets.values());
        cachedDirectory = directory;
        cachedVersion = version;
        logger.debug("Alias maps rebuilt for directory version {}: {} team aliases, {} market aliases",
            version, teamAliases.size(), marketAliases.size());
    }
}
