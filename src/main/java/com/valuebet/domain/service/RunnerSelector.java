package com.valuebet.domain.service;

import com.valuebet.domain.model.Runner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the runner of a market that represents the team's side of the bet.
 *
 * Market-specific rules are tried in order and fall through when they find nothing:
 * half-time/full-time, match odds, match odds and BTTS, match odds and over/under,
 * over/under style markets, win to nil, then a generic yes/over or closest-name fallback.
 */
public class RunnerSelector {

    private static final Logger logger = LoggerFactory.getLogger(RunnerSelector.class);

    private static final Pattern OVER_LINE = Pattern.compile("over\\s*([0-9]+\\.[0-9])\\s*goals");

    public Optional<Runner> pickBestRunner(
            List<Runner> runners,
            String teamName,
            List<String> marketTypes,
            String marketName,
            String eventName) {
        if (runners == null || runners.isEmpty()) {
            return Optional.empty();
        }
        String team = teamName.toLowerCase(Locale.ROOT).trim();
        Optional<TeamNameScorer.Sides> sides = TeamNameScorer.sides(eventName);
        boolean homeSide = TeamNameScorer.isHomeSide(eventName, teamName);

        if (marketTypes.contains("HALF_TIME_FULL_TIME")) {
            Optional<Runner> runner = halfTimeFullTime(runners, team, sides, homeSide);
            if (runner.isPresent()) {
                return runner;
            }
        }

        if (marketTypes.contains("MATCH_ODDS")) {
            Optional<Runner> exact = first(runners, name -> name.trim().equals(team));
            return exact.isPresent() ? exact : closestByName(runners, team);
        }

        if (marketTypes.contains("MATCH_ODDS_AND_BTTS")) {
            String desired = team + "/yes";
            Optional<Runner> runner = first(runners, name -> name.trim().equals(desired))
                .or(() -> first(runners, name -> name.contains(team) && (name.contains("yes") || name.contains("over"))));
            if (runner.isPresent()) {
                return runner;
            }
        }

        if (marketTypes.stream().anyMatch(t -> t.startsWith("MATCH_ODDS_AND_OU_"))) {
            Matcher matcher = OVER_LINE.matcher(marketName == null ? "" : marketName.toLowerCase(Locale.ROOT));
            Optional<Runner> runner = Optional.empty();
            if (matcher.find()) {
                String desired = team + "/over " + matcher.group(1);
                runner = first(runners, name -> name.trim().equals(desired));
            }
            runner = runner.or(() -> first(runners, name -> name.contains(team) && name.contains("over")));
            if (runner.isPresent()) {
                return runner;
            }
        }

        if (marketTypes.stream().anyMatch(RunnerSelector::isOverMarket)) {
            Optional<Runner> runner = first(runners, name -> name.contains("over"));
            if (runner.isPresent()) {
                return runner;
            }
        }

        if (marketTypes.contains("TEAM_A_WIN_TO_NIL") || marketTypes.contains("TEAM_B_WIN_TO_NIL")) {
            Optional<Runner> runner = first(runners, name -> name.trim().equals("yes"));
            if (runner.isPresent()) {
                return runner;
            }
        }

        Optional<Runner> yesOrOver = first(runners, name -> name.contains("yes") || name.contains("over"));
        if (yesOrOver.isPresent()) {
            return yesOrOver;
        }

        Optional<Runner> closest = closestByName(runners, team);
        if (closest.isEmpty()) {
            logger.debug("No runner matches team '{}' in market '{}'", teamName, marketName);
        }
        return closest;
    }

    private static boolean isOverMarket(String type) {
        String lower = type.toLowerCase(Locale.ROOT);
        return type.startsWith("OVER_UNDER_") || lower.contains("cornr") || lower.contains("first_half_goals");
    }

    private static Optional<Runner> halfTimeFullTime(
            List<Runner> runners,
            String team,
            Optional<TeamNameScorer.Sides> sides,
            boolean homeSide) {
        String home = sides.map(s -> s.home().toLowerCase(Locale.ROOT)).orElse(null);
        String away = sides.map(s -> s.away().toLowerCase(Locale.ROOT)).orElse(null);

        String teamSide = homeSide && home != null ? home : (away != null ? away : team);
        String otherSide = homeSide && away != null ? away : (home != null ? home : "");

        List<String> candidates = new ArrayList<>();
        candidates.add(teamSide + "/" + teamSide);
        candidates.add(teamSide + "/draw");
        candidates.add(teamSide + "/" + otherSide);
        candidates.add("draw/" + teamSide);
        candidates.add(otherSide + "/" + teamSide);

        for (String candidate : candidates) {
            if (candidate.startsWith("/") || candidate.endsWith("/")) {
                continue;
            }
            Optional<Runner> runner = first(runners, name -> name.trim().equals(candidate));
            if (runner.isPresent()) {
                return runner;
            }
        }
        return Optional.empty();
    }

    /**
     * First runner whose lower-cased name satisfies the predicate.
     */
    private static Optional<Runner> first(List<Runner> runners, Predicate<String> lowerCaseName) {
        return runners.stream()
            .filter(r -> lowerCaseName.test(r.name().toLowerCase(Locale.ROOT)))
            .findFirst();
    }

    /**
     * Highest similarity to the team, ties going to the earlier runner.
     */
    private static Optional<Runner> closestByName(List<Runner> runners, String team) {
        Runner best = null;
        int bestScore = -1;
        for (Runner runner : runners) {
            int score = Similarity.ratio(team, runner.name().toLowerCase(Locale.ROOT).trim());
            if (score > bestScore) {
                bestScore = score;
                best = runner;
            }
        }
        return Optional.ofNullable(best);
    }
}
