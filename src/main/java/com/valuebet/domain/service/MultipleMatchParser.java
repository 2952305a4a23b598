package com.valuebet.domain.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Handles accumulator input listing several fixtures, e.g.
 * "Ajax v Lazio (20:00) &amp; Rangers v Tottenham o2.5 goals".
 */
public class MultipleMatchParser {

    private static final Logger logger = LoggerFactory.getLogger(MultipleMatchParser.class);

    private static final Pattern KICK_OFF_TIME = Pattern.compile("\\(\\d{1,2}:\\d{2}\\)");
    private static final String FIXTURE_SEPARATOR = " v ";

    public enum Side { HOME, AWAY }

    /**
     * One side of every "A v B" segment. Segments are split on ',' and '&amp;'; segments
     * without " v " are ignored.
     */
    public List<String> teams(String input, Side side) {
        List<String> teams = new ArrayList<>();
        for (String segment : input.replace("&", ",").split(",")) {
            String fixture = KICK_OFF_TIME.matcher(segment).replaceAll("").trim();
            int separator = fixture.indexOf(FIXTURE_SEPARATOR);
            if (separator < 0) {
                if (!fixture.isEmpty()) {
                    logger.debug("No ' v ' in segment '{}', ignoring it", fixture);
                }
                continue;
            }
            String home = fixture.substring(0, separator).trim();
            String away = fixture.substring(separator + FIXTURE_SEPARATOR.length()).trim();
            teams.add(side == Side.HOME ? home : away);
        }
        logger.debug("{} teams from '{}': {}", side, input, teams);
        return teams;
    }

    public boolean isMultiple(String input) {
        String lower = input.toLowerCase(Locale.ROOT);
        return lower.split(FIXTURE_SEPARATOR, -1).length - 1 > 1;
    }

    /**
     * Rewrites a multi-fixture bet as the home teams followed by whatever text is not a team,
     * so each fixture is priced once through its home side.
     */
    public String simplify(String input) {
        List<String> home = teams(input, Side.HOME);
        List<String> away = teams(input, Side.AWAY);

        List<String> alternatives = new ArrayList<>();
        for (String team : home) {
            alternatives.add(Pattern.quote(team));
        }
        for (String team : away) {
            alternatives.add(Pattern.quote(team));
        }
        alternatives.add("\\bv\\b");
        Pattern pattern = Pattern.compile(String.join("|", alternatives), Pattern.CASE_INSENSITIVE);

        String leftover = KICK_OFF_TIME.matcher(input).replaceAll("");
        leftover = pattern.matcher(leftover).replaceAll("");
        leftover = leftover.replaceAll("^[\\s,]+|[\\s,]+$", "");

        String rebuilt = String.join(" ", home);
        if (!leftover.isEmpty()) {
            rebuilt += " " + leftover;
        }
        String simplified = preprocess(rebuilt);
        logger.debug("Simplified multiple matches '{}' to '{}'", input, simplified);
        return simplified;
    }

    /**
     * Lower-cases, turns ',' and '&amp;' into spaces and collapses whitespace.
     */
    public static String preprocess(String input) {
        String text = input.toLowerCase(Locale.ROOT).replace(",", " ").replace("&", " ");
        return TextNormalizer.collapseWhitespace(text);
    }
}
