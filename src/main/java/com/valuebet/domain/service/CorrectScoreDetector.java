package com.valuebet.domain.service;

import com.valuebet.domain.model.Score;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks "H-A" score predictions out of the leftover tokens.
 */
public class CorrectScoreDetector {

    private static final Logger logger = LoggerFactory.getLogger(CorrectScoreDetector.class);

    private static final Pattern SCORE = Pattern.compile("(\\d{1,9})-(\\d{1,9})");

    /**
     * @param scores    scores in the order they appear
     * @param remaining tokens left once each score token was removed
     */
    public record Detection(List<Score> scores, List<String> remaining) {}

    public Detection detect(List<String> tokens) {
        List<Score> scores = new ArrayList<>();
        List<String> remaining = new ArrayList<>();
        for (String token : tokens) {
            Matcher matcher = SCORE.matcher(token);
            if (matcher.matches()) {
                scores.add(new Score(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2))));
            } else {
                remaining.add(token);
            }
        }

        if (!scores.isEmpty()) {
            logger.debug("Correct scores detected: {}", scores);
        }
        return new Detection(List.copyOf(scores), List.copyOf(remaining));
    }
}
