package com.valuebet.application.usecase;

import com.valuebet.domain.model.InterpreterSettings;
import com.valuebet.domain.model.ParsedBet;
import com.valuebet.domain.ports.EntityDirectory;
import com.valuebet.domain.service.BetParser;
import com.valuebet.domain.service.MultipleMatchParser;
import com.valuebet.domain.service.UnknownEntityResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Use case for turning free bet text into a {@link ParsedBet}.
 */
@Service
public class InterpretBetUseCase {

    private static final Logger logger = LoggerFactory.getLogger(InterpretBetUseCase.class);

    private final BetParser betParser;
    private final UnknownEntityResolver resolver;
    private final MultipleMatchParser multipleMatchParser;
    private final EntityDirectory directory;
    private final InterpreterSettings settings;

    public InterpretBetUseCase(
            BetParser betParser,
            UnknownEntityResolver resolver,
            MultipleMatchParser multipleMatchParser,
            EntityDirectory directory,
            InterpreterSettings settings) {
        this.betParser = betParser;
        this.resolver = resolver;
        this.multipleMatchParser = multipleMatchParser;
        this.directory = directory;
        this.settings = settings;
    }

    /**
     * Parses the bet. Multi-fixture input is first reduced to its home teams. Leftover fragments
     * are offered to the classification strategy, and the bet is parsed again if that taught
     * the directory something new.
     */
    public ParsedBet execute(String betText) {
        String cleaned = multipleMatchParser.isMultiple(betText)
            ? multipleMatchParser.simplify(betText)
            : MultipleMatchParser.preprocess(betText);

        ParsedBet parsed = betParser.parse(cleaned, directory);
        logger.info("Parsed '{}': teams={}, markets={}, scores={}, unrecognized={}", betText, parsed.teams(),
            parsed.markets(), parsed.scores(), parsed.unrecognized());

        if (!settings.classifyUnrecognized() || parsed.unrecognized().isEmpty()) {
            return parsed;
        }

        long versionBefore = directory.version();
        for (String fragment : parsed.unrecognized()) {
            resolver.classify(fragment, directory);
        }

        if (directory.version() != versionBefore) {
            logger.info("Directory changed while classifying unrecognized text, re-parsing '{}'", betText);
            parsed = betParser.parse(cleaned, directory);
            logger.info("Re-parsed: teams={}, markets={}, scores={}, unrecognized={}", parsed.teams(),
                parsed.markets(), parsed.scores(), parsed.unrecognized());
        }
        return parsed;
    }
}
