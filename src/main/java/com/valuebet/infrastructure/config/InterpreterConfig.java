package com.valuebet.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.valuebet.domain.model.InterpreterSettings;
import com.valuebet.domain.ports.ClassificationStrategy;
import com.valuebet.domain.ports.EntityDirectory;
import com.valuebet.domain.ports.MarketDataProvider;
import com.valuebet.domain.service.BetLineParser;
import com.valuebet.domain.service.BetParser;
import com.valuebet.domain.service.ClosestAliasFinder;
import com.valuebet.domain.service.EventSelector;
import com.valuebet.domain.service.MarketPriceResolver;
import com.valuebet.domain.service.MarketSelector;
import com.valuebet.domain.service.MarketTypeMapper;
import com.valuebet.domain.service.MultipleMatchParser;
import com.valuebet.domain.service.PriceAggregator;
import com.valuebet.domain.service.RunnerSelector;
import com.valuebet.domain.service.SavedLineFormatter;
import com.valuebet.domain.service.UnknownEntityResolver;
import com.valuebet.domain.service.ValueClassifier;
import com.valuebet.infrastructure.classification.FuzzyAutoClassificationStrategy;
import com.valuebet.infrastructure.persistence.JsonFileEntityDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Wires the interpreter's domain services from the bound settings.
 */
@Configuration
@EnableConfigurationProperties(InterpreterProperties.class)
public class InterpreterConfig {

    private static final Logger logger = LoggerFactory.getLogger(InterpreterConfig.class);

    @Bean
    public InterpreterSettings interpreterSettings(InterpreterProperties properties) {
        InterpreterSettings settings = properties.toSettings();
        logger.info("Interpreter settings: fuzzyThreshold={}, aliasConflictPolicy={}, marketTypes={}",
            settings.fuzzyThreshold(), settings.aliasConflictPolicy(), settings.marketNameToTypes().size());
        return settings;
    }

    @Bean
    public EntityDirectory entityDirectory(InterpreterProperties properties, ObjectMapper objectMapper) {
        return new JsonFileEntityDirectory(Path.of(properties.getDataPath()), objectMapper);
    }

    @Bean
    public ClosestAliasFinder closestAliasFinder(InterpreterSettings settings) {
        return new ClosestAliasFinder(settings.closestAliasLimit(), settings.closestAliasCutoff());
    }

    @Bean
    public ClassificationStrategy classificationStrategy(ClosestAliasFinder finder, InterpreterSettings settings) {
        return new FuzzyAutoClassificationStrategy(finder, settings.autoAcceptThreshold());
    }

    @Bean
    public UnknownEntityResolver unknownEntityResolver(ClassificationStrategy strategy, InterpreterSettings settings) {
        return new UnknownEntityResolver(strategy, settings.maxClassificationAttempts());
    }

    @Bean
    public BetParser betParser(InterpreterSettings settings, UnknownEntityResolver resolver) {
        return new BetParser(settings, resolver);
    }

    @Bean
    public MultipleMatchParser multipleMatchParser() {
        return new MultipleMatchParser();
    }

    @Bean
    public BetLineParser betLineParser() {
        return new BetLineParser();
    }

    @Bean
    public EventSelector eventSelector() {
        return new EventSelector();
    }

    @Bean
    public MarketPriceResolver marketPriceResolver(MarketDataProvider marketData, InterpreterSettings settings) {
        return new MarketPriceResolver(marketData, new MarketTypeMapper(settings), new MarketSelector(),
            new RunnerSelector(), new PriceAggregator());
    }

    @Bean
    public ValueClassifier valueClassifier() {
        return new ValueClassifier();
    }

    @Bean
    public SavedLineFormatter savedLineFormatter() {
        return new SavedLineFormatter();
    }
}
