package com.valuebet.infrastructure.config;

import com.valuebet.domain.model.AliasConflictPolicy;
import com.valuebet.domain.model.InterpreterSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Interpreter settings bound from the "valuebet" prefix. Unset values keep the defaults
 * of {@link InterpreterSettings#defaults()}.
 */
@ConfigurationProperties(prefix = "valuebet")
public class InterpreterProperties {

    private static final InterpreterSettings DEFAULTS = InterpreterSettings.defaults();

    private String dataPath = "data";
    private int fuzzyThreshold = DEFAULTS.fuzzyThreshold();
    private Set<String> fillerWords = new LinkedHashSet<>(DEFAULTS.fillerWords());
    private Set<String> sportKeywords = new LinkedHashSet<>(DEFAULTS.sportKeywords());
    private Map<String, String> sportEventTypeIds = new LinkedHashMap<>(DEFAULTS.sportEventTypeIds());
    private Map<String, String> defaultMarketBySport = new LinkedHashMap<>(DEFAULTS.defaultMarketBySport());
    private String primarySport = DEFAULTS.primarySport();
    private String primaryFallbackType = DEFAULTS.primaryFallbackType();
    private String genericFallbackType = DEFAULTS.genericFallbackType();
    private AliasConflictPolicy aliasConflictPolicy = DEFAULTS.aliasConflictPolicy();
    private int maxClassificationAttempts = DEFAULTS.maxClassificationAttempts();
    private int maxReparses = DEFAULTS.maxReparses();
    private int autoAcceptThreshold = DEFAULTS.autoAcceptThreshold();
    private boolean classifyUnrecognized = DEFAULTS.classifyUnrecognized();
    private List<MarketTypeMapping> marketTypes = new ArrayList<>();

    /**
     * One row of the market name to type code table, e.g. "both teams to score" -> [BOTH_TEAMS_TO_SCORE].
     */
    public static class MarketTypeMapping {
        private String name;
        private List<String> codes = new ArrayList<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<String> getCodes() {
            return codes;
        }

        public void setCodes(List<String> codes) {
            this.codes = codes;
        }
    }

    public InterpreterSettings toSettings() {
        Map<String, List<String>> table = new LinkedHashMap<>(DEFAULTS.marketNameToTypes());
        for (MarketTypeMapping mapping : marketTypes) {
            if (mapping.getName() != null && !mapping.getName().isBlank()) {
                table.put(mapping.getName().trim().toLowerCase(Locale.ROOT), mapping.getCodes());
            }
        }
        return new InterpreterSettings(
            fuzzyThreshold,
            fillerWords,
            sportKeywords,
            sportEventTypeIds,
            table,
            defaultMarketBySport,
            primarySport,
            primaryFallbackType,
            genericFallbackType,
            DEFAULTS.defaultMatchResultMarket(),
            DEFAULTS.correctScoreMarket(),
            aliasConflictPolicy,
            maxClassificationAttempts,
            maxReparses,
            DEFAULTS.closestAliasLimit(),
            DEFAULTS.closestAliasCutoff(),
            autoAcceptThreshold,
            classifyUnrecognized
        );
    }

    public String getDataPath() {
        return dataPath;
    }

    public void setDataPath(String dataPath) {
        this.dataPath = dataPath;
    }

    public int getFuzzyThreshold() {
        return fuzzyThreshold;
    }

    public void setFuzzyThreshold(int fuzzyThreshold) {
        this.fuzzyThreshold = fuzzyThreshold;
    }

    public Set<String> getFillerWords() {
        return fillerWords;
    }

    public void setFillerWords(Set<String> fillerWords) {
        this.fillerWords = fillerWords;
    }

    public Set<String> getSportKeywords() {
        return sportKeywords;
    }

    public void setSportKeywords(Set<String> sportKeywords) {
        this.sportKeywords = sportKeywords;
    }

    public Map<String, String> getSportEventTypeIds() {
        return sportEventTypeIds;
    }

    public void setSportEventTypeIds(Map<String, String> sportEventTypeIds) {
        this.sportEventTypeIds = sportEventTypeIds;
    }

    public Map<String, String> getDefaultMarketBySport() {
        return defaultMarketBySport;
    }

    public void setDefaultMarketBySport(Map<String, String> defaultMarketBySport) {
        this.defaultMarketBySport = defaultMarketBySport;
    }

    public String getPrimarySport() {
        return primarySport;
    }

    public void setPrimarySport(String primarySport) {
        this.primarySport = primarySport;
    }

    public String getPrimaryFallbackType() {
        return primaryFallbackType;
    }

    public void setPrimaryFallbackType(String primaryFallbackType) {
        this.primaryFallbackType = primaryFallbackType;
    }

    public String getGenericFallbackType() {
        return genericFallbackType;
    }

    public void setGenericFallbackType(String genericFallbackType) {
        this.genericFallbackType = genericFallbackType;
    }

    public AliasConflictPolicy getAliasConflictPolicy() {
        return aliasConflictPolicy;
    }

    public void setAliasConflictPolicy(AliasConflictPolicy aliasConflictPolicy) {
        this.aliasConflictPolicy = aliasConflictPolicy;
    }

    public int getMaxClassificationAttempts() {
        return maxClassificationAttempts;
    }

    public void setMaxClassificationAttempts(int maxClassificationAttempts) {
        this.maxClassificationAttempts = maxClassificationAttempts;
    }

    public int getMaxReparses() {
        return maxReparses;
    }

    public void setMaxReparses(int maxReparses) {
        this.maxReparses = maxReparses;
    }

    public int getAutoAcceptThreshold() {
        return autoAcceptThreshold;
    }

    public void setAutoAcceptThreshold(int autoAcceptThreshold) {
        this.autoAcceptThreshold = autoAcceptThreshold;
    }

    public boolean isClassifyUnrecognized() {
        return classifyUnrecognized;
    }

    public void setClassifyUnrecognized(boolean classifyUnrecognized) {
        this.classifyUnrecognized = classifyUnrecognized;
    }

    public List<MarketTypeMapping> getMarketTypes() {
        return marketTypes;
    }

    public void setMarketTypes(List<MarketTypeMapping> marketTypes) {
        this.marketTypes = marketTypes;
    }
}
