package com.valuebet.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.valuebet.domain.model.MarketDefinition;
import com.valuebet.domain.model.Team;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entity directory backed by teams.json and markets.json in a data directory.
 *
 * Missing or malformed files leave the directory empty. Every mutation rewrites both files.
 * Player lists attached to teams are not interpreted here but are written back unchanged.
 */
public class JsonFileEntityDirectory extends InMemoryEntityDirectory {

    private static final Logger logger = LoggerFactory.getLogger(JsonFileEntityDirectory.class);

    static final String TEAMS_FILE = "teams.json";
    static final String MARKETS_FILE = "markets.json";

    private final Path dataPath;
    private final ObjectMapper objectMapper;
    private final Map<String, List<String>> teamPlayers = new LinkedHashMap<>();

    public JsonFileEntityDirectory(Path dataPath, ObjectMapper objectMapper) {
        this.dataPath = dataPath;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        load();
    }

    private void load() {
        Map<String, TeamDocument> teamDocs = safeLoad(TEAMS_FILE,
            new TypeReference<LinkedHashMap<String, TeamDocument>>() {});
        Map<String, MarketDocument> marketDocs = safeLoad(MARKETS_FILE,
            new TypeReference<LinkedHashMap<String, MarketDocument>>() {});

        List<Team> loadedTeams = new ArrayList<>();
        teamDocs.forEach((name, doc) -> {
            if (doc == null) {
                return;
            }
            try {
                loadedTeams.add(new Team(name, doc.getSport(), withoutBlanks(doc.getAliases())));
                if (doc.getPlayers() != null && !doc.getPlayers().isEmpty()) {
                    teamPlayers.put(name, withoutBlanks(doc.getPlayers()));
                }
            } catch (RuntimeException e) {
                logger.error("Skipping team '{}' in {}: {}", name, TEAMS_FILE, e.getMessage());
            }
        });

        List<MarketDefinition> loadedMarkets = new ArrayList<>();
        marketDocs.forEach((name, doc) -> {
            if (doc == null) {
                return;
            }
            try {
                loadedMarkets.add(new MarketDefinition(name, doc.getSport(), withoutBlanks(doc.getAliases()),
                    withoutBlanks(doc.getTypes()), doc.getDescription()));
            } catch (RuntimeException e) {
                logger.error("Skipping market '{}' in {}: {}", name, MARKETS_FILE, e.getMessage());
            }
        });

        replaceContents(loadedTeams, loadedMarkets);
        logger.info("Data loaded from {}. Teams: {}, Markets: {}", dataPath, loadedTeams.size(),
            loadedMarkets.size());
    }

    private static List<String> withoutBlanks(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
            .filter(Objects::nonNull)
            .filter(value -> !value.isBlank())
            .toList();
    }

    private <T> Map<String, T> safeLoad(String fileName, TypeReference<LinkedHashMap<String, T>> type) {
        Path file = dataPath.resolve(fileName);
        if (!Files.exists(file)) {
            logger.warn("File {} not found at {}. Using empty data.", fileName, file);
            return Map.of();
        }
        try {
            Map<String, T> data = objectMapper.readValue(file.toFile(), type);
            logger.debug("Loaded {} items from {}", data == null ? 0 : data.size(), fileName);
            return data == null ? Map.of() : data;
        } catch (JsonProcessingException e) {
            logger.error("Error decoding JSON in file {}: {}", fileName, e.getOriginalMessage());
            return Map.of();
        } catch (IOException e) {
            logger.error("Unexpected error loading {}", fileName, e);
            return Map.of();
        }
    }

    @Override
    protected void onChange() {
        Map<String, TeamDocument> teamDocs = new LinkedHashMap<>();
        teams.values().forEach(team -> {
            TeamDocument doc = new TeamDocument();
            doc.setSport(team.sport());
            doc.setAliases(new ArrayList<>(team.aliases()));
            List<String> players = teamPlayers.get(team.name());
            if (players != null) {
                doc.setPlayers(new ArrayList<>(players));
            }
            teamDocs.put(team.name(), doc);
        });

        Map<String, MarketDocument> marketDocs = new LinkedHashMap<>();
        markets.values().forEach(market -> {
            MarketDocument doc = new MarketDocument();
            doc.setSport(market.sport());
            doc.setAliases(new ArrayList<>(market.aliases()));
            doc.setTypes(new ArrayList<>(market.typeCodes()));
            doc.setDescription(market.description());
            marketDocs.put(market.name(), doc);
        });

        safeSave(TEAMS_FILE, teamDocs);
        safeSave(MARKETS_FILE, marketDocs);
    }

    private void safeSave(String fileName, Map<String, ?> data) {
        Path file = dataPath.resolve(fileName);
        try {
            Files.createDirectories(dataPath);
            objectMapper.writeValue(file.toFile(), data);
            logger.debug("Saved {} items to {}", data.size(), fileName);
        } catch (IOException e) {
            logger.error("Failed to save {}", fileName, e);
        }
    }
}
