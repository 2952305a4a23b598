package com.valuebet.infrastructure.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.Sorts;
import com.valuebet.domain.model.SavedBet;
import com.valuebet.domain.ports.SavedBetRepository;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * MongoDB implementation of SavedBetRepository. One document per saved bet.
 */
@Repository
public class MongoSavedBetRepository implements SavedBetRepository {

    private static final Logger logger = LoggerFactory.getLogger(MongoSavedBetRepository.class);
    private static final ObjectMapper OBJECT_MAPPER;

    static {
        OBJECT_MAPPER = new ObjectMapper();
        OBJECT_MAPPER.registerModule(new JavaTimeModule());
        OBJECT_MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    private final MongoClient mongoClient;
    private final String databaseName;
    private final String collectionName;

    public MongoSavedBetRepository(
            MongoClient mongoClient,
            String savedBetsCollectionName,
            @Value("${mongodb.database:valuebet}") String databaseName) {
        this.mongoClient = mongoClient;
        this.databaseName = databaseName;
        this.collectionName = savedBetsCollectionName;

        initializeIndexes();
    }

    private void initializeIndexes() {
        try {
            collection().createIndex(Indexes.descending("savedAt"), new IndexOptions().background(true));
            logger.info("MongoDB indexes initialized for collection: {}", collectionName);
        } catch (Exception e) {
            logger.warn("Failed to create indexes (may already exist): {}", e.getMessage());
        }
    }

    @Override
    public void save(SavedBet bet) {
        collection().insertOne(toDocument(bet));
        logger.debug("Saved bet '{}'", bet.getLine());
    }

    @Override
    public List<SavedBet> findRecent(int limit) {
        List<SavedBet> bets = new ArrayList<>();
        for (Document doc : collection().find().sort(Sorts.descending("savedAt")).limit(Math.max(limit, 0))) {
            try {
                bets.add(fromDocument(doc));
            } catch (IllegalArgumentException e) {
                logger.error("Error converting document {} to saved bet", doc.get("_id"), e);
            }
        }
        return bets;
    }

    private MongoCollection<Document> collection() {
        return mongoClient.getDatabase(databaseName).getCollection(collectionName);
    }

    static Document toDocument(SavedBet bet) {
        @SuppressWarnings("unchecked")
        Map<String, Object> map = OBJECT_MAPPER.convertValue(bet, Map.class);
        Document doc = new Document(map);
        // stored as a BSON date so the savedAt index sorts chronologically
        if (bet.getSavedAt() != null) {
            doc.put("savedAt", Date.from(bet.getSavedAt()));
        }
        return doc;
    }

    static SavedBet fromDocument(Document doc) {
        Document copy = new Document(doc);
        copy.remove("_id");
        Object savedAt = copy.get("savedAt");
        if (savedAt instanceof Date date) {
            copy.put("savedAt", date.toInstant().toString());
        }
        return OBJECT_MAPPER.convertValue(copy, SavedBet.class);
    }
}
