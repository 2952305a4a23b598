package com.valuebet.infrastructure.config;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * MongoDB configuration.
 */
@Configuration
public class MongoConfig {

    @Value("${mongodb.uri:mongodb://localhost:27017/?connectTimeoutMS=5000&serverSelectionTimeoutMS=5000}")
    private String mongoUri;

    @Bean
    public MongoClient mongoClient() {
        ConnectionString connectionString = new ConnectionString(mongoUri);
        MongoClientSettings settings = MongoClientSettings.builder()
            .applyConnectionString(connectionString)
            .build();
        return MongoClients.create(settings);
    }

    @Bean
    public String savedBetsCollectionName(@Value("${mongodb.saved-bets-collection:savedBets}") String collection) {
        return collection;
    }
}
