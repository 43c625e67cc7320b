package com.vocabgraph.wordgraph.config;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.AbstractMongoClientConfiguration;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

import java.util.concurrent.TimeUnit;

/**
 * MongoDB client for the word, relation and relation type collections.
 * One pooled client is shared by every request; pool and socket limits come from wordgraph.mongo.*.
 */
@Configuration
@EnableMongoRepositories(basePackages = "com.vocabgraph.wordgraph.repository")
@Slf4j
public class MongoConfig extends AbstractMongoClientConfiguration {

    @Value("${spring.data.mongodb.uri}")
    private String uri;

    @Value("${spring.data.mongodb.database}")
    private String database;

    @Value("${wordgraph.mongo.pool.max-size:50}")
    private int poolMaxSize;

    @Value("${wordgraph.mongo.pool.min-size:5}")
    private int poolMinSize;

    @Value("${wordgraph.mongo.pool.max-idle-seconds:60}")
    private long poolMaxIdleSeconds;

    @Value("${wordgraph.mongo.connect-timeout-seconds:10}")
    private long connectTimeoutSeconds;

    @Value("${wordgraph.mongo.read-timeout-seconds:10}")
    private long readTimeoutSeconds;

    @Override
    protected String getDatabaseName() {
        return database;
    }

    @Override
    protected boolean autoIndexCreation() {
        // Unique word and relation indexes are declared on the documents
        return true;
    }

    @Override
    public MongoClient mongoClient() {
        log.info("[Mongo Config] database: {}, pool: {}..{}, timeouts: connect {}s, read {}s",
                database, poolMinSize, poolMaxSize, connectTimeoutSeconds, readTimeoutSeconds);
        return MongoClients.create(clientSettings());
    }

    MongoClientSettings clientSettings() {
        return MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString(uri))
                .applyToConnectionPoolSettings(pool -> pool
                        .maxSize(poolMaxSize)
                        .minSize(poolMinSize)
                        .maxConnectionIdleTime(poolMaxIdleSeconds, TimeUnit.SECONDS))
                .applyToSocketSettings(socket -> socket
                        .connectTimeout(connectTimeoutSeconds, TimeUnit.SECONDS)
                        .readTimeout(readTimeoutSeconds, TimeUnit.SECONDS))
                .build();
    }

    @Bean
    public MongoTemplate mongoTemplate() {
        return new MongoTemplate(mongoClient(), getDatabaseName());
    }
}
