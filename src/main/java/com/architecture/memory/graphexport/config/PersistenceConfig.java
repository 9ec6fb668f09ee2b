package com.architecture.memory.graphexport.config;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Duration;

/**
 * Immutable settings for a single persistence run.
 */
@Value
@Builder(toBuilder = true)
public class PersistenceConfig {

    public static final int UNBOUNDED_DEPTH = -1;

    @NonNull
    String uri;

    @NonNull
    String username;

    @NonNull
    String password;

    @Builder.Default
    AutoIndexMode autoIndex = AutoIndexMode.UPDATE;

    @Builder.Default
    boolean verifyConnection = true;

    @Builder.Default
    int saveDepth = UNBOUNDED_DEPTH;

    @Builder.Default
    boolean purgeBeforeWrite = true;

    @Builder.Default
    int batchSize = 1000;

    @Builder.Default
    RetryPolicy retry = RetryPolicy.builder().build();

    public static PersistenceConfig from(GraphExportProperties properties) {
        GraphExportProperties.Neo4j neo4j = properties.getNeo4j();
        return PersistenceConfig.builder()
                .uri(neo4j.getUri())
                .username(neo4j.getUsername())
                .password(neo4j.getPassword())
                .autoIndex(neo4j.getAutoIndex())
                .verifyConnection(neo4j.isVerifyConnection())
                .saveDepth(properties.getSaveDepth())
                .purgeBeforeWrite(properties.isPurgeBeforeWrite())
                .batchSize(properties.getBatchSize())
                .retry(RetryPolicy.builder()
                        .maxAttempts(properties.getRetry().getMaxAttempts())
                        .delay(properties.getRetry().getDelay())
                        .build())
                .build();
    }

    public boolean isDepthUnbounded() {
        return saveDepth == UNBOUNDED_DEPTH;
    }

    @Value
    @Builder
    public static class RetryPolicy {

        @Builder.Default
        int maxAttempts = 10;

        @Builder.Default
        Duration delay = Duration.ofSeconds(2);
    }
}
