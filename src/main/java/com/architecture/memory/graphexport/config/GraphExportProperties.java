package com.architecture.memory.graphexport.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Export settings bound from the {@code graph-export} namespace in application.yml.
 *
 * <pre>
 * graph-export:
 *   save-depth: -1
 *   purge-before-write: true
 *   batch-size: 1000
 *   neo4j:
 *     uri: bolt://localhost
 *     username: neo4j
 *     password: password
 *     auto-index: update
 *     verify-connection: true
 *   retry:
 *     max-attempts: 10
 *     delay: 2s
 * </pre>
 *
 * Username, password and save depth can be overridden per run from the command line.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "graph-export")
public class GraphExportProperties {

    @Valid
    private Neo4j neo4j = new Neo4j();

    @Valid
    private Retry retry = new Retry();

    /**
     * Hops the writer follows from every saved node when linking relationships. -1 means no limit.
     */
    @Min(-1)
    private int saveDepth = -1;

    /**
     * Wipe the target database before writing. Destructive and on by default.
     */
    private boolean purgeBeforeWrite = true;

    /**
     * Rows per UNWIND statement.
     */
    @Min(1)
    private int batchSize = 1000;

    @Data
    public static class Neo4j {

        @NotBlank
        private String uri = "bolt://localhost";

        @NotBlank
        private String username = "neo4j";

        @NotNull
        private String password = "password";

        @NotNull
        private AutoIndexMode autoIndex = AutoIndexMode.UPDATE;

        private boolean verifyConnection = true;
    }

    @Data
    public static class Retry {

        /**
         * Connection attempts before giving up.
         */
        @Min(1)
        private int maxAttempts = 10;

        /**
         * Fixed pause between two connection attempts.
         */
        @NotNull
        private Duration delay = Duration.ofSeconds(2);
    }
}
