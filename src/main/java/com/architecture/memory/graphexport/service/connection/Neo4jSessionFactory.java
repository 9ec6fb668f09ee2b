package com.architecture.memory.graphexport.service.connection;

import com.architecture.memory.graphexport.config.AutoIndexMode;
import com.architecture.memory.graphexport.config.PersistenceConfig;
import com.architecture.memory.graphexport.exception.GraphPersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Config;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Logging;
import org.neo4j.driver.Session;

import java.util.Map;

/**
 * Session factory backed by one Neo4j {@link Driver}.
 */
@Slf4j
public class Neo4jSessionFactory implements GraphSessionFactory {

    static final String CONSTRAINT_NAME = "code_node_id";

    static final String CREATE_CONSTRAINT =
            "CREATE CONSTRAINT " + CONSTRAINT_NAME + " IF NOT EXISTS FOR (n:Node) REQUIRE n.id IS UNIQUE";
    static final String DROP_CONSTRAINT = "DROP CONSTRAINT " + CONSTRAINT_NAME + " IF EXISTS";
    static final String FIND_CONSTRAINT =
            "SHOW CONSTRAINTS YIELD name WHERE name = $name RETURN count(*) AS found";

    private final Driver driver;
    private final int batchSize;

    Neo4jSessionFactory(Driver driver, int batchSize) {
        this.driver = driver;
        this.batchSize = batchSize;
    }

    /**
     * Creates the driver, verifies it can reach and authenticate against the database when
     * configured to, and applies the auto-index mode. The driver is closed again if any of
     * that fails.
     */
    public static Neo4jSessionFactory open(PersistenceConfig config) {
        Driver driver = GraphDatabase.driver(config.getUri(),
                AuthTokens.basic(config.getUsername(), config.getPassword()),
                Config.builder().withLogging(Logging.slf4j()).build());
        try {
            if (config.isVerifyConnection()) {
                driver.verifyConnectivity();
            }
            Neo4jSessionFactory factory = new Neo4jSessionFactory(driver, config.getBatchSize());
            factory.applyAutoIndex(config.getAutoIndex());
            return factory;
        } catch (RuntimeException ex) {
            driver.close();
            throw ex;
        }
    }

    @Override
    public GraphSession openSession() {
        return new Neo4jGraphSession(driver.session(), batchSize);
    }

    @Override
    public void close() {
        driver.close();
    }

    void applyAutoIndex(AutoIndexMode mode) {
        if (mode == null || mode == AutoIndexMode.NONE) {
            log.warn("[neo4j-connect] Auto-index is off, writes look up {} nodes by id without an index",
                    Neo4jGraphSession.NODE_LABEL);
            return;
        }
        try (Session session = driver.session()) {
            switch (mode) {
                case UPDATE -> session.run(CREATE_CONSTRAINT).consume();
                case ASSERT -> {
                    session.run(DROP_CONSTRAINT).consume();
                    session.run(CREATE_CONSTRAINT).consume();
                }
                case VALIDATE -> {
                    long found = session.run(FIND_CONSTRAINT, Map.of("name", CONSTRAINT_NAME))
                            .single().get("found").asLong();
                    if (found == 0) {
                        throw new GraphPersistenceException("Constraint " + CONSTRAINT_NAME
                                + " is missing, run with auto-index 'update' or 'assert' first");
                    }
                }
                default -> { /* NONE handled above */ }
            }
        }
        log.info("[neo4j-connect] Applied auto-index mode {}", mode);
    }
}
