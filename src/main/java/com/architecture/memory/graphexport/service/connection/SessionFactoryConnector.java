package com.architecture.memory.graphexport.service.connection;

import com.architecture.memory.graphexport.config.PersistenceConfig;

/**
 * Creates a session factory for the configured database.
 *
 * Implementations report an unreachable database with the driver's
 * {@link org.neo4j.driver.exceptions.ServiceUnavailableException} and rejected credentials with
 * {@link org.neo4j.driver.exceptions.AuthenticationException}.
 */
@FunctionalInterface
public interface SessionFactoryConnector {

    GraphSessionFactory connect(PersistenceConfig config);
}
