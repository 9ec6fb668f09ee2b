package com.architecture.memory.graphexport.service.connection;

import com.architecture.memory.graphexport.config.PersistenceConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class Neo4jSessionFactoryConnector implements SessionFactoryConnector {

    @Override
    public GraphSessionFactory connect(PersistenceConfig config) {
        log.debug("[neo4j-connect] Opening driver for {} as {}", config.getUri(), config.getUsername());
        return Neo4jSessionFactory.open(config);
    }
}
