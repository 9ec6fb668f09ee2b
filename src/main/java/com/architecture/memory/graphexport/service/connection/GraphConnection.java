package com.architecture.memory.graphexport.service.connection;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * A session together with the factory that opened it, held for the duration of one run.
 * {@link #close()} clears and closes the session, then closes the factory, at most once.
 */
@Slf4j
@Getter
public class GraphConnection implements AutoCloseable {

    private final GraphSession session;
    private final GraphSessionFactory sessionFactory;
    private boolean closed;

    public GraphConnection(GraphSession session, GraphSessionFactory sessionFactory) {
        this.session = Objects.requireNonNull(session, "session");
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory");
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            try {
                session.clear();
            } finally {
                session.close();
            }
        } finally {
            sessionFactory.close();
            log.debug("[neo4j-connect] Session cleared and session factory closed");
        }
    }
}
