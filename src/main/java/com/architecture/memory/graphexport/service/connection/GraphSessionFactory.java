package com.architecture.memory.graphexport.service.connection;

/**
 * Owns the underlying driver. Closing it invalidates every session it opened.
 */
public interface GraphSessionFactory extends AutoCloseable {

    GraphSession openSession();

    @Override
    void close();
}
