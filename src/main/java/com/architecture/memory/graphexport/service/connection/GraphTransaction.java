package com.architecture.memory.graphexport.service.connection;

/**
 * Closing a transaction that was not committed rolls it back.
 */
public interface GraphTransaction extends AutoCloseable {

    void commit();

    boolean isCommitted();

    @Override
    void close();
}
