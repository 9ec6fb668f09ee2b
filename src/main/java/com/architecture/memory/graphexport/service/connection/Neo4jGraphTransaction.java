package com.architecture.memory.graphexport.service.connection;

import org.neo4j.driver.Transaction;

import java.util.function.Consumer;

class Neo4jGraphTransaction implements GraphTransaction {

    private final Transaction delegate;
    private final Consumer<Neo4jGraphTransaction> onFinish;
    private boolean committed;
    private boolean closed;

    Neo4jGraphTransaction(Transaction delegate, Consumer<Neo4jGraphTransaction> onFinish) {
        this.delegate = delegate;
        this.onFinish = onFinish;
    }

    Transaction delegate() {
        if (closed || committed) {
            throw new IllegalStateException("Transaction is no longer open");
        }
        return delegate;
    }

    @Override
    public void commit() {
        delegate().commit();
        committed = true;
    }

    @Override
    public boolean isCommitted() {
        return committed;
    }

    boolean isOpen() {
        return !closed && !committed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (!committed && delegate.isOpen()) {
                delegate.rollback();
            }
            delegate.close();
        } finally {
            onFinish.accept(this);
        }
    }
}
