package com.architecture.memory.graphexport.service.connection;

public enum ConnectionState {
    ATTEMPTING(false),
    CONNECTED(true),
    AUTH_FAILED(true),
    EXHAUSTED_RETRIES(true);

    private final boolean terminal;

    ConnectionState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
