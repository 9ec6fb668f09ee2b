package com.architecture.memory.graphexport.exception;

/**
 * Failure while purging, flattening, saving or committing. The transaction is never committed
 * when this is raised, but a purge that already ran is not undone.
 */
public class GraphPersistenceException extends GraphExportException {

    public static final int EXIT_CODE = 4;

    public GraphPersistenceException(String message) {
        super(message);
    }

    public GraphPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
