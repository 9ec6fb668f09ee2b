package com.architecture.memory.graphexport.exception;

/**
 * Credentials rejected by the database. Never retried.
 */
public class GraphAuthenticationException extends GraphExportException {

    public static final int EXIT_CODE = 1;

    public GraphAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
