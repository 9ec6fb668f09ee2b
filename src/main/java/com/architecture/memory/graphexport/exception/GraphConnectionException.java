package com.architecture.memory.graphexport.exception;

public class GraphConnectionException extends GraphExportException {

    public static final int EXIT_CODE = 3;

    public GraphConnectionException(String message) {
        super(message);
    }

    public GraphConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
