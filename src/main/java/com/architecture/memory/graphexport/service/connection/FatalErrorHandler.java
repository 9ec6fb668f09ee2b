package com.architecture.memory.graphexport.service.connection;

/**
 * Handles errors no retry can fix. The production handler ends the process and does not return.
 */
@FunctionalInterface
public interface FatalErrorHandler {

    void terminate(int status, String message, Throwable cause);
}
