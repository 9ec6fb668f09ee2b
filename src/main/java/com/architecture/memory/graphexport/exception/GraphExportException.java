package com.architecture.memory.graphexport.exception;

import org.springframework.boot.ExitCodeGenerator;

/**
 * Base type for failures that end an export run. Spring Boot walks the cause chain of a
 * failed runner and uses {@link #getExitCode()} as the process status.
 */
public abstract class GraphExportException extends RuntimeException implements ExitCodeGenerator {

    protected GraphExportException(String message) {
        super(message);
    }

    protected GraphExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
