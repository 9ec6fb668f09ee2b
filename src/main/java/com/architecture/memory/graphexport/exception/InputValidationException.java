package com.architecture.memory.graphexport.exception;

/**
 * Bad command line input: missing, hidden or mismatched paths, unreadable includes file,
 * malformed options. Raised before any analysis or connection work starts.
 */
public class InputValidationException extends GraphExportException {

    public static final int EXIT_CODE = 2;

    public InputValidationException(String message) {
        super(message);
    }

    public InputValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
