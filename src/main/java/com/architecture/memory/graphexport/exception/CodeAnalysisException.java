package com.architecture.memory.graphexport.exception;

public class CodeAnalysisException extends GraphExportException {

    public static final int EXIT_CODE = 5;

    public CodeAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
