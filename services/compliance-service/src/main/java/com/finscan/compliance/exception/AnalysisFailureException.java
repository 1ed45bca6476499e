package com.finscan.compliance.exception;

/**
 * Raised when page or table processing fails after the document was opened. The document has
 * already been closed by the time this propagates.
 */
public class AnalysisFailureException extends RuntimeException {

    public AnalysisFailureException(String operation, Throwable cause) {
        super("Failed to " + operation + ": " + describe(cause), cause);
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
