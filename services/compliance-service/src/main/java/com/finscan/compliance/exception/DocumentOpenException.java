package com.finscan.compliance.exception;

/**
 * The document reference could not be opened or decoded. Nothing was acquired, so there is
 * nothing to release.
 */
public class DocumentOpenException extends RuntimeException {

    public DocumentOpenException(String detail) {
        super("Failed to open PDF: " + detail);
    }

    public DocumentOpenException(String detail, Throwable cause) {
        super("Failed to open PDF: " + detail, cause);
    }
}
