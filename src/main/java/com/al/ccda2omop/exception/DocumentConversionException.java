package com.al.ccda2omop.exception;

import lombok.Getter;

/**
 * Exception thrown when one clinical document cannot be converted.
 * Carries the source file name so batch callers can report it.
 */
@Getter
public class DocumentConversionException extends RuntimeException {

    private final String sourceFile;

    public DocumentConversionException(String sourceFile, Throwable cause) {
        super(String.format("Failed to process %s: %s", sourceFile, cause.getMessage()), cause);
        this.sourceFile = sourceFile;
    }

    public DocumentConversionException(String sourceFile, String message) {
        super(String.format("Failed to process %s: %s", sourceFile, message));
        this.sourceFile = sourceFile;
    }
}
