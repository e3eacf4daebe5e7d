package com.al.ccda2omop.exception;

import lombok.Getter;

/**
 * Exception thrown when a vocabulary file cannot be loaded: unreadable file,
 * unexpected header, or missing supplementary vocabulary directory.
 */
@Getter
public class VocabularyLoadException extends RuntimeException {

    private final String source;

    public VocabularyLoadException(String source, String message) {
        super(message + ": " + source);
        this.source = source;
    }

    public VocabularyLoadException(String source, String message, Throwable cause) {
        super(message + ": " + source, cause);
        this.source = source;
    }
}
