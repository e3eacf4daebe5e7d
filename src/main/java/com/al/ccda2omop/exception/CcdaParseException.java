package com.al.ccda2omop.exception;

/**
 * Raised when a document is not well-formed XML or cannot be read.
 */
public class CcdaParseException extends RuntimeException {

    public CcdaParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
