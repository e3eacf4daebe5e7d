package com.al.ccda2omop.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A document that failed during a batch conversion.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversionError {

    /**
     * Position of the document in the batch input
     */
    private int index;

    /**
     * File name of the failing document
     */
    private String sourceFile;

    /**
     * Error code for programmatic handling
     */
    private String errorCode;

    /**
     * Human-readable error message
     */
    private String message;

    /**
     * The original exception class name (for debugging)
     */
    private String exceptionType;

    public static ConversionError documentError(int index, String sourceFile, Throwable cause) {
        Throwable root = cause.getCause() != null ? cause.getCause() : cause;
        return ConversionError.builder()
                .index(index)
                .sourceFile(sourceFile)
                .errorCode("DOCUMENT_FAILED")
                .message(cause.getMessage())
                .exceptionType(root.getClass().getSimpleName())
                .build();
    }
}
