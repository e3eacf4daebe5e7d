package com.al.ccda2omop.exception;

import lombok.Getter;

/**
 * Exception thrown when mapping rules cannot be read or fail validation.
 */
@Getter
public class RuleLoadException extends RuntimeException {

    /**
     * Rule name, or null when the failure is not tied to one rule
     */
    private final String ruleName;

    public RuleLoadException(String message) {
        super(message);
        this.ruleName = null;
    }

    public RuleLoadException(String message, Throwable cause) {
        super(message, cause);
        this.ruleName = null;
    }

    public RuleLoadException(String ruleName, String message) {
        super(String.format("Invalid rule '%s': %s", ruleName, message));
        this.ruleName = ruleName;
    }
}
