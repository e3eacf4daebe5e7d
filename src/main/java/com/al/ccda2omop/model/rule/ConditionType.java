package com.al.ccda2omop.model.rule;

import java.util.Arrays;
import java.util.Optional;

/**
 * Rule conditions, checked against the first resolved concept of an entry.
 */
public enum ConditionType {

    DOMAIN_EQUALS("domain_equals"),
    DOMAIN_NOT_EQUALS("domain_not_equals");

    private final String ruleName;

    ConditionType(String ruleName) {
        this.ruleName = ruleName;
    }

    public String ruleName() {
        return ruleName;
    }

    public static Optional<ConditionType> fromRuleName(String name) {
        return Arrays.stream(values()).filter(t -> t.ruleName.equals(name)).findFirst();
    }
}
