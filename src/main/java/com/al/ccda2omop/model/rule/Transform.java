package com.al.ccda2omop.model.rule;

import java.util.Arrays;
import java.util.Optional;

/**
 * Field transforms a mapping rule may name.
 */
public enum Transform {

    NONE("none"),
    STRING("string"),
    INT("int"),
    FLOAT("float"),
    /** HL7 timestamp truncated to midnight. */
    DATE("date"),
    /** HL7 timestamp kept as is. */
    TIME_PTR("time_ptr"),
    /** The entry's resolved standard concept id. */
    VOCAB("vocab"),
    /** UCUM unit code to concept id. */
    UNIT("unit"),
    /** Route code to concept id, SNOMED when the code system is unknown. */
    ROUTE("route"),
    /** Coded value to concept id, SNOMED when the code system is unknown. */
    VALUE_VOCAB("value_vocab"),
    /** "code: display name", or whichever of the two is present. */
    FORMAT_SOURCE("format_source"),
    /** Encounter id to the visit_occurrence_id mapped for this document. */
    VISIT("visit");

    private final String ruleName;

    Transform(String ruleName) {
        this.ruleName = ruleName;
    }

    public String ruleName() {
        return ruleName;
    }

    /**
     * @param name transform name as written in a rule file; blank means NONE
     */
    public static Optional<Transform> fromRuleName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.of(NONE);
        }
        return Arrays.stream(values()).filter(t -> t.ruleName.equals(name)).findFirst();
    }
}
