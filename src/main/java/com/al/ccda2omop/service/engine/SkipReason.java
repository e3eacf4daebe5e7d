package com.al.ccda2omop.service.engine;

/**
 * Why an entry produced no records. Labels appear in the conversion report.
 */
public enum SkipReason {

    EXCLUDED("excluded"),
    NO_CONCEPT("no_concept"),
    CONDITION_FAILED("condition_failed"),
    MISSING_REQUIRED_FIELD("missing_required_field"),
    XPATH_ERROR("xpath_error");

    private final String label;

    SkipReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
