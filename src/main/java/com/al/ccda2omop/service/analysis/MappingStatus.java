package com.al.ccda2omop.service.analysis;

/**
 * How a source code found in a document resolves against the loaded vocabulary.
 */
public enum MappingStatus {

    /** Resolved to one or more standard concepts. */
    MAPPED("mapped"),
    /** Unknown code, or a source concept without a standard mapping. */
    UNMAPPED("unmapped"),
    /** The code system OID has no vocabulary id. */
    NO_VOCAB("no_vocab"),
    /** No concept table was loaded. */
    NO_VOCAB_LOADER("no_vocab_loader");

    private final String label;

    MappingStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
