package com.al.ccda2omop.service.engine;

import com.al.ccda2omop.model.vocabulary.ConceptResolution;

import java.util.List;

/**
 * Outcome of applying one rule to one entry.
 */
public final class EntryMapping {

    private final List<MappedRecord> records;
    private final SkipReason skipReason;
    private final ConceptResolution resolution;
    private final long primaryConceptId;

    private EntryMapping(List<MappedRecord> records, SkipReason skipReason,
            ConceptResolution resolution, long primaryConceptId) {
        this.records = List.copyOf(records);
        this.skipReason = skipReason;
        this.resolution = resolution;
        this.primaryConceptId = primaryConceptId;
    }

    public static EntryMapping mapped(List<MappedRecord> records, ConceptResolution resolution,
            long primaryConceptId) {
        return new EntryMapping(records, null, resolution, primaryConceptId);
    }

    public static EntryMapping skipped(SkipReason reason, ConceptResolution resolution) {
        return new EntryMapping(List.of(), reason, resolution, 0L);
    }

    public List<MappedRecord> getRecords() {
        return records;
    }

    /**
     * @return why nothing was produced; null when at least one record was
     */
    public SkipReason getSkipReason() {
        return skipReason;
    }

    /**
     * Resolution of the coded field that decided the concept ids; null when
     * the rule has no coded field or no code was found.
     */
    public ConceptResolution getResolution() {
        return resolution;
    }

    /**
     * Concept id the rule conditions were evaluated against.
     */
    public long getPrimaryConceptId() {
        return primaryConceptId;
    }

    public boolean isSkipped() {
        return skipReason != null;
    }
}
