package com.al.ccda2omop.service.vocabulary;

import java.util.Map;

/**
 * Fixed concept assignments for demographics and visits, plus the
 * vocabulary-backed lookups used by unit, route and coded-value transforms.
 */
public class StandardConcepts {

    public static final long NO_MATCHING_CONCEPT = 0L;

    public static final long MALE = 8507L;
    public static final long FEMALE = 8532L;

    public static final long INPATIENT_VISIT = 9201L;
    public static final long OUTPATIENT_VISIT = 9202L;
    public static final long EMERGENCY_VISIT = 9203L;
    public static final long OFFICE_VISIT = 581477L;

    /**
     * "EHR" type concept used for every row produced from a C-CDA document.
     */
    public static final long EHR_TYPE = 32817L;

    private static final Map<String, Long> GENDER = Map.of(
            "M", MALE,
            "F", FEMALE,
            "UN", NO_MATCHING_CONCEPT);

    private static final Map<String, Long> RACE = Map.of(
            "2106-3", 8527L,
            "2054-5", 8516L,
            "2028-9", 8515L,
            "1002-5", 8657L,
            "2076-8", 8557L,
            "2131-1", 8522L);

    private static final Map<String, Long> ETHNICITY = Map.of(
            "2135-2", 38003563L,
            "2186-5", 38003564L);

    private static final Map<String, Long> VISIT = Map.of(
            "IMP", INPATIENT_VISIT,
            "AMB", OUTPATIENT_VISIT,
            "EMER", EMERGENCY_VISIT,
            "VR", OFFICE_VISIT);

    private final VocabularyIndex vocabulary;

    public StandardConcepts(VocabularyIndex vocabulary) {
        this.vocabulary = vocabulary;
    }

    public VocabularyIndex getVocabulary() {
        return vocabulary;
    }

    public long gender(String code) {
        return lookup(GENDER, code, NO_MATCHING_CONCEPT);
    }

    public long race(String code) {
        return lookup(RACE, code, NO_MATCHING_CONCEPT);
    }

    public long ethnicity(String code) {
        return lookup(ETHNICITY, code, NO_MATCHING_CONCEPT);
    }

    /**
     * Visit concept for an encounter code; unknown codes are outpatient.
     */
    public long visit(String encounterCode) {
        return lookup(VISIT, encounterCode, OUTPATIENT_VISIT);
    }

    /**
     * UCUM unit concept, 0 for a blank or unknown unit.
     */
    public long unit(String unit) {
        if (unit == null || unit.isEmpty()) {
            return NO_MATCHING_CONCEPT;
        }
        return vocabulary.standardConceptId(CodeSystemResolver.UCUM, unit);
    }

    /**
     * Route concept; the code system defaults to SNOMED when unrecognized.
     */
    public long route(String code, String codeSystem) {
        return codedValue(code, codeSystem);
    }

    /**
     * Concept for a coded observation or measurement value; the code system
     * defaults to SNOMED when unrecognized.
     */
    public long value(String code, String codeSystem) {
        return codedValue(code, codeSystem);
    }

    private long codedValue(String code, String codeSystem) {
        if (code == null || code.isEmpty()) {
            return NO_MATCHING_CONCEPT;
        }
        String vocabularyId = CodeSystemResolver.toVocabularyId(codeSystem);
        if (vocabularyId.isEmpty()) {
            vocabularyId = CodeSystemResolver.SNOMED;
        }
        return vocabulary.standardConceptId(vocabularyId, code);
    }

    private static long lookup(Map<String, Long> table, String code, long fallback) {
        if (code == null) {
            return fallback;
        }
        return table.getOrDefault(code, fallback);
    }
}
