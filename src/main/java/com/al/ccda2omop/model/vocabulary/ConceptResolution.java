package com.al.ccda2omop.model.vocabulary;

import java.util.List;

/**
 * Outcome of resolving a source code to standard concept ids.
 *
 * <p>
 * {@link Kind#SOURCE_ONLY} carries the source concept's own id, so callers
 * that only need ids see the same list as
 * {@code VocabularyIndex.standardConceptIds}; reporting can still tell an
 * unmapped concept from a standard one.
 */
public final class ConceptResolution {

    public enum Kind {
        /** The concept is itself standard. */
        STANDARD,
        /** The concept reached standard concepts through "Maps to" edges. */
        MAPPED,
        /** The concept exists but has no standard mapping; its own id is used. */
        SOURCE_ONLY,
        /** No concept for the code, or the code system is unknown. */
        NOT_FOUND
    }

    private static final ConceptResolution NOT_FOUND = new ConceptResolution(Kind.NOT_FOUND, "", List.of());

    private final Kind kind;
    private final String vocabularyId;
    private final List<Long> conceptIds;

    private ConceptResolution(Kind kind, String vocabularyId, List<Long> conceptIds) {
        this.kind = kind;
        this.vocabularyId = vocabularyId;
        this.conceptIds = List.copyOf(conceptIds);
    }

    public static ConceptResolution of(Kind kind, String vocabularyId, List<Long> conceptIds) {
        return new ConceptResolution(kind, vocabularyId, conceptIds);
    }

    public static ConceptResolution notFound() {
        return NOT_FOUND;
    }

    public static ConceptResolution notFound(String vocabularyId) {
        return new ConceptResolution(Kind.NOT_FOUND, vocabularyId == null ? "" : vocabularyId, List.of());
    }

    public Kind getKind() {
        return kind;
    }

    public String getVocabularyId() {
        return vocabularyId;
    }

    public List<Long> getConceptIds() {
        return conceptIds;
    }

    public boolean isFound() {
        return kind != Kind.NOT_FOUND;
    }

    /**
     * True when the ids are standard concepts (self or mapped).
     */
    public boolean isMappedToStandard() {
        return kind == Kind.STANDARD || kind == Kind.MAPPED;
    }

    @Override
    public String toString() {
        return "ConceptResolution{" + kind + ", " + vocabularyId + ", " + conceptIds + "}";
    }
}
