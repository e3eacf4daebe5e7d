package com.al.ccda2omop.service.vocabulary;

import com.al.ccda2omop.model.vocabulary.Concept;
import com.al.ccda2omop.model.vocabulary.ConceptResolution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only index over the loaded OMOP vocabulary.
 *
 * <p>
 * Built once by {@link VocabularyLoader} and then shared by every document
 * conversion, including concurrent ones. No method mutates it.
 */
public final class VocabularyIndex {

    private static final VocabularyIndex EMPTY = new VocabularyIndex(Map.of(), Map.of(), Map.of());

    private final Map<String, Concept> conceptsByCode;
    private final Map<Long, Concept> conceptsById;
    private final Map<Long, List<Long>> mapsTo;

    private VocabularyIndex(Map<String, Concept> conceptsByCode, Map<Long, Concept> conceptsById,
            Map<Long, List<Long>> mapsTo) {
        this.conceptsByCode = conceptsByCode;
        this.conceptsById = conceptsById;
        this.mapsTo = mapsTo;
    }

    /**
     * Index with no concepts; every lookup misses.
     */
    public static VocabularyIndex empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Concept lookup(String vocabularyId, String code) {
        return conceptsByCode.get(key(vocabularyId, code));
    }

    public Concept lookupById(long conceptId) {
        return conceptsById.get(conceptId);
    }

    /**
     * Standard concept ids for a source code.
     *
     * @return [self] for a standard concept, the "Maps to" targets in load
     *         order when present, otherwise [self]; empty only when the code
     *         is not in the index
     */
    public List<Long> standardConceptIds(String vocabularyId, String code) {
        return resolve(vocabularyId, code).getConceptIds();
    }

    /**
     * First standard concept id, or 0 when the code is unknown.
     */
    public long standardConceptId(String vocabularyId, String code) {
        List<Long> ids = standardConceptIds(vocabularyId, code);
        return ids.isEmpty() ? 0L : ids.get(0);
    }

    public ConceptResolution resolve(String vocabularyId, String code) {
        Concept concept = lookup(vocabularyId, code);
        if (concept == null) {
            return ConceptResolution.notFound(vocabularyId);
        }
        if (concept.isStandard()) {
            return ConceptResolution.of(ConceptResolution.Kind.STANDARD, vocabularyId,
                    List.of(concept.getConceptId()));
        }
        List<Long> targets = mapsTo.get(concept.getConceptId());
        if (targets != null && !targets.isEmpty()) {
            return ConceptResolution.of(ConceptResolution.Kind.MAPPED, vocabularyId, targets);
        }
        return ConceptResolution.of(ConceptResolution.Kind.SOURCE_ONLY, vocabularyId,
                List.of(concept.getConceptId()));
    }

    /**
     * @return the concept's domain, or "" when the id is unknown
     */
    public String domainOf(long conceptId) {
        Concept concept = conceptsById.get(conceptId);
        return concept == null ? "" : concept.getDomainId();
    }

    public int conceptCount() {
        return conceptsById.size();
    }

    public int relationshipCount() {
        return mapsTo.values().stream().mapToInt(List::size).sum();
    }

    private static String key(String vocabularyId, String code) {
        return vocabularyId + "|" + code;
    }

    /**
     * Mutable accumulator used while loading vocabulary files.
     */
    public static final class Builder {

        private final Map<String, Concept> conceptsByCode = new HashMap<>();
        private final Map<Long, Concept> conceptsById = new HashMap<>();
        private final Map<Long, List<Long>> mapsTo = new HashMap<>();

        private Builder() {
        }

        /**
         * Add a concept; a later concept with the same code or id replaces
         * the earlier one.
         */
        public Builder concept(Concept concept) {
            conceptsByCode.put(key(concept.getVocabularyId(), concept.getConceptCode()), concept);
            conceptsById.put(concept.getConceptId(), concept);
            return this;
        }

        public Builder mapsTo(long sourceConceptId, long targetConceptId) {
            mapsTo.computeIfAbsent(sourceConceptId, id -> new ArrayList<>()).add(targetConceptId);
            return this;
        }

        public boolean containsConcept(long conceptId) {
            return conceptsById.containsKey(conceptId);
        }

        public VocabularyIndex build() {
            Map<Long, List<Long>> edges = new HashMap<>();
            mapsTo.forEach((source, targets) -> edges.put(source, List.copyOf(targets)));
            return new VocabularyIndex(
                    Collections.unmodifiableMap(new HashMap<>(conceptsByCode)),
                    Collections.unmodifiableMap(new HashMap<>(conceptsById)),
                    Collections.unmodifiableMap(edges));
        }
    }
}
