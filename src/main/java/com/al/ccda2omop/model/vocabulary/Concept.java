package com.al.ccda2omop.model.vocabulary;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * One row of the standardized OMOP vocabulary.
 */
@Value
@Builder
@AllArgsConstructor
public class Concept {

    long conceptId;

    String conceptName;

    String domainId;

    String vocabularyId;

    String conceptClassId;

    /**
     * "S" for standard, "C" for classification, empty otherwise.
     */
    String standardConcept;

    String conceptCode;

    public boolean isStandard() {
        return "S".equals(standardConcept);
    }
}
