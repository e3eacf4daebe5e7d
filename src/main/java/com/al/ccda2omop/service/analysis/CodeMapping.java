package com.al.ccda2omop.service.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One coded value found in a document together with its OMOP resolution.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CodeMapping {
    private String section;
    private String xpath;
    private String sourceCode;
    private String sourceCodeSystem;
    @Builder.Default
    private String sourceVocabulary = "";
    @Builder.Default
    private String sourceDisplayName = "";
    private long omopConceptId;
    @Builder.Default
    private String omopConceptName = "";
    @Builder.Default
    private String omopDomainId = "";
    @Builder.Default
    private String omopVocabularyId = "";
    private boolean standard;
    private MappingStatus status;
    private int targetCount;

    /**
     * Status label, with the target count when a code maps to several concepts,
     * e.g. {@code mapped (2 targets)}.
     */
    public String statusLabel() {
        if (status == MappingStatus.MAPPED && targetCount > 1) {
            return status.label() + " (" + targetCount + " targets)";
        }
        return status.label();
    }

    public boolean isUnresolved() {
        return status == MappingStatus.UNMAPPED || status == MappingStatus.NO_VOCAB;
    }
}
