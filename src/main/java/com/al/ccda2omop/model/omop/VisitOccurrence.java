package com.al.ccda2omop.model.omop;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VisitOccurrence implements OmopRow {
    private Long visitOccurrenceId;
    private Long personId;
    @Builder.Default
    private Long visitConceptId = 0L;
    private LocalDate visitStartDate;
    private LocalDateTime visitStartDatetime;
    private LocalDate visitEndDate;
    private LocalDateTime visitEndDatetime;
    private Long visitTypeConceptId;
    private Long providerId;
    private Long careSiteId;
    private String visitSourceValue;
    private Long visitSourceConceptId;
    private Long admittedFromConceptId;
    private String admittedFromSourceValue;
    private Long dischargeToConceptId;
    private String dischargeToSourceValue;
    private Long precedingVisitOccurrenceId;
    private String mappingRule;
    private String sourceFile;

    @Override
    public OmopTable table() {
        return OmopTable.VISIT_OCCURRENCE;
    }

    @Override
    public List<Object> values() {
        return Arrays.asList(visitOccurrenceId, personId, visitConceptId, visitStartDate, visitStartDatetime,
                visitEndDate, visitEndDatetime, visitTypeConceptId, providerId, careSiteId, visitSourceValue,
                visitSourceConceptId, admittedFromConceptId, admittedFromSourceValue, dischargeToConceptId,
                dischargeToSourceValue, precedingVisitOccurrenceId, mappingRule, sourceFile);
    }
}
