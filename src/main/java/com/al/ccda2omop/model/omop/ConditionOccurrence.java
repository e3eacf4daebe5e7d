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
public class ConditionOccurrence implements OmopRow {
    private Long conditionOccurrenceId;
    private Long personId;
    @Builder.Default
    private Long conditionConceptId = 0L;
    private LocalDate conditionStartDate;
    private LocalDateTime conditionStartDatetime;
    private LocalDate conditionEndDate;
    private LocalDateTime conditionEndDatetime;
    private Long conditionTypeConceptId;
    private Long conditionStatusConceptId;
    private String stopReason;
    private Long providerId;
    private Long visitOccurrenceId;
    private Long visitDetailId;
    private String conditionSourceValue;
    private Long conditionSourceConceptId;
    private String conditionStatusSourceValue;
    private String mappingRule;
    private String sourceFile;

    @Override
    public OmopTable table() {
        return OmopTable.CONDITION_OCCURRENCE;
    }

    @Override
    public List<Object> values() {
        return Arrays.asList(conditionOccurrenceId, personId, conditionConceptId, conditionStartDate,
                conditionStartDatetime, conditionEndDate, conditionEndDatetime, conditionTypeConceptId,
                conditionStatusConceptId, stopReason, providerId, visitOccurrenceId, visitDetailId,
                conditionSourceValue, conditionSourceConceptId, conditionStatusSourceValue, mappingRule,
                sourceFile);
    }
}
