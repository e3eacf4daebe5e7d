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
public class Observation implements OmopRow {
    private Long observationId;
    private Long personId;
    @Builder.Default
    private Long observationConceptId = 0L;
    private LocalDate observationDate;
    private LocalDateTime observationDatetime;
    private Long observationTypeConceptId;
    private Double valueAsNumber;
    private String valueAsString;
    private Long valueAsConceptId;
    private Long qualifierConceptId;
    private Long unitConceptId;
    private Long providerId;
    private Long visitOccurrenceId;
    private Long visitDetailId;
    private String observationSourceValue;
    private Long observationSourceConceptId;
    private String unitSourceValue;
    private String qualifierSourceValue;
    private String mappingRule;
    private String sourceFile;

    @Override
    public OmopTable table() {
        return OmopTable.OBSERVATION;
    }

    @Override
    public List<Object> values() {
        return Arrays.asList(observationId, personId, observationConceptId, observationDate,
                observationDatetime, observationTypeConceptId, valueAsNumber, valueAsString, valueAsConceptId,
                qualifierConceptId, unitConceptId, providerId, visitOccurrenceId, visitDetailId,
                observationSourceValue, observationSourceConceptId, unitSourceValue, qualifierSourceValue,
                mappingRule, sourceFile);
    }
}
