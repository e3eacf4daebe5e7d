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
public class Measurement implements OmopRow {
    private Long measurementId;
    private Long personId;
    @Builder.Default
    private Long measurementConceptId = 0L;
    private LocalDate measurementDate;
    private LocalDateTime measurementDatetime;
    private String measurementTime;
    private Long measurementTypeConceptId;
    private Long operatorConceptId;
    private Double valueAsNumber;
    private Long valueAsConceptId;
    private Long unitConceptId;
    private Double rangeLow;
    private Double rangeHigh;
    private Long providerId;
    private Long visitOccurrenceId;
    private Long visitDetailId;
    private String measurementSourceValue;
    private Long measurementSourceConceptId;
    private String unitSourceValue;
    private String valueSourceValue;
    private String mappingRule;
    private String sourceFile;

    @Override
    public OmopTable table() {
        return OmopTable.MEASUREMENT;
    }

    @Override
    public List<Object> values() {
        return Arrays.asList(measurementId, personId, measurementConceptId, measurementDate,
                measurementDatetime, measurementTime, measurementTypeConceptId, operatorConceptId,
                valueAsNumber, valueAsConceptId, unitConceptId, rangeLow, rangeHigh, providerId,
                visitOccurrenceId, visitDetailId, measurementSourceValue, measurementSourceConceptId,
                unitSourceValue, valueSourceValue, mappingRule, sourceFile);
    }
}
