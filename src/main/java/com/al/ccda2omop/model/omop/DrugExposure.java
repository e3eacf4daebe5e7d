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
public class DrugExposure implements OmopRow {
    private Long drugExposureId;
    private Long personId;
    @Builder.Default
    private Long drugConceptId = 0L;
    private LocalDate drugExposureStartDate;
    private LocalDateTime drugExposureStartDatetime;
    private LocalDate drugExposureEndDate;
    private LocalDateTime drugExposureEndDatetime;
    private LocalDate verbatimEndDate;
    private Long drugTypeConceptId;
    private String stopReason;
    private Integer refills;
    private Double quantity;
    private Integer daysSupply;
    private String sig;
    private Long routeConceptId;
    private String lotNumber;
    private Long providerId;
    private Long visitOccurrenceId;
    private Long visitDetailId;
    private String drugSourceValue;
    private Long drugSourceConceptId;
    private String routeSourceValue;
    private String doseUnitSourceValue;
    private String mappingRule;
    private String sourceFile;

    @Override
    public OmopTable table() {
        return OmopTable.DRUG_EXPOSURE;
    }

    @Override
    public List<Object> values() {
        return Arrays.asList(drugExposureId, personId, drugConceptId, drugExposureStartDate,
                drugExposureStartDatetime, drugExposureEndDate, drugExposureEndDatetime, verbatimEndDate,
                drugTypeConceptId, stopReason, refills, quantity, daysSupply, sig, routeConceptId, lotNumber,
                providerId, visitOccurrenceId, visitDetailId, drugSourceValue, drugSourceConceptId,
                routeSourceValue, doseUnitSourceValue, mappingRule, sourceFile);
    }
}
