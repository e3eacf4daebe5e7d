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
public class ProcedureOccurrence implements OmopRow {
    private Long procedureOccurrenceId;
    private Long personId;
    @Builder.Default
    private Long procedureConceptId = 0L;
    private LocalDate procedureDate;
    private LocalDateTime procedureDatetime;
    private Long procedureTypeConceptId;
    private Long modifierConceptId;
    private Integer quantity;
    private Long providerId;
    private Long visitOccurrenceId;
    private Long visitDetailId;
    private String procedureSourceValue;
    private Long procedureSourceConceptId;
    private String modifierSourceValue;
    private String mappingRule;
    private String sourceFile;

    @Override
    public OmopTable table() {
        return OmopTable.PROCEDURE_OCCURRENCE;
    }

    @Override
    public List<Object> values() {
        return Arrays.asList(procedureOccurrenceId, personId, procedureConceptId, procedureDate,
                procedureDatetime, procedureTypeConceptId, modifierConceptId, quantity, providerId,
                visitOccurrenceId, visitDetailId, procedureSourceValue, procedureSourceConceptId,
                modifierSourceValue, mappingRule, sourceFile);
    }
}
