package com.al.ccda2omop.model.omop;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Person implements OmopRow {
    private Long personId;
    @Builder.Default
    private Long genderConceptId = 0L;
    private Integer yearOfBirth;
    private Integer monthOfBirth;
    private Integer dayOfBirth;
    private LocalDateTime birthDatetime;
    @Builder.Default
    private Long raceConceptId = 0L;
    @Builder.Default
    private Long ethnicityConceptId = 0L;
    private Long locationId;
    private Long providerId;
    private Long careSiteId;
    private String personSourceValue;
    private String genderSourceValue;
    private Long genderSourceConceptId;
    private String raceSourceValue;
    private Long raceSourceConceptId;
    private String ethnicitySourceValue;
    private Long ethnicitySourceConceptId;
    private String mappingRule;
    private String sourceFile;

    @Override
    public OmopTable table() {
        return OmopTable.PERSON;
    }

    @Override
    public List<Object> values() {
        return Arrays.asList(personId, genderConceptId, yearOfBirth, monthOfBirth, dayOfBirth,
                birthDatetime, raceConceptId, ethnicityConceptId, locationId, providerId, careSiteId,
                personSourceValue, genderSourceValue, genderSourceConceptId, raceSourceValue,
                raceSourceConceptId, ethnicitySourceValue, ethnicitySourceConceptId, mappingRule, sourceFile);
    }
}
