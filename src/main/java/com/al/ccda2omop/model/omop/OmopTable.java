package com.al.ccda2omop.model.omop;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The OMOP CDM tables this converter writes, with their CSV column order.
 */
public enum OmopTable {

    PERSON("person", "person_id", null, "gender_concept_id", null, List.of(
            "person_id", "gender_concept_id", "year_of_birth", "month_of_birth", "day_of_birth",
            "birth_datetime", "race_concept_id", "ethnicity_concept_id", "location_id", "provider_id",
            "care_site_id", "person_source_value", "gender_source_value", "gender_source_concept_id",
            "race_source_value", "race_source_concept_id", "ethnicity_source_value",
            "ethnicity_source_concept_id", "mapping_rule", "source_file")),

    VISIT_OCCURRENCE("visit_occurrence", "visit_occurrence_id", "visit_type_concept_id", "visit_concept_id",
            "visit_start_date", List.of(
                    "visit_occurrence_id", "person_id", "visit_concept_id", "visit_start_date",
                    "visit_start_datetime", "visit_end_date", "visit_end_datetime", "visit_type_concept_id",
                    "provider_id", "care_site_id", "visit_source_value", "visit_source_concept_id",
                    "admitted_from_concept_id", "admitted_from_source_value", "discharge_to_concept_id",
                    "discharge_to_source_value", "preceding_visit_occurrence_id", "mapping_rule",
                    "source_file")),

    CONDITION_OCCURRENCE("condition_occurrence", "condition_occurrence_id", "condition_type_concept_id",
            "condition_concept_id", "condition_start_date", List.of(
                    "condition_occurrence_id", "person_id", "condition_concept_id", "condition_start_date",
                    "condition_start_datetime", "condition_end_date", "condition_end_datetime",
                    "condition_type_concept_id", "condition_status_concept_id", "stop_reason", "provider_id",
                    "visit_occurrence_id", "visit_detail_id", "condition_source_value",
                    "condition_source_concept_id", "condition_status_source_value", "mapping_rule",
                    "source_file")),

    DRUG_EXPOSURE("drug_exposure", "drug_exposure_id", "drug_type_concept_id", "drug_concept_id",
            "drug_exposure_start_date", List.of(
                    "drug_exposure_id", "person_id", "drug_concept_id", "drug_exposure_start_date",
                    "drug_exposure_start_datetime", "drug_exposure_end_date", "drug_exposure_end_datetime",
                    "verbatim_end_date", "drug_type_concept_id", "stop_reason", "refills", "quantity",
                    "days_supply", "sig", "route_concept_id", "lot_number", "provider_id",
                    "visit_occurrence_id", "visit_detail_id", "drug_source_value", "drug_source_concept_id",
                    "route_source_value", "dose_unit_source_value", "mapping_rule", "source_file")),

    PROCEDURE_OCCURRENCE("procedure_occurrence", "procedure_occurrence_id", "procedure_type_concept_id",
            "procedure_concept_id", "procedure_date", List.of(
                    "procedure_occurrence_id", "person_id", "procedure_concept_id", "procedure_date",
                    "procedure_datetime", "procedure_type_concept_id", "modifier_concept_id", "quantity",
                    "provider_id", "visit_occurrence_id", "visit_detail_id", "procedure_source_value",
                    "procedure_source_concept_id", "modifier_source_value", "mapping_rule", "source_file")),

    MEASUREMENT("measurement", "measurement_id", "measurement_type_concept_id", "measurement_concept_id",
            "measurement_date", List.of(
                    "measurement_id", "person_id", "measurement_concept_id", "measurement_date",
                    "measurement_datetime", "measurement_time", "measurement_type_concept_id",
                    "operator_concept_id", "value_as_number", "value_as_concept_id", "unit_concept_id",
                    "range_low", "range_high", "provider_id", "visit_occurrence_id", "visit_detail_id",
                    "measurement_source_value", "measurement_source_concept_id", "unit_source_value",
                    "value_source_value", "mapping_rule", "source_file")),

    OBSERVATION("observation", "observation_id", "observation_type_concept_id", "observation_concept_id",
            "observation_date", List.of(
                    "observation_id", "person_id", "observation_concept_id", "observation_date",
                    "observation_datetime", "observation_type_concept_id", "value_as_number",
                    "value_as_string", "value_as_concept_id", "qualifier_concept_id", "unit_concept_id",
                    "provider_id", "visit_occurrence_id", "visit_detail_id", "observation_source_value",
                    "observation_source_concept_id", "unit_source_value", "qualifier_source_value",
                    "mapping_rule", "source_file")),

    DEVICE_EXPOSURE("device_exposure", "device_exposure_id", "device_type_concept_id", "device_concept_id",
            "device_exposure_start_date", List.of(
                    "device_exposure_id", "person_id", "device_concept_id", "device_exposure_start_date",
                    "device_exposure_start_datetime", "device_exposure_end_date",
                    "device_exposure_end_datetime", "device_type_concept_id", "unique_device_id", "quantity",
                    "provider_id", "visit_occurrence_id", "visit_detail_id", "device_source_value",
                    "device_source_concept_id", "mapping_rule", "source_file"));

    private final String tableName;
    private final String idColumn;
    private final String typeConceptColumn;
    private final String conceptColumn;
    private final String startDateColumn;
    private final List<String> columns;

    OmopTable(String tableName, String idColumn, String typeConceptColumn, String conceptColumn,
            String startDateColumn, List<String> columns) {
        this.tableName = tableName;
        this.idColumn = idColumn;
        this.typeConceptColumn = typeConceptColumn;
        this.conceptColumn = conceptColumn;
        this.startDateColumn = startDateColumn;
        this.columns = columns;
    }

    public String tableName() {
        return tableName;
    }

    /**
     * CSV file name, e.g. {@code condition_occurrence.csv}.
     */
    public String fileName() {
        return tableName + ".csv";
    }

    public String idColumn() {
        return idColumn;
    }

    /**
     * Type concept column; null for {@link #PERSON}, which has none.
     */
    public String typeConceptColumn() {
        return typeConceptColumn;
    }

    public String conceptColumn() {
        return conceptColumn;
    }

    /**
     * Start date column; null for {@link #PERSON}.
     */
    public String startDateColumn() {
        return startDateColumn;
    }

    public List<String> columns() {
        return columns;
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /**
     * Whether mapping rules may target this table. Person rows come only
     * from patient demographics.
     */
    public boolean isRuleTarget() {
        return this != PERSON;
    }

    public static Optional<OmopTable> fromTableName(String name) {
        return Arrays.stream(values())
                .filter(t -> t.tableName.equals(name))
                .findFirst();
    }
}
