package com.al.ccda2omop.service.mapper;

import com.al.ccda2omop.model.omop.ConditionOccurrence;
import com.al.ccda2omop.model.omop.DeviceExposure;
import com.al.ccda2omop.model.omop.DrugExposure;
import com.al.ccda2omop.model.omop.Measurement;
import com.al.ccda2omop.model.omop.Observation;
import com.al.ccda2omop.model.omop.OmopRow;
import com.al.ccda2omop.model.omop.OmopTable;
import com.al.ccda2omop.model.omop.ProcedureOccurrence;
import com.al.ccda2omop.service.engine.MappedRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Converts engine records into typed OMOP rows.
 *
 * <p>
 * The table id, {@code person_id} and the type concept are required; a
 * record lacking any of them is rejected. Concept ids default to 0 and a
 * missing start date (or drug end date) to {@link #UNKNOWN_DATE}. Integer
 * columns holding a value outside the INTEGER range are left empty. Every
 * other column stays null when absent.
 */
@Component
@Slf4j
public class RowConverter {

    /**
     * Written for NOT NULL date columns the source document leaves empty.
     */
    public static final LocalDate UNKNOWN_DATE = LocalDate.of(1, 1, 1);

    public RowResult convert(MappedRecord record) {
        OmopTable table = record.getTable();
        for (String column : new String[] { table.idColumn(), "person_id", table.typeConceptColumn() }) {
            if (column != null && !present(record, column)) {
                return RowResult.missing(column);
            }
        }
        if (table.startDateColumn() != null && record.getDateTime(table.startDateColumn()) == null) {
            log.debug("Rule {}: no {}, using {}", record.getRuleName(), table.startDateColumn(), UNKNOWN_DATE);
        }
        switch (table) {
            case CONDITION_OCCURRENCE:
                return RowResult.of(condition(record));
            case DRUG_EXPOSURE:
                return RowResult.of(drug(record));
            case PROCEDURE_OCCURRENCE:
                return RowResult.of(procedure(record));
            case MEASUREMENT:
                return RowResult.of(measurement(record));
            case OBSERVATION:
                return RowResult.of(observation(record));
            case DEVICE_EXPOSURE:
                return RowResult.of(device(record));
            default:
                throw new IllegalArgumentException("Rules cannot produce rows for " + table.tableName());
        }
    }

    private static boolean present(MappedRecord record, String column) {
        return record.getLong(column) != null;
    }

    private OmopRow condition(MappedRecord r) {
        return ConditionOccurrence.builder()
                .conditionOccurrenceId(r.getLong("condition_occurrence_id"))
                .personId(r.getLong("person_id"))
                .conditionConceptId(concept(r, "condition_concept_id"))
                .conditionStartDate(requiredDate(r, "condition_start_date"))
                .conditionStartDatetime(r.getDateTime("condition_start_datetime"))
                .conditionEndDate(date(r, "condition_end_date"))
                .conditionEndDatetime(r.getDateTime("condition_end_datetime"))
                .conditionTypeConceptId(r.getLong("condition_type_concept_id"))
                .conditionStatusConceptId(r.getLong("condition_status_concept_id"))
                .stopReason(r.getString("stop_reason"))
                .providerId(r.getLong("provider_id"))
                .visitOccurrenceId(r.getLong("visit_occurrence_id"))
                .visitDetailId(r.getLong("visit_detail_id"))
                .conditionSourceValue(r.getString("condition_source_value"))
                .conditionSourceConceptId(r.getLong("condition_source_concept_id"))
                .conditionStatusSourceValue(r.getString("condition_status_source_value"))
                .mappingRule(r.getString("mapping_rule"))
                .build();
    }

    private OmopRow drug(MappedRecord r) {
        return DrugExposure.builder()
                .drugExposureId(r.getLong("drug_exposure_id"))
                .personId(r.getLong("person_id"))
                .drugConceptId(concept(r, "drug_concept_id"))
                .drugExposureStartDate(requiredDate(r, "drug_exposure_start_date"))
                .drugExposureStartDatetime(r.getDateTime("drug_exposure_start_datetime"))
                .drugExposureEndDate(requiredDate(r, "drug_exposure_end_date"))
                .drugExposureEndDatetime(r.getDateTime("drug_exposure_end_datetime"))
                .verbatimEndDate(date(r, "verbatim_end_date"))
                .drugTypeConceptId(r.getLong("drug_type_concept_id"))
                .stopReason(r.getString("stop_reason"))
                .refills(integer(r, "refills"))
                .quantity(r.getDouble("quantity"))
                .daysSupply(integer(r, "days_supply"))
                .sig(r.getString("sig"))
                .routeConceptId(r.getLong("route_concept_id"))
                .lotNumber(r.getString("lot_number"))
                .providerId(r.getLong("provider_id"))
                .visitOccurrenceId(r.getLong("visit_occurrence_id"))
                .visitDetailId(r.getLong("visit_detail_id"))
                .drugSourceValue(r.getString("drug_source_value"))
                .drugSourceConceptId(r.getLong("drug_source_concept_id"))
                .routeSourceValue(r.getString("route_source_value"))
                .doseUnitSourceValue(r.getString("dose_unit_source_value"))
                .mappingRule(r.getString("mapping_rule"))
                .build();
    }

    private OmopRow procedure(MappedRecord r) {
        return ProcedureOccurrence.builder()
                .procedureOccurrenceId(r.getLong("procedure_occurrence_id"))
                .personId(r.getLong("person_id"))
                .procedureConceptId(concept(r, "procedure_concept_id"))
                .procedureDate(requiredDate(r, "procedure_date"))
                .procedureDatetime(r.getDateTime("procedure_datetime"))
                .procedureTypeConceptId(r.getLong("procedure_type_concept_id"))
                .modifierConceptId(r.getLong("modifier_concept_id"))
                .quantity(integer(r, "quantity"))
                .providerId(r.getLong("provider_id"))
                .visitOccurrenceId(r.getLong("visit_occurrence_id"))
                .visitDetailId(r.getLong("visit_detail_id"))
                .procedureSourceValue(r.getString("procedure_source_value"))
                .procedureSourceConceptId(r.getLong("procedure_source_concept_id"))
                .modifierSourceValue(r.getString("modifier_source_value"))
                .mappingRule(r.getString("mapping_rule"))
                .build();
    }

    private OmopRow measurement(MappedRecord r) {
        return Measurement.builder()
                .measurementId(r.getLong("measurement_id"))
                .personId(r.getLong("person_id"))
                .measurementConceptId(concept(r, "measurement_concept_id"))
                .measurementDate(requiredDate(r, "measurement_date"))
                .measurementDatetime(r.getDateTime("measurement_datetime"))
                .measurementTime(r.getString("measurement_time"))
                .measurementTypeConceptId(r.getLong("measurement_type_concept_id"))
                .operatorConceptId(r.getLong("operator_concept_id"))
                .valueAsNumber(r.getDouble("value_as_number"))
                .valueAsConceptId(r.getLong("value_as_concept_id"))
                .unitConceptId(r.getLong("unit_concept_id"))
                .rangeLow(r.getDouble("range_low"))
                .rangeHigh(r.getDouble("range_high"))
                .providerId(r.getLong("provider_id"))
                .visitOccurrenceId(r.getLong("visit_occurrence_id"))
                .visitDetailId(r.getLong("visit_detail_id"))
                .measurementSourceValue(r.getString("measurement_source_value"))
                .measurementSourceConceptId(r.getLong("measurement_source_concept_id"))
                .unitSourceValue(r.getString("unit_source_value"))
                .valueSourceValue(r.getString("value_source_value"))
                .mappingRule(r.getString("mapping_rule"))
                .build();
    }

    private OmopRow observation(MappedRecord r) {
        return Observation.builder()
                .observationId(r.getLong("observation_id"))
                .personId(r.getLong("person_id"))
                .observationConceptId(concept(r, "observation_concept_id"))
                .observationDate(requiredDate(r, "observation_date"))
                .observationDatetime(r.getDateTime("observation_datetime"))
                .observationTypeConceptId(r.getLong("observation_type_concept_id"))
                .valueAsNumber(r.getDouble("value_as_number"))
                .valueAsString(r.getString("value_as_string"))
                .valueAsConceptId(r.getLong("value_as_concept_id"))
                .qualifierConceptId(r.getLong("qualifier_concept_id"))
                .unitConceptId(r.getLong("unit_concept_id"))
                .providerId(r.getLong("provider_id"))
                .visitOccurrenceId(r.getLong("visit_occurrence_id"))
                .visitDetailId(r.getLong("visit_detail_id"))
                .observationSourceValue(r.getString("observation_source_value"))
                .observationSourceConceptId(r.getLong("observation_source_concept_id"))
                .unitSourceValue(r.getString("unit_source_value"))
                .qualifierSourceValue(r.getString("qualifier_source_value"))
                .mappingRule(r.getString("mapping_rule"))
                .build();
    }

    private OmopRow device(MappedRecord r) {
        return DeviceExposure.builder()
                .deviceExposureId(r.getLong("device_exposure_id"))
                .personId(r.getLong("person_id"))
                .deviceConceptId(concept(r, "device_concept_id"))
                .deviceExposureStartDate(requiredDate(r, "device_exposure_start_date"))
                .deviceExposureStartDatetime(r.getDateTime("device_exposure_start_datetime"))
                .deviceExposureEndDate(date(r, "device_exposure_end_date"))
                .deviceExposureEndDatetime(r.getDateTime("device_exposure_end_datetime"))
                .deviceTypeConceptId(r.getLong("device_type_concept_id"))
                .uniqueDeviceId(r.getString("unique_device_id"))
                .quantity(integer(r, "quantity"))
                .providerId(r.getLong("provider_id"))
                .visitOccurrenceId(r.getLong("visit_occurrence_id"))
                .visitDetailId(r.getLong("visit_detail_id"))
                .deviceSourceValue(r.getString("device_source_value"))
                .deviceSourceConceptId(r.getLong("device_source_concept_id"))
                .mappingRule(r.getString("mapping_rule"))
                .build();
    }

    private static Long concept(MappedRecord r, String column) {
        Long value = r.getLong(column);
        return value == null ? 0L : value;
    }

    private static LocalDate date(MappedRecord r, String column) {
        LocalDateTime value = r.getDateTime(column);
        return value == null ? null : value.toLocalDate();
    }

    private static LocalDate requiredDate(MappedRecord r, String column) {
        LocalDate value = date(r, column);
        return value == null ? UNKNOWN_DATE : value;
    }

    private static Integer integer(MappedRecord r, String column) {
        Long value = r.getLong(column);
        if (value == null) {
            return null;
        }
        try {
            return Math.toIntExact(value);
        } catch (ArithmeticException e) {
            log.warn("Rule {}: {} value {} exceeds the integer range, column left empty",
                    r.getRuleName(), column, value);
            return null;
        }
    }
}
