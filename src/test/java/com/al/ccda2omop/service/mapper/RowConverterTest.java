package com.al.ccda2omop.service.mapper;

import com.al.ccda2omop.TestFixtures;
import com.al.ccda2omop.model.omop.ConditionOccurrence;
import com.al.ccda2omop.model.omop.DeviceExposure;
import com.al.ccda2omop.model.omop.DrugExposure;
import com.al.ccda2omop.model.omop.Measurement;
import com.al.ccda2omop.model.omop.OmopTable;
import com.al.ccda2omop.model.rule.MappingRule;
import com.al.ccda2omop.service.engine.EntryMapping;
import com.al.ccda2omop.service.engine.FieldValue;
import com.al.ccda2omop.service.engine.MappedRecord;
import com.al.ccda2omop.service.engine.RuleEngine;
import com.al.ccda2omop.service.output.OmopValueFormatter;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RowConverterTest {

    private final RowConverter converter = new RowConverter();

    @Test
    public void testConvert_Condition() {
        MappedRecord record = base(OmopTable.CONDITION_OCCURRENCE, "condition_occurrence_id", "condition_start_date");
        record.put("condition_concept_id", FieldValue.integer(201826L));
        record.put("condition_end_date", FieldValue.timestamp(LocalDateTime.of(2024, 3, 1, 0, 0)));
        record.put("condition_source_value", FieldValue.string("44054006: Type 2 diabetes mellitus"));
        record.put("visit_occurrence_id", FieldValue.integer(77L));
        record.put("mapping_rule", FieldValue.string("RuleMapper:Problems_to_condition_occurrence"));

        RowResult result = converter.convert(record);

        assertTrue(result.isPresent());
        ConditionOccurrence row = (ConditionOccurrence) result.getRow();
        assertEquals(10L, row.getConditionOccurrenceId());
        assertEquals(20L, row.getPersonId());
        assertEquals(201826L, row.getConditionConceptId());
        assertEquals(LocalDate.of(2024, 1, 10), row.getConditionStartDate());
        assertEquals(LocalDate.of(2024, 3, 1), row.getConditionEndDate());
        assertEquals(32817L, row.getConditionTypeConceptId());
        assertEquals(77L, row.getVisitOccurrenceId());
        assertEquals("RuleMapper:Problems_to_condition_occurrence", row.getMappingRule());
        assertNull(row.getConditionStatusConceptId());
    }

    @Test
    public void testConvert_MissingConceptDefaultsToZero() {
        MappedRecord record = base(OmopTable.DEVICE_EXPOSURE, "device_exposure_id", "device_exposure_start_date");

        DeviceExposure row = (DeviceExposure) converter.convert(record).getRow();

        assertEquals(0L, row.getDeviceConceptId());
        assertNull(row.getQuantity());
    }

    @Test
    public void testConvert_MissingStartDateUsesUnknownDate() {
        MappedRecord record = new MappedRecord(OmopTable.MEASUREMENT, "Labs");
        record.put("measurement_id", FieldValue.integer(1L));
        record.put("person_id", FieldValue.integer(2L));
        record.put("measurement_type_concept_id", FieldValue.integer(32817L));

        RowResult result = converter.convert(record);

        assertTrue(result.isPresent());
        Measurement row = (Measurement) result.getRow();
        assertEquals(LocalDate.of(1, 1, 1), row.getMeasurementDate());
        assertNull(row.getMeasurementDatetime());
        assertEquals("0001-01-01", OmopValueFormatter.format(row.getMeasurementDate()));
    }

    @Test
    public void testConvert_DrugEndDateDefaults() {
        MappedRecord record = base(OmopTable.DRUG_EXPOSURE, "drug_exposure_id", "drug_exposure_start_date");

        DrugExposure drug = (DrugExposure) converter.convert(record).getRow();

        assertEquals(LocalDate.of(2024, 1, 10), drug.getDrugExposureStartDate());
        assertEquals(RowConverter.UNKNOWN_DATE, drug.getDrugExposureEndDate());
        assertNull(drug.getVerbatimEndDate());
    }

    @Test
    public void testConvert_EntriesOptionalProblemWithoutDate() {
        RuleEngine engine = new RuleEngine(TestFixtures.standardConcepts());
        MappingRule rule = TestFixtures.bundledRules().forSection("Problems").get(0);
        Element entry = TestFixtures.element("<observation classCode=\"OBS\" moodCode=\"EVN\">"
                + "<value code=\"44054006\" codeSystem=\"2.16.840.1.113883.6.96\"/></observation>");

        EntryMapping mapping = engine.mapEntry(rule, entry, 20L, Map.of(), false);
        RowResult result = converter.convert(mapping.getRecords().get(0));

        assertTrue(result.isPresent());
        ConditionOccurrence row = (ConditionOccurrence) result.getRow();
        assertEquals(201826L, row.getConditionConceptId());
        assertEquals(LocalDate.of(1, 1, 1), row.getConditionStartDate());
    }

    @Test
    public void testConvert_IntegerOutOfRangeLeftEmpty() {
        MappedRecord record = base(OmopTable.DRUG_EXPOSURE, "drug_exposure_id", "drug_exposure_start_date");
        record.put("refills", FieldValue.integer(3_000_000_000L));
        record.put("days_supply", FieldValue.integer(30L));

        DrugExposure drug = (DrugExposure) converter.convert(record).getRow();

        assertNull(drug.getRefills());
        assertEquals(30, drug.getDaysSupply());
    }

    @Test
    public void testConvert_MissingId() {
        MappedRecord record = new MappedRecord(OmopTable.OBSERVATION, "Obs");
        record.put("person_id", FieldValue.integer(2L));

        assertEquals("observation_id", converter.convert(record).getMissingColumn());
    }

    @Test
    public void testConvert_NumericColumns() {
        MappedRecord drugRecord = base(OmopTable.DRUG_EXPOSURE, "drug_exposure_id", "drug_exposure_start_date");
        drugRecord.put("quantity", FieldValue.decimal(2.5));
        drugRecord.put("refills", FieldValue.integer(3L));
        drugRecord.put("route_concept_id", FieldValue.integer(4132161L));

        DrugExposure drug = (DrugExposure) converter.convert(drugRecord).getRow();

        assertEquals(2.5, drug.getQuantity());
        assertEquals(3, drug.getRefills());
        assertEquals(4132161L, drug.getRouteConceptId());

        MappedRecord measurementRecord = base(OmopTable.MEASUREMENT, "measurement_id", "measurement_date");
        measurementRecord.put("value_as_number", FieldValue.integer(72L));
        measurementRecord.put("range_low", FieldValue.decimal(4.0));

        Measurement measurement = (Measurement) converter.convert(measurementRecord).getRow();

        assertEquals(72.0, measurement.getValueAsNumber());
        assertEquals(4.0, measurement.getRangeLow());
        assertNull(measurement.getRangeHigh());
    }

    @Test
    public void testConvert_PersonIsNotARuleTable() {
        MappedRecord record = new MappedRecord(OmopTable.PERSON, "Person");
        record.put("person_id", FieldValue.integer(2L));

        assertThrows(IllegalArgumentException.class, () -> converter.convert(record));
    }

    private static MappedRecord base(OmopTable table, String idColumn, String dateColumn) {
        MappedRecord record = new MappedRecord(table, "Test");
        record.put(idColumn, FieldValue.integer(10L));
        record.put("person_id", FieldValue.integer(20L));
        record.put(table.typeConceptColumn(), FieldValue.integer(32817L));
        record.put(dateColumn, FieldValue.timestamp(LocalDateTime.of(2024, 1, 10, 0, 0)));
        return record;
    }
}
