package com.al.ccda2omop.report;

import com.al.ccda2omop.model.omop.ConditionOccurrence;
import com.al.ccda2omop.model.omop.DeviceExposure;
import com.al.ccda2omop.model.omop.DrugExposure;
import com.al.ccda2omop.model.omop.Measurement;
import com.al.ccda2omop.model.omop.Observation;
import com.al.ccda2omop.model.omop.OmopDataset;
import com.al.ccda2omop.model.omop.OmopTable;
import com.al.ccda2omop.model.omop.ProcedureOccurrence;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Coverage and quality metrics for a conversion run.
 *
 * <p>
 * Per-document counters (sections, skips, concept mappings, routing) are
 * collected while mapping and combined with {@link #merge(ConversionReport)};
 * table counts and field population are computed once from the aggregated
 * dataset by {@link #calculateFromDataset(OmopDataset)}.
 *
 * @author CCDA2OMOP Team
 * @since 1.0.0
 */
@Getter
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({ "documentsProcessed", "documentsWithErrors", "entriesBySection", "recordsByTable",
        "fieldPopulation", "conceptMappings", "domainRouting", "skippedEntries" })
public class ConversionReport {

    private int documentsProcessed;
    private int documentsWithErrors;
    private final Map<String, SectionMetrics> entriesBySection = new LinkedHashMap<>();
    private final Map<String, Integer> recordsByTable = new LinkedHashMap<>();
    private final Map<String, Map<String, FieldStats>> fieldPopulation = new LinkedHashMap<>();
    private final Map<String, VocabStats> conceptMappings = new LinkedHashMap<>();
    private final List<DomainRoute> domainRouting = new ArrayList<>();
    private final Map<String, Integer> skippedEntries = new LinkedHashMap<>();

    public void addDocument(boolean hasError) {
        documentsProcessed++;
        if (hasError) {
            documentsWithErrors++;
        }
    }

    public void addSectionEntry(String section) {
        section(section).entriesFound++;
    }

    public void addSectionRecord(String section, String targetTable) {
        SectionMetrics metrics = section(section);
        metrics.recordsCreated++;
        metrics.targetTables.merge(targetTable, 1, Integer::sum);
    }

    public void addSkipped(String section, String reason) {
        section(section).skipped++;
        skippedEntries.merge(reason, 1, Integer::sum);
    }

    public void addConceptMapping(String vocabulary, boolean mappedToStandard) {
        VocabStats stats = conceptMappings.computeIfAbsent(vocabulary, k -> new VocabStats());
        stats.codesSeen++;
        if (mappedToStandard) {
            stats.mappedStandard++;
        } else {
            stats.sourceOnly++;
        }
    }

    /**
     * Count a record routed away from the section's primary table. Routes are
     * keyed by section and tables; the first reason recorded is kept.
     */
    public void addDomainRoute(String section, String originalTarget, String actualTarget, String reason) {
        addDomainRoute(section, originalTarget, actualTarget, reason, 1);
    }

    private void addDomainRoute(String section, String originalTarget, String actualTarget, String reason,
            int count) {
        for (DomainRoute route : domainRouting) {
            if (route.sourceSection.equals(section) && route.originalTarget.equals(originalTarget)
                    && route.actualTarget.equals(actualTarget)) {
                route.count += count;
                return;
            }
        }
        domainRouting.add(new DomainRoute(section, originalTarget, actualTarget, count, reason));
    }

    /**
     * Add another report's counters to this one.
     */
    public void merge(ConversionReport other) {
        documentsProcessed += other.documentsProcessed;
        documentsWithErrors += other.documentsWithErrors;
        other.entriesBySection.forEach((name, metrics) -> {
            SectionMetrics target = section(name);
            target.entriesFound += metrics.entriesFound;
            target.recordsCreated += metrics.recordsCreated;
            target.skipped += metrics.skipped;
            metrics.targetTables.forEach((table, n) -> target.targetTables.merge(table, n, Integer::sum));
        });
        other.recordsByTable.forEach((table, n) -> recordsByTable.merge(table, n, Integer::sum));
        other.conceptMappings.forEach((vocab, stats) -> {
            VocabStats target = conceptMappings.computeIfAbsent(vocab, k -> new VocabStats());
            target.codesSeen += stats.codesSeen;
            target.mappedStandard += stats.mappedStandard;
            target.sourceOnly += stats.sourceOnly;
        });
        other.domainRouting.forEach(r -> addDomainRoute(r.sourceSection, r.originalTarget, r.actualTarget,
                r.reason, r.count));
        other.skippedEntries.forEach((reason, n) -> skippedEntries.merge(reason, n, Integer::sum));
    }

    /**
     * Set record counts for all tables and field population rates for the
     * clinical tables from the final dataset.
     */
    public void calculateFromDataset(OmopDataset data) {
        for (OmopTable table : OmopTable.values()) {
            recordsByTable.put(table.tableName(), data.count(table));
        }

        List<ConditionOccurrence> conditions = data.rows(OmopTable.CONDITION_OCCURRENCE, ConditionOccurrence.class);
        Population<ConditionOccurrence> condition = new Population<>(conditions);
        condition.field("condition_concept_id (>0)", r -> positive(r.getConditionConceptId()));
        condition.field("condition_end_date", r -> r.getConditionEndDate() != null);
        condition.field("condition_source_value", r -> notEmpty(r.getConditionSourceValue()));
        condition.field("visit_occurrence_id", r -> r.getVisitOccurrenceId() != null);
        condition.store(OmopTable.CONDITION_OCCURRENCE);

        Population<DrugExposure> drug = new Population<>(data.rows(OmopTable.DRUG_EXPOSURE, DrugExposure.class));
        drug.field("drug_concept_id (>0)", r -> positive(r.getDrugConceptId()));
        drug.field("quantity", r -> r.getQuantity() != null);
        drug.field("route_concept_id (>0)", r -> positive(r.getRouteConceptId()));
        drug.field("drug_source_value", r -> notEmpty(r.getDrugSourceValue()));
        drug.store(OmopTable.DRUG_EXPOSURE);

        Population<ProcedureOccurrence> procedure =
                new Population<>(data.rows(OmopTable.PROCEDURE_OCCURRENCE, ProcedureOccurrence.class));
        procedure.field("procedure_concept_id (>0)", r -> positive(r.getProcedureConceptId()));
        procedure.field("procedure_source_value", r -> notEmpty(r.getProcedureSourceValue()));
        procedure.field("visit_occurrence_id", r -> r.getVisitOccurrenceId() != null);
        procedure.store(OmopTable.PROCEDURE_OCCURRENCE);

        Population<Measurement> measurement =
                new Population<>(data.rows(OmopTable.MEASUREMENT, Measurement.class));
        measurement.field("measurement_concept_id (>0)", r -> positive(r.getMeasurementConceptId()));
        measurement.field("value_as_number", r -> r.getValueAsNumber() != null);
        measurement.field("value_as_concept_id (>0)", r -> positive(r.getValueAsConceptId()));
        measurement.field("unit_concept_id (>0)", r -> positive(r.getUnitConceptId()));
        measurement.field("range_low/high", r -> r.getRangeLow() != null || r.getRangeHigh() != null);
        measurement.field("measurement_source_value", r -> notEmpty(r.getMeasurementSourceValue()));
        measurement.store(OmopTable.MEASUREMENT);

        Population<Observation> observation =
                new Population<>(data.rows(OmopTable.OBSERVATION, Observation.class));
        observation.field("observation_concept_id (>0)", r -> positive(r.getObservationConceptId()));
        observation.field("value_as_number", r -> r.getValueAsNumber() != null);
        observation.field("value_as_string", r -> notEmpty(r.getValueAsString()));
        observation.field("value_as_concept_id (>0)", r -> positive(r.getValueAsConceptId()));
        observation.field("observation_source_value", r -> notEmpty(r.getObservationSourceValue()));
        observation.store(OmopTable.OBSERVATION);

        Population<DeviceExposure> device =
                new Population<>(data.rows(OmopTable.DEVICE_EXPOSURE, DeviceExposure.class));
        device.field("device_concept_id (>0)", r -> positive(r.getDeviceConceptId()));
        device.field("device_source_value", r -> notEmpty(r.getDeviceSourceValue()));
        device.field("unique_device_id", r -> notEmpty(r.getUniqueDeviceId()));
        device.store(OmopTable.DEVICE_EXPOSURE);
    }

    private SectionMetrics section(String name) {
        return entriesBySection.computeIfAbsent(name, k -> new SectionMetrics());
    }

    private static boolean positive(Long value) {
        return value != null && value > 0;
    }

    private static boolean notEmpty(String value) {
        return value != null && !value.isEmpty();
    }

    /**
     * Population counts for one table; tables without rows are left out.
     */
    private final class Population<T> {
        private final List<T> rows;
        private final Map<String, FieldStats> fields = new LinkedHashMap<>();

        private Population(List<T> rows) {
            this.rows = rows;
        }

        private void field(String name, Predicate<T> populated) {
            int count = (int) rows.stream().filter(populated).count();
            fields.put(name, new FieldStats(count, rows.size()));
        }

        private void store(OmopTable table) {
            if (!rows.isEmpty()) {
                fieldPopulation.put(table.tableName(), fields);
            }
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonPropertyOrder({ "entriesFound", "recordsCreated", "skipped", "targetTables" })
    public static class SectionMetrics {
        private int entriesFound;
        private int recordsCreated;
        private int skipped;
        private Map<String, Integer> targetTables = new LinkedHashMap<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FieldStats {
        private int populated;
        private int total;

        public double rate() {
            return total > 0 ? populated * 100.0 / total : 0.0;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonPropertyOrder({ "codesSeen", "mappedStandard", "sourceOnly" })
    public static class VocabStats {
        private int codesSeen;
        private int mappedStandard;
        private int sourceOnly;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonPropertyOrder({ "sourceSection", "originalTarget", "actualTarget", "count", "reason" })
    public static class DomainRoute {
        private String sourceSection;
        private String originalTarget;
        private String actualTarget;
        private int count;
        private String reason;
    }
}
