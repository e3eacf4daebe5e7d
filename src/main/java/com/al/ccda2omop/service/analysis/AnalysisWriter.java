package com.al.ccda2omop.service.analysis;

import com.al.ccda2omop.model.omop.OmopTable;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders code analysis results: the per-code CSV, a coverage summary and a
 * section to OMOP table overview.
 */
@Component
public class AnalysisWriter {

    static final List<String> CSV_HEADER = List.of(
            "Section", "XPath", "Source_Code", "Source_CodeSystem_OID", "Source_Vocabulary", "Source_DisplayName",
            "OMOP_Concept_ID", "OMOP_Concept_Name", "OMOP_Domain_ID", "OMOP_Vocabulary_ID", "Is_Standard",
            "Mapping_Status");

    private static final Map<String, OmopTable> DOMAIN_TABLES = Map.of(
            "Condition", OmopTable.CONDITION_OCCURRENCE,
            "Drug", OmopTable.DRUG_EXPOSURE,
            "Procedure", OmopTable.PROCEDURE_OCCURRENCE,
            "Measurement", OmopTable.MEASUREMENT,
            "Observation", OmopTable.OBSERVATION,
            "Device", OmopTable.DEVICE_EXPOSURE,
            "Visit", OmopTable.VISIT_OCCURRENCE);

    private static final String RULE = "=".repeat(80);

    public void writeCsv(List<CodeMapping> mappings, Writer out) throws IOException {
        CSVPrinter printer = new CSVPrinter(out, CSVFormat.DEFAULT);
        printer.printRecord(CSV_HEADER);
        for (CodeMapping m : mappings) {
            printer.printRecord(m.getSection(), m.getXpath(), m.getSourceCode(), m.getSourceCodeSystem(),
                    m.getSourceVocabulary(), m.getSourceDisplayName(), String.valueOf(m.getOmopConceptId()),
                    m.getOmopConceptName(), m.getOmopDomainId(), m.getOmopVocabularyId(),
                    String.valueOf(m.isStandard()), m.statusLabel());
        }
        printer.flush();
    }

    /**
     * Counts by section, mapping status and domain, followed by the codes
     * that did not resolve.
     */
    public void writeSummary(List<CodeMapping> mappings, Writer out) {
        Map<String, Integer> bySection = new TreeMap<>();
        Map<String, Integer> byStatus = new TreeMap<>();
        Map<String, Integer> byDomain = new TreeMap<>();
        for (CodeMapping m : mappings) {
            bySection.merge(m.getSection(), 1, Integer::sum);
            byStatus.merge(m.statusLabel(), 1, Integer::sum);
            if (!m.getOmopDomainId().isEmpty()) {
                byDomain.merge(m.getOmopDomainId(), 1, Integer::sum);
            }
        }

        PrintWriter w = new PrintWriter(out);
        w.printf("%n=== Analysis Summary ===%n%n");
        w.printf("Total codes found: %d%n%n", mappings.size());
        printCounts(w, "By Section:", bySection);
        w.println();
        printCounts(w, "By Mapping Status:", byStatus);
        w.println();
        printCounts(w, "By OMOP Domain:", byDomain);
        w.printf("%n=== Unmapped Codes ===%n");
        for (CodeMapping m : mappings) {
            if (m.isUnresolved()) {
                w.printf("  [%s] %s (%s) - %s%n", m.getSection(), m.getSourceCode(), m.getSourceVocabulary(),
                        m.getSourceDisplayName());
            }
        }
        w.flush();
    }

    /**
     * Per section: how many codes were found, how many resolved to a domain,
     * and the OMOP tables those domains populate, broken down by code XPath.
     */
    public void writeMappingSummary(List<CodeMapping> mappings, Writer out) {
        Map<String, Map<String, PathStats>> sections = new TreeMap<>();
        for (CodeMapping m : mappings) {
            PathStats stats = sections.computeIfAbsent(m.getSection(), k -> new TreeMap<>())
                    .computeIfAbsent(m.getXpath(), k -> new PathStats());
            stats.total++;
            if (!m.getOmopDomainId().isEmpty()) {
                stats.mapped++;
                stats.tables.merge(tableFor(m.getOmopDomainId()), 1, Integer::sum);
            }
        }

        PrintWriter w = new PrintWriter(out);
        w.printf("%n%s%nC-CDA to OMOP Mapping Summary%n%s%n%n", RULE, RULE);
        PathStats overall = new PathStats();
        for (Map.Entry<String, Map<String, PathStats>> section : sections.entrySet()) {
            PathStats sectionStats = new PathStats();
            section.getValue().values().forEach(sectionStats::add);
            overall.add(sectionStats);

            w.printf("C-CDA Section: %s%n", section.getKey());
            w.printf("  Total codes: %d, Mapped: %d (%s)%n", sectionStats.total, sectionStats.mapped,
                    percent(sectionStats.mapped, sectionStats.total));
            w.println("  OMOP Tables:");
            sectionStats.tables.forEach((table, count) -> w.printf("    -> %-25s %d codes%n", table, count));
            w.println("  Code Paths:");
            section.getValue().forEach((path, stats) -> w.printf("    %s -> %s (%d codes)%n", path,
                    stats.tables.isEmpty() ? "(no mapping)" : String.join(", ", stats.tables.keySet()),
                    stats.total));
            w.println();
        }

        w.printf("%s%nOverall Summary%n%s%n%n", RULE, RULE);
        w.printf("Total C-CDA codes analyzed: %d%n", overall.total);
        w.printf("Successfully mapped: %d (%s)%n", overall.mapped, percent(overall.mapped, overall.total));
        w.printf("Unmapped: %d (%s)%n%n", overall.total - overall.mapped,
                percent(overall.total - overall.mapped, overall.total));
        w.println("OMOP CDM Tables populated:");
        overall.tables.forEach((table, count) -> w.printf("  %-30s %d records%n", table, count));
        w.flush();
    }

    private static void printCounts(PrintWriter w, String title, Map<String, Integer> counts) {
        w.println(title);
        counts.forEach((key, count) -> w.printf("  %s: %d%n", key, count));
    }

    static String tableFor(String domainId) {
        OmopTable table = DOMAIN_TABLES.get(domainId);
        return table != null ? table.tableName() : domainId;
    }

    private static String percent(int part, int total) {
        double value = total == 0 ? 0.0 : 100.0 * part / total;
        return String.format(Locale.ROOT, "%.1f%%", value);
    }

    private static final class PathStats {
        private int total;
        private int mapped;
        private final Map<String, Integer> tables = new TreeMap<>();

        private void add(PathStats other) {
            total += other.total;
            mapped += other.mapped;
            other.tables.forEach((table, count) -> tables.merge(table, count, Integer::sum));
        }
    }
}
