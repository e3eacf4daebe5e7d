package com.al.ccda2omop.report;

import com.al.ccda2omop.model.omop.OmopTable;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Renders a {@link ConversionReport} as markdown text or JSON.
 *
 * @author CCDA2OMOP Team
 * @since 1.0.0
 */
@Component
public class ReportRenderer {

    public enum Format {
        TEXT, JSON;

        /**
         * JSON for a {@code .json} file name, text otherwise.
         */
        public static Format forPath(Path path) {
            return path.getFileName() != null && path.getFileName().toString().endsWith(".json") ? JSON : TEXT;
        }

        public static Format fromName(String name) {
            return name != null && name.equalsIgnoreCase("json") ? JSON : TEXT;
        }
    }

    private final ObjectMapper mapper;

    public ReportRenderer() {
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(ConversionReport report, Path file) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(report, Format.forPath(file), out);
        }
    }

    public void write(ConversionReport report, Format format, Writer out) throws IOException {
        if (format == Format.JSON) {
            out.write(toJson(report));
        } else {
            writeText(report, out);
        }
        out.flush();
    }

    public String render(ConversionReport report, Format format) {
        StringWriter out = new StringWriter();
        try {
            write(report, format, out);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to render report", e);
        }
        return out.toString();
    }

    public String toJson(ConversionReport report) throws IOException {
        return mapper.writeValueAsString(report);
    }

    void writeText(ConversionReport report, Writer w) throws IOException {
        w.write("# CCDA-to-OMOP Conversion Report\n\n");

        w.write("## Document Summary\n\n");
        w.write("| Metric | Value |\n");
        w.write("|--------|-------|\n");
        w.write("| Documents Processed | " + report.getDocumentsProcessed() + " |\n");
        w.write("| Documents with Errors | " + report.getDocumentsWithErrors() + " |\n");
        if (report.getDocumentsProcessed() > 0) {
            double success = (report.getDocumentsProcessed() - report.getDocumentsWithErrors()) * 100.0
                    / report.getDocumentsProcessed();
            w.write("| Success Rate | " + percent(success) + " |\n");
        }
        w.write("\n");

        w.write("## Records Created by OMOP Table\n\n");
        w.write("| Table | Records |\n");
        w.write("|-------|--------:|\n");
        int total = 0;
        for (OmopTable table : OmopTable.values()) {
            int count = report.getRecordsByTable().getOrDefault(table.tableName(), 0);
            total += count;
            w.write("| " + table.tableName() + " | " + count + " |\n");
        }
        w.write("| **Total** | **" + total + "** |\n");
        w.write("\n");

        if (!report.getEntriesBySection().isEmpty()) {
            w.write("## CCDA Section to OMOP Table Mapping\n\n");
            w.write("| Section | Records | Target Tables |\n");
            w.write("|---------|--------:|---------------|\n");
            for (Map.Entry<String, ConversionReport.SectionMetrics> e
                    : new TreeMap<>(report.getEntriesBySection()).entrySet()) {
                w.write("| " + e.getKey() + " | " + e.getValue().getRecordsCreated() + " | "
                        + targetTables(e.getValue().getTargetTables()) + " |\n");
            }
            w.write("\n");
        }

        if (!report.getFieldPopulation().isEmpty()) {
            w.write("## Field Population Rates\n\n");
            for (OmopTable table : OmopTable.values()) {
                Map<String, ConversionReport.FieldStats> fields = report.getFieldPopulation().get(table.tableName());
                if (fields == null || fields.isEmpty()) {
                    continue;
                }
                w.write("### " + table.tableName() + "\n\n");
                w.write("| Field | Populated | Total | Rate |\n");
                w.write("|-------|----------:|------:|-----:|\n");
                for (Map.Entry<String, ConversionReport.FieldStats> f : new TreeMap<>(fields).entrySet()) {
                    ConversionReport.FieldStats stats = f.getValue();
                    w.write("| " + f.getKey() + " | " + stats.getPopulated() + " | " + stats.getTotal() + " | "
                            + percent(stats.rate()) + " |\n");
                }
                w.write("\n");
            }
        }

        if (!report.getConceptMappings().isEmpty()) {
            w.write("## Concept Mapping Quality\n\n");
            w.write("| Vocabulary | Codes Seen | Mapped Standard | Source Only | Rate |\n");
            w.write("|------------|----------:|-----------------:|------------:|-----:|\n");
            for (Map.Entry<String, ConversionReport.VocabStats> e
                    : new TreeMap<>(report.getConceptMappings()).entrySet()) {
                ConversionReport.VocabStats stats = e.getValue();
                double rate = stats.getCodesSeen() > 0 ? stats.getMappedStandard() * 100.0 / stats.getCodesSeen() : 0;
                w.write("| " + e.getKey() + " | " + stats.getCodesSeen() + " | " + stats.getMappedStandard()
                        + " | " + stats.getSourceOnly() + " | " + percent(rate) + " |\n");
            }
            w.write("\n");
        }

        if (!report.getDomainRouting().isEmpty()) {
            w.write("## Domain Routing\n\n");
            w.write("Records moved to different tables based on OMOP concept domain:\n\n");
            w.write("| Source Section | Original Target | Actual Target | Count | Reason |\n");
            w.write("|----------------|-----------------|---------------|------:|--------|\n");
            for (ConversionReport.DomainRoute route : report.getDomainRouting()) {
                w.write("| " + route.getSourceSection() + " | " + route.getOriginalTarget() + " | "
                        + route.getActualTarget() + " | " + route.getCount() + " | " + route.getReason() + " |\n");
            }
            w.write("\n");
        }

        if (!report.getSkippedEntries().isEmpty()) {
            w.write("## Skipped Entries\n\n");
            w.write("| Reason | Count |\n");
            w.write("|--------|------:|\n");
            for (Map.Entry<String, Integer> e : new TreeMap<>(report.getSkippedEntries()).entrySet()) {
                w.write("| " + e.getKey() + " | " + e.getValue() + " |\n");
            }
            w.write("\n");
        }
    }

    static String targetTables(Map<String, Integer> tables) {
        if (tables == null || tables.isEmpty()) {
            return "-";
        }
        return new TreeMap<>(tables).entrySet().stream()
                .map(e -> e.getKey() + "(" + e.getValue() + ")")
                .collect(Collectors.joining(", "));
    }

    /**
     * One decimal place, half-even on the exact binary value.
     */
    static String percent(double rate) {
        return new BigDecimal(rate).setScale(1, RoundingMode.HALF_EVEN).toPlainString() + "%";
    }
}
