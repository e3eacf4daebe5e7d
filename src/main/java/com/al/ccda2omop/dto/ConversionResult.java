package com.al.ccda2omop.dto;

import com.al.ccda2omop.model.omop.OmopDataset;
import com.al.ccda2omop.model.omop.OmopRow;
import com.al.ccda2omop.model.omop.OmopTable;
import com.al.ccda2omop.report.ConversionReport;
import com.al.ccda2omop.service.output.OmopValueFormatter;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OMOP rows produced from one document, keyed by table, with cells
 * formatted as they appear in the CSV output.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ConversionResult {

    private String sourceFile;

    @Builder.Default
    private Map<String, Integer> recordCounts = new LinkedHashMap<>();

    /**
     * Non-empty tables only
     */
    @Builder.Default
    private Map<String, List<Map<String, String>>> tables = new LinkedHashMap<>();

    private ConversionReport report;

    public static ConversionResult of(String sourceFile, OmopDataset dataset, ConversionReport report) {
        ConversionResult result = ConversionResult.builder()
                .sourceFile(sourceFile)
                .report(report)
                .build();
        for (OmopTable table : OmopTable.values()) {
            List<OmopRow> rows = dataset.rows(table);
            result.getRecordCounts().put(table.tableName(), rows.size());
            if (rows.isEmpty()) {
                continue;
            }
            List<Map<String, String>> rendered = new ArrayList<>(rows.size());
            for (OmopRow row : rows) {
                Map<String, String> cells = new LinkedHashMap<>();
                List<Object> values = row.values();
                for (int i = 0; i < table.columns().size(); i++) {
                    cells.put(table.columns().get(i), OmopValueFormatter.format(values.get(i)));
                }
                rendered.add(cells);
            }
            result.getTables().put(table.tableName(), rendered);
        }
        return result;
    }
}
