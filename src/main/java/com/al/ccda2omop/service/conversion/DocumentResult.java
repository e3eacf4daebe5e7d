package com.al.ccda2omop.service.conversion;

import com.al.ccda2omop.model.omop.OmopDataset;
import com.al.ccda2omop.report.ConversionReport;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Rows and per-document report counters for one converted document.
 */
@Getter
@AllArgsConstructor
public class DocumentResult {

    private final String sourceFile;
    private final OmopDataset dataset;
    private final ConversionReport report;

    /**
     * A finished report for this document alone, with document and table
     * counts filled in.
     */
    public ConversionReport toReport() {
        ConversionReport finished = new ConversionReport();
        finished.merge(report);
        finished.addDocument(false);
        finished.calculateFromDataset(dataset);
        return finished;
    }
}
