package com.al.ccda2omop.service.conversion;

import com.al.ccda2omop.dto.ConversionError;
import com.al.ccda2omop.model.omop.OmopDataset;
import com.al.ccda2omop.report.ConversionReport;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Aggregated rows, the finished report and any per-document failures of a
 * batch run.
 */
@Getter
@AllArgsConstructor
public class BatchResult {

    private final OmopDataset dataset;
    private final ConversionReport report;
    private final List<ConversionError> errors;
    private final long processingTimeMs;

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
