package com.al.ccda2omop.service.mapper;

import com.al.ccda2omop.model.omop.OmopDataset;
import com.al.ccda2omop.report.ConversionReport;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Rows and report counters produced from one document.
 */
@Getter
@AllArgsConstructor
public class MappingResult {
    private final OmopDataset dataset;
    private final ConversionReport report;
}
