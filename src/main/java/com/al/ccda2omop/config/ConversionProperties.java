package com.al.ccda2omop.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Conversion settings bound from {@code app.conversion.*}. The command line
 * options of the CLI are translated onto these keys at startup.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app.conversion")
@Validated
public class ConversionProperties {

    /**
     * C-CDA file or directory of {@code *.xml} files to convert (CLI mode).
     */
    private String input;

    /**
     * OMOP CONCEPT table (tab-delimited). Without it every concept lookup misses.
     */
    private String conceptFile;

    /**
     * OMOP CONCEPT_RELATIONSHIP table (tab-delimited).
     */
    private String relationshipFile;

    /**
     * Directory of supplementary concept files ({@code *.csv}, tab-delimited).
     */
    private String vocabDir;

    /**
     * Rule file or directory of rule files. Empty means the bundled rules.
     */
    private String rulesPath;

    @NotBlank
    private String outputDir = "./output";

    /**
     * Produce a conversion report.
     */
    private boolean report;

    /**
     * Report destination; a {@code .json} suffix selects JSON. Empty prints text to stdout.
     */
    private String reportOutput;

    /**
     * Record a failing document and keep going instead of aborting the batch.
     */
    private boolean continueOnError;

    /**
     * Worker threads for batch conversion; 0 means max(4, available processors).
     */
    @Min(0)
    private int batchThreads;

    private boolean verbose;

    /**
     * List the coded values of the input and how they resolve instead of converting.
     */
    private boolean analyze;

    /**
     * Analysis CSV destination. Empty prints the CSV to stdout.
     */
    private String analyzeOutput;

    /**
     * Print the section to OMOP table overview instead of the per-code CSV.
     */
    private boolean analyzeSummary;

    public int effectiveBatchThreads() {
        return batchThreads > 0 ? batchThreads : Math.max(4, Runtime.getRuntime().availableProcessors());
    }
}
