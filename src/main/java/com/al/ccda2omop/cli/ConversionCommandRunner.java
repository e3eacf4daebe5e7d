package com.al.ccda2omop.cli;

import com.al.ccda2omop.config.ConversionProperties;
import com.al.ccda2omop.model.omop.OmopDataset;
import com.al.ccda2omop.model.omop.OmopTable;
import com.al.ccda2omop.report.ReportRenderer;
import com.al.ccda2omop.service.analysis.AnalysisWriter;
import com.al.ccda2omop.service.analysis.CodeAnalyzer;
import com.al.ccda2omop.service.analysis.CodeMapping;
import com.al.ccda2omop.service.conversion.BatchConversionService;
import com.al.ccda2omop.service.conversion.BatchResult;
import com.al.ccda2omop.service.conversion.InputCollector;
import com.al.ccda2omop.service.output.CsvTableWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line conversion: collects the input files, converts them as one
 * batch, writes the OMOP CSV files and optionally the report. In analyze
 * mode it lists the coded values of the input instead. Active only when an
 * input is given; the exit code is 0 on success and 1 on failure.
 *
 * @author CCDA2OMOP Team
 * @since 1.0.0
 */
@Component
@ConditionalOnProperty(prefix = "app.conversion", name = "input")
@Slf4j
public class ConversionCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private final ConversionProperties properties;
    private final InputCollector inputCollector;
    private final BatchConversionService batchConversionService;
    private final CsvTableWriter csvTableWriter;
    private final ReportRenderer reportRenderer;
    private final CodeAnalyzer codeAnalyzer;
    private final AnalysisWriter analysisWriter;
    private final PrintStream out;
    private final PrintStream err;

    private int exitCode;

    @Autowired
    public ConversionCommandRunner(ConversionProperties properties, InputCollector inputCollector,
            BatchConversionService batchConversionService, CsvTableWriter csvTableWriter,
            ReportRenderer reportRenderer, CodeAnalyzer codeAnalyzer, AnalysisWriter analysisWriter) {
        this(properties, inputCollector, batchConversionService, csvTableWriter, reportRenderer, codeAnalyzer,
                analysisWriter, System.out, System.err);
    }

    ConversionCommandRunner(ConversionProperties properties, InputCollector inputCollector,
            BatchConversionService batchConversionService, CsvTableWriter csvTableWriter,
            ReportRenderer reportRenderer, CodeAnalyzer codeAnalyzer, AnalysisWriter analysisWriter,
            PrintStream out, PrintStream err) {
        this.properties = properties;
        this.inputCollector = inputCollector;
        this.batchConversionService = batchConversionService;
        this.csvTableWriter = csvTableWriter;
        this.reportRenderer = reportRenderer;
        this.codeAnalyzer = codeAnalyzer;
        this.analysisWriter = analysisWriter;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute();
    }

    int execute() {
        Path input = Path.of(properties.getInput());
        Path outputDir = Path.of(properties.getOutputDir());

        BatchResult result;
        List<Path> files;
        try {
            files = inputCollector.collect(input);
            if (files.isEmpty()) {
                err.println("No XML files found in directory: " + input);
                return 1;
            }
            if (properties.isVerbose()) {
                log.info("Found {} XML files in {}", files.size(), input);
            }
            if (properties.isAnalyze()) {
                return analyze(files);
            }
            result = batchConversionService.convertFiles(files);
            csvTableWriter.writeAll(result.getDataset(), outputDir);
        } catch (IOException | RuntimeException e) {
            log.debug("Conversion failed", e);
            err.println("Conversion failed: " + e.getMessage());
            return 1;
        }

        out.println("Conversion complete. Processed " + files.size() + " file(s). Output written to: "
                + properties.getOutputDir());
        out.println("  " + summary(result.getDataset()));
        result.getErrors().forEach(e -> err.println("Skipped " + e.getSourceFile() + ": " + e.getMessage()));

        if (properties.isReport()) {
            try {
                writeReport(result);
            } catch (IOException | RuntimeException e) {
                err.println("Failed to write report: " + e.getMessage());
                return 1;
            }
        }
        return 0;
    }

    private int analyze(List<Path> files) {
        List<CodeMapping> mappings = new ArrayList<>();
        try {
            for (Path file : files) {
                mappings.addAll(codeAnalyzer.analyze(file));
            }
            Writer stdout = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            if (properties.isAnalyzeSummary()) {
                analysisWriter.writeMappingSummary(mappings, stdout);
                return 0;
            }
            String target = properties.getAnalyzeOutput();
            if (target == null || target.isBlank()) {
                analysisWriter.writeCsv(mappings, stdout);
                return 0;
            }
            Path path = Path.of(target);
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                analysisWriter.writeCsv(mappings, writer);
            }
            analysisWriter.writeSummary(mappings, new OutputStreamWriter(err, StandardCharsets.UTF_8));
            out.println("Analysis written to: " + target);
            return 0;
        } catch (IOException | RuntimeException e) {
            log.debug("Analysis failed", e);
            err.println("Analysis failed: " + e.getMessage());
            return 1;
        }
    }

    private void writeReport(BatchResult result) throws IOException {
        String target = properties.getReportOutput();
        if (target == null || target.isBlank()) {
            Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            reportRenderer.write(result.getReport(), ReportRenderer.Format.TEXT, writer);
            return;
        }
        reportRenderer.write(result.getReport(), Path.of(target));
        out.println("Report written to: " + target);
    }

    static String summary(OmopDataset data) {
        return data.count(OmopTable.PERSON) + " person, "
                + data.count(OmopTable.VISIT_OCCURRENCE) + " visit, "
                + data.count(OmopTable.CONDITION_OCCURRENCE) + " condition, "
                + data.count(OmopTable.DRUG_EXPOSURE) + " drug, "
                + data.count(OmopTable.PROCEDURE_OCCURRENCE) + " procedure, "
                + data.count(OmopTable.MEASUREMENT) + " measurement, "
                + data.count(OmopTable.OBSERVATION) + " observation, "
                + data.count(OmopTable.DEVICE_EXPOSURE) + " device";
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
