package com.al.ccda2omop.cli;

import com.al.ccda2omop.TestFixtures;
import com.al.ccda2omop.config.ConversionProperties;
import com.al.ccda2omop.model.omop.OmopDataset;
import com.al.ccda2omop.model.omop.Person;
import com.al.ccda2omop.report.ReportRenderer;
import com.al.ccda2omop.service.analysis.AnalysisWriter;
import com.al.ccda2omop.service.analysis.CodeAnalyzer;
import com.al.ccda2omop.service.conversion.BatchConversionService;
import com.al.ccda2omop.service.conversion.ConversionService;
import com.al.ccda2omop.service.conversion.InputCollector;
import com.al.ccda2omop.service.output.CsvTableWriter;
import com.al.ccda2omop.service.parser.CcdaParser;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConversionCommandRunner.
 */
public class ConversionCommandRunnerTest {

    @TempDir
    Path dir;

    private ConversionProperties properties;
    private BatchConversionService batchService;
    private ConversionCommandRunner runner;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private Path inputDir;
    private Path outputDir;

    @BeforeEach
    public void setUp() throws IOException {
        properties = new ConversionProperties();
        properties.setBatchThreads(1);
        inputDir = Files.createDirectory(dir.resolve("in"));
        outputDir = dir.resolve("out");
        properties.setInput(inputDir.toString());
        properties.setOutputDir(outputDir.toString());

        ConversionService conversionService = new ConversionService(new CcdaParser(),
                TestFixtures.documentMapper(TestFixtures.bundledRules()), new SimpleMeterRegistry(), properties);
        batchService = new BatchConversionService(conversionService, properties);
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        CodeAnalyzer analyzer = new CodeAnalyzer(TestFixtures.bundledRules(), TestFixtures.vocabulary(),
                new CcdaParser());
        runner = new ConversionCommandRunner(properties, new InputCollector(), batchService, new CsvTableWriter(),
                new ReportRenderer(), analyzer, new AnalysisWriter(), new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    public void tearDown() {
        batchService.shutdown();
    }

    private void copySample(String name) throws IOException {
        Files.write(inputDir.resolve(name), TestFixtures.sampleCcda());
    }

    @Test
    public void testExecute_WritesCsvFiles() throws IOException {
        copySample("sample.xml");

        assertEquals(0, runner.execute());

        String stdout = out.toString(StandardCharsets.UTF_8);
        assertTrue(stdout.contains("Conversion complete. Processed 1 file(s). Output written to: " + outputDir));
        assertTrue(stdout.contains("1 person, 2 visit, 3 condition, 1 drug, 0 procedure, 2 measurement, "
                + "1 observation, 0 device"));
        assertEquals(4, Files.readAllLines(outputDir.resolve("condition_occurrence.csv")).size());
        assertEquals(1, Files.readAllLines(outputDir.resolve("procedure_occurrence.csv")).size());
    }

    @Test
    public void testExecute_ReportToStdout() throws IOException {
        copySample("sample.xml");
        properties.setReport(true);

        assertEquals(0, runner.execute());

        String stdout = out.toString(StandardCharsets.UTF_8);
        assertTrue(stdout.contains("# CCDA-to-OMOP Conversion Report"));
        assertTrue(stdout.contains("| Documents Processed | 1 |"));
    }

    @Test
    public void testExecute_ReportToJsonFile() throws IOException {
        copySample("sample.xml");
        Path report = dir.resolve("reports/report.json");
        properties.setReport(true);
        properties.setReportOutput(report.toString());

        assertEquals(0, runner.execute());

        assertTrue(out.toString(StandardCharsets.UTF_8).contains("Report written to: " + report));
        assertTrue(Files.readString(report).contains("\"documents_processed\" : 1"));
    }

    @Test
    public void testExecute_EmptyDirectory() {
        assertEquals(1, runner.execute());

        assertTrue(err.toString(StandardCharsets.UTF_8).contains("No XML files found in directory: " + inputDir));
        assertFalse(Files.exists(outputDir));
    }

    @Test
    public void testExecute_MissingInput() {
        properties.setInput(dir.resolve("missing").toString());

        assertEquals(1, runner.execute());

        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("Conversion failed: Input path does not exist"));
    }

    @Test
    public void testExecute_FailingDocumentAborts() throws IOException {
        copySample("a.xml");
        Files.writeString(inputDir.resolve("b.xml"), "<ClinicalDocument>");

        assertEquals(1, runner.execute());

        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Conversion failed: Failed to process b.xml"));
        assertFalse(Files.exists(outputDir));
    }

    @Test
    public void testExecute_ContinueOnError() throws IOException {
        copySample("a.xml");
        Files.writeString(inputDir.resolve("b.xml"), "<ClinicalDocument>");
        properties.setContinueOnError(true);

        assertEquals(0, runner.execute());

        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Skipped b.xml: Failed to process b.xml"));
        assertEquals(2, Files.readAllLines(outputDir.resolve("person.csv")).size());
    }

    @Test
    public void testExecute_AnalyzeToStdout() throws IOException {
        copySample("sample.xml");
        properties.setAnalyze(true);

        assertEquals(0, runner.execute());

        String stdout = out.toString(StandardCharsets.UTF_8);
        assertTrue(stdout.startsWith("Section,XPath,Source_Code,"));
        assertTrue(stdout.contains("Problems,"));
        assertFalse(Files.exists(outputDir));
    }

    @Test
    public void testExecute_AnalyzeToFile() throws IOException {
        copySample("sample.xml");
        Path csv = dir.resolve("analysis/codes.csv");
        properties.setAnalyze(true);
        properties.setAnalyzeOutput(csv.toString());

        assertEquals(0, runner.execute());

        assertTrue(out.toString(StandardCharsets.UTF_8).contains("Analysis written to: " + csv));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("=== Analysis Summary ==="));
        List<String> lines = Files.readAllLines(csv);
        assertTrue(lines.size() > 1);
        assertTrue(lines.get(0).endsWith("Is_Standard,Mapping_Status"));
    }

    @Test
    public void testExecute_AnalyzeSummary() throws IOException {
        copySample("sample.xml");
        properties.setAnalyze(true);
        properties.setAnalyzeSummary(true);

        assertEquals(0, runner.execute());

        String stdout = out.toString(StandardCharsets.UTF_8);
        assertTrue(stdout.contains("C-CDA to OMOP Mapping Summary"));
        assertTrue(stdout.contains("C-CDA Section: Problems"));
        assertTrue(stdout.contains("Overall Summary"));
    }

    @Test
    public void testSummary() {
        OmopDataset data = new OmopDataset();
        data.add(Person.builder().personId(1L).build());

        assertEquals("1 person, 0 visit, 0 condition, 0 drug, 0 procedure, 0 measurement, 0 observation, 0 device",
                ConversionCommandRunner.summary(data));
    }
}
