package com.al.ccda2omop.service.output;

import com.al.ccda2omop.model.omop.ConditionOccurrence;
import com.al.ccda2omop.model.omop.OmopDataset;
import com.al.ccda2omop.model.omop.OmopRow;
import com.al.ccda2omop.model.omop.OmopTable;
import com.al.ccda2omop.model.omop.Person;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CsvTableWriterTest {

    private final CsvTableWriter writer = new CsvTableWriter();

    @Test
    public void testWrite_HeaderAndFormattedCells() throws IOException {
        ConditionOccurrence row = ConditionOccurrence.builder()
                .conditionOccurrenceId(10L)
                .personId(20L)
                .conditionConceptId(201826L)
                .conditionStartDate(LocalDate.of(2024, 1, 10))
                .conditionStartDatetime(LocalDateTime.of(2024, 1, 10, 8, 30))
                .conditionTypeConceptId(32817L)
                .conditionSourceValue("44054006: Type 2 diabetes mellitus, uncontrolled")
                .mappingRule("RuleMapper:Problems_to_condition_occurrence")
                .sourceFile("doc.xml")
                .build();
        StringWriter out = new StringWriter();

        writer.write(OmopTable.CONDITION_OCCURRENCE, List.<OmopRow>of(row), out);

        String csv = out.toString();
        assertTrue(csv.startsWith(String.join(",", OmopTable.CONDITION_OCCURRENCE.columns()) + "\r\n"));
        assertTrue(csv.contains("\"44054006: Type 2 diabetes mellitus, uncontrolled\""));

        List<CSVRecord> records = CSVParser.parse(new StringReader(csv), CSVFormat.DEFAULT).getRecords();
        assertEquals(2, records.size());
        CSVRecord data = records.get(1);
        assertEquals(OmopTable.CONDITION_OCCURRENCE.columns().size(), data.size());
        assertEquals("10", data.get(0));
        assertEquals("2024-01-10", data.get(3));
        assertEquals("2024-01-10 08:30:00", data.get(4));
        assertEquals("", data.get(5));
        assertEquals("32817", data.get(7));
        assertEquals("44054006: Type 2 diabetes mellitus, uncontrolled", data.get(13));
        assertEquals("doc.xml", data.get(17));
    }

    @Test
    public void testWriteAll_EveryTableGetsAFile(@TempDir Path dir) throws IOException {
        OmopDataset data = new OmopDataset();
        data.add(Person.builder().personId(1L).yearOfBirth(1980).mappingRule("RuleMapper:Person").build());
        Path output = dir.resolve("omop");

        List<Path> files = writer.writeAll(data, output);

        assertEquals(OmopTable.values().length, files.size());
        for (OmopTable table : OmopTable.values()) {
            assertTrue(Files.exists(output.resolve(table.fileName())), table.fileName());
        }
        List<String> person = Files.readAllLines(output.resolve("person.csv"), StandardCharsets.UTF_8);
        assertEquals(2, person.size());
        assertTrue(person.get(1).startsWith("1,0,1980,"));
        List<String> devices = Files.readAllLines(output.resolve("device_exposure.csv"), StandardCharsets.UTF_8);
        assertEquals(1, devices.size());
        assertTrue(devices.get(0).startsWith("device_exposure_id,person_id,device_concept_id"));
    }
}
