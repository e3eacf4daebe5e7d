package com.al.ccda2omop.service.output;

import com.al.ccda2omop.model.omop.OmopDataset;
import com.al.ccda2omop.model.omop.OmopRow;
import com.al.ccda2omop.model.omop.OmopTable;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes one CSV file per OMOP table. Every table gets a file with its
 * header, even when it has no rows.
 */
@Component
@Slf4j
public class CsvTableWriter {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT;

    /**
     * @return the files written, in table order
     */
    public List<Path> writeAll(OmopDataset data, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        List<Path> written = new ArrayList<>();
        for (OmopTable table : OmopTable.values()) {
            Path file = outputDir.resolve(table.fileName());
            try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                write(table, data.rows(table), out);
            }
            log.debug("Wrote {} rows to {}", data.count(table), file);
            written.add(file);
        }
        return written;
    }

    public void write(OmopTable table, List<OmopRow> rows, Writer out) throws IOException {
        CSVPrinter printer = new CSVPrinter(out, FORMAT);
        printer.printRecord(table.columns());
        List<String> cells = new ArrayList<>(table.columns().size());
        for (OmopRow row : rows) {
            cells.clear();
            for (Object value : row.values()) {
                cells.add(OmopValueFormatter.format(value));
            }
            printer.printRecord(cells);
        }
        printer.flush();
    }
}
