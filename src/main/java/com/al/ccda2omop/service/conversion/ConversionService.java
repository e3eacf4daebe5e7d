package com.al.ccda2omop.service.conversion;

import com.al.ccda2omop.config.ConversionProperties;
import com.al.ccda2omop.exception.DocumentConversionException;
import com.al.ccda2omop.model.ccda.ClinicalDocument;
import com.al.ccda2omop.model.omop.OmopDataset;
import com.al.ccda2omop.model.omop.OmopTable;
import com.al.ccda2omop.service.mapper.DocumentMapper;
import com.al.ccda2omop.service.mapper.MappingResult;
import com.al.ccda2omop.service.parser.CcdaParser;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Converts a single C-CDA document: parse, map, stamp the source file.
 *
 * <p>
 * Any failure is rethrown as {@link DocumentConversionException} naming the
 * document, so callers never see partial rows.
 *
 * @author CCDA2OMOP Team
 * @since 1.0.0
 */
@Service
@Slf4j
public class ConversionService {

    static final String MDC_SOURCE_FILE = "sourceFile";

    private final CcdaParser parser;
    private final DocumentMapper mapper;
    private final MeterRegistry meterRegistry;
    private final ConversionProperties properties;

    @Autowired
    public ConversionService(CcdaParser parser, DocumentMapper mapper, MeterRegistry meterRegistry,
            ConversionProperties properties) {
        this.parser = parser;
        this.mapper = mapper;
        this.meterRegistry = meterRegistry;
        this.properties = properties;
    }

    public DocumentResult convert(Path file) {
        String sourceFile = file.getFileName().toString();
        byte[] xml;
        try {
            xml = Files.readAllBytes(file);
        } catch (IOException e) {
            meterRegistry.counter("ccda.conversion.documents", "status", "error").increment();
            throw new DocumentConversionException(sourceFile, e);
        }
        return convert(xml, sourceFile);
    }

    public DocumentResult convert(byte[] xml, String sourceFile) {
        String previous = MDC.get(MDC_SOURCE_FILE);
        MDC.put(MDC_SOURCE_FILE, sourceFile);
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            if (properties.isVerbose()) {
                log.info("Processing {}", sourceFile);
            } else {
                log.debug("Processing {}", sourceFile);
            }
            ClinicalDocument document = parser.parse(xml, sourceFile);
            MappingResult mapped = mapper.map(document);
            OmopDataset dataset = mapped.getDataset().withSourceFile(sourceFile);

            for (OmopTable table : OmopTable.values()) {
                int count = dataset.count(table);
                if (count > 0) {
                    meterRegistry.counter("ccda.mapping.records", "table", table.tableName()).increment(count);
                }
            }
            meterRegistry.counter("ccda.conversion.documents", "status", "success").increment();
            sample.stop(meterRegistry.timer("ccda.conversion.duration"));

            if (properties.isVerbose()) {
                log.info("Converted {}: {} records", sourceFile, dataset.totalCount());
            }
            return new DocumentResult(sourceFile, dataset, mapped.getReport());
        } catch (DocumentConversionException e) {
            meterRegistry.counter("ccda.conversion.documents", "status", "error").increment();
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to convert {}: {}", sourceFile, e.getMessage());
            meterRegistry.counter("ccda.conversion.documents", "status", "error").increment();
            throw new DocumentConversionException(sourceFile, e);
        } finally {
            if (previous == null) {
                MDC.remove(MDC_SOURCE_FILE);
            } else {
                MDC.put(MDC_SOURCE_FILE, previous);
            }
        }
    }
}
