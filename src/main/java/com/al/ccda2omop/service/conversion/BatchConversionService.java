package com.al.ccda2omop.service.conversion;

import com.al.ccda2omop.config.ConversionProperties;
import com.al.ccda2omop.dto.ConversionError;
import com.al.ccda2omop.exception.DocumentConversionException;
import com.al.ccda2omop.model.omop.OmopDataset;
import com.al.ccda2omop.report.ConversionReport;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Service for batch conversion of C-CDA files with parallel processing.
 *
 * <p>
 * Documents are converted concurrently on a fixed thread pool and merged in
 * input order, so the output does not depend on scheduling. A document
 * contributes all of its rows or none. A failing document either aborts the
 * batch once all documents have settled or, with {@code continueOnError},
 * is counted in {@code documents_with_errors}.
 *
 * @author CCDA2OMOP Team
 * @since 1.0.0
 */
@Service
@Slf4j
public class BatchConversionService {

    private final ConversionService conversionService;
    private final ConversionProperties properties;
    private final ExecutorService executorService;

    @Autowired
    public BatchConversionService(ConversionService conversionService, ConversionProperties properties) {
        this.conversionService = conversionService;
        this.properties = properties;
        int threadPoolSize = properties.effectiveBatchThreads();
        this.executorService = Executors.newFixedThreadPool(threadPoolSize);
        log.info("BatchConversionService initialized with {} threads", threadPoolSize);
    }

    /**
     * Convert files in parallel and merge them in the given order.
     *
     * @throws DocumentConversionException for the first failing document,
     *                                     unless {@code continueOnError} is set
     */
    public BatchResult convertFiles(List<Path> files) {
        long startTime = System.currentTimeMillis();
        log.info("Starting batch conversion: {} documents", files.size());

        Map<String, String> context = MDC.getCopyOfContextMap();
        List<CompletableFuture<DocumentResult>> futures = new ArrayList<>();
        for (Path file : files) {
            futures.add(CompletableFuture.supplyAsync(() -> convertWithContext(file, context), executorService));
        }

        // Wait for every document before merging, failed ones included
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).exceptionally(e -> null).join();

        OmopDataset dataset = new OmopDataset();
        ConversionReport report = new ConversionReport();
        List<ConversionError> errors = new ArrayList<>();

        for (int i = 0; i < futures.size(); i++) {
            String sourceFile = files.get(i).getFileName().toString();
            DocumentResult result;
            try {
                result = futures.get(i).join();
            } catch (CompletionException e) {
                RuntimeException failure = unwrap(e, sourceFile);
                report.addDocument(true);
                if (!properties.isContinueOnError()) {
                    throw failure;
                }
                log.error("Skipping {}: {}", sourceFile, failure.getMessage());
                errors.add(ConversionError.documentError(i, sourceFile, failure));
                continue;
            }
            dataset.addAll(result.getDataset());
            report.merge(result.getReport());
            report.addDocument(false);
        }
        report.calculateFromDataset(dataset);

        long processingTimeMs = System.currentTimeMillis() - startTime;
        log.info("Batch conversion completed: {} success, {} failures, {} records, {}ms total",
                files.size() - errors.size(), errors.size(), dataset.totalCount(), processingTimeMs);
        return new BatchResult(dataset, report, errors, processingTimeMs);
    }

    /**
     * Runs on a pool thread with the caller's MDC, so worker log lines keep
     * the {@code conversionId}.
     */
    private DocumentResult convertWithContext(Path file, Map<String, String> context) {
        if (context != null) {
            MDC.setContextMap(context);
        }
        try {
            return conversionService.convert(file);
        } finally {
            MDC.clear();
        }
    }

    private static RuntimeException unwrap(CompletionException e, String sourceFile) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        if (cause instanceof DocumentConversionException) {
            return (DocumentConversionException) cause;
        }
        return new DocumentConversionException(sourceFile, cause);
    }

    @PreDestroy
    public void shutdown() {
        executorService.shutdown();
    }
}
