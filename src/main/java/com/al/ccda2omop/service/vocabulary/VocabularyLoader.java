package com.al.ccda2omop.service.vocabulary;

import com.al.ccda2omop.exception.VocabularyLoadException;
import com.al.ccda2omop.model.vocabulary.Concept;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads tab-delimited OMOP vocabulary tables into a {@link VocabularyIndex}.
 *
 * <p>
 * Loading is tolerant: short rows, non-numeric ids and invalidated rows are
 * skipped without error. Only a missing or unexpected header, an unreadable
 * file, or a missing supplementary directory fails the load.
 *
 * <p>
 * Not thread-safe. Load everything, call {@link #build()}, then share the
 * resulting index.
 */
@Slf4j
public class VocabularyLoader {

    /**
     * Vocabularies retained from the main concept table.
     */
    public static final Set<String> RELEVANT_VOCABULARIES = Set.of(
            "SNOMED", "RxNorm", "LOINC", "ICD10CM", "ICD9CM", "CPT4", "HCPCS", "CVX", "NDC", "UNII",
            "NDFRT", "NCI", "ActCode", "RouteOfAdministration", "Gender", "Race", "Ethnicity", "UCUM",
            "Visit");

    private static final String MAPS_TO = "Maps to";

    private static final CSVFormat TSV = CSVFormat.TDF.builder()
            .setQuote(null)
            .setIgnoreSurroundingSpaces(false)
            .setTrim(false)
            .build();

    private static final CSVFormat TSV_WITH_COMMENTS = TSV.builder()
            .setCommentMarker('#')
            .build();

    private static final int CONCEPT_COLUMNS = 10;
    private static final int SUPPLEMENTARY_MIN_COLUMNS = 7;
    private static final int RELATIONSHIP_COLUMNS = 6;
    private static final int INVALID_REASON = 9;

    private final VocabularyIndex.Builder builder = VocabularyIndex.builder();

    /**
     * Load the main CONCEPT table, keeping only {@link #RELEVANT_VOCABULARIES}.
     *
     * @return number of concepts loaded
     */
    public int loadConcepts(Path file) {
        return read(file, reader -> loadConcepts(reader, file.toString()));
    }

    public int loadConcepts(Reader reader, String sourceName) {
        int count = 0;
        try (CSVParser parser = TSV.parse(reader)) {
            Iterator<CSVRecord> records = parser.iterator();
            requireHeader(records, "concept_id", sourceName);
            while (records.hasNext()) {
                CSVRecord row = records.next();
                if (row.size() < CONCEPT_COLUMNS) {
                    continue;
                }
                if (!RELEVANT_VOCABULARIES.contains(row.get(3))) {
                    continue;
                }
                Long conceptId = parseId(row.get(0));
                if (conceptId == null || !row.get(INVALID_REASON).isEmpty()) {
                    continue;
                }
                builder.concept(toConcept(conceptId, row));
                count++;
            }
        } catch (IOException | UncheckedIOException e) {
            throw new VocabularyLoadException(sourceName, "Failed to read concept table", e);
        }
        log.info("Loaded {} concepts from {}", count, sourceName);
        return count;
    }

    /**
     * Load "Maps to" edges from a CONCEPT_RELATIONSHIP table. Must run after
     * the concepts whose edges it carries are loaded.
     *
     * @return number of edges kept
     */
    public int loadRelationships(Path file) {
        return read(file, reader -> loadRelationships(reader, file.toString()));
    }

    public int loadRelationships(Reader reader, String sourceName) {
        int count = 0;
        try (CSVParser parser = TSV.parse(reader)) {
            Iterator<CSVRecord> records = parser.iterator();
            requireHeader(records, "concept_id_1", sourceName);
            while (records.hasNext()) {
                CSVRecord row = records.next();
                if (row.size() < RELATIONSHIP_COLUMNS || !MAPS_TO.equals(row.get(2)) || !row.get(5).isEmpty()) {
                    continue;
                }
                Long sourceId = parseId(row.get(0));
                Long targetId = parseId(row.get(1));
                if (sourceId == null || targetId == null || !builder.containsConcept(sourceId)) {
                    continue;
                }
                builder.mapsTo(sourceId, targetId);
                count++;
            }
        } catch (IOException | UncheckedIOException e) {
            throw new VocabularyLoadException(sourceName, "Failed to read relationship table", e);
        }
        log.info("Loaded {} 'Maps to' relationships from {}", count, sourceName);
        return count;
    }

    /**
     * Load a supplementary concept file. Leading {@code #} comment lines are
     * allowed before the header and every vocabulary is accepted. Entries
     * replace earlier ones with the same code or id.
     *
     * @return number of concepts loaded
     */
    public int loadSupplementary(Path file) {
        return read(file, reader -> loadSupplementary(reader, file.toString()));
    }

    public int loadSupplementary(Reader reader, String sourceName) {
        int count = 0;
        try (CSVParser parser = TSV_WITH_COMMENTS.parse(reader)) {
            Iterator<CSVRecord> records = parser.iterator();
            if (!records.hasNext()) {
                log.warn("Supplementary vocabulary {} has no header, nothing loaded", sourceName);
                return 0;
            }
            requireHeader(records, "concept_id", sourceName);
            while (records.hasNext()) {
                CSVRecord row = records.next();
                if (row.size() < SUPPLEMENTARY_MIN_COLUMNS) {
                    continue;
                }
                Long conceptId = parseId(row.get(0));
                if (conceptId == null) {
                    continue;
                }
                if (row.size() > INVALID_REASON && !row.get(INVALID_REASON).isEmpty()) {
                    continue;
                }
                builder.concept(toConcept(conceptId, row));
                count++;
            }
        } catch (IOException | UncheckedIOException e) {
            throw new VocabularyLoadException(sourceName, "Failed to read supplementary vocabulary", e);
        }
        log.info("Loaded {} supplementary concepts from {}", count, sourceName);
        return count;
    }

    /**
     * Load every {@code *.csv} file of a directory as a supplementary
     * vocabulary, in sorted file name order.
     *
     * @return total number of concepts loaded
     */
    public int loadSupplementaryDirectory(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new VocabularyLoadException(directory.toString(), "Vocab directory not found");
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new VocabularyLoadException(directory.toString(), "Failed to list vocab directory", e);
        }
        int total = 0;
        for (Path file : files) {
            total += loadSupplementary(file);
        }
        return total;
    }

    public VocabularyIndex build() {
        return builder.build();
    }

    private static void requireHeader(Iterator<CSVRecord> records, String prefix, String sourceName) {
        if (!records.hasNext()) {
            throw new VocabularyLoadException(sourceName, "Missing header");
        }
        CSVRecord header = records.next();
        if (header.size() == 0 || !header.get(0).startsWith(prefix)) {
            throw new VocabularyLoadException(sourceName, "Unexpected header " + header.toList());
        }
    }

    private static Concept toConcept(long conceptId, CSVRecord row) {
        return Concept.builder()
                .conceptId(conceptId)
                .conceptName(row.get(1))
                .domainId(row.get(2))
                .vocabularyId(row.get(3))
                .conceptClassId(row.get(4))
                .standardConcept(row.get(5))
                .conceptCode(row.get(6))
                .build();
    }

    private static Long parseId(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static int read(Path file, ReaderTask task) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return task.load(reader);
        } catch (IOException e) {
            throw new VocabularyLoadException(file.toString(), "Failed to open vocabulary file", e);
        }
    }

    @FunctionalInterface
    private interface ReaderTask {
        int load(Reader reader);
    }
}
