package com.al.ccda2omop.service.vocabulary;

import com.al.ccda2omop.TestFixtures;
import com.al.ccda2omop.exception.VocabularyLoadException;
import com.al.ccda2omop.model.vocabulary.Concept;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class VocabularyLoaderTest {

    static final String CONCEPT_HEADER = "concept_id\tconcept_name\tdomain_id\tvocabulary_id\tconcept_class_id"
            + "\tstandard_concept\tconcept_code\tvalid_start_date\tvalid_end_date\tinvalid_reason\n";

    @Test
    public void testLoadConcepts_KeepsRelevantValidRows() {
        VocabularyLoader loader = new VocabularyLoader();

        int loaded = loader.loadConcepts(TestFixtures.resource("vocab/concept.tsv"));
        VocabularyIndex index = loader.build();

        assertEquals(13, loaded);
        assertEquals(13, index.conceptCount());
        Concept diabetes = index.lookup("SNOMED", "44054006");
        assertNotNull(diabetes);
        assertEquals(201826L, diabetes.getConceptId());
        assertEquals("Condition", diabetes.getDomainId());
        assertTrue(diabetes.isStandard());
        assertEquals("%", index.lookup("UCUM", "%").getConceptCode());
    }

    @Test
    public void testLoadConcepts_StandardConceptIsItsOwnTarget() {
        VocabularyLoader loader = new VocabularyLoader();
        loader.loadConcepts(new StringReader(CONCEPT_HEADER
                + "44054006\tType 2 diabetes mellitus\tCondition\tSNOMED\tClinical Finding\tS\t44054006"
                + "\t19700101\t20991231\t\n"), "CONCEPT.csv");
        VocabularyIndex index = loader.build();

        Concept concept = index.lookup("SNOMED", "44054006");
        assertEquals(44054006L, concept.getConceptId());
        assertEquals("Type 2 diabetes mellitus", concept.getConceptName());
        assertEquals(List.of(44054006L), index.standardConceptIds("SNOMED", "44054006"));
    }

    @Test
    public void testLoadConcepts_SkipsInvalidIrrelevantAndShortRows() {
        VocabularyLoader loader = new VocabularyLoader();
        loader.loadConcepts(TestFixtures.resource("vocab/concept.tsv"));
        VocabularyIndex index = loader.build();

        assertNull(index.lookup("SNOMED", "1111"));
        assertNull(index.lookupById(9000001L));
        assertNull(index.lookupById(9000002L));
    }

    @Test
    public void testLoadRelationships_KeepsValidMapsToForLoadedConcepts() {
        VocabularyLoader loader = new VocabularyLoader();
        loader.loadConcepts(TestFixtures.resource("vocab/concept.tsv"));

        int edges = loader.loadRelationships(TestFixtures.resource("vocab/relationship.tsv"));
        VocabularyIndex index = loader.build();

        assertEquals(5, edges);
        assertEquals(5, index.relationshipCount());
        assertEquals(List.of(201826L, 4193704L), index.standardConceptIds("ICD10CM", "E11.65"));
        assertEquals(List.of(1308216L), index.standardConceptIds("RxNorm", "206765"));
    }

    @Test
    public void testLoadRelationships_BeforeConceptsKeepsNothing() {
        VocabularyLoader loader = new VocabularyLoader();

        assertEquals(0, loader.loadRelationships(TestFixtures.resource("vocab/relationship.tsv")));
    }

    @Test
    public void testLoadConcepts_RejectsUnexpectedHeader() {
        VocabularyLoader loader = new VocabularyLoader();

        VocabularyLoadException e = assertThrows(VocabularyLoadException.class,
                () -> loader.loadConcepts(new StringReader("id\tname\n1\tx\n"), "bad.tsv"));
        assertEquals("bad.tsv", e.getSource());
    }

    @Test
    public void testLoadConcepts_EmptyInputHasNoHeader() {
        VocabularyLoader loader = new VocabularyLoader();

        assertThrows(VocabularyLoadException.class, () -> loader.loadConcepts(new StringReader(""), "empty.tsv"));
    }

    @Test
    public void testLoadConcepts_MissingFile(@TempDir Path dir) {
        VocabularyLoader loader = new VocabularyLoader();

        assertThrows(VocabularyLoadException.class, () -> loader.loadConcepts(dir.resolve("CONCEPT.csv")));
    }

    @Test
    public void testLoadSupplementaryDirectory_OverridesAndExtends() {
        VocabularyLoader loader = new VocabularyLoader();
        loader.loadConcepts(TestFixtures.resource("vocab/concept.tsv"));

        int loaded = loader.loadSupplementaryDirectory(TestFixtures.resource("vocab/supplementary"));
        VocabularyIndex index = loader.build();

        assertEquals(2, loaded);
        assertEquals(2000000001L, index.lookup("Local", "LOC-PEANUT").getConceptId());
        assertEquals(2000000002L, index.standardConceptId("LOINC", "8867-4"));
    }

    @Test
    public void testLoadSupplementary_HeaderOnlyAfterComments() {
        VocabularyLoader loader = new VocabularyLoader();
        String content = "# comment\nconcept_id\tconcept_name\tdomain_id\tvocabulary_id\tconcept_class_id"
                + "\tstandard_concept\tconcept_code\n";

        assertEquals(0, loader.loadSupplementary(new StringReader(content), "local.csv"));
    }

    @Test
    public void testLoadSupplementary_EmptyFileLoadsNothing() {
        VocabularyLoader loader = new VocabularyLoader();

        assertEquals(0, loader.loadSupplementary(new StringReader(""), "empty.csv"));
    }

    @Test
    public void testLoadSupplementaryDirectory_MissingDirectory(@TempDir Path dir) {
        VocabularyLoader loader = new VocabularyLoader();

        assertThrows(VocabularyLoadException.class,
                () -> loader.loadSupplementaryDirectory(dir.resolve("missing")));
    }
}
