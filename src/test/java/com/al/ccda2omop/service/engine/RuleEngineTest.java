package com.al.ccda2omop.service.engine;

import com.al.ccda2omop.TestFixtures;
import com.al.ccda2omop.model.omop.OmopTable;
import com.al.ccda2omop.model.rule.ConditionType;
import com.al.ccda2omop.model.rule.MappingRule;
import com.al.ccda2omop.model.rule.Transform;
import com.al.ccda2omop.model.vocabulary.ConceptResolution;
import com.al.ccda2omop.service.vocabulary.StandardConcepts;
import com.al.ccda2omop.service.vocabulary.VocabularyLoader;
import com.al.ccda2omop.util.IdGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import java.io.StringReader;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RuleEngineTest {

    private static final long PERSON_ID = 1234L;
    private static final String SNOMED_OID = "2.16.840.1.113883.6.96";

    private RuleEngine engine;

    @BeforeEach
    public void setUp() {
        engine = new RuleEngine(TestFixtures.standardConcepts());
    }

    @Test
    public void testMapEntry_StandardConcept() {
        Element entry = problem("44054006", SNOMED_OID, "20240110083000");

        EntryMapping mapping = engine.mapEntry(conditionRule(), entry, PERSON_ID, Map.of(), true);

        assertFalse(mapping.isSkipped());
        assertEquals(201826L, mapping.getPrimaryConceptId());
        assertEquals(ConceptResolution.Kind.STANDARD, mapping.getResolution().getKind());
        assertEquals(1, mapping.getRecords().size());

        MappedRecord record = mapping.getRecords().get(0);
        assertEquals(OmopTable.CONDITION_OCCURRENCE, record.getTable());
        assertEquals(IdGenerator.generateId("condition", "1234", "44054006", "20240110083000"),
                record.getLong("condition_occurrence_id"));
        assertEquals(PERSON_ID, record.getLong("person_id"));
        assertEquals(32817L, record.getLong("condition_type_concept_id"));
        assertEquals(201826L, record.getLong("condition_concept_id"));
        assertEquals(LocalDateTime.of(2024, 1, 10, 0, 0), record.getDateTime("condition_start_date"));
        assertEquals(LocalDateTime.of(2024, 1, 10, 8, 30), record.getDateTime("condition_start_datetime"));
        assertEquals("44054006: Type 2 diabetes mellitus", record.getString("condition_source_value"));
        assertEquals("RuleMapper:Test_condition", record.getString("mapping_rule"));
        assertFalse(record.has("visit_occurrence_id"));
    }

    @Test
    public void testMapEntry_ActiveProblemWithSelfStandardConcept() {
        VocabularyLoader loader = new VocabularyLoader();
        loader.loadConcepts(new StringReader("concept_id\tconcept_name\tdomain_id\tvocabulary_id"
                + "\tconcept_class_id\tstandard_concept\tconcept_code\tvalid_start_date\tvalid_end_date"
                + "\tinvalid_reason\n44054006\tType 2 diabetes mellitus\tCondition\tSNOMED\tClinical Finding"
                + "\tS\t44054006\t19700101\t20991231\t\n"), "CONCEPT.csv");
        RuleEngine selfMapped = new RuleEngine(new StandardConcepts(loader.build()));
        Element entry = xml("<observation classCode=\"OBS\"><statusCode code=\"active\"/>"
                + "<effectiveTime><low value=\"20240110\"/></effectiveTime>"
                + "<value code=\"44054006\" codeSystem=\"" + SNOMED_OID + "\"/></observation>");

        EntryMapping mapping = selfMapped.mapEntry(conditionRule(), entry, PERSON_ID, Map.of(), true);

        assertEquals(1, mapping.getRecords().size());
        MappedRecord record = mapping.getRecords().get(0);
        assertEquals(44054006L, record.getLong("condition_concept_id"));
        assertEquals(32817L, record.getLong("condition_type_concept_id"));
        assertTrue(record.getString("mapping_rule").contains("Test_condition"));
    }

    @Test
    public void testMapEntry_FanOutUsesConsecutiveIds() {
        Element entry = problem("E11.65", "2.16.840.1.113883.6.90", "20240201");

        EntryMapping mapping = engine.mapEntry(conditionRule(), entry, PERSON_ID, Map.of(), true);

        List<MappedRecord> records = mapping.getRecords();
        assertEquals(2, records.size());
        assertEquals(ConceptResolution.Kind.MAPPED, mapping.getResolution().getKind());
        long base = IdGenerator.generateId("condition", "1234", "E11.65", "20240201");
        assertEquals(base, records.get(0).getLong("condition_occurrence_id"));
        assertEquals(base + 1, records.get(1).getLong("condition_occurrence_id"));
        assertEquals(201826L, records.get(0).getLong("condition_concept_id"));
        assertEquals(4193704L, records.get(1).getLong("condition_concept_id"));
    }

    @Test
    public void testMapEntry_UnknownCodeWhenEntriesRequired() {
        Element entry = problem("99999999", SNOMED_OID, "20240105");

        EntryMapping mapping = engine.mapEntry(conditionRule(), entry, PERSON_ID, Map.of(), true);

        assertTrue(mapping.isSkipped());
        assertEquals(SkipReason.NO_CONCEPT, mapping.getSkipReason());
        assertFalse(mapping.getResolution().isFound());
        assertEquals("SNOMED", mapping.getResolution().getVocabularyId());
    }

    @Test
    public void testMapEntry_UnknownCodeWhenEntriesOptional() {
        Element entry = problem("99999999", SNOMED_OID, "20240105");

        EntryMapping mapping = engine.mapEntry(conditionRule(), entry, PERSON_ID, Map.of(), false);

        assertEquals(1, mapping.getRecords().size());
        assertEquals(0L, mapping.getRecords().get(0).getLong("condition_concept_id"));
    }

    @Test
    public void testMapEntry_UnknownCodeSystem() {
        Element entry = problem("44054006", "1.2.3.4", "20240105");

        assertEquals(SkipReason.NO_CONCEPT,
                engine.mapEntry(conditionRule(), entry, PERSON_ID, Map.of(), true).getSkipReason());
        assertEquals(0L, engine.mapEntry(conditionRule(), entry, PERSON_ID, Map.of(), false)
                .getRecords().get(0).getLong("condition_concept_id"));
    }

    @Test
    public void testMapEntry_NonStandardCodeFollowsMapsTo() {
        Element entry = problem("E11.9", "2.16.840.1.113883.6.90", "20240105");

        EntryMapping mapping = engine.mapEntry(conditionRule(), entry, PERSON_ID, Map.of(), true);

        assertEquals(201826L, mapping.getPrimaryConceptId());
        assertTrue(mapping.getResolution().isMappedToStandard());
    }

    @Test
    public void testMapEntry_DomainConditions() {
        MappingRule observationOnly = conditionRule();
        observationOnly.getSource().getConditions().add(MappingRule.Condition.builder()
                .type(ConditionType.DOMAIN_EQUALS).field("concept_domain").value("Observation").build());

        EntryMapping diabetes = engine.mapEntry(observationOnly, problem("44054006", SNOMED_OID, "20240110"),
                PERSON_ID, Map.of(), true);
        EntryMapping smoker = engine.mapEntry(observationOnly, problem("8517006", SNOMED_OID, "20231201"),
                PERSON_ID, Map.of(), true);

        assertEquals(SkipReason.CONDITION_FAILED, diabetes.getSkipReason());
        assertNotNull(diabetes.getResolution());
        assertFalse(smoker.isSkipped());
        assertEquals(4310250L, smoker.getPrimaryConceptId());
    }

    @Test
    public void testMapEntry_DomainNotEqualsPassesForUnmappedConcept() {
        MappingRule notObservation = conditionRule();
        notObservation.getSource().getConditions().add(MappingRule.Condition.builder()
                .type(ConditionType.DOMAIN_NOT_EQUALS).value("Observation").build());

        EntryMapping mapping = engine.mapEntry(notObservation, problem("99999999", SNOMED_OID, "20240105"),
                PERSON_ID, Map.of(), false);

        assertFalse(mapping.isSkipped());
        assertEquals(0L, mapping.getPrimaryConceptId());
    }

    @Test
    public void testMapEntry_ExcludedMoodAndStatus() {
        Element intent = xml("<observation moodCode=\"INT\"><value code=\"44054006\" codeSystem=\""
                + SNOMED_OID + "\"/><effectiveTime value=\"20240110\"/></observation>");
        Element nullified = xml("<observation moodCode=\"EVN\"><statusCode code=\"nullified\"/>"
                + "<value code=\"44054006\" codeSystem=\"" + SNOMED_OID + "\"/>"
                + "<effectiveTime value=\"20240110\"/></observation>");

        assertEquals(SkipReason.EXCLUDED,
                engine.mapEntry(conditionRule(), intent, PERSON_ID, Map.of(), true).getSkipReason());
        assertEquals(SkipReason.EXCLUDED,
                engine.mapEntry(conditionRule(), nullified, PERSON_ID, Map.of(), true).getSkipReason());
    }

    @Test
    public void testShouldInclude() {
        assertTrue(RuleEngine.shouldInclude(xml("<observation/>")));
        assertTrue(RuleEngine.shouldInclude(xml("<observation moodCode=\"EVN\"><statusCode code=\"active\"/></observation>")));
        assertTrue(RuleEngine.shouldInclude(xml("<observation><statusCode/></observation>")));
        assertFalse(RuleEngine.shouldInclude(xml("<observation moodCode=\"RQO\"/>")));
        assertFalse(RuleEngine.shouldInclude(xml("<observation><statusCode code=\"aborted\"/></observation>")));
        assertFalse(RuleEngine.shouldInclude(null));
    }

    @Test
    public void testMapEntry_DateFallsBackToPointValue() {
        Element entry = xml("<observation><effectiveTime value=\"20230704\"/>"
                + "<value code=\"44054006\" codeSystem=\"" + SNOMED_OID + "\"/></observation>");

        MappedRecord record = engine.mapEntry(conditionRule(), entry, PERSON_ID, Map.of(), true)
                .getRecords().get(0);

        assertEquals(LocalDateTime.of(2023, 7, 4, 0, 0), record.getDateTime("condition_start_date"));
    }

    @Test
    public void testMapEntry_MissingRequiredDate() {
        Element entry = xml("<observation><value code=\"44054006\" codeSystem=\"" + SNOMED_OID + "\"/></observation>");

        EntryMapping required = engine.mapEntry(conditionRule(), entry, PERSON_ID, Map.of(), true);
        EntryMapping optional = engine.mapEntry(conditionRule(), entry, PERSON_ID, Map.of(), false);

        assertEquals(SkipReason.MISSING_REQUIRED_FIELD, required.getSkipReason());
        assertEquals(1, optional.getRecords().size());
        assertFalse(optional.getRecords().get(0).has("condition_start_date"));
    }

    @Test
    public void testMapEntry_VisitLookup() {
        Element entry = xml("<observation><effectiveTime value=\"20240110\"/>"
                + "<value code=\"44054006\" codeSystem=\"" + SNOMED_OID + "\"/>"
                + "<entryRelationship><encounter><id root=\"1.2\" extension=\"ENC-1\"/></encounter>"
                + "</entryRelationship></observation>");

        MappedRecord linked = engine.mapEntry(conditionRule(), entry, PERSON_ID, Map.of("ENC-1", 42L), true)
                .getRecords().get(0);
        MappedRecord unlinked = engine.mapEntry(conditionRule(), entry, PERSON_ID, Map.of("ENC-2", 43L), true)
                .getRecords().get(0);

        assertEquals(42L, linked.getLong("visit_occurrence_id"));
        assertFalse(unlinked.has("visit_occurrence_id"));
    }

    @Test
    public void testMapEntry_MeasurementTransforms() {
        Element entry = xml("<observation><code code=\"8867-4\" codeSystem=\"2.16.840.1.113883.6.1\"/>"
                + "<effectiveTime value=\"20240110093500\"/>"
                + "<value value=\"72\" unit=\"/min\"/>"
                + "<interpretationCode code=\"8517006\" codeSystem=\"" + SNOMED_OID + "\"/>"
                + "<repeatNumber value=\"3\"/></observation>");

        MappedRecord record = engine.mapEntry(measurementRule(), entry, PERSON_ID, Map.of(), true)
                .getRecords().get(0);

        assertEquals(3027018L, record.getLong("measurement_concept_id"));
        assertEquals(72.0, record.getDouble("value_as_number"));
        assertEquals(FieldValue.Kind.DECIMAL, record.get("value_as_number").getKind());
        assertEquals(8541L, record.getLong("unit_concept_id"));
        assertEquals("/min", record.getString("unit_source_value"));
        assertEquals(4310250L, record.getLong("value_as_concept_id"));
        assertEquals(3L, record.getLong("operator_concept_id"));
        assertEquals(LocalDateTime.of(2024, 1, 10, 9, 35), record.getDateTime("measurement_datetime"));
    }

    @Test
    public void testMapEntry_BadOptionalNumberDropsOnlyThatField() {
        Element entry = xml("<observation><code code=\"8867-4\" codeSystem=\"2.16.840.1.113883.6.1\"/>"
                + "<effectiveTime value=\"20240110\"/><value value=\"high\" unit=\"/min\"/></observation>");

        EntryMapping mapping = engine.mapEntry(measurementRule(), entry, PERSON_ID, Map.of(), true);

        assertFalse(mapping.isSkipped());
        assertFalse(mapping.getRecords().get(0).has("value_as_number"));
        assertEquals("/min", mapping.getRecords().get(0).getString("unit_source_value"));
    }

    @Test
    public void testMapEntry_RuleWithoutCodedField() {
        Element entry = xml("<observation><effectiveTime value=\"20240110\"/><text>Lives alone</text></observation>");

        EntryMapping mapping = engine.mapEntry(uncodedRule(), entry, PERSON_ID, Map.of(), true);

        assertTrue(mapping.isSkipped());
        assertEquals(SkipReason.NO_CONCEPT, mapping.getSkipReason());
        assertTrue(mapping.getRecords().isEmpty());
    }

    @Test
    public void testMapEntry_RuleWithoutCodedFieldEntriesOptional() {
        Element entry = xml("<observation><effectiveTime value=\"20240110\"/><text>Lives alone</text></observation>");

        EntryMapping mapping = engine.mapEntry(uncodedRule(), entry, PERSON_ID, Map.of(), false);

        assertEquals(1, mapping.getRecords().size());
        MappedRecord record = mapping.getRecords().get(0);
        assertFalse(record.has("observation_concept_id"));
        assertEquals("Lives alone", record.getString("value_as_string"));
        assertEquals(IdGenerator.generateId("observation", "1234"), record.getLong("observation_id"));
        assertNull(mapping.getResolution());
    }

    @Test
    public void testMapEntry_EntriesOptionalWithoutDate() {
        Element entry = xml("<observation moodCode=\"EVN\"><value code=\"44054006\" codeSystem=\""
                + SNOMED_OID + "\"/></observation>");

        EntryMapping mapping = engine.mapEntry(conditionRule(), entry, PERSON_ID, Map.of(), false);

        assertEquals(1, mapping.getRecords().size());
        assertFalse(mapping.getRecords().get(0).has("condition_start_date"));
        assertEquals(SkipReason.MISSING_REQUIRED_FIELD,
                engine.mapEntry(conditionRule(), entry, PERSON_ID, Map.of(), true).getSkipReason());
    }

    @Test
    public void testMapEntry_GeneratorNamespaceSeedsId() {
        Element entry = problem("44054006", SNOMED_OID, "20240110");

        MappedRecord record = engine.mapEntry(conditionRule(), entry, PERSON_ID, Map.of(), true).getRecords().get(0);

        assertEquals(IdGenerator.generateId("condition", "1234", "44054006", "20240110"),
                record.getLong("condition_occurrence_id"));
        assertNotEquals(IdGenerator.generateId("condition_occurrence", "1234", "44054006", "20240110"),
                record.getLong("condition_occurrence_id"));
    }

    @Test
    public void testMapEntry_InvalidXpath() {
        MappingRule rule = conditionRule();
        rule.getFields().get(0).setXpath("value/@@code");

        EntryMapping mapping = engine.mapEntry(rule, problem("44054006", SNOMED_OID, "20240110"),
                PERSON_ID, Map.of(), true);

        assertEquals(SkipReason.XPATH_ERROR, mapping.getSkipReason());
    }

    @Test
    public void testMapEntries_ConcatenatesRecords() {
        List<Element> entries = List.of(
                problem("44054006", SNOMED_OID, "20240110"),
                problem("E11.65", "2.16.840.1.113883.6.90", "20240201"),
                problem("99999999", SNOMED_OID, "20240105"));

        List<MappedRecord> records = engine.mapEntries(conditionRule(), entries, PERSON_ID, Map.of(), true);

        assertEquals(3, records.size());
    }

    @Test
    public void testBaseFieldPath() {
        assertEquals("value/@code", RuleEngine.baseFieldPath("Value.code"));
        assertEquals("code/@code", RuleEngine.baseFieldPath("Code.code"));
        assertEquals("effectiveTime/low/@value", RuleEngine.baseFieldPath("EffectiveTime.low.value"));
        assertEquals("value/@value", RuleEngine.baseFieldPath("Value"));
        assertEquals("effectiveTime/low/@value", RuleEngine.baseFieldPath("effectiveTime/low/@value"));
        assertEquals("@classCode", RuleEngine.baseFieldPath("@classCode"));
    }

    @Test
    public void testFormatSourceValue() {
        assertEquals("44054006: Type 2 diabetes mellitus",
                RuleEngine.formatSourceValue("44054006", "Type 2 diabetes mellitus"));
        assertEquals("44054006", RuleEngine.formatSourceValue("44054006", ""));
        assertEquals("Type 2 diabetes mellitus", RuleEngine.formatSourceValue(null, "Type 2 diabetes mellitus"));
        assertEquals("", RuleEngine.formatSourceValue("", null));
    }

    private static MappingRule conditionRule() {
        return MappingRule.builder()
                .name("Test_condition")
                .source(MappingRule.SourceSpec.builder().section("Problems").build())
                .target(MappingRule.TargetSpec.builder()
                        .table(OmopTable.CONDITION_OCCURRENCE).typeConceptId(32817L).build())
                .fields(new ArrayList<>(List.of(
                        MappingRule.FieldMapping.builder().target("condition_concept_id").xpath("value/@code")
                                .vocabXpath("value/@codeSystem").transform(Transform.VOCAB).build(),
                        field("condition_start_date", "effectiveTime/low", "effectiveTime", Transform.DATE, false),
                        field("condition_start_datetime", "effectiveTime/low", "effectiveTime", Transform.TIME_PTR,
                                true),
                        field("condition_source_value", "value/@code", "value/@displayName",
                                Transform.FORMAT_SOURCE, true),
                        field("visit_occurrence_id", "entryRelationship/encounter/id/@extension", null,
                                Transform.VISIT, true))))
                .idGen(MappingRule.IdGenSpec.builder()
                        .baseFields(List.of("Value.code", "effectiveTime/low/@value"))
                        .generator("condition")
                        .build())
                .build();
    }

    private static MappingRule uncodedRule() {
        return MappingRule.builder()
                .name("Notes")
                .source(MappingRule.SourceSpec.builder().section("Observations").build())
                .target(MappingRule.TargetSpec.builder().table(OmopTable.OBSERVATION).typeConceptId(32817L).build())
                .fields(new ArrayList<>(List.of(
                        field("observation_date", "effectiveTime", null, Transform.DATE, false),
                        field("value_as_string", "text", null, Transform.STRING, true))))
                .build();
    }

    private static MappingRule measurementRule() {
        return MappingRule.builder()
                .name("Test_measurement")
                .source(MappingRule.SourceSpec.builder().section("VitalSigns").build())
                .target(MappingRule.TargetSpec.builder().table(OmopTable.MEASUREMENT).typeConceptId(32817L).build())
                .fields(new ArrayList<>(List.of(
                        MappingRule.FieldMapping.builder().target("measurement_concept_id").xpath("code/@code")
                                .vocabXpath("code/@codeSystem").transform(Transform.VOCAB).build(),
                        field("measurement_date", "effectiveTime", null, Transform.DATE, false),
                        field("measurement_datetime", "effectiveTime", null, Transform.TIME_PTR, true),
                        field("value_as_number", "value/@value", null, Transform.FLOAT, true),
                        field("unit_concept_id", "value/@unit", null, Transform.UNIT, true),
                        field("unit_source_value", "value/@unit", null, Transform.STRING, true),
                        MappingRule.FieldMapping.builder().target("value_as_concept_id")
                                .xpath("interpretationCode/@code").vocabXpath("interpretationCode/@codeSystem")
                                .transform(Transform.VALUE_VOCAB).optional(true).build(),
                        field("operator_concept_id", "repeatNumber/@value", null, Transform.INT, true))))
                .idGen(MappingRule.IdGenSpec.builder().baseFields(List.of("Code.code", "Value")).build())
                .build();
    }

    private static MappingRule.FieldMapping field(String target, String xpath, String fallback, Transform transform,
            boolean optional) {
        return MappingRule.FieldMapping.builder()
                .target(target)
                .xpath(xpath)
                .fallbackXpath(fallback)
                .transform(transform)
                .optional(optional)
                .build();
    }

    private static Element problem(String code, String codeSystem, String low) {
        return xml("<observation classCode=\"OBS\" moodCode=\"EVN\"><statusCode code=\"completed\"/>"
                + "<effectiveTime><low value=\"" + low + "\"/></effectiveTime>"
                + "<value code=\"" + code + "\" codeSystem=\"" + codeSystem
                + "\" displayName=\"Type 2 diabetes mellitus\"/></observation>");
    }

    static Element xml(String content) {
        return TestFixtures.element(content);
    }
}
