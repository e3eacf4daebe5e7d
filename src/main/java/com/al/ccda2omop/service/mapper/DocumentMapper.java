package com.al.ccda2omop.service.mapper;

import com.al.ccda2omop.model.ccda.ClinicalDocument;
import com.al.ccda2omop.model.ccda.Encounter;
import com.al.ccda2omop.model.ccda.Patient;
import com.al.ccda2omop.model.ccda.SectionType;
import com.al.ccda2omop.model.omop.OmopDataset;
import com.al.ccda2omop.model.omop.OmopTable;
import com.al.ccda2omop.model.omop.Person;
import com.al.ccda2omop.model.omop.VisitOccurrence;
import com.al.ccda2omop.model.rule.ConditionType;
import com.al.ccda2omop.model.rule.MappingRule;
import com.al.ccda2omop.model.vocabulary.ConceptResolution;
import com.al.ccda2omop.report.ConversionReport;
import com.al.ccda2omop.service.engine.EntryMapping;
import com.al.ccda2omop.service.engine.MappedRecord;
import com.al.ccda2omop.service.engine.RuleEngine;
import com.al.ccda2omop.service.engine.SkipReason;
import com.al.ccda2omop.service.engine.XmlExtractor;
import com.al.ccda2omop.service.rule.RuleSet;
import com.al.ccda2omop.service.vocabulary.StandardConcepts;
import com.al.ccda2omop.util.IdGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.w3c.dom.Element;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps one parsed C-CDA document to OMOP rows.
 *
 * <p>
 * Person and visit rows are built directly from demographics and
 * encounters. Clinical sections are then mapped in a fixed order, each
 * through all of its rules in load order, so output is deterministic for a
 * given document and rule set.
 *
 * @author CCDA2OMOP Team
 * @since 1.0.0
 */
@Service
@Slf4j
public class DocumentMapper {

    static final String PERSON_RULE = "RuleMapper:Person";
    static final String ENCOUNTER_RULE = "RuleMapper:Encounter";
    static final int DEFAULT_YEAR_OF_BIRTH = 1900;

    /**
     * Clinical sections in mapping order.
     */
    public static final List<SectionType> SECTION_ORDER = List.of(
            SectionType.PROBLEMS, SectionType.MEDICATIONS, SectionType.IMMUNIZATIONS, SectionType.PROCEDURES,
            SectionType.VITAL_SIGNS, SectionType.LAB_RESULTS, SectionType.ALLERGIES, SectionType.OBSERVATIONS,
            SectionType.DEVICES);

    private final RuleSet rules;
    private final RuleEngine engine;
    private final RowConverter rowConverter;
    private final StandardConcepts concepts;

    @Autowired
    public DocumentMapper(RuleSet rules, RuleEngine engine, RowConverter rowConverter, StandardConcepts concepts) {
        this.rules = rules;
        this.engine = engine;
        this.rowConverter = rowConverter;
        this.concepts = concepts;
    }

    public MappingResult map(ClinicalDocument doc) {
        OmopDataset data = new OmopDataset();
        ConversionReport report = new ConversionReport();

        long personId = IdGenerator.personId(doc.getPatient().getId(), IdGenerator.SOURCE_SYSTEM_CCDA);
        data.add(mapPerson(doc.getPatient(), personId));

        Map<String, Long> visitMap = new LinkedHashMap<>();
        for (Encounter encounter : doc.getEncounters()) {
            VisitOccurrence visit = mapEncounter(encounter, personId);
            visitMap.put(encounter.getId(), visit.getVisitOccurrenceId());
            data.add(visit);
        }

        for (SectionType section : SECTION_ORDER) {
            List<MappingRule> sectionRules = rules.forSection(section.sectionName());
            if (!sectionRules.isEmpty()) {
                mapSection(doc, section, sectionRules, personId, visitMap, data, report);
            }
        }
        return new MappingResult(data, report);
    }

    private void mapSection(ClinicalDocument doc, SectionType section, List<MappingRule> sectionRules,
            long personId, Map<String, Long> visitMap, OmopDataset data, ConversionReport report) {
        boolean entriesRequired = doc.entriesRequired(section.sectionName());
        OmopTable primaryTable = sectionRules.get(0).targetTable();
        Map<Element, EntryOutcome> outcomes = new IdentityHashMap<>();
        List<Element> order = new ArrayList<>();
        Map<OmopTable, Integer> produced = new LinkedHashMap<>();

        for (MappingRule rule : sectionRules) {
            for (Element entry : entriesFor(doc, section, rule)) {
                EntryOutcome outcome = outcomes.computeIfAbsent(entry, e -> {
                    order.add(e);
                    return new EntryOutcome();
                });
                EntryMapping mapping = engine.mapEntry(rule, entry, personId, visitMap, entriesRequired);
                outcome.record(mapping.getResolution());
                if (mapping.isSkipped()) {
                    outcome.skip(mapping.getSkipReason());
                    continue;
                }
                int converted = 0;
                for (MappedRecord record : mapping.getRecords()) {
                    RowResult row = rowConverter.convert(record);
                    if (!row.isPresent()) {
                        log.debug("Rule {}: record dropped, missing {}", rule.getName(), row.getMissingColumn());
                        continue;
                    }
                    data.add(row.getRow());
                    report.addSectionRecord(section.sectionName(), rule.targetTable().tableName());
                    if (rule.targetTable() != primaryTable) {
                        report.addDomainRoute(section.sectionName(), primaryTable.tableName(),
                                rule.targetTable().tableName(), routingReason(rule));
                    }
                    converted++;
                }
                if (converted > 0) {
                    outcome.mapped = true;
                    produced.merge(rule.targetTable(), converted, Integer::sum);
                } else {
                    outcome.skip(SkipReason.MISSING_REQUIRED_FIELD);
                }
            }
        }

        for (Element entry : order) {
            EntryOutcome outcome = outcomes.get(entry);
            report.addSectionEntry(section.sectionName());
            if (outcome.resolution != null && !outcome.resolution.getVocabularyId().isEmpty()) {
                report.addConceptMapping(outcome.resolution.getVocabularyId(),
                        outcome.resolution.isMappedToStandard());
            }
            if (!outcome.mapped) {
                report.addSkipped(section.sectionName(), outcome.reason().label());
            }
        }

        String summary = produced.entrySet().stream()
                .map(e -> e.getValue() + " to " + e.getKey().tableName())
                .collect(Collectors.joining(", "));
        log.debug("Mapped {} {} entries: {}", order.size(), section.sectionName(),
                summary.isEmpty() ? "no records" : summary);
    }

    /**
     * Entries for a rule: its {@code entry_xpath} under the section carrying
     * one of the rule's template OIDs, or the parser's default entries when
     * the rule names no path.
     */
    public static List<Element> entriesFor(ClinicalDocument doc, SectionType section, MappingRule rule) {
        String entryXpath = rule.getSource().getEntryXpath();
        if (entryXpath == null || entryXpath.isBlank()) {
            return doc.entries(section);
        }
        Element sectionElement = findSection(doc.getRoot(), rule.getSource().getSectionOid(),
                rule.getSource().getSectionOidEntriesRequired());
        if (sectionElement == null) {
            return List.of();
        }
        try {
            return XmlExtractor.elements(sectionElement, entryXpath);
        } catch (IllegalArgumentException e) {
            log.warn("Rule {}: invalid entry path: {}", rule.getName(), e.getMessage());
            return List.of();
        }
    }

    static Element findSection(Element root, String sectionOid, String entriesRequiredOid) {
        for (Element section : XmlExtractor.elements(root, "//component/section")) {
            for (Element template : XmlExtractor.elements(section, "templateId")) {
                String oid = template.getAttribute("root");
                if (!oid.isEmpty() && (oid.equals(sectionOid) || oid.equals(entriesRequiredOid))) {
                    return section;
                }
            }
        }
        return null;
    }

    private static String routingReason(MappingRule rule) {
        return rule.getSource().getConditions().stream()
                .map(c -> "concept domain " + (c.getType() == ConditionType.DOMAIN_NOT_EQUALS ? "!= " : "= ")
                        + c.getValue())
                .collect(Collectors.joining(", "));
    }

    Person mapPerson(Patient patient, long personId) {
        LocalDateTime birth = patient.getBirthTime();
        return Person.builder()
                .personId(personId)
                .genderConceptId(concepts.gender(patient.getGender().getCode()))
                .yearOfBirth(birth != null ? birth.getYear() : DEFAULT_YEAR_OF_BIRTH)
                .monthOfBirth(birth != null ? birth.getMonthValue() : null)
                .dayOfBirth(birth != null ? birth.getDayOfMonth() : null)
                .birthDatetime(birth)
                .raceConceptId(concepts.race(patient.getRace().getCode()))
                .ethnicityConceptId(concepts.ethnicity(patient.getEthnicity().getCode()))
                .personSourceValue(patient.getId())
                .genderSourceValue(patient.getGender().getDisplayName())
                .raceSourceValue(patient.getRace().getDisplayName())
                .ethnicitySourceValue(patient.getEthnicity().getDisplayName())
                .mappingRule(PERSON_RULE)
                .build();
    }

    /**
     * Every encounter becomes a visit. Without a start time the visit dates
     * fall back to {@link RowConverter#UNKNOWN_DATE} and the datetimes stay empty.
     */
    VisitOccurrence mapEncounter(Encounter encounter, long personId) {
        LocalDateTime start = encounter.getEffectiveTime().start();
        LocalDateTime end = encounter.getEffectiveTime().getHigh() != null
                ? encounter.getEffectiveTime().getHigh()
                : start;
        if (start == null) {
            log.debug("Encounter '{}' has no start time", encounter.getId());
        }
        return VisitOccurrence.builder()
                .visitOccurrenceId(IdGenerator.visitId(personId, encounter.getId()))
                .personId(personId)
                .visitConceptId(concepts.visit(encounter.getCode().getCode()))
                .visitStartDate(start != null ? start.toLocalDate() : RowConverter.UNKNOWN_DATE)
                .visitStartDatetime(start)
                .visitEndDate(end != null ? end.toLocalDate() : RowConverter.UNKNOWN_DATE)
                .visitEndDatetime(end)
                .visitTypeConceptId(StandardConcepts.EHR_TYPE)
                .visitSourceValue(encounter.getCode().getDisplayName())
                .mappingRule(ENCOUNTER_RULE)
                .build();
    }

    /**
     * What happened to one entry across all rules of its section.
     */
    private static final class EntryOutcome {
        private boolean mapped;
        private ConceptResolution resolution;
        private final List<SkipReason> reasons = new ArrayList<>();

        private void record(ConceptResolution candidate) {
            if (resolution == null && candidate != null) {
                resolution = candidate;
            }
        }

        private void skip(SkipReason reason) {
            reasons.add(reason);
        }

        /**
         * A failed routing condition only explains a skip when no rule
         * failed for another reason.
         */
        private SkipReason reason() {
            return reasons.stream()
                    .filter(r -> r != SkipReason.CONDITION_FAILED)
                    .findFirst()
                    .orElse(reasons.isEmpty() ? SkipReason.EXCLUDED : SkipReason.CONDITION_FAILED);
        }
    }
}
