package com.al.ccda2omop.service.engine;

import com.al.ccda2omop.model.omop.OmopTable;
import com.al.ccda2omop.model.rule.ConditionType;
import com.al.ccda2omop.model.rule.MappingRule;
import com.al.ccda2omop.model.rule.Transform;
import com.al.ccda2omop.model.vocabulary.ConceptResolution;
import com.al.ccda2omop.service.vocabulary.CodeSystemResolver;
import com.al.ccda2omop.service.vocabulary.StandardConcepts;
import com.al.ccda2omop.util.Hl7Time;
import com.al.ccda2omop.util.IdGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Applies a {@link MappingRule} to C-CDA entry elements.
 *
 * <p>
 * For each included entry the engine resolves the coded field to standard
 * concept ids, checks the rule's domain conditions, derives a deterministic
 * base id and emits one record per concept id. Nothing thrown while reading
 * an entry escapes: failures become a {@link SkipReason} or drop the single
 * record they affect.
 *
 * @author CCDA2OMOP Team
 * @since 1.0.0
 */
@Component
@Slf4j
public class RuleEngine {

    private static final String ACCEPTED_MOOD = "EVN";

    private final StandardConcepts concepts;

    @Autowired
    public RuleEngine(StandardConcepts concepts) {
        this.concepts = concepts;
    }

    /**
     * Map every entry and concatenate the records.
     */
    public List<MappedRecord> mapEntries(MappingRule rule, List<Element> entries, long personId,
            Map<String, Long> visitMap, boolean entriesRequired) {
        List<MappedRecord> records = new ArrayList<>();
        for (Element entry : entries) {
            records.addAll(mapEntry(rule, entry, personId, visitMap, entriesRequired).getRecords());
        }
        return records;
    }

    public EntryMapping mapEntry(MappingRule rule, Element entry, long personId,
            Map<String, Long> visitMap, boolean entriesRequired) {
        if (!shouldInclude(entry)) {
            return EntryMapping.skipped(SkipReason.EXCLUDED, null);
        }

        ConceptLookup lookup;
        try {
            lookup = conceptIds(rule, entry, entriesRequired);
        } catch (IllegalArgumentException e) {
            log.debug("Rule {}: concept extraction failed: {}", rule.getName(), e.getMessage());
            return EntryMapping.skipped(SkipReason.XPATH_ERROR, null);
        }
        if (lookup.conceptIds.isEmpty()) {
            log.debug("Rule {}: entry has no usable concept", rule.getName());
            return EntryMapping.skipped(SkipReason.NO_CONCEPT, lookup.resolution);
        }

        long primaryConcept = lookup.conceptIds.get(0) == null ? 0L : lookup.conceptIds.get(0);
        if (!conditionsHold(rule, primaryConcept)) {
            return EntryMapping.skipped(SkipReason.CONDITION_FAILED, lookup.resolution);
        }

        long baseId;
        try {
            baseId = baseId(rule, entry, personId);
        } catch (IllegalArgumentException e) {
            log.debug("Rule {}: id seed extraction failed: {}", rule.getName(), e.getMessage());
            return EntryMapping.skipped(SkipReason.XPATH_ERROR, lookup.resolution);
        }

        List<MappedRecord> records = new ArrayList<>();
        for (int i = 0; i < lookup.conceptIds.size(); i++) {
            MappedRecord record = createRecord(rule, entry, personId, baseId + i,
                    lookup.conceptIds.get(i), visitMap, entriesRequired);
            if (record != null) {
                records.add(record);
            }
        }
        if (records.isEmpty()) {
            return EntryMapping.skipped(SkipReason.MISSING_REQUIRED_FIELD, lookup.resolution);
        }
        return EntryMapping.mapped(records, lookup.resolution, primaryConcept);
    }

    /**
     * Only actual events ({@code moodCode} EVN or absent) whose status is
     * completed, active or absent are mapped.
     */
    public static boolean shouldInclude(Element entry) {
        if (entry == null) {
            return false;
        }
        String mood = entry.getAttribute("moodCode");
        if (!mood.isEmpty() && !ACCEPTED_MOOD.equals(mood)) {
            return false;
        }
        Element status = XmlExtractor.child(entry, "statusCode");
        if (status != null) {
            String code = status.getAttribute("code");
            return code.isEmpty() || "completed".equals(code) || "active".equals(code);
        }
        return true;
    }

    private ConceptLookup conceptIds(MappingRule rule, Element entry, boolean entriesRequired) {
        boolean hasCodedField = false;
        ConceptResolution lastResolution = null;
        for (MappingRule.FieldMapping field : rule.getFields()) {
            if (field.getTransform() != Transform.VOCAB) {
                continue;
            }
            hasCodedField = true;
            String code = XmlExtractor.string(entry, field.getXpath(), field.getFallbackXpath());
            if (code.isEmpty()) {
                continue;
            }
            String codeSystem = XmlExtractor.string(entry, field.getVocabXpath());
            String vocabularyId = CodeSystemResolver.toVocabularyId(codeSystem);
            if (!vocabularyId.isEmpty()) {
                lastResolution = concepts.getVocabulary().resolve(vocabularyId, code);
                if (lastResolution.isFound()) {
                    return new ConceptLookup(lastResolution.getConceptIds(), lastResolution);
                }
            } else {
                lastResolution = ConceptResolution.notFound();
            }
            if (!entriesRequired) {
                return new ConceptLookup(List.of(StandardConcepts.NO_MATCHING_CONCEPT), lastResolution);
            }
        }
        if (!hasCodedField) {
            if (entriesRequired) {
                return new ConceptLookup(List.of(), null);
            }
            List<Long> none = new ArrayList<>();
            none.add(null);
            return new ConceptLookup(none, null);
        }
        if (!entriesRequired) {
            return new ConceptLookup(List.of(StandardConcepts.NO_MATCHING_CONCEPT), lastResolution);
        }
        return new ConceptLookup(List.of(), lastResolution);
    }

    private boolean conditionsHold(MappingRule rule, long conceptId) {
        for (MappingRule.Condition condition : rule.getSource().getConditions()) {
            String domain = concepts.getVocabulary().domainOf(conceptId);
            if (condition.getType() == ConditionType.DOMAIN_EQUALS && !domain.equals(condition.getValue())) {
                return false;
            }
            if (condition.getType() == ConditionType.DOMAIN_NOT_EQUALS && domain.equals(condition.getValue())) {
                return false;
            }
        }
        return true;
    }

    private long baseId(MappingRule rule, Element entry, long personId) {
        List<String> parts = new ArrayList<>();
        String generator = rule.getIdGen().getGenerator();
        parts.add(generator == null || generator.isEmpty() ? rule.targetTable().tableName() : generator);
        parts.add(String.valueOf(personId));
        for (String baseField : rule.getIdGen().getBaseFields()) {
            String value = XmlExtractor.string(entry, baseFieldPath(baseField));
            if (!value.isEmpty()) {
                parts.add(value);
            }
        }
        return IdGenerator.generateId(parts.toArray(new String[0]));
    }

    /**
     * Translate an id seed field to XPath: {@code Code.code} becomes
     * {@code code/@code}, {@code Value} becomes {@code value/@value}, and
     * anything containing {@code /} or {@code @} is used as written.
     */
    static String baseFieldPath(String baseField) {
        if (baseField.contains("/") || baseField.contains("@")) {
            return baseField;
        }
        int dot = baseField.lastIndexOf('.');
        if (dot < 0) {
            String name = decapitalize(baseField);
            return name + "/@value";
        }
        String[] path = baseField.substring(0, dot).split("\\.");
        StringBuilder xpath = new StringBuilder();
        for (String step : path) {
            if (xpath.length() > 0) {
                xpath.append('/');
            }
            xpath.append(decapitalize(step));
        }
        return xpath.append("/@").append(decapitalize(baseField.substring(dot + 1))).toString();
    }

    private static String decapitalize(String name) {
        if (name.isEmpty()) {
            return name;
        }
        return Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }

    private MappedRecord createRecord(MappingRule rule, Element entry, long personId, long recordId,
            Long conceptId, Map<String, Long> visitMap, boolean entriesRequired) {
        OmopTable table = rule.targetTable();
        MappedRecord record = new MappedRecord(table, rule.getName());
        record.put(table.idColumn(), FieldValue.integer(recordId));
        record.put("person_id", FieldValue.integer(personId));
        record.put(table.typeConceptColumn(), FieldValue.integer(rule.getTarget().getTypeConceptId()));

        for (MappingRule.FieldMapping field : rule.getFields()) {
            boolean optional = field.isOptional() || !entriesRequired;
            FieldValue value;
            try {
                value = fieldValue(entry, field, conceptId, visitMap);
            } catch (RuntimeException e) {
                log.debug("Rule {}: field {} failed: {}", rule.getName(), field.getTarget(), e.getMessage());
                value = null;
            }
            if (value != null) {
                record.put(field.getTarget(), value);
            } else if (!optional) {
                log.debug("Rule {}: required field {} missing, record dropped", rule.getName(), field.getTarget());
                return null;
            }
        }
        record.put("mapping_rule", FieldValue.string(rule.provenance()));
        return record;
    }

    /**
     * @return the transformed value, or null when the field is absent
     */
    private FieldValue fieldValue(Element entry, MappingRule.FieldMapping field, Long conceptId,
            Map<String, Long> visitMap) {
        switch (field.getTransform()) {
            case VOCAB:
                return conceptId == null ? null : FieldValue.integer(conceptId);
            case DATE:
                return timestamp(truncate(time(entry, field)));
            case TIME_PTR:
                return timestamp(time(entry, field));
            default:
                break;
        }

        String raw = XmlExtractor.string(entry, field.getXpath(), field.getFallbackXpath());
        switch (field.getTransform()) {
            case INT:
                return raw.isEmpty() ? null : FieldValue.integer(Long.parseLong(raw.trim()));
            case FLOAT:
                return raw.isEmpty() ? null : FieldValue.decimal(Double.parseDouble(raw.trim()));
            case UNIT:
                return raw.isEmpty() ? null : FieldValue.integer(concepts.unit(raw));
            case ROUTE:
                return raw.isEmpty() ? null
                        : FieldValue.integer(concepts.route(raw, XmlExtractor.string(entry, field.getVocabXpath())));
            case VALUE_VOCAB:
                return raw.isEmpty() ? null
                        : FieldValue.integer(concepts.value(raw, XmlExtractor.string(entry, field.getVocabXpath())));
            case FORMAT_SOURCE:
                String formatted = formatSourceValue(XmlExtractor.string(entry, field.getXpath()),
                        XmlExtractor.string(entry, field.getFallbackXpath()));
                return formatted.isEmpty() ? null : FieldValue.string(formatted);
            case VISIT:
                Long visitId = raw.isEmpty() ? null : visitMap.get(raw);
                return visitId == null ? null : FieldValue.integer(visitId);
            default:
                return raw.isEmpty() ? null : FieldValue.string(raw);
        }
    }

    private static LocalDateTime time(Element entry, MappingRule.FieldMapping field) {
        LocalDateTime time = XmlExtractor.time(entry, field.getXpath());
        if (time == null && field.getFallbackXpath() != null && !field.getFallbackXpath().isBlank()) {
            time = XmlExtractor.time(entry, field.getFallbackXpath());
        }
        return time;
    }

    private static LocalDateTime truncate(LocalDateTime time) {
        return time == null ? null : time.toLocalDate().atStartOfDay();
    }

    private static FieldValue timestamp(LocalDateTime time) {
        return time == null ? null : FieldValue.timestamp(time);
    }

    /**
     * "code: display" when both are present, otherwise whichever is.
     */
    public static String formatSourceValue(String code, String display) {
        boolean hasCode = code != null && !code.isEmpty();
        boolean hasDisplay = display != null && !display.isEmpty();
        if (hasCode && hasDisplay) {
            return code + ": " + display;
        }
        if (hasDisplay) {
            return display;
        }
        return hasCode ? code : "";
    }

    private static final class ConceptLookup {
        private final List<Long> conceptIds;
        private final ConceptResolution resolution;

        private ConceptLookup(List<Long> conceptIds, ConceptResolution resolution) {
            this.conceptIds = conceptIds;
            this.resolution = resolution;
        }
    }
}
