package com.al.ccda2omop.service.analysis;

import com.al.ccda2omop.model.ccda.ClinicalDocument;
import com.al.ccda2omop.model.ccda.SectionType;
import com.al.ccda2omop.model.rule.MappingRule;
import com.al.ccda2omop.model.rule.Transform;
import com.al.ccda2omop.model.vocabulary.Concept;
import com.al.ccda2omop.model.vocabulary.ConceptResolution;
import com.al.ccda2omop.service.engine.XmlExtractor;
import com.al.ccda2omop.service.mapper.DocumentMapper;
import com.al.ccda2omop.service.parser.CcdaParser;
import com.al.ccda2omop.service.rule.RuleSet;
import com.al.ccda2omop.service.vocabulary.CodeSystemResolver;
import com.al.ccda2omop.service.vocabulary.VocabularyIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.w3c.dom.Element;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lists every coded value the mapping rules read from a document and how it
 * resolves against the loaded vocabulary, without producing OMOP rows.
 *
 * <p>
 * Codes are located through the coded fields of the rules, so the analysis
 * covers exactly what a conversion would look up. A field shared by several
 * rules of one section is reported once per entry.
 *
 * @author CCDA2OMOP Team
 * @since 1.0.0
 */
@Service
@Slf4j
public class CodeAnalyzer {

    private static final Set<Transform> CODED = EnumSet.of(Transform.VOCAB, Transform.VALUE_VOCAB, Transform.ROUTE);

    private final RuleSet rules;
    private final VocabularyIndex vocabulary;
    private final CcdaParser parser;

    @Autowired
    public CodeAnalyzer(RuleSet rules, VocabularyIndex vocabulary, CcdaParser parser) {
        this.rules = rules;
        this.vocabulary = vocabulary;
        this.parser = parser;
    }

    public List<CodeMapping> analyze(Path file) {
        return analyze(parser.parse(file));
    }

    public List<CodeMapping> analyze(ClinicalDocument doc) {
        List<CodeMapping> mappings = new ArrayList<>();
        for (SectionType section : DocumentMapper.SECTION_ORDER) {
            Map<Element, Set<String>> seen = new IdentityHashMap<>();
            for (MappingRule rule : rules.forSection(section.sectionName())) {
                String entryPath = entryPath(section, rule);
                for (Element entry : DocumentMapper.entriesFor(doc, section, rule)) {
                    for (MappingRule.FieldMapping field : rule.getFields()) {
                        if (!CODED.contains(field.getTransform())
                                || !seen.computeIfAbsent(entry, e -> new HashSet<>()).add(field.getXpath())) {
                            continue;
                        }
                        CodeMapping mapping = analyzeField(section, entryPath, entry, field);
                        if (mapping != null) {
                            mappings.add(mapping);
                        }
                    }
                }
            }
        }
        log.debug("Found {} coded values", mappings.size());
        return mappings;
    }

    private CodeMapping analyzeField(SectionType section, String entryPath, Element entry,
            MappingRule.FieldMapping field) {
        String code;
        String codeSystem;
        String displayName;
        try {
            code = XmlExtractor.string(entry, field.getXpath(), field.getFallbackXpath());
            codeSystem = XmlExtractor.string(entry, field.getVocabXpath());
            displayName = XmlExtractor.string(entry, displayNamePath(field.getXpath()));
        } catch (IllegalArgumentException e) {
            log.debug("Section {}: cannot read {}: {}", section.sectionName(), field.getXpath(), e.getMessage());
            return null;
        }
        if (code.isEmpty()) {
            return null;
        }
        return resolve(section.sectionName(), entryPath + "/" + field.getXpath(), code, codeSystem, displayName);
    }

    CodeMapping resolve(String section, String xpath, String code, String codeSystem, String displayName) {
        CodeMapping.CodeMappingBuilder mapping = CodeMapping.builder()
                .section(section)
                .xpath(xpath)
                .sourceCode(code)
                .sourceCodeSystem(codeSystem)
                .sourceDisplayName(displayName);

        String vocabularyId = CodeSystemResolver.toVocabularyId(codeSystem);
        mapping.sourceVocabulary(vocabularyId);
        if (vocabularyId.isEmpty()) {
            return mapping.status(MappingStatus.NO_VOCAB).build();
        }
        if (vocabulary.conceptCount() == 0) {
            return mapping.status(MappingStatus.NO_VOCAB_LOADER).build();
        }

        ConceptResolution resolution = vocabulary.resolve(vocabularyId, code);
        switch (resolution.getKind()) {
            case STANDARD:
            case MAPPED:
                List<Long> targets = resolution.getConceptIds();
                Concept target = vocabulary.lookupById(targets.get(0));
                if (target == null) {
                    return mapping.status(MappingStatus.UNMAPPED).build();
                }
                return describe(mapping, target)
                        .standard(target.isStandard())
                        .status(MappingStatus.MAPPED)
                        .targetCount(targets.size())
                        .build();
            case SOURCE_ONLY:
                return describe(mapping, vocabulary.lookup(vocabularyId, code))
                        .status(MappingStatus.UNMAPPED)
                        .build();
            default:
                return mapping.status(MappingStatus.UNMAPPED).build();
        }
    }

    private static CodeMapping.CodeMappingBuilder describe(CodeMapping.CodeMappingBuilder mapping, Concept concept) {
        if (concept == null) {
            return mapping;
        }
        return mapping.omopConceptId(concept.getConceptId())
                .omopConceptName(nullToEmpty(concept.getConceptName()))
                .omopDomainId(nullToEmpty(concept.getDomainId()))
                .omopVocabularyId(nullToEmpty(concept.getVocabularyId()));
    }

    private static String entryPath(SectionType section, MappingRule rule) {
        String entryXpath = rule.getSource().getEntryXpath();
        return entryXpath == null || entryXpath.isBlank() ? section.defaultEntryPath() : entryXpath;
    }

    /**
     * {@code value/@code} reads its label from {@code value/@displayName}.
     */
    static String displayNamePath(String codePath) {
        if (codePath == null || !codePath.endsWith("@code")) {
            return null;
        }
        return codePath.substring(0, codePath.length() - "code".length()) + "displayName";
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
