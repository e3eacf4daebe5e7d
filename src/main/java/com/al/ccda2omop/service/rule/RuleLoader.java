package com.al.ccda2omop.service.rule;

import com.al.ccda2omop.exception.RuleLoadException;
import com.al.ccda2omop.model.omop.OmopTable;
import com.al.ccda2omop.model.rule.ConditionType;
import com.al.ccda2omop.model.rule.MappingRule;
import com.al.ccda2omop.model.rule.Transform;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads mapping rules from YAML.
 *
 * <p>
 * A document is either a single rule (it has a {@code name} key) or a list
 * of rules under {@code rules}. Anything else, including an empty document,
 * yields no rules. Directories are read in sorted file name order so rules
 * for the same section always append in the same order.
 *
 * @author CCDA2OMOP Team
 * @since 1.0.0
 */
@Component
@Slf4j
public class RuleLoader {

    /**
     * Load rules from a YAML file, or from every {@code .yaml}/{@code .yml}
     * file of a directory.
     */
    public List<MappingRule> load(Path path) {
        if (Files.isDirectory(path)) {
            return loadDirectory(path);
        }
        if (!Files.isRegularFile(path)) {
            throw new RuleLoadException("Rules path not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader, path.toString());
        } catch (IOException e) {
            throw new RuleLoadException("Failed to read rules file " + path, e);
        }
    }

    /**
     * Load rules from classpath or URL resources, sorted by file name.
     */
    public List<MappingRule> load(Resource[] resources) {
        List<Resource> sorted = Arrays.stream(resources)
                .filter(r -> r.getFilename() != null && isRuleFile(r.getFilename()))
                .sorted(Comparator.comparing(Resource::getFilename))
                .collect(Collectors.toList());
        List<MappingRule> rules = new ArrayList<>();
        for (Resource resource : sorted) {
            try (InputStream in = resource.getInputStream();
                    Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                rules.addAll(load(reader, resource.getDescription()));
            } catch (IOException e) {
                throw new RuleLoadException("Failed to read rules resource " + resource.getDescription(), e);
            }
        }
        return rules;
    }

    public List<MappingRule> load(Reader reader, String sourceName) {
        Object document;
        try {
            document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
        } catch (YAMLException e) {
            throw new RuleLoadException("Malformed YAML in " + sourceName, e);
        }
        if (!(document instanceof Map)) {
            return Collections.emptyList();
        }
        Map<?, ?> root = (Map<?, ?>) document;
        List<MappingRule> rules = new ArrayList<>();
        if (root.containsKey("name")) {
            rules.add(convertRule(root));
        } else if (root.containsKey("rules")) {
            for (Map<?, ?> ruleData : maps(root.get("rules"))) {
                rules.add(convertRule(ruleData));
            }
        }
        log.debug("Loaded {} rules from {}", rules.size(), sourceName);
        return rules;
    }

    private List<MappingRule> loadDirectory(Path directory) {
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(p -> isRuleFile(p.getFileName().toString()))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new RuleLoadException("Failed to list rules directory " + directory, e);
        }
        List<MappingRule> rules = new ArrayList<>();
        for (Path file : files) {
            rules.addAll(load(file));
        }
        return rules;
    }

    private static boolean isRuleFile(String fileName) {
        return fileName.endsWith(".yaml") || fileName.endsWith(".yml");
    }

    private MappingRule convertRule(Map<?, ?> data) {
        String name = str(data.get("name"));
        if (name.isBlank()) {
            throw new RuleLoadException("Rule without a name");
        }
        Map<?, ?> source = map(data.get("source"));
        Map<?, ?> target = map(data.get("target"));
        Map<?, ?> idGen = map(data.get("id_gen"));

        OmopTable table = OmopTable.fromTableName(str(target.get("table")))
                .filter(OmopTable::isRuleTarget)
                .orElseThrow(() -> new RuleLoadException(name, "unknown target table '" + target.get("table") + "'"));

        List<MappingRule.Condition> conditions = new ArrayList<>();
        for (Map<?, ?> c : maps(source.get("conditions"))) {
            String type = str(c.get("type"));
            conditions.add(MappingRule.Condition.builder()
                    .type(ConditionType.fromRuleName(type)
                            .orElseThrow(() -> new RuleLoadException(name, "unknown condition type '" + type + "'")))
                    .field(str(c.get("field")))
                    .value(str(c.get("value")))
                    .build());
        }

        List<MappingRule.Extraction> extraction = new ArrayList<>();
        for (Map<?, ?> e : maps(source.get("extraction"))) {
            extraction.add(MappingRule.Extraction.builder()
                    .field(str(e.get("field")))
                    .xpath(str(e.get("xpath")))
                    .type(str(e.get("type")))
                    .build());
        }

        List<MappingRule.FieldMapping> fields = new ArrayList<>();
        for (Map<?, ?> f : maps(data.get("fields"))) {
            String column = str(f.get("target"));
            if (!table.hasColumn(column)) {
                throw new RuleLoadException(name,
                        "column '" + column + "' is not part of " + table.tableName());
            }
            String transform = str(f.get("transform"));
            fields.add(MappingRule.FieldMapping.builder()
                    .target(column)
                    .xpath(str(f.get("xpath")))
                    .fallbackXpath(str(f.get("fallback_xpath")))
                    .vocabXpath(str(f.get("vocab_xpath")))
                    .transform(Transform.fromRuleName(transform)
                            .orElseThrow(() -> new RuleLoadException(name, "unknown transform '" + transform + "'")))
                    .optional(Boolean.TRUE.equals(f.get("optional")))
                    .build());
        }

        List<String> baseFields = new ArrayList<>();
        Object rawBaseFields = idGen.get("base_fields");
        if (rawBaseFields instanceof List) {
            for (Object field : (List<?>) rawBaseFields) {
                baseFields.add(str(field));
            }
        }

        return MappingRule.builder()
                .name(name)
                .source(MappingRule.SourceSpec.builder()
                        .section(str(source.get("section")))
                        .sectionOid(str(source.get("section_oid")))
                        .sectionOidEntriesRequired(str(source.get("section_oid_entries_required")))
                        .entryXpath(str(source.get("entry_xpath")))
                        .entryType(str(source.get("entry_type")))
                        .extraction(extraction)
                        .conditions(conditions)
                        .build())
                .target(MappingRule.TargetSpec.builder()
                        .table(table)
                        .typeConceptId(number(name, target.get("type_concept_id")))
                        .build())
                .fields(fields)
                .idGen(MappingRule.IdGenSpec.builder()
                        .baseFields(baseFields)
                        .generator(str(idGen.get("generator")))
                        .build())
                .build();
    }

    private static Map<?, ?> map(Object value) {
        return value instanceof Map ? (Map<?, ?>) value : Collections.emptyMap();
    }

    private static List<Map<?, ?>> maps(Object value) {
        if (!(value instanceof List)) {
            return Collections.emptyList();
        }
        return ((List<?>) value).stream()
                .filter(Map.class::isInstance)
                .map(v -> (Map<?, ?>) v)
                .collect(Collectors.toList());
    }

    private static String str(Object value) {
        return value == null ? "" : Objects.toString(value);
    }

    private static long number(String ruleName, Object value) {
        if (value == null) {
            return 0L;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new RuleLoadException(ruleName, "type_concept_id is not a number: " + value);
        }
    }
}
