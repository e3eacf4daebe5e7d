package com.al.ccda2omop.service.rule;

import com.al.ccda2omop.model.rule.MappingRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable set of loaded rules, indexed by source section in load order.
 */
public final class RuleSet {

    private final List<MappingRule> rules;
    private final Map<String, List<MappingRule>> bySection;

    private RuleSet(List<MappingRule> rules) {
        this.rules = List.copyOf(rules);
        Map<String, List<MappingRule>> index = new LinkedHashMap<>();
        for (MappingRule rule : this.rules) {
            index.computeIfAbsent(rule.getSource().getSection(), k -> new ArrayList<>()).add(rule);
        }
        index.replaceAll((k, v) -> List.copyOf(v));
        this.bySection = Collections.unmodifiableMap(index);
    }

    public static RuleSet of(List<MappingRule> rules) {
        return new RuleSet(rules);
    }

    public static RuleSet empty() {
        return new RuleSet(List.of());
    }

    /**
     * Rules for a section, in load order; empty when the section has none.
     */
    public List<MappingRule> forSection(String section) {
        return bySection.getOrDefault(section, List.of());
    }

    /**
     * First rule with the given name.
     */
    public Optional<MappingRule> byName(String name) {
        return rules.stream().filter(r -> r.getName().equals(name)).findFirst();
    }

    public List<MappingRule> all() {
        return rules;
    }

    public Set<String> sections() {
        return bySection.keySet();
    }

    public int size() {
        return rules.size();
    }
}
