package com.al.ccda2omop.model.rule;

import com.al.ccda2omop.model.omop.OmopTable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A declarative mapping from one kind of C-CDA entry to one OMOP table.
 *
 * <p>
 * Rules are grouped by {@link SourceSpec#getSection() section}; a section may
 * carry several rules whose conditions route entries to different tables.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MappingRule {

    /**
     * Unique rule name, used as provenance in {@code mapping_rule}
     */
    private String name;

    @Builder.Default
    private SourceSpec source = new SourceSpec();

    @Builder.Default
    private TargetSpec target = new TargetSpec();

    @Builder.Default
    private List<FieldMapping> fields = new ArrayList<>();

    @Builder.Default
    private IdGenSpec idGen = new IdGenSpec();

    /**
     * Provenance tag written to every row the rule produces.
     */
    public String provenance() {
        return "RuleMapper:" + name;
    }

    public OmopTable targetTable() {
        return target.getTable();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SourceSpec {
        private String section;          // e.g. "Problems"
        private String sectionOid;       // entries-optional template id
        private String sectionOidEntriesRequired;
        private String entryXpath;       // relative to the section element
        private String entryType;
        @Builder.Default
        private List<Extraction> extraction = new ArrayList<>();
        @Builder.Default
        private List<Condition> conditions = new ArrayList<>();
    }

    /**
     * Named extraction kept for documentation of the rule's inputs.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Extraction {
        private String field;
        private String xpath;
        private String type;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Condition {
        private ConditionType type;
        private String field;
        private String value;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TargetSpec {
        private OmopTable table;
        private long typeConceptId;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FieldMapping {
        private String target;          // OMOP column
        private String xpath;
        private String fallbackXpath;
        private String vocabXpath;      // code system for vocab/route/value_vocab
        @Builder.Default
        private Transform transform = Transform.NONE;
        private boolean optional;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class IdGenSpec {
        /**
         * Entry sub-fields seeding the id, e.g. "Code.code" or "EffectiveTime.low"
         */
        @Builder.Default
        private List<String> baseFields = new ArrayList<>();
        /**
         * Id namespace; the target table name when empty
         */
        private String generator;
    }
}
