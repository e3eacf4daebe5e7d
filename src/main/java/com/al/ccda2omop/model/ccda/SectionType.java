package com.al.ccda2omop.model.ccda;

import java.util.Arrays;
import java.util.Optional;

/**
 * C-CDA sections the converter reads, with their template OIDs and the
 * default entry path relative to the section element.
 */
public enum SectionType {

    ENCOUNTERS("Encounters", "22", "22.1", "entry/encounter"),
    PROBLEMS("Problems", "5", "5.1", "entry/act/entryRelationship/observation"),
    MEDICATIONS("Medications", "1", "1.1", "entry/substanceAdministration"),
    PROCEDURES("Procedures", "7", "7.1", "entry/procedure"),
    VITAL_SIGNS("VitalSigns", "4", "4.1", "entry/organizer/component/observation"),
    LAB_RESULTS("LabResults", "3", "3.1", "entry/organizer/component/observation"),
    ALLERGIES("Allergies", "6", "6.1", "entry/act/entryRelationship/observation"),
    IMMUNIZATIONS("Immunizations", "2", "2.1", "entry/substanceAdministration"),
    DEVICES("Devices", "23", null, "entry/supply"),
    OBSERVATIONS("Observations", "17", null, "entry/observation");

    public static final String SECTION_OID_PREFIX = "2.16.840.1.113883.10.20.22.2.";

    private final String sectionName;
    private final String entriesOptionalOid;
    private final String entriesRequiredOid;
    private final String defaultEntryPath;

    SectionType(String sectionName, String entriesOptionalSuffix, String entriesRequiredSuffix,
            String defaultEntryPath) {
        this.sectionName = sectionName;
        this.entriesOptionalOid = SECTION_OID_PREFIX + entriesOptionalSuffix;
        this.entriesRequiredOid = entriesRequiredSuffix == null ? null : SECTION_OID_PREFIX + entriesRequiredSuffix;
        this.defaultEntryPath = defaultEntryPath;
    }

    /**
     * Name used by rule files ({@code source.section}).
     */
    public String sectionName() {
        return sectionName;
    }

    public String entriesOptionalOid() {
        return entriesOptionalOid;
    }

    /**
     * Entries-required template OID; null for sections that never require entries.
     */
    public String entriesRequiredOid() {
        return entriesRequiredOid;
    }

    public String defaultEntryPath() {
        return defaultEntryPath;
    }

    public boolean matches(String templateOid) {
        return entriesOptionalOid.equals(templateOid) || templateOid.equals(entriesRequiredOid);
    }

    public static Optional<SectionType> fromTemplateOid(String templateOid) {
        return Arrays.stream(values()).filter(t -> t.matches(templateOid)).findFirst();
    }

    public static Optional<SectionType> fromSectionName(String name) {
        return Arrays.stream(values()).filter(t -> t.sectionName.equals(name)).findFirst();
    }
}
