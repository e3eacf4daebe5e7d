package com.al.ccda2omop.model.ccda;

import lombok.Getter;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A parsed C-CDA document: the raw XML root plus the demographics,
 * encounters and per-section entry lists extracted from it.
 */
@Getter
public class ClinicalDocument {

    private final Element root;
    private final Patient patient;
    private final List<Encounter> encounters;
    private final Map<SectionType, List<Element>> entries = new EnumMap<>(SectionType.class);
    private final Map<SectionType, SectionMetadata> sections = new EnumMap<>(SectionType.class);

    public ClinicalDocument(Element root, Patient patient, List<Encounter> encounters) {
        this.root = root;
        this.patient = patient;
        this.encounters = new ArrayList<>(encounters);
    }

    public void addSection(SectionType type, SectionMetadata metadata, List<Element> sectionEntries) {
        sections.put(type, metadata);
        entries.put(type, new ArrayList<>(sectionEntries));
    }

    /**
     * Included entries found at the section's default path; empty when the
     * section is absent.
     */
    public List<Element> entries(SectionType type) {
        return Collections.unmodifiableList(entries.getOrDefault(type, List.of()));
    }

    public Optional<SectionMetadata> metadata(SectionType type) {
        return Optional.ofNullable(sections.get(type));
    }

    /**
     * Whether entries of the named section are required; true when the
     * section was not recognized.
     */
    public boolean entriesRequired(String sectionName) {
        return SectionType.fromSectionName(sectionName)
                .flatMap(this::metadata)
                .map(SectionMetadata::isEntriesRequired)
                .orElse(true);
    }
}
