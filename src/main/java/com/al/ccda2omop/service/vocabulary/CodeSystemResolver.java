package com.al.ccda2omop.service.vocabulary;

import java.util.Map;

/**
 * Maps C-CDA code system OIDs and code system names to OMOP vocabulary ids.
 *
 * <p>
 * The table is closed: anything not listed resolves to an empty string.
 * Matching is exact and case-sensitive.
 */
public final class CodeSystemResolver {

    public static final String SNOMED = "SNOMED";
    public static final String UCUM = "UCUM";

    private static final Map<String, String> CODE_SYSTEMS = Map.ofEntries(
            // OIDs
            Map.entry("2.16.840.1.113883.6.96", SNOMED),
            Map.entry("2.16.840.1.113883.6.88", "RxNorm"),
            Map.entry("2.16.840.1.113883.6.1", "LOINC"),
            Map.entry("2.16.840.1.113883.6.90", "ICD10CM"),
            Map.entry("2.16.840.1.113883.6.103", "ICD9CM"),
            Map.entry("2.16.840.1.113883.6.12", "CPT4"),
            Map.entry("2.16.840.1.113883.6.14", "HCPCS"),
            Map.entry("2.16.840.1.113883.6.13", "HCPCS"),
            Map.entry("2.16.840.1.113883.12.292", "CVX"),
            Map.entry("2.16.840.1.113883.6.59", "CVX"),
            Map.entry("2.16.840.1.113883.6.69", "NDC"),
            Map.entry("2.16.840.1.113883.4.9", "UNII"),
            Map.entry("2.16.840.1.113883.3.26.1.5", "NDFRT"),
            Map.entry("2.16.840.1.113883.3.26.1.1", "NCI"),
            Map.entry("2.16.840.1.113883.5.4", "ActCode"),
            Map.entry("2.16.840.1.113883.5.112", "RouteOfAdministration"),
            // names and aliases
            Map.entry("SNOMED", SNOMED),
            Map.entry("SNOMED CT", SNOMED),
            Map.entry("SNOMEDCT", SNOMED),
            Map.entry("RxNorm", "RxNorm"),
            Map.entry("LOINC", "LOINC"),
            Map.entry("ICD10CM", "ICD10CM"),
            Map.entry("ICD-10-CM", "ICD10CM"),
            Map.entry("ICD10", "ICD10CM"),
            Map.entry("ICD9CM", "ICD9CM"),
            Map.entry("ICD-9-CM", "ICD9CM"),
            Map.entry("ICD9", "ICD9CM"),
            Map.entry("CPT4", "CPT4"),
            Map.entry("CPT", "CPT4"),
            Map.entry("CPT-4", "CPT4"),
            Map.entry("HCPCS", "HCPCS"),
            Map.entry("CVX", "CVX"),
            Map.entry("NDC", "NDC"),
            Map.entry("UNII", "UNII"),
            Map.entry("NDFRT", "NDFRT"),
            Map.entry("NDF-RT", "NDFRT"),
            Map.entry("NCI", "NCI"),
            Map.entry("NCIt", "NCI"),
            Map.entry("ActCode", "ActCode"),
            Map.entry("ASSERTION", "ActCode"),
            Map.entry("RouteOfAdministration", "RouteOfAdministration"));

    private CodeSystemResolver() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * @param codeSystem OID or code system name from the document
     * @return OMOP vocabulary id, or "" when unrecognized
     */
    public static String toVocabularyId(String codeSystem) {
        if (codeSystem == null) {
            return "";
        }
        return CODE_SYSTEMS.getOrDefault(codeSystem, "");
    }
}
