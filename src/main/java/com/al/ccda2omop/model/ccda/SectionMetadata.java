package com.al.ccda2omop.model.ccda;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Template OID a section was recognized by, and whether that template
 * requires coded entries.
 */
@Data
@AllArgsConstructor
public class SectionMetadata {
    private String templateOid;
    private boolean entriesRequired;
}
