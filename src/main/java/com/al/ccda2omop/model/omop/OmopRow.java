package com.al.ccda2omop.model.omop;

import java.util.List;

/**
 * A row of one OMOP CDM table.
 */
public interface OmopRow {

    OmopTable table();

    /**
     * Column values in {@link OmopTable#columns()} order; absent values are null.
     */
    List<Object> values();

    String getMappingRule();

    String getSourceFile();

    void setSourceFile(String sourceFile);
}
