package com.al.ccda2omop.service.mapper;

import com.al.ccda2omop.model.omop.OmopRow;

/**
 * A converted row, or the required column that prevented conversion.
 */
public final class RowResult {

    private final OmopRow row;
    private final String missingColumn;

    private RowResult(OmopRow row, String missingColumn) {
        this.row = row;
        this.missingColumn = missingColumn;
    }

    public static RowResult of(OmopRow row) {
        return new RowResult(row, null);
    }

    public static RowResult missing(String column) {
        return new RowResult(null, column);
    }

    public boolean isPresent() {
        return row != null;
    }

    public OmopRow getRow() {
        return row;
    }

    public String getMissingColumn() {
        return missingColumn;
    }
}
