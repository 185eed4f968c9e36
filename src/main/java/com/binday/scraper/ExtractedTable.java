package com.binday.scraper;

import java.util.List;

/**
 * Column mapping and body rows pulled from a results page.
 */
public record ExtractedTable(ColumnMapping columnMapping, List<RawRow> rows) {
    public static final ExtractedTable EMPTY = new ExtractedTable(ColumnMapping.NONE, List.of());

    public ExtractedTable {
        columnMapping = columnMapping == null ? ColumnMapping.NONE : columnMapping;
        rows = rows == null ? List.of() : List.copyOf(rows);
    }
}
