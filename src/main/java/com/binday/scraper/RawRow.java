package com.binday.scraper;

import java.util.List;

/**
 * One body row of the results table as found in the markup.
 * @param rowHeaderText text of the row's {@code <th>}, line breaks rendered as {@link LabelSplitter#SEPARATOR}; null when the row has none
 * @param cellValues trimmed text of each {@code <td>} in document order
 */
public record RawRow(String rowHeaderText, List<String> cellValues) {
    public RawRow {
        cellValues = cellValues == null ? List.of() : List.copyOf(cellValues);
    }

    /**
     * Returns the cell at the index, or null when the index is absent or out of range.
     */
    public String cell(Integer index) {
        if (index == null || index < 0 || index >= cellValues.size()) return null;
        return cellValues.get(index);
    }
}
