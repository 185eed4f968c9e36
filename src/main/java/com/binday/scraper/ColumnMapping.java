package com.binday.scraper;

/**
 * Positions of the next-collection, last-collection and collection-type columns, derived from the
 * table header. Indices address a row's {@code <td>} cells only; a row-header {@code <th>} is not counted.
 * Any index may be null when no header matched.
 */
public record ColumnMapping(Integer nextIndex, Integer lastIndex, Integer typeIndex) {
    public static final ColumnMapping NONE = new ColumnMapping(null, null, null);

    /**
     * Moves every index left by {@code offset}; indices that would go negative become null.
     */
    public ColumnMapping shift(int offset) {
        return new ColumnMapping(shift(nextIndex, offset), shift(lastIndex, offset), shift(typeIndex, offset));
    }

    private static Integer shift(Integer index, int offset) {
        if (index == null) return null;
        int shifted = index - offset;
        return shifted < 0 ? null : shifted;
    }
}
