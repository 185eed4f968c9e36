package com.binday.scraper;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a composite row header ("Black Rubbish Bin | Blue Cardboard Bag") into individual labels.
 */
public class LabelSplitter {
    /** Token the table extractor puts where a row header had a line break. */
    public static final String SEPARATOR = " | ";

    /**
     * @param rowHeaderText header text, possibly composite (may be null)
     * @return trimmed non-empty labels in their original order; empty when the text is blank
     */
    public List<String> split(String rowHeaderText) {
        List<String> labels = new ArrayList<>();
        if (rowHeaderText == null || rowHeaderText.isBlank()) {
            return labels;
        }
        String normalized = normalizeWhitespace(rowHeaderText);
        if (!normalized.contains(SEPARATOR)) {
            labels.add(normalized);
            return labels;
        }
        for (String part : normalized.split(" \\| ")) {
            String label = part.trim();
            if (!label.isEmpty()) labels.add(label);
        }
        return labels;
    }

    /**
     * Collapses runs of whitespace (non-breaking spaces included) to a single space and trims.
     */
    public static String normalizeWhitespace(String s) {
        return s == null ? "" : s.replaceAll("[\\s\\u00A0]+", " ").trim();
    }
}
