package com.binday.scraper;

import java.util.List;

/**
 * Result of classifying a collection label: the waste group(s) it covers and its storage column key.
 * An unrecognized label has no groups and a null key.
 */
public record WasteClassification(List<String> wasteGroups, StorageColumnKey storageKey) {
    public static final WasteClassification NONE = new WasteClassification(List.of(), null);

    public WasteClassification {
        wasteGroups = wasteGroups == null ? List.of() : List.copyOf(wasteGroups);
    }

    public boolean isRecognized() {
        return !wasteGroups.isEmpty();
    }
}
