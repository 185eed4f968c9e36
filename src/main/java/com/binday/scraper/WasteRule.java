package com.binday.scraper;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * One row of the waste classification table: a predicate over the lower-cased collection label and
 * the classification it yields when the predicate matches.
 */
public final class WasteRule {
    public final String name;
    public final Predicate<String> condition;
    public final List<String> wasteGroups;
    public final StorageColumnKey storageKey;

    public WasteRule(String name, Predicate<String> condition, List<String> wasteGroups, StorageColumnKey storageKey) {
        this.name = name;
        this.condition = condition;
        this.wasteGroups = List.copyOf(wasteGroups);
        this.storageKey = storageKey;
    }

    /**
     * Predicate that holds when the label contains every given word.
     */
    public static Predicate<String> allOf(String... words) {
        return label -> {
            for (String w : words) {
                if (!label.contains(w)) return false;
            }
            return true;
        };
    }

    /**
     * Predicate that holds when the label contains at least one of the given words.
     */
    public static Predicate<String> anyOf(String... words) {
        return label -> {
            for (String w : words) {
                if (label.contains(w)) return true;
            }
            return false;
        };
    }

    public boolean matches(String label) {
        return label != null && condition.test(label.toLowerCase(Locale.ROOT));
    }

    public WasteClassification classification() {
        return new WasteClassification(wasteGroups, storageKey);
    }
}
