package com.binday.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static com.binday.scraper.WasteRule.allOf;
import static com.binday.scraper.WasteRule.anyOf;

/**
 * Maps free-text collection labels to waste groups and storage column keys.
 * <p>
 * Rules are matched case-insensitively on substrings and evaluated top to bottom; the first match wins.
 * Keep the order when adding rules: a new rule may overlap an existing one.
 *
 * @author Bin Collection Scraper Team
 * @since 1.0
 */
public final class WasteClassifier {
    private static final Logger logger = LoggerFactory.getLogger(WasteClassifier.class);

    private static final List<WasteRule> RULES = List.of(
        new WasteRule("black rubbish", allOf("black", "rubbish"),
            List.of("General Rubbish (black bin)"), StorageColumnKey.BLACK_RUBBISH_140L),
        new WasteRule("blue cardboard", label -> label.contains("blue") && anyOf("cardboard", "bag").test(label),
            List.of("Cardboard (blue bag/box)"), StorageColumnKey.BLUE_CARDBOARD_BAG),
        new WasteRule("food caddy", anyOf("food", "caddy"),
            List.of("Food Waste (caddy)"), StorageColumnKey.BLACK_FOOD_WASTE),
        new WasteRule("green recycling", allOf("green", "recycling"),
            List.of("Plastics & Metals (green box)", "Glass & Paper (green box)"), StorageColumnKey.GREEN_RECYCLING_BOX),
        new WasteRule("garden waste", allOf("garden", "waste"),
            List.of("Garden Waste (garden bin subscription)"), StorageColumnKey.GREEN_GARDEN_BIN)
    );

    /**
     * Returns the ordered rule table.
     */
    public static List<WasteRule> getRules() {
        return RULES;
    }

    /**
     * Classifies a collection label.
     * @param label collection type text (may be null)
     * @return the first matching rule's classification, or {@link WasteClassification#NONE}
     */
    public WasteClassification classify(String label) {
        if (label == null || label.isBlank()) {
            return WasteClassification.NONE;
        }
        for (WasteRule rule : RULES) {
            if (rule.matches(label)) {
                logger.debug("Classified '{}' as {}", label, rule.name);
                return rule.classification();
            }
        }
        logger.debug("No waste rule matched '{}'", label);
        return WasteClassification.NONE;
    }
}
