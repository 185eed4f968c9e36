package com.binday.scraper;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Bin types that have their own pair of timestamp columns in the collections table.
 */
public enum StorageColumnKey {
    BLACK_RUBBISH_140L("black_rubbish_140l"),
    BLUE_CARDBOARD_BAG("blue_cardboard_bag"),
    BLACK_FOOD_WASTE("black_food_waste"),
    GREEN_GARDEN_BIN("green_garden_bin"),
    GREEN_RECYCLING_BOX("green_recycling_box");

    private final String columnPrefix;

    StorageColumnKey(String columnPrefix) {
        this.columnPrefix = columnPrefix;
    }

    @JsonValue
    public String columnPrefix() {
        return columnPrefix;
    }

    public String lastCollectionColumn() {
        return columnPrefix + "_last_collection";
    }

    public String nextCollectionColumn() {
        return columnPrefix + "_next_collection";
    }
}
