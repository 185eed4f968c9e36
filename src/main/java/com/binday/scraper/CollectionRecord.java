package com.binday.scraper;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Immutable record representing one bin type's collection schedule for a household.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Built by {@link RecordAssembler} from one results-table row; a composite row yields one record per bin type.</li>
 *   <li>{@code wasteGroups} and {@code storageKey} come from {@link WasteClassifier}; both are null for unrecognized bin types.</li>
 *   <li>{@code nextCollection} / {@code lastCollection} keep the page's raw date text.</li>
 *   <li>The delta fields are present only when the corresponding date parsed.</li>
 * </ul>
 * Records without a storage key are still reported but never persisted.
 * <p>
 * JSON rendering omits null fields and writes a single waste group as a plain string.
 *
 * @author Bin Collection Scraper Team
 * @since 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"collection_type", "waste_group", "storage_key", "next_collection", "last_collection",
    "days_until_next", "minutes_until_next", "time_until_next_text", "days_since_last", "minutes_since_last"})
public record CollectionRecord(
    @JsonProperty("collection_type") String collectionType,
    @JsonProperty("waste_group") @JsonFormat(with = JsonFormat.Feature.WRITE_SINGLE_ELEM_ARRAYS_UNWRAPPED) List<String> wasteGroups,
    @JsonProperty("storage_key") StorageColumnKey storageKey,
    @JsonProperty("next_collection") String nextCollection,
    @JsonProperty("last_collection") String lastCollection,
    @JsonProperty("days_until_next") Long daysUntilNext,
    @JsonProperty("minutes_until_next") Long minutesUntilNext,
    @JsonProperty("time_until_next_text") String timeUntilNextText,
    @JsonProperty("days_since_last") Long daysSinceLast,
    @JsonProperty("minutes_since_last") Long minutesSinceLast
) {
    public CollectionRecord {
        if (collectionType == null || collectionType.isBlank()) {
            throw new IllegalArgumentException("collectionType must not be blank");
        }
        wasteGroups = wasteGroups == null || wasteGroups.isEmpty() ? null : List.copyOf(wasteGroups);
    }

    /**
     * Builds a record from its label, classification, raw dates and computed deltas.
     */
    public static CollectionRecord of(String collectionType, WasteClassification classification,
                                      String nextCollection, String lastCollection, TimeDelta delta) {
        WasteClassification c = classification == null ? WasteClassification.NONE : classification;
        TimeDelta d = delta == null ? TimeDelta.EMPTY : delta;
        return new CollectionRecord(
            collectionType,
            c.wasteGroups(),
            c.storageKey(),
            nextCollection,
            lastCollection,
            d.daysUntilNext(),
            d.minutesUntilNext(),
            d.timeUntilNextText(),
            d.daysSinceLast(),
            d.minutesSinceLast()
        );
    }

    /**
     * True when this bin type has columns in the collections table.
     */
    @JsonIgnore
    public boolean isPersistable() {
        return storageKey != null;
    }
}
