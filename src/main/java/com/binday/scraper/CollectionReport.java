package com.binday.scraper;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.List;

/**
 * Diagnostic JSON view of one scrape: the household and its assembled records.
 *
 * @author Bin Collection Scraper Team
 * @since 1.0
 */
@JsonPropertyOrder({"address", "postcode", "timezone", "collections"})
public record CollectionReport(
    String address,
    String postcode,
    String timezone,
    List<CollectionRecord> collections
) {
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public CollectionReport {
        collections = collections == null ? List.of() : List.copyOf(collections);
    }

    /**
     * Renders the report as pretty-printed JSON.
     * @throws JsonProcessingException if serialization fails
     */
    public String toJson() throws JsonProcessingException {
        return MAPPER.writeValueAsString(this);
    }
}
