package com.companya.scd.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Contents of a table metadata file, e.g.
 * <pre>
 * { "primary_key": "id", "changing_attributes": ["product_name", "price"], "detect_removed": true }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TableMetadata(
        @JsonProperty("primary_key") String primaryKey,
        @JsonProperty("changing_attributes") List<String> changingAttributes,
        @JsonProperty("detect_removed") Boolean detectRemoved
) {}
