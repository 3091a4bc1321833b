package com.scorebook.gamestate.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Envelope written around every cached value.
 *
 * <p>{@code ttl} is in seconds. An entry is stale once {@code now - timestamp > ttl}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CacheEntry(
    @JsonProperty("version") int version,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("ttl") long ttl,
    @JsonProperty("data") JsonNode data
) {

    public boolean isExpired(Instant now) {
        return now.isAfter(timestamp.plusSeconds(ttl));
    }
}
