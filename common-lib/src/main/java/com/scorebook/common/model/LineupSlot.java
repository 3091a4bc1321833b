package com.scorebook.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of a game lineup: a player and the batting-order slot they occupy.
 * Batting orders are unique positive integers within a single game.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LineupSlot(
    @JsonProperty("playerId") String playerId,
    @JsonProperty("battingOrder") int battingOrder
) {
    public static LineupSlot of(String playerId, int battingOrder) {
        return new LineupSlot(playerId, battingOrder);
    }
}
