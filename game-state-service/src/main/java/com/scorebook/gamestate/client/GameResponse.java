package com.scorebook.gamestate.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scorebook.common.model.LineupSlot;

import java.util.List;

/** The subset of {@code GET /games/{gameId}} the engine needs. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GameResponse(
    @JsonProperty("gameId") String gameId,
    @JsonProperty("teamId") String teamId,
    @JsonProperty("status") String status,
    @JsonProperty("lineup") List<LineupSlot> lineup
) {}
