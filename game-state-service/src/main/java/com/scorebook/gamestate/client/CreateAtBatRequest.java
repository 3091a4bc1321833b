package com.scorebook.gamestate.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scorebook.common.model.HitLocation;

/** Body of {@code POST /games/{gameId}/atbats}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateAtBatRequest(
    @JsonProperty("playerId") String playerId,
    @JsonProperty("result") String result,
    @JsonProperty("inning") int inning,
    @JsonProperty("outs") int outs,
    @JsonProperty("battingOrder") Integer battingOrder,
    @JsonProperty("hitLocation") HitLocation hitLocation,
    @JsonProperty("hitType") String hitType,
    @JsonProperty("rbis") Integer rbis
) {}
