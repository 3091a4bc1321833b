package com.scorebook.gamestate.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scorebook.common.model.HitLocation;

/** Body of {@code PUT /games/{gameId}/atbats/{atBatId}}. Absent fields are left unchanged. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UpdateAtBatRequest(
    @JsonProperty("result") String result,
    @JsonProperty("hitLocation") HitLocation hitLocation,
    @JsonProperty("hitType") String hitType,
    @JsonProperty("rbis") Integer rbis
) {}
