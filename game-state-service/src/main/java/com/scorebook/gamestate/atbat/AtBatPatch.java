package com.scorebook.gamestate.atbat;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scorebook.common.model.HitLocation;

/** Scoring fields to change on an existing at-bat; {@code null} leaves a field as is. */
public record AtBatPatch(
    @JsonProperty("result") String result,
    @JsonProperty("hitLocation") HitLocation hitLocation,
    @JsonProperty("hitType") String hitType,
    @JsonProperty("rbis") Integer rbis
) {}
