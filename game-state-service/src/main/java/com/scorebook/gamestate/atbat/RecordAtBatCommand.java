package com.scorebook.gamestate.atbat;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scorebook.common.model.HitLocation;

/** Input for recording a new at-bat. Inning and outs are filled in from the derived state. */
public record RecordAtBatCommand(
    @JsonProperty("playerId") String playerId,
    @JsonProperty("result") String result,
    @JsonProperty("battingOrder") Integer battingOrder,
    @JsonProperty("hitLocation") HitLocation hitLocation,
    @JsonProperty("hitType") String hitType,
    @JsonProperty("rbis") Integer rbis
) {}
