package com.scorebook.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where a batted ball landed, as normalized field coordinates.
 * Both axes run from 0.0 to 1.0 with home plate at the bottom centre.
 */
public record HitLocation(
    @JsonProperty("x") double x,
    @JsonProperty("y") double y
) {}
