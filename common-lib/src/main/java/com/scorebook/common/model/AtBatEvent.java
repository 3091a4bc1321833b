package com.scorebook.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One completed plate appearance, as recorded by the backend's at-bat collection.
 *
 * <p>Events are append-only. An update replaces the scoring fields but keeps
 * {@link #atBatId()} and {@link #createdAt()}, so the event keeps its place in the
 * replay order.
 *
 * <p>{@code inning} and {@code outs} are the values the scorer saw when the at-bat was
 * recorded. They are informational only: the authoritative game state is always
 * re-derived from the ordered log by {@code GameStateReducer}.
 *
 * <p>{@code sequence} is assigned on the client when an event is recorded locally and is
 * used only to order events whose {@code createdAt} values collide. Events fetched from
 * the backend without a local origin carry {@code null}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AtBatEvent(
    @JsonProperty("atBatId") String atBatId,
    @JsonProperty("gameId") String gameId,
    @JsonProperty("teamId") String teamId,
    @JsonProperty("playerId") String playerId,
    @JsonProperty("result") String result,
    @JsonProperty("inning") int inning,
    @JsonProperty("outs") int outs,
    @JsonProperty("battingOrder") Integer battingOrder,
    @JsonProperty("hitLocation") HitLocation hitLocation,
    @JsonProperty("hitType") String hitType,
    @JsonProperty("rbis") Integer rbis,
    @JsonProperty("createdAt") Instant createdAt,
    @JsonProperty("updatedAt") Instant updatedAt,
    @JsonProperty("sequence") Long sequence
) {

    public AtBatEvent withSequence(Long sequence) {
        return new AtBatEvent(atBatId, gameId, teamId, playerId, result, inning, outs,
            battingOrder, hitLocation, hitType, rbis, createdAt, updatedAt, sequence);
    }

    /**
     * Returns a copy with the given scoring fields replaced. {@code null} arguments keep
     * the current value. Identity, creation time and sequence are always preserved.
     */
    public AtBatEvent withChanges(String result, HitLocation hitLocation, String hitType,
                                  Integer rbis, Instant updatedAt) {
        return new AtBatEvent(
            atBatId, gameId, teamId, playerId,
            result      != null ? result      : this.result,
            inning, outs, battingOrder,
            hitLocation != null ? hitLocation : this.hitLocation,
            hitType     != null ? hitType     : this.hitType,
            rbis        != null ? rbis        : this.rbis,
            createdAt,
            updatedAt   != null ? updatedAt   : this.updatedAt,
            sequence);
    }
}
