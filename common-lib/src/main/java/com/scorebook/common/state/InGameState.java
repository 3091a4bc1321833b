package com.scorebook.common.state;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Current state of a game in progress: inning, outs and who is up to bat.
 *
 * <p>Derived, never authoritative. Always recomputable from the at-bat log and the
 * lineup, and only {@link GameStateReducer} can construct one.
 */
public final class InGameState {

    private final int inning;
    private final int outs;
    private final int batterIndex;
    private final String batterPlayerId;

    InGameState(int inning, int outs, int batterIndex, String batterPlayerId) {
        this.inning         = inning;
        this.outs           = outs;
        this.batterIndex    = batterIndex;
        this.batterPlayerId = batterPlayerId;
    }

    /** Current inning, 1-based. */
    @JsonProperty("inning")
    public int inning() {
        return inning;
    }

    /** Outs in the current half-inning: 0, 1 or 2. */
    @JsonProperty("outs")
    public int outs() {
        return outs;
    }

    /** Index of the current batter in the lineup sorted by batting order. */
    @JsonProperty("batterIndex")
    public int batterIndex() {
        return batterIndex;
    }

    @JsonProperty("batterPlayerId")
    public String batterPlayerId() {
        return batterPlayerId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InGameState)) return false;
        InGameState that = (InGameState) o;
        return inning == that.inning
            && outs == that.outs
            && batterIndex == that.batterIndex
            && Objects.equals(batterPlayerId, that.batterPlayerId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inning, outs, batterIndex, batterPlayerId);
    }

    @Override
    public String toString() {
        return "InGameState[inning=" + inning + ", outs=" + outs
            + ", batterIndex=" + batterIndex + ", batterPlayerId=" + batterPlayerId + "]";
    }
}
