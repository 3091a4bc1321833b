package com.scorebook.gamestate.cache;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scorebook.common.state.InGameState;

/**
 * What an observer of {@link GameStateCache} sees: either still loading, or a derived
 * state. {@code state} is {@code null} while loading.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GameStateView(
    @JsonProperty("status") Status status,
    @JsonProperty("state") InGameState state
) {

    public enum Status { LOADING, DATA }

    private static final GameStateView LOADING = new GameStateView(Status.LOADING, null);

    public static GameStateView loading() {
        return LOADING;
    }

    public static GameStateView data(InGameState state) {
        return new GameStateView(Status.DATA, state);
    }

    public boolean isData() {
        return status == Status.DATA;
    }
}
