package com.scorebook.gamestate.cache;

import java.util.Objects;

/** Identifies one cached game state: a game as seen by one team. */
public record GameStateKey(String gameId, String teamId) {

    public GameStateKey {
        Objects.requireNonNull(gameId, "gameId");
        Objects.requireNonNull(teamId, "teamId");
    }
}
