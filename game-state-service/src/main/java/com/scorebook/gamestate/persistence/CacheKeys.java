package com.scorebook.gamestate.persistence;

/** Key names used in the local cache. */
public final class CacheKeys {

    private CacheKeys() {}

    public static String atBats(String gameId) {
        return "atbats_cache_" + gameId;
    }

    public static String game(String gameId) {
        return "game_" + gameId;
    }
}
