package com.scorebook.gamestate.lineup;

import com.scorebook.common.exception.ValidationException;
import com.scorebook.common.model.LineupSlot;
import com.scorebook.gamestate.client.GameResponse;
import com.scorebook.gamestate.client.ScorebookBackend;
import com.scorebook.gamestate.persistence.CacheKeys;
import com.scorebook.gamestate.persistence.PersistentCacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Resolves a game's batting lineup, cache-first.
 *
 * <p>The lineup comes from {@code GET /games/{gameId}} and is persisted under
 * {@code game_{gameId}}. A game that belongs to a different team, or whose lineup has not
 * been set, fails with {@link ValidationException}. A persisted game without a lineup is
 * ignored, since the lineup is usually set after the game is created.
 */
@Service
public class LineupService {

    private static final Logger log = LoggerFactory.getLogger(LineupService.class);

    private final ScorebookBackend backend;
    private final PersistentCacheStore cache;

    public LineupService(ScorebookBackend backend, PersistentCacheStore cache) {
        this.backend = backend;
        this.cache   = cache;
    }

    public Mono<List<LineupSlot>> lineup(String gameId, String teamId) {
        String key = CacheKeys.game(gameId);
        return cache.getJson(key, GameResponse.class)
            .filter(LineupService::hasLineup)
            .doOnNext(g -> log.debug("CACHE_HIT key={}", key))
            .switchIfEmpty(Mono.defer(() -> {
                log.debug("CACHE_MISS key={}", key);
                return backend.getGame(gameId)
                    .flatMap(game -> cache.setJson(key, game)
                        .onErrorResume(e -> {
                            log.warn("[Lineup] Persisting game failed. gameId={} err={}", gameId, e.toString());
                            return Mono.empty();
                        })
                        .thenReturn(game));
            }))
            .map(game -> validated(game, gameId, teamId));
    }

    /** Forgets the persisted game so the next lookup goes to the backend. */
    public Mono<Void> invalidate(String gameId) {
        return cache.remove(CacheKeys.game(gameId));
    }

    private static boolean hasLineup(GameResponse game) {
        return game.lineup() != null && !game.lineup().isEmpty();
    }

    private static List<LineupSlot> validated(GameResponse game, String gameId, String teamId) {
        if (teamId != null && game.teamId() != null && !teamId.equals(game.teamId())) {
            throw new ValidationException("teamId",
                "Game " + gameId + " belongs to team " + game.teamId() + ", not " + teamId);
        }
        if (!hasLineup(game)) {
            throw new ValidationException("lineup", "Game lineup not set");
        }
        return game.lineup();
    }
}
