package com.scorebook.gamestate.controller;

import com.scorebook.common.exception.ValidationException;
import com.scorebook.gamestate.atbat.AtBatCollectionService;
import com.scorebook.gamestate.atbat.AtBatPatch;
import com.scorebook.gamestate.atbat.RecordAtBatCommand;
import com.scorebook.gamestate.cache.GameStateCache;
import com.scorebook.gamestate.cache.GameStateKey;
import com.scorebook.gamestate.cache.GameStateView;
import com.scorebook.gamestate.mutation.LoggingUserNotifier;
import com.scorebook.gamestate.mutation.MutationResult;
import com.scorebook.gamestate.persistence.PersistentCacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Locale;
import java.util.Map;

/**
 * HTTP surface of the game-state engine.
 *
 * <ul>
 *   <li>{@code GET  /games/{gameId}/state?teamId=} SSE stream of {@link GameStateView}</li>
 *   <li>{@code POST /games/{gameId}/atbats?teamId=} record an at-bat</li>
 *   <li>{@code PUT  /games/{gameId}/atbats/{atBatId}?teamId=} edit an at-bat</li>
 *   <li>{@code DELETE /games/{gameId}/atbats/{atBatId}?teamId=}</li>
 *   <li>{@code GET  /games/{gameId}/atbats/last}</li>
 *   <li>{@code GET  /notices} SSE stream of success / error notices</li>
 *   <li>{@code POST /cache/clear} sign-out: drop every in-memory and persisted copy</li>
 * </ul>
 *
 * Mutation outcomes map to 200/201 on success, 502 when the backend call failed and was
 * rolled back, 409 when the game was not loaded.
 */
@RestController
@RequestMapping("/api/v1")
public class GameStateController {

    private static final Logger log = LoggerFactory.getLogger(GameStateController.class);

    private final GameStateCache gameStateCache;
    private final AtBatCollectionService atBats;
    private final PersistentCacheStore cacheStore;
    private final LoggingUserNotifier notifier;

    public GameStateController(GameStateCache gameStateCache, AtBatCollectionService atBats,
                               PersistentCacheStore cacheStore, LoggingUserNotifier notifier) {
        this.gameStateCache = gameStateCache;
        this.atBats         = atBats;
        this.cacheStore     = cacheStore;
        this.notifier       = notifier;
    }

    @GetMapping(value = "/games/{gameId}/state", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<GameStateView>> state(@PathVariable String gameId,
                                                      @RequestParam String teamId) {
        log.info("[GameStateAPI] State stream opened. gameId={} teamId={}", gameId, teamId);
        return gameStateCache.observe(new GameStateKey(gameId, teamId))
            .map(view -> ServerSentEvent.<GameStateView>builder()
                .event("state")
                .data(view)
                .build());
    }

    @PostMapping("/games/{gameId}/atbats")
    public Mono<ResponseEntity<Object>> recordAtBat(@PathVariable String gameId,
                                                    @RequestParam String teamId,
                                                    @RequestBody RecordAtBatCommand command) {
        log.info("[GameStateAPI] record. gameId={} playerId={} result={}",
                 gameId, command.playerId(), command.result());
        return gameStateCache.recordAtBat(new GameStateKey(gameId, teamId), command)
            .map(result -> toResponse(result, HttpStatus.CREATED));
    }

    @PutMapping("/games/{gameId}/atbats/{atBatId}")
    public Mono<ResponseEntity<Object>> updateAtBat(@PathVariable String gameId,
                                                    @PathVariable String atBatId,
                                                    @RequestParam String teamId,
                                                    @RequestBody AtBatPatch patch) {
        log.info("[GameStateAPI] update. gameId={} atBatId={}", gameId, atBatId);
        return gameStateCache.updateAtBat(new GameStateKey(gameId, teamId), atBatId, patch)
            .map(result -> toResponse(result, HttpStatus.OK));
    }

    @DeleteMapping("/games/{gameId}/atbats/{atBatId}")
    public Mono<ResponseEntity<Object>> deleteAtBat(@PathVariable String gameId,
                                                    @PathVariable String atBatId,
                                                    @RequestParam String teamId) {
        log.info("[GameStateAPI] delete. gameId={} atBatId={}", gameId, atBatId);
        return gameStateCache.deleteAtBat(new GameStateKey(gameId, teamId), atBatId)
            .map(result -> toResponse(result, HttpStatus.OK));
    }

    @GetMapping("/games/{gameId}/atbats/last")
    public ResponseEntity<Object> lastAtBat(@PathVariable String gameId) {
        return gameStateCache.getLastAtBat(gameId)
            .<ResponseEntity<Object>>map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping(value = "/notices", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<LoggingUserNotifier.Notice>> notices() {
        return notifier.notices()
            .map(n -> ServerSentEvent.<LoggingUserNotifier.Notice>builder()
                .event(n.level().name().toLowerCase(Locale.ROOT))
                .data(n)
                .build());
    }

    @PostMapping("/cache/clear")
    public Mono<ResponseEntity<String>> clearCache() {
        log.info("[GameStateAPI] cache clear requested");
        return gameStateCache.releaseAll()
            .then(Mono.fromRunnable(atBats::evictAll))
            .then(cacheStore.clearAll())
            .then(Mono.just(ResponseEntity.ok("Local cache cleared")));
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> onValidation(ValidationException e) {
        log.warn("[GameStateAPI] Rejected. field={} err={}", e.getField(), e.getMessage());
        return ResponseEntity.unprocessableEntity()
            .body(Map.of("error", e.getMessage(), "field", e.getField()));
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static ResponseEntity<Object> toResponse(MutationResult<?> result, HttpStatus okStatus) {
        return switch (result.status()) {
            case SUCCEEDED -> ResponseEntity.status(okStatus).body(result.value());
            case SKIPPED   -> ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", result.message()));
            case FAILED    -> ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(Map.of("error", result.message()));
        };
    }
}
