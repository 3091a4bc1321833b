package com.scorebook.gamestate.client;

import com.scorebook.common.model.AtBatEvent;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * The scorebook REST backend, as seen by the game-state engine.
 *
 * <p>Non-2xx responses surface as {@link com.scorebook.common.exception.ApiException}.
 * Live implementation: {@link ScorebookApiClient}.
 */
public interface ScorebookBackend {

    Mono<List<AtBatEvent>> listAtBats(String gameId);

    Mono<AtBatEvent> createAtBat(String gameId, CreateAtBatRequest request);

    Mono<AtBatEvent> updateAtBat(String gameId, String atBatId, UpdateAtBatRequest request);

    Mono<Void> deleteAtBat(String gameId, String atBatId);

    Mono<GameResponse> getGame(String gameId);
}
