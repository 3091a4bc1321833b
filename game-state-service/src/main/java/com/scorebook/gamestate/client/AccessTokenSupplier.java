package com.scorebook.gamestate.client;

import reactor.core.publisher.Mono;

/**
 * Supplies the bearer token for backend calls. Sign-in and renewal live outside this
 * engine; a 401 is reported to the caller like any other failure.
 */
@FunctionalInterface
public interface AccessTokenSupplier {

    Mono<String> token();
}
