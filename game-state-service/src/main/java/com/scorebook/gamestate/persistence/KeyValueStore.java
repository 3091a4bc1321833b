package com.scorebook.gamestate.persistence;

import reactor.core.publisher.Mono;

/**
 * Local string key-value storage primitive underneath {@link PersistentCacheStore}.
 *
 * <p>Implementations must be non-blocking from the caller's point of view; any disk
 * I/O happens inside the returned {@code Mono}.
 */
public interface KeyValueStore {

    /** Stored value, or empty when the key is absent. */
    Mono<String> get(String key);

    Mono<Void> put(String key, String value);

    Mono<Void> remove(String key);

    /** Removes every key. */
    Mono<Void> clear();
}
