package com.scorebook.gamestate.persistence;

import reactor.core.publisher.Mono;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link KeyValueStore}. Used when no cache directory is configured and
 * in tests. Contents do not survive a restart.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final ConcurrentHashMap<String, String> store = new ConcurrentHashMap<>();

    @Override
    public Mono<String> get(String key) {
        return Mono.fromCallable(() -> store.get(key));
    }

    @Override
    public Mono<Void> put(String key, String value) {
        return Mono.fromRunnable(() -> store.put(key, value));
    }

    @Override
    public Mono<Void> remove(String key) {
        return Mono.fromRunnable(() -> store.remove(key));
    }

    @Override
    public Mono<Void> clear() {
        return Mono.fromRunnable(store::clear);
    }

    public int size() {
        return store.size();
    }
}
