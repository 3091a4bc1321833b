package com.scorebook.gamestate.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Versioned, TTL'd JSON cache over a {@link KeyValueStore}.
 *
 * <p>Every value is wrapped in a {@link CacheEntry}. A read is a miss, and the key is
 * evicted, when:
 * <ul>
 *   <li>the stored text is not a decodable entry,</li>
 *   <li>the entry's version differs from the running schema version,</li>
 *   <li>the entry is older than its TTL (unless the caller skips the TTL check),</li>
 *   <li>the payload is missing or does not decode to the requested type.</li>
 * </ul>
 * Corruption is never surfaced to the caller; it just falls back to a normal fetch.
 *
 * <p>One schema version governs every key. {@link #checkSchemaVersion()} runs at startup
 * and wipes the store when the stored marker differs. There is no cross-key
 * transactionality.
 */
@Component
public class PersistentCacheStore {

    private static final Logger log = LoggerFactory.getLogger(PersistentCacheStore.class);

    static final String VERSION_KEY = "cache_version";

    public static final Duration DEFAULT_TTL = Duration.ofHours(24);

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int schemaVersion;
    private final Duration defaultTtl;

    public PersistentCacheStore(KeyValueStore store, ObjectMapper objectMapper, Clock clock,
                                @Value("${scorebook.cache.schema-version:2}") int schemaVersion,
                                @Value("${scorebook.cache.default-ttl:PT24H}") Duration defaultTtl) {
        this.store         = store;
        this.objectMapper  = objectMapper;
        this.clock         = clock;
        this.schemaVersion = schemaVersion;
        this.defaultTtl    = defaultTtl != null ? defaultTtl : DEFAULT_TTL;
    }

    /**
     * Clears the whole store if the persisted version marker differs from the running
     * schema version, then writes the current marker.
     */
    public Mono<Void> checkSchemaVersion() {
        return store.get(VERSION_KEY)
            .map(String::trim)
            .defaultIfEmpty("")
            .flatMap(stored -> {
                if (stored.equals(Integer.toString(schemaVersion))) {
                    log.debug("CACHE_VERSION_OK version={}", schemaVersion);
                    return Mono.empty();
                }
                log.info("CACHE_VERSION_MISMATCH stored={} current={}, purging local cache",
                         stored.isEmpty() ? "none" : stored, schemaVersion);
                return clearAll();
            });
    }

    // ── writes ─────────────────────────────────────────────────────────────

    public Mono<Void> setJson(String key, Object value) {
        return setJson(key, value, null);
    }

    /**
     * Wraps {@code value} in a {@link CacheEntry} stamped with the current schema version
     * and time, and writes it under {@code key}.
     *
     * @param ttl time-to-live; {@code null} uses the configured default (24 h unless overridden)
     */
    public Mono<Void> setJson(String key, Object value, Duration ttl) {
        return Mono.fromCallable(() -> encode(value, ttl != null ? ttl : defaultTtl))
            .flatMap(encoded -> store.put(key, encoded))
            .doOnSuccess(v -> log.debug("CACHE_WRITE key={}", key));
    }

    // ── reads ──────────────────────────────────────────────────────────────

    public <T> Mono<T> getJson(String key, Class<T> type) {
        return getJson(key, objectMapper.constructType(type), true);
    }

    public <T> Mono<T> getJson(String key, TypeReference<T> type) {
        return getJson(key, objectMapper.constructType(type), true);
    }

    /**
     * Reads and decodes the value under {@code key}; empty on any kind of miss.
     *
     * @param checkTtl {@code false} returns entries past their TTL (still version-checked)
     */
    public <T> Mono<T> getJson(String key, JavaType type, boolean checkTtl) {
        return store.get(key)
            .flatMap(raw -> this.<T>decode(key, raw, type, checkTtl));
    }

    private <T> Mono<T> decode(String key, String raw, JavaType type, boolean checkTtl) {
        CacheEntry entry;
        try {
            entry = objectMapper.readValue(raw, CacheEntry.class);
        } catch (JsonProcessingException e) {
            return evict(key, "undecodable");
        }
        if (entry == null) {
            return evict(key, "undecodable");
        }
        if (entry.timestamp() == null) {
            return evict(key, "missing-timestamp");
        }
        if (entry.version() != schemaVersion) {
            return evict(key, "version=" + entry.version());
        }
        if (checkTtl && entry.isExpired(clock.instant())) {
            return evict(key, "expired");
        }
        if (entry.data() == null || entry.data().isNull()) {
            return evict(key, "missing-data");
        }
        T data;
        try {
            data = objectMapper.convertValue(entry.data(), type);
        } catch (IllegalArgumentException e) {
            return evict(key, "payload-undecodable");
        }
        if (data == null) {
            return evict(key, "payload-undecodable");
        }
        return Mono.just(data);
    }

    // ── eviction ───────────────────────────────────────────────────────────

    public Mono<Void> remove(String key) {
        return store.remove(key);
    }

    /** Same as {@link #remove(String)}; kept for call sites that read as manual eviction. */
    public Mono<Void> clear(String key) {
        return remove(key);
    }

    /** Wipes every key, e.g. on sign-out, and rewrites the schema version marker. */
    public Mono<Void> clearAll() {
        return store.clear()
            .then(store.put(VERSION_KEY, Integer.toString(schemaVersion)))
            .doOnSuccess(v -> log.info("CACHE_CLEARED version={}", schemaVersion));
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private String encode(Object value, Duration ttl) throws JsonProcessingException {
        Instant now = clock.instant();
        CacheEntry entry = new CacheEntry(schemaVersion, now, ttl.toSeconds(), objectMapper.valueToTree(value));
        return objectMapper.writeValueAsString(entry);
    }

    private <T> Mono<T> evict(String key, String reason) {
        log.debug("CACHE_EVICT key={} reason={}", key, reason);
        return store.remove(key).then(Mono.empty());
    }
}
