package com.scorebook.gamestate.atbat;

import com.fasterxml.jackson.core.type.TypeReference;
import com.scorebook.common.exception.ApiException;
import com.scorebook.common.exception.ValidationException;
import com.scorebook.common.model.AtBatEvent;
import com.scorebook.common.state.AtBatOrdering;
import com.scorebook.gamestate.client.CreateAtBatRequest;
import com.scorebook.gamestate.client.ScorebookBackend;
import com.scorebook.gamestate.client.UpdateAtBatRequest;
import com.scorebook.gamestate.collection.PublishedCollection;
import com.scorebook.gamestate.mutation.MutationDescriptor;
import com.scorebook.gamestate.mutation.MutationEngine;
import com.scorebook.gamestate.mutation.MutationResult;
import com.scorebook.gamestate.persistence.CacheKeys;
import com.scorebook.gamestate.persistence.PersistentCacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the published at-bat log of every game the client has opened.
 *
 * <p>Loading is cache-first: a persisted copy is published immediately and then refreshed
 * from the backend in the background. With no usable persisted copy the backend is
 * fetched directly. Concurrent loads of the same game share one fetch.
 *
 * <p>Record / update / delete go through {@link MutationEngine}. A freshly recorded at-bat
 * is shown under a {@code temp-} id until the backend answers; pending events survive a
 * background refresh and are never written to the persistent cache.
 */
@Service
public class AtBatCollectionService {

    private static final Logger log = LoggerFactory.getLogger(AtBatCollectionService.class);

    private static final TypeReference<List<AtBatEvent>> AT_BAT_LIST = new TypeReference<>() {};

    static final String TEMP_ID_PREFIX = "temp-";

    private final ScorebookBackend backend;
    private final PersistentCacheStore cache;
    private final MutationEngine mutationEngine;
    private final Scheduler scheduler;
    private final Clock clock;

    private final ConcurrentHashMap<String, PublishedCollection<List<AtBatEvent>>> collections = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Mono<List<AtBatEvent>>> inFlightLoads = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public AtBatCollectionService(ScorebookBackend backend, PersistentCacheStore cache,
                                  MutationEngine mutationEngine, Scheduler scheduler, Clock clock) {
        this.backend        = backend;
        this.cache          = cache;
        this.mutationEngine = mutationEngine;
        this.scheduler      = scheduler;
        this.clock          = clock;
    }

    /** The published collection for {@code gameId}; created unloaded on first access. */
    public PublishedCollection<List<AtBatEvent>> collection(String gameId) {
        return collections.computeIfAbsent(gameId, id -> new PublishedCollection<>("atbats:" + id));
    }

    public Flux<List<AtBatEvent>> changes(String gameId) {
        return collection(gameId).changes();
    }

    // ── loading ────────────────────────────────────────────────────────────

    /**
     * Ensures the collection is loaded and returns its value. Already-loaded collections
     * are returned as is, without touching the cache or the backend.
     */
    public Mono<List<AtBatEvent>> load(String gameId) {
        PublishedCollection<List<AtBatEvent>> collection = collection(gameId);
        Optional<List<AtBatEvent>> loaded = collection.current();
        if (loaded.isPresent()) {
            return Mono.just(loaded.get());
        }
        return inFlightLoads.computeIfAbsent(gameId, id ->
            loadFromCacheOrRemote(id, collection)
                .doFinally(signal -> inFlightLoads.remove(id))
                .cache());
    }

    /** Re-fetches the log from the backend and republishes it, keeping pending events. */
    public Mono<List<AtBatEvent>> refresh(String gameId) {
        return fetchAndPublish(gameId, collection(gameId));
    }

    private Mono<List<AtBatEvent>> loadFromCacheOrRemote(String gameId,
                                                         PublishedCollection<List<AtBatEvent>> collection) {
        String key = CacheKeys.atBats(gameId);
        return cache.getJson(key, AT_BAT_LIST)
            .publishOn(scheduler)
            .map(cached -> {
                log.info("CACHE_HIT key={} count={}", key, cached.size());
                List<AtBatEvent> published = publishFetched(collection, cached);
                refreshInBackground(gameId);
                return published;
            })
            .switchIfEmpty(Mono.defer(() -> {
                log.info("CACHE_MISS key={}", key);
                return fetchAndPublish(gameId, collection);
            }));
    }

    private Mono<List<AtBatEvent>> fetchAndPublish(String gameId,
                                                   PublishedCollection<List<AtBatEvent>> collection) {
        return backend.listAtBats(gameId)
            .publishOn(scheduler)
            .map(fresh -> publishFetched(collection, fresh))
            .flatMap(published -> persist(gameId, published).thenReturn(published));
    }

    private void refreshInBackground(String gameId) {
        refresh(gameId).subscribe(
            fresh -> log.debug("[AtBats] Background refresh done. gameId={} count={}", gameId, fresh.size()),
            e -> log.warn("[AtBats] Background refresh failed, keeping cached copy. gameId={} err={}",
                          gameId, e.toString()));
    }

    /**
     * Publishes a backend (or persisted) snapshot, carrying over locally assigned sequence
     * numbers and any pending {@code temp-} events the snapshot does not know about yet.
     */
    private List<AtBatEvent> publishFetched(PublishedCollection<List<AtBatEvent>> collection,
                                            List<AtBatEvent> fresh) {
        List<AtBatEvent> current = collection.current().orElse(List.of());
        Map<String, Long> sequences = new HashMap<>();
        for (AtBatEvent e : current) {
            if (e.sequence() != null) {
                sequences.put(e.atBatId(), e.sequence());
            }
        }

        Set<String> freshIds = new HashSet<>();
        List<AtBatEvent> merged = new ArrayList<>(fresh.size() + 1);
        for (AtBatEvent e : fresh) {
            freshIds.add(e.atBatId());
            Long known = sequences.get(e.atBatId());
            merged.add(e.sequence() == null && known != null ? e.withSequence(known) : e);
        }
        for (AtBatEvent e : current) {
            if (isPending(e) && !freshIds.contains(e.atBatId())) {
                merged.add(e);
            }
        }
        List<AtBatEvent> published = sorted(merged);
        collection.publish(published);
        return published;
    }

    // ── mutations ──────────────────────────────────────────────────────────

    /**
     * Records a new at-bat. {@code inning} and {@code outs} are the state the scorer was
     * looking at, stored on the event for reference.
     */
    public Mono<MutationResult<AtBatEvent>> create(String gameId, String teamId, RecordAtBatCommand command,
                                                   int inning, int outs) {
        if (command == null || isBlank(command.playerId())) {
            return Mono.error(new ValidationException("playerId", "Player is required"));
        }
        if (isBlank(command.result())) {
            return Mono.error(new ValidationException("result", "Result is required"));
        }

        Instant now = clock.instant();
        AtBatEvent pending = new AtBatEvent(
            TEMP_ID_PREFIX + UUID.randomUUID(), gameId, teamId, command.playerId(), command.result(),
            inning, outs, command.battingOrder(), command.hitLocation(), command.hitType(), command.rbis(),
            now, now, sequence.incrementAndGet());
        CreateAtBatRequest request = new CreateAtBatRequest(
            command.playerId(), command.result(), inning, outs, command.battingOrder(),
            command.hitLocation(), command.hitType(), command.rbis());

        MutationDescriptor<List<AtBatEvent>, AtBatEvent> descriptor =
            MutationDescriptor.<List<AtBatEvent>, AtBatEvent>of(
                    live -> append(live, pending),
                    () -> backend.createAtBat(gameId, request),
                    (live, created) -> replace(live, pending.atBatId(), created.withSequence(pending.sequence())),
                    live -> withoutId(live, pending.atBatId()))
                .withSuccessMessage("At-bat recorded successfully")
                .withErrorMessage(e -> "Failed to record at-bat: " + describe(e));

        return mutationEngine.mutate(collection(gameId), descriptor)
            .flatMap(result -> persistIfSucceeded(gameId, result));
    }

    /**
     * Applies {@code patch} to an existing at-bat, keeping its id, creation time and place.
     * Pending ({@code temp-}) at-bats cannot be edited until the backend confirms them.
     */
    public Mono<MutationResult<AtBatEvent>> update(String gameId, String atBatId, AtBatPatch patch) {
        if (patch == null) {
            return Mono.error(new ValidationException("patch", "Nothing to update"));
        }
        if (isPendingId(atBatId)) {
            return Mono.error(stillPending());
        }
        AtomicReference<AtBatEvent> before = new AtomicReference<>();
        UpdateAtBatRequest request = new UpdateAtBatRequest(
            patch.result(), patch.hitLocation(), patch.hitType(), patch.rbis());

        MutationDescriptor<List<AtBatEvent>, AtBatEvent> descriptor =
            MutationDescriptor.<List<AtBatEvent>, AtBatEvent>of(
                    live -> {
                        Optional<AtBatEvent> existing = findById(live, atBatId);
                        existing.ifPresent(before::set);
                        return existing
                            .map(e -> replace(live, atBatId, e.withChanges(patch.result(), patch.hitLocation(),
                                                                           patch.hitType(), patch.rbis(), clock.instant())))
                            .orElse(live);
                    },
                    () -> before.get() == null
                        ? Mono.error(notFound())
                        : backend.updateAtBat(gameId, atBatId, request),
                    (live, updated) -> replace(live, atBatId,
                        updated.sequence() == null ? updated.withSequence(before.get().sequence()) : updated),
                    live -> before.get() == null ? live : replaceIfPresent(live, before.get()))
                .withSuccessMessage("At-bat updated")
                .withErrorMessage(e -> "Failed to update at-bat: " + describe(e));

        return mutationEngine.mutate(collection(gameId), descriptor)
            .flatMap(result -> persistIfSucceeded(gameId, result));
    }

    /**
     * Deletes an at-bat; on failure the event is put back in its original position.
     * A {@code temp-} id is rejected: its create is still in flight and will replace it.
     */
    public Mono<MutationResult<String>> delete(String gameId, String atBatId) {
        if (isPendingId(atBatId)) {
            return Mono.error(stillPending());
        }
        AtomicReference<AtBatEvent> before = new AtomicReference<>();

        MutationDescriptor<List<AtBatEvent>, String> descriptor =
            MutationDescriptor.<List<AtBatEvent>, String>of(
                    live -> {
                        findById(live, atBatId).ifPresent(before::set);
                        return withoutId(live, atBatId);
                    },
                    () -> before.get() == null
                        ? Mono.error(notFound())
                        : backend.deleteAtBat(gameId, atBatId).thenReturn(atBatId),
                    (live, deletedId) -> withoutId(live, deletedId),
                    live -> before.get() == null || findById(live, atBatId).isPresent()
                        ? live
                        : append(live, before.get()))
                .withSuccessMessage("At-bat deleted")
                .withErrorMessage(e -> "Failed to delete at-bat: " + describe(e));

        return mutationEngine.mutate(collection(gameId), descriptor)
            .flatMap(result -> persistIfSucceeded(gameId, result));
    }

    // ── queries ────────────────────────────────────────────────────────────

    /** Latest at-bat by replay order; empty when none or the game is not loaded. */
    public Optional<AtBatEvent> lastAtBat(String gameId) {
        return Optional.ofNullable(collections.get(gameId))
            .flatMap(PublishedCollection::current)
            .flatMap(list -> list.stream().max(AtBatOrdering.CHRONOLOGICAL));
    }

    /** Drops every in-memory collection. Persisted copies are left to the cache store. */
    public void evictAll() {
        int count = collections.size();
        collections.clear();
        inFlightLoads.clear();
        log.info("[AtBats] In-memory collections evicted. count={}", count);
    }

    // ── persistence ────────────────────────────────────────────────────────

    private <R> Mono<MutationResult<R>> persistIfSucceeded(String gameId, MutationResult<R> result) {
        if (!result.isSuccess()) {
            return Mono.just(result);
        }
        return Mono.justOrEmpty(collection(gameId).current())
            .flatMap(list -> persist(gameId, list))
            .thenReturn(result);
    }

    private Mono<Void> persist(String gameId, List<AtBatEvent> events) {
        List<AtBatEvent> confirmed = events.stream().filter(e -> !isPending(e)).toList();
        return cache.setJson(CacheKeys.atBats(gameId), confirmed)
            .onErrorResume(e -> {
                log.warn("[AtBats] Persisting at-bats failed. gameId={} err={}", gameId, e.toString());
                return Mono.empty();
            });
    }

    // ── list helpers ───────────────────────────────────────────────────────

    static boolean isPending(AtBatEvent e) {
        return isPendingId(e.atBatId());
    }

    static boolean isPendingId(String atBatId) {
        return atBatId != null && atBatId.startsWith(TEMP_ID_PREFIX);
    }

    private static List<AtBatEvent> append(List<AtBatEvent> live, AtBatEvent event) {
        List<AtBatEvent> next = new ArrayList<>(live);
        next.add(event);
        return sorted(next);
    }

    private static List<AtBatEvent> withoutId(List<AtBatEvent> live, String atBatId) {
        List<AtBatEvent> next = new ArrayList<>(live);
        next.removeIf(e -> atBatId.equals(e.atBatId()));
        return Collections.unmodifiableList(next);
    }

    /** Removes {@code oldId} and any copy of {@code event}, then inserts {@code event}. */
    private static List<AtBatEvent> replace(List<AtBatEvent> live, String oldId, AtBatEvent event) {
        List<AtBatEvent> next = new ArrayList<>(live);
        next.removeIf(e -> oldId.equals(e.atBatId()) || Objects.equals(event.atBatId(), e.atBatId()));
        next.add(event);
        return sorted(next);
    }

    private static List<AtBatEvent> replaceIfPresent(List<AtBatEvent> live, AtBatEvent event) {
        return findById(live, event.atBatId()).isPresent() ? replace(live, event.atBatId(), event) : live;
    }

    private static Optional<AtBatEvent> findById(List<AtBatEvent> live, String atBatId) {
        return live.stream().filter(e -> atBatId.equals(e.atBatId())).findFirst();
    }

    private static List<AtBatEvent> sorted(List<AtBatEvent> events) {
        List<AtBatEvent> next = new ArrayList<>(events);
        next.sort(AtBatOrdering.CHRONOLOGICAL);
        return Collections.unmodifiableList(next);
    }

    private static ValidationException stillPending() {
        return new ValidationException("atBatId", "At-bat is still being saved");
    }

    private static ApiException notFound() {
        return new ApiException(404, "At-bat not found", "NotFound");
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
