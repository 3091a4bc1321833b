package com.scorebook.gamestate.cache;

import com.scorebook.common.model.AtBatEvent;
import com.scorebook.common.model.LineupSlot;
import com.scorebook.common.state.GameStateReducer;
import com.scorebook.common.state.InGameState;
import com.scorebook.gamestate.atbat.AtBatCollectionService;
import com.scorebook.gamestate.atbat.AtBatPatch;
import com.scorebook.gamestate.atbat.RecordAtBatCommand;
import com.scorebook.gamestate.lineup.LineupService;
import com.scorebook.gamestate.mutation.MutationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memoized, self-refreshing {@link InGameState} per {@link GameStateKey}.
 *
 * <p><strong>Lifecycle of an entry</strong>
 * <ol>
 *   <li>First {@link #observe} creates it and publishes {@code LOADING}.</li>
 *   <li>The at-bat log and the lineup are loaded, the reducer runs, {@code DATA} is
 *       published.</li>
 *   <li>Every change of the game's at-bat collection re-runs the reducer over the whole
 *       log and publishes a new {@code DATA}. A failed recompute keeps the last one.</li>
 *   <li>When the last observer leaves, a keep-alive timer is armed. An observer arriving
 *       before it fires gets the cached view instantly; otherwise the entry is released
 *       and the next observer starts from step 1.</li>
 * </ol>
 *
 * <p>All entry bookkeeping runs on the engine {@link Scheduler}; the observer count and
 * timer fields are therefore only touched by one thread.
 */
@Service
public class GameStateCache {

    private static final Logger log = LoggerFactory.getLogger(GameStateCache.class);

    public static final Duration DEFAULT_KEEP_ALIVE = Duration.ofMinutes(5);

    private final AtBatCollectionService atBats;
    private final LineupService lineups;
    private final Scheduler scheduler;
    private final Duration keepAlive;

    private final ConcurrentHashMap<GameStateKey, Entry> entries = new ConcurrentHashMap<>();

    public GameStateCache(AtBatCollectionService atBats, LineupService lineups,
                          Scheduler scheduler,
                          @Value("${scorebook.game-state.keep-alive:PT5M}") Duration keepAlive) {
        this.atBats    = atBats;
        this.lineups   = lineups;
        this.scheduler = scheduler;
        this.keepAlive = keepAlive != null ? keepAlive : DEFAULT_KEEP_ALIVE;
    }

    // ── observation ────────────────────────────────────────────────────────

    /**
     * Stream of views for {@code key}, starting with the latest one. Completes only when
     * the entry is released via {@link #releaseAll()}.
     */
    public Flux<GameStateView> observe(GameStateKey key) {
        return Flux.defer(() -> {
            Entry entry = acquire(key);
            return entry.views.asFlux()
                .doFinally(signal -> scheduler.schedule(() -> release(entry)));
        }).subscribeOn(scheduler);
    }

    /** Latest view of a live entry, without subscribing. */
    public Optional<GameStateView> current(GameStateKey key) {
        return Optional.ofNullable(entries.get(key)).map(e -> e.latest);
    }

    public Set<GameStateKey> activeEntries() {
        return Set.copyOf(entries.keySet());
    }

    /** Releases every entry immediately, e.g. on sign-out. Open observers complete. */
    public Mono<Void> releaseAll() {
        return Mono.<Void>fromRunnable(() -> {
            int count = entries.size();
            entries.values().forEach(this::dispose);
            entries.clear();
            log.info("[GameState] All entries released. count={}", count);
        }).subscribeOn(scheduler);
    }

    // ── commands ───────────────────────────────────────────────────────────

    /**
     * Records an at-bat stamped with the inning and outs currently derived for
     * {@code key}. The state is not recomputed here; the collection change does that.
     */
    public Mono<MutationResult<AtBatEvent>> recordAtBat(GameStateKey key, RecordAtBatCommand command) {
        return currentState(key)
            .flatMap(state -> atBats.create(key.gameId(), key.teamId(), command, state.inning(), state.outs()));
    }

    public Mono<MutationResult<AtBatEvent>> updateAtBat(GameStateKey key, String atBatId, AtBatPatch patch) {
        return atBats.load(key.gameId())
            .then(Mono.defer(() -> atBats.update(key.gameId(), atBatId, patch)));
    }

    public Mono<MutationResult<String>> deleteAtBat(GameStateKey key, String atBatId) {
        return atBats.load(key.gameId())
            .then(Mono.defer(() -> atBats.delete(key.gameId(), atBatId)));
    }

    public Optional<AtBatEvent> getLastAtBat(String gameId) {
        return atBats.lastAtBat(gameId);
    }

    /** The cached state if the entry holds {@code DATA}, otherwise a one-off computation. */
    private Mono<InGameState> currentState(GameStateKey key) {
        return Mono.defer(() -> {
            Entry entry = entries.get(key);
            if (entry != null && entry.latest.isData()) {
                return Mono.just(entry.latest.state());
            }
            return Mono.zip(atBats.load(key.gameId()), lineups.lineup(key.gameId(), key.teamId()))
                .map(t -> GameStateReducer.compute(t.getT1(), t.getT2()));
        }).subscribeOn(scheduler);
    }

    // ── entry bookkeeping (engine scheduler only) ──────────────────────────

    private Entry acquire(GameStateKey key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            entry = new Entry(key);
            entries.put(key, entry);
            entry.observers++;
            log.debug("[GameState] Entry created. key={}", key);
            start(entry);
            return entry;
        }
        if (entry.keepAliveTimer != null) {
            entry.keepAliveTimer.dispose();
            entry.keepAliveTimer = null;
            log.debug("KEEPALIVE_CANCELLED key={}", key);
        }
        entry.observers++;
        return entry;
    }

    private void start(Entry entry) {
        GameStateKey key = entry.key;
        entry.emit(GameStateView.loading());

        entry.changeSubscription = atBats.changes(key.gameId())
            .publishOn(scheduler)
            .subscribe(
                events -> recompute(entry, events),
                e -> log.warn("[GameState] Change stream failed. key={} err={}", key, e.toString()));

        entry.initialLoad = Mono.zip(atBats.load(key.gameId()), lineups.lineup(key.gameId(), key.teamId()))
            .publishOn(scheduler)
            .map(t -> {
                entry.lineup = t.getT2();
                List<AtBatEvent> live = atBats.collection(key.gameId()).current().orElse(t.getT1());
                return GameStateReducer.compute(live, entry.lineup);
            })
            .subscribe(
                state -> {
                    if (!entry.released) {
                        entry.emit(GameStateView.data(state));
                        log.info("GAME_STATE_LOADED key={} state={}", key, state);
                    }
                },
                e -> log.error("[GameState] Initial load failed, entry stays LOADING. key={} err={}",
                               key, e.toString()));
    }

    private void recompute(Entry entry, List<AtBatEvent> events) {
        if (entry.released || !entry.latest.isData() || entry.lineup == null) {
            return;
        }
        try {
            InGameState state = GameStateReducer.compute(events, entry.lineup);
            entry.emit(GameStateView.data(state));
            log.debug("GAME_STATE_RECOMPUTED key={} events={} state={}", entry.key, events.size(), state);
        } catch (RuntimeException e) {
            log.warn("[GameState] Recompute failed, keeping last state. key={} err={}", entry.key, e.toString());
        }
    }

    private void release(Entry entry) {
        if (entry.released) {
            return;
        }
        entry.observers--;
        if (entry.observers > 0) {
            return;
        }
        entry.keepAliveTimer = Mono.delay(keepAlive, scheduler)
            .subscribe(tick -> expire(entry));
        log.debug("KEEPALIVE_ARMED key={} keepAlive={}", entry.key, keepAlive);
    }

    private void expire(Entry entry) {
        if (entry.released || entry.observers > 0) {
            return;
        }
        dispose(entry);
        entries.remove(entry.key, entry);
        log.info("KEEPALIVE_EXPIRED key={}", entry.key);
    }

    private void dispose(Entry entry) {
        entry.released = true;
        disposeQuietly(entry.keepAliveTimer);
        disposeQuietly(entry.changeSubscription);
        disposeQuietly(entry.initialLoad);
        entry.views.tryEmitComplete();
    }

    private static void disposeQuietly(Disposable d) {
        if (d != null) {
            d.dispose();
        }
    }

    private static final class Entry {
        final GameStateKey key;
        final Sinks.Many<GameStateView> views = Sinks.many().replay().latest();

        volatile GameStateView latest = GameStateView.loading();
        List<LineupSlot> lineup;
        int observers;
        boolean released;
        Disposable keepAliveTimer;
        Disposable changeSubscription;
        Disposable initialLoad;

        Entry(GameStateKey key) {
            this.key = key;
        }

        void emit(GameStateView view) {
            latest = view;
            views.tryEmitNext(view);
        }
    }
}
