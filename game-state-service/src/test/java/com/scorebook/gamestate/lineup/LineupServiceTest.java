package com.scorebook.gamestate.lineup;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.scorebook.common.exception.ApiException;
import com.scorebook.common.exception.ValidationException;
import com.scorebook.common.model.LineupSlot;
import com.scorebook.gamestate.client.FakeScorebookBackend;
import com.scorebook.gamestate.persistence.InMemoryKeyValueStore;
import com.scorebook.gamestate.persistence.MutableClock;
import com.scorebook.gamestate.persistence.PersistentCacheStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LineupServiceTest {

    private static final List<LineupSlot> LINEUP = List.of(LineupSlot.of("p1", 1), LineupSlot.of("p2", 2));

    private FakeScorebookBackend backend;
    private LineupService service;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2026-05-01T18:00:00Z"));
        backend = new FakeScorebookBackend(clock);
        PersistentCacheStore cache = new PersistentCacheStore(new InMemoryKeyValueStore(),
            new ObjectMapper().registerModule(new JavaTimeModule()), clock, 2, null);
        service = new LineupService(backend, cache);
    }

    @Test
    void fetchesOnceThenServesFromCache() {
        backend.givenGame("g1", "t1", LINEUP);

        assertEquals(LINEUP, service.lineup("g1", "t1").block());
        assertEquals(LINEUP, service.lineup("g1", "t1").block());
        assertEquals(1, backend.gameCalls());
    }

    @Test
    void invalidateForcesRefetch() {
        backend.givenGame("g1", "t1", LINEUP);
        service.lineup("g1", "t1").block();

        service.invalidate("g1").block();
        service.lineup("g1", "t1").block();

        assertEquals(2, backend.gameCalls());
    }

    @Test
    void missingLineupIsRejectedAndNotServedFromCache() {
        backend.givenGame("g1", "t1", List.of());

        StepVerifier.create(service.lineup("g1", "t1"))
            .expectErrorSatisfies(e -> assertEquals("lineup", ((ValidationException) e).getField()))
            .verify();

        backend.givenGame("g1", "t1", LINEUP);
        assertEquals(LINEUP, service.lineup("g1", "t1").block());
    }

    @Test
    void otherTeamsGameIsRejected() {
        backend.givenGame("g1", "t1", LINEUP);

        StepVerifier.create(service.lineup("g1", "t2"))
            .expectError(ValidationException.class)
            .verify();
    }

    @Test
    void unknownGamePropagatesApiError() {
        StepVerifier.create(service.lineup("nope", "t1"))
            .expectError(ApiException.class)
            .verify();
    }
}
