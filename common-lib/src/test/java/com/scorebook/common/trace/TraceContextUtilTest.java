package com.scorebook.common.trace;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TraceContextUtilTest {

    @Test
    @DisplayName("mutation ids are the collection name and a sequence number")
    void mutationIdFormat() {
        assertEquals("atbats:g1#7", TraceContextUtil.mutationId("atbats:g1", 7));
    }

    @Test
    @DisplayName("the id written at the end of assembly is visible upstream")
    void contextCarriesId() {
        Mono<String> read = Mono.deferContextual(ctx -> Mono.just(TraceContextUtil.getMutationId(ctx)));

        assertEquals("atbats:g1#3", TraceContextUtil.withMutationId(read, "atbats:g1#3").block());
        assertEquals("unknown", read.block());
    }

    @Test
    @DisplayName("MDC holds the id only while the log action runs")
    void mdcIsCleared() {
        AtomicReference<String> seen = new AtomicReference<>();

        TraceContextUtil.withMdc("atbats:g1#1", () -> seen.set(MDC.get(TraceContextUtil.MUTATION_ID_KEY)));

        assertEquals("atbats:g1#1", seen.get());
        assertNull(MDC.get(TraceContextUtil.MUTATION_ID_KEY));
    }
}
