package com.scorebook.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Ties together everything one optimistic mutation does: the optimistic publish, the
 * backend request (sent as {@code X-Mutation-Id}) and the confirm or rollback line.
 *
 * <p>Ids have the form {@code <collection>#<n>}, e.g. {@code atbats:g1#7}, so a grep on
 * the collection name shows every mutation of one game in order.
 *
 * <p>The id travels in the Reactor Context. MDC only holds it while one log statement runs.
 */
public final class TraceContextUtil {

    public static final String MUTATION_ID_KEY = "mutationId";

    static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    /** {@code atbats:g1} and {@code 7} give {@code atbats:g1#7}. */
    public static String mutationId(String collection, long sequence) {
        return collection + "#" + sequence;
    }

    /** Call last when assembling the pipeline: {@code contextWrite} is visible upstream only. */
    public static <T> Mono<T> withMutationId(Mono<T> mono, String mutationId) {
        return mono.contextWrite(ctx -> ctx.put(MUTATION_ID_KEY, mutationId));
    }

    /** The id of the mutation this signal belongs to; {@code "unknown"} for reads and refreshes. */
    public static String getMutationId(ContextView ctx) {
        return ctx.getOrDefault(MUTATION_ID_KEY, UNKNOWN);
    }

    public static void withMdc(String mutationId, Runnable logAction) {
        MDC.put(MUTATION_ID_KEY, mutationId);
        try {
            logAction.run();
        } finally {
            MDC.remove(MUTATION_ID_KEY);
        }
    }
}
