package com.scorebook.gamestate.mutation;

import com.scorebook.common.trace.TraceContextUtil;
import com.scorebook.gamestate.collection.PublishedCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Generic optimistic-update executor.
 *
 * <p><strong>Flow of one {@link #mutate} call</strong>, strictly in this order:
 * <ol>
 *   <li>Publish {@code optimisticUpdate(live)}.</li>
 *   <li>Subscribe to {@code apiCall()}.</li>
 *   <li>On success publish {@code applyResult(live, result)}.</li>
 *   <li>On failure publish {@code rollback(live)} and surface the error message.</li>
 * </ol>
 * "live" is always the collection value at the moment the step runs. If another
 * mutation completed in between, its effect is preserved.
 *
 * <p>Steps that touch the collection run on the engine {@link Scheduler}, which is
 * single-threaded, so collection writes never race. There is no per-key locking, no retry
 * and no cancellation: a mutation whose caller went away still completes. Every failure
 * kind (network, 4xx, 5xx, 401) is handled identically; the distinction only feeds the
 * error message.
 */
@Component
public class MutationEngine {

    private static final Logger log = LoggerFactory.getLogger(MutationEngine.class);

    private final Scheduler scheduler;
    private final UserNotifier notifier;
    private final AtomicLong mutationCounter = new AtomicLong();

    public MutationEngine(Scheduler scheduler, UserNotifier notifier) {
        this.scheduler = scheduler;
        this.notifier  = notifier;
    }

    /**
     * Runs one optimistic mutation against {@code collection}.
     *
     * <p>The returned {@code Mono} never errors: failures are reported as
     * {@link MutationResult.Status#FAILED}. If the collection is not loaded the API is not
     * called and the result is {@link MutationResult.Status#SKIPPED}.
     */
    public <C, R> Mono<MutationResult<R>> mutate(PublishedCollection<C> collection,
                                                 MutationDescriptor<C, R> descriptor) {
        String mutationId = TraceContextUtil.mutationId(collection.name(), mutationCounter.incrementAndGet());

        Mono<MutationResult<R>> pipeline = Mono.defer(() -> {
            if (!collection.isLoaded()) {
                TraceContextUtil.withMdc(mutationId, () ->
                    log.warn("MUTATION_SKIPPED collection={} reason=not-loaded", collection.name()));
                return Mono.just(MutationResult.<R>skipped());
            }

            collection.update(descriptor.optimisticUpdate());
            TraceContextUtil.withMdc(mutationId, () ->
                log.debug("MUTATION_OPTIMISTIC collection={}", collection.name()));

            return Mono.defer(descriptor.apiCall())
                .switchIfEmpty(Mono.error(() ->
                    new IllegalStateException("Remote call completed without a result")))
                .publishOn(scheduler)
                .map(result -> confirm(collection, descriptor, result, mutationId))
                .onErrorResume(error -> Mono.fromSupplier(() ->
                    rollBack(collection, descriptor, error, mutationId)));
        }).subscribeOn(scheduler);

        return TraceContextUtil.withMutationId(pipeline, mutationId);
    }

    // ── steps 3 / 4 ────────────────────────────────────────────────────────

    private <C, R> MutationResult<R> confirm(PublishedCollection<C> collection,
                                             MutationDescriptor<C, R> descriptor,
                                             R result, String mutationId) {
        collection.update(live -> descriptor.applyResult().apply(live, result));
        TraceContextUtil.withMdc(mutationId, () ->
            log.info("MUTATION_CONFIRMED collection={}", collection.name()));
        if (descriptor.successMessage() != null) {
            notifier.success(descriptor.successMessage());
        }
        return MutationResult.succeeded(result);
    }

    private <C, R> MutationResult<R> rollBack(PublishedCollection<C> collection,
                                              MutationDescriptor<C, R> descriptor,
                                              Throwable error, String mutationId) {
        collection.update(descriptor.rollback());
        String message = descriptor.errorMessage().apply(error);
        TraceContextUtil.withMdc(mutationId, () ->
            log.warn("MUTATION_ROLLED_BACK collection={} error={}", collection.name(), error.toString()));
        notifier.error(message);
        return MutationResult.failed(error, message);
    }
}
