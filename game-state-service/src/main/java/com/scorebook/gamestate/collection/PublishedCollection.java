package com.scorebook.gamestate.collection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * The published value of one named collection (e.g. the at-bat log of one game) plus a
 * change stream.
 *
 * <p>Single writer, many readers: writes happen only on the engine scheduler, by the
 * mutation engine and the collection's loader. Readers may call {@link #current()} from
 * anywhere or subscribe to {@link #changes()}.
 *
 * <p>A collection starts unloaded. It becomes loaded on the first {@link #publish}.
 *
 * @param <C> collection type, treated as immutable; transforms return new values
 */
public class PublishedCollection<C> {

    private static final Logger log = LoggerFactory.getLogger(PublishedCollection.class);

    private final String name;
    private final Sinks.Many<C> changes = Sinks.many().multicast().directBestEffort();

    private volatile C value;

    public PublishedCollection(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    public boolean isLoaded() {
        return value != null;
    }

    public Optional<C> current() {
        return Optional.ofNullable(value);
    }

    /** Replaces the published value and notifies subscribers. */
    public void publish(C next) {
        if (next == null) {
            throw new IllegalArgumentException("Collection " + name + " cannot publish null");
        }
        value = next;
        Sinks.EmitResult result = changes.tryEmitNext(next);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("[Collection] Change notification dropped. name={} result={}", name, result);
        }
    }

    /**
     * Applies {@code transform} to the live value and publishes the outcome.
     * No-op when the collection is not loaded.
     *
     * @return the newly published value, or empty when nothing was loaded
     */
    public Optional<C> update(UnaryOperator<C> transform) {
        C current = value;
        if (current == null) {
            log.debug("[Collection] Update skipped, not loaded. name={}", name);
            return Optional.empty();
        }
        C next = transform.apply(current);
        publish(next);
        return Optional.of(next);
    }

    /** Every value published from now on. Does not replay the current value. */
    public Flux<C> changes() {
        return changes.asFlux();
    }
}
