package com.scorebook.gamestate.mutation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Logs user notices and re-publishes them as a stream that a front end can subscribe to.
 */
@Component
public class LoggingUserNotifier implements UserNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingUserNotifier.class);

    public record Notice(Level level, String message) {
        public enum Level { SUCCESS, ERROR }
    }

    private final Sinks.Many<Notice> notices = Sinks.many().multicast().directBestEffort();

    @Override
    public void success(String message) {
        log.info("USER_NOTICE level=SUCCESS message=\"{}\"", message);
        notices.tryEmitNext(new Notice(Notice.Level.SUCCESS, message));
    }

    @Override
    public void error(String message) {
        log.warn("USER_NOTICE level=ERROR message=\"{}\"", message);
        notices.tryEmitNext(new Notice(Notice.Level.ERROR, message));
    }

    public Flux<Notice> notices() {
        return notices.asFlux();
    }
}
