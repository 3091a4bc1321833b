package com.scorebook.gamestate.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.scorebook.gamestate.persistence.FileKeyValueStore;
import com.scorebook.gamestate.persistence.InMemoryKeyValueStore;
import com.scorebook.gamestate.persistence.KeyValueStore;
import com.scorebook.gamestate.persistence.PersistentCacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class GameStateConfig {

    private static final Logger log = LoggerFactory.getLogger(GameStateConfig.class);

    @Value("${scorebook.cache.directory:}")
    private String cacheDirectory;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /** Single writer for every published collection and cache entry. */
    @Bean(destroyMethod = "dispose")
    public Scheduler gameStateScheduler() {
        return Schedulers.newSingle("game-state");
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public KeyValueStore keyValueStore(ObjectMapper objectMapper) {
        if (cacheDirectory == null || cacheDirectory.isBlank()) {
            log.info("[Config] No cache directory configured, local cache is in-memory only");
            return new InMemoryKeyValueStore();
        }
        Path file = Path.of(cacheDirectory, "game-state-cache.json");
        log.info("[Config] Local cache file={}", file);
        return new FileKeyValueStore(file, objectMapper);
    }

    /** Purges the local cache before first use when it was written by another schema version. */
    @Bean
    public ApplicationRunner cacheSchemaCheck(PersistentCacheStore persistentCacheStore) {
        return args -> persistentCacheStore.checkSchemaVersion().block();
    }
}
