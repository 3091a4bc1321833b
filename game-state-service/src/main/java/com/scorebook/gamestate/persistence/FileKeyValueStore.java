package com.scorebook.gamestate.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link KeyValueStore} persisted as a single JSON object file so cached collections
 * survive a restart.
 *
 * <p>The whole map is held in memory and rewritten on every change (write to a temp file,
 * then atomic move). File I/O runs on the bounded-elastic scheduler.
 */
public class FileKeyValueStore implements KeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(FileKeyValueStore.class);

    private static final TypeReference<LinkedHashMap<String, String>> MAP_TYPE = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Map<String, String> entries;

    public FileKeyValueStore(Path file, ObjectMapper objectMapper) {
        this.file         = file;
        this.objectMapper = objectMapper;
        this.entries      = load(file, objectMapper);
    }

    @Override
    public Mono<String> get(String key) {
        return Mono.fromCallable(() -> {
            synchronized (entries) {
                return entries.get(key);
            }
        });
    }

    @Override
    public Mono<Void> put(String key, String value) {
        return write(() -> entries.put(key, value));
    }

    @Override
    public Mono<Void> remove(String key) {
        return write(() -> entries.remove(key));
    }

    @Override
    public Mono<Void> clear() {
        return write(entries::clear);
    }

    // ── internal ───────────────────────────────────────────────────────────

    private Mono<Void> write(Runnable change) {
        return Mono.<Void>fromRunnable(() -> {
                synchronized (entries) {
                    change.run();
                    flush();
                }
            })
            .subscribeOn(Schedulers.boundedElastic());
    }

    private void flush() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), entries);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write key-value store " + file, e);
        }
    }

    private static Map<String, String> load(Path file, ObjectMapper objectMapper) {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, String> loaded = objectMapper.readValue(file.toFile(), MAP_TYPE);
            log.info("[KeyValueStore] Loaded {} keys from {}", loaded.size(), file);
            return loaded;
        } catch (IOException e) {
            log.warn("[KeyValueStore] Unreadable store file, starting empty. file={} err={}", file, e.getMessage());
            return new LinkedHashMap<>();
        }
    }
}
