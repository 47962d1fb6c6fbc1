package com.trading.dpl.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trading.dpl.engine.PoolConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.Data;
import lombok.extern.log4j.Log4j2;

/**
 * POJO representation of the engine configuration file.
 *
 * <pre>{@code
 * {
 *   "pool":      { "initialSize": 16, "maxSize": 1024 },
 *   "streaming": { "windowSize": 256 },
 *   "columnar":  { "enabled": true },
 *   "feed":      { "ringBufferSize": 1024 }
 * }
 * }</pre>
 *
 * Missing sections keep their defaults; unknown keys are ignored.
 */
@Data
@Log4j2
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EngineConfig {
    public static final String DEFAULT_RESOURCE = "dpl-engine.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Pool pool = new Pool();
    private Streaming streaming = new Streaming();
    private Columnar columnar = new Columnar();
    private Feed feed = new Feed();

    /** Scope pool sizing. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Pool {
        private int initialSize = 16;
        private int maxSize = 1024;
    }

    /** Bounded-window executor. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Streaming {
        private int windowSize = 256;
    }

    /** Columnar input history for large batches. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Columnar {
        private boolean enabled = true;
    }

    /** Disruptor tick feed. Ring buffer size must be a power of two. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Feed {
        private int ringBufferSize = 1024;
    }

    public PoolConfig poolConfig() {
        return new PoolConfig(pool.getInitialSize(), pool.getMaxSize());
    }

    // ── Loading ──────────────────────────────────────────────────

    /** Built-in defaults, without reading any file. */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath, falling back to
     * built-in defaults when it is absent.
     */
    public static EngineConfig load() {
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                log.debug("{} not on classpath, using defaults", DEFAULT_RESOURCE);
                return defaults();
            }
            return validate(MAPPER.readValue(in, EngineConfig.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    public static EngineConfig fromJson(String json) {
        try {
            return validate(MAPPER.readValue(json, EngineConfig.class));
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid engine config: " + e.getMessage(), e);
        }
    }

    public static EngineConfig fromFile(Path path) {
        try {
            return fromJson(Files.readString(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read engine config " + path, e);
        }
    }

    private static EngineConfig validate(EngineConfig config) {
        // PoolConfig enforces its own bounds.
        config.poolConfig();
        if (config.streaming.getWindowSize() < 1)
            throw new IllegalArgumentException("streaming.windowSize must be >= 1");
        int ring = config.feed.getRingBufferSize();
        if (ring < 1 || Integer.bitCount(ring) != 1)
            throw new IllegalArgumentException("feed.ringBufferSize must be a power of two, got " + ring);
        return config;
    }
}
