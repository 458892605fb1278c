/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.chunkstream.streaming;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable configuration of a {@link ChunkStreamer}. Build with {@link #builder()}, or load from JSON where
 * missing keys keep their defaults and unknown keys are ignored.
 *
 * @author hal.hildebrand
 */
public final class StreamingConfiguration {

    public static final String DEFAULT_RESOURCE = "/chunk-streaming.json";

    private static final Logger       log    = LoggerFactory.getLogger(StreamingConfiguration.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final int           workerThreads;
    private final double        viewDistance;
    private final int           verticalViewDistance;
    private final float         chunkSize;
    private final int           viewUpdateIntervalTicks;
    private final int           evictionIntervalTicks;
    private final boolean       autoSaveEnabled;
    private final Duration      autoSaveInterval;
    private final int           maxCachedChunks;
    private final int           eventQueueCapacity;
    private final EventDelivery eventDelivery;
    private final Duration      shutdownTimeout;

    private StreamingConfiguration(Builder builder) {
        this.workerThreads = builder.workerThreads;
        this.viewDistance = builder.viewDistance;
        this.verticalViewDistance = builder.verticalViewDistance;
        this.chunkSize = builder.chunkSize;
        this.viewUpdateIntervalTicks = builder.viewUpdateIntervalTicks;
        this.evictionIntervalTicks = builder.evictionIntervalTicks;
        this.autoSaveEnabled = builder.autoSaveEnabled;
        this.autoSaveInterval = builder.autoSaveInterval;
        this.maxCachedChunks = builder.maxCachedChunks;
        this.eventQueueCapacity = builder.eventQueueCapacity;
        this.eventDelivery = builder.eventDelivery;
        this.shutdownTimeout = builder.shutdownTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static StreamingConfiguration defaultConfig() {
        return builder().build();
    }

    /**
     * Load the bundled {@value #DEFAULT_RESOURCE}, falling back to {@link #defaultConfig()} if it is absent.
     */
    public static StreamingConfiguration loadDefault() {
        try {
            return fromResource(DEFAULT_RESOURCE);
        } catch (FileNotFoundException e) {
            log.warn("Configuration resource not found: {}, using defaults", DEFAULT_RESOURCE);
            return defaultConfig();
        } catch (IOException e) {
            throw new IllegalStateException("Unreadable configuration resource " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * @throws FileNotFoundException if the class path has no such resource
     * @throws IOException           if the resource is not valid JSON
     */
    public static StreamingConfiguration fromResource(String resource) throws IOException {
        try (InputStream is = StreamingConfiguration.class.getResourceAsStream(resource)) {
            if (is == null) {
                throw new FileNotFoundException("Configuration resource not found: " + resource);
            }
            return load(is);
        }
    }

    /**
     * Parse a JSON configuration object.
     *
     * @throws IOException              if the input is not a JSON object
     * @throws IllegalArgumentException if a value is out of range
     */
    public static StreamingConfiguration load(InputStream input) throws IOException {
        var root = MAPPER.readTree(input);
        if (root == null || !root.isObject()) {
            throw new IOException("Configuration must be a JSON object");
        }
        var builder = builder();
        if (root.has("workerThreads")) {
            builder.withWorkerThreads(root.get("workerThreads").asInt());
        }
        if (root.has("viewDistance")) {
            builder.withViewDistance(root.get("viewDistance").asDouble());
        }
        if (root.has("verticalViewDistance")) {
            builder.withVerticalViewDistance(root.get("verticalViewDistance").asInt());
        }
        if (root.has("chunkSize")) {
            builder.withChunkSize((float) root.get("chunkSize").asDouble());
        }
        if (root.has("viewUpdateIntervalTicks")) {
            builder.withViewUpdateIntervalTicks(root.get("viewUpdateIntervalTicks").asInt());
        }
        if (root.has("evictionIntervalTicks")) {
            builder.withEvictionIntervalTicks(root.get("evictionIntervalTicks").asInt());
        }
        if (root.has("autoSaveEnabled")) {
            builder.withAutoSave(root.get("autoSaveEnabled").asBoolean());
        }
        if (root.has("autoSaveIntervalSeconds")) {
            builder.withAutoSaveInterval(seconds(root.get("autoSaveIntervalSeconds")));
        }
        if (root.has("maxCachedChunks")) {
            builder.withMaxCachedChunks(root.get("maxCachedChunks").asInt());
        }
        if (root.has("eventQueueCapacity")) {
            builder.withEventQueueCapacity(root.get("eventQueueCapacity").asInt());
        }
        if (root.has("eventDelivery")) {
            var text = root.get("eventDelivery").asText().toUpperCase(Locale.ROOT);
            builder.withEventDelivery(EventDelivery.valueOf(text));
        }
        if (root.has("shutdownTimeoutSeconds")) {
            builder.withShutdownTimeout(seconds(root.get("shutdownTimeoutSeconds")));
        }
        var config = builder.build();
        log.debug("Loaded {}", config);
        return config;
    }

    private static Duration seconds(JsonNode node) {
        return Duration.ofMillis(Math.round(node.asDouble() * 1000.0));
    }

    public Duration getAutoSaveInterval() {
        return autoSaveInterval;
    }

    public float getChunkSize() {
        return chunkSize;
    }

    public EventDelivery getEventDelivery() {
        return eventDelivery;
    }

    public int getEventQueueCapacity() {
        return eventQueueCapacity;
    }

    public int getEvictionIntervalTicks() {
        return evictionIntervalTicks;
    }

    public int getMaxCachedChunks() {
        return maxCachedChunks;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    /**
     * @return half height, in chunks, of the vertical band loaded around each viewer
     */
    public int getVerticalViewDistance() {
        return verticalViewDistance;
    }

    /**
     * @return horizontal view radius in chunks
     */
    public double getViewDistance() {
        return viewDistance;
    }

    public int getViewUpdateIntervalTicks() {
        return viewUpdateIntervalTicks;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public boolean isAutoSaveEnabled() {
        return autoSaveEnabled;
    }

    public Builder toBuilder() {
        return builder().withWorkerThreads(workerThreads)
                        .withViewDistance(viewDistance)
                        .withVerticalViewDistance(verticalViewDistance)
                        .withChunkSize(chunkSize)
                        .withViewUpdateIntervalTicks(viewUpdateIntervalTicks)
                        .withEvictionIntervalTicks(evictionIntervalTicks)
                        .withAutoSave(autoSaveEnabled)
                        .withAutoSaveInterval(autoSaveInterval)
                        .withMaxCachedChunks(maxCachedChunks)
                        .withEventQueueCapacity(eventQueueCapacity)
                        .withEventDelivery(eventDelivery)
                        .withShutdownTimeout(shutdownTimeout);
    }

    @Override
    public String toString() {
        return String.format(
        "StreamingConfiguration[workers=%d, viewDistance=%.1f, vertical=%d, chunkSize=%.1f, viewEvery=%d, evictEvery=%d, autoSave=%s/%s, maxCached=%d, events=%s/%d, shutdownTimeout=%s]",
        workerThreads, viewDistance, verticalViewDistance, chunkSize, viewUpdateIntervalTicks, evictionIntervalTicks,
        autoSaveEnabled, autoSaveInterval, maxCachedChunks, eventDelivery, eventQueueCapacity, shutdownTimeout);
    }

    /**
     * Builder for StreamingConfiguration. Values are validated by {@link #build()}.
     */
    public static class Builder {
        private int           workerThreads           = 2;
        private double        viewDistance            = 8.0;
        private int           verticalViewDistance    = 2;
        private float         chunkSize               = 16.0f;
        private int           viewUpdateIntervalTicks = 10;
        private int           evictionIntervalTicks   = 60;
        private boolean       autoSaveEnabled         = true;
        private Duration      autoSaveInterval        = Duration.ofSeconds(30);
        private int           maxCachedChunks         = 4096;
        private int           eventQueueCapacity      = 4096;
        private EventDelivery eventDelivery           = EventDelivery.OWNER_THREAD;
        private Duration      shutdownTimeout         = Duration.ofSeconds(30);

        private Builder() {
        }

        public StreamingConfiguration build() {
            if (workerThreads < 1) {
                throw new IllegalArgumentException("workerThreads must be positive: " + workerThreads);
            }
            if (!(viewDistance >= 0) || Double.isInfinite(viewDistance)) {
                throw new IllegalArgumentException("viewDistance must be finite and non-negative: " + viewDistance);
            }
            if (verticalViewDistance < 0) {
                throw new IllegalArgumentException(
                "verticalViewDistance must be non-negative: " + verticalViewDistance);
            }
            if (!(chunkSize > 0) || Float.isInfinite(chunkSize)) {
                throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
            }
            if (viewUpdateIntervalTicks < 1 || evictionIntervalTicks < 1) {
                throw new IllegalArgumentException(
                "Tick intervals must be positive: view=" + viewUpdateIntervalTicks + " eviction="
                + evictionIntervalTicks);
            }
            if (autoSaveInterval.isNegative() || autoSaveInterval.isZero()) {
                throw new IllegalArgumentException("autoSaveInterval must be positive: " + autoSaveInterval);
            }
            if (maxCachedChunks < 0) {
                throw new IllegalArgumentException("maxCachedChunks must be non-negative: " + maxCachedChunks);
            }
            if (eventQueueCapacity < 1) {
                throw new IllegalArgumentException("eventQueueCapacity must be positive: " + eventQueueCapacity);
            }
            if (shutdownTimeout.isNegative()) {
                throw new IllegalArgumentException("shutdownTimeout must be non-negative: " + shutdownTimeout);
            }
            return new StreamingConfiguration(this);
        }

        public Builder withAutoSave(boolean enabled) {
            this.autoSaveEnabled = enabled;
            return this;
        }

        public Builder withAutoSaveInterval(Duration interval) {
            this.autoSaveInterval = Objects.requireNonNull(interval, "interval");
            return this;
        }

        /**
         * @param chunkSize edge length of a chunk in world units
         */
        public Builder withChunkSize(float chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder withEventDelivery(EventDelivery delivery) {
            this.eventDelivery = Objects.requireNonNull(delivery, "delivery");
            return this;
        }

        public Builder withEventQueueCapacity(int capacity) {
            this.eventQueueCapacity = capacity;
            return this;
        }

        public Builder withEvictionIntervalTicks(int ticks) {
            this.evictionIntervalTicks = ticks;
            return this;
        }

        /**
         * @param maxCachedChunks eviction target; 0 disables periodic eviction
         */
        public Builder withMaxCachedChunks(int maxCachedChunks) {
            this.maxCachedChunks = maxCachedChunks;
            return this;
        }

        public Builder withShutdownTimeout(Duration timeout) {
            this.shutdownTimeout = Objects.requireNonNull(timeout, "timeout");
            return this;
        }

        public Builder withVerticalViewDistance(int chunks) {
            this.verticalViewDistance = chunks;
            return this;
        }

        public Builder withViewDistance(double chunks) {
            this.viewDistance = chunks;
            return this;
        }

        public Builder withViewUpdateIntervalTicks(int ticks) {
            this.viewUpdateIntervalTicks = ticks;
            return this;
        }

        public Builder withWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }
    }
}
