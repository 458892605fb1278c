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

import com.hellblazer.chunkstream.common.ChunkPayload;
import com.hellblazer.chunkstream.geometry.ChunkCoordinate;
import com.hellblazer.chunkstream.store.ChunkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Streams a chunked world into memory around a set of viewers and keeps it synchronized with a {@link ChunkStore}.
 * <p>
 * One owner thread drives {@link #tick}; a fixed pool of I/O workers performs store loads and saves. Public
 * mutations never block on the store, except {@link #unload} of a dirty chunk, {@link #saveAllDirty(boolean)} when
 * blocking and {@link #shutdown()}, all of which persist before returning.
 * <p>
 * Usage:
 * <pre>
 * try (var streamer = new ChunkStreamer(StreamingConfiguration.loadDefault())) {
 *     streamer.initialize(new FileChunkStore(worldDir));
 *     streamer.setView("player-1", position);
 *     while (running) {
 *         streamer.tick(frameSeconds);
 *     }
 * }
 * </pre>
 *
 * @author hal.hildebrand
 */
public class ChunkStreamer implements AutoCloseable {

    private enum Phase {
        NEW, RUNNING, SHUTTING_DOWN, TERMINATED
    }

    private static final Logger log = LoggerFactory.getLogger(ChunkStreamer.class);

    private static final Duration DRAIN_POLL = Duration.ofMillis(50);

    private final StreamingConfiguration config;
    private final ViewRegistry           views  = new ViewRegistry();
    private final ChunkTable             table  = new ChunkTable();
    private final IOScheduler            scheduler = new IOScheduler();
    private final StreamEventChannel     events;
    private final AtomicReference<Phase> phase  = new AtomicReference<>(Phase.NEW);
    /** Mutations hold the read side for their whole duration; phase transitions take the write side */
    private final ReentrantReadWriteLock runLock = new ReentrantReadWriteLock();

    private volatile ChunkLifecycle      lifecycle;
    private volatile StreamingController controller;
    private volatile IOWorkerPool        workers;

    public ChunkStreamer() {
        this(StreamingConfiguration.defaultConfig());
    }

    public ChunkStreamer(StreamingConfiguration config) {
        this.config = Objects.requireNonNull(config, "config");
        this.events = new StreamEventChannel(config.getEventDelivery(), config.getEventQueueCapacity());
    }

    /**
     * Start with the configured number of I/O workers.
     */
    public boolean initialize(ChunkStore store) {
        return initialize(store, config.getWorkerThreads());
    }

    /**
     * Start the I/O workers against a store.
     *
     * @return false, with no threads started, if the store reports itself unavailable
     * @throws IllegalStateException if already initialized
     */
    public boolean initialize(ChunkStore store, int workerThreadCount) {
        Objects.requireNonNull(store, "store");
        if (workerThreadCount < 1) {
            throw new IllegalArgumentException("Worker thread count must be positive: " + workerThreadCount);
        }
        runLock.writeLock().lock();
        try {
            if (phase.get() != Phase.NEW) {
                throw new IllegalStateException("Streamer already initialized: " + phase.get());
            }
            if (!store.isAvailable()) {
                log.error("Chunk store {} is unavailable, streamer not started", store);
                return false;
            }
            var locks = new CoordinateLocks(workerThreadCount * 16);
            lifecycle = new ChunkLifecycle(table, scheduler, store, locks, events);
            controller = new StreamingController(config, table, views, lifecycle);
            workers = new IOWorkerPool(scheduler, lifecycle, workerThreadCount);
            workers.start();
            phase.set(Phase.RUNNING);
        } finally {
            runLock.writeLock().unlock();
        }
        log.info("Chunk streamer started with {} workers: {}", workerThreadCount, config);
        return true;
    }

    /**
     * Stop accepting requests, persist every dirty chunk, stop the workers and deliver remaining events. Queued
     * loads complete with false. Waits for mutations already in progress to finish. Idempotent.
     *
     * @throws IllegalStateException if called from a listener invoked inside a streamer operation
     */
    public void shutdown() {
        if (runLock.getReadHoldCount() > 0) {
            throw new IllegalStateException("Cannot shut down from within a streamer operation");
        }
        runLock.writeLock().lock();
        try {
            var current = phase.get();
            if (current == Phase.NEW) {
                phase.set(Phase.TERMINATED);
                return;
            }
            if (current != Phase.RUNNING) {
                return;
            }
            phase.set(Phase.SHUTTING_DOWN);
        } finally {
            runLock.writeLock().unlock();
        }
        log.info("Shutting down chunk streamer, {} dirty chunks", table.dirtyCount());

        lifecycle.saveAllDirty();
        awaitIdle(config.getShutdownTimeout());
        workers.shutdown(config.getShutdownTimeout());
        int discarded = table.discardPending();
        if (discarded > 0) {
            log.debug("Discarded {} pending loads", discarded);
        }
        int failed = lifecycle.flushSynchronously();
        if (failed > 0) {
            log.warn("{} dirty chunks could not be persisted on shutdown", failed);
        }
        events.drain();
        phase.set(Phase.TERMINATED);
        log.info("Chunk streamer stopped: {}", getStatistics());
    }

    @Override
    public void close() {
        shutdown();
    }

    /**
     * Advance the streaming clock: view diff, auto-save and eviction on their cadences, then deliver queued events on
     * the calling thread.
     *
     * @param deltaSeconds time elapsed since the previous tick
     */
    public void tick(double deltaSeconds) {
        if (deltaSeconds < 0 || Double.isNaN(deltaSeconds)) {
            throw new IllegalArgumentException("Invalid tick delta: " + deltaSeconds);
        }
        whileRunning(() -> {
            controller.tick(deltaSeconds);
            return null;
        });
        events.drain();
    }

    public void setView(String viewerId, Point3f position) {
        requireRunning();
        views.setView(viewerId, position);
    }

    public void removeView(String viewerId) {
        requireRunning();
        views.removeView(viewerId);
    }

    /**
     * @param distance horizontal view radius in chunks
     */
    public void setViewDistance(double distance) {
        requireRunning();
        if (!(distance >= 0) || Double.isInfinite(distance)) {
            throw new IllegalArgumentException("Invalid view distance: " + distance);
        }
        controller.setViewDistance(distance);
    }

    /**
     * Load a chunk in the background. Requests for a chunk already queued or loading share that load's future.
     *
     * @return completes true once the chunk is resident, false on a miss, failure or cancellation
     */
    public CompletableFuture<Boolean> requestLoad(ChunkCoordinate coordinate, int priority) {
        Objects.requireNonNull(coordinate, "coordinate");
        return whileRunning(() -> lifecycle.requestLoad(coordinate, priority));
    }

    /**
     * Replace a chunk's payload. The new value is visible to readers immediately; the durable write happens in the
     * background.
     *
     * @return completes with the result of the durable write
     */
    public CompletableFuture<Boolean> requestSave(ChunkCoordinate coordinate, ChunkPayload payload) {
        Objects.requireNonNull(coordinate, "coordinate");
        Objects.requireNonNull(payload, "payload");
        return whileRunning(() -> lifecycle.requestSave(coordinate, payload));
    }

    /**
     * Unload a chunk, persisting it first if dirty.
     */
    public boolean unload(ChunkCoordinate coordinate) {
        return unload(coordinate, true);
    }

    /**
     * @return false if the chunk was dirty and could not be saved; it then stays resident and dirty
     */
    public boolean unload(ChunkCoordinate coordinate, boolean saveIfDirty) {
        Objects.requireNonNull(coordinate, "coordinate");
        return whileRunning(() -> lifecycle.unload(coordinate, saveIfDirty))
               != ChunkLifecycle.UnloadOutcome.SAVE_FAILED;
    }

    /**
     * @return false if the chunk is not resident
     */
    public boolean markDirty(ChunkCoordinate coordinate) {
        Objects.requireNonNull(coordinate, "coordinate");
        return whileRunning(() -> lifecycle.markDirty(coordinate));
    }

    public boolean isLoaded(ChunkCoordinate coordinate) {
        return getState(coordinate).isResident();
    }

    /**
     * @return a copy of the resident payload; reading refreshes the chunk's LRU position
     */
    public Optional<ChunkPayload> getChunk(ChunkCoordinate coordinate) {
        requireInitialized();
        return table.read(coordinate);
    }

    public ChunkLoadState getState(ChunkCoordinate coordinate) {
        requireInitialized();
        return table.getState(coordinate);
    }

    /**
     * Enqueue a save of every dirty chunk.
     *
     * @param blocking wait until the I/O queue drains, delivering events meanwhile
     * @return when blocking, true if no chunk is dirty afterwards; otherwise true
     */
    public boolean saveAllDirty(boolean blocking) {
        whileRunning(lifecycle::saveAllDirty);
        if (!blocking) {
            return true;
        }
        awaitIdle(null);
        return table.dirtyCount() == 0;
    }

    /**
     * @return number of resident chunks unloaded
     */
    public int unloadAll(boolean saveFirst) {
        int unloaded = whileRunning(() -> lifecycle.unloadAll(saveFirst));
        log.info("Unloaded {} chunks", unloaded);
        return unloaded;
    }

    /**
     * Request every chunk within {@code radius} chunks of {@code center}, nearest first.
     *
     * @return number of loads newly enqueued
     */
    public int preloadRadius(ChunkCoordinate center, int radius) {
        Objects.requireNonNull(center, "center");
        if (radius < 0) {
            throw new IllegalArgumentException("Radius must be non-negative: " + radius);
        }
        return whileRunning(() -> lifecycle.preloadRadius(center, radius));
    }

    public void setAutoSave(boolean enabled, Duration interval) {
        requireRunning();
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Auto-save interval must be positive: " + interval);
        }
        controller.setAutoSave(enabled, interval);
    }

    /**
     * @param maxChunks periodic eviction target; 0 disables periodic eviction
     */
    public void setMaxCachedChunks(int maxChunks) {
        requireRunning();
        if (maxChunks < 0) {
            throw new IllegalArgumentException("Capacity must be non-negative: " + maxChunks);
        }
        controller.setMaxCachedChunks(maxChunks);
    }

    /**
     * Unload the least recently accessed chunks, saving dirty ones, until at most {@code maxChunks} remain.
     *
     * @return number of chunks evicted
     */
    public int evictToCapacity(int maxChunks) {
        if (maxChunks < 0) {
            throw new IllegalArgumentException("Capacity must be non-negative: " + maxChunks);
        }
        return whileRunning(() -> lifecycle.evictToCapacity(maxChunks));
    }

    public StreamingStatistics getStatistics() {
        requireInitialized();
        var queue = scheduler.snapshot();
        return new StreamingStatistics(table.residentCount(), table.dirtyCount(), queue.pendingLoads(),
                                       queue.pendingSaves(), lifecycle.averageLoadMillis(),
                                       lifecycle.averageSaveMillis(), queue.queued(), lifecycle.evictionCount(),
                                       lifecycle.loadFailureCount(), lifecycle.saveFailureCount(),
                                       events.droppedCount());
    }

    public void addListener(ChunkStreamListener listener) {
        events.addListener(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(ChunkStreamListener listener) {
        events.removeListener(listener);
    }

    public StreamingConfiguration getConfiguration() {
        return config;
    }

    public boolean isRunning() {
        return phase.get() == Phase.RUNNING;
    }

    StreamingController controller() {
        return controller;
    }

    ChunkTable table() {
        return table;
    }

    /**
     * Wait for the I/O queue to go idle, delivering events on this thread meanwhile.
     *
     * @param timeout null to wait indefinitely
     */
    private boolean awaitIdle(Duration timeout) {
        long deadline = timeout == null ? 0 : System.nanoTime() + timeout.toNanos();
        try {
            while (!scheduler.awaitIdle(DRAIN_POLL)) {
                events.drain();
                if (timeout != null && System.nanoTime() - deadline > 0) {
                    log.warn("I/O queue not idle after {}", timeout);
                    return false;
                }
            }
            events.drain();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private <T> T whileRunning(Supplier<T> operation) {
        runLock.readLock().lock();
        try {
            requireRunning();
            return operation.get();
        } finally {
            runLock.readLock().unlock();
        }
    }

    private void requireInitialized() {
        if (lifecycle == null) {
            throw new IllegalStateException("Streamer not initialized");
        }
    }

    private void requireRunning() {
        var current = phase.get();
        if (current != Phase.RUNNING) {
            throw new IllegalStateException(
            current == Phase.NEW ? "Streamer not initialized" : "Streamer is shut down");
        }
    }
}
