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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Load, save and unload transitions of chunks between the {@link ChunkTable} and the {@link ChunkStore}. Runs on
 * both the owner thread (requests, unloads, synchronous flushes) and the I/O workers (queued loads and saves).
 * <p>
 * Durable writes for a coordinate are serialized by its stripe in {@link CoordinateLocks} and always write the
 * freshest in-memory payload. No table lock is held across a store call.
 *
 * @author hal.hildebrand
 */
class ChunkLifecycle implements IOWorkerPool.IORequestHandler {

    enum SaveOutcome {
        /** Nothing to write */
        CLEAN,
        WRITTEN,
        FAILED
    }

    enum UnloadOutcome {
        UNLOADED,
        /** A queued or in-flight load was cancelled */
        CANCELLED,
        ABSENT,
        /** The chunk is dirty and could not be persisted; it stays resident */
        SAVE_FAILED
    }

    private static final Logger log = LoggerFactory.getLogger(ChunkLifecycle.class);

    /** Attempts to win the race against concurrent writers before an unload gives up */
    private static final int MAX_UNLOAD_ATTEMPTS = 8;

    private final ChunkTable         table;
    private final IOScheduler        scheduler;
    private final ChunkStore         store;
    private final CoordinateLocks    locks;
    private final StreamEventChannel events;
    private final LatencyTracker     loadLatency  = new LatencyTracker();
    private final LatencyTracker     saveLatency  = new LatencyTracker();
    private final AtomicLong         evictions    = new AtomicLong();
    private final AtomicLong         loadFailures = new AtomicLong();
    private final AtomicLong         saveFailures = new AtomicLong();

    ChunkLifecycle(ChunkTable table, IOScheduler scheduler, ChunkStore store, CoordinateLocks locks,
                   StreamEventChannel events) {
        this.table = table;
        this.scheduler = scheduler;
        this.store = store;
        this.locks = locks;
        this.events = events;
    }

    @Override
    public boolean handle(IORequest request) {
        return switch (request.type()) {
            case LOAD -> executeLoad(request);
            case SAVE -> executeSave(request);
        };
    }

    /**
     * Admit a load and enqueue it if no load for the coordinate is queued, in flight or complete.
     */
    ChunkTable.LoadTicket admitLoad(ChunkCoordinate coordinate, int priority) {
        var ticket = table.admitLoad(coordinate);
        if (ticket.enqueue()) {
            var request = scheduler.submit(IORequest.Type.LOAD, coordinate, priority, ticket.future());
            if (request == null) {
                table.failLoad(coordinate, ticket.future());
                ticket.future().complete(false);
                return new ChunkTable.LoadTicket(ticket.future(), false);
            }
            log.trace("Queued {}", request);
        }
        return ticket;
    }

    CompletableFuture<Boolean> requestLoad(ChunkCoordinate coordinate, int priority) {
        return admitLoad(coordinate, priority).future();
    }

    /**
     * Install the payload as the current, dirty value and enqueue its durable write.
     */
    CompletableFuture<Boolean> requestSave(ChunkCoordinate coordinate, ChunkPayload payload) {
        table.installDirty(coordinate, payload.copy());
        return enqueueSave(coordinate);
    }

    boolean markDirty(ChunkCoordinate coordinate) {
        boolean marked = table.markDirty(coordinate);
        if (marked) {
            log.debug("Marked {} dirty", coordinate);
        }
        return marked;
    }

    /**
     * Enqueue a save for every dirty chunk not already being saved.
     *
     * @return number of saves enqueued
     */
    int saveAllDirty() {
        int enqueued = 0;
        for (var coordinate : table.dirtyCoordinates()) {
            enqueueSave(coordinate);
            enqueued++;
        }
        if (enqueued > 0) {
            log.debug("Enqueued {} dirty chunk saves", enqueued);
        }
        return enqueued;
    }

    /**
     * Persist every dirty chunk on the calling thread.
     *
     * @return number of chunks that could not be persisted
     */
    int flushSynchronously() {
        int failed = 0;
        for (var coordinate : table.dirtySnapshot()) {
            if (persist(coordinate) == SaveOutcome.FAILED) {
                failed++;
            }
        }
        return failed;
    }

    /**
     * Remove a chunk from memory, first persisting it if dirty and requested.
     */
    UnloadOutcome unload(ChunkCoordinate coordinate, boolean saveIfDirty) {
        for (int attempt = 0; attempt < MAX_UNLOAD_ATTEMPTS; attempt++) {
            if (saveIfDirty && table.isDirty(coordinate) && persist(coordinate) == SaveOutcome.FAILED) {
                log.warn("Unload of {} aborted, chunk could not be saved", coordinate);
                publish(new StreamEvent.Error(System.currentTimeMillis(), coordinate,
                                              "Unload aborted: save failed for " + coordinate));
                return UnloadOutcome.SAVE_FAILED;
            }
            switch (table.remove(coordinate, saveIfDirty)) {
                case ABSENT:
                    return UnloadOutcome.ABSENT;
                case REMOVED_PENDING:
                    log.debug("Cancelled pending load of {}", coordinate);
                    return UnloadOutcome.CANCELLED;
                case REMOVED_RESIDENT:
                    log.debug("Unloaded {}", coordinate);
                    publish(new StreamEvent.ChunkUnloaded(System.currentTimeMillis(), coordinate));
                    return UnloadOutcome.UNLOADED;
                case STILL_DIRTY:
                    // written again after the save, go around
                    break;
                default:
                    throw new IllegalStateException("Unknown removal");
            }
        }
        log.warn("Unload of {} gave up, chunk kept changing", coordinate);
        publish(new StreamEvent.Error(System.currentTimeMillis(), coordinate,
                                      "Unload aborted: " + coordinate + " kept changing during save"));
        return UnloadOutcome.SAVE_FAILED;
    }

    /**
     * Unload the least recently used chunks until no more than {@code maxChunks} remain.
     *
     * @return number of chunks evicted
     */
    int evictToCapacity(int maxChunks) {
        int excess = table.size() - maxChunks;
        if (excess <= 0) {
            return 0;
        }
        int evicted = 0;
        for (var coordinate : table.leastRecentlyUsed(excess)) {
            if (unload(coordinate, true) == UnloadOutcome.UNLOADED) {
                evicted++;
            }
        }
        evictions.addAndGet(evicted);
        log.debug("Evicted {} of {} excess chunks", evicted, excess);
        return evicted;
    }

    /**
     * @return number of resident chunks unloaded
     */
    int unloadAll(boolean saveFirst) {
        int unloaded = 0;
        for (var coordinate : table.allCoordinates()) {
            if (unload(coordinate, saveFirst) == UnloadOutcome.UNLOADED) {
                unloaded++;
            }
        }
        return unloaded;
    }

    /**
     * Request every chunk within a sphere, nearest first.
     *
     * @return number of loads newly enqueued
     */
    int preloadRadius(ChunkCoordinate center, int radius) {
        var candidates = new ArrayList<ChunkCoordinate>();
        long limit = (long) radius * radius;
        for (int dx = -radius; dx <= radius; dx++) {
            for (int dy = -radius; dy <= radius; dy++) {
                for (int dz = -radius; dz <= radius; dz++) {
                    if ((long) dx * dx + (long) dy * dy + (long) dz * dz <= limit) {
                        candidates.add(center.offset(dx, dy, dz));
                    }
                }
            }
        }
        candidates.sort(Comparator.comparingLong(center::distanceSquared));
        int enqueued = 0;
        for (var coordinate : candidates) {
            if (admitLoad(coordinate, LoadPriority.forDistance(coordinate.distance(center))).enqueue()) {
                enqueued++;
            }
        }
        log.debug("Preload around {} radius {} enqueued {} loads", center, radius, enqueued);
        return enqueued;
    }

    /**
     * Durably write the freshest payload of a dirty chunk. Serialized per coordinate.
     */
    SaveOutcome persist(ChunkCoordinate coordinate) {
        var lock = locks.lockFor(coordinate);
        boolean success;
        String failure = null;
        lock.lock();
        try {
            var snapshot = table.snapshotForSave(coordinate);
            if (snapshot == null) {
                return SaveOutcome.CLEAN;
            }
            long start = System.nanoTime();
            try {
                success = store.saveChunk(coordinate, snapshot.payload());
            } catch (RuntimeException e) {
                log.error("Store failed saving {}", coordinate, e);
                success = false;
                failure = e.toString();
            }
            saveLatency.record(start);
            table.completeSave(coordinate, snapshot.version(), success);
        } finally {
            lock.unlock();
        }
        publish(new StreamEvent.ChunkSaved(System.currentTimeMillis(), coordinate, success));
        if (!success) {
            saveFailures.incrementAndGet();
            log.warn("Save of {} failed, chunk remains dirty", coordinate);
            publish(new StreamEvent.Error(System.currentTimeMillis(), coordinate,
                                          failure == null ? "Save failed for " + coordinate
                                                          : "Save failed for " + coordinate + ": " + failure));
            return SaveOutcome.FAILED;
        }
        log.debug("Saved {}", coordinate);
        return SaveOutcome.WRITTEN;
    }

    double averageLoadMillis() {
        return loadLatency.averageMillis();
    }

    double averageSaveMillis() {
        return saveLatency.averageMillis();
    }

    long evictionCount() {
        return evictions.get();
    }

    long loadFailureCount() {
        return loadFailures.get();
    }

    long saveFailureCount() {
        return saveFailures.get();
    }

    private CompletableFuture<Boolean> enqueueSave(ChunkCoordinate coordinate) {
        var future = new CompletableFuture<Boolean>();
        var request = scheduler.submit(IORequest.Type.SAVE, coordinate, LoadPriority.DEFAULT, future);
        if (request == null) {
            future.complete(false);
        } else {
            log.trace("Queued {}", request);
        }
        return future;
    }

    private boolean executeLoad(IORequest request) {
        var coordinate = request.coordinate();
        if (!table.beginLoad(coordinate, request.future())) {
            log.trace("Skipping stale {}", request);
            return false;
        }
        long start = System.nanoTime();
        ChunkPayload payload;
        try {
            payload = store.loadChunk(coordinate);
        } catch (RuntimeException e) {
            log.error("Store failed loading {}", coordinate, e);
            table.failLoad(coordinate, request.future());
            loadFailures.incrementAndGet();
            publish(new StreamEvent.Error(System.currentTimeMillis(), coordinate,
                                          "Load failed for " + coordinate + ": " + e));
            return false;
        }
        loadLatency.record(start);
        if (payload == null || !payload.isGenerated()) {
            log.debug("No stored content for {}", coordinate);
            table.failLoad(coordinate, request.future());
            loadFailures.incrementAndGet();
            return false;
        }
        var outcome = table.completeLoad(coordinate, request.future(), payload.copy());
        if (outcome != ChunkTable.LoadOutcome.INSTALLED) {
            log.debug("Discarded load of {}: {}", coordinate, outcome);
            return false;
        }
        log.debug("Loaded {} ({} bytes)", coordinate, payload.size());
        publish(new StreamEvent.ChunkLoaded(System.currentTimeMillis(), coordinate, payload));
        return true;
    }

    private boolean executeSave(IORequest request) {
        return persist(request.coordinate()) != SaveOutcome.FAILED;
    }

    private void publish(StreamEvent event) {
        events.publish(event);
    }
}
