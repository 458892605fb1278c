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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The authoritative in-memory chunk cache: payload, load state and last access per coordinate, plus the set of
 * coordinates whose payload has not been durably persisted.
 * <p>
 * Every read and write goes through a single lock, held only for the map operation itself and never across store
 * I/O. Access times come from a logical clock advanced on every touch, so LRU ranking is strict even when several
 * accesses land in the same nanosecond.
 * <p>
 * Invariant: a coordinate is in the dirty set only while its entry is {@link ChunkLoadState#DIRTY} or
 * {@link ChunkLoadState#SAVING}.
 *
 * @author hal.hildebrand
 */
public class ChunkTable {

    /**
     * Result of asking to load a coordinate.
     *
     * @param future   completes when the (possibly shared) load finishes
     * @param enqueue  true if the caller must enqueue a new load request
     */
    public record LoadTicket(CompletableFuture<Boolean> future, boolean enqueue) {
    }

    /**
     * Snapshot of a dirty payload taken for a durable write.
     *
     * @param payload  private copy of the freshest in-memory payload
     * @param version  mutation version the copy reflects
     */
    public record SaveSnapshot(ChunkPayload payload, long version) {
    }

    public enum LoadOutcome {
        /** Payload installed as LOADED */
        INSTALLED,
        /** The chunk was written locally while the load was in flight; the stored copy is stale */
        SUPERSEDED,
        /** The chunk was unloaded while the load was in flight */
        CANCELLED
    }

    public enum Removal {
        ABSENT,
        REMOVED_RESIDENT,
        REMOVED_PENDING,
        /** Removal required a clean chunk but the chunk is dirty */
        STILL_DIRTY
    }

    private static final class Entry {
        ChunkPayload               payload;
        ChunkLoadState             state;
        long                       lastAccess;
        long                       version;
        CompletableFuture<Boolean> pendingLoad;

        Entry(ChunkLoadState state) {
            this.state = state;
        }
    }

    private final ReentrantLock                  lock    = new ReentrantLock();
    private final Map<ChunkCoordinate, Entry>    entries = new HashMap<>();
    private final Set<ChunkCoordinate>           dirty   = new HashSet<>();
    private long                                 accessClock;
    /** Table-wide so a re-created entry never reuses a version an older snapshot carries */
    private long                                 mutationClock;

    /**
     * Admit a load for a coordinate. Only the first caller for an absent coordinate is told to enqueue; callers
     * racing on a queued or loading coordinate share its future; a resident coordinate completes immediately.
     */
    public LoadTicket admitLoad(ChunkCoordinate coordinate) {
        lock.lock();
        try {
            var entry = entries.get(coordinate);
            if (entry == null) {
                entry = new Entry(ChunkLoadState.QUEUED);
                entry.pendingLoad = new CompletableFuture<>();
                entries.put(coordinate, entry);
                return new LoadTicket(entry.pendingLoad, true);
            }
            if (entry.state.isPending() && entry.pendingLoad != null) {
                return new LoadTicket(entry.pendingLoad, false);
            }
            return new LoadTicket(CompletableFuture.completedFuture(entry.state.isResident()), false);
        } finally {
            lock.unlock();
        }
    }

    /**
     * A worker picked up the load: QUEUED to LOADING.
     *
     * @param ticket the future handed out by {@link #admitLoad}; a stale request for a coordinate that was unloaded
     *               and re-admitted does not match
     * @return false if this request no longer owns a queued entry
     */
    public boolean beginLoad(ChunkCoordinate coordinate, CompletableFuture<Boolean> ticket) {
        lock.lock();
        try {
            var entry = entries.get(coordinate);
            if (entry == null || entry.state != ChunkLoadState.QUEUED || entry.pendingLoad != ticket) {
                return false;
            }
            entry.state = ChunkLoadState.LOADING;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Install a loaded payload unless the coordinate was unloaded or written while the load was in flight.
     */
    public LoadOutcome completeLoad(ChunkCoordinate coordinate, CompletableFuture<Boolean> ticket,
                                    ChunkPayload payload) {
        lock.lock();
        try {
            var entry = entries.get(coordinate);
            if (entry == null) {
                return LoadOutcome.CANCELLED;
            }
            if (!entry.state.isPending()) {
                return LoadOutcome.SUPERSEDED;
            }
            if (entry.pendingLoad != ticket) {
                return LoadOutcome.CANCELLED;
            }
            entry.pendingLoad = null;
            entry.payload = payload;
            entry.state = ChunkLoadState.LOADED;
            touch(entry);
            return LoadOutcome.INSTALLED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * A load missed or failed: return the coordinate to UNLOADED so a later request can retry.
     *
     * @return true if a pending entry was removed
     */
    public boolean failLoad(ChunkCoordinate coordinate, CompletableFuture<Boolean> ticket) {
        lock.lock();
        try {
            var entry = entries.get(coordinate);
            if (entry == null || !entry.state.isPending() || entry.pendingLoad != ticket) {
                return false;
            }
            entries.remove(coordinate);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Install a locally written payload as DIRTY, replacing whatever the table held. Readers see the new value as soon
     * as this returns.
     *
     * @return the mutation version of the installed payload
     */
    public long installDirty(ChunkCoordinate coordinate, ChunkPayload payload) {
        CompletableFuture<Boolean> superseded;
        long version;
        lock.lock();
        try {
            var entry = entries.computeIfAbsent(coordinate, c -> new Entry(ChunkLoadState.DIRTY));
            superseded = entry.pendingLoad;
            entry.pendingLoad = null;
            entry.payload = payload;
            entry.state = ChunkLoadState.DIRTY;
            entry.version = ++mutationClock;
            dirty.add(coordinate);
            touch(entry);
            version = entry.version;
        } finally {
            lock.unlock();
        }
        // the in-flight load can no longer install its result
        if (superseded != null) {
            superseded.complete(false);
        }
        return version;
    }

    /**
     * Flag a resident chunk as diverging from the store.
     *
     * @return false if the chunk is not resident
     */
    public boolean markDirty(ChunkCoordinate coordinate) {
        lock.lock();
        try {
            var entry = entries.get(coordinate);
            if (entry == null || !entry.state.isResident()) {
                return false;
            }
            entry.state = ChunkLoadState.DIRTY;
            entry.version = ++mutationClock;
            dirty.add(coordinate);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Take the freshest payload of a dirty chunk for a durable write, moving it to SAVING.
     *
     * @return the snapshot, or null if the chunk is absent or clean
     */
    public SaveSnapshot snapshotForSave(ChunkCoordinate coordinate) {
        lock.lock();
        try {
            var entry = entries.get(coordinate);
            if (entry == null || !dirty.contains(coordinate)) {
                return null;
            }
            entry.state = ChunkLoadState.SAVING;
            return new SaveSnapshot(entry.payload.copy(), entry.version);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Record the outcome of a durable write. The chunk only becomes clean if the write succeeded and nothing mutated
     * it after the snapshot was taken.
     *
     * @return true if the chunk is now clean
     */
    public boolean completeSave(ChunkCoordinate coordinate, long version, boolean success) {
        lock.lock();
        try {
            var entry = entries.get(coordinate);
            if (entry == null) {
                return success;
            }
            if (success && entry.version == version) {
                dirty.remove(coordinate);
                entry.state = ChunkLoadState.LOADED;
                return true;
            }
            if (entry.state == ChunkLoadState.SAVING) {
                entry.state = ChunkLoadState.DIRTY;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove a coordinate from the table, its access time and the dirty set.
     *
     * @param requireClean refuse to remove a dirty chunk
     */
    public Removal remove(ChunkCoordinate coordinate, boolean requireClean) {
        Entry removed;
        lock.lock();
        try {
            var entry = entries.get(coordinate);
            if (entry == null) {
                return Removal.ABSENT;
            }
            if (requireClean && dirty.contains(coordinate)) {
                return Removal.STILL_DIRTY;
            }
            removed = entries.remove(coordinate);
            dirty.remove(coordinate);
        } finally {
            lock.unlock();
        }
        if (removed.pendingLoad != null) {
            removed.pendingLoad.complete(false);
        }
        return removed.state.isPending() ? Removal.REMOVED_PENDING : Removal.REMOVED_RESIDENT;
    }

    /**
     * Drop every queued or loading entry.
     *
     * @return number of entries dropped
     */
    public int discardPending() {
        var discarded = new ArrayList<CompletableFuture<Boolean>>();
        lock.lock();
        try {
            var it = entries.values().iterator();
            while (it.hasNext()) {
                var entry = it.next();
                if (entry.state.isPending()) {
                    if (entry.pendingLoad != null) {
                        discarded.add(entry.pendingLoad);
                    }
                    it.remove();
                }
            }
        } finally {
            lock.unlock();
        }
        discarded.forEach(f -> f.complete(false));
        return discarded.size();
    }

    /**
     * Read a resident chunk, refreshing its access time.
     *
     * @return a copy of the payload, or empty if the chunk is not resident
     */
    public Optional<ChunkPayload> read(ChunkCoordinate coordinate) {
        lock.lock();
        try {
            var entry = entries.get(coordinate);
            if (entry == null || !entry.state.isResident()) {
                return Optional.empty();
            }
            touch(entry);
            return Optional.of(entry.payload.copy());
        } finally {
            lock.unlock();
        }
    }

    public ChunkLoadState getState(ChunkCoordinate coordinate) {
        lock.lock();
        try {
            var entry = entries.get(coordinate);
            return entry == null ? ChunkLoadState.UNLOADED : entry.state;
        } finally {
            lock.unlock();
        }
    }

    public boolean isDirty(ChunkCoordinate coordinate) {
        lock.lock();
        try {
            return dirty.contains(coordinate);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the last access tick of a coordinate, or -1 if absent or never accessed
     */
    public long lastAccess(ChunkCoordinate coordinate) {
        lock.lock();
        try {
            var entry = entries.get(coordinate);
            return entry == null || entry.lastAccess == 0 ? -1 : entry.lastAccess;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Chunks in state DIRTY; chunks currently being saved are excluded.
     */
    public List<ChunkCoordinate> dirtyCoordinates() {
        lock.lock();
        try {
            var result = new ArrayList<ChunkCoordinate>(dirty.size());
            for (var coordinate : dirty) {
                if (entries.get(coordinate).state == ChunkLoadState.DIRTY) {
                    result.add(coordinate);
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public Set<ChunkCoordinate> dirtySnapshot() {
        lock.lock();
        try {
            return Set.copyOf(dirty);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Chunks eligible for unload: LOADED or DIRTY.
     */
    public List<ChunkCoordinate> unloadableCoordinates() {
        lock.lock();
        try {
            var result = new ArrayList<ChunkCoordinate>(entries.size());
            entries.forEach((coordinate, entry) -> {
                if (entry.state == ChunkLoadState.LOADED || entry.state == ChunkLoadState.DIRTY) {
                    result.add(coordinate);
                }
            });
            return result;
        } finally {
            lock.unlock();
        }
    }

    public List<ChunkCoordinate> allCoordinates() {
        lock.lock();
        try {
            return new ArrayList<>(entries.keySet());
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(ChunkCoordinate coordinate) {
        lock.lock();
        try {
            return entries.containsKey(coordinate);
        } finally {
            lock.unlock();
        }
    }

    /**
     * The least recently accessed unloadable chunks, oldest first.
     *
     * @param count maximum number of coordinates to return
     */
    public List<ChunkCoordinate> leastRecentlyUsed(int count) {
        if (count <= 0) {
            return List.of();
        }
        lock.lock();
        try {
            return entries.entrySet()
                          .stream()
                          .filter(e -> e.getValue().state == ChunkLoadState.LOADED
                                  || e.getValue().state == ChunkLoadState.DIRTY)
                          .sorted(Comparator.comparingLong(e -> e.getValue().lastAccess))
                          .limit(count)
                          .map(Map.Entry::getKey)
                          .toList();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int residentCount() {
        return count(true);
    }

    public int pendingCount() {
        return count(false);
    }

    public int dirtyCount() {
        lock.lock();
        try {
            return dirty.size();
        } finally {
            lock.unlock();
        }
    }

    private int count(boolean resident) {
        lock.lock();
        try {
            int n = 0;
            for (var entry : entries.values()) {
                if (resident ? entry.state.isResident() : entry.state.isPending()) {
                    n++;
                }
            }
            return n;
        } finally {
            lock.unlock();
        }
    }

    private void touch(Entry entry) {
        entry.lastAccess = ++accessClock;
    }
}
