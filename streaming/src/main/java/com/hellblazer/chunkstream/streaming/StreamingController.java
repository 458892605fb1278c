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

import com.hellblazer.chunkstream.geometry.ChunkCoordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Per-tick orchestration: view diff every few ticks, periodic auto-save, and LRU eviction on its own cadence.
 * <p>
 * Runs on the owner thread only; settings may be changed from any thread.
 *
 * @author hal.hildebrand
 */
class StreamingController {

    /**
     * Outcome of one view update.
     *
     * @param loadsIssued loads newly enqueued, in submission order
     * @param priorities  priority of each issued load, parallel to {@code loadsIssued}
     * @param unloaded    chunks unloaded because no viewer wants them
     */
    record ViewUpdate(List<ChunkCoordinate> loadsIssued, List<Integer> priorities, int unloaded) {
        static final ViewUpdate NONE = new ViewUpdate(List.of(), List.of(), 0);
    }

    private static final Logger log = LoggerFactory.getLogger(StreamingController.class);

    private final ChunkTable     table;
    private final ViewRegistry   views;
    private final ChunkLifecycle lifecycle;
    private final float          chunkSize;
    private final int            verticalViewDistance;
    private final int            viewUpdateIntervalTicks;
    private final int            evictionIntervalTicks;

    private volatile double   viewDistance;
    private volatile boolean  autoSaveEnabled;
    private volatile Duration autoSaveInterval;
    private volatile int      maxCachedChunks;

    private long       tickCount;
    private double     autoSaveTimer;
    private ViewUpdate lastUpdate = ViewUpdate.NONE;

    StreamingController(StreamingConfiguration config, ChunkTable table, ViewRegistry views,
                        ChunkLifecycle lifecycle) {
        this.table = table;
        this.views = views;
        this.lifecycle = lifecycle;
        this.chunkSize = config.getChunkSize();
        this.verticalViewDistance = config.getVerticalViewDistance();
        this.viewUpdateIntervalTicks = config.getViewUpdateIntervalTicks();
        this.evictionIntervalTicks = config.getEvictionIntervalTicks();
        this.viewDistance = config.getViewDistance();
        this.autoSaveEnabled = config.isAutoSaveEnabled();
        this.autoSaveInterval = config.getAutoSaveInterval();
        this.maxCachedChunks = config.getMaxCachedChunks();
    }

    void tick(double deltaSeconds) {
        tickCount++;
        autoSaveTimer += deltaSeconds;

        if (tickCount % viewUpdateIntervalTicks == 0) {
            lastUpdate = updateStreaming();
        }

        double interval = autoSaveInterval.toNanos() / 1_000_000_000.0;
        if (autoSaveEnabled && autoSaveTimer >= interval) {
            autoSaveTimer = 0;
            int enqueued = lifecycle.saveAllDirty();
            if (enqueued > 0) {
                log.debug("Auto-save enqueued {} chunks", enqueued);
            }
        }

        int capacity = maxCachedChunks;
        if (capacity > 0 && tickCount % evictionIntervalTicks == 0) {
            lifecycle.evictToCapacity(capacity);
        }
    }

    /**
     * Diff the desired chunk set against the table: load what is missing, nearest first, and unload what no viewer
     * wants. With no viewer registered nothing is unloaded.
     */
    ViewUpdate updateStreaming() {
        if (views.isEmpty()) {
            return ViewUpdate.NONE;
        }
        var desired = views.desiredChunks(viewDistance, verticalViewDistance, chunkSize);
        var viewers = views.viewerChunks(chunkSize);

        var missing = new ArrayList<ChunkCoordinate>();
        for (var coordinate : desired) {
            if (!table.contains(coordinate)) {
                missing.add(coordinate);
            }
        }
        missing.sort(Comparator.<ChunkCoordinate>comparingDouble(c -> ViewRegistry.nearestDistance(c, viewers))
                               .thenComparingInt(c -> c.y)
                               .thenComparingInt(c -> c.x)
                               .thenComparingInt(c -> c.z));

        var issued = new ArrayList<ChunkCoordinate>();
        var priorities = new ArrayList<Integer>();
        for (var coordinate : missing) {
            int priority = LoadPriority.forDistance(ViewRegistry.nearestDistance(coordinate, viewers));
            if (lifecycle.admitLoad(coordinate, priority).enqueue()) {
                issued.add(coordinate);
                priorities.add(priority);
            }
        }

        int unloaded = 0;
        for (var coordinate : table.unloadableCoordinates()) {
            if (!desired.contains(coordinate)
            && lifecycle.unload(coordinate, true) == ChunkLifecycle.UnloadOutcome.UNLOADED) {
                unloaded++;
            }
        }
        if (!issued.isEmpty() || unloaded > 0) {
            log.debug("View update: {} desired, {} loads issued, {} unloaded", desired.size(), issued.size(),
                      unloaded);
        }
        return new ViewUpdate(List.copyOf(issued), List.copyOf(priorities), unloaded);
    }

    ViewUpdate lastUpdate() {
        return lastUpdate;
    }

    long tickCount() {
        return tickCount;
    }

    double viewDistance() {
        return viewDistance;
    }

    int maxCachedChunks() {
        return maxCachedChunks;
    }

    void setAutoSave(boolean enabled, Duration interval) {
        this.autoSaveInterval = interval;
        this.autoSaveEnabled = enabled;
    }

    void setMaxCachedChunks(int maxCachedChunks) {
        this.maxCachedChunks = maxCachedChunks;
    }

    void setViewDistance(double viewDistance) {
        this.viewDistance = viewDistance;
    }
}
