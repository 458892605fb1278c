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

package com.hellblazer.chunkstream.store;

import com.hellblazer.chunkstream.common.ChunkPayload;
import com.hellblazer.chunkstream.geometry.ChunkCoordinate;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Heap-backed {@link ChunkStore}. Payloads are copied on the way in and out, so callers never share state with the
 * store.
 *
 * @author hal.hildebrand
 */
public class InMemoryChunkStore implements ChunkStore {

    private final Map<ChunkCoordinate, ChunkPayload> chunks = new ConcurrentHashMap<>();
    private final AtomicLong                         loads  = new AtomicLong();
    private final AtomicLong                         saves  = new AtomicLong();
    private volatile boolean                         available = true;

    @Override
    public ChunkPayload loadChunk(ChunkCoordinate coordinate) {
        loads.incrementAndGet();
        var stored = chunks.get(coordinate);
        return stored == null ? ChunkPayload.notGenerated() : stored.copy();
    }

    @Override
    public boolean saveChunk(ChunkCoordinate coordinate, ChunkPayload payload) {
        Objects.requireNonNull(coordinate, "coordinate");
        Objects.requireNonNull(payload, "payload");
        if (!available) {
            return false;
        }
        saves.incrementAndGet();
        chunks.put(coordinate, payload.copy());
        return true;
    }

    @Override
    public boolean isChunkGenerated(ChunkCoordinate coordinate) {
        var stored = chunks.get(coordinate);
        return stored != null && stored.isGenerated();
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    /**
     * Simulate the backing medium going away (or coming back). While unavailable, saves fail.
     */
    public void setAvailable(boolean available) {
        this.available = available;
    }

    @Override
    public boolean deleteChunk(ChunkCoordinate coordinate) {
        return chunks.remove(coordinate) != null;
    }

    @Override
    public Set<ChunkCoordinate> chunksInRadius(ChunkCoordinate center, double radius) {
        return chunks.keySet()
                     .stream()
                     .filter(c -> c.distance(center) <= radius)
                     .collect(Collectors.toSet());
    }

    /**
     * Direct view of stored content, bypassing load accounting.
     */
    public ChunkPayload peek(ChunkCoordinate coordinate) {
        var stored = chunks.get(coordinate);
        return stored == null ? null : stored.copy();
    }

    public int size() {
        return chunks.size();
    }

    public long getLoadCount() {
        return loads.get();
    }

    public long getSaveCount() {
        return saves.get();
    }
}
