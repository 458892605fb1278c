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

import java.util.Set;

/**
 * Synchronous durable blob store keyed by chunk coordinate.
 * <p>
 * A store owns no caching policy. Failures are reported through return values: a miss or unreadable chunk loads as
 * {@link ChunkPayload#notGenerated()} and a failed write returns false. Implementations must be safe to call from
 * several I/O worker threads at once.
 *
 * @author hal.hildebrand
 */
public interface ChunkStore {

    /**
     * Load the stored payload for a chunk.
     *
     * @param coordinate chunk to load
     * @return the stored payload, or a payload with {@code isGenerated() == false} if the store has none. Never null.
     */
    ChunkPayload loadChunk(ChunkCoordinate coordinate);

    /**
     * Durably persist a payload, replacing any previous content.
     *
     * @return true if the write completed, false on any persistence failure
     */
    boolean saveChunk(ChunkCoordinate coordinate, ChunkPayload payload);

    /**
     * @return true if the store holds generated content for the chunk
     */
    boolean isChunkGenerated(ChunkCoordinate coordinate);

    /**
     * Whether the store can currently serve requests. Checked once when a streamer is initialized.
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Remove a chunk from the store.
     *
     * @return true if a stored chunk was removed
     */
    default boolean deleteChunk(ChunkCoordinate coordinate) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " does not support deletion");
    }

    /**
     * Stored chunks whose Euclidean chunk distance from {@code center} is at most {@code radius}.
     */
    default Set<ChunkCoordinate> chunksInRadius(ChunkCoordinate center, double radius) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " does not support spatial queries");
    }
}
