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

/**
 * Receives chunk streaming events. Override the callbacks of interest, or {@link #onEvent} to see every event.
 * <p>
 * With {@link EventDelivery#OWNER_THREAD} delivery (the default) callbacks run on the thread calling
 * {@link ChunkStreamer#tick}; with {@link EventDelivery#DIRECT} they run on whichever thread completed the
 * operation and must be thread-safe. Exceptions thrown by a listener are caught and logged.
 *
 * @author hal.hildebrand
 */
public interface ChunkStreamListener {

    default void onChunkLoaded(ChunkCoordinate coordinate, ChunkPayload payload) {
    }

    default void onChunkSaved(ChunkCoordinate coordinate, boolean success) {
    }

    default void onChunkUnloaded(ChunkCoordinate coordinate) {
    }

    default void onError(ChunkCoordinate coordinate, String message) {
    }

    default void onEvent(StreamEvent event) {
        if (event instanceof StreamEvent.ChunkLoaded e) {
            onChunkLoaded(e.coordinate(), e.payload());
        } else if (event instanceof StreamEvent.ChunkUnloaded e) {
            onChunkUnloaded(e.coordinate());
        } else if (event instanceof StreamEvent.ChunkSaved e) {
            onChunkSaved(e.coordinate(), e.success());
        } else if (event instanceof StreamEvent.Error e) {
            onError(e.coordinate(), e.message());
        }
    }
}
