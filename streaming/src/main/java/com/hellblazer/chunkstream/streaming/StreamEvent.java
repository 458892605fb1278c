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
 * Sealed interface for chunk streaming events.
 * <p>
 * Events are immutable records. Payloads carried by {@link ChunkLoaded} are private copies; listeners may keep them.
 *
 * @author hal.hildebrand
 */
public sealed interface StreamEvent permits StreamEvent.ChunkLoaded, StreamEvent.ChunkUnloaded,
                                            StreamEvent.ChunkSaved, StreamEvent.Error {

    /**
     * Event timestamp in milliseconds since epoch.
     *
     * @return event timestamp
     */
    long timestamp();

    /**
     * A chunk was read from the store and installed.
     *
     * @param timestamp  event timestamp
     * @param coordinate chunk coordinate
     * @param payload    copy of the loaded payload
     */
    record ChunkLoaded(long timestamp, ChunkCoordinate coordinate, ChunkPayload payload) implements StreamEvent {
    }

    /**
     * A resident chunk was removed from memory.
     *
     * @param timestamp  event timestamp
     * @param coordinate chunk coordinate
     */
    record ChunkUnloaded(long timestamp, ChunkCoordinate coordinate) implements StreamEvent {
    }

    /**
     * A durable write finished.
     *
     * @param timestamp  event timestamp
     * @param coordinate chunk coordinate
     * @param success    whether the store accepted the write
     */
    record ChunkSaved(long timestamp, ChunkCoordinate coordinate, boolean success) implements StreamEvent {
    }

    /**
     * A recoverable failure.
     *
     * @param timestamp  event timestamp
     * @param coordinate affected chunk, null when the failure is not chunk specific
     * @param message    description
     */
    record Error(long timestamp, ChunkCoordinate coordinate, String message) implements StreamEvent {
    }
}
