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

/**
 * Lifecycle state of a chunk in the streaming cache. A coordinate absent from the cache is {@link #UNLOADED}.
 *
 * <pre>
 * UNLOADED -> QUEUED -> LOADING -> LOADED
 * LOADED -> DIRTY -> SAVING -> LOADED   (save succeeded)
 *                    SAVING -> DIRTY    (save failed, or mutated while saving)
 * LOADED | DIRTY -> UNLOADED            (unload, saving first if dirty)
 * </pre>
 *
 * @author hal.hildebrand
 */
public enum ChunkLoadState {
    UNLOADED,
    QUEUED,
    LOADING,
    LOADED,
    SAVING,
    DIRTY;

    /**
     * @return true if the chunk's payload is held in memory
     */
    public boolean isResident() {
        return this == LOADED || this == DIRTY || this == SAVING;
    }

    /**
     * @return true if a load request for the chunk is queued or executing
     */
    public boolean isPending() {
        return this == QUEUED || this == LOADING;
    }
}
