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
 * Load ordering by distance to the nearest viewer: closer chunks get a larger value and are serviced first.
 *
 * @author hal.hildebrand
 */
public final class LoadPriority {

    public static final int MAX   = 10_000;
    public static final int SCALE = 100;

    /** Priority for explicitly requested saves and loads with no viewer to rank against */
    public static final int DEFAULT = 0;

    private LoadPriority() {
    }

    /**
     * @param distanceInChunks distance, in chunk units, from the chunk to the nearest viewer
     */
    public static int forDistance(double distanceInChunks) {
        if (Double.isNaN(distanceInChunks) || distanceInChunks < 0) {
            throw new IllegalArgumentException("Invalid distance: " + distanceInChunks);
        }
        if (Double.isInfinite(distanceInChunks)) {
            return Integer.MIN_VALUE;
        }
        long scaled = Math.round(distanceInChunks * SCALE);
        return (int) Math.max(Integer.MIN_VALUE, MAX - scaled);
    }
}
