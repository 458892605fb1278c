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

import java.util.concurrent.locks.ReentrantLock;

/**
 * Striped locks serializing durable writes per coordinate. Distinct coordinates may share a stripe; that only costs
 * concurrency, never correctness. Always acquired before the chunk table lock, never while holding it.
 *
 * @author hal.hildebrand
 */
public class CoordinateLocks {

    private final ReentrantLock[] stripes;
    private final int             mask;

    public CoordinateLocks(int minimumStripes) {
        int size = Integer.highestOneBit(Math.max(1, minimumStripes - 1)) << 1;
        stripes = new ReentrantLock[size];
        for (int i = 0; i < size; i++) {
            stripes[i] = new ReentrantLock();
        }
        mask = size - 1;
    }

    public ReentrantLock lockFor(ChunkCoordinate coordinate) {
        int h = coordinate.hashCode();
        h ^= (h >>> 16);
        return stripes[h & mask];
    }

    public int stripeCount() {
        return stripes.length;
    }
}
