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

package com.hellblazer.chunkstream.geometry;

import javax.vecmath.Point3f;

/**
 * Immutable integer grid address of a chunk.
 * <p>
 * Coordinates carry no spatial meaning beyond equality and hashing when used as map keys. The horizontal plane is
 * (x, z); y is the vertical axis.
 *
 * @author hal.hildebrand
 */
public final class ChunkCoordinate {

    /** X coordinate */
    public final int x;

    /** Y (vertical) coordinate */
    public final int y;

    /** Z coordinate */
    public final int z;

    /**
     * Create a new chunk coordinate.
     *
     * @param x X coordinate
     * @param y Y coordinate
     * @param z Z coordinate
     */
    public ChunkCoordinate(int x, int y, int z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    public static ChunkCoordinate of(int x, int y, int z) {
        return new ChunkCoordinate(x, y, z);
    }

    /**
     * The coordinate at the origin (0, 0, 0).
     */
    public static ChunkCoordinate origin() {
        return new ChunkCoordinate(0, 0, 0);
    }

    /**
     * Find the chunk containing a world position.
     *
     * @param position  world position
     * @param chunkSize edge length of a chunk in world units
     * @return the containing chunk, using floor division so negative positions map correctly
     * @throws IllegalArgumentException if chunkSize is not positive
     */
    public static ChunkCoordinate fromWorldPosition(Point3f position, float chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
        }
        return new ChunkCoordinate((int) Math.floor(position.x / chunkSize),
                                   (int) Math.floor(position.y / chunkSize),
                                   (int) Math.floor(position.z / chunkSize));
    }

    /**
     * Translate this coordinate.
     *
     * @return New coordinate offset by the given deltas
     */
    public ChunkCoordinate offset(int dx, int dy, int dz) {
        return new ChunkCoordinate(x + dx, y + dy, z + dz);
    }

    /**
     * Calculate squared Euclidean distance, in chunks, to another coordinate.
     *
     * @param other Other coordinate
     * @return Squared distance
     */
    public long distanceSquared(ChunkCoordinate other) {
        long dx = x - other.x;
        long dy = y - other.y;
        long dz = z - other.z;
        return dx * dx + dy * dy + dz * dz;
    }

    /**
     * Euclidean distance between chunk centers.
     */
    public double distance(ChunkCoordinate other) {
        return Math.sqrt(distanceSquared(other));
    }

    /**
     * Euclidean distance in the horizontal (x, z) plane, ignoring the vertical axis.
     */
    public double horizontalDistance(ChunkCoordinate other) {
        long dx = x - other.x;
        long dz = z - other.z;
        return Math.sqrt(dx * dx + dz * dz);
    }

    /**
     * Calculate Chebyshev distance to another coordinate.
     *
     * @return max(|dx|, |dy|, |dz|)
     */
    public int chebyshevDistance(ChunkCoordinate other) {
        return Math.max(Math.abs(x - other.x), Math.max(Math.abs(y - other.y), Math.abs(z - other.z)));
    }

    /**
     * World-space center of this chunk.
     *
     * @param chunkSize edge length of a chunk in world units
     */
    public Point3f center(float chunkSize) {
        return new Point3f((x + 0.5f) * chunkSize, (y + 0.5f) * chunkSize, (z + 0.5f) * chunkSize);
    }

    /**
     * Two coordinates are equal iff all three components are equal.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ChunkCoordinate other)) return false;
        return x == other.x && y == other.y && z == other.z;
    }

    /**
     * Polynomial mix of the three components, {@code 31 * (31 * x + y) + z}. Consistent with {@link #equals}; no
     * ordering is implied by the hash.
     */
    @Override
    public int hashCode() {
        return 31 * (31 * x + y) + z;
    }

    @Override
    public String toString() {
        return String.format("ChunkCoordinate(%d, %d, %d)", x, y, z);
    }
}
