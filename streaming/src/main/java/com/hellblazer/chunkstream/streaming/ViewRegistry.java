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

import javax.vecmath.Point3f;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * One world position per viewer, under its own lock. Independent of chunk state.
 *
 * @author hal.hildebrand
 */
public class ViewRegistry {

    private final Map<String, Point3f> views = new HashMap<>();
    private final ReadWriteLock        lock  = new ReentrantReadWriteLock();

    public void setView(String viewerId, Point3f position) {
        Objects.requireNonNull(viewerId, "viewerId");
        Objects.requireNonNull(position, "position");
        lock.writeLock().lock();
        try {
            views.put(viewerId, new Point3f(position));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return true if the viewer was registered
     */
    public boolean removeView(String viewerId) {
        lock.writeLock().lock();
        try {
            return views.remove(viewerId) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int viewerCount() {
        lock.readLock().lock();
        try {
            return views.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isEmpty() {
        return viewerCount() == 0;
    }

    /**
     * The chunk each viewer currently stands in.
     */
    public List<ChunkCoordinate> viewerChunks(float chunkSize) {
        lock.readLock().lock();
        try {
            var result = new ArrayList<ChunkCoordinate>(views.size());
            for (var position : views.values()) {
                result.add(ChunkCoordinate.fromWorldPosition(position, chunkSize));
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * The union over all viewers of the chunks whose centers lie within {@code viewDistance} chunks, horizontally, of
     * the viewer's chunk center, repeated over a vertical band of {@code verticalDistance} chunks above and below.
     *
     * @param viewDistance     horizontal radius in chunks
     * @param verticalDistance half height of the vertical band in chunks
     * @param chunkSize        chunk edge length in world units
     */
    public Set<ChunkCoordinate> desiredChunks(double viewDistance, int verticalDistance, float chunkSize) {
        var centers = viewerChunks(chunkSize);
        var desired = new HashSet<ChunkCoordinate>();
        int reach = (int) Math.floor(viewDistance);
        double limit = viewDistance * viewDistance;
        for (var center : centers) {
            for (int dx = -reach; dx <= reach; dx++) {
                for (int dz = -reach; dz <= reach; dz++) {
                    if (dx * dx + dz * dz > limit) {
                        continue;
                    }
                    for (int dy = -verticalDistance; dy <= verticalDistance; dy++) {
                        desired.add(center.offset(dx, dy, dz));
                    }
                }
            }
        }
        return desired;
    }

    /**
     * Euclidean distance, in chunks, from a coordinate to the nearest viewer's chunk.
     *
     * @return the distance, or {@link Double#POSITIVE_INFINITY} with no viewers
     */
    public static double nearestDistance(ChunkCoordinate coordinate, List<ChunkCoordinate> viewerChunks) {
        double best = Double.POSITIVE_INFINITY;
        for (var viewer : viewerChunks) {
            best = Math.min(best, coordinate.distance(viewer));
        }
        return best;
    }
}
