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

import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import java.util.HashSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ChunkCoordinate.
 *
 * @author hal.hildebrand
 */
public class ChunkCoordinateTest {

    @Test
    public void testConstruction() {
        var coord = ChunkCoordinate.of(1, 2, 3);
        assertEquals(1, coord.x);
        assertEquals(2, coord.y);
        assertEquals(3, coord.z);
        assertEquals(ChunkCoordinate.of(0, 0, 0), ChunkCoordinate.origin());
    }

    @Test
    public void testFromWorldPosition() {
        assertEquals(ChunkCoordinate.of(0, 0, 0), ChunkCoordinate.fromWorldPosition(new Point3f(0, 0, 0), 16));
        assertEquals(ChunkCoordinate.of(0, 0, 0), ChunkCoordinate.fromWorldPosition(new Point3f(15.9f, 1, 8), 16));
        assertEquals(ChunkCoordinate.of(1, 0, 2), ChunkCoordinate.fromWorldPosition(new Point3f(16, 0, 40), 16));

        // Floor division, not truncation
        assertEquals(ChunkCoordinate.of(-1, -1, -2), ChunkCoordinate.fromWorldPosition(new Point3f(-0.5f, -16, -17), 16));
    }

    @Test
    public void testFromWorldPositionRejectsBadChunkSize() {
        assertThrows(IllegalArgumentException.class,
                     () -> ChunkCoordinate.fromWorldPosition(new Point3f(), 0));
    }

    @Test
    public void testOffset() {
        var coord = ChunkCoordinate.of(1, 2, 3).offset(-1, 0, 4);
        assertEquals(ChunkCoordinate.of(0, 2, 7), coord);
    }

    @Test
    public void testDistances() {
        var a = ChunkCoordinate.of(0, 0, 0);
        var b = ChunkCoordinate.of(3, 4, 0);
        assertEquals(25, a.distanceSquared(b));
        assertEquals(5.0, a.distance(b), 1e-9);
        assertEquals(3.0, a.horizontalDistance(b), 1e-9);
        assertEquals(4, a.chebyshevDistance(b));

        var c = ChunkCoordinate.of(1, 2, 3);
        var d = ChunkCoordinate.of(4, 6, 8);
        assertEquals(50, c.distanceSquared(d));
        assertEquals(d.distanceSquared(c), c.distanceSquared(d));
    }

    @Test
    public void testCenter() {
        var center = ChunkCoordinate.of(1, 0, -1).center(16);
        assertEquals(24f, center.x, 1e-6);
        assertEquals(8f, center.y, 1e-6);
        assertEquals(-8f, center.z, 1e-6);
    }

    @Test
    public void testEqualsAndHashCode() {
        var p1 = ChunkCoordinate.of(1, 2, 3);
        var p2 = ChunkCoordinate.of(1, 2, 3);
        var p3 = ChunkCoordinate.of(3, 2, 1);

        assertEquals(p1, p2);
        assertEquals(p1.hashCode(), p2.hashCode());
        assertNotEquals(p1, p3);
        assertNotEquals(p1.hashCode(), p3.hashCode());
        assertNotEquals(p1, null);
        assertNotEquals(p1, "not a coordinate");
    }

    @Test
    public void testHashSpreadOverNeighborhood() {
        var hashes = new HashSet<Integer>();
        for (int x = -4; x <= 4; x++) {
            for (int y = -1; y <= 1; y++) {
                for (int z = -4; z <= 4; z++) {
                    hashes.add(ChunkCoordinate.of(x, y, z).hashCode());
                }
            }
        }
        assertEquals(9 * 3 * 9, hashes.size());
    }

    @Test
    public void testToString() {
        var str = ChunkCoordinate.of(1, -2, 3).toString();
        assertTrue(str.contains("ChunkCoordinate"));
        assertTrue(str.contains("-2"));
    }
}
