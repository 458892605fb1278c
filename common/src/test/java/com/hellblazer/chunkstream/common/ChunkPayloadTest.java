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

package com.hellblazer.chunkstream.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ChunkPayload value semantics.
 */
public class ChunkPayloadTest {

    @Test
    void testDefensiveCopyOnConstruction() {
        var bytes = new byte[] { 1, 2, 3 };
        var payload = new ChunkPayload(bytes, true, false, 42L);
        bytes[0] = 99;
        assertEquals(1, payload.data()[0]);
    }

    @Test
    void testDefensiveCopyOnRead() {
        var payload = ChunkPayload.of(new byte[] { 1, 2, 3 });
        payload.data()[0] = 99;
        assertEquals(1, payload.data()[0]);
        assertEquals(3, payload.size());
    }

    @Test
    void testNotGenerated() {
        var placeholder = ChunkPayload.notGenerated();
        assertFalse(placeholder.isGenerated());
        assertFalse(placeholder.isPopulated());
        assertEquals(0, placeholder.size());
    }

    @Test
    void testValueEquality() {
        var a = new ChunkPayload(new byte[] { 4, 5 }, true, true, 7L);
        var b = new ChunkPayload(new byte[] { 4, 5 }, true, true, 7L);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(a, a.copy());
        assertNotSame(a, a.copy());

        assertNotEquals(a, new ChunkPayload(new byte[] { 4, 6 }, true, true, 7L));
        assertNotEquals(a, new ChunkPayload(new byte[] { 4, 5 }, false, true, 7L));
        assertNotEquals(a, new ChunkPayload(new byte[] { 4, 5 }, true, true, 8L));
    }

    @Test
    void testWithData() {
        var original = new ChunkPayload(new byte[] { 1 }, false, true, 1L);
        var updated = original.withData(new byte[] { 2, 3 }, 10L);
        assertTrue(updated.isGenerated());
        assertTrue(updated.isPopulated());
        assertEquals(10L, updated.modifiedAt());
        assertArrayEquals(new byte[] { 2, 3 }, updated.data());
        assertArrayEquals(new byte[] { 1 }, original.data());
    }

    @Test
    void testNullDataRejected() {
        assertThrows(NullPointerException.class, () -> new ChunkPayload(null, true, false, 0L));
    }
}
