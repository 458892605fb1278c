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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InMemoryChunkStore
 */
public class InMemoryChunkStoreTest {

    private InMemoryChunkStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryChunkStore();
    }

    @Test
    void testMissLoadsPlaceholder() {
        var loaded = store.loadChunk(ChunkCoordinate.origin());
        assertFalse(loaded.isGenerated());
        assertEquals(1, store.getLoadCount());
    }

    @Test
    void testSaveAndLoad() {
        var coord = ChunkCoordinate.of(1, 2, 3);
        var payload = ChunkPayload.of(new byte[] { 1, 2 });
        assertTrue(store.saveChunk(coord, payload));
        assertEquals(payload, store.loadChunk(coord));
        assertTrue(store.isChunkGenerated(coord));
        assertEquals(1, store.getSaveCount());
        assertEquals(1, store.size());
    }

    @Test
    void testUnavailableStoreRejectsSaves() {
        store.setAvailable(false);
        assertFalse(store.isAvailable());
        assertFalse(store.saveChunk(ChunkCoordinate.origin(), ChunkPayload.of(new byte[] { 1 })));
        assertNull(store.peek(ChunkCoordinate.origin()));
    }

    @Test
    void testDeleteAndRadius() {
        store.saveChunk(ChunkCoordinate.of(0, 0, 0), ChunkPayload.of(new byte[] { 1 }));
        store.saveChunk(ChunkCoordinate.of(5, 0, 0), ChunkPayload.of(new byte[] { 1 }));
        assertEquals(1, store.chunksInRadius(ChunkCoordinate.origin(), 2.0).size());
        assertTrue(store.deleteChunk(ChunkCoordinate.of(5, 0, 0)));
        assertFalse(store.deleteChunk(ChunkCoordinate.of(5, 0, 0)));
    }

    @Test
    void testDefaultOperationsAreOptional() {
        ChunkStore minimal = new ChunkStore() {
            @Override
            public ChunkPayload loadChunk(ChunkCoordinate coordinate) {
                return ChunkPayload.notGenerated();
            }

            @Override
            public boolean saveChunk(ChunkCoordinate coordinate, ChunkPayload payload) {
                return true;
            }

            @Override
            public boolean isChunkGenerated(ChunkCoordinate coordinate) {
                return false;
            }
        };
        assertTrue(minimal.isAvailable());
        assertThrows(UnsupportedOperationException.class, () -> minimal.deleteChunk(ChunkCoordinate.origin()));
        assertThrows(UnsupportedOperationException.class,
                     () -> minimal.chunksInRadius(ChunkCoordinate.origin(), 1));
    }
}
