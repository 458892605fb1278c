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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ChunkTable state transitions
 */
public class ChunkTableTest {

    private static final ChunkCoordinate C = ChunkCoordinate.of(1, 0, -1);

    private ChunkTable table;

    @BeforeEach
    void setUp() {
        table = new ChunkTable();
    }

    @Test
    void testAdmitLoadIsIdempotent() {
        var first = table.admitLoad(C);
        var second = table.admitLoad(C);
        assertTrue(first.enqueue());
        assertFalse(second.enqueue());
        assertSame(first.future(), second.future());
        assertEquals(ChunkLoadState.QUEUED, table.getState(C));

        assertTrue(table.beginLoad(C, first.future()));
        assertEquals(ChunkLoadState.LOADING, table.getState(C));
        assertEquals(ChunkTable.LoadOutcome.INSTALLED, table.completeLoad(C, first.future(), payload(1)));
        assertEquals(ChunkLoadState.LOADED, table.getState(C));

        var resident = table.admitLoad(C);
        assertFalse(resident.enqueue());
        assertTrue(resident.future().join());
    }

    @Test
    void testFailedLoadReturnsToUnloaded() {
        var ticket = table.admitLoad(C);
        table.beginLoad(C, ticket.future());
        assertTrue(table.failLoad(C, ticket.future()));
        assertEquals(ChunkLoadState.UNLOADED, table.getState(C));
        assertTrue(table.admitLoad(C).enqueue());
    }

    @Test
    void testStaleRequestCannotClaimReadmittedCoordinate() {
        var stale = table.admitLoad(C);
        assertEquals(ChunkTable.Removal.REMOVED_PENDING, table.remove(C, true));
        assertFalse(stale.future().join());

        var fresh = table.admitLoad(C);
        assertFalse(table.beginLoad(C, stale.future()));
        assertTrue(table.beginLoad(C, fresh.future()));
        assertEquals(ChunkTable.LoadOutcome.CANCELLED, table.completeLoad(C, stale.future(), payload(1)));
    }

    @Test
    void testLocalWriteSupersedesInFlightLoad() {
        var ticket = table.admitLoad(C);
        table.beginLoad(C, ticket.future());
        table.installDirty(C, payload(7));
        assertFalse(ticket.future().join());
        assertEquals(ChunkTable.LoadOutcome.SUPERSEDED, table.completeLoad(C, ticket.future(), payload(1)));
        assertEquals(payload(7), table.read(C).orElseThrow());
        assertEquals(ChunkLoadState.DIRTY, table.getState(C));
    }

    @Test
    void testSaveClearsDirtyOnlyForCurrentVersion() {
        table.installDirty(C, payload(1));
        var snapshot = table.snapshotForSave(C);
        assertNotNull(snapshot);
        assertEquals(ChunkLoadState.SAVING, table.getState(C));
        assertTrue(table.isDirty(C));

        table.installDirty(C, payload(2));
        assertFalse(table.completeSave(C, snapshot.version(), true));
        assertTrue(table.isDirty(C));
        assertEquals(ChunkLoadState.DIRTY, table.getState(C));

        var second = table.snapshotForSave(C);
        assertEquals(payload(2), second.payload());
        assertTrue(table.completeSave(C, second.version(), true));
        assertFalse(table.isDirty(C));
        assertEquals(ChunkLoadState.LOADED, table.getState(C));
        assertNull(table.snapshotForSave(C));
    }

    @Test
    void testSaveOfRemovedEntryCannotCleanRecreatedEntry() {
        table.installDirty(C, payload(1));
        var snapshot = table.snapshotForSave(C);
        assertEquals(ChunkTable.Removal.REMOVED_RESIDENT, table.remove(C, false));

        table.installDirty(C, payload(2));
        assertNotEquals(snapshot.version(), table.snapshotForSave(C).version());
        assertFalse(table.completeSave(C, snapshot.version(), true));
        assertTrue(table.isDirty(C));
    }

    @Test
    void testFailedSaveStaysDirty() {
        table.installDirty(C, payload(1));
        var snapshot = table.snapshotForSave(C);
        assertFalse(table.completeSave(C, snapshot.version(), false));
        assertEquals(ChunkLoadState.DIRTY, table.getState(C));
        assertEquals(List.of(C), table.dirtyCoordinates());
    }

    @Test
    void testMarkDirtyRequiresResidentChunk() {
        assertFalse(table.markDirty(C));
        var ticket = table.admitLoad(C);
        assertFalse(table.markDirty(C));
        table.beginLoad(C, ticket.future());
        table.completeLoad(C, ticket.future(), payload(3));
        assertTrue(table.markDirty(C));
        assertEquals(ChunkLoadState.DIRTY, table.getState(C));
        assertEquals(1, table.dirtyCount());
    }

    @Test
    void testRemoveRespectsDirtyWhenRequired() {
        table.installDirty(C, payload(1));
        assertEquals(ChunkTable.Removal.STILL_DIRTY, table.remove(C, true));
        assertEquals(ChunkTable.Removal.REMOVED_RESIDENT, table.remove(C, false));
        assertEquals(0, table.dirtyCount());
        assertEquals(ChunkTable.Removal.ABSENT, table.remove(C, false));
    }

    @Test
    void testLeastRecentlyUsedOrdering() {
        var a = ChunkCoordinate.of(0, 0, 0);
        var b = ChunkCoordinate.of(1, 0, 0);
        var c = ChunkCoordinate.of(2, 0, 0);
        table.installDirty(a, payload(1));
        table.installDirty(b, payload(2));
        table.installDirty(c, payload(3));
        table.read(a);

        assertEquals(List.of(b, c), table.leastRecentlyUsed(2));
        assertEquals(List.of(b, c, a), table.leastRecentlyUsed(10));
        assertTrue(table.lastAccess(a) > table.lastAccess(c));
        assertEquals(List.of(), table.leastRecentlyUsed(0));
    }

    @Test
    void testReadReturnsCopy() {
        table.installDirty(C, payload(5));
        var read = table.read(C).orElseThrow();
        assertNotSame(read, table.read(C).orElseThrow());
        assertTrue(table.read(ChunkCoordinate.origin()).isEmpty());
    }

    @Test
    void testDiscardPendingCompletesWaiters() {
        var a = table.admitLoad(ChunkCoordinate.of(0, 0, 0));
        var b = table.admitLoad(ChunkCoordinate.of(0, 1, 0));
        table.installDirty(C, payload(1));
        assertEquals(2, table.pendingCount());

        assertEquals(2, table.discardPending());
        assertFalse(a.future().join());
        assertFalse(b.future().join());
        assertEquals(1, table.size());
        assertEquals(1, table.residentCount());
    }

    private static ChunkPayload payload(int value) {
        return new ChunkPayload(new byte[] { (byte) value }, true, false, 1000L);
    }
}
