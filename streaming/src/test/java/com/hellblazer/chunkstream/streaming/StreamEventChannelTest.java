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
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StreamEventChannel delivery modes
 */
public class StreamEventChannelTest {

    @Test
    void testOwnerThreadDeliveryWaitsForDrain() {
        var channel = new StreamEventChannel(EventDelivery.OWNER_THREAD, 8);
        var received = new ArrayList<StreamEvent>();
        channel.addListener(new ChunkStreamListener() {
            @Override
            public void onEvent(StreamEvent event) {
                received.add(event);
            }
        });

        channel.publish(new StreamEvent.ChunkUnloaded(1L, ChunkCoordinate.origin()));
        assertTrue(received.isEmpty());
        assertEquals(1, channel.drain());
        assertEquals(1, received.size());
    }

    @Test
    void testOverflowDropsAndCounts() {
        var channel = new StreamEventChannel(EventDelivery.OWNER_THREAD, 2);
        channel.addListener(new ChunkStreamListener() {
        });
        for (int i = 0; i < 5; i++) {
            channel.publish(new StreamEvent.ChunkSaved(i, ChunkCoordinate.of(i, 0, 0), true));
        }
        assertEquals(3, channel.droppedCount());
        assertEquals(2, channel.drain());
    }

    @Test
    void testNoListenersQueuesNothing() {
        var channel = new StreamEventChannel(EventDelivery.OWNER_THREAD, 1);
        channel.publish(new StreamEvent.ChunkUnloaded(1L, ChunkCoordinate.origin()));
        channel.publish(new StreamEvent.ChunkUnloaded(2L, ChunkCoordinate.origin()));
        assertEquals(0, channel.droppedCount());
        assertEquals(0, channel.queuedCount());
    }

    @Test
    void testDirectDeliveryIsolatesFailingListener() {
        var channel = new StreamEventChannel(EventDelivery.DIRECT, 1);
        var saved = new ArrayList<Boolean>();
        channel.addListener(new ChunkStreamListener() {
            @Override
            public void onChunkSaved(ChunkCoordinate coordinate, boolean success) {
                throw new IllegalStateException("listener bug");
            }
        });
        channel.addListener(new ChunkStreamListener() {
            @Override
            public void onChunkSaved(ChunkCoordinate coordinate, boolean success) {
                saved.add(success);
            }
        });
        channel.publish(new StreamEvent.ChunkSaved(1L, ChunkCoordinate.origin(), false));
        assertEquals(List.of(false), saved);
        assertEquals(0, channel.queuedCount());
    }

    @Test
    void testCallbacksDispatchedByType() {
        var channel = new StreamEventChannel(EventDelivery.DIRECT, 1);
        var calls = new ArrayList<String>();
        var listener = new ChunkStreamListener() {
            @Override
            public void onChunkUnloaded(ChunkCoordinate coordinate) {
                calls.add("unloaded");
            }

            @Override
            public void onError(ChunkCoordinate coordinate, String message) {
                calls.add("error:" + message);
            }
        };
        channel.addListener(listener);
        channel.addListener(listener);
        channel.publish(new StreamEvent.ChunkUnloaded(1L, ChunkCoordinate.origin()));
        channel.publish(new StreamEvent.Error(2L, null, "disk"));
        assertEquals(List.of("unloaded", "error:disk"), calls);

        channel.removeListener(listener);
        channel.publish(new StreamEvent.ChunkUnloaded(3L, ChunkCoordinate.origin()));
        assertEquals(2, calls.size());
    }
}
