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
import com.hellblazer.chunkstream.store.ChunkStore;
import com.hellblazer.chunkstream.store.InMemoryChunkStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * In-memory store whose loads and saves can be held at a gate, failed, or made to throw.
 */
class ControllableChunkStore implements ChunkStore {

    final InMemoryChunkStore          delegate  = new InMemoryChunkStore();
    final List<ChunkCoordinate>       loadOrder = Collections.synchronizedList(new ArrayList<>());
    final List<ChunkCoordinate>       saveOrder = Collections.synchronizedList(new ArrayList<>());
    private volatile CountDownLatch   loadGate;
    private volatile CountDownLatch   saveGate;
    private volatile boolean          failSaves;
    private volatile RuntimeException loadFailure;
    private volatile boolean          available = true;

    static void await(BooleanSupplier condition, long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("Condition not reached within " + timeoutMillis + "ms");
            }
            Thread.sleep(5);
        }
    }

    void closeLoadGate() {
        loadGate = new CountDownLatch(1);
    }

    void openLoadGate() {
        var gate = loadGate;
        if (gate != null) {
            gate.countDown();
        }
    }

    void closeSaveGate() {
        saveGate = new CountDownLatch(1);
    }

    void openSaveGate() {
        var gate = saveGate;
        if (gate != null) {
            gate.countDown();
        }
    }

    void setFailSaves(boolean failSaves) {
        this.failSaves = failSaves;
    }

    void setLoadFailure(RuntimeException failure) {
        this.loadFailure = failure;
    }

    void setAvailable(boolean available) {
        this.available = available;
    }

    void seed(ChunkCoordinate coordinate, ChunkPayload payload) {
        delegate.saveChunk(coordinate, payload);
    }

    @Override
    public ChunkPayload loadChunk(ChunkCoordinate coordinate) {
        pass(loadGate);
        loadOrder.add(coordinate);
        var failure = loadFailure;
        if (failure != null) {
            throw failure;
        }
        return delegate.loadChunk(coordinate);
    }

    @Override
    public boolean saveChunk(ChunkCoordinate coordinate, ChunkPayload payload) {
        pass(saveGate);
        if (failSaves) {
            return false;
        }
        saveOrder.add(coordinate);
        return delegate.saveChunk(coordinate, payload);
    }

    @Override
    public boolean isChunkGenerated(ChunkCoordinate coordinate) {
        return delegate.isChunkGenerated(coordinate);
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    int loadCount(ChunkCoordinate coordinate) {
        synchronized (loadOrder) {
            return (int) loadOrder.stream().filter(coordinate::equals).count();
        }
    }

    private static void pass(CountDownLatch gate) {
        if (gate == null) {
            return;
        }
        try {
            if (!gate.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Gate never opened");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted at gate", e);
        }
    }
}
