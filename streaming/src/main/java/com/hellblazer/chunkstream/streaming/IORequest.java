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

import java.util.concurrent.CompletableFuture;

/**
 * A queued unit of store I/O. Ordered by priority (higher first) and then by submission sequence, so requests of
 * equal priority are serviced in the order they were submitted.
 * <p>
 * Save requests carry no payload: the worker snapshots the freshest in-memory copy when it executes the request.
 *
 * @author hal.hildebrand
 */
public final class IORequest implements Comparable<IORequest> {

    public enum Type {
        LOAD, SAVE
    }

    private final Type                       type;
    private final ChunkCoordinate            coordinate;
    private final int                        priority;
    private final long                       submittedAt;
    private final long                       sequence;
    private final CompletableFuture<Boolean> future;

    IORequest(Type type, ChunkCoordinate coordinate, int priority, long sequence, CompletableFuture<Boolean> future) {
        this.type = type;
        this.coordinate = coordinate;
        this.priority = priority;
        this.sequence = sequence;
        this.future = future;
        this.submittedAt = System.nanoTime();
    }

    @Override
    public int compareTo(IORequest other) {
        int c = Integer.compare(other.priority, priority);
        return c != 0 ? c : Long.compare(sequence, other.sequence);
    }

    public ChunkCoordinate coordinate() {
        return coordinate;
    }

    public CompletableFuture<Boolean> future() {
        return future;
    }

    public int priority() {
        return priority;
    }

    public long sequence() {
        return sequence;
    }

    public long submittedAt() {
        return submittedAt;
    }

    public Type type() {
        return type;
    }

    @Override
    public String toString() {
        return String.format("IORequest[%s %s priority=%d seq=%d]", type, coordinate, priority, sequence);
    }
}
