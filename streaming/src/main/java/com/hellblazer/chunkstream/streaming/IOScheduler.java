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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Priority queue of pending store I/O shared by the worker pool.
 * <p>
 * Tracks requests that have been taken but not yet completed, so callers can wait for the queue to go fully idle.
 * After {@link #shutdown()} no request is accepted and {@link #take()} returns null.
 *
 * @author hal.hildebrand
 */
public class IOScheduler {

    /**
     * Point-in-time queue counters.
     */
    public record Snapshot(int queued, int inFlight, int pendingLoads, int pendingSaves) {
    }

    private final ReentrantLock            lock     = new ReentrantLock();
    private final Condition                notEmpty = lock.newCondition();
    private final Condition                idle     = lock.newCondition();
    private final PriorityQueue<IORequest> queue    = new PriorityQueue<>();
    private long                           sequence;
    private int                            inFlight;
    private int                            loadsInFlight;
    private int                            savesInFlight;
    private int                            queuedLoads;
    private int                            queuedSaves;
    private boolean                        shutdown;

    /**
     * Create and enqueue a request.
     *
     * @return the request, or null if the scheduler has shut down
     */
    public IORequest submit(IORequest.Type type, ChunkCoordinate coordinate, int priority,
                            CompletableFuture<Boolean> future) {
        lock.lock();
        try {
            if (shutdown) {
                return null;
            }
            var request = new IORequest(type, coordinate, priority, sequence++, future);
            queue.add(request);
            if (type == IORequest.Type.LOAD) {
                queuedLoads++;
            } else {
                queuedSaves++;
            }
            notEmpty.signal();
            return request;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block until a request is available.
     *
     * @return the highest priority request, or null once the scheduler has shut down
     */
    public IORequest take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty() && !shutdown) {
                notEmpty.await();
            }
            if (shutdown) {
                return null;
            }
            var request = queue.poll();
            inFlight++;
            if (request.type() == IORequest.Type.LOAD) {
                queuedLoads--;
                loadsInFlight++;
            } else {
                queuedSaves--;
                savesInFlight++;
            }
            return request;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Mark a taken request as finished.
     */
    public void complete(IORequest request) {
        lock.lock();
        try {
            inFlight--;
            if (request.type() == IORequest.Type.LOAD) {
                loadsInFlight--;
            } else {
                savesInFlight--;
            }
            if (inFlight == 0 && queue.isEmpty()) {
                idle.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait until nothing is queued or in flight.
     *
     * @return true if idle, false if the timeout elapsed first
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (inFlight > 0 || !queue.isEmpty()) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = idle.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isIdle() {
        lock.lock();
        try {
            return inFlight == 0 && queue.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public boolean isShutdown() {
        lock.lock();
        try {
            return shutdown;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop accepting requests and wake every waiting worker.
     *
     * @return the requests that were still queued, in service order
     */
    public List<IORequest> shutdown() {
        lock.lock();
        try {
            shutdown = true;
            var drained = new ArrayList<IORequest>(queue.size());
            while (!queue.isEmpty()) {
                drained.add(queue.poll());
            }
            queuedLoads = 0;
            queuedSaves = 0;
            notEmpty.signalAll();
            if (inFlight == 0) {
                idle.signalAll();
            }
            return drained;
        } finally {
            lock.unlock();
        }
    }

    public Snapshot snapshot() {
        lock.lock();
        try {
            return new Snapshot(queue.size(), inFlight, queuedLoads + loadsInFlight, queuedSaves + savesInFlight);
        } finally {
            lock.unlock();
        }
    }
}
