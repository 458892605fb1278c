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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool of I/O workers draining an {@link IOScheduler}. Each worker loops until the scheduler shuts down; a
 * failing request is logged and the loop carries on.
 *
 * @author hal.hildebrand
 */
public class IOWorkerPool {

    /**
     * Executes one request against the store.
     */
    @FunctionalInterface
    public interface IORequestHandler {
        /**
         * @return the value the request's future completes with
         */
        boolean handle(IORequest request);
    }

    private static final Logger log = LoggerFactory.getLogger(IOWorkerPool.class);

    private final IOScheduler      scheduler;
    private final IORequestHandler handler;
    private final int              workerCount;
    private final ExecutorService  executor;
    private final AtomicInteger    active = new AtomicInteger();

    public IOWorkerPool(IOScheduler scheduler, IORequestHandler handler, int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("Worker count must be positive: " + workerCount);
        }
        this.scheduler = scheduler;
        this.handler = handler;
        this.workerCount = workerCount;
        var threadIds = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(workerCount, r -> {
            var thread = new Thread(r, "ChunkIO-" + threadIds.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public void start() {
        for (int i = 0; i < workerCount; i++) {
            executor.submit(this::workerLoop);
        }
        log.debug("Started {} chunk I/O workers", workerCount);
    }

    /**
     * Shut the scheduler down, fail whatever was still queued and wait for in-flight requests.
     *
     * @return true if every worker finished within the timeout
     */
    public boolean shutdown(Duration timeout) {
        var drained = scheduler.shutdown();
        for (var request : drained) {
            request.future().complete(false);
        }
        if (!drained.isEmpty()) {
            log.debug("Discarded {} queued I/O requests on shutdown", drained.size());
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("I/O workers did not finish within {}, interrupting", timeout);
                executor.shutdownNow();
                return false;
            }
            return true;
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public int activeWorkers() {
        return active.get();
    }

    public int workerCount() {
        return workerCount;
    }

    private void workerLoop() {
        while (true) {
            IORequest request;
            try {
                request = scheduler.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (request == null) {
                return;
            }
            active.incrementAndGet();
            try {
                request.future().complete(handler.handle(request));
            } catch (RuntimeException e) {
                log.error("I/O worker failed on {}", request, e);
                request.future().complete(false);
            } finally {
                active.decrementAndGet();
                scheduler.complete(request);
            }
        }
    }
}
