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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Running average of operation latency.
 *
 * @author hal.hildebrand
 */
class LatencyTracker {
    private final AtomicLong count      = new AtomicLong();
    private final AtomicLong totalNanos = new AtomicLong();

    void record(long startNanos) {
        totalNanos.addAndGet(System.nanoTime() - startNanos);
        count.incrementAndGet();
    }

    double averageMillis() {
        long n = count.get();
        return n == 0 ? 0.0 : totalNanos.get() / (double) n / 1_000_000.0;
    }

    long count() {
        return count.get();
    }
}
