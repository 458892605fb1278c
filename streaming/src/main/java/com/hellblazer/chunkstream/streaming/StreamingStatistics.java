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

/**
 * Snapshot of streaming engine counters.
 *
 * @param loaded        resident chunks (LOADED, DIRTY or SAVING)
 * @param dirty         chunks not yet durably persisted
 * @param pendingLoads  load requests queued or executing
 * @param pendingSaves  save requests queued or executing
 * @param avgLoadMs     mean store load latency
 * @param avgSaveMs     mean store save latency
 * @param queued        requests waiting in the scheduler
 * @param evictions     chunks removed by LRU eviction
 * @param loadFailures  loads that missed or threw
 * @param saveFailures  saves the store rejected or threw on
 * @param droppedEvents events dropped because the event queue was full
 * @author hal.hildebrand
 */
public record StreamingStatistics(int loaded, int dirty, int pendingLoads, int pendingSaves, double avgLoadMs,
                                  double avgSaveMs, int queued, long evictions, long loadFailures, long saveFailures,
                                  long droppedEvents) {

    @Override
    public String toString() {
        return String.format(
        "StreamingStatistics[loaded=%d, dirty=%d, pendingLoads=%d, pendingSaves=%d, avgLoad=%.2fms, avgSave=%.2fms, queued=%d, evictions=%d, loadFailures=%d, saveFailures=%d, droppedEvents=%d]",
        loaded, dirty, pendingLoads, pendingSaves, avgLoadMs, avgSaveMs, queued, evictions, loadFailures,
        saveFailures, droppedEvents);
    }
}
