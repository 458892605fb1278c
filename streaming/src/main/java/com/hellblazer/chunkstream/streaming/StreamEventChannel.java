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

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded event channel between the threads completing chunk operations and the registered listeners.
 * <p>
 * In {@link EventDelivery#OWNER_THREAD} mode, {@link #publish} only enqueues; {@link #drain} dispatches on the
 * calling thread. A full queue drops the event and counts it.
 *
 * @author hal.hildebrand
 */
public class StreamEventChannel {
    private static final Logger log = LoggerFactory.getLogger(StreamEventChannel.class);

    private final EventDelivery                             delivery;
    private final BlockingQueue<StreamEvent>                queue;
    private final CopyOnWriteArrayList<ChunkStreamListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong                                dropped   = new AtomicLong();

    public StreamEventChannel(EventDelivery delivery, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Event queue capacity must be positive: " + capacity);
        }
        this.delivery = delivery;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    public void addListener(ChunkStreamListener listener) {
        listeners.addIfAbsent(listener);
    }

    public void removeListener(ChunkStreamListener listener) {
        listeners.remove(listener);
    }

    public void publish(StreamEvent event) {
        if (delivery == EventDelivery.DIRECT) {
            dispatch(event);
            return;
        }
        if (listeners.isEmpty()) {
            return;
        }
        if (!queue.offer(event)) {
            long count = dropped.incrementAndGet();
            log.warn("Event queue full, dropped {} (total dropped: {})", event.getClass().getSimpleName(), count);
        }
    }

    /**
     * Deliver every queued event on the calling thread.
     *
     * @return number of events delivered
     */
    public int drain() {
        int delivered = 0;
        StreamEvent event;
        while ((event = queue.poll()) != null) {
            dispatch(event);
            delivered++;
        }
        return delivered;
    }

    public long droppedCount() {
        return dropped.get();
    }

    public int queuedCount() {
        return queue.size();
    }

    public EventDelivery delivery() {
        return delivery;
    }

    private void dispatch(StreamEvent event) {
        for (var listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("Listener {} failed on {}", listener, event, e);
            }
        }
    }
}
