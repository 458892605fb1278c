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

package com.hellblazer.chunkstream.common;

import java.util.Arrays;
import java.util.Objects;

/**
 * Opaque chunk content plus the generation flags the durable store keeps alongside it.
 * <p>
 * Payloads never share their backing array: the constructor copies its input and {@link #data()} returns a copy, so
 * the cache, the store and callbacks each hold an independent value.
 *
 * @author hal.hildebrand
 */
public final class ChunkPayload {

    private static final byte[] EMPTY = new byte[0];

    private final byte[]  data;
    private final boolean generated;
    private final boolean populated;
    private final long    modifiedAt;

    public ChunkPayload(byte[] data, boolean generated, boolean populated, long modifiedAt) {
        Objects.requireNonNull(data, "data");
        this.data = data.length == 0 ? EMPTY : data.clone();
        this.generated = generated;
        this.populated = populated;
        this.modifiedAt = modifiedAt;
    }

    /**
     * A generated, unpopulated payload stamped with the current time.
     */
    public static ChunkPayload of(byte[] data) {
        return new ChunkPayload(data, true, false, System.currentTimeMillis());
    }

    /**
     * Placeholder returned by a store that has no content for a coordinate.
     */
    public static ChunkPayload notGenerated() {
        return new ChunkPayload(EMPTY, false, false, 0L);
    }

    /**
     * @return a copy of the content bytes
     */
    public byte[] data() {
        return data.length == 0 ? EMPTY : data.clone();
    }

    public int size() {
        return data.length;
    }

    /**
     * @return true if the store actually has content for this chunk, false for a placeholder
     */
    public boolean isGenerated() {
        return generated;
    }

    public boolean isPopulated() {
        return populated;
    }

    public long modifiedAt() {
        return modifiedAt;
    }

    public ChunkPayload copy() {
        return new ChunkPayload(data, generated, populated, modifiedAt);
    }

    /**
     * @return a copy with new content, marked generated and stamped with the given time
     */
    public ChunkPayload withData(byte[] newData, long timestamp) {
        return new ChunkPayload(newData, true, populated, timestamp);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChunkPayload that)) return false;
        return generated == that.generated && populated == that.populated && modifiedAt == that.modifiedAt
        && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(generated, populated, modifiedAt) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return String.format("ChunkPayload{size=%d, generated=%s, populated=%s, modifiedAt=%d}", data.length,
                             generated, populated, modifiedAt);
    }
}
