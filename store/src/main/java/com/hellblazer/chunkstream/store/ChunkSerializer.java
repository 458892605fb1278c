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

package com.hellblazer.chunkstream.store;

import com.hellblazer.chunkstream.common.ChunkPayload;
import com.hellblazer.chunkstream.geometry.ChunkCoordinate;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.zip.CRC32;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

import static com.hellblazer.chunkstream.store.ChunkFileFormat.*;

/**
 * Encodes and decodes chunk records in the {@link ChunkFileFormat} layout.
 *
 * @author hal.hildebrand
 * @see ChunkFileFormat
 */
public final class ChunkSerializer {

    /**
     * A decoded record.
     */
    public record ChunkRecord(ChunkCoordinate coordinate, ChunkPayload payload) {
    }

    private ChunkSerializer() {
        // Utility class
    }

    /**
     * Encode a payload.
     *
     * @param coordinate chunk address written into the header
     * @param payload    content to encode
     * @param compress   DEFLATE the data section
     */
    public static byte[] serialize(ChunkCoordinate coordinate, ChunkPayload payload, boolean compress) {
        var raw = payload.data();
        var crc = new CRC32();
        crc.update(raw);

        var stored = compress ? deflate(raw) : raw;

        byte flags = 0;
        if (payload.isGenerated()) {
            flags |= FLAG_GENERATED;
        }
        if (payload.isPopulated()) {
            flags |= FLAG_POPULATED;
        }

        var buffer = ByteBuffer.allocate(HEADER_SIZE + stored.length);
        buffer.putInt(MAGIC_NUMBER);
        buffer.putShort(CURRENT_VERSION);
        buffer.put(flags);
        buffer.put(compress ? COMPRESSION_DEFLATE : COMPRESSION_NONE);
        buffer.putInt(coordinate.x);
        buffer.putInt(coordinate.y);
        buffer.putInt(coordinate.z);
        buffer.putLong(payload.modifiedAt());
        buffer.putInt(raw.length);
        buffer.putInt((int) crc.getValue());
        buffer.putInt(stored.length);
        buffer.put(stored);
        return buffer.array();
    }

    /**
     * Decode a record.
     *
     * @throws IOException if the record is truncated, has an unknown magic, version or compression, or fails its
     *                     checksum
     */
    public static ChunkRecord deserialize(byte[] bytes) throws IOException {
        var buffer = ByteBuffer.wrap(bytes);
        try {
            int magic = buffer.getInt();
            if (magic != MAGIC_NUMBER) {
                throw new IOException(String.format("Invalid chunk record magic: 0x%08X", magic));
            }
            short version = buffer.getShort();
            if (version != VERSION_1) {
                throw new IOException("Unsupported chunk record version: " + version);
            }
            byte flags = buffer.get();
            byte compression = buffer.get();
            var coordinate = new ChunkCoordinate(buffer.getInt(), buffer.getInt(), buffer.getInt());
            long modifiedAt = buffer.getLong();
            int uncompressedSize = buffer.getInt();
            int expectedCrc = buffer.getInt();
            int storedLength = buffer.getInt();
            if (storedLength < 0 || storedLength > MAX_DATA_SIZE || uncompressedSize < 0
            || uncompressedSize > MAX_DATA_SIZE) {
                throw new IOException("Corrupt chunk record lengths: stored=" + storedLength + ", uncompressed="
                                      + uncompressedSize);
            }
            var stored = new byte[storedLength];
            buffer.get(stored);

            byte[] raw = switch (compression) {
                case COMPRESSION_NONE -> stored;
                case COMPRESSION_DEFLATE -> inflate(stored, uncompressedSize);
                default -> throw new IOException("Unknown chunk compression: " + compression);
            };
            if (raw.length != uncompressedSize) {
                throw new IOException("Chunk size mismatch for " + coordinate + ": expected " + uncompressedSize
                                      + ", got " + raw.length);
            }
            var crc = new CRC32();
            crc.update(raw);
            if ((int) crc.getValue() != expectedCrc) {
                throw new IOException("Checksum mismatch for " + coordinate);
            }

            var payload = new ChunkPayload(raw, (flags & FLAG_GENERATED) != 0, (flags & FLAG_POPULATED) != 0,
                                           modifiedAt);
            return new ChunkRecord(coordinate, payload);
        } catch (BufferUnderflowException e) {
            throw new IOException("Truncated chunk record (" + bytes.length + " bytes)", e);
        }
    }

    private static byte[] deflate(byte[] raw) {
        var deflater = new Deflater(Deflater.BEST_SPEED);
        try {
            deflater.setInput(raw);
            deflater.finish();
            var out = new ByteArrayOutputStream(Math.max(64, raw.length / 2));
            var chunk = new byte[8192];
            while (!deflater.finished()) {
                int n = deflater.deflate(chunk);
                out.write(chunk, 0, n);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    private static byte[] inflate(byte[] stored, int uncompressedSize) throws IOException {
        var inflater = new Inflater();
        try {
            inflater.setInput(stored);
            var raw = new byte[uncompressedSize];
            int offset = 0;
            while (offset < uncompressedSize && !inflater.finished()) {
                int n = inflater.inflate(raw, offset, uncompressedSize - offset);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new IOException("Truncated compressed chunk data");
                }
                offset += n;
            }
            if (offset != uncompressedSize) {
                throw new IOException("Compressed chunk data shorter than declared size");
            }
            return raw;
        } catch (DataFormatException e) {
            throw new IOException("Corrupt compressed chunk data", e);
        } finally {
            inflater.end();
        }
    }
}
