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

import com.hellblazer.chunkstream.geometry.ChunkCoordinate;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * File format definitions for persisted chunk records.
 *
 * <p><b>Record Layout V1</b> (big-endian):
 * <pre>
 * [Header: 40 bytes]
 *   magic(4) + version(2) + flags(1) + compression(1) +
 *   x(4) + y(4) + z(4) + modifiedAt(8) +
 *   uncompressedSize(4) + crc32(4) + storedLength(4)
 * [Data: storedLength bytes, DEFLATE compressed when compression == 1]
 * </pre>
 * The CRC32 covers the uncompressed data.
 *
 * @author hal.hildebrand
 */
public final class ChunkFileFormat {

    // "CHNK" in ASCII
    public static final int MAGIC_NUMBER = 0x43484E4B;

    public static final short VERSION_1       = 1;
    public static final short CURRENT_VERSION = VERSION_1;

    public static final int HEADER_SIZE = 40;

    public static final byte FLAG_GENERATED = 0x01;
    public static final byte FLAG_POPULATED = 0x02;

    public static final byte COMPRESSION_NONE    = 0;
    public static final byte COMPRESSION_DEFLATE = 1;

    // Sanity bound on a single chunk record
    public static final int MAX_DATA_SIZE = 64 * 1024 * 1024;

    public static final String FILE_EXTENSION = ".bin";

    private static final Pattern FILE_NAME = Pattern.compile("chunk\\.(-?\\d+)\\.(-?\\d+)\\.(-?\\d+)\\.bin");

    private ChunkFileFormat() {
        // Utility class
    }

    /**
     * File name holding the record for a coordinate.
     */
    public static String fileName(ChunkCoordinate coordinate) {
        return "chunk." + coordinate.x + "." + coordinate.y + "." + coordinate.z + FILE_EXTENSION;
    }

    /**
     * Recover the coordinate from a record file name.
     *
     * @return the coordinate, or empty if the name is not a chunk record
     */
    public static Optional<ChunkCoordinate> parseFileName(String fileName) {
        var matcher = FILE_NAME.matcher(fileName);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new ChunkCoordinate(Integer.parseInt(matcher.group(1)),
                                                   Integer.parseInt(matcher.group(2)),
                                                   Integer.parseInt(matcher.group(3))));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
