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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link ChunkStore} keeping one record file per chunk under a root directory.
 * <p>
 * Writes go to a temporary file in the same directory which is then moved over the target, so a reader never sees a
 * partially written record. I/O failures are logged and reported through return values.
 *
 * @author hal.hildebrand
 */
public class FileChunkStore implements ChunkStore {
    private static final Logger log = LoggerFactory.getLogger(FileChunkStore.class);

    private final Path       root;
    private final boolean    compress;
    private final boolean    available;
    private final AtomicLong bytesWritten = new AtomicLong();
    private final AtomicLong bytesRead    = new AtomicLong();

    /**
     * Create a compressing store rooted at the given directory, creating it if needed.
     */
    public FileChunkStore(Path root) {
        this(root, true);
    }

    public FileChunkStore(Path root, boolean compress) {
        this.root = Objects.requireNonNull(root, "root");
        this.compress = compress;
        this.available = prepareRoot(root);
    }

    private static boolean prepareRoot(Path root) {
        try {
            Files.createDirectories(root);
            if (!Files.isWritable(root)) {
                log.error("Chunk store directory is not writable: {}", root);
                return false;
            }
            return true;
        } catch (IOException e) {
            log.error("Unable to create chunk store directory {}", root, e);
            return false;
        }
    }

    @Override
    public ChunkPayload loadChunk(ChunkCoordinate coordinate) {
        var file = pathFor(coordinate);
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return ChunkPayload.notGenerated();
        } catch (IOException e) {
            log.warn("Failed to read chunk {} from {}", coordinate, file, e);
            return ChunkPayload.notGenerated();
        }
        bytesRead.addAndGet(bytes.length);
        try {
            var record = ChunkSerializer.deserialize(bytes);
            if (!record.coordinate().equals(coordinate)) {
                log.warn("Chunk file {} holds {} instead of {}", file, record.coordinate(), coordinate);
                return ChunkPayload.notGenerated();
            }
            return record.payload();
        } catch (IOException e) {
            log.warn("Corrupt chunk record {} at {}: {}", coordinate, file, e.getMessage());
            return ChunkPayload.notGenerated();
        }
    }

    @Override
    public boolean saveChunk(ChunkCoordinate coordinate, ChunkPayload payload) {
        if (!available) {
            return false;
        }
        var target = pathFor(coordinate);
        var bytes = ChunkSerializer.serialize(coordinate, payload, compress);
        Path temp = null;
        try {
            temp = Files.createTempFile(root, ChunkFileFormat.fileName(coordinate), ".tmp");
            Files.write(temp, bytes);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            bytesWritten.addAndGet(bytes.length);
            log.trace("Wrote chunk {} ({} bytes)", coordinate, bytes.length);
            return true;
        } catch (IOException e) {
            log.warn("Failed to write chunk {} to {}", coordinate, target, e);
            deleteQuietly(temp);
            return false;
        }
    }

    @Override
    public boolean isChunkGenerated(ChunkCoordinate coordinate) {
        if (!Files.exists(pathFor(coordinate))) {
            return false;
        }
        return loadChunk(coordinate).isGenerated();
    }

    @Override
    public boolean isAvailable() {
        return available && Files.isDirectory(root) && Files.isWritable(root);
    }

    @Override
    public boolean deleteChunk(ChunkCoordinate coordinate) {
        try {
            return Files.deleteIfExists(pathFor(coordinate));
        } catch (IOException e) {
            log.warn("Failed to delete chunk {}", coordinate, e);
            return false;
        }
    }

    @Override
    public Set<ChunkCoordinate> chunksInRadius(ChunkCoordinate center, double radius) {
        var result = new HashSet<ChunkCoordinate>();
        try (var files = Files.list(root)) {
            files.map(p -> ChunkFileFormat.parseFileName(p.getFileName().toString()))
                 .flatMap(Optional::stream)
                 .filter(c -> c.distance(center) <= radius)
                 .forEach(result::add);
        } catch (IOException e) {
            log.warn("Failed to list chunk store directory {}", root, e);
        }
        return result;
    }

    public Path getRoot() {
        return root;
    }

    public long getBytesWritten() {
        return bytesWritten.get();
    }

    public long getBytesRead() {
        return bytesRead.get();
    }

    Path pathFor(ChunkCoordinate coordinate) {
        return root.resolve(ChunkFileFormat.fileName(coordinate));
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.debug("Unable to remove temporary chunk file {}", temp, e);
        }
    }
}
