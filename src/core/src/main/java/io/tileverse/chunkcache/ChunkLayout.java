/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.chunkcache;

import io.tileverse.chunkcache.io.ByteRange;
import java.util.OptionalLong;
import java.util.stream.LongStream;

/**
 * Fixed-size chunk arithmetic.
 * <p>
 * Chunk {@code i} covers {@code [i * chunkSize, min((i + 1) * chunkSize, totalSize))}. While the
 * total size of a resource is unknown, chunks are assumed to be full.
 */
public final class ChunkLayout {

    /** Default chunk size, 10 MiB. */
    public static final long DEFAULT_CHUNK_SIZE = 10L * 1024 * 1024;

    private final long chunkSize;

    public ChunkLayout(long chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
        }
        this.chunkSize = chunkSize;
    }

    public long chunkSize() {
        return chunkSize;
    }

    public long indexOf(long offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative: " + offset);
        }
        return offset / chunkSize;
    }

    /**
     * @param totalSize the resource size
     * @return the number of chunks needed to cover {@code totalSize} bytes
     */
    public long chunkCount(long totalSize) {
        return (totalSize + chunkSize - 1) / chunkSize;
    }

    /**
     * @return whether {@code index} addresses a chunk of a resource of the given size, any non-negative index
     *     is valid while the size is unknown
     */
    public boolean isValidIndex(long index, OptionalLong totalSize) {
        return index >= 0 && (totalSize.isEmpty() || index < chunkCount(totalSize.getAsLong()));
    }

    /**
     * Computes the byte bounds of a chunk.
     *
     * @param index the chunk index
     * @param totalSize the resource size, if known
     * @return the chunk bounds, truncated at {@code totalSize}
     * @throws IllegalArgumentException if the index is out of bounds
     */
    public ByteRange bounds(long index, OptionalLong totalSize) {
        if (!isValidIndex(index, totalSize)) {
            throw new IllegalArgumentException("Chunk index %d out of bounds for size %s".formatted(index, totalSize));
        }
        long start = index * chunkSize;
        long end = start + chunkSize;
        if (totalSize.isPresent()) {
            end = Math.min(end, totalSize.getAsLong());
        }
        return ByteRange.between(start, end);
    }

    /**
     * @return the indices of every chunk overlapping {@code range}, in ascending order
     */
    public LongStream indicesOverlapping(ByteRange range) {
        if (range.isEmpty()) {
            return LongStream.empty();
        }
        return LongStream.rangeClosed(indexOf(range.offset()), indexOf(range.last()));
    }

    @Override
    public String toString() {
        return "ChunkLayout[chunkSize=" + chunkSize + "]";
    }
}
