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
package io.tileverse.chunkcache.index;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of cache entries and of the byte intervals downloaded for each of them.
 * <p>
 * The index is the only source of truth about what is available on disk: a chunk's bytes may be read from the
 * cache file only once its interval has been {@link #recordChunk recorded}. Implementations must be thread-safe.
 */
public interface CacheIndex {

    Optional<CacheEntry> findEntry(long entryId) throws IOException;

    Optional<CacheEntry> findEntry(CacheEntryKey key) throws IOException;

    /**
     * Returns the entry for {@code key}, creating it if it doesn't exist yet. An existing entry is returned
     * unchanged, even if {@code originalUrl} differs.
     */
    CacheEntry getOrCreateEntry(CacheEntryKey key, URI originalUrl, Path filePath) throws IOException;

    void updateExpectedTotalSize(long entryId, long totalSize) throws IOException;

    void markComplete(long entryId) throws IOException;

    void markAccessed(long entryId) throws IOException;

    /**
     * @return {@code true} iff a single recorded interval of the entry fully covers {@code [start, end)}
     */
    boolean chunkExists(long entryId, long start, long end) throws IOException;

    /**
     * Records {@code [start, end)} as downloaded. Recording the same interval twice has no effect.
     */
    void recordChunk(long entryId, long start, long end) throws IOException;

    /**
     * @return every interval recorded for the entry, ordered by start byte
     */
    List<ChunkRecord> listChunks(long entryId) throws IOException;

    /**
     * Forgets every recorded interval overlapping {@code [start, end)} and clears the entry's completeness flag.
     *
     * @return the number of records removed
     */
    int deleteChunksInRange(long entryId, long start, long end) throws IOException;

    default long coveredBytes(long entryId) throws IOException {
        return Coverage.coveredBytes(listChunks(entryId));
    }
}
