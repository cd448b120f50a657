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

import io.tileverse.chunkcache.io.ByteRange;
import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Non-durable {@link CacheIndex}, for tests and ephemeral caches.
 */
public class InMemoryCacheIndex implements CacheIndex {

    private final Clock clock;

    private final Map<Long, CacheEntry> entries = new HashMap<>();
    private final Map<CacheEntryKey, Long> entryIds = new HashMap<>();
    private final Map<Long, TreeMap<ByteRange, ChunkRecord>> chunks = new HashMap<>();
    private long nextId = 1;

    public InMemoryCacheIndex() {
        this(Clock.systemUTC());
    }

    public InMemoryCacheIndex(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Optional<CacheEntry> findEntry(long entryId) {
        return Optional.ofNullable(entries.get(entryId));
    }

    @Override
    public synchronized Optional<CacheEntry> findEntry(CacheEntryKey key) {
        return Optional.ofNullable(entryIds.get(key)).map(entries::get);
    }

    @Override
    public synchronized CacheEntry getOrCreateEntry(CacheEntryKey key, URI originalUrl, Path filePath) {
        Long id = entryIds.get(key);
        if (id != null) {
            return entries.get(id);
        }
        Instant now = clock.instant();
        CacheEntry entry = new CacheEntry(nextId++, key, originalUrl, filePath, null, false, now, now);
        entries.put(entry.id(), entry);
        entryIds.put(key, entry.id());
        chunks.put(entry.id(), new TreeMap<>());
        return entry;
    }

    @Override
    public synchronized void updateExpectedTotalSize(long entryId, long totalSize) throws CacheIndexException {
        entries.put(entryId, require(entryId).withExpectedTotalSize(totalSize));
    }

    @Override
    public synchronized void markComplete(long entryId) throws CacheIndexException {
        entries.put(entryId, require(entryId).withComplete(true));
    }

    @Override
    public synchronized void markAccessed(long entryId) throws CacheIndexException {
        entries.put(entryId, require(entryId).withLastAccessed(clock.instant()));
    }

    @Override
    public synchronized boolean chunkExists(long entryId, long start, long end) {
        TreeMap<ByteRange, ChunkRecord> records = chunks.get(entryId);
        if (records == null) {
            return false;
        }
        // candidates start at or before 'start'
        for (ChunkRecord r : records.headMap(ByteRange.of(start, Long.MAX_VALUE - start), true).values()) {
            if (r.covers(start, end)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public synchronized void recordChunk(long entryId, long start, long end) throws CacheIndexException {
        require(entryId);
        ChunkRecord chunk = new ChunkRecord(entryId, start, end, clock.instant());
        chunks.get(entryId).putIfAbsent(ByteRange.between(start, end), chunk);
    }

    @Override
    public synchronized List<ChunkRecord> listChunks(long entryId) {
        TreeMap<ByteRange, ChunkRecord> records = chunks.get(entryId);
        return records == null ? List.of() : new ArrayList<>(records.values());
    }

    @Override
    public synchronized int deleteChunksInRange(long entryId, long start, long end) throws CacheIndexException {
        CacheEntry entry = require(entryId);
        int removed = 0;
        for (Iterator<ChunkRecord> it = chunks.get(entryId).values().iterator(); it.hasNext(); ) {
            ChunkRecord r = it.next();
            if (r.startByte() < end && start < r.endByte()) {
                it.remove();
                removed++;
            }
        }
        entries.put(entryId, entry.withComplete(false));
        return removed;
    }

    private CacheEntry require(long entryId) throws CacheIndexException {
        CacheEntry entry = entries.get(entryId);
        if (entry == null) {
            throw new CacheIndexException("Cache entry not found: " + entryId, null);
        }
        return entry;
    }
}
