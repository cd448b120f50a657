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

import static java.util.Objects.requireNonNull;

import io.tileverse.chunkcache.index.CacheEntry;
import io.tileverse.chunkcache.index.CacheIndex;
import io.tileverse.chunkcache.io.ByteRange;
import io.tileverse.chunkcache.manager.ChunkManager;
import io.tileverse.chunkcache.store.ChunkStore;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link RangeReader} over one cache entry.
 * <p>
 * Missing chunks are requested at {@link Priority#CRITICAL CRITICAL} priority and waited for, up to the configured
 * timeout. If reading bytes the index reports as cached fails, the range is invalidated and downloaded again
 * once before giving up.
 * <p>
 * Readers don't own the cache resources, closing one has no effect.
 */
public class ChunkCacheReader extends AbstractRangeReader {

    private static final Logger logger = LoggerFactory.getLogger(ChunkCacheReader.class);

    private final long entryId;
    private final CacheIndex index;
    private final ChunkStore store;
    private final ChunkManager manager;
    private final Duration waitTimeout;

    ChunkCacheReader(long entryId, CacheIndex index, ChunkStore store, ChunkManager manager, Duration waitTimeout) {
        this.entryId = entryId;
        this.index = requireNonNull(index);
        this.store = requireNonNull(store);
        this.manager = requireNonNull(manager);
        this.waitTimeout = requireNonNull(waitTimeout);
    }

    public long entryId() {
        return entryId;
    }

    @Override
    protected int readRangeNoFlip(final long offset, int actualLength, ByteBuffer target) throws IOException {
        CacheEntry entry = entry();
        if (entry.expectedSize().isEmpty()) {
            // the first download reveals the size, clip to it before waiting for the rest
            manager.fetchChunk(entryId, manager.layout().indexOf(offset), Priority.CRITICAL, waitTimeout);
            entry = entry();
            long size = entry.expectedSize().orElse(Long.MAX_VALUE);
            if (offset >= size) {
                return 0;
            }
            actualLength = (int) Math.min(actualLength, size - offset);
        }
        final ByteRange range = ByteRange.of(offset, actualLength);
        if (manager.hasByteRange(entryId, range)) {
            logger.debug("Cache hit for {} of entry {}", range, entryId);
        } else {
            manager.fetchRange(entryId, range, Priority.CRITICAL, waitTimeout);
        }
        try {
            return store.read(entry(), offset, actualLength, target);
        } catch (ChunkStorageException e) {
            if (e.isDiskFull()) {
                throw e;
            }
            logger.warn(
                    "Unable to read cached range {} of entry {}, downloading it again: {}",
                    range,
                    entryId,
                    e.getMessage());
            manager.retryRange(entryId, range, waitTimeout);
            return store.read(entry(), offset, actualLength, target);
        }
    }

    @Override
    public OptionalLong size() throws IOException {
        return entry().expectedSize();
    }

    @Override
    public String getSourceIdentifier() {
        try {
            return "chunk-cached:" + entry().originalUrl();
        } catch (IOException e) {
            return "chunk-cached:entry-" + entryId;
        }
    }

    @Override
    public void close() {
        // resources belong to the ChunkCache
    }

    private CacheEntry entry() throws IOException {
        return index.findEntry(entryId).orElseThrow(() -> ChunkNotFoundException.forEntry(entryId));
    }
}
