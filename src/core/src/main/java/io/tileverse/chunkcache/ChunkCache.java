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

import io.tileverse.chunkcache.config.ChunkCacheConfig;
import io.tileverse.chunkcache.download.ChunkDownloader;
import io.tileverse.chunkcache.index.CacheEntry;
import io.tileverse.chunkcache.index.CacheEntryKey;
import io.tileverse.chunkcache.index.CacheIndex;
import io.tileverse.chunkcache.index.InMemoryCacheIndex;
import io.tileverse.chunkcache.manager.ChunkManager;
import io.tileverse.chunkcache.store.ChunkStore;
import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.util.Optional;
import java.util.OptionalLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Wires the chunk cache components together: index, store, downloader and manager.
 * <p>
 * Usage:
 * <pre>{@code
 * try (ChunkCache cache = ChunkCache.builder().config(config).index(index).build()) {
 *     CacheEntry entry = cache.open(CacheEntryKey.of("server-1", "movie-42", "original"), originUri);
 *     ByteBuffer header = cache.reader(entry.id()).readRange(0, 1024).flip();
 * }
 * }</pre>
 */
@Slf4j
public class ChunkCache implements Closeable {

    private final ChunkCacheConfig config;
    private final CacheIndex index;
    private final ChunkStore store;
    private final ChunkLayout layout;
    private final HttpClient httpClient;
    private final ChunkDownloader downloader;
    private final ChunkManager manager;

    private ChunkCache(Builder builder) throws IOException {
        this.config = builder.config;
        this.index = builder.index == null ? new InMemoryCacheIndex() : builder.index;
        this.layout = config.chunkLayout();
        this.httpClient = builder.httpClient == null ? defaultHttpClient(config) : builder.httpClient;
        this.store = new ChunkStore(config.cacheDirectory(), config.fileAllocation().orElse(null));
        this.downloader = new ChunkDownloader(index, store, layout, httpClient, config.retryPolicy());
        this.manager = ChunkManager.builder()
                .index(index)
                .downloader(downloader)
                .layout(layout)
                .maxConcurrentDownloads(config.maxConcurrentDownloads())
                .lookaheadChunks(config.lookaheadChunks())
                .build();
        log.info(
                "Chunk cache at {}: chunk size {}, {} concurrent downloads, {} allocation",
                config.cacheDirectory(),
                layout.chunkSize(),
                config.maxConcurrentDownloads(),
                store.allocation());
    }

    /**
     * Opens the entry for {@code key}, creating it on first use.
     * <p>
     * Learns the resource size with a {@code HEAD} request if still unknown, allocates the cache file, and
     * requests a background fill of the missing chunks if enabled.
     *
     * @param key the entry key
     * @param originUrl the URL to fetch the resource from, ignored if the entry exists
     * @return the entry
     */
    public CacheEntry open(CacheEntryKey key, URI originUrl) throws IOException {
        CacheEntry entry = index.getOrCreateEntry(key, originUrl, store.pathFor(key));
        index.markAccessed(entry.id());
        if (entry.expectedSize().isEmpty()) {
            probeSize(entry.id());
            entry = index.findEntry(entry.id()).orElseThrow();
        }
        store.openOrCreate(entry);
        if (config.backgroundFillEnabled() && !entry.complete()) {
            manager.requestBackgroundFill(entry.id());
        }
        log.debug("Opened cache entry {} ({}), size {}", entry.id(), key, entry.expectedSize());
        return entry;
    }

    /**
     * Tries to learn the entry size from the origin.
     *
     * @return the size, empty if the origin didn't report it or couldn't be reached
     */
    public OptionalLong probeSize(long entryId) throws IOException {
        try {
            return downloader.probeSize(entryId);
        } catch (ChunkDownloadException e) {
            log.warn("Unable to probe size of entry {}: {}", entryId, e.getMessage());
            return OptionalLong.empty();
        }
    }

    public Optional<CacheEntry> find(CacheEntryKey key) throws IOException {
        return index.findEntry(key);
    }

    public Optional<CacheEntry> find(long entryId) throws IOException {
        return index.findEntry(entryId);
    }

    /**
     * @return a blocking reader over the entry
     */
    public ChunkCacheReader reader(long entryId) {
        return new ChunkCacheReader(entryId, index, store, manager, config.chunkWaitTimeout());
    }

    public CacheStatus status(long entryId) throws IOException {
        return manager.getCacheStatus(entryId);
    }

    /**
     * Requests every missing chunk of the entry at {@link Priority#MEDIUM MEDIUM} priority.
     *
     * @return the number of chunks requested
     */
    public int precache(long entryId) throws IOException {
        return manager.precache(entryId);
    }

    public ChunkCacheConfig config() {
        return config;
    }

    public CacheIndex index() {
        return index;
    }

    public ChunkStore store() {
        return store;
    }

    public ChunkLayout layout() {
        return layout;
    }

    public ChunkManager manager() {
        return manager;
    }

    public HttpClient httpClient() {
        return httpClient;
    }

    @Override
    public void close() {
        manager.close();
        store.close();
        log.debug("Chunk cache closed");
    }

    private static HttpClient defaultHttpClient(ChunkCacheConfig config) {
        return HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for ChunkCache.
     */
    public static class Builder {

        private ChunkCacheConfig config = new ChunkCacheConfig();
        private CacheIndex index;
        private HttpClient httpClient;

        private Builder() {}

        public Builder config(ChunkCacheConfig config) {
            this.config = requireNonNull(config);
            return this;
        }

        /**
         * @param index the persistent index, defaults to a non-durable {@link InMemoryCacheIndex}
         */
        public Builder index(CacheIndex index) {
            this.index = index;
            return this;
        }

        /**
         * @param httpClient the client used to reach origins, defaults to one honoring the configured connect timeout
         */
        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        /**
         * @throws IOException if the cache directory can't be created
         * @throws IllegalArgumentException if the configuration is invalid
         */
        public ChunkCache build() throws IOException {
            return new ChunkCache(this);
        }
    }
}
