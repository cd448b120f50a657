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

import static java.util.Objects.requireNonNull;

import java.net.URI;
import java.nio.file.Path;
import java.time.Instant;
import java.util.OptionalLong;

/**
 * Persistent record of a cached media object.
 *
 * @param id index-assigned identifier
 * @param key unique key of the entry
 * @param originalUrl the origin URL the bytes are fetched from
 * @param filePath the local cache file
 * @param expectedTotalSize total size of the resource, {@code null} until known
 * @param complete whether every byte has been downloaded
 * @param createdAt creation time
 * @param lastAccessed last time the entry was opened
 */
public record CacheEntry(
        long id,
        CacheEntryKey key,
        URI originalUrl,
        Path filePath,
        Long expectedTotalSize,
        boolean complete,
        Instant createdAt,
        Instant lastAccessed) {

    public CacheEntry {
        requireNonNull(key, "key");
        requireNonNull(originalUrl, "originalUrl");
        requireNonNull(filePath, "filePath");
        requireNonNull(createdAt, "createdAt");
        requireNonNull(lastAccessed, "lastAccessed");
    }

    public OptionalLong expectedSize() {
        return expectedTotalSize == null ? OptionalLong.empty() : OptionalLong.of(expectedTotalSize);
    }

    public CacheEntry withExpectedTotalSize(long size) {
        return new CacheEntry(id, key, originalUrl, filePath, size, complete, createdAt, lastAccessed);
    }

    public CacheEntry withComplete(boolean complete) {
        return new CacheEntry(id, key, originalUrl, filePath, expectedTotalSize, complete, createdAt, lastAccessed);
    }

    public CacheEntry withLastAccessed(Instant lastAccessed) {
        return new CacheEntry(id, key, originalUrl, filePath, expectedTotalSize, complete, createdAt, lastAccessed);
    }
}
