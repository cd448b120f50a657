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

/**
 * Download progress of a cache entry, derived from the persistent index.
 *
 * @param cachedChunks number of chunks fully recorded
 * @param totalChunks number of chunks of the resource, {@code 0} while its size is unknown
 * @param progressPercent {@code cachedChunks} as a percentage of {@code totalChunks}
 * @param complete whether the entry has been marked complete
 */
public record CacheStatus(long cachedChunks, long totalChunks, double progressPercent, boolean complete) {

    public static CacheStatus of(long cachedChunks, long totalChunks, boolean complete) {
        double progress;
        if (totalChunks == 0) {
            progress = complete ? 100d : 0d;
        } else {
            progress = 100d * cachedChunks / totalChunks;
        }
        return new CacheStatus(cachedChunks, totalChunks, progress, complete);
    }
}
