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
package io.tileverse.chunkcache.manager;

import io.tileverse.chunkcache.Priority;
import java.time.Instant;
import java.util.Comparator;

/**
 * A queued request for a chunk download.
 *
 * @param key the requested chunk
 * @param priority current priority
 * @param enqueuedAt when the request was first enqueued
 * @param sequence enqueue order, kept across priority changes
 */
public record ChunkRequest(ChunkKey key, Priority priority, Instant enqueuedAt, long sequence) {

    /** Highest priority first, then first come first served. */
    public static final Comparator<ChunkRequest> SCHEDULING_ORDER =
            Comparator.comparing(ChunkRequest::priority).thenComparingLong(ChunkRequest::sequence);

    public ChunkRequest withPriority(Priority newPriority) {
        return new ChunkRequest(key, newPriority, enqueuedAt, sequence);
    }
}
