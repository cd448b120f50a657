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

import java.io.IOException;
import java.time.Duration;

/**
 * Thrown when a consumer gave up waiting for a chunk. The download itself is not affected.
 */
public class ChunkWaitTimeoutException extends IOException {

    private static final long serialVersionUID = 1L;

    private final long entryId;
    private final long chunkIndex;

    public ChunkWaitTimeoutException(long entryId, long chunkIndex, Duration timeout) {
        super("Timed out after %d ms waiting for chunk %d of entry %d"
                .formatted(timeout.toMillis(), chunkIndex, entryId));
        this.entryId = entryId;
        this.chunkIndex = chunkIndex;
    }

    public long getEntryId() {
        return entryId;
    }

    public long getChunkIndex() {
        return chunkIndex;
    }
}
