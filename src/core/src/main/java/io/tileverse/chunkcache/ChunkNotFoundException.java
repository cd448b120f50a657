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

/**
 * Usage error: the referenced cache entry doesn't exist, or the chunk index lies past the end of the entry.
 */
public class ChunkNotFoundException extends IOException {

    private static final long serialVersionUID = 1L;

    public ChunkNotFoundException(String message) {
        super(message);
    }

    public static ChunkNotFoundException forEntry(long entryId) {
        return new ChunkNotFoundException("Cache entry not found: " + entryId);
    }

    public static ChunkNotFoundException forChunk(long entryId, long chunkIndex) {
        return new ChunkNotFoundException("Chunk %d out of bounds for cache entry %d".formatted(chunkIndex, entryId));
    }
}
