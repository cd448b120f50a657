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
import java.time.Instant;

/**
 * A downloaded byte interval {@code [startByte, endByte)} of a cache entry.
 *
 * @param entryId the owning entry
 * @param startByte inclusive start
 * @param endByte exclusive end
 * @param downloadedAt when the interval was recorded
 */
public record ChunkRecord(long entryId, long startByte, long endByte, Instant downloadedAt) {

    public ChunkRecord {
        if (startByte < 0 || endByte < startByte) {
            throw new IllegalArgumentException("Invalid chunk interval [%d, %d)".formatted(startByte, endByte));
        }
    }

    public ByteRange range() {
        return ByteRange.between(startByte, endByte);
    }

    public long length() {
        return endByte - startByte;
    }

    public boolean covers(long start, long end) {
        return startByte <= start && endByte >= end;
    }
}
