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

import io.tileverse.chunkcache.io.ByteRange;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.OptionalLong;

/**
 * Interface for reading ranges of bytes from a cached media resource.
 * <p>
 * Reads block until the requested bytes are available in the cache, triggering their download if needed.
 * <p>
 * All implementations of this interface MUST be thread-safe to allow concurrent
 * access from multiple threads without interference.
 */
public interface RangeReader extends Closeable {

    /**
     * Reads bytes from the source at the specified offset.
     * <p>
     * This convenience method allocates a new ByteBuffer for each call.
     *
     * @param offset The offset to read from
     * @param length The number of bytes to read
     * @return A ByteBuffer with its position set at the actual number of bytes read, needs flip() to be consumed
     * @throws IOException              If an I/O error occurs
     * @throws IllegalArgumentException If offset or length is negative
     */
    default ByteBuffer readRange(long offset, int length) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(length);
        int bytesRead = readRange(offset, length, buffer);
        assert bytesRead <= length;
        assert bytesRead == buffer.position();
        return buffer;
    }

    /**
     * Reads a byte range from the source.
     *
     * @param range The byte range to read, at most {@link Integer#MAX_VALUE} bytes long.
     * @return A ByteBuffer containing the data.
     * @throws IOException If an I/O error occurs.
     */
    default ByteBuffer readRange(ByteRange range) throws IOException {
        return readRange(requireNonNull(range).offset(), Math.toIntExact(range.length()));
    }

    /**
     * Reads bytes from the source at the specified offset into the provided target
     * buffer.
     * <p>
     * Following standard NIO conventions, after this method returns, the
     * target buffer's position will be advanced by the number of bytes read, and
     * the caller must call {@code flip()} on the buffer to prepare it for reading.
     *
     * @param offset The offset to read from
     * @param length The number of bytes to read
     * @param target The ByteBuffer to read into, starting at its current position
     * @return The number of bytes actually read
     * @throws IOException                      If an I/O error occurs
     * @throws IllegalArgumentException         If offset or length is negative, if target is null,
     *                                          or if target has insufficient remaining capacity
     * @throws java.nio.ReadOnlyBufferException If the target buffer is read-only
     */
    int readRange(long offset, int length, ByteBuffer target) throws IOException;

    /**
     * Gets the total size of the source in bytes.
     *
     * @return The size in bytes, or empty if unknown
     * @throws IOException If an I/O error occurs
     */
    OptionalLong size() throws IOException;

    /**
     * Gets a unique identifier for the source being read, used for logging and debugging purposes.
     *
     * @return A unique identifier for this source
     */
    String getSourceIdentifier();

    /**
     * Releases any resource held by this reader. This operation is idempotent.
     */
    @Override
    void close() throws IOException;
}
