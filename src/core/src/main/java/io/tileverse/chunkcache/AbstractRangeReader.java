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
import java.nio.ByteBuffer;
import java.util.OptionalLong;

/**
 * Abstract base class providing common implementation for {@link RangeReader}.
 * <p>
 * {@link #readRange(long, int, ByteBuffer)} handles validation and EOF truncation,
 * and delegates the actual reading to {@link #readRangeNoFlip(long, int, ByteBuffer)}.
 */
public abstract class AbstractRangeReader implements RangeReader {

    protected AbstractRangeReader() {
        // Default constructor for subclasses
    }

    /**
     * Reads bytes from the source at the specified offset into the provided target buffer.
     * <p>
     * <strong>Boundary Handling:</strong>
     * <ul>
     * <li>For zero-length reads, returns immediately with 0 bytes read</li>
     * <li>For reads starting beyond EOF, returns 0 bytes read</li>
     * <li>For reads extending beyond EOF, truncates to available data</li>
     * </ul>
     *
     * @param offset The byte offset to read from (must be >= 0)
     * @param length The number of bytes to read (must be >= 0)
     * @param target The ByteBuffer to read into, starting at its current position
     * @return The number of bytes actually read (may be less than requested if EOF is reached)
     * @throws IOException                      If an I/O error occurs during reading
     * @throws IllegalArgumentException         If offset or length is negative, target is null,
     *                                          or target has insufficient remaining capacity
     * @throws java.nio.ReadOnlyBufferException If the target buffer is read-only
     */
    @Override
    public final int readRange(long offset, int length, ByteBuffer target) throws IOException {
        if (offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative");
        }
        if (length < 0) {
            throw new IllegalArgumentException("Length cannot be negative");
        }
        if (target == null) {
            throw new IllegalArgumentException("Target buffer cannot be null");
        }
        if (target.isReadOnly()) {
            throw new java.nio.ReadOnlyBufferException();
        }
        if (length == 0) {
            return 0;
        }

        final int remainingBefore = target.remaining();
        if (remainingBefore < length) {
            throw new IllegalArgumentException(
                    "Target buffer has insufficient remaining capacity: " + remainingBefore + " < " + length);
        }

        int actualLength = length;

        final OptionalLong fileSize = size();
        if (fileSize.isPresent()) {
            long size = fileSize.getAsLong();
            if (offset >= size) {
                return 0;
            }
            if (offset + length > size) {
                actualLength = (int) (size - offset);
            }
        }

        return readRangeNoFlip(offset, actualLength, target);
    }

    /**
     * Reads bytes from the source into the target buffer without preparing the buffer for consumption.
     * <p>
     * When called by {@link #readRange(long, int, ByteBuffer)}, {@code offset} is within the source,
     * {@code actualLength} is positive and {@code target} has enough remaining capacity.
     * Implementations must advance the target's position by the number of bytes written and leave its
     * limit unchanged.
     *
     * @param offset       The byte offset to read from
     * @param actualLength The number of bytes to read
     * @param target       The ByteBuffer to write into
     * @return The number of bytes actually read and written to the target buffer
     * @throws IOException If an I/O error occurs during reading from the underlying source
     */
    protected abstract int readRangeNoFlip(long offset, int actualLength, ByteBuffer target) throws IOException;
}
