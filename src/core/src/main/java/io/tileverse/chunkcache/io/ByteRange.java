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
package io.tileverse.chunkcache.io;

import java.io.Serializable;

/**
 * Half-open byte range {@code [offset, offset + length)}.
 *
 * @param offset the starting position of the range
 * @param length the number of bytes in the range
 */
public record ByteRange(
        /** The starting position of the range */
        long offset,
        /** The number of bytes in the range */
        long length)
        implements Serializable, Comparable<ByteRange> {

    /**
     * Compact constructor that validates the byte range parameters.
     *
     * @param offset the starting position of the range (must be non-negative)
     * @param length the number of bytes in the range (must be non-negative)
     */
    public ByteRange {
        if (offset < 0) {
            throw new IllegalArgumentException("offset can't be < 0: " + offset);
        }
        if (length < 0) {
            throw new IllegalArgumentException("length can't be < 0: " + length);
        }
    }

    /**
     * @return the exclusive end position, {@code offset + length}
     */
    public long end() {
        return offset + length;
    }

    /**
     * @return the inclusive position of the last byte, as used in HTTP {@code Range} headers
     */
    public long last() {
        return end() - 1;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    public boolean contains(long position) {
        return position >= offset && position < end();
    }

    /**
     * @param other the range to test against
     * @return {@code true} if this range fully covers {@code other}
     */
    public boolean covers(ByteRange other) {
        return offset <= other.offset() && end() >= other.end();
    }

    public boolean overlaps(ByteRange other) {
        return offset < other.end() && other.offset() < end();
    }

    /**
     * Clips this range so it doesn't extend past {@code size}.
     *
     * @param size the total size of the resource
     * @return the clipped range, possibly empty
     */
    public ByteRange clip(long size) {
        if (offset >= size) {
            return new ByteRange(offset, 0);
        }
        return end() <= size ? this : new ByteRange(offset, size - offset);
    }

    @Override
    public int compareTo(ByteRange o) {
        int c = Long.compare(offset, o.offset());
        return c == 0 ? Long.compare(length, o.length()) : c;
    }

    /**
     * Creates a new {@link ByteRange} with a different offset but the same length.
     *
     * @param newOffset The new offset.
     * @return A new {@link ByteRange} instance.
     */
    public ByteRange withOffset(long newOffset) {
        return new ByteRange(newOffset, length());
    }

    /**
     * Factory method to create a new {@link ByteRange}.
     *
     * @param offset The starting offset.
     * @param length The length of the range.
     * @return A new {@link ByteRange} instance.
     */
    public static ByteRange of(long offset, long length) {
        return new ByteRange(offset, length);
    }

    /**
     * Creates the range {@code [start, end)}.
     *
     * @param start inclusive start
     * @param end exclusive end
     * @return the range
     */
    public static ByteRange between(long start, long end) {
        if (end < start) {
            throw new IllegalArgumentException("end can't be < start: [%d, %d)".formatted(start, end));
        }
        return new ByteRange(start, end - start);
    }

    @Override
    public String toString() {
        return "[" + offset + ", " + end() + ")";
    }
}
