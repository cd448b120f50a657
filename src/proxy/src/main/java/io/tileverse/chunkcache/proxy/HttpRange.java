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
package io.tileverse.chunkcache.proxy;

import io.tileverse.chunkcache.io.ByteRange;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single {@code Range: bytes=...} request, in one of the forms {@code first-last}, {@code first-} or
 * {@code -suffixLength}.
 * <p>
 * Only the first range of a multi-range request is honored. Malformed headers parse to empty, and the request
 * is then served as if it had no {@code Range} header.
 */
public final class HttpRange {

    private static final Pattern BYTES_RANGE = Pattern.compile("^\\s*(\\d*)\\s*-\\s*(\\d*)\\s*$");

    // -1 when absent
    private final long first;
    private final long last;
    private final long suffixLength;

    private HttpRange(long first, long last, long suffixLength) {
        this.first = first;
        this.last = last;
        this.suffixLength = suffixLength;
    }

    /**
     * @param header the {@code Range} header value, may be {@code null}
     * @return the parsed range, empty if absent or malformed
     */
    public static Optional<HttpRange> parse(String header) {
        if (header == null) {
            return Optional.empty();
        }
        String value = header.trim();
        if (!value.regionMatches(true, 0, "bytes=", 0, 6)) {
            return Optional.empty();
        }
        String rangeSet = value.substring(6);
        int comma = rangeSet.indexOf(',');
        if (comma >= 0) {
            rangeSet = rangeSet.substring(0, comma);
        }
        Matcher matcher = BYTES_RANGE.matcher(rangeSet);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String firstPos = matcher.group(1);
        String lastPos = matcher.group(2);
        try {
            if (firstPos.isEmpty()) {
                if (lastPos.isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(new HttpRange(-1, -1, Long.parseLong(lastPos)));
            }
            long start = Long.parseLong(firstPos);
            long end = lastPos.isEmpty() ? -1 : Long.parseLong(lastPos);
            if (end >= 0 && end < start) {
                return Optional.empty();
            }
            return Optional.of(new HttpRange(start, end, -1));
        } catch (NumberFormatException overflow) {
            return Optional.empty();
        }
    }

    public boolean isSuffix() {
        return suffixLength >= 0;
    }

    /**
     * Resolves this range against a resource of {@code totalSize} bytes, truncating the last position at the end
     * of the resource.
     *
     * @return the byte range, or empty if unsatisfiable
     */
    public Optional<ByteRange> resolve(long totalSize) {
        if (isSuffix()) {
            if (suffixLength == 0 || totalSize == 0) {
                return Optional.empty();
            }
            long length = Math.min(suffixLength, totalSize);
            return Optional.of(ByteRange.of(totalSize - length, length));
        }
        if (first >= totalSize) {
            return Optional.empty();
        }
        long end = last < 0 || last >= totalSize - 1 ? totalSize : last + 1;
        return Optional.of(ByteRange.between(first, end));
    }

    @Override
    public String toString() {
        if (isSuffix()) {
            return "bytes=-" + suffixLength;
        }
        return "bytes=" + first + "-" + (last < 0 ? "" : String.valueOf(last));
    }
}
