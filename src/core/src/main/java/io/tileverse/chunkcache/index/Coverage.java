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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Operations on the set of intervals recorded for an entry.
 */
public final class Coverage {

    private Coverage() {
        // utility class
    }

    /**
     * @param records chunk records in any order
     * @return the union of the records as disjoint, non-adjacent ranges sorted by offset
     */
    public static List<ByteRange> merge(List<ChunkRecord> records) {
        List<ChunkRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparingLong(ChunkRecord::startByte));
        List<ByteRange> merged = new ArrayList<>();
        long start = -1;
        long end = -1;
        for (ChunkRecord r : sorted) {
            if (start < 0) {
                start = r.startByte();
                end = r.endByte();
            } else if (r.startByte() <= end) {
                end = Math.max(end, r.endByte());
            } else {
                merged.add(ByteRange.between(start, end));
                start = r.startByte();
                end = r.endByte();
            }
        }
        if (start >= 0) {
            merged.add(ByteRange.between(start, end));
        }
        return merged;
    }

    /**
     * @return the number of distinct bytes covered by {@code records}
     */
    public static long coveredBytes(List<ChunkRecord> records) {
        return merge(records).stream().mapToLong(ByteRange::length).sum();
    }

    /**
     * @return {@code true} if a single record covers {@code [start, end)}
     */
    public static boolean anyCovers(List<ChunkRecord> records, long start, long end) {
        return records.stream().anyMatch(r -> r.covers(start, end));
    }
}
