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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.tileverse.chunkcache.io.ByteRange;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;

class ChunkLayoutTest {

    private static final long MIB = 1024 * 1024;

    private final ChunkLayout layout = new ChunkLayout(10 * MIB);

    @Test
    void indexOf() {
        assertThat(layout.indexOf(0)).isZero();
        assertThat(layout.indexOf(10 * MIB - 1)).isZero();
        assertThat(layout.indexOf(10 * MIB)).isEqualTo(1);
        assertThat(layout.indexOf(52_428_800)).isEqualTo(5);
        assertThrows(IllegalArgumentException.class, () -> layout.indexOf(-1));
    }

    @Test
    void boundsAreTruncatedAtTotalSize() {
        OptionalLong size = OptionalLong.of(25 * MIB);
        assertThat(layout.bounds(0, size)).isEqualTo(ByteRange.between(0, 10 * MIB));
        assertThat(layout.bounds(2, size)).isEqualTo(ByteRange.between(20 * MIB, 25 * MIB));
        assertThrows(IllegalArgumentException.class, () -> layout.bounds(3, size));
    }

    @Test
    void boundsAssumeFullChunksWhileSizeUnknown() {
        assertThat(layout.bounds(7, OptionalLong.empty())).isEqualTo(ByteRange.between(70 * MIB, 80 * MIB));
        assertThat(layout.isValidIndex(1_000, OptionalLong.empty())).isTrue();
        assertThat(layout.isValidIndex(-1, OptionalLong.empty())).isFalse();
    }

    @Test
    void chunkCount() {
        assertThat(layout.chunkCount(0)).isZero();
        assertThat(layout.chunkCount(1)).isEqualTo(1);
        assertThat(layout.chunkCount(100 * MIB)).isEqualTo(10);
        assertThat(layout.chunkCount(100 * MIB + 1)).isEqualTo(11);
    }

    @Test
    void indicesOverlapping() {
        assertThat(layout.indicesOverlapping(ByteRange.of(0, 1024 * 1024)).toArray())
                .containsExactly(0);
        assertThat(layout.indicesOverlapping(ByteRange.between(10 * MIB - 1, 20 * MIB + 1)).toArray())
                .containsExactly(0, 1, 2);
        assertThat(layout.indicesOverlapping(ByteRange.of(10 * MIB, 0)).toArray())
                .isEmpty();
    }

    @Test
    void invalidChunkSize() {
        assertThrows(IllegalArgumentException.class, () -> new ChunkLayout(0));
    }
}
