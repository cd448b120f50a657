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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class ByteRangeTest {

    @Test
    void halfOpenBounds() {
        ByteRange range = ByteRange.between(100, 200);
        assertThat(range.offset()).isEqualTo(100);
        assertThat(range.length()).isEqualTo(100);
        assertThat(range.end()).isEqualTo(200);
        assertThat(range.last()).isEqualTo(199);
        assertThat(range.contains(199)).isTrue();
        assertThat(range.contains(200)).isFalse();
    }

    @Test
    void overlapsAndCovers() {
        ByteRange range = ByteRange.between(100, 200);
        assertThat(range.overlaps(ByteRange.between(199, 300))).isTrue();
        assertThat(range.overlaps(ByteRange.between(200, 300))).isFalse();
        assertThat(range.covers(ByteRange.between(150, 200))).isTrue();
        assertThat(range.covers(ByteRange.between(150, 201))).isFalse();
    }

    @Test
    void clip() {
        assertThat(ByteRange.between(100, 200).clip(150)).isEqualTo(ByteRange.between(100, 150));
        assertThat(ByteRange.between(100, 200).clip(500)).isEqualTo(ByteRange.between(100, 200));
        assertThat(ByteRange.between(100, 200).clip(50).isEmpty()).isTrue();
    }

    @Test
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> ByteRange.of(-1, 10));
        assertThrows(IllegalArgumentException.class, () -> ByteRange.of(0, -1));
        assertThrows(IllegalArgumentException.class, () -> ByteRange.between(10, 5));
    }

    @Test
    void orderedByOffsetThenLength() {
        assertThat(ByteRange.of(0, 10).compareTo(ByteRange.of(0, 20))).isNegative();
        assertThat(ByteRange.of(0, 20).compareTo(ByteRange.of(1, 1))).isNegative();
    }
}
