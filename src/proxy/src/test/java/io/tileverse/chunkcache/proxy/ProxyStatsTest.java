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

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ProxyStatsTest {

    @Test
    void hitRate() {
        ProxyCounters counters = new ProxyCounters();
        assertThat(counters.snapshot().hitRate()).isZero();

        counters.cacheHits.addAndGet(3);
        counters.cacheMisses.incrementAndGet();
        counters.requests.addAndGet(4);

        ProxyStats stats = counters.snapshot();
        assertThat(stats.hitRate()).isEqualTo(0.75);
        assertThat(stats.toString()).contains("requests=4").contains("hitRate=75.00%");
    }
}
