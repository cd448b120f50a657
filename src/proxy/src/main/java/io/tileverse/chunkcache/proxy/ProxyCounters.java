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

import java.util.concurrent.atomic.AtomicLong;

class ProxyCounters {

    final AtomicLong requests = new AtomicLong();
    final AtomicLong rangeRequests = new AtomicLong();
    final AtomicLong fullRequests = new AtomicLong();
    final AtomicLong bytesServed = new AtomicLong();
    final AtomicLong cacheHits = new AtomicLong();
    final AtomicLong cacheMisses = new AtomicLong();
    final AtomicLong activeStreams = new AtomicLong();
    final AtomicLong serviceUnavailable = new AtomicLong();
    final AtomicLong passthroughs = new AtomicLong();
    final AtomicLong errors = new AtomicLong();

    ProxyStats snapshot() {
        return new ProxyStats(
                requests.get(),
                rangeRequests.get(),
                fullRequests.get(),
                bytesServed.get(),
                cacheHits.get(),
                cacheMisses.get(),
                activeStreams.get(),
                serviceUnavailable.get(),
                passthroughs.get(),
                errors.get());
    }
}
