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

import java.util.Locale;

/**
 * Snapshot of the proxy request statistics.
 *
 * @param requests requests served, {@code HEAD} included
 * @param rangeRequests {@code GET} requests carrying a {@code Range} header
 * @param fullRequests {@code GET} requests without one
 * @param bytesServed body bytes written to clients
 * @param cacheHits requests whose whole span was cached when they arrived
 * @param cacheMisses requests that had to wait for at least one chunk
 * @param activeStreams requests currently being served
 * @param serviceUnavailable requests answered {@code 503}
 * @param passthroughs requests forwarded to the origin because the resource size is unknown
 * @param errors requests answered {@code 500} or aborted after the response was committed
 */
public record ProxyStats(
        long requests,
        long rangeRequests,
        long fullRequests,
        long bytesServed,
        long cacheHits,
        long cacheMisses,
        long activeStreams,
        long serviceUnavailable,
        long passthroughs,
        long errors) {

    /**
     * @return the fraction of requests fully served from the cache, between 0.0 and 1.0
     */
    public double hitRate() {
        long total = cacheHits + cacheMisses;
        return total == 0 ? 0d : (double) cacheHits / total;
    }

    @Override
    public String toString() {
        return String.format(
                Locale.ROOT,
                "ProxyStats{requests=%d (range=%d, full=%d), active=%d, hitRate=%.2f%%, served=%.2f MiB, 503=%d, "
                        + "passthrough=%d, errors=%d}",
                requests,
                rangeRequests,
                fullRequests,
                activeStreams,
                hitRate() * 100.0,
                bytesServed / (1024.0 * 1024.0),
                serviceUnavailable,
                passthroughs,
                errors);
    }
}
