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

/**
 * Failure to fetch a chunk from the origin.
 * <p>
 * Transient failures (timeouts, connection resets, HTTP 5xx, truncated bodies) are retried by the downloader,
 * permanent ones (HTTP 4xx, exhausted retries) fail the chunk and release its waiters.
 */
public class ChunkDownloadException extends IOException {

    private static final long serialVersionUID = 1L;

    private final boolean transientFailure;

    public ChunkDownloadException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public ChunkDownloadException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public static ChunkDownloadException transientFailure(String message, Throwable cause) {
        return new ChunkDownloadException(message, true, cause);
    }

    public static ChunkDownloadException permanentFailure(String message) {
        return new ChunkDownloadException(message, false);
    }

    /**
     * @return {@code true} if retrying the download may succeed
     */
    public boolean isTransient() {
        return transientFailure;
    }
}
