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
package io.tileverse.chunkcache.download;

import static java.util.Objects.requireNonNull;

import io.tileverse.chunkcache.ChunkDownloadException;
import io.tileverse.chunkcache.ChunkLayout;
import io.tileverse.chunkcache.ChunkNotFoundException;
import io.tileverse.chunkcache.index.CacheEntry;
import io.tileverse.chunkcache.index.CacheIndex;
import io.tileverse.chunkcache.index.Coverage;
import io.tileverse.chunkcache.io.ByteRange;
import io.tileverse.chunkcache.store.ChunkStore;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches chunks from the origin with HTTP range requests, writes them to the {@link ChunkStore} and records them
 * in the {@link CacheIndex}.
 * <p>
 * Transient failures are retried according to the {@link RetryPolicy}. If the origin ignores the {@code Range}
 * header and answers {@code 200}, the entry switches to sequential mode: the whole body is consumed from byte zero
 * and every chunk is recorded as soon as it's complete. Only one sequential fill runs per entry at a time, other
 * downloads of the same entry wait for it.
 * <p>
 * Listeners are notified only after a chunk's record is durable.
 */
public class ChunkDownloader {

    private static final Logger logger = LoggerFactory.getLogger(ChunkDownloader.class);

    static final int COPY_BUFFER_SIZE = 64 * 1024;

    private static final Pattern CONTENT_RANGE = Pattern.compile("bytes\\s+(\\d+)-(\\d+)/(\\d+|\\*)");

    private final CacheIndex index;
    private final ChunkStore store;
    private final ChunkLayout layout;
    private final HttpClient httpClient;
    private final RetryPolicy retryPolicy;

    private volatile ChunkListener listener = ChunkListener.NONE;

    // entries whose origin doesn't honor range requests
    private final Set<Long> rangeUnsupported = ConcurrentHashMap.newKeySet();
    private final ConcurrentMap<Long, CompletableFuture<Void>> sequentialFills = new ConcurrentHashMap<>();

    public ChunkDownloader(
            @NonNull CacheIndex index,
            @NonNull ChunkStore store,
            @NonNull ChunkLayout layout,
            @NonNull HttpClient httpClient,
            @NonNull RetryPolicy retryPolicy) {
        this.index = index;
        this.store = store;
        this.layout = layout;
        this.httpClient = httpClient;
        this.retryPolicy = retryPolicy;
    }

    public void setListener(ChunkListener listener) {
        this.listener = listener == null ? ChunkListener.NONE : listener;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    /**
     * @return {@code true} if the entry's origin was found not to support range requests
     */
    public boolean isSequential(long entryId) {
        return rangeUnsupported.contains(entryId);
    }

    /**
     * Downloads a chunk unless the index already covers it, in which case no request is made.
     *
     * @throws ChunkNotFoundException if the entry doesn't exist or the chunk is past its end
     * @throws ChunkDownloadException if the chunk failed permanently, or transiently on every attempt
     * @throws io.tileverse.chunkcache.ChunkStorageException if the chunk couldn't be written, not retried
     * @throws IOException on index failures
     */
    public void download(long entryId, long chunkIndex) throws IOException {
        CacheEntry entry = index.findEntry(entryId).orElseThrow(() -> ChunkNotFoundException.forEntry(entryId));
        if (!layout.isValidIndex(chunkIndex, entry.expectedSize())) {
            throw ChunkNotFoundException.forChunk(entryId, chunkIndex);
        }
        ByteRange bounds = layout.bounds(chunkIndex, entry.expectedSize());
        if (index.chunkExists(entryId, bounds.offset(), bounds.end())) {
            logger.debug("Chunk {} of entry {} already cached, skipping download", chunkIndex, entryId);
            return;
        }

        for (int attempt = 1; ; attempt++) {
            try {
                if (rangeUnsupported.contains(entryId)) {
                    downloadSequentially(entry, chunkIndex, null);
                } else {
                    downloadRange(entry, chunkIndex);
                }
                if (attempt > 1) {
                    logger.info(
                            "Downloaded chunk {} of entry {} after {} attempts", chunkIndex, entryId, attempt);
                }
                return;
            } catch (ChunkDownloadException e) {
                if (!e.isTransient()) {
                    logger.error("Download of chunk {} of entry {} failed: {}", chunkIndex, entryId, e.getMessage());
                    throw e;
                }
                if (attempt >= retryPolicy.maxAttempts()) {
                    logger.error(
                            "Download of chunk {} of entry {} failed after {} attempts: {}",
                            chunkIndex,
                            entryId,
                            attempt,
                            e.getMessage());
                    throw new ChunkDownloadException(
                            "Chunk %d of entry %d failed after %d attempts".formatted(chunkIndex, entryId, attempt),
                            false,
                            e);
                }
                Duration delay = retryPolicy.delayAfter(attempt);
                logger.warn(
                        "Download of chunk {} of entry {} failed (attempt {}/{}), retrying in {} ms: {}",
                        chunkIndex,
                        entryId,
                        attempt,
                        retryPolicy.maxAttempts(),
                        delay.toMillis(),
                        e.getMessage());
                sleep(delay);
                // the entry size may have been learned by a concurrent download
                entry = index.findEntry(entryId).orElseThrow(() -> ChunkNotFoundException.forEntry(entryId));
            }
        }
    }

    /**
     * Learns the size of the entry's resource with a {@code HEAD} request and records it.
     *
     * @return the size, or empty if the origin didn't report it
     * @throws ChunkDownloadException if the origin couldn't be reached
     */
    public OptionalLong probeSize(long entryId) throws IOException {
        CacheEntry entry = index.findEntry(entryId).orElseThrow(() -> ChunkNotFoundException.forEntry(entryId));
        if (entry.expectedSize().isPresent()) {
            return entry.expectedSize();
        }
        HttpRequest request = HttpRequest.newBuilder(entry.originalUrl())
                .method("HEAD", HttpRequest.BodyPublishers.noBody())
                .build();
        HttpResponse<Void> response = send(entry, request, HttpResponse.BodyHandlers.discarding());
        if (response.statusCode() != 200) {
            logger.debug("HEAD {} returned {}, size unknown", entry.originalUrl(), response.statusCode());
            return OptionalLong.empty();
        }
        List<String> acceptRanges = response.headers().allValues("Accept-Ranges");
        if (acceptRanges.stream().map(s -> s.toLowerCase(Locale.ROOT)).anyMatch("none"::equals)) {
            logger.info("Origin of entry {} does not support range requests (Accept-Ranges: none)", entryId);
            rangeUnsupported.add(entryId);
        }
        OptionalLong length = response.headers().firstValueAsLong("Content-Length");
        if (length.isEmpty() || length.getAsLong() < 0) {
            logger.warn("Content-Length unknown for {}", entry.originalUrl());
            return OptionalLong.empty();
        }
        learnSize(entry, length.getAsLong());
        return length;
    }

    private void downloadRange(CacheEntry entry, long chunkIndex) throws IOException {
        final long start = System.nanoTime();
        final ByteRange requested = layout.bounds(chunkIndex, entry.expectedSize());
        HttpRequest request = HttpRequest.newBuilder(entry.originalUrl())
                .GET()
                .header("Range", "bytes=" + requested.offset() + "-" + requested.last())
                .build();
        HttpResponse<InputStream> response = send(entry, request, HttpResponse.BodyHandlers.ofInputStream());
        if (response.statusCode() == 200) {
            logger.info("Origin ignored Range header for entry {}, switching to sequential download", entry.id());
            rangeUnsupported.add(entry.id());
            downloadSequentially(entry, chunkIndex, response);
            return;
        }
        try (InputStream body = response.body()) {
            checkStatusCode(entry, response.statusCode());

            CacheEntry current = entry;
            OptionalLong total = response.headers()
                    .firstValue("Content-Range")
                    .map(ChunkDownloader::parseContentRangeTotal)
                    .orElse(OptionalLong.empty());
            if (current.expectedSize().isEmpty() && total.isPresent()) {
                current = learnSize(current, total.getAsLong());
            }
            ByteRange chunk = layout.bounds(chunkIndex, current.expectedSize());
            checkContentLength(chunk.length(), response);

            long copied = copy(body, current, chunk);
            if (copied < chunk.length()) {
                if (current.expectedSize().isPresent()) {
                    throw ChunkDownloadException.transientFailure(
                            "Short body for chunk %d of entry %d: expected %,d bytes, got %,d"
                                    .formatted(chunkIndex, entry.id(), chunk.length(), copied),
                            null);
                }
                // no size reported and the body ended early, this is the last chunk
                current = learnSize(current, chunk.offset() + copied);
                chunk = ByteRange.of(chunk.offset(), copied);
            }
            record(current, chunkIndex, chunk);
            if (logger.isDebugEnabled()) {
                long millis = Duration.ofNanos(System.nanoTime() - start).toMillis();
                logger.debug("range:[{} +{}], time: {}ms", chunk.offset(), chunk.length(), millis);
            }
            checkComplete(current);
        }
    }

    /**
     * Runs or joins the sequential fill of the entry, then checks the chunk got recorded.
     *
     * @param response an already open {@code 200} response to consume, or {@code null} to issue a new request
     */
    private void downloadSequentially(CacheEntry entry, long chunkIndex, HttpResponse<InputStream> response)
            throws IOException {
        CompletableFuture<Void> fill = new CompletableFuture<>();
        CompletableFuture<Void> running = sequentialFills.putIfAbsent(entry.id(), fill);
        if (running != null) {
            if (response != null) {
                response.body().close();
            }
            logger.debug("Chunk {} of entry {} waits for the running sequential fill", chunkIndex, entry.id());
            awaitFill(running);
        } else {
            try {
                HttpResponse<InputStream> source = response == null ? requestWholeFile(entry) : response;
                fillSequentially(entry, source);
                fill.complete(null);
            } catch (IOException | RuntimeException e) {
                fill.completeExceptionally(e);
                throw e;
            } finally {
                sequentialFills.remove(entry.id(), fill);
            }
        }
        CacheEntry current = index.findEntry(entry.id()).orElseThrow(() -> ChunkNotFoundException.forEntry(entry.id()));
        if (!layout.isValidIndex(chunkIndex, current.expectedSize())) {
            throw ChunkNotFoundException.forChunk(entry.id(), chunkIndex);
        }
        ByteRange bounds = layout.bounds(chunkIndex, current.expectedSize());
        if (!index.chunkExists(entry.id(), bounds.offset(), bounds.end())) {
            throw ChunkDownloadException.transientFailure(
                    "Chunk %d of entry %d missing after sequential download".formatted(chunkIndex, entry.id()), null);
        }
    }

    private HttpResponse<InputStream> requestWholeFile(CacheEntry entry) throws IOException {
        HttpRequest request = HttpRequest.newBuilder(entry.originalUrl()).GET().build();
        HttpResponse<InputStream> response = send(entry, request, HttpResponse.BodyHandlers.ofInputStream());
        if (response.statusCode() != 200) {
            response.body().close();
            checkStatusCode(entry, response.statusCode());
            throw ChunkDownloadException.permanentFailure(
                    "Unexpected status %d for full download of %s"
                            .formatted(response.statusCode(), entry.originalUrl()));
        }
        return response;
    }

    private void fillSequentially(CacheEntry entry, HttpResponse<InputStream> response) throws IOException {
        logger.info("Sequential download of entry {} from {}", entry.id(), entry.originalUrl());
        CacheEntry current = entry;
        OptionalLong contentLength = response.headers().firstValueAsLong("Content-Length");
        if (current.expectedSize().isEmpty() && contentLength.isPresent() && contentLength.getAsLong() >= 0) {
            current = learnSize(current, contentLength.getAsLong());
        }
        try (InputStream body = response.body()) {
            for (long chunkIndex = 0; layout.isValidIndex(chunkIndex, current.expectedSize()); chunkIndex++) {
                ByteRange chunk = layout.bounds(chunkIndex, current.expectedSize());
                boolean present = index.chunkExists(current.id(), chunk.offset(), chunk.end());
                long copied = present ? skip(body, chunk.length()) : copy(body, current, chunk);
                if (copied < chunk.length()) {
                    if (current.expectedSize().isPresent()) {
                        throw ChunkDownloadException.transientFailure(
                                "Body of %s ended at %,d, expected %,d bytes"
                                        .formatted(
                                                current.originalUrl(),
                                                chunk.offset() + copied,
                                                current.expectedTotalSize()),
                                null);
                    }
                    long size = chunk.offset() + copied;
                    current = learnSize(current, size);
                    if (copied == 0) {
                        break;
                    }
                    chunk = ByteRange.of(chunk.offset(), copied);
                }
                if (!present) {
                    record(current, chunkIndex, chunk);
                }
            }
        }
        checkComplete(current);
    }

    private void awaitFill(CompletableFuture<Void> running) throws IOException {
        try {
            running.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for sequential download", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof ChunkDownloadException cde) {
                throw new ChunkDownloadException(cde.getMessage(), cde.isTransient(), cde);
            }
            throw ChunkDownloadException.transientFailure("Sequential download failed", e.getCause());
        }
    }

    private void record(CacheEntry entry, long chunkIndex, ByteRange chunk) throws IOException {
        index.recordChunk(entry.id(), chunk.offset(), chunk.end());
        logger.info("Downloaded chunk {} of entry {} {}", chunkIndex, entry.id(), chunk);
        try {
            listener.chunkRecorded(entry.id(), chunkIndex);
        } catch (RuntimeException e) {
            logger.warn("Chunk listener failed for chunk {} of entry {}", chunkIndex, entry.id(), e);
        }
    }

    private void checkComplete(CacheEntry entry) throws IOException {
        OptionalLong size = entry.expectedSize();
        if (size.isEmpty() || entry.complete()) {
            return;
        }
        long covered = Coverage.coveredBytes(index.listChunks(entry.id()));
        if (covered >= size.getAsLong()) {
            index.markComplete(entry.id());
            logger.info("Cache entry {} ({}) complete, {} bytes", entry.id(), entry.key(), size.getAsLong());
        }
    }

    private CacheEntry learnSize(CacheEntry entry, long totalSize) throws IOException {
        if (entry.expectedSize().isPresent()) {
            return entry;
        }
        index.updateExpectedTotalSize(entry.id(), totalSize);
        CacheEntry sized = entry.withExpectedTotalSize(totalSize);
        store.openOrCreate(sized);
        logger.info("Size of entry {} is {} bytes", entry.id(), totalSize);
        return sized;
    }

    private long copy(InputStream body, CacheEntry entry, ByteRange range) throws IOException {
        byte[] buffer = new byte[COPY_BUFFER_SIZE];
        long position = range.offset();
        long remaining = range.length();
        while (remaining > 0) {
            int read = readBody(body, buffer, (int) Math.min(buffer.length, remaining));
            if (read == -1) {
                break;
            }
            store.write(entry, position, ByteBuffer.wrap(buffer, 0, read));
            position += read;
            remaining -= read;
        }
        return position - range.offset();
    }

    private long skip(InputStream body, long length) throws ChunkDownloadException {
        byte[] buffer = new byte[COPY_BUFFER_SIZE];
        long skipped = 0;
        while (skipped < length) {
            int read = readBody(body, buffer, (int) Math.min(buffer.length, length - skipped));
            if (read == -1) {
                break;
            }
            skipped += read;
        }
        return skipped;
    }

    private int readBody(InputStream body, byte[] buffer, int length) throws ChunkDownloadException {
        try {
            return body.read(buffer, 0, length);
        } catch (IOException e) {
            throw ChunkDownloadException.transientFailure("Error reading response body: " + e.getMessage(), e);
        }
    }

    private <T> HttpResponse<T> send(CacheEntry entry, HttpRequest request, HttpResponse.BodyHandler<T> handler)
            throws IOException {
        try {
            return httpClient.send(request, handler);
        } catch (HttpConnectTimeoutException timeout) {
            throw rethrow(entry, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Request was interrupted", e);
        } catch (IOException e) {
            throw ChunkDownloadException.transientFailure(
                    "Request to %s failed: %s".formatted(entry.originalUrl(), e), e);
        }
    }

    private ChunkDownloadException rethrow(CacheEntry entry, HttpConnectTimeoutException timeout) {
        String duration = httpClient
                .connectTimeout()
                .map(d -> d.toMillis() + " milliseconds")
                .orElse("default timeout");
        String message = "Connection timeout after " + duration + " to " + entry.originalUrl();
        return ChunkDownloadException.transientFailure(message, timeout);
    }

    private void checkStatusCode(CacheEntry entry, int statusCode) throws ChunkDownloadException {
        if (statusCode == 206) {
            return;
        }
        if (statusCode == 401 || statusCode == 403) {
            throw ChunkDownloadException.permanentFailure(
                    "Authentication failed for URI: " + entry.originalUrl() + ", status code: " + statusCode);
        }
        String message = "Failed to get range from URI: " + entry.originalUrl() + ", status code: " + statusCode;
        if (statusCode >= 500 || statusCode == 429) {
            throw new ChunkDownloadException(message, true);
        }
        throw ChunkDownloadException.permanentFailure(message);
    }

    private void checkContentLength(long length, HttpResponse<InputStream> response) throws ChunkDownloadException {
        OptionalLong contentLength = response.headers().firstValueAsLong("Content-Length");
        if (contentLength.isPresent() && contentLength.getAsLong() > length) {
            throw ChunkDownloadException.permanentFailure(
                    "Server returned more data than requested. Requested %,d bytes, returned %,d"
                            .formatted(length, contentLength.getAsLong()));
        }
    }

    /**
     * Parses the complete length out of a {@code Content-Range} header, e.g. {@code bytes 0-99/1000}.
     *
     * @return the complete length, empty if unknown ({@code *}) or unparseable
     */
    static OptionalLong parseContentRangeTotal(String contentRange) {
        Matcher matcher = CONTENT_RANGE.matcher(requireNonNull(contentRange).trim());
        if (!matcher.matches() || "*".equals(matcher.group(3))) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(Long.parseLong(matcher.group(3)));
    }

    private static void sleep(Duration delay) throws IOException {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting to retry", e);
        }
    }
}
