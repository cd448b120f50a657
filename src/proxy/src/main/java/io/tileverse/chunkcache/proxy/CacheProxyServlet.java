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

import static java.util.Objects.requireNonNull;

import io.tileverse.chunkcache.ChunkCache;
import io.tileverse.chunkcache.ChunkDownloadException;
import io.tileverse.chunkcache.ChunkLayout;
import io.tileverse.chunkcache.ChunkNotFoundException;
import io.tileverse.chunkcache.ChunkStorageException;
import io.tileverse.chunkcache.ChunkWaitTimeoutException;
import io.tileverse.chunkcache.Priority;
import io.tileverse.chunkcache.config.ChunkCacheConfig;
import io.tileverse.chunkcache.index.CacheEntry;
import io.tileverse.chunkcache.index.CacheEntryKey;
import io.tileverse.chunkcache.io.ByteRange;
import io.tileverse.chunkcache.manager.ChunkManager;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Serves cache entries over HTTP with {@code 206 Partial Content} responses, downloading missing chunks on
 * demand.
 * <p>
 * Routes:
 * <ul>
 * <li>{@code /cache/{sourceId}/{mediaId}/{quality}}: the entry with that key
 * <li>{@code /stream/{streamId}}: an entry registered through {@link CacheProxyServer#registerStream}
 * </ul>
 * Spans shorter than the direct read threshold are buffered whole before responding. Longer spans are streamed
 * chunk by chunk, only the first chunk being awaited before the response is committed.
 */
@Slf4j
class CacheProxyServlet extends HttpServlet {

    private static final long serialVersionUID = 1L;

    static final int STREAM_BUFFER_SIZE = 256 * 1024;

    private final transient ChunkCache cache;
    private final transient Function<String, Optional<Long>> streams;
    private final transient ProxyCounters counters;
    private final long directReadThreshold;
    private final Duration waitTimeout;
    private final Duration retryAfter;
    private final String contentType;

    CacheProxyServlet(ChunkCache cache, Function<String, Optional<Long>> streams, ProxyCounters counters) {
        this.cache = requireNonNull(cache);
        this.streams = requireNonNull(streams);
        this.counters = requireNonNull(counters);
        ChunkCacheConfig config = cache.config();
        this.directReadThreshold = Math.min(config.directReadThreshold(), Integer.MAX_VALUE);
        this.waitTimeout = config.chunkWaitTimeout();
        this.retryAfter = config.retryAfter();
        this.contentType = config.contentType();
    }

    @Override
    protected void doGet(HttpServletRequest request, HttpServletResponse response) throws IOException {
        serve(request, response, false);
    }

    @Override
    protected void doHead(HttpServletRequest request, HttpServletResponse response) throws IOException {
        serve(request, response, true);
    }

    private void serve(HttpServletRequest request, HttpServletResponse response, boolean head) throws IOException {
        counters.requests.incrementAndGet();
        counters.activeStreams.incrementAndGet();
        CacheEntry entry = null;
        try {
            Optional<CacheEntry> found = resolve(request.getPathInfo());
            if (found.isEmpty()) {
                log.debug("No cache entry for {}", request.getPathInfo());
                response.sendError(HttpServletResponse.SC_NOT_FOUND);
                return;
            }
            entry = found.get();
            if (entry.expectedSize().isEmpty()) {
                cache.probeSize(entry.id());
                entry = cache.find(entry.id()).orElse(entry);
            }
            if (head) {
                serveHead(entry, response);
            } else if (entry.expectedSize().isEmpty()) {
                passthrough(entry, request, response);
            } else {
                serveRange(entry, request, response);
            }
        } catch (IOException e) {
            handleFailure(entry, response, e);
        } finally {
            counters.activeStreams.decrementAndGet();
        }
    }

    private Optional<CacheEntry> resolve(String path) throws IOException {
        if (path == null || path.length() < 2) {
            return Optional.empty();
        }
        String[] parts = path.substring(1).split("/", -1);
        for (String part : parts) {
            if (part.isEmpty()) {
                return Optional.empty();
            }
        }
        if (parts.length == 4 && "cache".equals(parts[0])) {
            return cache.find(CacheEntryKey.of(parts[1], parts[2], parts[3]));
        }
        if (parts.length == 2 && "stream".equals(parts[0])) {
            Optional<Long> entryId = streams.apply(parts[1]);
            return entryId.isPresent() ? cache.find(entryId.get()) : Optional.empty();
        }
        return Optional.empty();
    }

    private void serveHead(CacheEntry entry, HttpServletResponse response) {
        response.setStatus(HttpServletResponse.SC_OK);
        response.setContentType(contentType);
        response.setHeader("Accept-Ranges", "bytes");
        entry.expectedSize().ifPresent(response::setContentLengthLong);
    }

    private void serveRange(CacheEntry entry, HttpServletRequest request, HttpServletResponse response)
            throws IOException {
        final long total = entry.expectedSize().getAsLong();
        final String rangeHeader = request.getHeader("Range");
        (rangeHeader == null ? counters.fullRequests : counters.rangeRequests).incrementAndGet();
        Optional<HttpRange> requested = HttpRange.parse(rangeHeader);
        if (rangeHeader != null && requested.isEmpty()) {
            log.debug("Ignoring malformed Range header '{}'", rangeHeader);
        }
        if (requested.isEmpty() && total == 0) {
            response.setStatus(HttpServletResponse.SC_OK);
            response.setContentType(contentType);
            response.setContentLengthLong(0);
            return;
        }
        Optional<ByteRange> resolved =
                requested.isPresent() ? requested.get().resolve(total) : Optional.of(ByteRange.of(0, total));
        if (resolved.isEmpty()) {
            log.debug("Unsatisfiable range {} for entry {} of {} bytes", rangeHeader, entry.id(), total);
            response.setStatus(HttpServletResponse.SC_REQUESTED_RANGE_NOT_SATISFIABLE);
            response.setHeader("Content-Range", "bytes */" + total);
            return;
        }
        final ByteRange span = resolved.get();
        ChunkManager manager = cache.manager();
        manager.onPlaybackPosition(entry.id(), span.offset());
        if (manager.hasByteRange(entry.id(), span)) {
            counters.cacheHits.incrementAndGet();
        } else {
            counters.cacheMisses.incrementAndGet();
        }
        log.debug("Serving {} of entry {} ({} bytes)", span, entry.id(), total);
        if (span.length() < directReadThreshold) {
            serveBuffered(entry, span, response);
        } else {
            serveStreaming(entry, span, response);
        }
    }

    private void serveBuffered(CacheEntry entry, ByteRange span, HttpServletResponse response) throws IOException {
        ByteBuffer data = cache.reader(entry.id()).readRange(span);
        data.flip();
        if (data.remaining() != span.length()) {
            throw new IOException("Read %d bytes of %s from entry %d".formatted(data.remaining(), span, entry.id()));
        }
        writeHeaders(response, span, entry.expectedTotalSize());
        OutputStream out = response.getOutputStream();
        if (data.hasArray()) {
            write(out, data.array(), data.arrayOffset() + data.position(), data.remaining());
        } else {
            byte[] bytes = new byte[data.remaining()];
            data.get(bytes);
            write(out, bytes, 0, bytes.length);
        }
        counters.bytesServed.addAndGet(span.length());
    }

    private void serveStreaming(CacheEntry entry, ByteRange span, HttpServletResponse response) throws IOException {
        final ChunkManager manager = cache.manager();
        final ChunkLayout layout = cache.layout();
        final long firstChunk = layout.indexOf(span.offset());
        final long lastChunk = layout.indexOf(span.last());

        // a failure here can still be answered with a 503
        manager.fetchChunk(entry.id(), firstChunk, Priority.CRITICAL, waitTimeout);
        writeHeaders(response, span, entry.expectedTotalSize());
        OutputStream out = response.getOutputStream();

        byte[] buffer = new byte[STREAM_BUFFER_SIZE];
        long position = span.offset();
        for (long chunk = firstChunk; chunk <= lastChunk; chunk++) {
            ByteRange bounds = layout.bounds(chunk, entry.expectedSize());
            if (chunk != firstChunk) {
                manager.onPlaybackPosition(entry.id(), bounds.offset());
                manager.fetchChunk(entry.id(), chunk, Priority.CRITICAL, waitTimeout);
            }
            long end = Math.min(bounds.end(), span.end());
            while (position < end) {
                int length = (int) Math.min(buffer.length, end - position);
                readCached(entry, bounds, position, ByteBuffer.wrap(buffer, 0, length));
                write(out, buffer, 0, length);
                position += length;
                counters.bytesServed.addAndGet(length);
            }
        }
        log.debug("Streamed {} of entry {}", span, entry.id());
    }

    private void readCached(CacheEntry entry, ByteRange chunk, long position, ByteBuffer target) throws IOException {
        final int length = target.remaining();
        try {
            cache.store().read(entry, position, length, target);
        } catch (ChunkStorageException e) {
            if (e.isDiskFull()) {
                throw e;
            }
            log.warn("Unable to read {} of entry {}, downloading it again: {}", chunk, entry.id(), e.getMessage());
            cache.manager().retryRange(entry.id(), chunk, waitTimeout);
            cache.store().read(entry, position, length, target);
        }
    }

    private void passthrough(CacheEntry entry, HttpServletRequest request, HttpServletResponse response)
            throws IOException {
        counters.passthroughs.incrementAndGet();
        log.info("Size of entry {} unknown, passing request through to {}", entry.id(), entry.originalUrl());
        HttpRequest.Builder builder = HttpRequest.newBuilder(entry.originalUrl()).GET();
        String range = request.getHeader("Range");
        if (range != null) {
            builder.header("Range", range);
        }
        HttpResponse<InputStream> upstream;
        try {
            upstream = cache.httpClient().send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Request was interrupted", e);
        } catch (IOException e) {
            log.warn("Origin {} unreachable: {}", entry.originalUrl(), e.getMessage());
            counters.errors.incrementAndGet();
            response.sendError(HttpServletResponse.SC_BAD_GATEWAY);
            return;
        }
        try (InputStream body = upstream.body()) {
            int status = upstream.statusCode();
            if (status != HttpServletResponse.SC_OK && status != HttpServletResponse.SC_PARTIAL_CONTENT) {
                log.warn("Origin {} returned status {}", entry.originalUrl(), status);
                counters.errors.incrementAndGet();
                response.sendError(HttpServletResponse.SC_BAD_GATEWAY);
                return;
            }
            response.setStatus(status);
            response.setContentType(contentType);
            response.setHeader("Accept-Ranges", "bytes");
            upstream.headers().firstValue("Content-Range").ifPresent(v -> response.setHeader("Content-Range", v));
            upstream.headers().firstValueAsLong("Content-Length").ifPresent(response::setContentLengthLong);
            OutputStream out = response.getOutputStream();
            byte[] buffer = new byte[STREAM_BUFFER_SIZE];
            int read;
            while ((read = body.read(buffer)) != -1) {
                write(out, buffer, 0, read);
                counters.bytesServed.addAndGet(read);
            }
        }
    }

    private void writeHeaders(HttpServletResponse response, ByteRange span, long total) {
        response.setStatus(HttpServletResponse.SC_PARTIAL_CONTENT);
        response.setContentType(contentType);
        response.setHeader("Accept-Ranges", "bytes");
        response.setHeader("Content-Range", "bytes " + span.offset() + "-" + span.last() + "/" + total);
        response.setContentLengthLong(span.length());
    }

    private void handleFailure(CacheEntry entry, HttpServletResponse response, IOException e) throws IOException {
        final Object entryId = entry == null ? "?" : entry.id();
        if (e instanceof ClientDisconnectedException) {
            log.debug("Client disconnected while receiving entry {}: {}", entryId, e.getMessage());
            return;
        }
        if (response.isCommitted()) {
            counters.errors.incrementAndGet();
            log.warn("Aborting response for entry {} after commit: {}", entryId, e.getMessage());
            return;
        }
        response.reset();
        if (e instanceof ChunkWaitTimeoutException || e instanceof ChunkDownloadException) {
            counters.serviceUnavailable.incrementAndGet();
            log.warn("Entry {} not available yet, answering 503: {}", entryId, e.getMessage());
            response.setStatus(HttpServletResponse.SC_SERVICE_UNAVAILABLE);
            response.setHeader("Retry-After", String.valueOf(Math.max(1, retryAfter.toSeconds())));
            response.setHeader("Accept-Ranges", "bytes");
        } else if (e instanceof ChunkNotFoundException) {
            log.debug("Not found: {}", e.getMessage());
            response.sendError(HttpServletResponse.SC_NOT_FOUND);
        } else {
            counters.errors.incrementAndGet();
            log.error("Error serving entry {}", entryId, e);
            response.sendError(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
        }
    }

    private static void write(OutputStream out, byte[] buffer, int offset, int length)
            throws ClientDisconnectedException {
        try {
            out.write(buffer, offset, length);
        } catch (IOException e) {
            throw new ClientDisconnectedException(e);
        }
    }

    /** The client went away, only its own request is affected. */
    static class ClientDisconnectedException extends IOException {
        private static final long serialVersionUID = 1L;

        ClientDisconnectedException(IOException cause) {
            super(cause.getMessage(), cause);
        }
    }
}
