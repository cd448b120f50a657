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
package io.tileverse.chunkcache.manager;

import static java.util.Objects.requireNonNull;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.tileverse.chunkcache.CacheStatus;
import io.tileverse.chunkcache.ChunkDownloadException;
import io.tileverse.chunkcache.ChunkLayout;
import io.tileverse.chunkcache.ChunkNotFoundException;
import io.tileverse.chunkcache.ChunkWaitTimeoutException;
import io.tileverse.chunkcache.Priority;
import io.tileverse.chunkcache.download.ChunkDownloader;
import io.tileverse.chunkcache.download.ChunkListener;
import io.tileverse.chunkcache.index.CacheEntry;
import io.tileverse.chunkcache.index.CacheIndex;
import io.tileverse.chunkcache.index.ChunkRecord;
import io.tileverse.chunkcache.index.Coverage;
import io.tileverse.chunkcache.io.ByteRange;
import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.PrimitiveIterator;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Schedules chunk downloads by priority and lets consumers wait for chunks.
 * <p>
 * A single scheduler thread takes a download slot from a semaphore sized to the global concurrency ceiling, then
 * dispatches the highest priority pending request, oldest first among equals. Each download runs as its own task
 * and releases its slot when done. Requests are upgrade-only, except when a seek demotes lookahead requests that
 * fell out of the playback window. Dispatched downloads are never preempted.
 * <p>
 * Waiters register before checking the index, so a completion can't slip between the check and the
 * registration. They're resolved after the chunk is recorded, released with the failure when the download fails
 * permanently, or give up on timeout.
 * <p>
 * All scheduling state is guarded by one lock, never held during I/O.
 */
@Slf4j
public class ChunkManager implements ChunkListener, Closeable {

    private final CacheIndex index;
    private final ChunkDownloader downloader;
    private final ChunkLayout layout;
    private final int maxConcurrentDownloads;
    private final int lookaheadChunks;

    private final Semaphore downloadSlots;
    private final ExecutorService downloadExecutor;
    private final Thread scheduler;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition requestAvailable = lock.newCondition();
    private final NavigableSet<ChunkRequest> queue = new TreeSet<>(ChunkRequest.SCHEDULING_ORDER);
    private final Map<ChunkKey, ChunkRequest> pending = new HashMap<>();
    private final Set<ChunkKey> inFlight = new HashSet<>();
    private final Map<ChunkKey, List<CompletableFuture<Void>>> waiters = new HashMap<>();
    private final Map<Long, Long> playbackChunks = new HashMap<>();
    private long sequence;
    private boolean closed;

    // outcome of recently finished requests
    private final Cache<ChunkKey, RequestState> outcomes = Caffeine.newBuilder()
            .maximumSize(10_000)
            .expireAfterWrite(Duration.ofMinutes(5))
            .build();

    private ChunkManager(Builder builder) {
        this.index = requireNonNull(builder.index, "index");
        this.downloader = requireNonNull(builder.downloader, "downloader");
        this.layout = requireNonNull(builder.layout, "layout");
        this.maxConcurrentDownloads = builder.maxConcurrentDownloads;
        this.lookaheadChunks = builder.lookaheadChunks;
        this.downloadSlots = new Semaphore(maxConcurrentDownloads);
        this.downloadExecutor = Executors.newCachedThreadPool(threadFactory("chunk-download-"));
        this.scheduler = threadFactory("chunk-scheduler-").newThread(this::runScheduler);
    }

    public ChunkLayout layout() {
        return layout;
    }

    public int maxConcurrentDownloads() {
        return maxConcurrentDownloads;
    }

    public int lookaheadChunks() {
        return lookaheadChunks;
    }

    /**
     * @return {@code true} if the index covers the chunk
     */
    public boolean hasChunk(long entryId, long chunkIndex) throws IOException {
        return isRecorded(requireEntry(entryId), chunkIndex);
    }

    /**
     * @return {@code true} iff every chunk overlapping {@code range} is recorded, the range being clipped to the
     *     entry size when known
     */
    public boolean hasByteRange(long entryId, ByteRange range) throws IOException {
        CacheEntry entry = requireEntry(entryId);
        for (PrimitiveIterator.OfLong it = indices(entry, range); it.hasNext(); ) {
            if (!isRecorded(entry, it.nextLong())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Requests a chunk download.
     * <p>
     * Does nothing if the chunk is already recorded (resolving any waiter), already downloading, or already
     * pending at the same or a higher priority. A pending request at a lower priority is upgraded.
     *
     * @return {@code true} if a request was queued or upgraded
     * @throws ChunkNotFoundException if the entry doesn't exist or the index is past its end
     */
    public boolean requestChunk(long entryId, long chunkIndex, Priority priority) throws IOException {
        return request(requireEntry(entryId), chunkIndex, priority);
    }

    /**
     * Requests every missing chunk overlapping {@code range}.
     *
     * @return the number of requests queued or upgraded
     */
    public int requestChunksForRange(long entryId, ByteRange range, Priority priority) throws IOException {
        CacheEntry entry = requireEntry(entryId);
        int requested = 0;
        for (PrimitiveIterator.OfLong it = indices(entry, range); it.hasNext(); ) {
            if (request(entry, it.nextLong(), priority)) {
                requested++;
            }
        }
        return requested;
    }

    private boolean request(CacheEntry entry, long chunkIndex, Priority priority) throws IOException {
        requireNonNull(priority, "priority");
        checkIndex(entry, chunkIndex);
        final ChunkKey key = new ChunkKey(entry.id(), chunkIndex);
        if (isRecorded(entry, chunkIndex)) {
            chunkRecorded(entry.id(), chunkIndex);
            return false;
        }
        lock.lock();
        try {
            checkOpen();
            if (inFlight.contains(key)) {
                return false;
            }
            ChunkRequest existing = pending.get(key);
            if (existing == null) {
                enqueue(new ChunkRequest(key, priority, Instant.now(), sequence++));
                requestAvailable.signal();
                log.debug("Queued {} at {} priority", key, priority);
                return true;
            }
            if (priority.isHigherThan(existing.priority())) {
                reprioritize(existing, priority);
                log.debug("Upgraded {} from {} to {}", key, existing.priority(), priority);
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Registers a waiter for a chunk, resolved immediately if the chunk is already recorded.
     * <p>
     * Each call returns its own future: cancelling it releases this waiter only, and never affects the download.
     * The future completes exceptionally with the download failure if the chunk fails permanently.
     */
    public CompletableFuture<Void> awaitChunk(long entryId, long chunkIndex) throws IOException {
        CacheEntry entry = requireEntry(entryId);
        checkIndex(entry, chunkIndex);
        final ChunkKey key = new ChunkKey(entryId, chunkIndex);
        final CompletableFuture<Void> waiter = new CompletableFuture<>();
        lock.lock();
        try {
            checkOpen();
            waiters.computeIfAbsent(key, k -> new ArrayList<>()).add(waiter);
        } finally {
            lock.unlock();
        }
        waiter.whenComplete((r, e) -> removeWaiter(key, waiter));
        try {
            if (isRecorded(entry, chunkIndex)) {
                waiter.complete(null);
            }
        } catch (IOException e) {
            waiter.cancel(false);
            throw e;
        }
        return waiter;
    }

    /**
     * Blocks until the chunk is recorded.
     *
     * @throws ChunkWaitTimeoutException if {@code timeout} elapses first
     * @throws ChunkDownloadException if the chunk's download failed permanently
     */
    public void waitForChunk(long entryId, long chunkIndex, Duration timeout) throws IOException {
        await(entryId, chunkIndex, timeout.toNanos(), timeout);
    }

    /**
     * Blocks until every chunk overlapping {@code range} is recorded, sharing one deadline.
     */
    public void waitForRange(long entryId, ByteRange range, Duration timeout) throws IOException {
        final long deadline = System.nanoTime() + timeout.toNanos();
        CacheEntry entry = requireEntry(entryId);
        for (PrimitiveIterator.OfLong it = indices(entry, range); it.hasNext(); ) {
            long remaining = Math.max(0, deadline - System.nanoTime());
            await(entryId, it.nextLong(), remaining, timeout);
        }
    }

    /**
     * Requests a chunk and blocks until it's recorded. The waiter is registered before the request is queued, so
     * a fast failure is reported as such rather than as a timeout.
     */
    public void fetchChunk(long entryId, long chunkIndex, Priority priority, Duration timeout) throws IOException {
        CompletableFuture<Void> waiter = awaitChunk(entryId, chunkIndex);
        try {
            requestChunk(entryId, chunkIndex, priority);
        } catch (IOException | RuntimeException e) {
            waiter.cancel(false);
            throw e;
        }
        await(waiter, entryId, chunkIndex, timeout.toNanos(), timeout);
    }

    /**
     * Requests every missing chunk overlapping {@code range} and blocks until they're all recorded, sharing one
     * deadline.
     */
    public void fetchRange(long entryId, ByteRange range, Priority priority, Duration timeout) throws IOException {
        final long deadline = System.nanoTime() + timeout.toNanos();
        CacheEntry entry = requireEntry(entryId);
        Map<Long, CompletableFuture<Void>> waiting = new LinkedHashMap<>();
        try {
            for (PrimitiveIterator.OfLong it = indices(entry, range); it.hasNext(); ) {
                long chunkIndex = it.nextLong();
                waiting.put(chunkIndex, awaitChunk(entryId, chunkIndex));
            }
            for (long chunkIndex : waiting.keySet()) {
                request(entry, chunkIndex, priority);
            }
            for (Map.Entry<Long, CompletableFuture<Void>> w : waiting.entrySet()) {
                long remaining = Math.max(0, deadline - System.nanoTime());
                await(w.getValue(), entryId, w.getKey(), remaining, timeout);
            }
        } finally {
            waiting.values().forEach(w -> w.cancel(false));
        }
    }

    private void await(long entryId, long chunkIndex, long timeoutNanos, Duration timeout) throws IOException {
        await(awaitChunk(entryId, chunkIndex), entryId, chunkIndex, timeoutNanos, timeout);
    }

    private void await(
            CompletableFuture<Void> waiter, long entryId, long chunkIndex, long timeoutNanos, Duration timeout)
            throws IOException {
        try {
            waiter.get(timeoutNanos, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            waiter.cancel(false);
            log.warn("Timed out after {} ms waiting for chunk {} of entry {}", timeout.toMillis(), chunkIndex, entryId);
            throw new ChunkWaitTimeoutException(entryId, chunkIndex, timeout);
        } catch (InterruptedException e) {
            waiter.cancel(false);
            Thread.currentThread().interrupt();
            throw new IOException(
                    "Interrupted while waiting for chunk %d of entry %d".formatted(chunkIndex, entryId), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            throw new ChunkDownloadException(
                    "Download of chunk %d of entry %d failed: %s".formatted(chunkIndex, entryId, cause.getMessage()),
                    false,
                    cause);
        }
    }

    /**
     * Reports the playback position of an entry and re-prioritizes its requests.
     * <p>
     * A position outside {@code [previous, previous + lookahead]} chunks is a seek: pending {@link Priority#LOW
     * LOW} requests of the entry outside the new window are cancelled, then {@link Priority#HIGH HIGH} ones outside
     * it are demoted to {@code LOW}. In every case the chunk at the position is requested at
     * {@link Priority#CRITICAL CRITICAL} and the lookahead chunks after it at {@code HIGH}.
     *
     * @return {@code true} if the position was handled as a seek
     */
    public boolean onPlaybackPosition(long entryId, long byteOffset) throws IOException {
        CacheEntry entry = requireEntry(entryId);
        final long current = layout.indexOf(byteOffset);
        checkIndex(entry, current);
        final long windowEnd = current + lookaheadChunks;

        boolean seek;
        int cancelled = 0;
        int demoted = 0;
        lock.lock();
        try {
            checkOpen();
            Long previous = playbackChunks.put(entryId, current);
            seek = previous != null && (current < previous || current > previous + lookaheadChunks);
            if (seek) {
                List<ChunkRequest> outside = pending.values().stream()
                        .filter(r -> r.key().entryId() == entryId)
                        .filter(r -> r.key().chunkIndex() < current || r.key().chunkIndex() > windowEnd)
                        .toList();
                for (ChunkRequest r : outside) {
                    if (r.priority() == Priority.LOW) {
                        dequeue(r);
                        cancelled++;
                    }
                }
                for (ChunkRequest r : outside) {
                    if (r.priority() == Priority.HIGH) {
                        reprioritize(r, Priority.LOW);
                        demoted++;
                    }
                }
            }
        } finally {
            lock.unlock();
        }
        if (seek) {
            log.info(
                    "Seek to chunk {} of entry {}: cancelled {} and demoted {} pending requests",
                    current,
                    entryId,
                    cancelled,
                    demoted);
        }

        request(entry, current, Priority.CRITICAL);
        for (long i = current + 1; i <= windowEnd && layout.isValidIndex(i, entry.expectedSize()); i++) {
            request(entry, i, Priority.HIGH);
        }
        return seek;
    }

    /**
     * Cancels pending requests. Downloads already dispatched are not affected.
     *
     * @return the number of requests cancelled
     */
    public int cancelRequests(long entryId, Collection<Long> chunkIndices) {
        int cancelled = 0;
        lock.lock();
        try {
            for (Long chunkIndex : chunkIndices) {
                ChunkRequest r = pending.get(new ChunkKey(entryId, chunkIndex));
                if (r != null) {
                    dequeue(r);
                    cancelled++;
                }
            }
        } finally {
            lock.unlock();
        }
        log.debug("Cancelled {} pending requests of entry {}", cancelled, entryId);
        return cancelled;
    }

    /**
     * Requests every missing chunk of the entry at {@link Priority#LOW LOW} priority.
     *
     * @return the number of requests queued
     */
    public int requestBackgroundFill(long entryId) throws IOException {
        return requestMissing(entryId, Priority.LOW);
    }

    /**
     * Requests every missing chunk of the entry at {@link Priority#MEDIUM MEDIUM} priority.
     *
     * @return the number of requests queued or upgraded
     */
    public int precache(long entryId) throws IOException {
        return requestMissing(entryId, Priority.MEDIUM);
    }

    private int requestMissing(long entryId, Priority priority) throws IOException {
        CacheEntry entry = requireEntry(entryId);
        int requested = 0;
        for (long chunkIndex : missingChunks(entry)) {
            if (request(entry, chunkIndex, priority)) {
                requested++;
            }
        }
        log.debug("Requested {} missing chunks of entry {} at {} priority", requested, entryId, priority);
        return requested;
    }

    /**
     * Forgets the recorded chunks overlapping {@code range}, downloads them again at {@link Priority#HIGH HIGH}
     * priority and waits for them. Used when cached bytes turn out to be unreadable.
     */
    public void retryRange(long entryId, ByteRange range, Duration timeout) throws IOException {
        CacheEntry entry = requireEntry(entryId);
        ByteRange clipped = clip(entry, range);
        int removed = index.deleteChunksInRange(entryId, clipped.offset(), clipped.end());
        log.warn("Invalidated {} chunk records of entry {} in {}, downloading again", removed, entryId, clipped);
        fetchRange(entryId, clipped, Priority.HIGH, timeout);
    }

    public CacheStatus getCacheStatus(long entryId) throws IOException {
        CacheEntry entry = requireEntry(entryId);
        List<ChunkRecord> records = index.listChunks(entryId);
        if (entry.expectedSize().isEmpty()) {
            return CacheStatus.of(records.size(), 0, entry.complete());
        }
        long total = layout.chunkCount(entry.expectedSize().getAsLong());
        return CacheStatus.of(total - missingChunks(entry, records).size(), total, entry.complete());
    }

    /**
     * @return the indices of the recorded chunks of the entry, ascending
     */
    public List<Long> availableChunks(long entryId) throws IOException {
        CacheEntry entry = requireEntry(entryId);
        List<ChunkRecord> records = index.listChunks(entryId);
        List<Long> available = new ArrayList<>();
        long count = entry.expectedSize().isPresent()
                ? layout.chunkCount(entry.expectedSize().getAsLong())
                : records.stream()
                        .mapToLong(r -> layout.indexOf(Math.max(0, r.endByte() - 1)) + 1)
                        .max()
                        .orElse(0);
        for (long i = 0; i < count; i++) {
            ByteRange b = layout.bounds(i, entry.expectedSize());
            if (Coverage.anyCovers(records, b.offset(), b.end())) {
                available.add(i);
            }
        }
        return available;
    }

    /**
     * @return the number of pending requests, not counting dispatched downloads
     */
    public int queueSize() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    public int inFlightCount() {
        lock.lock();
        try {
            return inFlight.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the state of the chunk's request, empty if there's no request and no recent outcome
     */
    public Optional<RequestState> requestState(long entryId, long chunkIndex) {
        ChunkKey key = new ChunkKey(entryId, chunkIndex);
        lock.lock();
        try {
            if (inFlight.contains(key)) {
                return Optional.of(RequestState.DOWNLOADING);
            }
            if (pending.containsKey(key)) {
                return Optional.of(RequestState.PENDING);
            }
        } finally {
            lock.unlock();
        }
        return Optional.ofNullable(outcomes.getIfPresent(key));
    }

    /**
     * @return the priority of the chunk's pending request, empty if it's not pending
     */
    public Optional<Priority> pendingPriority(long entryId, long chunkIndex) {
        lock.lock();
        try {
            return Optional.ofNullable(pending.get(new ChunkKey(entryId, chunkIndex)))
                    .map(ChunkRequest::priority);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Resolves the chunk's waiters and drops any pending request for it. Called by the downloader once the chunk
     * is recorded.
     */
    @Override
    public void chunkRecorded(long entryId, long chunkIndex) {
        final ChunkKey key = new ChunkKey(entryId, chunkIndex);
        List<CompletableFuture<Void>> released;
        lock.lock();
        try {
            released = waiters.remove(key);
            ChunkRequest stale = pending.get(key);
            if (stale != null) {
                dequeue(stale);
            }
        } finally {
            lock.unlock();
        }
        complete(released, null);
    }

    private void runScheduler() {
        log.debug("Chunk scheduler started, {} download slots", maxConcurrentDownloads);
        try {
            while (true) {
                downloadSlots.acquire();
                ChunkRequest next;
                lock.lock();
                try {
                    while (queue.isEmpty() && !closed) {
                        requestAvailable.await();
                    }
                    if (closed) {
                        downloadSlots.release();
                        return;
                    }
                    next = queue.pollFirst();
                    pending.remove(next.key());
                    inFlight.add(next.key());
                } finally {
                    lock.unlock();
                }
                dispatch(next);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Chunk scheduler interrupted");
        }
    }

    private void dispatch(ChunkRequest request) {
        log.debug("Dispatching {} ({})", request.key(), request.priority());
        try {
            downloadExecutor.execute(() -> runDownload(request.key()));
        } catch (RejectedExecutionException e) {
            downloadSlots.release();
            finish(request.key(), new IOException("Chunk manager closed", e));
        }
    }

    private void runDownload(ChunkKey key) {
        Throwable failure = null;
        try {
            downloader.download(key.entryId(), key.chunkIndex());
            if (!hasChunk(key.entryId(), key.chunkIndex())) {
                failure = ChunkDownloadException.permanentFailure(key + " not recorded after download");
            }
        } catch (IOException | RuntimeException e) {
            log.debug("Download of {} failed", key, e);
            failure = e;
        } finally {
            downloadSlots.release();
        }
        finish(key, failure);
    }

    private void finish(ChunkKey key, Throwable failure) {
        List<CompletableFuture<Void>> released;
        lock.lock();
        try {
            inFlight.remove(key);
            released = waiters.remove(key);
        } finally {
            lock.unlock();
        }
        outcomes.put(key, failure == null ? RequestState.COMPLETED : RequestState.FAILED);
        complete(released, failure);
    }

    private static void complete(List<CompletableFuture<Void>> released, Throwable failure) {
        if (released == null) {
            return;
        }
        for (CompletableFuture<Void> waiter : released) {
            if (failure == null) {
                waiter.complete(null);
            } else {
                waiter.completeExceptionally(failure);
            }
        }
    }

    private void removeWaiter(ChunkKey key, CompletableFuture<Void> waiter) {
        lock.lock();
        try {
            List<CompletableFuture<Void>> list = waiters.get(key);
            if (list != null && list.remove(waiter) && list.isEmpty()) {
                waiters.remove(key);
            }
        } finally {
            lock.unlock();
        }
    }

    // queue and pending must change together, callers hold the lock
    private void enqueue(ChunkRequest request) {
        queue.add(request);
        pending.put(request.key(), request);
    }

    private void dequeue(ChunkRequest request) {
        queue.remove(request);
        pending.remove(request.key());
    }

    private void reprioritize(ChunkRequest request, Priority priority) {
        dequeue(request);
        enqueue(request.withPriority(priority));
    }

    private List<Long> missingChunks(CacheEntry entry) throws IOException {
        return missingChunks(entry, index.listChunks(entry.id()));
    }

    private List<Long> missingChunks(CacheEntry entry, List<ChunkRecord> records) {
        List<Long> missing = new ArrayList<>();
        if (entry.expectedSize().isEmpty()) {
            // size unknown, downloading the first chunk reveals it
            ByteRange first = layout.bounds(0, entry.expectedSize());
            if (!Coverage.anyCovers(records, first.offset(), first.end())) {
                missing.add(0L);
            }
            return missing;
        }
        long count = layout.chunkCount(entry.expectedSize().getAsLong());
        for (long i = 0; i < count; i++) {
            ByteRange b = layout.bounds(i, entry.expectedSize());
            if (!Coverage.anyCovers(records, b.offset(), b.end())) {
                missing.add(i);
            }
        }
        return missing;
    }

    private boolean isRecorded(CacheEntry entry, long chunkIndex) throws IOException {
        if (!layout.isValidIndex(chunkIndex, entry.expectedSize())) {
            return false;
        }
        ByteRange b = layout.bounds(chunkIndex, entry.expectedSize());
        return index.chunkExists(entry.id(), b.offset(), b.end());
    }

    private PrimitiveIterator.OfLong indices(CacheEntry entry, ByteRange range) {
        return layout.indicesOverlapping(clip(entry, range)).iterator();
    }

    private static ByteRange clip(CacheEntry entry, ByteRange range) {
        return entry.expectedSize().isPresent() ? range.clip(entry.expectedSize().getAsLong()) : range;
    }

    private void checkIndex(CacheEntry entry, long chunkIndex) throws ChunkNotFoundException {
        if (!layout.isValidIndex(chunkIndex, entry.expectedSize())) {
            throw ChunkNotFoundException.forChunk(entry.id(), chunkIndex);
        }
    }

    private CacheEntry requireEntry(long entryId) throws IOException {
        return index.findEntry(entryId).orElseThrow(() -> ChunkNotFoundException.forEntry(entryId));
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("ChunkManager is closed");
        }
    }

    /**
     * Stops the scheduler, abandons pending requests and releases every waiter with an error. Running downloads
     * are interrupted.
     */
    @Override
    public void close() {
        List<CompletableFuture<Void>> abandoned = new ArrayList<>();
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            queue.clear();
            pending.clear();
            waiters.values().forEach(abandoned::addAll);
            waiters.clear();
            requestAvailable.signalAll();
        } finally {
            lock.unlock();
        }
        scheduler.interrupt();
        downloadExecutor.shutdownNow();
        IOException closedError = new IOException("Chunk manager closed");
        abandoned.forEach(w -> w.completeExceptionally(closedError));
        try {
            scheduler.join(TimeUnit.SECONDS.toMillis(1));
            if (!downloadExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Chunk downloads still running after close");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("Chunk manager closed");
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger count = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for ChunkManager. {@link #build()} registers the manager as the downloader's listener and starts the
     * scheduler thread.
     */
    public static class Builder {

        private CacheIndex index;
        private ChunkDownloader downloader;
        private ChunkLayout layout = new ChunkLayout(ChunkLayout.DEFAULT_CHUNK_SIZE);
        private int maxConcurrentDownloads = 3;
        private int lookaheadChunks = 10;

        private Builder() {}

        public Builder index(CacheIndex index) {
            this.index = index;
            return this;
        }

        public Builder downloader(ChunkDownloader downloader) {
            this.downloader = downloader;
            return this;
        }

        public Builder layout(ChunkLayout layout) {
            this.layout = layout;
            return this;
        }

        public Builder maxConcurrentDownloads(int maxConcurrentDownloads) {
            if (maxConcurrentDownloads < 1) {
                throw new IllegalArgumentException(
                        "maxConcurrentDownloads must be positive: " + maxConcurrentDownloads);
            }
            this.maxConcurrentDownloads = maxConcurrentDownloads;
            return this;
        }

        public Builder lookaheadChunks(int lookaheadChunks) {
            if (lookaheadChunks < 0) {
                throw new IllegalArgumentException("lookaheadChunks can't be negative: " + lookaheadChunks);
            }
            this.lookaheadChunks = lookaheadChunks;
            return this;
        }

        public ChunkManager build() {
            ChunkManager manager = new ChunkManager(this);
            manager.downloader.setListener(manager);
            manager.scheduler.start();
            return manager;
        }
    }
}
