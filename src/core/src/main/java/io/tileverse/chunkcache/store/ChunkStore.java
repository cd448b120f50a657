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
package io.tileverse.chunkcache.store;

import static java.util.Objects.requireNonNull;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.github.benmanes.caffeine.cache.RemovalCause;
import io.tileverse.chunkcache.ChunkStorageException;
import io.tileverse.chunkcache.index.CacheEntry;
import io.tileverse.chunkcache.index.CacheEntryKey;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.concurrent.CompletionException;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the on-disk cache files, one per {@link CacheEntry}.
 * <p>
 * Reads and writes are positional on a {@link FileChannel} shared by all threads, so concurrent writers to
 * disjoint offsets and concurrent readers anywhere need no locking. Growing a file to its expected size is the
 * only exclusive operation.
 * <p>
 * The store doesn't know which bytes are valid: callers must check the {@link io.tileverse.chunkcache.index.CacheIndex
 * index} before reading.
 */
public class ChunkStore implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(ChunkStore.class);

    static final String FILE_EXTENSION = ".cache";

    private final Path directory;
    private final FileAllocation allocation;

    // open channels, closed on eviction
    private final LoadingCache<Path, FileChannel> channels;

    private final ReadWriteLock growLock = new ReentrantReadWriteLock();

    private volatile boolean closed;

    /**
     * Creates a store rooted at {@code directory}, probing the file store for sparse file support.
     *
     * @throws ChunkStorageException if the directory can't be created
     */
    public ChunkStore(@NonNull Path directory) throws ChunkStorageException {
        this(directory, null);
    }

    /**
     * @param directory the cache directory
     * @param allocation the allocation strategy, or {@code null} to {@link FileAllocation#probe probe} it
     * @throws ChunkStorageException if the directory can't be created
     */
    public ChunkStore(@NonNull Path directory, FileAllocation allocation) throws ChunkStorageException {
        this.directory = directory;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new ChunkStorageException("Unable to create cache directory " + directory, e);
        }
        this.allocation = allocation == null ? FileAllocation.probe(directory) : allocation;
        this.channels = Caffeine.newBuilder()
                .maximumSize(256)
                .expireAfterAccess(Duration.ofMinutes(5))
                .removalListener(this::onChannelRemoval)
                .build(this::openChannel);
    }

    public Path directory() {
        return directory;
    }

    public FileAllocation allocation() {
        return allocation;
    }

    /**
     * @return the file an entry with the given key is stored at
     */
    public Path pathFor(CacheEntryKey key) {
        return directory.resolve(hash(key) + FILE_EXTENSION);
    }

    /**
     * Creates the entry's file if missing, and grows it to the entry's expected size when known. Files are never
     * shrunk.
     */
    public void openOrCreate(CacheEntry entry) throws ChunkStorageException {
        final Path path = entry.filePath();
        growLock.writeLock().lock();
        try {
            FileChannel channel = channel(path);
            long currentSize = channel.size();
            if (entry.expectedSize().isPresent()) {
                long expected = entry.expectedSize().getAsLong();
                if (currentSize < expected) {
                    allocation.grow(channel, currentSize, expected);
                    logger.debug("Allocated {} ({} bytes, {})", path, expected, allocation);
                }
            }
        } catch (IOException e) {
            throw failure("Unable to allocate cache file " + path, e);
        } finally {
            growLock.writeLock().unlock();
        }
    }

    /**
     * Writes the remaining bytes of {@code data} at {@code offset}.
     */
    public void write(CacheEntry entry, long offset, ByteBuffer data) throws ChunkStorageException {
        growLock.readLock().lock();
        try {
            writeFully(entry.filePath(), offset, data);
        } catch (IOException e) {
            throw failure(
                    "Error writing %d bytes at %d to %s".formatted(data.remaining(), offset, entry.filePath()), e);
        } finally {
            growLock.readLock().unlock();
        }
    }

    private void writeFully(Path path, long offset, ByteBuffer data) throws IOException {
        final int start = data.position();
        try {
            FileChannel channel = channel(path);
            long position = offset;
            while (data.hasRemaining()) {
                position += channel.write(data, position);
            }
        } catch (ClosedChannelException evicted) {
            // channel evicted by another thread mid-write, reopen and resume
            channels.invalidate(path);
            FileChannel channel = channel(path);
            long position = offset;
            data.position(start);
            while (data.hasRemaining()) {
                position += channel.write(data, position);
            }
        }
    }

    /**
     * Reads exactly {@code length} bytes at {@code offset} into {@code target}.
     * <p>
     * On success the target's position is advanced by {@code length}, on failure it is left unchanged.
     *
     * @return {@code length}
     * @throws ChunkStorageException if the file is missing, shorter than requested, or can't be read
     */
    public int read(CacheEntry entry, long offset, int length, ByteBuffer target) throws ChunkStorageException {
        final Path path = entry.filePath();
        ByteBuffer dst = target.duplicate();
        dst.limit(dst.position() + length);
        try {
            readFully(path, offset, dst);
        } catch (ClosedChannelException evicted) {
            channels.invalidate(path);
            dst = target.duplicate();
            dst.limit(dst.position() + length);
            try {
                readFully(path, offset, dst);
            } catch (IOException e) {
                throw failure("Error reading %d bytes at %d from %s".formatted(length, offset, path), e);
            }
        } catch (IOException e) {
            throw failure("Error reading %d bytes at %d from %s".formatted(length, offset, path), e);
        }
        target.position(dst.position());
        return length;
    }

    /**
     * Convenience method to read into a new buffer.
     *
     * @return a buffer with {@code length} bytes ready to be consumed
     */
    public ByteBuffer read(CacheEntry entry, long offset, int length) throws ChunkStorageException {
        ByteBuffer buffer = ByteBuffer.allocate(length);
        read(entry, offset, length, buffer);
        return buffer.flip();
    }

    private void readFully(Path path, long offset, ByteBuffer dst) throws IOException {
        FileChannel channel = channel(path);
        long position = offset;
        while (dst.hasRemaining()) {
            int read = channel.read(dst, position);
            if (read < 0) {
                throw new IOException("Unexpected end of file at " + position);
            }
            position += read;
        }
    }

    /**
     * Closes and deletes the entry's file.
     */
    public void delete(CacheEntry entry) throws ChunkStorageException {
        final Path path = entry.filePath();
        channels.invalidate(path);
        try {
            Files.deleteIfExists(path);
            logger.debug("Deleted cache file {}", path);
        } catch (IOException e) {
            throw failure("Unable to delete cache file " + path, e);
        }
    }

    /**
     * @return the current size of the entry's file, {@code 0} if it doesn't exist
     */
    public long fileSize(CacheEntry entry) throws ChunkStorageException {
        try {
            return Files.exists(entry.filePath()) ? Files.size(entry.filePath()) : 0L;
        } catch (IOException e) {
            throw failure("Unable to get size of " + entry.filePath(), e);
        }
    }

    @Override
    public void close() {
        closed = true;
        channels.invalidateAll();
        channels.cleanUp();
    }

    private FileChannel channel(Path path) throws IOException {
        if (closed) {
            throw new IllegalStateException("ChunkStore is closed");
        }
        try {
            return requireNonNull(channels.get(path));
        } catch (UncheckedIOException e) {
            throw e.getCause();
        } catch (CompletionException e) {
            if (e.getCause() instanceof IOException io) {
                throw io;
            }
            throw e;
        }
    }

    private FileChannel openChannel(Path path) {
        try {
            return FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void onChannelRemoval(Path path, FileChannel channel, @NonNull RemovalCause cause) {
        if (channel != null && channel.isOpen()) {
            try {
                channel.close();
                logger.debug("Closed cache file channel: path={}, cause={}", path, cause);
            } catch (IOException e) {
                logger.warn("Failed to close cache file channel: {}", path, e);
            }
        }
    }

    private ChunkStorageException failure(String message, IOException cause) {
        ChunkStorageException e = new ChunkStorageException(message, cause);
        if (e.isDiskFull()) {
            logger.error("Disk full in cache directory {}: {}", directory, cause.getMessage());
        } else if (cause instanceof NoSuchFileException) {
            logger.warn("Cache file missing: {}", cause.getMessage());
        }
        return e;
    }

    static String hash(CacheEntryKey key) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            byte[] hash = digest.digest(key.toString().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            return String.format("%08x", key.hashCode());
        }
    }
}
