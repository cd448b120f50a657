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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.tileverse.chunkcache.ChunkStorageException;
import io.tileverse.chunkcache.TestData;
import io.tileverse.chunkcache.index.CacheEntry;
import io.tileverse.chunkcache.index.CacheEntryKey;
import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class ChunkStoreTest {

    private static final CacheEntryKey KEY = CacheEntryKey.of("src", "media", "original");

    @TempDir
    Path tempDir;

    private ChunkStore store;

    @AfterEach
    void tearDown() {
        if (store != null) {
            store.close();
        }
    }

    private CacheEntry entry(Long size) {
        Instant now = Instant.now();
        return new CacheEntry(
                1, KEY, URI.create("http://origin/media.mp4"), store.pathFor(KEY), size, false, now, now);
    }

    @ParameterizedTest
    @EnumSource(FileAllocation.class)
    void openOrCreateAllocatesExpectedSize(FileAllocation allocation) throws IOException {
        store = new ChunkStore(tempDir, allocation);
        CacheEntry entry = entry(3_000_000L);

        store.openOrCreate(entry);

        assertThat(entry.filePath()).exists();
        assertThat(Files.size(entry.filePath())).isEqualTo(3_000_000L);
        assertThat(store.fileSize(entry)).isEqualTo(3_000_000L);
        // allocated regions read back as zeros
        ByteBuffer head = store.read(entry, 0, 16);
        assertThat(head.remaining()).isEqualTo(16);
        while (head.hasRemaining()) {
            assertThat(head.get()).isZero();
        }
    }

    @Test
    void openOrCreateWithUnknownSizeCreatesEmptyFile() throws IOException {
        store = new ChunkStore(tempDir, FileAllocation.SPARSE);
        CacheEntry entry = entry(null);

        store.openOrCreate(entry);

        assertThat(entry.filePath()).exists();
        assertThat(store.fileSize(entry)).isZero();
    }

    @Test
    void filesAreNeverShrunk() throws IOException {
        store = new ChunkStore(tempDir, FileAllocation.SPARSE);
        store.openOrCreate(entry(2048L));
        store.openOrCreate(entry(1024L));
        assertThat(store.fileSize(entry(null))).isEqualTo(2048L);
    }

    @Test
    void writeAndReadBack() throws IOException {
        store = new ChunkStore(tempDir, FileAllocation.SPARSE);
        CacheEntry entry = entry(4096L);
        store.openOrCreate(entry);
        byte[] data = TestData.create(1024);

        store.write(entry, 2048, ByteBuffer.wrap(data));

        ByteBuffer read = store.read(entry, 2048, 1024);
        byte[] actual = new byte[read.remaining()];
        read.get(actual);
        assertThat(actual).isEqualTo(data);
    }

    @Test
    void readAdvancesTargetPosition() throws IOException {
        store = new ChunkStore(tempDir, FileAllocation.SPARSE);
        CacheEntry entry = entry(1024L);
        store.openOrCreate(entry);
        store.write(entry, 0, ByteBuffer.wrap(TestData.create(1024)));

        ByteBuffer target = ByteBuffer.allocate(200);
        target.position(50);
        assertThat(store.read(entry, 10, 100, target)).isEqualTo(100);
        assertThat(target.position()).isEqualTo(150);
        assertThat(target.get(50)).isEqualTo((byte) 10);
    }

    @Test
    void readPastEndOfFileFails() throws IOException {
        store = new ChunkStore(tempDir, FileAllocation.SPARSE);
        CacheEntry entry = entry(1024L);
        store.openOrCreate(entry);

        ByteBuffer target = ByteBuffer.allocate(200);
        assertThrows(ChunkStorageException.class, () -> store.read(entry, 900, 200, target));
        assertThat(target.position()).isZero();
    }

    @Test
    void pathForIsStable() throws IOException {
        store = new ChunkStore(tempDir, FileAllocation.SPARSE);
        Path path = store.pathFor(KEY);

        assertThat(path.getParent()).isEqualTo(tempDir);
        assertThat(path.getFileName().toString()).matches("[0-9a-f]{32}\\.cache");
        assertThat(store.pathFor(CacheEntryKey.of("src", "media", "original"))).isEqualTo(path);
        assertThat(store.pathFor(CacheEntryKey.of("src", "media", "720p"))).isNotEqualTo(path);
    }

    @Test
    void deleteRemovesFile() throws IOException {
        store = new ChunkStore(tempDir, FileAllocation.SPARSE);
        CacheEntry entry = entry(1024L);
        store.openOrCreate(entry);

        store.delete(entry);

        assertThat(entry.filePath()).doesNotExist();
        assertThat(store.fileSize(entry)).isZero();
    }

    @Test
    void createsMissingDirectory() throws IOException {
        Path nested = tempDir.resolve("a/b/c");
        store = new ChunkStore(nested);
        assertThat(nested).isDirectory();
        assertThat(store.allocation()).isNotNull();
    }
}
