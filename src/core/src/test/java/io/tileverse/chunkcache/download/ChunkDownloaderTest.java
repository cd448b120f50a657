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

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.anyUrl;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.head;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static com.github.tomakehurst.wiremock.stubbing.Scenario.STARTED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import io.tileverse.chunkcache.ChunkDownloadException;
import io.tileverse.chunkcache.ChunkLayout;
import io.tileverse.chunkcache.ChunkNotFoundException;
import io.tileverse.chunkcache.ChunkStorageException;
import io.tileverse.chunkcache.Priority;
import io.tileverse.chunkcache.TestData;
import io.tileverse.chunkcache.index.CacheEntry;
import io.tileverse.chunkcache.index.CacheEntryKey;
import io.tileverse.chunkcache.index.CacheIndex;
import io.tileverse.chunkcache.index.InMemoryCacheIndex;
import io.tileverse.chunkcache.manager.ChunkManager;
import io.tileverse.chunkcache.store.ChunkStore;
import io.tileverse.chunkcache.store.FileAllocation;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.junit.jupiter.api.io.TempDir;

class ChunkDownloaderTest {

    private static final String PATH = "/videos/movie.mp4";
    private static final int CHUNK_SIZE = 1024;
    private static final byte[] DATA = TestData.create(4000);

    @RegisterExtension
    static WireMockExtension wm = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    @TempDir
    Path tempDir;

    private CacheIndex index;
    private ChunkStore store;
    private ChunkDownloader downloader;
    private final List<Long> recorded = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        index = new InMemoryCacheIndex();
        store = new ChunkStore(tempDir, FileAllocation.SPARSE);
        RetryPolicy retries = new RetryPolicy(3, Duration.ofMillis(10), Duration.ofMillis(50), 2.0);
        downloader = new ChunkDownloader(
                index, store, new ChunkLayout(CHUNK_SIZE), HttpClient.newHttpClient(), retries);
        downloader.setListener((entryId, chunkIndex) -> recorded.add(chunkIndex));
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private CacheEntry createEntry(Long size) throws IOException {
        CacheEntryKey key = CacheEntryKey.of("origin", "movie", "original");
        URI uri = URI.create(wm.baseUrl() + PATH);
        CacheEntry entry = index.getOrCreateEntry(key, uri, store.pathFor(key));
        if (size != null) {
            index.updateExpectedTotalSize(entry.id(), size);
            entry = index.findEntry(entry.id()).orElseThrow();
            store.openOrCreate(entry);
        }
        return entry;
    }

    private static void stubRange(int start, int end) {
        byte[] body = TestData.slice(DATA, start, end);
        wm.stubFor(get(urlEqualTo(PATH))
                .withHeader("Range", equalTo("bytes=" + start + "-" + (end - 1)))
                .willReturn(aResponse()
                        .withStatus(206)
                        .withHeader("Content-Range", "bytes " + start + "-" + (end - 1) + "/" + DATA.length)
                        .withBody(body)));
    }

    private byte[] readStored(CacheEntry entry, int start, int end) throws IOException {
        ByteBuffer buffer = store.read(entry, start, end - start);
        byte[] bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        return bytes;
    }

    @Test
    void storageFailureAbortsDownloadWithoutRetry() throws IOException {
        ChunkStore failingStore = new ChunkStore(tempDir.resolve("failing"), FileAllocation.SPARSE) {
            @Override
            public void write(CacheEntry entry, long offset, ByteBuffer data) throws ChunkStorageException {
                throw new ChunkStorageException("Error writing to " + entry.filePath());
            }
        };
        RetryPolicy retries = new RetryPolicy(3, Duration.ofMillis(10), Duration.ofMillis(50), 2.0);
        ChunkLayout layout = new ChunkLayout(CHUNK_SIZE);
        ChunkDownloader failing =
                new ChunkDownloader(index, failingStore, layout, HttpClient.newHttpClient(), retries);
        CacheEntry entry = createEntry((long) DATA.length);
        stubRange(1024, 2048);

        assertThrows(ChunkStorageException.class, () -> failing.download(entry.id(), 1));
        wm.verify(1, getRequestedFor(urlEqualTo(PATH)));
        assertThat(index.listChunks(entry.id())).isEmpty();

        ChunkManager manager = ChunkManager.builder()
                .index(index)
                .downloader(failing)
                .layout(layout)
                .maxConcurrentDownloads(1)
                .lookaheadChunks(0)
                .build();
        try {
            ChunkDownloadException e = assertThrows(
                    ChunkDownloadException.class,
                    () -> manager.fetchChunk(entry.id(), 1, Priority.CRITICAL, Duration.ofSeconds(30)));
            assertThat(e.isTransient()).isFalse();
            assertThat(e.getCause()).isInstanceOf(ChunkStorageException.class);
        } finally {
            manager.close();
            failingStore.close();
        }
        wm.verify(2, getRequestedFor(urlEqualTo(PATH)));
        assertThat(index.chunkExists(entry.id(), 1024, 2048)).isFalse();
    }

    @Test
    void downloadsChunkWithRangeRequest() throws IOException {
        CacheEntry entry = createEntry((long) DATA.length);
        stubRange(1024, 2048);

        downloader.download(entry.id(), 1);

        wm.verify(1, getRequestedFor(urlEqualTo(PATH)).withHeader("Range", equalTo("bytes=1024-2047")));
        assertThat(index.chunkExists(entry.id(), 1024, 2048)).isTrue();
        assertThat(readStored(entry, 1024, 2048)).isEqualTo(TestData.slice(DATA, 1024, 2048));
        assertThat(recorded).containsExactly(1L);
    }

    @Test
    void lastChunkIsTruncatedAtResourceSize() throws IOException {
        CacheEntry entry = createEntry((long) DATA.length);
        stubRange(3072, 4000);

        downloader.download(entry.id(), 3);

        assertThat(index.listChunks(entry.id())).singleElement().satisfies(c -> {
            assertThat(c.startByte()).isEqualTo(3072);
            assertThat(c.endByte()).isEqualTo(4000);
        });
        assertThat(readStored(entry, 3072, 4000)).isEqualTo(TestData.slice(DATA, 3072, 4000));
    }

    @Test
    void cachedChunkIsNotDownloadedAgain() throws IOException {
        CacheEntry entry = createEntry((long) DATA.length);
        index.recordChunk(entry.id(), 0, 1024);

        downloader.download(entry.id(), 0);

        wm.verify(0, getRequestedFor(anyUrl()));
        assertThat(recorded).isEmpty();
    }

    @Test
    void entryIsMarkedCompleteOnceFullyCovered() throws IOException {
        CacheEntry entry = createEntry((long) DATA.length);
        for (int i = 0; i < 4; i++) {
            stubRange(i * CHUNK_SIZE, Math.min((i + 1) * CHUNK_SIZE, DATA.length));
        }
        for (int i = 0; i < 3; i++) {
            downloader.download(entry.id(), i);
        }
        assertThat(index.findEntry(entry.id()).orElseThrow().complete()).isFalse();

        downloader.download(entry.id(), 3);

        assertThat(index.findEntry(entry.id()).orElseThrow().complete()).isTrue();
        assertThat(readStored(entry, 0, DATA.length)).isEqualTo(DATA);
    }

    @Test
    void transientFailuresAreRetried() throws IOException {
        CacheEntry entry = createEntry((long) DATA.length);
        wm.stubFor(get(urlEqualTo(PATH))
                .inScenario("flaky origin")
                .whenScenarioStateIs(STARTED)
                .willReturn(aResponse().withStatus(503))
                .willSetStateTo("recovered"));
        wm.stubFor(get(urlEqualTo(PATH))
                .inScenario("flaky origin")
                .whenScenarioStateIs("recovered")
                .willReturn(aResponse()
                        .withStatus(206)
                        .withHeader("Content-Range", "bytes 0-1023/" + DATA.length)
                        .withBody(TestData.slice(DATA, 0, 1024))));

        downloader.download(entry.id(), 0);

        wm.verify(2, getRequestedFor(urlEqualTo(PATH)));
        assertThat(index.chunkExists(entry.id(), 0, 1024)).isTrue();
    }

    @Test
    void retriesAreBounded() throws IOException {
        CacheEntry entry = createEntry((long) DATA.length);
        wm.stubFor(get(urlEqualTo(PATH)).willReturn(aResponse().withStatus(500)));

        ChunkDownloadException e =
                assertThrows(ChunkDownloadException.class, () -> downloader.download(entry.id(), 0));

        assertThat(e.isTransient()).isFalse();
        wm.verify(3, getRequestedFor(urlEqualTo(PATH)));
        assertThat(index.listChunks(entry.id())).isEmpty();
    }

    @Test
    void clientErrorsAreNotRetried() throws IOException {
        CacheEntry entry = createEntry((long) DATA.length);
        wm.stubFor(get(urlEqualTo(PATH)).willReturn(aResponse().withStatus(404)));

        ChunkDownloadException e =
                assertThrows(ChunkDownloadException.class, () -> downloader.download(entry.id(), 0));

        assertThat(e.isTransient()).isFalse();
        wm.verify(1, getRequestedFor(urlEqualTo(PATH)));
    }

    @Test
    void authenticationFailure() throws IOException {
        CacheEntry entry = createEntry((long) DATA.length);
        wm.stubFor(get(urlEqualTo(PATH)).willReturn(aResponse().withStatus(403)));

        ChunkDownloadException e =
                assertThrows(ChunkDownloadException.class, () -> downloader.download(entry.id(), 0));

        assertThat(e.getMessage()).contains("Authentication failed");
        wm.verify(1, getRequestedFor(urlEqualTo(PATH)));
    }

    @Test
    void originIgnoringRangeFallsBackToSequentialDownload() throws IOException {
        CacheEntry entry = createEntry((long) DATA.length);
        wm.stubFor(get(urlEqualTo(PATH)).willReturn(aResponse().withStatus(200).withBody(DATA)));

        downloader.download(entry.id(), 2);

        assertThat(downloader.isSequential(entry.id())).isTrue();
        assertThat(index.listChunks(entry.id())).hasSize(4);
        assertThat(recorded).containsExactlyInAnyOrder(0L, 1L, 2L, 3L);
        assertThat(index.findEntry(entry.id()).orElseThrow().complete()).isTrue();
        assertThat(readStored(entry, 0, DATA.length)).isEqualTo(DATA);
    }

    @Test
    void unknownSizeIsLearnedFromContentRange() throws IOException {
        CacheEntry entry = createEntry(null);
        stubRange(0, 1024);

        downloader.download(entry.id(), 0);

        CacheEntry updated = index.findEntry(entry.id()).orElseThrow();
        assertThat(updated.expectedSize()).hasValue(DATA.length);
        assertThat(store.fileSize(updated)).isEqualTo(DATA.length);
        assertThat(readStored(updated, 0, 1024)).isEqualTo(TestData.slice(DATA, 0, 1024));
    }

    @Test
    void chunkPastEndIsRejected() throws IOException {
        CacheEntry entry = createEntry((long) DATA.length);
        assertThrows(ChunkNotFoundException.class, () -> downloader.download(entry.id(), 4));
        assertThrows(ChunkNotFoundException.class, () -> downloader.download(entry.id() + 100, 0));
        wm.verify(0, getRequestedFor(anyUrl()));
    }

    @Test
    void probeSizeWithHeadRequest() throws IOException {
        CacheEntry entry = createEntry(null);
        wm.stubFor(head(urlEqualTo(PATH))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Length", String.valueOf(DATA.length))
                        .withHeader("Accept-Ranges", "bytes")));

        OptionalLong size = downloader.probeSize(entry.id());

        assertThat(size).hasValue(DATA.length);
        assertThat(index.findEntry(entry.id()).orElseThrow().expectedSize()).hasValue(DATA.length);
        assertThat(downloader.isSequential(entry.id())).isFalse();
    }

    @Test
    void probeSizeWithoutHeadSupport() throws IOException {
        CacheEntry entry = createEntry(null);
        wm.stubFor(head(urlEqualTo(PATH)).willReturn(aResponse().withStatus(405)));

        assertThat(downloader.probeSize(entry.id())).isEmpty();
        assertThat(index.findEntry(entry.id()).orElseThrow().expectedSize()).isEmpty();
    }

    @Test
    void parseContentRangeTotal() {
        assertThat(ChunkDownloader.parseContentRangeTotal("bytes 0-1023/4000")).hasValue(4000);
        assertThat(ChunkDownloader.parseContentRangeTotal("bytes 0-1023/*")).isEmpty();
        assertThat(ChunkDownloader.parseContentRangeTotal("items 0-1/2")).isEmpty();
    }
}
