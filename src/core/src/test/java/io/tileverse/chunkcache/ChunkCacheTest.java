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

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.head;
import static com.github.tomakehurst.wiremock.client.WireMock.headRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import io.tileverse.chunkcache.config.ChunkCacheConfig;
import io.tileverse.chunkcache.index.CacheEntry;
import io.tileverse.chunkcache.index.CacheEntryKey;
import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.junit.jupiter.api.io.TempDir;

/**
 * End to end tests of {@link ChunkCache} against a mock origin.
 */
class ChunkCacheTest {

    private static final String PATH = "/library/episode.mkv";
    private static final int CHUNK_SIZE = 1024;
    private static final byte[] DATA = TestData.create(4000);
    private static final CacheEntryKey KEY = CacheEntryKey.of("jellyfin", "episode-7", "original");

    @RegisterExtension
    static WireMockExtension wm = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    @TempDir
    Path tempDir;

    private URI origin;
    private ChunkCacheConfig config;
    private ChunkCache cache;

    @BeforeEach
    void setUp() {
        origin = URI.create(wm.baseUrl() + PATH);
        config = new ChunkCacheConfig()
                .setParameter(ChunkCacheConfig.CACHE_DIRECTORY, tempDir.resolve("cache"))
                .setParameter(ChunkCacheConfig.FILE_ALLOCATION, "sparse")
                .setParameter(ChunkCacheConfig.CHUNK_SIZE, (long) CHUNK_SIZE)
                .setParameter(ChunkCacheConfig.ENABLE_BACKGROUND_FILL, false)
                .setParameter(ChunkCacheConfig.LOOKAHEAD_CHUNKS, 0)
                .setParameter(ChunkCacheConfig.CHUNK_WAIT_TIMEOUT, Duration.ofSeconds(5))
                .setParameter(ChunkCacheConfig.RETRY_INITIAL_DELAY, Duration.ofMillis(10));
        for (int start = 0; start < DATA.length; start += CHUNK_SIZE) {
            stubRange(start, Math.min(start + CHUNK_SIZE, DATA.length));
        }
    }

    @AfterEach
    void tearDown() {
        if (cache != null) {
            cache.close();
        }
    }

    private static void stubRange(int start, int end) {
        wm.stubFor(get(urlEqualTo(PATH))
                .withHeader("Range", equalTo("bytes=" + start + "-" + (end - 1)))
                .willReturn(aResponse()
                        .withStatus(206)
                        .withHeader("Content-Range", "bytes " + start + "-" + (end - 1) + "/" + DATA.length)
                        .withBody(TestData.slice(DATA, start, end))));
    }

    private ChunkCache cache() throws IOException {
        cache = ChunkCache.builder().config(config).build();
        return cache;
    }

    /** Creates the entry with a known size so opening it doesn't probe the origin. */
    private CacheEntry openSized() throws IOException {
        CacheEntry entry = cache.index().getOrCreateEntry(KEY, origin, cache.store().pathFor(KEY));
        cache.index().updateExpectedTotalSize(entry.id(), DATA.length);
        return cache.open(KEY, origin);
    }

    private static byte[] bytes(ByteBuffer buffer) {
        buffer.flip();
        byte[] bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        return bytes;
    }

    @Test
    void openProbesSizeAndAllocatesFile() throws IOException {
        wm.stubFor(head(urlEqualTo(PATH))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Length", String.valueOf(DATA.length))
                        .withHeader("Accept-Ranges", "bytes")));
        cache();

        CacheEntry entry = cache.open(KEY, origin);

        wm.verify(1, headRequestedFor(urlEqualTo(PATH)));
        assertThat(entry.expectedSize()).hasValue(DATA.length);
        assertThat(cache.store().fileSize(entry)).isEqualTo(DATA.length);
        CacheStatus status = cache.status(entry.id());
        assertThat(status.cachedChunks()).isZero();
        assertThat(status.totalChunks()).isEqualTo(4);
        assertThat(cache.open(KEY, origin).id()).isEqualTo(entry.id());
    }

    @Test
    void readerDownloadsOnlyMissingChunks() throws IOException {
        cache();
        CacheEntry entry = openSized();
        RangeReader reader = cache.reader(entry.id());

        ByteBuffer first = reader.readRange(1500, 1000);
        assertThat(bytes(first)).isEqualTo(TestData.slice(DATA, 1500, 2500));
        wm.verify(2, getRequestedFor(urlEqualTo(PATH)));
        wm.verify(getRequestedFor(urlEqualTo(PATH)).withHeader("Range", equalTo("bytes=1024-2047")));
        wm.verify(getRequestedFor(urlEqualTo(PATH)).withHeader("Range", equalTo("bytes=2048-3071")));

        ByteBuffer again = reader.readRange(1100, 900);
        assertThat(bytes(again)).isEqualTo(TestData.slice(DATA, 1100, 2000));
        wm.verify(2, getRequestedFor(urlEqualTo(PATH)));

        assertThat(cache.manager().availableChunks(entry.id())).containsExactly(1L, 2L);
    }

    @Test
    void readIsTruncatedAtEndOfResource() throws IOException {
        cache();
        CacheEntry entry = openSized();
        RangeReader reader = cache.reader(entry.id());

        ByteBuffer tail = reader.readRange(3900, 500);

        assertThat(bytes(tail)).isEqualTo(TestData.slice(DATA, 3900, 4000));
        assertThat(reader.readRange(4000, 10).position()).isZero();
        assertThat(reader.size()).hasValue(DATA.length);
    }

    @Test
    void sizeIsLearnedOnFirstReadWhenOriginDoesNotAnswerHead() throws IOException {
        wm.stubFor(head(urlEqualTo(PATH)).willReturn(aResponse().withStatus(405)));
        cache();
        CacheEntry entry = cache.open(KEY, origin);
        assertThat(entry.expectedSize()).isEmpty();

        ByteBuffer head = cache.reader(entry.id()).readRange(0, 100);

        assertThat(bytes(head)).isEqualTo(TestData.slice(DATA, 0, 100));
        assertThat(cache.find(entry.id()).orElseThrow().expectedSize()).hasValue(DATA.length);
    }

    @Test
    void backgroundFillCompletesEntry() throws IOException {
        config.setParameter(ChunkCacheConfig.ENABLE_BACKGROUND_FILL, true);
        cache();

        CacheEntry entry = openSized();

        await().atMost(Duration.ofSeconds(10))
                .until(() -> cache.status(entry.id()).complete());
        assertThat(cache.status(entry.id()).progressPercent()).isEqualTo(100d);
        assertThat(bytes(cache.reader(entry.id()).readRange(0, DATA.length))).isEqualTo(DATA);
        wm.verify(4, getRequestedFor(urlEqualTo(PATH)));
    }

    @Test
    void precacheDownloadsEveryChunk() throws IOException {
        cache();
        CacheEntry entry = openSized();

        assertThat(cache.precache(entry.id())).isEqualTo(4);

        await().atMost(Duration.ofSeconds(10))
                .until(() -> cache.status(entry.id()).cachedChunks() == 4);
        assertThat(cache.find(KEY).orElseThrow().complete()).isTrue();
    }

    @Test
    void failingOriginFailsRead() throws IOException {
        config.setParameter(ChunkCacheConfig.MAX_RETRIES, 1);
        cache();
        CacheEntry entry = openSized();
        wm.stubFor(get(urlEqualTo(PATH))
                .withHeader("Range", equalTo("bytes=0-1023"))
                .willReturn(aResponse().withStatus(502)));

        RangeReader reader = cache.reader(entry.id());
        ChunkDownloadException e = assertThrows(ChunkDownloadException.class, () -> reader.readRange(0, 10));
        assertThat(e.isTransient()).isFalse();
        assertThat(cache.manager().hasChunk(entry.id(), 0)).isFalse();
    }

    @Test
    void sourceIdentifier() throws IOException {
        cache();
        CacheEntry entry = openSized();
        assertThat(cache.reader(entry.id()).getSourceIdentifier()).isEqualTo("chunk-cached:" + origin);
    }
}
