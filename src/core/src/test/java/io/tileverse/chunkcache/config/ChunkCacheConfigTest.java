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
package io.tileverse.chunkcache.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.tileverse.chunkcache.download.RetryPolicy;
import io.tileverse.chunkcache.store.FileAllocation;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class ChunkCacheConfigTest {

    @Test
    void defaults() {
        ChunkCacheConfig config = new ChunkCacheConfig();
        assertThat(config.chunkSize()).isEqualTo(10L * 1024 * 1024);
        assertThat(config.maxConcurrentDownloads()).isEqualTo(3);
        assertThat(config.lookaheadChunks()).isEqualTo(10);
        assertThat(config.chunkWaitTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.backgroundFillEnabled()).isTrue();
        assertThat(config.retryPolicy()).isEqualTo(RetryPolicy.DEFAULT);
        assertThat(config.proxyHost()).isEqualTo("127.0.0.1");
        assertThat(config.directReadThreshold()).isEqualTo(50L * 1024 * 1024);
        assertThat(config.retryAfter()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.contentType()).isEqualTo("video/mp4");
        assertThat(config.statsInterval()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void fromProperties() {
        Properties props = new Properties();
        props.setProperty("io.tileverse.chunkcache.chunk-size", "1048576");
        props.setProperty("io.tileverse.chunkcache.max-concurrent-downloads", "5");
        props.setProperty("io.tileverse.chunkcache.chunk-wait-timeout", "PT2.5S");
        props.setProperty("io.tileverse.chunkcache.proxy.retry-after", "10");
        props.setProperty("io.tileverse.chunkcache.enable-background-fill", "false");
        props.setProperty("io.tileverse.chunkcache.cache-directory", "/var/cache/media");
        props.setProperty("unrelated.key", "ignored");

        ChunkCacheConfig config = ChunkCacheConfig.fromProperties(props);

        assertThat(config.chunkSize()).isEqualTo(1048576L);
        assertThat(config.maxConcurrentDownloads()).isEqualTo(5);
        assertThat(config.chunkWaitTimeout()).isEqualTo(Duration.ofMillis(2500));
        assertThat(config.retryAfter()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.backgroundFillEnabled()).isFalse();
        assertThat(config.cacheDirectory()).isEqualTo(Path.of("/var/cache/media"));
        assertThat(config.toProperties()).doesNotContainKey("unrelated.key");
    }

    @Test
    void toPropertiesRoundTripsTypedValues() {
        ChunkCacheConfig config = new ChunkCacheConfig()
                .setParameter(ChunkCacheConfig.CHUNK_WAIT_TIMEOUT, Duration.ofMillis(1500))
                .setParameter(ChunkCacheConfig.LOOKAHEAD_CHUNKS, 4);

        ChunkCacheConfig copy = ChunkCacheConfig.fromProperties(config.toProperties());

        assertThat(copy.chunkWaitTimeout()).isEqualTo(Duration.ofMillis(1500));
        assertThat(copy.lookaheadChunks()).isEqualTo(4);
    }

    @Test
    void invalidValuesAreRejected() {
        Properties props = new Properties();
        props.setProperty("io.tileverse.chunkcache.chunk-size", "ten megs");
        assertThrows(IllegalArgumentException.class, () -> ChunkCacheConfig.fromProperties(props));

        ChunkCacheConfig config = new ChunkCacheConfig().setParameter(ChunkCacheConfig.CHUNK_SIZE, 0L);
        assertThrows(IllegalArgumentException.class, config::chunkSize);

        config.setParameter(ChunkCacheConfig.LOOKAHEAD_CHUNKS, -1);
        assertThrows(IllegalArgumentException.class, config::lookaheadChunks);
    }

    @Test
    void fileAllocation() {
        ChunkCacheConfig config = new ChunkCacheConfig();
        assertThat(config.fileAllocation()).isEmpty();
        config.setParameter(ChunkCacheConfig.FILE_ALLOCATION, "sparse");
        assertThat(config.fileAllocation()).hasValue(FileAllocation.SPARSE);
        config.setParameter(ChunkCacheConfig.FILE_ALLOCATION, "Preallocated");
        assertThat(config.fileAllocation()).hasValue(FileAllocation.PREALLOCATED);
        config.setParameter(ChunkCacheConfig.FILE_ALLOCATION, "fallocate");
        assertThrows(IllegalArgumentException.class, config::fileAllocation);
    }

    @Test
    void withDefaultsSetsEveryParameter() {
        ChunkCacheConfig config = ChunkCacheConfig.withDefaults();
        for (CacheParameter<?> param : ChunkCacheConfig.PARAMETERS) {
            assertThat(config.getParameter(param)).as(param.key()).isPresent();
        }
    }

    @Test
    void parameterDefaultMustMatchType() {
        CacheParameter.Builder builder = CacheParameter.builder()
                .key("k")
                .title("t")
                .group(CacheParameter.GROUP_CACHE)
                .type(Integer.class)
                .defaultValue("not a number");
        assertThrows(IllegalArgumentException.class, builder::build);
    }
}
