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

import static java.util.Objects.requireNonNull;

import io.tileverse.chunkcache.ChunkLayout;
import io.tileverse.chunkcache.download.RetryPolicy;
import io.tileverse.chunkcache.store.FileAllocation;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Configuration of a {@link io.tileverse.chunkcache.ChunkCache} and its proxy.
 * <p>
 * Holds a map of parameter values keyed by {@link CacheParameter#key()}, with typed accessors falling back to
 * each parameter's default. Values may be given either typed or as strings, as when loaded
 * {@link #fromProperties(Properties) from properties}.
 */
public class ChunkCacheConfig {

    /** Prefix shared by every configuration key. */
    public static final String PREFIX = "io.tileverse.chunkcache.";

    public static final CacheParameter<Path> CACHE_DIRECTORY = CacheParameter.builder()
            .key(PREFIX + "cache-directory")
            .title("Cache directory")
            .description("Directory holding one cache file per entry")
            .group(CacheParameter.GROUP_CACHE)
            .type(Path.class)
            .defaultValue(Path.of(System.getProperty("java.io.tmpdir"), "tileverse-chunkcache"))
            .build();

    public static final CacheParameter<Long> CHUNK_SIZE = CacheParameter.builder()
            .key(PREFIX + "chunk-size")
            .title("Chunk size")
            .description("Size in bytes of the download and caching unit")
            .group(CacheParameter.GROUP_CACHE)
            .type(Long.class)
            .defaultValue(ChunkLayout.DEFAULT_CHUNK_SIZE)
            .build();

    public static final CacheParameter<String> FILE_ALLOCATION = CacheParameter.builder()
            .key(PREFIX + "file-allocation")
            .title("File allocation")
            .description("How cache files are grown: auto (probe the file system), sparse or preallocated")
            .group(CacheParameter.GROUP_CACHE)
            .type(String.class)
            .defaultValue("auto")
            .build();

    public static final CacheParameter<Integer> MAX_CONCURRENT_DOWNLOADS = CacheParameter.builder()
            .key(PREFIX + "max-concurrent-downloads")
            .title("Maximum concurrent downloads")
            .description("Global ceiling of chunk downloads in flight, shared by all entries")
            .group(CacheParameter.GROUP_DOWNLOAD)
            .type(Integer.class)
            .defaultValue(3)
            .build();

    public static final CacheParameter<Integer> LOOKAHEAD_CHUNKS = CacheParameter.builder()
            .key(PREFIX + "lookahead-chunks")
            .title("Lookahead chunks")
            .description("Number of chunks past the playback position requested at high priority")
            .group(CacheParameter.GROUP_CACHE)
            .type(Integer.class)
            .defaultValue(10)
            .build();

    public static final CacheParameter<Duration> CHUNK_WAIT_TIMEOUT = CacheParameter.builder()
            .key(PREFIX + "chunk-wait-timeout")
            .title("Chunk wait timeout")
            .description("How long a consumer waits for a missing chunk")
            .group(CacheParameter.GROUP_CACHE)
            .type(Duration.class)
            .defaultValue(Duration.ofSeconds(30))
            .build();

    public static final CacheParameter<Boolean> ENABLE_BACKGROUND_FILL = CacheParameter.builder()
            .key(PREFIX + "enable-background-fill")
            .title("Background fill")
            .description("Request every missing chunk at low priority when an entry is opened")
            .group(CacheParameter.GROUP_CACHE)
            .type(Boolean.class)
            .defaultValue(true)
            .build();

    public static final CacheParameter<Integer> MAX_RETRIES = CacheParameter.builder()
            .key(PREFIX + "max-retries")
            .title("Maximum download attempts")
            .description("Attempts per chunk before a transient failure becomes permanent")
            .group(CacheParameter.GROUP_DOWNLOAD)
            .type(Integer.class)
            .defaultValue(RetryPolicy.DEFAULT.maxAttempts())
            .build();

    public static final CacheParameter<Duration> RETRY_INITIAL_DELAY = CacheParameter.builder()
            .key(PREFIX + "retry-initial-delay")
            .title("Initial retry delay")
            .group(CacheParameter.GROUP_DOWNLOAD)
            .type(Duration.class)
            .defaultValue(RetryPolicy.DEFAULT.initialDelay())
            .build();

    public static final CacheParameter<Duration> RETRY_MAX_DELAY = CacheParameter.builder()
            .key(PREFIX + "retry-max-delay")
            .title("Maximum retry delay")
            .group(CacheParameter.GROUP_DOWNLOAD)
            .type(Duration.class)
            .defaultValue(RetryPolicy.DEFAULT.maxDelay())
            .build();

    public static final CacheParameter<Duration> CONNECT_TIMEOUT = CacheParameter.builder()
            .key(PREFIX + "connect-timeout")
            .title("Origin connection timeout")
            .group(CacheParameter.GROUP_DOWNLOAD)
            .type(Duration.class)
            .defaultValue(Duration.ofSeconds(5))
            .build();

    public static final CacheParameter<String> PROXY_HOST = CacheParameter.builder()
            .key(PREFIX + "proxy.host")
            .title("Proxy bind address")
            .group(CacheParameter.GROUP_PROXY)
            .type(String.class)
            .defaultValue("127.0.0.1")
            .build();

    public static final CacheParameter<Integer> PROXY_PORT = CacheParameter.builder()
            .key(PREFIX + "proxy.port")
            .title("Proxy port")
            .description("0 binds an ephemeral port")
            .group(CacheParameter.GROUP_PROXY)
            .type(Integer.class)
            .defaultValue(0)
            .build();

    public static final CacheParameter<Long> DIRECT_READ_THRESHOLD = CacheParameter.builder()
            .key(PREFIX + "proxy.direct-read-threshold")
            .title("Direct read threshold")
            .description("Spans shorter than this are buffered whole, longer spans are streamed chunk by chunk")
            .group(CacheParameter.GROUP_PROXY)
            .type(Long.class)
            .defaultValue(50L * 1024 * 1024)
            .build();

    public static final CacheParameter<Duration> RETRY_AFTER = CacheParameter.builder()
            .key(PREFIX + "proxy.retry-after")
            .title("Retry-After")
            .description("Value of the Retry-After header sent along 503 responses")
            .group(CacheParameter.GROUP_PROXY)
            .type(Duration.class)
            .defaultValue(Duration.ofSeconds(5))
            .build();

    public static final CacheParameter<String> CONTENT_TYPE = CacheParameter.builder()
            .key(PREFIX + "proxy.content-type")
            .title("Content type")
            .group(CacheParameter.GROUP_PROXY)
            .type(String.class)
            .defaultValue("video/mp4")
            .build();

    public static final CacheParameter<Boolean> ENABLE_STATS = CacheParameter.builder()
            .key(PREFIX + "proxy.enable-stats")
            .title("Periodic statistics report")
            .group(CacheParameter.GROUP_PROXY)
            .type(Boolean.class)
            .defaultValue(true)
            .build();

    public static final CacheParameter<Duration> STATS_INTERVAL = CacheParameter.builder()
            .key(PREFIX + "proxy.stats-interval")
            .title("Statistics report interval")
            .group(CacheParameter.GROUP_PROXY)
            .type(Duration.class)
            .defaultValue(Duration.ofSeconds(30))
            .build();

    /** Every known parameter. */
    public static final List<CacheParameter<?>> PARAMETERS = List.of(
            CACHE_DIRECTORY,
            CHUNK_SIZE,
            FILE_ALLOCATION,
            MAX_CONCURRENT_DOWNLOADS,
            LOOKAHEAD_CHUNKS,
            CHUNK_WAIT_TIMEOUT,
            ENABLE_BACKGROUND_FILL,
            MAX_RETRIES,
            RETRY_INITIAL_DELAY,
            RETRY_MAX_DELAY,
            CONNECT_TIMEOUT,
            PROXY_HOST,
            PROXY_PORT,
            DIRECT_READ_THRESHOLD,
            RETRY_AFTER,
            CONTENT_TYPE,
            ENABLE_STATS,
            STATS_INTERVAL);

    private final Map<String, Object> parameterValues = new HashMap<>();

    public ChunkCacheConfig() {
        // Default constructor
    }

    /**
     * Sets a parameter value by its key.
     * <p>
     * Note: This method does not validate the key against the known {@link #PARAMETERS}.
     *
     * @param key The key of the parameter.
     * @param value The value of the parameter, {@code null} to unset it.
     * @return this
     */
    public ChunkCacheConfig setParameter(String key, Object value) {
        requireNonNull(key, "key");
        if (value == null) {
            parameterValues.remove(key);
        } else {
            parameterValues.put(key, value);
        }
        return this;
    }

    public <T> ChunkCacheConfig setParameter(CacheParameter<T> param, T value) {
        return setParameter(param.key(), value);
    }

    /**
     * @return the explicitly set value of {@code param}, converted to its type
     * @throws IllegalArgumentException if the value can't be converted
     */
    public <T> Optional<T> getParameter(CacheParameter<T> param) {
        return getParameter(param.key(), param.type());
    }

    public <T> Optional<T> getParameter(String key, Class<T> type) {
        Object value = parameterValues.get(requireNonNull(key, "key"));
        requireNonNull(type, "type");
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(convert(value, type));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid value for %s: '%s'".formatted(key, value), e);
        }
    }

    /**
     * @return the value of {@code param}, or its default if not set
     */
    public <T> T get(CacheParameter<T> param) {
        return getParameter(param).orElseGet(param::requireDefault);
    }

    public Path cacheDirectory() {
        return get(CACHE_DIRECTORY);
    }

    public long chunkSize() {
        return positive(CHUNK_SIZE, get(CHUNK_SIZE));
    }

    public ChunkLayout chunkLayout() {
        return new ChunkLayout(chunkSize());
    }

    /**
     * @return the configured allocation strategy, empty to probe the file system
     */
    public Optional<FileAllocation> fileAllocation() {
        String value = get(FILE_ALLOCATION).trim().toUpperCase(Locale.ROOT);
        if ("AUTO".equals(value)) {
            return Optional.empty();
        }
        try {
            return Optional.of(FileAllocation.valueOf(value));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "%s must be one of auto, sparse, preallocated: %s".formatted(FILE_ALLOCATION.key(), value), e);
        }
    }

    public int maxConcurrentDownloads() {
        return positive(MAX_CONCURRENT_DOWNLOADS, get(MAX_CONCURRENT_DOWNLOADS)).intValue();
    }

    public int lookaheadChunks() {
        int lookahead = get(LOOKAHEAD_CHUNKS);
        if (lookahead < 0) {
            throw new IllegalArgumentException(LOOKAHEAD_CHUNKS.key() + " can't be negative: " + lookahead);
        }
        return lookahead;
    }

    public Duration chunkWaitTimeout() {
        return get(CHUNK_WAIT_TIMEOUT);
    }

    public boolean backgroundFillEnabled() {
        return get(ENABLE_BACKGROUND_FILL);
    }

    public RetryPolicy retryPolicy() {
        int attempts = positive(MAX_RETRIES, get(MAX_RETRIES)).intValue();
        return new RetryPolicy(
                attempts, get(RETRY_INITIAL_DELAY), get(RETRY_MAX_DELAY), RetryPolicy.DEFAULT.multiplier());
    }

    public Duration connectTimeout() {
        return get(CONNECT_TIMEOUT);
    }

    public String proxyHost() {
        return get(PROXY_HOST);
    }

    public int proxyPort() {
        return get(PROXY_PORT);
    }

    public long directReadThreshold() {
        return positive(DIRECT_READ_THRESHOLD, get(DIRECT_READ_THRESHOLD));
    }

    public Duration retryAfter() {
        return get(RETRY_AFTER);
    }

    public String contentType() {
        return get(CONTENT_TYPE);
    }

    public boolean statsEnabled() {
        return get(ENABLE_STATS);
    }

    public Duration statsInterval() {
        return get(STATS_INTERVAL);
    }

    private static Long positive(CacheParameter<?> param, Number value) {
        if (value.longValue() <= 0) {
            throw new IllegalArgumentException(param.key() + " must be positive: " + value);
        }
        return value.longValue();
    }

    /**
     * Converts an object to a specified target type.
     * <p>
     * Durations accept either ISO-8601 ({@code PT30S}) or a plain number of seconds.
     *
     * @throws IllegalArgumentException if the conversion to the specified type is not supported.
     */
    static <T> T convert(Object value, Class<T> type) {
        if (type.isInstance(value)) return type.cast(value);

        final String string = String.valueOf(value).trim();
        Object converted;
        if (type.equals(String.class)) {
            converted = string;
        } else if (type.equals(Boolean.class)) {
            converted = Boolean.valueOf(string);
        } else if (type.equals(Integer.class)) {
            converted = Integer.parseInt(string);
        } else if (type.equals(Long.class)) {
            converted = Long.parseLong(string);
        } else if (type.equals(Duration.class)) {
            converted = parseDuration(string);
        } else if (type.equals(Path.class)) {
            converted = Path.of(string);
        } else if (type.equals(URI.class)) {
            converted = URI.create(string);
        } else {
            throw new IllegalArgumentException("Unsupported conversion %s to %s"
                    .formatted(value.getClass().getCanonicalName(), type.getCanonicalName()));
        }
        return type.cast(converted);
    }

    private static Duration parseDuration(String value) {
        try {
            return Duration.ofSeconds(Long.parseLong(value));
        } catch (NumberFormatException notSeconds) {
            try {
                return Duration.parse(value);
            } catch (DateTimeParseException e) {
                e.addSuppressed(notSeconds);
                throw e;
            }
        }
    }

    /**
     * @return the explicitly set parameters as strings, durations in ISO-8601
     */
    public Properties toProperties() {
        Properties properties = new Properties();
        parameterValues.forEach((name, v) -> properties.setProperty(name, String.valueOf(v)));
        return properties;
    }

    /**
     * Creates a configuration from {@link Properties}. Keys outside {@link #PREFIX} are ignored.
     *
     * @param properties the properties to read
     * @return a new config
     * @throws IllegalArgumentException if a known parameter has an invalid value
     */
    public static ChunkCacheConfig fromProperties(Properties properties) {
        requireNonNull(properties);
        ChunkCacheConfig config = new ChunkCacheConfig();
        properties.forEach((k, v) -> {
            String key = String.valueOf(k);
            if (key.startsWith(PREFIX)) {
                config.setParameter(key, v);
            }
        });
        PARAMETERS.forEach(config::getParameter);
        return config;
    }

    /**
     * @return a config with every parameter explicitly set to its default value
     */
    public static ChunkCacheConfig withDefaults() {
        ChunkCacheConfig config = new ChunkCacheConfig();
        PARAMETERS.stream()
                .filter(p -> p.defaultValue().isPresent())
                .forEach(p -> config.setParameter(p.key(), p.defaultValue().orElseThrow()));
        return config;
    }

    @Override
    public String toString() {
        return "ChunkCacheConfig" + parameterValues;
    }
}
