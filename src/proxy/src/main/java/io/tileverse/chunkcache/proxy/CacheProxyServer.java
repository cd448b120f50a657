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

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.tileverse.chunkcache.ChunkCache;
import io.tileverse.chunkcache.config.ChunkCacheConfig;
import io.tileverse.chunkcache.index.CacheEntry;
import io.tileverse.chunkcache.index.CacheEntryKey;
import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;

/**
 * Local HTTP server exposing a {@link ChunkCache} to media players.
 * <p>
 * The server doesn't own the cache, closing it leaves the cache open.
 *
 * <pre>{@code
 * try (CacheProxyServer proxy = CacheProxyServer.builder().cache(cache).build().start()) {
 *     URI playable = proxy.registerStream(CacheEntryKey.of("jellyfin", itemId, "original"), originUri);
 *     player.play(playable);
 * }
 * }</pre>
 */
@Slf4j
public class CacheProxyServer implements Closeable {

    /** How long an unused stream registration is kept. */
    public static final Duration STREAM_EXPIRY = Duration.ofHours(12);

    private final ChunkCache cache;
    private final ChunkCacheConfig config;
    private final Server server;
    private final ServerConnector connector;
    private final ProxyCounters counters = new ProxyCounters();

    // stream id to entry id
    private final Cache<String, Long> streams;

    private ScheduledExecutorService statsReporter;

    private CacheProxyServer(Builder builder) {
        this.cache = requireNonNull(builder.cache, "cache");
        this.config = cache.config();
        this.streams = Caffeine.newBuilder().expireAfterAccess(builder.streamExpiry).build();

        this.server = new Server();
        this.connector = new ServerConnector(server);
        connector.setHost(config.proxyHost());
        connector.setPort(config.proxyPort());
        server.addConnector(connector);

        ServletContextHandler context = new ServletContextHandler();
        context.setContextPath("/");
        CacheProxyServlet servlet =
                new CacheProxyServlet(cache, id -> Optional.ofNullable(streams.getIfPresent(id)), counters);
        context.addServlet(new ServletHolder(servlet), "/*");
        server.setHandler(context);
    }

    /**
     * Starts listening, and the periodic statistics report if enabled.
     *
     * @return this
     * @throws IOException if the server can't bind its port
     */
    public CacheProxyServer start() throws IOException {
        try {
            server.start();
        } catch (Exception e) {
            throw new IOException(
                    "Unable to start cache proxy on %s:%d".formatted(config.proxyHost(), config.proxyPort()), e);
        }
        log.info("Cache proxy listening on {}", baseUri());
        if (config.statsEnabled()) {
            startStatsReporting(config.statsInterval());
        }
        return this;
    }

    private void startStatsReporting(Duration interval) {
        statsReporter = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "cache-proxy-stats");
            thread.setDaemon(true);
            return thread;
        });
        statsReporter.scheduleAtFixedRate(
                this::logStats, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    void logStats() {
        ProxyStats stats = stats();
        if (stats.requests() > 0) {
            log.info("{}", stats);
        }
    }

    /**
     * @return the port the server is bound to, the ephemeral one if configured with port {@code 0}
     */
    public int port() {
        return connector.getLocalPort();
    }

    public URI baseUri() {
        return URI.create("http://" + hostForUri() + ":" + port());
    }

    /**
     * Opens the cache entry for {@code key} and issues a stream URL for it.
     *
     * @param key the entry key
     * @param originUrl the URL the resource is downloaded from
     * @return the proxy URL to hand to the player
     * @throws IOException if the entry can't be opened
     */
    public URI registerStream(CacheEntryKey key, URI originUrl) throws IOException {
        CacheEntry entry = cache.open(key, originUrl);
        String streamId = UUID.randomUUID().toString();
        streams.put(streamId, entry.id());
        log.info("Registered stream {} for entry {} ({})", streamId, entry.id(), key);
        return baseUri().resolve("/stream/" + streamId);
    }

    /**
     * @return the proxy URL serving the entry with the given key
     */
    public URI cacheUri(CacheEntryKey key) {
        String path = "/cache/" + key.sourceId() + "/" + key.mediaId() + "/" + key.quality();
        try {
            return new URI("http", null, hostForUri(), port(), path, null, null);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid cache key for a URI path: " + key, e);
        }
    }

    public ProxyStats stats() {
        return counters.snapshot();
    }

    public ChunkCache cache() {
        return cache;
    }

    private String hostForUri() {
        String host = config.proxyHost();
        return host.contains(":") && !host.startsWith("[") ? "[" + host + "]" : host;
    }

    @Override
    public void close() throws IOException {
        if (statsReporter != null) {
            statsReporter.shutdownNow();
        }
        try {
            server.stop();
        } catch (Exception e) {
            throw new IOException("Error stopping cache proxy", e);
        }
        log.info("Cache proxy stopped, {}", stats());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for CacheProxyServer. Host, port and serving parameters come from the cache's
     * {@link ChunkCacheConfig}.
     */
    public static class Builder {

        private ChunkCache cache;
        private Duration streamExpiry = STREAM_EXPIRY;

        private Builder() {}

        public Builder cache(ChunkCache cache) {
            this.cache = requireNonNull(cache);
            return this;
        }

        public Builder streamExpiry(Duration streamExpiry) {
            this.streamExpiry = requireNonNull(streamExpiry);
            return this;
        }

        public CacheProxyServer build() {
            return new CacheProxyServer(this);
        }
    }
}
