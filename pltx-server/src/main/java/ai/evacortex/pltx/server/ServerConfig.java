/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.server;

import ai.evacortex.pltx.core.storage.ReaderOptions;
import ai.evacortex.pltx.core.storage.io.ChunkCache;
import ai.evacortex.pltx.server.http.dto.ServiceInfo;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Server settings read from the {@code pltx} block of a Typesafe Config.
 *
 * <p>
 * Defaults live in {@code reference.conf}. An {@code application.conf} on the class
 * path, or a file given explicitly, overrides them; system properties override both.
 * </p>
 */
public record ServerConfig(String host,
                           int port,
                           Set<Integer> supportedVersions,
                           long chunkCacheMaxBytes,
                           int maxStreams,
                           ServiceInfo service,
                           CoreLink core) {

    /**
     * Optional link to an orchestrating core service: registration once at startup,
     * then a heartbeat at a fixed interval.
     */
    public record CoreLink(boolean enabled, String host, int port, Duration heartbeatInterval) {

        public CoreLink {
            if (port < 1 || port > 65535) throw new IllegalArgumentException("Invalid core port: " + port);
            if (heartbeatInterval.isNegative() || heartbeatInterval.isZero()) {
                throw new IllegalArgumentException("heartbeat-interval must be positive: " + heartbeatInterval);
            }
        }

        public String baseUrl() {
            return "http://" + host + ":" + port;
        }
    }

    public ServerConfig {
        if (port < 0 || port > 65535) throw new IllegalArgumentException("Invalid port: " + port);
        if (maxStreams < 1) throw new IllegalArgumentException("max-streams must be >= 1: " + maxStreams);
        if (chunkCacheMaxBytes < 0) throw new IllegalArgumentException("chunk-cache.max-bytes must be >= 0");
        if (supportedVersions.isEmpty()) throw new IllegalArgumentException("supported-versions must not be empty");
        supportedVersions = Set.copyOf(supportedVersions);
    }

    public static ServerConfig load() {
        return from(ConfigFactory.load());
    }

    public static ServerConfig load(Path file) {
        return from(ConfigFactory.load(ConfigFactory.parseFile(file.toFile())));
    }

    public static ServerConfig from(Config root) {
        Config c = root.getConfig("pltx");
        Config service = c.getConfig("service");
        Config core = c.getConfig("core");
        return new ServerConfig(
                c.getString("server.host"),
                c.getInt("server.port"),
                new LinkedHashSet<>(c.getIntList("reader.supported-versions")),
                c.getBytes("reader.chunk-cache.max-bytes"),
                c.getInt("streaming.max-streams"),
                new ServiceInfo(
                        service.getString("name"),
                        service.getString("id"),
                        service.getString("version"),
                        service.getString("description"),
                        service.getString("mode"),
                        service.getStringList("file-formats")),
                new CoreLink(
                        core.getBoolean("enabled"),
                        core.getString("target"),
                        core.getInt("target-port"),
                        core.getDuration("heartbeat-interval")));
    }

    public ServerConfig withEndpoint(String host, int port) {
        return new ServerConfig(host, port, supportedVersions, chunkCacheMaxBytes, maxStreams, service, core);
    }

    ReaderOptions readerOptions(ChunkCache cache) {
        return new ReaderOptions(supportedVersions, cache);
    }
}
