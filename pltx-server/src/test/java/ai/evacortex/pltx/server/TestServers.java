/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.server;

import com.typesafe.config.ConfigFactory;

import java.util.Map;

/** Server configurations for tests: loopback, ephemeral port, small cache. */
public final class TestServers {

    private TestServers() {}

    public static ServerConfig config() {
        return config(Map.of());
    }

    /** Test defaults with {@code overrides} (full {@code pltx.*} paths) applied on top. */
    public static ServerConfig config(Map<String, Object> overrides) {
        return ServerConfig.from(ConfigFactory.parseMap(overrides)
                .withFallback(ConfigFactory.parseMap(Map.of(
                        "pltx.server.host", "127.0.0.1",
                        "pltx.server.port", 0,
                        "pltx.streaming.max-streams", 16,
                        "pltx.reader.chunk-cache.max-bytes", "1m")))
                .withFallback(ConfigFactory.defaultReference())
                .resolve());
    }
}
