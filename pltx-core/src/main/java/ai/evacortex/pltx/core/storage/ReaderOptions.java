/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.core.storage;

import ai.evacortex.pltx.core.storage.io.ChunkCache;

import java.util.Objects;
import java.util.Set;

/**
 * Settings applied when a file is opened.
 *
 * @param supportedVersions format versions this reader accepts; anything else is rejected
 * @param chunkCache        decoded chunk cache shared between readers, or {@link ChunkCache#disabled()}
 */
public record ReaderOptions(Set<Integer> supportedVersions, ChunkCache chunkCache) {

    public static final Set<Integer> DEFAULT_VERSIONS = Set.of(2);

    public ReaderOptions {
        Objects.requireNonNull(supportedVersions, "supportedVersions");
        Objects.requireNonNull(chunkCache, "chunkCache");
        if (supportedVersions.isEmpty()) throw new IllegalArgumentException("No supported versions");
        supportedVersions = Set.copyOf(supportedVersions);
    }

    public static ReaderOptions defaults() {
        return new ReaderOptions(DEFAULT_VERSIONS, ChunkCache.disabled());
    }

    public ReaderOptions withChunkCache(ChunkCache cache) {
        return new ReaderOptions(supportedVersions, cache);
    }
}
