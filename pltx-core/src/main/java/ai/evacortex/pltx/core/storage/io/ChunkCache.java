/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.core.storage.io;

import ai.evacortex.pltx.core.storage.io.codec.DecodedChunk;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.io.Closeable;
import java.util.function.Supplier;

/**
 * Process-wide cache of decoded chunks, shared by every reader that is handed the
 * same instance.
 *
 * <p>
 * Keys are {@code (readerId, chunkOffset)}: two opens of the same file are distinct
 * readers and never share entries. Values are weighed by their decoded size and the
 * cache is bounded by {@code maxBytes}; a bound of zero disables caching entirely and
 * every lookup goes straight to the loader.
 * </p>
 *
 * <p>
 * Cursors still buffer at most their current chunk. The cache only saves the I/O and
 * decode work when several cursors walk the same signal close together.
 * </p>
 */
public final class ChunkCache implements Closeable {

    private record Key(long readerId, long chunkOffset) {}

    private final Cache<Key, DecodedChunk> cache;
    private final long maxBytes;

    public ChunkCache(long maxBytes) {
        if (maxBytes < 0) throw new IllegalArgumentException("maxBytes must be >= 0: " + maxBytes);
        this.maxBytes = maxBytes;
        this.cache = maxBytes == 0 ? null : Caffeine.newBuilder()
                .maximumWeight(maxBytes)
                .weigher((Key k, DecodedChunk c) -> c.weightInBytes())
                .build();
    }

    public static ChunkCache disabled() {
        return new ChunkCache(0);
    }

    public boolean isEnabled() {
        return cache != null;
    }

    public long maxBytes() {
        return maxBytes;
    }

    /**
     * Returns the cached chunk or loads it. Loader failures propagate unchanged and
     * leave nothing behind in the cache.
     *
     * <p>
     * The loader runs outside the cache's own locking, so a slow read never delays
     * lookups of other chunks. Two cursors missing the same chunk at once may both
     * load it; the first one stored wins and both get that instance.
     * </p>
     */
    public DecodedChunk get(long readerId, long chunkOffset, Supplier<DecodedChunk> loader) {
        if (cache == null) return loader.get();
        Key key = new Key(readerId, chunkOffset);
        DecodedChunk cached = cache.getIfPresent(key);
        if (cached != null) return cached;

        DecodedChunk loaded = loader.get();
        DecodedChunk raced = cache.asMap().putIfAbsent(key, loaded);
        return raced != null ? raced : loaded;
    }

    public boolean contains(long readerId, long chunkOffset) {
        return cache != null && cache.getIfPresent(new Key(readerId, chunkOffset)) != null;
    }

    /** Drops every entry of a reader that has been closed. */
    public void invalidateReader(long readerId) {
        if (cache == null) return;
        cache.asMap().keySet().removeIf(k -> k.readerId() == readerId);
    }

    @Override
    public void close() {
        if (cache == null) return;
        cache.invalidateAll();
        cache.cleanUp();
    }
}
