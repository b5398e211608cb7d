/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.core.storage.io;

import ai.evacortex.pltx.core.storage.ChunkDescriptor;
import ai.evacortex.pltx.core.storage.io.codec.ChunkCodec;
import ai.evacortex.pltx.core.storage.io.codec.Compression;
import ai.evacortex.pltx.core.storage.io.codec.DecodedChunk;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class ChunkCacheTest {

    @Test
    void testDisabledCacheAlwaysLoads() {
        try (ChunkCache cache = ChunkCache.disabled()) {
            assertFalse(cache.isEnabled());
            assertEquals(0, cache.maxBytes());
            AtomicInteger loads = new AtomicInteger();
            Supplier<DecodedChunk> loader = counting(loads, 4);
            cache.get(1, 100, loader);
            cache.get(1, 100, loader);
            assertEquals(2, loads.get());
            assertFalse(cache.contains(1, 100));
        }
    }

    @Test
    void testEntriesAreKeyedByReaderAndOffset() {
        try (ChunkCache cache = new ChunkCache(1 << 20)) {
            assertTrue(cache.isEnabled());
            AtomicInteger loads = new AtomicInteger();
            DecodedChunk first = cache.get(1, 100, counting(loads, 4));
            assertSame(first, cache.get(1, 100, counting(loads, 4)));
            cache.get(2, 100, counting(loads, 4));
            assertEquals(2, loads.get());
            assertTrue(cache.contains(1, 100));
            assertTrue(cache.contains(2, 100));
        }
    }

    @Test
    void testInvalidateReaderDropsOnlyItsEntries() {
        try (ChunkCache cache = new ChunkCache(1 << 20)) {
            AtomicInteger loads = new AtomicInteger();
            cache.get(1, 100, counting(loads, 2));
            cache.get(1, 200, counting(loads, 2));
            cache.get(2, 100, counting(loads, 2));

            cache.invalidateReader(1);
            assertFalse(cache.contains(1, 100));
            assertFalse(cache.contains(1, 200));
            assertTrue(cache.contains(2, 100));
        }
    }

    @Test
    void testLoaderFailureLeavesNoEntry() {
        try (ChunkCache cache = new ChunkCache(1 << 20)) {
            assertThrows(IllegalStateException.class, () -> cache.get(1, 100, () -> {
                throw new IllegalStateException("boom");
            }));
            assertFalse(cache.contains(1, 100));
        }
    }

    @Test
    @Timeout(10)
    void testSlowLoadDoesNotBlockOtherChunks() throws Exception {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try (ChunkCache cache = new ChunkCache(1 << 20)) {
            CountDownLatch loading = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            Future<DecodedChunk> slow = pool.submit(() -> cache.get(1, 100, () -> {
                loading.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return chunk(2);
            }));
            assertTrue(loading.await(5, TimeUnit.SECONDS));

            // every other key must stay reachable while the first load is parked
            AtomicInteger loads = new AtomicInteger();
            for (long offset = 200; offset < 264; offset++) {
                cache.get(1, offset, counting(loads, 1));
                cache.get(2, 100, counting(loads, 1));
            }
            assertFalse(slow.isDone());

            release.countDown();
            assertEquals(2, slow.get(5, TimeUnit.SECONDS).size());
            assertTrue(cache.contains(1, 100));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testConcurrentMissKeepsFirstStoredChunk() {
        try (ChunkCache cache = new ChunkCache(1 << 20)) {
            DecodedChunk[] inner = new DecodedChunk[1];
            // a second miss on the same key lands while the outer load is still running
            DecodedChunk outer = cache.get(1, 100, () -> {
                inner[0] = cache.get(1, 100, () -> chunk(3));
                return chunk(3);
            });
            assertSame(inner[0], outer);
            assertSame(outer, cache.get(1, 100, () -> fail("should be cached")));
        }
    }

    @Test
    void testNegativeBoundRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ChunkCache(-1));
    }

    private static Supplier<DecodedChunk> counting(AtomicInteger loads, int samples) {
        return () -> {
            loads.incrementAndGet();
            return chunk(samples);
        };
    }

    private static DecodedChunk chunk(int samples) {
        ByteBuffer buf = ByteBuffer.allocate(samples * 16).order(ByteOrder.LITTLE_ENDIAN);
        for (int i = 0; i < samples; i++) {
            buf.putDouble(i).putDouble(i * 2.0);
        }
        byte[] raw = buf.array();
        ChunkDescriptor descriptor = new ChunkDescriptor(1, 0, 36, raw.length, raw.length, samples,
                0.0, samples - 1, Compression.NONE);
        assertFalse(descriptor.compressed());
        return ChunkCodec.decode(raw, descriptor);
    }
}
