/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.core.storage;

import ai.evacortex.pltx.core.PltxTestFiles;
import ai.evacortex.pltx.core.Sample;
import ai.evacortex.pltx.core.storage.io.ChunkCache;
import ai.evacortex.pltx.testkit.PltxFileBuilder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrentCursorsTest {

    @TempDir
    Path tempDir;

    @Test
    @Timeout(30)
    void testParallelCursorsMatchSequentialReads() throws Exception {
        assertParallelMatchesSequential(ReaderOptions.defaults());
    }

    @Test
    @Timeout(30)
    void testParallelCursorsWithSharedCache() throws Exception {
        assertParallelMatchesSequential(ReaderOptions.defaults().withChunkCache(new ChunkCache(256 * 1024)));
    }

    private void assertParallelMatchesSequential(ReaderOptions options) throws Exception {
        Path file = PltxTestFiles.interleaved(PltxFileBuilder.COMPRESSION_ZLIB, 40, 64)
                .writeTo(tempDir.resolve("parallel.pltx"));
        String[] names = {"alpha", "beta"};
        int cursors = 16;

        try (PltxReader reader = PltxReader.open(file, options)) {
            Map<String, List<Sample>> expected = Map.of(
                    "alpha", sequential(reader, "alpha"),
                    "beta", sequential(reader, "beta"));

            Queue<Throwable> errors = new ConcurrentLinkedQueue<>();
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(cursors);
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < cursors; i++) {
                String name = names[i % names.length];
                futures.add(pool.submit(() -> {
                    try (SignalCursor cursor = reader.openCursor(name)) {
                        start.await();
                        List<Sample> got = PltxTestFiles.drain(cursor);
                        if (!expected.get(name).equals(got)) {
                            errors.add(new AssertionError("Sequence of " + name + " differs"));
                        }
                        if (cursor.seq() != got.size()) {
                            errors.add(new AssertionError("seq " + cursor.seq() + " != " + got.size()));
                        }
                    } catch (Throwable e) {
                        errors.add(e);
                    }
                }));
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(20, TimeUnit.SECONDS));
            for (Future<?> f : futures) f.get();

            assertTrue(errors.isEmpty(), () -> "Errors: " + errors);
            assertEquals(1, reader.refCount());
        }
    }

    private static List<Sample> sequential(PltxReader reader, String name) {
        try (SignalCursor cursor = reader.openCursor(name)) {
            List<Sample> samples = PltxTestFiles.drain(cursor);
            assertEquals(40 * 64, samples.size());
            return samples;
        }
    }
}
