/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.server;

import ai.evacortex.pltx.core.catalog.RegisteredFile;
import ai.evacortex.pltx.core.catalog.SignalCatalog;
import ai.evacortex.pltx.core.storage.PltxReader;
import ai.evacortex.pltx.core.storage.ReaderOptions;
import ai.evacortex.pltx.core.storage.io.ChunkCache;
import ai.evacortex.pltx.server.http.FileController;
import ai.evacortex.pltx.server.http.HealthController;
import ai.evacortex.pltx.server.http.StreamController;
import ai.evacortex.pltx.server.registry.CoreRegistrar;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the catalog, the chunk cache, the streaming workers and the HTTP and
 * WebSocket routes into one Javalin application.
 *
 * <p>
 * Every stream gets a worker thread of its own, so a client that reads slowly only
 * ever holds up its own stream. The number of concurrent streams is capped at
 * upgrade time by {@code streaming.max-streams}.
 * </p>
 *
 * <p>
 * {@link #close()} stops the heartbeat and the listener first, then the workers
 * (running streams are interrupted and their sessions cancelled), and finally
 * releases every registered file. It may be called more than once and from any
 * thread, including through {@code GET /stop}.
 * </p>
 */
public final class PltxServer implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(PltxServer.class);

    // lets the /stop response reach the client before the listener goes away
    private static final long STOP_DELAY_MS = 100;

    private final ServerConfig config;
    private final ChunkCache chunkCache;
    private final SignalCatalog catalog;
    private final ReaderOptions readerOptions;
    private final ExecutorService workers;
    private final StreamController streams;
    private final Javalin app;
    private final CoreRegistrar registrar;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final CountDownLatch terminated = new CountDownLatch(1);
    private volatile boolean started;

    public PltxServer(ServerConfig config) {
        this.config = config;
        this.chunkCache = new ChunkCache(config.chunkCacheMaxBytes());
        this.catalog = new SignalCatalog();
        this.readerOptions = config.readerOptions(chunkCache);
        this.workers = Executors.newCachedThreadPool(new WorkerThreadFactory());

        ObjectMapper mapper = new ObjectMapper();
        this.app = Javalin.create(javalin -> {
            javalin.showJavalinBanner = false;
            javalin.jsonMapper(new JavalinJackson(mapper, false));
        });

        new HealthController(config.service(), this::requestStop).registerRoutes(app);
        new FileController(catalog, readerOptions).registerRoutes(app);
        this.streams = new StreamController(catalog, workers, mapper, config.maxStreams());
        streams.registerRoutes(app);

        this.registrar = config.core().enabled() ? new CoreRegistrar(config.core(), config.service(), mapper) : null;
    }

    /**
     * Binds the listener and, when a core link is enabled, registers with the core and
     * starts the heartbeat.
     *
     * @throws ai.evacortex.pltx.server.registry.CoreRegistrationException if the core refuses or cannot be reached;
     *         the listener is left running and the caller is expected to {@link #close()}
     */
    public PltxServer start() {
        app.start(config.host(), config.port());
        started = true;
        LOGGER.info("{} {} listening on {}:{} with up to {} streams, chunk cache {}", config.service().name(),
                config.service().version(), config.host(), app.port(), config.maxStreams(),
                chunkCache.isEnabled() ? chunkCache.maxBytes() + " bytes" : "disabled");
        if (registrar != null) {
            registrar.register(config.host(), app.port());
            registrar.startHeartbeat();
        }
        return this;
    }

    /**
     * Opens {@code path} with the server's reader settings and registers its signals.
     *
     * @throws ai.evacortex.pltx.core.exceptions.PltxOpenException if the file cannot be opened
     */
    public RegisteredFile open(Path path) {
        try (PltxReader reader = PltxReader.open(path, readerOptions)) {
            return catalog.register(reader);
        }
    }

    /** Bound port; only meaningful after {@link #start()}. */
    public int port() {
        return app.port();
    }

    public Javalin app() {
        return app;
    }

    public SignalCatalog catalog() {
        return catalog;
    }

    public int activeStreams() {
        return streams.activeStreams();
    }

    /** The core link, or {@code null} when registration is disabled. */
    public CoreRegistrar registrar() {
        return registrar;
    }

    /** Blocks until {@link #close()} has completed. */
    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return terminated.await(timeout, unit);
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Closes the server on a separate thread shortly after the calling request has
     * been answered.
     */
    void requestStop() {
        LOGGER.warn("Stop requested over HTTP, shutting down");
        Thread stopper = new Thread(() -> {
            try {
                Thread.sleep(STOP_DELAY_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            close();
        }, "pltx-stop");
        stopper.start();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        try {
            if (registrar != null) registrar.close();
            if (started) {
                app.stop();
                started = false;
            }
            workers.shutdownNow();
            try {
                if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                    LOGGER.warn("Stream workers did not terminate within 5s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            catalog.close();
            chunkCache.close();
            LOGGER.info("{} stopped", config.service().name());
        } finally {
            terminated.countDown();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "pltx-stream-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
