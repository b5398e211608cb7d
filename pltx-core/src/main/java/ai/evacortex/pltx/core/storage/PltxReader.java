/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.core.storage;

import ai.evacortex.pltx.core.SignalMetadata;
import ai.evacortex.pltx.core.exceptions.ChunkReadException;
import ai.evacortex.pltx.core.exceptions.PltxOpenException;
import ai.evacortex.pltx.core.exceptions.PltxOpenException.Reason;
import ai.evacortex.pltx.core.exceptions.SignalNotFoundException;
import ai.evacortex.pltx.core.storage.io.ChunkCache;
import ai.evacortex.pltx.core.storage.io.FileHandle;
import ai.evacortex.pltx.core.storage.io.codec.ChunkCodec;
import ai.evacortex.pltx.core.storage.io.codec.DecodedChunk;
import ai.evacortex.pltx.core.storage.io.format.FileHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * PltxReader is the open form of one PLTX file: its parsed header, its signal index
 * and the single {@link FileHandle} all of its cursors read through.
 *
 * <h3>Lifecycle</h3>
 * <p>
 * A reader is reference counted. {@link #open(Path)} returns it with one reference,
 * owned by the caller and given up by {@link #close()}. Every other holder (the
 * signal catalog, each open {@link SignalCursor}) takes its own reference with
 * {@link #retain()} and gives it back with {@link #release()}. The file handle is
 * closed, and the reader's cached chunks dropped, when the count reaches zero.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <p>
 * The header and index are immutable after open and read without locking. Chunk
 * payload reads are serialized by the file handle; decoding runs on the calling
 * thread outside of any lock.
 * </p>
 *
 * @see SignalCursor
 * @see ReaderOptions
 */
public final class PltxReader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PltxReader.class);
    private static final AtomicLong IDS = new AtomicLong();

    private final long id;
    private final Path path;
    private final FileHandle file;
    private final FileHeader header;
    private final SignalIndex index;
    private final ChunkCache cache;
    private final AtomicInteger refs = new AtomicInteger(1);
    private final AtomicBoolean ownerReleased = new AtomicBoolean();

    private PltxReader(Path path, FileHandle file, FileHeader header, SignalIndex index, ChunkCache cache) {
        this.id = IDS.incrementAndGet();
        this.path = path;
        this.file = file;
        this.header = header;
        this.index = index;
        this.cache = cache;
    }

    public static PltxReader open(Path path) {
        return open(path, ReaderOptions.defaults());
    }

    /**
     * Opens {@code path}, validates its structure and builds the signal index. No
     * chunk payload is read.
     *
     * @throws PltxOpenException with reason {@code NOT_FOUND}, {@code BAD_HEADER},
     *                           {@code BAD_INDEX} or {@code IO_ERROR}
     */
    public static PltxReader open(Path path, ReaderOptions options) {
        if (!Files.exists(path)) {
            throw new PltxOpenException(Reason.NOT_FOUND, path, "no such file");
        }
        if (Files.isDirectory(path)) {
            throw new PltxOpenException(Reason.IO_ERROR, path, "is a directory");
        }

        FileHandle file;
        try {
            file = FileHandle.open(path);
        } catch (NoSuchFileException e) {
            throw new PltxOpenException(Reason.NOT_FOUND, path, "no such file", e);
        } catch (IOException e) {
            throw new PltxOpenException(Reason.IO_ERROR, path, String.valueOf(e.getMessage()), e);
        }

        IndexLoader.Loaded loaded;
        try {
            loaded = new IndexLoader(path, file, options.supportedVersions()).load();
        } catch (RuntimeException e) {
            closeAfterFailure(file, e);
            throw e;
        } catch (IOException e) {
            PltxOpenException failure = new PltxOpenException(Reason.IO_ERROR, path,
                    String.valueOf(e.getMessage()), e);
            closeAfterFailure(file, failure);
            throw failure;
        }

        PltxReader reader = new PltxReader(path, file, loaded.header(), loaded.index(), options.chunkCache());
        log.info("Opened {} (reader {}): version={}, compression={}, signals={}, chunks={}",
                path, reader.id, loaded.header().version(), loaded.header().compression(),
                loaded.index().signalCount(), loaded.index().chunkCount());
        return reader;
    }

    private static void closeAfterFailure(FileHandle file, RuntimeException failure) {
        try {
            file.close();
        } catch (IOException suppressed) {
            failure.addSuppressed(suppressed);
        }
    }

    /** Unique per open; two opens of the same path get different ids. */
    public long id()              { return id; }
    public Path path()            { return path; }
    public FileHeader header()    { return header; }

    /** File name without directories, used as the human-readable name of the reader. */
    public String displayName() {
        Path name = path.getFileName();
        return name != null ? name.toString() : path.toString();
    }

    /** Signals in index order. */
    public List<SignalMetadata> listSignals() {
        return index.signals();
    }

    public Optional<SignalMetadata> signal(String name) {
        return index.find(name).map(SignalIndex.Entry::metadata);
    }

    /** Opens a cursor over every sample of {@code name}. No I/O happens here. */
    public SignalCursor openCursor(String name) {
        SignalIndex.Entry entry = index.find(name).orElseThrow(() -> new SignalNotFoundException(name));
        retain();
        return new SignalCursor(this, entry, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, false);
    }

    /**
     * Opens a cursor over the samples of {@code name} with {@code from <= timestamp <= to}.
     * Chunks entirely outside the window are never read.
     *
     * @throws IllegalArgumentException if {@code from > to} or either bound is NaN
     */
    public SignalCursor openCursor(String name, double from, double to) {
        if (Double.isNaN(from) || Double.isNaN(to) || from > to) {
            throw new IllegalArgumentException("Invalid time window [" + from + ", " + to + "]");
        }
        SignalIndex.Entry entry = index.find(name).orElseThrow(() -> new SignalNotFoundException(name));
        retain();
        return new SignalCursor(this, entry, from, to, true);
    }

    SignalIndex index() {
        return index;
    }

    DecodedChunk loadChunk(ChunkDescriptor descriptor) {
        return cache.get(id, descriptor.chunkOffset(), () -> ChunkCodec.decode(readPayload(descriptor), descriptor));
    }

    private byte[] readPayload(ChunkDescriptor descriptor) {
        try {
            return file.readRange(descriptor.payloadOffset(), descriptor.storedLength());
        } catch (IOException e) {
            throw new ChunkReadException("Failed to read chunk at offset " + descriptor.chunkOffset()
                    + " of " + path, e);
        }
    }

    /**
     * Takes an additional reference.
     *
     * @throws IllegalStateException if the reader has already been fully released
     */
    public PltxReader retain() {
        while (true) {
            int current = refs.get();
            if (current <= 0) throw new IllegalStateException("Reader " + id + " for " + path + " is closed");
            if (refs.compareAndSet(current, current + 1)) return this;
        }
    }

    /** Gives back one reference; the last one closes the file. */
    public void release() {
        int left = refs.decrementAndGet();
        if (left > 0) return;
        if (left < 0) {
            refs.set(0);
            throw new IllegalStateException("Reader " + id + " released more often than retained");
        }
        cache.invalidateReader(id);
        try {
            file.close();
            log.debug("Closed {} (reader {})", path, id);
        } catch (IOException e) {
            log.warn("Failed to close {} (reader {})", path, id, e);
        }
    }

    /** Gives up the reference returned by {@link #open(Path)}. Further calls do nothing. */
    @Override
    public void close() {
        if (ownerReleased.compareAndSet(false, true)) release();
    }

    public int refCount() {
        return Math.max(refs.get(), 0);
    }

    public boolean isOpen() {
        return refs.get() > 0;
    }
}
