/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.core.storage.io;

import ai.evacortex.pltx.core.storage.util.AutoLock;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.ClosedChannelException;
import java.nio.file.Path;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FileHandle gives serialized, read-only access to byte ranges of one open file.
 *
 * <p>
 * The underlying {@link RandomAccessFile} has a single file pointer shared by every
 * caller. {@link #readRange(long, int)} holds an exclusive lock for the whole
 * seek-and-read, so reads issued concurrently by different cursors never interleave
 * and never observe each other's buffers. Callers block only for the duration of
 * their own I/O plus any read already in progress.
 * </p>
 *
 * <p>
 * Stream-style I/O is used instead of an interruptible channel: interrupting one
 * worker thread must not close the descriptor shared by all the others.
 * </p>
 */
public final class FileHandle implements Closeable {

    private final Path path;
    private final RandomAccessFile file;
    private final long size;
    private final ReentrantLock lock = new ReentrantLock();
    private boolean closed;

    private FileHandle(Path path, RandomAccessFile file, long size) {
        this.path = path;
        this.file = file;
        this.size = size;
    }

    public static FileHandle open(Path path) throws IOException {
        RandomAccessFile raf = new RandomAccessFile(path.toFile(), "r");
        try {
            return new FileHandle(path, raf, raf.length());
        } catch (RuntimeException e) {
            raf.close();
            throw e;
        }
    }

    /**
     * Reads exactly {@code length} bytes starting at {@code offset}.
     *
     * @throws EOFException           if the range does not lie within the file
     * @throws ClosedChannelException if the handle has been closed
     */
    public byte[] readRange(long offset, int length) throws IOException {
        if (offset < 0 || length < 0 || offset > size - length) {
            throw new EOFException("Range [" + offset + ", +" + length + ") outside " + path.getFileName()
                    + " (" + size + " bytes)");
        }
        byte[] out = new byte[length];
        try (AutoLock ignored = AutoLock.exclusive(lock)) {
            if (closed) throw new ClosedChannelException();
            file.seek(offset);
            file.readFully(out);
        }
        return out;
    }

    /** {@link #readRange(long, int)} wrapped as a little-endian buffer. */
    public ByteBuffer readBuffer(long offset, int length) throws IOException {
        return ByteBuffer.wrap(readRange(offset, length)).order(ByteOrder.LITTLE_ENDIAN);
    }

    public long size() {
        return size;
    }

    public Path path() {
        return path;
    }

    public boolean isOpen() {
        try (AutoLock ignored = AutoLock.exclusive(lock)) {
            return !closed;
        }
    }

    @Override
    public void close() throws IOException {
        try (AutoLock ignored = AutoLock.exclusive(lock)) {
            if (closed) return;
            closed = true;
            file.close();
        }
    }
}
