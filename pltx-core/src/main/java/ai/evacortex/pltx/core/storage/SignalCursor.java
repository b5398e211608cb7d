/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.core.storage;

import ai.evacortex.pltx.core.Sample;
import ai.evacortex.pltx.core.SignalMetadata;
import ai.evacortex.pltx.core.exceptions.ChunkDecodeException;
import ai.evacortex.pltx.core.exceptions.ChunkReadException;
import ai.evacortex.pltx.core.exceptions.PltxException;
import ai.evacortex.pltx.core.storage.io.codec.DecodedChunk;

import java.util.List;
import java.util.Optional;

/**
 * Forward-only iterator over the samples of one signal, in chunk order.
 *
 * <p>
 * At most one decoded chunk is held at a time; the next chunk is read and decoded
 * only when the current one is exhausted. The cursor holds a reference on its
 * {@link PltxReader} until it reaches {@link State#END}, {@link State#FAILED} or is
 * closed, whichever comes first.
 * </p>
 *
 * <p>
 * A cursor belongs to one thread at a time and is not safe for concurrent use.
 * </p>
 */
public final class SignalCursor implements AutoCloseable {

    public enum State { OPEN, END, FAILED, CLOSED }

    private final PltxReader reader;
    private final SignalMetadata signal;
    private final List<ChunkDescriptor> chunks;
    private final double from;
    private final double to;
    private final boolean windowed;

    private int nextChunk;
    private DecodedChunk current;
    private int position;
    private long seq;
    private State state = State.OPEN;
    private PltxException failure;
    private boolean holdsReader = true;

    SignalCursor(PltxReader reader, SignalIndex.Entry entry, double from, double to, boolean windowed) {
        this.reader = reader;
        this.signal = entry.metadata();
        this.chunks = entry.chunks();
        this.from = from;
        this.to = to;
        this.windowed = windowed;
    }

    /**
     * Returns the next sample, or empty once the signal is exhausted. Empty is final.
     *
     * @throws ChunkDecodeException  if a chunk payload is corrupt; repeated on every later call
     * @throws ChunkReadException    if a chunk payload cannot be read; repeated on every later call
     * @throws IllegalStateException if the cursor has been closed
     */
    public Optional<Sample> next() {
        switch (state) {
            case CLOSED:
                throw new IllegalStateException("Cursor on '" + signal.name() + "' is closed");
            case END:
                return Optional.empty();
            case FAILED:
                throw failure;
            default:
                break;
        }

        while (true) {
            if (current != null) {
                while (position < current.size()) {
                    int i = position++;
                    double ts = current.timestamp(i);
                    if (windowed && (ts < from || ts > to)) continue;
                    seq++;
                    return Optional.of(new Sample(ts, current.value(i)));
                }
                current = null;
            }

            if (nextChunk >= chunks.size()) {
                finish(State.END);
                return Optional.empty();
            }
            ChunkDescriptor descriptor = chunks.get(nextChunk++);
            if (descriptor.sampleCount() == 0) continue;
            if (windowed) {
                if (descriptor.startTime() > to) {
                    nextChunk = chunks.size();
                    continue;
                }
                if (!descriptor.overlaps(from, to)) continue;
            }

            try {
                current = reader.loadChunk(descriptor);
                position = 0;
            } catch (ChunkDecodeException | ChunkReadException e) {
                failure = e;
                finish(State.FAILED);
                throw e;
            }
        }
    }

    /** Number of samples returned so far. */
    public long seq() {
        return seq;
    }

    public State state() {
        return state;
    }

    public SignalMetadata signal() {
        return signal;
    }

    public PltxReader reader() {
        return reader;
    }

    /** Drops the buffered chunk and the reader reference. Idempotent. */
    @Override
    public void close() {
        if (state == State.CLOSED) return;
        state = State.CLOSED;
        current = null;
        releaseReader();
    }

    private void finish(State terminal) {
        state = terminal;
        current = null;
        releaseReader();
    }

    private void releaseReader() {
        if (!holdsReader) return;
        holdsReader = false;
        reader.release();
    }
}
